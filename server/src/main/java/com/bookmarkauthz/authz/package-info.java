/**
 * The relation model and authorization engine.
 *
 * <p>Closed enums ({@link com.bookmarkauthz.authz.Relation}, {@link
 * com.bookmarkauthz.authz.Permission}, {@link com.bookmarkauthz.authz.SubjectType}, {@link
 * com.bookmarkauthz.authz.ResourceType}) describe what a tuple can say. {@link
 * com.bookmarkauthz.authz.AuthorizationEngine} reads and writes tuples through {@link
 * com.bookmarkauthz.db.PermissionTuples} and expands users into subjects through a {@link
 * com.bookmarkauthz.identity.SubjectResolver}.
 */
package com.bookmarkauthz.authz;
