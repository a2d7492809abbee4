package com.bookmarkauthz.db;

import com.bookmarkauthz.authz.Relation;
import com.bookmarkauthz.authz.ResourceType;
import com.bookmarkauthz.authz.SubjectType;

/**
 * The unique key of a row in 'bookmark_permissions'. At most one tuple exists per key.
 *
 * @param tenantId The owning tenant
 * @param resourceType The kind of resource
 * @param resourceId The resource identifier within its type
 * @param relation The relation held
 * @param subjectType The kind of principal holding the relation
 * @param subjectId The principal identifier
 */
public record TupleKey(
    int tenantId,
    ResourceType resourceType,
    String resourceId,
    Relation relation,
    SubjectType subjectType,
    String subjectId) {}
