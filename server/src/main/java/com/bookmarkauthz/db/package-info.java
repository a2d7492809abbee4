/**
 * Persistence for permission tuples.
 *
 * <p>{@link com.bookmarkauthz.db.PermissionTuple} mirrors one row of the
 * {@code bookmark_permissions} table and converts itself to its Protocol Buffer message.
 * {@link com.bookmarkauthz.db.PermissionTuples} holds the static query helpers; each takes an open
 * {@code Connection} and returns {@code StatusOr<T>}, turning {@code SQLException} into a failed
 * status rather than throwing.
 *
 * <p>Enum columns are stored as their wire tokens ({@code RELATION_OWNER},
 * {@code SUBJECT_TYPE_ROLE}, ...). No other component writes to the table.
 */
package com.bookmarkauthz.db;
