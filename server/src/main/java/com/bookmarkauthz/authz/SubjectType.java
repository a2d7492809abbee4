package com.bookmarkauthz.authz;

/**
 * Kind of principal that can hold a relation.
 *
 * <p>Stored as {@code SUBJECT_TYPE_<NAME>} in bookmark_permissions.subject_type.
 */
public enum SubjectType {
  /** A single user; the subject id is the user id. */
  USER,
  /** Every member of a role; the subject id is the role code. */
  ROLE,
  /** Every member of a tenant; the subject id is the tenant id in decimal. */
  TENANT;

  private static final String DB_PREFIX = "SUBJECT_TYPE_";

  public String toDatabaseValue() {
    return DB_PREFIX + name();
  }

  /**
   * Creates an enum value from its stored representation.
   *
   * @throws IllegalArgumentException if the value is not a known subject type
   */
  public static SubjectType fromDatabaseValue(String value) {
    if (value == null || !value.startsWith(DB_PREFIX)) {
      throw new IllegalArgumentException("Unknown subject type: " + value);
    }
    return valueOf(value.substring(DB_PREFIX.length()));
  }
}
