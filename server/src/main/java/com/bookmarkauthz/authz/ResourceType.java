package com.bookmarkauthz.authz;

/**
 * Kind of resource governed by permission tuples.
 *
 * <p>Stored as {@code RESOURCE_TYPE_<NAME>} in bookmark_permissions.resource_type.
 */
public enum ResourceType {
  BOOKMARK;

  private static final String DB_PREFIX = "RESOURCE_TYPE_";

  public String toDatabaseValue() {
    return DB_PREFIX + name();
  }

  /**
   * Creates an enum value from its stored representation.
   *
   * @throws IllegalArgumentException if the value is not a known resource type
   */
  public static ResourceType fromDatabaseValue(String value) {
    if (value == null || !value.startsWith(DB_PREFIX)) {
      throw new IllegalArgumentException("Unknown resource type: " + value);
    }
    return valueOf(value.substring(DB_PREFIX.length()));
  }
}
