package com.bookmarkauthz.authz;

import static com.bookmarkauthz.authz.Permission.DELETE;
import static com.bookmarkauthz.authz.Permission.READ;
import static com.bookmarkauthz.authz.Permission.SHARE;
import static com.bookmarkauthz.authz.Permission.WRITE;

import com.google.common.collect.Sets;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * The nature of a subject's link to a resource, and the fixed set of permissions it grants.
 *
 * <p>Relations are not hierarchical: a permission is held when any active relation grants it.
 * {@link #priority()} only orders relations for reporting the highest one a user holds.
 *
 * <p>IMPORTANT: the stored form ({@link #toDatabaseValue()}) is persisted in the
 * bookmark_permissions.relation column; renaming a constant requires a data migration.
 */
public enum Relation {
  OWNER,
  EDITOR,
  VIEWER,
  SHARER;

  private static final String DB_PREFIX = "RELATION_";

  /** Orders relations from lowest to highest priority. */
  public static final Comparator<Relation> BY_PRIORITY = Comparator.comparingInt(Relation::priority);

  /** Returns the permissions granted by this relation. */
  public Set<Permission> permissions() {
    return switch (this) {
      case OWNER -> Sets.immutableEnumSet(READ, WRITE, DELETE, SHARE);
      case EDITOR -> Sets.immutableEnumSet(READ, WRITE);
      case VIEWER -> Sets.immutableEnumSet(READ);
      case SHARER -> Sets.immutableEnumSet(READ, SHARE);
    };
  }

  /** OWNER > EDITOR > SHARER > VIEWER. */
  public int priority() {
    return switch (this) {
      case OWNER -> 4;
      case EDITOR -> 3;
      case SHARER -> 2;
      case VIEWER -> 1;
    };
  }

  public boolean grants(Permission permission) {
    return permissions().contains(permission);
  }

  /** Returns every relation whose permission set contains the given permission. */
  public static Set<Relation> grantingRelations(Permission permission) {
    EnumSet<Relation> result = EnumSet.noneOf(Relation.class);
    for (Relation relation : values()) {
      if (relation.grants(permission)) {
        result.add(relation);
      }
    }
    return Sets.immutableEnumSet(result);
  }

  /** Returns the highest-priority relation of the collection, if any. */
  public static Optional<Relation> highest(Collection<Relation> relations) {
    return relations.stream().max(BY_PRIORITY);
  }

  /** Returns the union of the permissions granted by the given relations. */
  public static Set<Permission> union(Collection<Relation> relations) {
    EnumSet<Permission> result = EnumSet.noneOf(Permission.class);
    for (Relation relation : relations) {
      result.addAll(relation.permissions());
    }
    return Sets.immutableEnumSet(result);
  }

  public String toDatabaseValue() {
    return DB_PREFIX + name();
  }

  /**
   * Creates an enum value from its stored representation.
   *
   * @throws IllegalArgumentException if the value is not a known relation
   */
  public static Relation fromDatabaseValue(String value) {
    if (value == null || !value.startsWith(DB_PREFIX)) {
      throw new IllegalArgumentException("Unknown relation: " + value);
    }
    return valueOf(value.substring(DB_PREFIX.length()));
  }
}
