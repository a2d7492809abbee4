package com.bookmarkauthz.authz;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for the relation to permission model. */
public class RelationTest {

  @Test
  void testPermissionTable() {
    assertEquals(EnumSet.allOf(Permission.class), Relation.OWNER.permissions());
    assertEquals(EnumSet.of(Permission.READ, Permission.WRITE), Relation.EDITOR.permissions());
    assertEquals(EnumSet.of(Permission.READ), Relation.VIEWER.permissions());
    assertEquals(EnumSet.of(Permission.READ, Permission.SHARE), Relation.SHARER.permissions());
  }

  @Test
  void testEveryRelationGrantsRead() {
    assertEquals(EnumSet.allOf(Relation.class), Relation.grantingRelations(Permission.READ));
  }

  @Test
  void testGrantingRelations() {
    assertEquals(
        EnumSet.of(Relation.OWNER, Relation.EDITOR), Relation.grantingRelations(Permission.WRITE));
    assertEquals(EnumSet.of(Relation.OWNER), Relation.grantingRelations(Permission.DELETE));
    assertEquals(
        EnumSet.of(Relation.OWNER, Relation.SHARER), Relation.grantingRelations(Permission.SHARE));
  }

  @Test
  void testHighestFollowsPriority() {
    assertEquals(
        Relation.OWNER,
        Relation.highest(List.of(Relation.VIEWER, Relation.OWNER, Relation.EDITOR)).get());
    assertEquals(
        Relation.EDITOR, Relation.highest(List.of(Relation.SHARER, Relation.EDITOR)).get());
    assertEquals(
        Relation.SHARER, Relation.highest(List.of(Relation.VIEWER, Relation.SHARER)).get());
    assertTrue(Relation.highest(List.of()).isEmpty());
  }

  @Test
  void testUnionIsNotHierarchical() {
    // SHARER is below EDITOR, yet only SHARER grants SHARE
    assertEquals(
        EnumSet.of(Permission.READ, Permission.WRITE, Permission.SHARE),
        Relation.union(List.of(Relation.EDITOR, Relation.SHARER)));
    assertTrue(Relation.union(List.of()).isEmpty());
  }

  @Test
  void testDatabaseValue() {
    for (Relation relation : Relation.values()) {
      assertEquals(relation, Relation.fromDatabaseValue(relation.toDatabaseValue()));
    }
    assertEquals("RELATION_OWNER", Relation.OWNER.toDatabaseValue());
    assertThrows(IllegalArgumentException.class, () -> Relation.fromDatabaseValue("OWNER"));
    assertThrows(IllegalArgumentException.class, () -> Relation.fromDatabaseValue(null));
  }
}
