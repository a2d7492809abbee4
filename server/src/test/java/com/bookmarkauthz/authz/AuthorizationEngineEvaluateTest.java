package com.bookmarkauthz.authz;

import static org.junit.jupiter.api.Assertions.*;

import com.bookmarkauthz.db.PermissionTuple;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import javax.annotation.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for the in-memory reduction of tuples into check results and effective permissions. */
public class AuthorizationEngineEvaluateTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Test
  void testEvaluate_NoTuplesIsNoGrant() {
    CheckResult result = AuthorizationEngine.evaluate(List.of(), Permission.READ, NOW);

    assertFalse(result.allowed());
    assertEquals(DenialReason.NO_GRANT, result.reason());
    assertTrue(result.relation().isEmpty());
  }

  @Test
  void testEvaluate_OnlyExpiredTuplesIsExpired() {
    List<PermissionTuple> tuples =
        List.of(
            tuple(Relation.OWNER, NOW.minus(1, ChronoUnit.SECONDS)),
            tuple(Relation.VIEWER, NOW));

    CheckResult result = AuthorizationEngine.evaluate(tuples, Permission.READ, NOW);

    assertEquals(DenialReason.EXPIRED, result.reason());
  }

  @Test
  void testEvaluate_ActiveButWrongRelationIsInsufficient() {
    List<PermissionTuple> tuples =
        List.of(tuple(Relation.VIEWER, null), tuple(Relation.OWNER, NOW.minusSeconds(60)));

    CheckResult result = AuthorizationEngine.evaluate(tuples, Permission.DELETE, NOW);

    assertEquals(DenialReason.INSUFFICIENT_RELATION, result.reason());
  }

  @Test
  void testEvaluate_ReportsHighestGrantingRelation() {
    List<PermissionTuple> tuples =
        List.of(
            tuple(Relation.VIEWER, null),
            tuple(Relation.EDITOR, NOW.plusSeconds(60)),
            tuple(Relation.SHARER, null));

    CheckResult read = AuthorizationEngine.evaluate(tuples, Permission.READ, NOW);
    CheckResult share = AuthorizationEngine.evaluate(tuples, Permission.SHARE, NOW);

    assertTrue(read.allowed());
    assertEquals(Relation.EDITOR, read.matchedRelation());
    assertTrue(read.denialReason().isEmpty());
    assertEquals(Relation.SHARER, share.matchedRelation());
  }

  @Test
  void testEffective_UnionOfActiveRelations() {
    List<PermissionTuple> tuples =
        List.of(
            tuple(Relation.SHARER, null),
            tuple(Relation.VIEWER, null),
            tuple(Relation.OWNER, NOW.minusSeconds(1)));

    EffectivePermissions effective = AuthorizationEngine.effective(tuples, NOW);

    assertEquals(Relation.SHARER, effective.highestRelation());
    assertEquals(EnumSet.of(Permission.READ, Permission.SHARE), effective.permissions());
  }

  @Test
  void testEffective_NothingActiveIsNone() {
    assertEquals(EffectivePermissions.NONE, AuthorizationEngine.effective(List.of(), NOW));
    assertEquals(
        EffectivePermissions.NONE,
        AuthorizationEngine.effective(List.of(tuple(Relation.OWNER, NOW)), NOW));
  }

  @Test
  void testEffective_MatchesEvaluateForEveryPermission() {
    List<List<Relation>> cases =
        List.of(
            List.of(Relation.VIEWER),
            List.of(Relation.EDITOR, Relation.SHARER),
            List.of(Relation.OWNER, Relation.VIEWER),
            List.of(Relation.SHARER));
    for (List<Relation> relations : cases) {
      List<PermissionTuple> tuples = relations.stream().map(r -> tuple(r, null)).toList();
      EffectivePermissions effective = AuthorizationEngine.effective(tuples, NOW);
      for (Permission permission : Permission.values()) {
        assertEquals(
            effective.permissions().contains(permission),
            AuthorizationEngine.evaluate(tuples, permission, NOW).allowed(),
            relations + " " + permission);
      }
    }
  }

  private static PermissionTuple tuple(Relation relation, @Nullable Instant expiresAt) {
    return new PermissionTuple(
        1L,
        1,
        ResourceType.BOOKMARK,
        "b1",
        relation,
        SubjectType.USER,
        "101",
        null,
        expiresAt,
        NOW.minus(1, ChronoUnit.DAYS));
  }
}
