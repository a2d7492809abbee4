package com.bookmarkauthz.authz;

import static org.junit.jupiter.api.Assertions.*;

import com.bookmarkauthz.common.status.Status;
import com.bookmarkauthz.common.status.StatusCode;
import com.bookmarkauthz.common.status.StatusOr;
import com.bookmarkauthz.db.PermissionTuple;
import com.bookmarkauthz.db.PermissionTuples;
import com.bookmarkauthz.db.util.PostgresTestHelper;
import com.bookmarkauthz.db.util.PostgresTestHelper.PostgresContext;
import com.bookmarkauthz.security.RequestContext;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Integration tests for AuthorizationEngine against a real PostgreSQL database, with membership
 * taken from a fixed table and time frozen.
 */
@Testcontainers
public class AuthorizationEngineTest {

  private static final int TENANT = 1;
  private static final int OTHER_TENANT = 2;
  private static final String OWNER = "100";
  private static final String U1 = "101";
  private static final String U2 = "102";
  private static final String OUTSIDER = "900";
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private static PostgresContext postgresContext;
  private static HikariDataSource dataSource;
  private static FixedMembershipSubjectResolver resolver;
  private static AuthorizationEngine engine;

  @BeforeAll
  static void setUp() throws SQLException {
    postgresContext =
        PostgresTestHelper.setupPostgres(
            "bookmark_authz_engine_test", AuthorizationEngineTest.class);

    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(postgresContext.getContainer().getJdbcUrl());
    config.setUsername(postgresContext.getContainer().getUsername());
    config.setPassword(postgresContext.getContainer().getPassword());
    config.setMaximumPoolSize(2);
    dataSource = new HikariDataSource(config);

    resolver = new FixedMembershipSubjectResolver();
    engine =
        new AuthorizationEngine(
            new AuthorizationEngine.Config(
                dataSource,
                resolver,
                Clock.fixed(NOW, ZoneOffset.UTC),
                EnumSet.allOf(ResourceType.class)));
  }

  @AfterAll
  static void tearDown() {
    if (dataSource != null) {
      dataSource.close();
    }
    if (postgresContext != null) {
      postgresContext.close();
    }
  }

  @BeforeEach
  void resetState() {
    PostgresTestHelper.truncate(postgresContext.getConnection());
    resolver.clear();
    resolver.addUser(TENANT, OWNER).addUser(OTHER_TENANT, OUTSIDER);
  }

  @Test
  void testCheck_EditorMayWriteButNotDelete() {
    // Given: u1 is EDITOR of b1
    claim(OWNER, "b1");
    grantToUser(OWNER, "b1", Relation.EDITOR, U1, null);

    // When: We check WRITE and DELETE
    CheckResult write = check(U1, "b1", Permission.WRITE);
    CheckResult delete = check(U1, "b1", Permission.DELETE);

    // Then: WRITE is allowed through EDITOR and DELETE is not granted by it
    assertTrue(write.allowed());
    assertEquals(Relation.EDITOR, write.matchedRelation());
    assertFalse(delete.allowed());
    assertEquals(DenialReason.INSUFFICIENT_RELATION, delete.reason());
  }

  @Test
  void testCheck_RoleGrantReachesRoleMembers() {
    // Given: The auditor role is VIEWER of b1 and u2 holds that role
    resolver.addUser(TENANT, U2, "auditor");
    claim(OWNER, "b1");
    assertTrue(
        engine
            .grant(
                caller(OWNER), ResourceType.BOOKMARK, "b1", Relation.VIEWER, SubjectType.ROLE,
                "auditor", null)
            .isOk());

    // When / Then: u2 can read b1, u1 cannot
    CheckResult viaRole = check(U2, "b1", Permission.READ);
    assertTrue(viaRole.allowed());
    assertEquals(Relation.VIEWER, viaRole.matchedRelation());
    assertEquals(DenialReason.NO_GRANT, check(U1, "b1", Permission.READ).reason());
  }

  @Test
  void testCheck_TenantWideGrantReachesTenantMembers() {
    claim(OWNER, "b1");
    assertTrue(
        engine
            .grant(
                caller(OWNER), ResourceType.BOOKMARK, "b1", Relation.VIEWER, SubjectType.TENANT,
                String.valueOf(TENANT), null)
            .isOk());

    assertTrue(check(U1, "b1", Permission.READ).allowed());
    assertEquals(
        DenialReason.INSUFFICIENT_RELATION, check(U1, "b1", Permission.WRITE).reason());
  }

  @Test
  void testCheck_ExpiredGrantIsDeniedButStillListed() {
    // Given: A grant that expired one second ago
    claim(OWNER, "b1");
    Instant expiry = NOW.minus(1, ChronoUnit.SECONDS);
    grantToUser(OWNER, "b1", Relation.VIEWER, U1, expiry);

    // When: u1 checks READ
    CheckResult result = check(U1, "b1", Permission.READ);

    // Then: The denial names the expiry, and the admin listing still shows the tuple
    assertFalse(result.allowed());
    assertEquals(DenialReason.EXPIRED, result.reason());

    StatusOr<PermissionTuples.QueryResult> listed =
        engine.listTuples(TENANT, ResourceType.BOOKMARK, "b1", SubjectType.USER, U1, 0, 20);
    assertTrue(listed.isOk());
    assertEquals(1, listed.getValue().getTotalCount());
    assertEquals(expiry, listed.getValue().getTuples().get(0).expiresAt());
  }

  @Test
  void testCheck_GrantExpiringNowIsExpired() {
    claim(OWNER, "b1");
    grantToUser(OWNER, "b1", Relation.VIEWER, U1, NOW);
    grantToUser(OWNER, "b1", Relation.EDITOR, U2, NOW.plus(1, ChronoUnit.MILLIS));

    assertEquals(DenialReason.EXPIRED, check(U1, "b1", Permission.READ).reason());
    assertTrue(check(U2, "b1", Permission.READ).allowed());
  }

  @Test
  void testCheck_UngovernedResourceHasNoGrant() {
    CheckResult result = check(U1, "never-claimed", Permission.READ);

    assertFalse(result.allowed());
    assertEquals(DenialReason.NO_GRANT, result.reason());
  }

  @Test
  void testCheck_ActiveGrantWinsOverExpiredOne() {
    claim(OWNER, "b1");
    grantToUser(OWNER, "b1", Relation.EDITOR, U1, NOW.minus(1, ChronoUnit.DAYS));
    grantToUser(OWNER, "b1", Relation.VIEWER, U1, null);

    assertTrue(check(U1, "b1", Permission.READ).allowed());
    assertEquals(
        DenialReason.INSUFFICIENT_RELATION, check(U1, "b1", Permission.WRITE).reason());
  }

  @Test
  void testCheck_RejectsEmptyUserId() {
    StatusOr<CheckResult> result =
        engine.check(TENANT, "", ResourceType.BOOKMARK, "b1", Permission.READ);

    assertTrue(result.isNotOk());
    assertEquals(StatusCode.INVALID_ARGUMENT, result.getStatus().getCode());
  }

  @Test
  void testGetEffectivePermissions_UnionOfDirectAndRoleGrants() {
    // Given: u1 owns b1 and also belongs to the team role, which is VIEWER of b1
    resolver.addUser(TENANT, U1, "team");
    claim(U1, "b1");
    assertTrue(
        engine
            .grant(
                caller(U1), ResourceType.BOOKMARK, "b1", Relation.VIEWER, SubjectType.ROLE,
                "team", null)
            .isOk());

    // When: We compute u1's effective permissions
    StatusOr<EffectivePermissions> result =
        engine.getEffectivePermissions(TENANT, U1, ResourceType.BOOKMARK, "b1");

    // Then: The union is OWNER's full set
    assertTrue(result.isOk());
    assertEquals(Relation.OWNER, result.getValue().highestRelation());
    assertEquals(
        EnumSet.of(Permission.READ, Permission.WRITE, Permission.DELETE, Permission.SHARE),
        EnumSet.copyOf(result.getValue().permissions()));
  }

  @Test
  void testGetEffectivePermissions_CombinesNonNestedRelations() {
    claim(OWNER, "b1");
    grantToUser(OWNER, "b1", Relation.SHARER, U1, null);
    grantToUser(OWNER, "b1", Relation.EDITOR, U1, null);

    EffectivePermissions effective =
        engine.getEffectivePermissions(TENANT, U1, ResourceType.BOOKMARK, "b1").getValue();

    assertEquals(Relation.EDITOR, effective.highestRelation());
    assertEquals(
        EnumSet.of(Permission.READ, Permission.WRITE, Permission.SHARE),
        EnumSet.copyOf(effective.permissions()));
  }

  @Test
  void testGetEffectivePermissions_NoneWhenOnlyExpiredGrants() {
    claim(OWNER, "b1");
    grantToUser(OWNER, "b1", Relation.EDITOR, U1, NOW.minus(1, ChronoUnit.HOURS));

    EffectivePermissions effective =
        engine.getEffectivePermissions(TENANT, U1, ResourceType.BOOKMARK, "b1").getValue();

    assertTrue(effective.permissions().isEmpty());
    assertNull(effective.highestRelation());
  }

  @Test
  void testGetEffectivePermissions_AgreesWithCheck() {
    // Given: A mix of direct, role, tenant and expired grants across users
    resolver.addUser(TENANT, U2, "team");
    claim(OWNER, "b1");
    grantToUser(OWNER, "b1", Relation.SHARER, U1, null);
    grantToUser(OWNER, "b1", Relation.OWNER, U2, NOW.minus(1, ChronoUnit.MINUTES));
    assertTrue(
        engine
            .grant(
                caller(OWNER), ResourceType.BOOKMARK, "b1", Relation.EDITOR, SubjectType.ROLE,
                "team", null)
            .isOk());

    // Then: For every user, the effective set is exactly what Check allows
    for (String userId : List.of(OWNER, U1, U2, "103")) {
      Set<Permission> effective =
          engine.getEffectivePermissions(TENANT, userId, ResourceType.BOOKMARK, "b1")
              .getValue()
              .permissions();
      for (Permission permission : Permission.values()) {
        assertEquals(
            effective.contains(permission),
            check(userId, "b1", permission).allowed(),
            "user " + userId + " permission " + permission);
      }
    }
  }

  @Test
  void testListAccessibleResources_EachResourceOnce() {
    // Given: VIEWER on b1 and b2, and EDITOR on b2 only
    claim(OWNER, "b1");
    claim(OWNER, "b2");
    grantToUser(OWNER, "b1", Relation.VIEWER, U1, null);
    grantToUser(OWNER, "b2", Relation.VIEWER, U1, null);
    grantToUser(OWNER, "b2", Relation.EDITOR, U1, null);

    // When: We list what u1 can read
    StatusOr<AccessibleResources> result =
        engine.listAccessibleResources(TENANT, U1, ResourceType.BOOKMARK, Permission.READ, 0, 20);

    // Then: Both bookmarks appear exactly once
    assertTrue(result.isOk());
    assertEquals(List.of("b1", "b2"), result.getValue().resourceIds());
    assertEquals(2, result.getValue().total());
  }

  @Test
  void testListAccessibleResources_ExcludesExpiredAndPages() {
    resolver.addUser(TENANT, U1, "team");
    for (String bookmark : List.of("b1", "b2", "b3", "b4")) {
      claim(OWNER, bookmark);
    }
    grantToUser(OWNER, "b1", Relation.VIEWER, U1, null);
    grantToUser(OWNER, "b2", Relation.VIEWER, U1, NOW.minus(1, ChronoUnit.SECONDS));
    assertTrue(
        engine
            .grant(
                caller(OWNER), ResourceType.BOOKMARK, "b3", Relation.EDITOR, SubjectType.ROLE,
                "team", null)
            .isOk());
    grantToUser(OWNER, "b4", Relation.SHARER, U1, null);

    AccessibleResources firstPage =
        engine
            .listAccessibleResources(TENANT, U1, ResourceType.BOOKMARK, Permission.READ, 0, 2)
            .getValue();
    AccessibleResources secondPage =
        engine
            .listAccessibleResources(TENANT, U1, ResourceType.BOOKMARK, Permission.READ, 2, 2)
            .getValue();
    AccessibleResources writable =
        engine
            .listAccessibleResources(TENANT, U1, ResourceType.BOOKMARK, Permission.WRITE, 0, 20)
            .getValue();

    assertEquals(List.of("b1", "b3"), firstPage.resourceIds());
    assertEquals(3, firstPage.total());
    assertEquals(List.of("b4"), secondPage.resourceIds());
    assertEquals(List.of("b3"), writable.resourceIds());
  }

  @Test
  void testGrant_SameKeyTwiceKeepsOneTupleAndLastCallWins() {
    // Given: u2 may share b1
    claim(OWNER, "b1");
    grantToUser(OWNER, "b1", Relation.SHARER, U2, null);
    grantToUser(OWNER, "b1", Relation.VIEWER, U1, NOW.plus(1, ChronoUnit.HOURS));

    // When: u2 grants the same relation again, without expiry
    StatusOr<PermissionTuple> second =
        engine.grant(
            caller(U2), ResourceType.BOOKMARK, "b1", Relation.VIEWER, SubjectType.USER, U1, null);

    // Then: One tuple remains, carrying the second call's expiry and grantor
    assertTrue(second.isOk(), () -> second.getStatus().toString());
    PermissionTuples.QueryResult tuples =
        engine.listTuples(TENANT, ResourceType.BOOKMARK, "b1", SubjectType.USER, U1, 0, 20)
            .getValue();
    assertEquals(1, tuples.getTotalCount());
    PermissionTuple stored = tuples.getTuples().get(0);
    assertNull(stored.expiresAt());
    assertEquals(102, stored.grantedBy());
  }

  @Test
  void testGrant_RequiresShareOnTheResource() {
    // Given: u1 is only EDITOR
    claim(OWNER, "b1");
    grantToUser(OWNER, "b1", Relation.EDITOR, U1, null);

    // When: u1 tries to grant someone else
    StatusOr<PermissionTuple> result =
        engine.grant(
            caller(U1), ResourceType.BOOKMARK, "b1", Relation.VIEWER, SubjectType.USER, U2, null);

    // Then: The grant is refused and nothing is stored
    assertTrue(result.isNotOk());
    assertEquals(StatusCode.PERMISSION_DENIED, result.getStatus().getCode());
    assertEquals(DenialReason.NO_GRANT, check(U2, "b1", Permission.READ).reason());
  }

  @Test
  void testGrant_UngovernedResourceMustBeClaimedFirst() {
    StatusOr<PermissionTuple> result =
        engine.grant(
            caller(OWNER), ResourceType.BOOKMARK, "b1", Relation.VIEWER, SubjectType.USER, U1,
            null);

    assertTrue(result.isNotOk());
    assertEquals(StatusCode.PERMISSION_DENIED, result.getStatus().getCode());
  }

  @Test
  void testGrant_SharerMayDelegate() {
    claim(OWNER, "b1");
    grantToUser(OWNER, "b1", Relation.SHARER, U1, null);

    StatusOr<PermissionTuple> result =
        engine.grant(
            caller(U1), ResourceType.BOOKMARK, "b1", Relation.VIEWER, SubjectType.USER, U2, null);

    assertTrue(result.isOk());
    assertEquals(101, result.getValue().grantedBy());
    assertTrue(check(U2, "b1", Permission.READ).allowed());
  }

  @Test
  void testGrant_TenantSubjectMustBeCallersTenant() {
    claim(OWNER, "b1");

    StatusOr<PermissionTuple> result =
        engine.grant(
            caller(OWNER), ResourceType.BOOKMARK, "b1", Relation.VIEWER, SubjectType.TENANT,
            String.valueOf(OTHER_TENANT), null);

    assertTrue(result.isNotOk());
    assertTrue(AuthzError.TENANT_MISMATCH.matches(result.getStatus()));
  }

  @Test
  void testGrant_RejectsEmptySubject() {
    claim(OWNER, "b1");

    StatusOr<PermissionTuple> result =
        engine.grant(
            caller(OWNER), ResourceType.BOOKMARK, "b1", Relation.VIEWER, SubjectType.USER, "",
            null);

    assertTrue(result.isNotOk());
    assertEquals(StatusCode.INVALID_ARGUMENT, result.getStatus().getCode());
  }

  @Test
  void testRevoke_IsIdempotent() {
    // Given: u1 holds VIEWER and SHARER on b1
    claim(OWNER, "b1");
    grantToUser(OWNER, "b1", Relation.VIEWER, U1, null);
    grantToUser(OWNER, "b1", Relation.SHARER, U1, null);

    // When: A relation u1 does not hold is revoked
    StatusOr<Integer> missing =
        engine.revoke(
            caller(OWNER), ResourceType.BOOKMARK, "b1", SubjectType.USER, U1, Relation.EDITOR);
    // And: Then every relation of u1, twice
    StatusOr<Integer> all =
        engine.revoke(caller(OWNER), ResourceType.BOOKMARK, "b1", SubjectType.USER, U1, null);
    StatusOr<Integer> again =
        engine.revoke(caller(OWNER), ResourceType.BOOKMARK, "b1", SubjectType.USER, U1, null);

    // Then: Nothing fails, and only the real tuples were counted
    assertTrue(missing.isOk());
    assertEquals(0, missing.getValue());
    assertEquals(2, all.getValue());
    assertTrue(again.isOk());
    assertEquals(0, again.getValue());
    assertEquals(DenialReason.NO_GRANT, check(U1, "b1", Permission.READ).reason());
  }

  @Test
  void testRevoke_SingleRelationLeavesOthers() {
    claim(OWNER, "b1");
    grantToUser(OWNER, "b1", Relation.VIEWER, U1, null);
    grantToUser(OWNER, "b1", Relation.SHARER, U1, null);

    StatusOr<Integer> removed =
        engine.revoke(
            caller(OWNER), ResourceType.BOOKMARK, "b1", SubjectType.USER, U1, Relation.SHARER);

    assertEquals(1, removed.getValue());
    assertTrue(check(U1, "b1", Permission.READ).allowed());
    assertEquals(
        DenialReason.INSUFFICIENT_RELATION, check(U1, "b1", Permission.SHARE).reason());
  }

  @Test
  void testTenantIsolation() {
    // Given: b1 is governed by tenant 1 and readable by every member of tenant 1
    claim(OWNER, "b1");
    assertTrue(
        engine
            .grant(
                caller(OWNER), ResourceType.BOOKMARK, "b1", Relation.VIEWER, SubjectType.TENANT,
                String.valueOf(TENANT), null)
            .isOk());

    // Then: A member of tenant 2 is denied and sees nothing
    CheckResult result =
        engine.check(OTHER_TENANT, OUTSIDER, ResourceType.BOOKMARK, "b1", Permission.READ)
            .getValue();
    assertFalse(result.allowed());
    assertEquals(DenialReason.TENANT_MISMATCH, result.reason());

    assertEquals(
        EffectivePermissions.NONE,
        engine.getEffectivePermissions(OTHER_TENANT, OUTSIDER, ResourceType.BOOKMARK, "b1")
            .getValue());
    assertEquals(
        0,
        engine
            .listAccessibleResources(
                OTHER_TENANT, OUTSIDER, ResourceType.BOOKMARK, Permission.READ, 0, 20)
            .getValue()
            .total());
    assertEquals(
        0,
        engine.listTuples(OTHER_TENANT, null, null, null, null, 0, 20).getValue().getTotalCount());

    // And: Cannot write tuples on it
    StatusOr<PermissionTuple> grant =
        engine.grant(
            new RequestContext(OTHER_TENANT, OUTSIDER, "", List.of()),
            ResourceType.BOOKMARK, "b1", Relation.OWNER, SubjectType.USER, OUTSIDER, null);
    assertTrue(grant.isNotOk());
    assertTrue(AuthzError.TENANT_MISMATCH.matches(grant.getStatus()));
  }

  @Test
  void testCheck_UserOutsideTenantIsTenantMismatch() {
    // Given: u1 belongs to tenant 1 but the call is made in tenant 2
    resolver.addUser(TENANT, U1);

    CheckResult result =
        engine.check(OTHER_TENANT, U1, ResourceType.BOOKMARK, "b1", Permission.READ).getValue();

    assertFalse(result.allowed());
    assertEquals(DenialReason.TENANT_MISMATCH, result.reason());
  }

  @Test
  void testClaimOwnership() {
    // When: The creator claims a fresh bookmark
    StatusOr<PermissionTuple> claimed =
        engine.claimOwnership(caller(OWNER), ResourceType.BOOKMARK, "b1");

    // Then: They become its OWNER
    assertTrue(claimed.isOk(), () -> claimed.getStatus().toString());
    assertEquals(Relation.OWNER, claimed.getValue().relation());
    assertEquals(OWNER, claimed.getValue().subjectId());
    assertEquals(100, claimed.getValue().grantedBy());
    assertTrue(check(OWNER, "b1", Permission.DELETE).allowed());

    // And: A second claim in the same tenant is a conflict
    StatusOr<PermissionTuple> again =
        engine.claimOwnership(caller(U1), ResourceType.BOOKMARK, "b1");
    assertEquals(StatusCode.ALREADY_EXISTS, again.getStatus().getCode());

    // And: A claim from another tenant is a tenant mismatch
    StatusOr<PermissionTuple> foreign =
        engine.claimOwnership(
            new RequestContext(OTHER_TENANT, OUTSIDER, "", List.of()), ResourceType.BOOKMARK, "b1");
    assertTrue(AuthzError.TENANT_MISMATCH.matches(foreign.getStatus()));
  }

  @Test
  void testGrant_ConcurrentSameKeyKeepsOneTuple() throws Exception {
    // Given: Both the owner and a sharer may grant on b1
    claim(OWNER, "b1");
    grantToUser(OWNER, "b1", Relation.SHARER, U2, null);
    Instant inOneHour = NOW.plus(1, ChronoUnit.HOURS);
    Instant inOneDay = NOW.plus(1, ChronoUnit.DAYS);

    // When: They grant the same key to u1 at the same time, with different expiries
    List<StatusOr<PermissionTuple>> results =
        runTogether(
            () ->
                engine.grant(
                    caller(OWNER), ResourceType.BOOKMARK, "b1", Relation.VIEWER,
                    SubjectType.USER, U1, inOneHour),
            () ->
                engine.grant(
                    caller(U2), ResourceType.BOOKMARK, "b1", Relation.VIEWER,
                    SubjectType.USER, U1, inOneDay));

    // Then: Both succeed and exactly one tuple remains, holding one writer's values
    for (StatusOr<PermissionTuple> result : results) {
      assertTrue(result.isOk(), () -> result.getStatus().toString());
    }
    PermissionTuples.QueryResult tuples =
        engine.listTuples(TENANT, ResourceType.BOOKMARK, "b1", SubjectType.USER, U1, 0, 20)
            .getValue();
    assertEquals(1, tuples.getTotalCount());
    PermissionTuple stored = tuples.getTuples().get(0);
    if (Integer.valueOf(100).equals(stored.grantedBy())) {
      assertEquals(inOneHour, stored.expiresAt());
    } else {
      assertEquals(102, stored.grantedBy());
      assertEquals(inOneDay, stored.expiresAt());
    }
  }

  @Test
  void testClaimOwnership_ConcurrentClaimsFromTwoTenants() throws Exception {
    // When: Users of two tenants claim the same fresh bookmark at the same time
    List<StatusOr<PermissionTuple>> results =
        runTogether(
            () -> engine.claimOwnership(caller(OWNER), ResourceType.BOOKMARK, "b1"),
            () ->
                engine.claimOwnership(
                    new RequestContext(OTHER_TENANT, OUTSIDER, "", List.of()),
                    ResourceType.BOOKMARK,
                    "b1"));

    // Then: Exactly one claim wins and the other is a tenant mismatch
    assertEquals(1, results.stream().filter(StatusOr::isOk).count());
    int winnerIndex = results.get(0).isOk() ? 0 : 1;
    StatusOr<PermissionTuple> loser = results.get(1 - winnerIndex);
    assertTrue(
        AuthzError.TENANT_MISMATCH.matches(loser.getStatus()), () -> loser.getStatus().toString());

    // And: The resource is governed by the winning tenant only
    PermissionTuple owner = results.get(winnerIndex).getValue();
    assertEquals(
        1,
        engine
            .listTuples(owner.tenantId(), ResourceType.BOOKMARK, "b1", null, null, 0, 20)
            .getValue()
            .getTotalCount());
    int otherTenant = owner.tenantId() == TENANT ? OTHER_TENANT : TENANT;
    assertEquals(
        0,
        engine
            .listTuples(otherTenant, ResourceType.BOOKMARK, "b1", null, null, 0, 20)
            .getValue()
            .getTotalCount());
  }

  @Test
  void testDeleteResourcePermissions() {
    // Given: b1 with an owner and two other grants
    claim(OWNER, "b1");
    grantToUser(OWNER, "b1", Relation.EDITOR, U1, null);
    grantToUser(OWNER, "b1", Relation.VIEWER, U2, null);

    // When: An editor tries to drop everything
    StatusOr<Integer> refused =
        engine.deleteResourcePermissions(caller(U1), ResourceType.BOOKMARK, "b1");

    // Then: The editor lacks DELETE
    assertEquals(StatusCode.PERMISSION_DENIED, refused.getStatus().getCode());

    // When: The owner does it
    StatusOr<Integer> deleted =
        engine.deleteResourcePermissions(caller(OWNER), ResourceType.BOOKMARK, "b1");

    // Then: Every tuple goes and the bookmark can be claimed again
    assertEquals(3, deleted.getValue());
    assertEquals(DenialReason.NO_GRANT, check(U1, "b1", Permission.READ).reason());
    assertTrue(engine.claimOwnership(caller(U2), ResourceType.BOOKMARK, "b1").isOk());
  }

  @Test
  void testPurgeExpired() {
    claim(OWNER, "b1");
    grantToUser(OWNER, "b1", Relation.VIEWER, U1, NOW.minus(1, ChronoUnit.SECONDS));
    grantToUser(OWNER, "b1", Relation.VIEWER, U2, NOW.plus(1, ChronoUnit.DAYS));

    StatusOr<Integer> purged = engine.purgeExpired();

    assertEquals(1, purged.getValue());
    assertEquals(2, engine.listTuples(TENANT, null, null, null, null, 0, 20).getValue()
        .getTotalCount());
  }

  @Test
  void testIdentityUnavailableIsAnErrorNotADenial() {
    claim(OWNER, "b1");
    grantToUser(OWNER, "b1", Relation.VIEWER, U1, null);
    resolver.failWith(AuthzError.IDENTITY_UNAVAILABLE.toStatus("directory down"));

    StatusOr<CheckResult> check =
        engine.check(TENANT, U1, ResourceType.BOOKMARK, "b1", Permission.READ);
    StatusOr<AccessibleResources> list =
        engine.listAccessibleResources(TENANT, U1, ResourceType.BOOKMARK, Permission.READ, 0, 20);
    StatusOr<EffectivePermissions> effective =
        engine.getEffectivePermissions(TENANT, U1, ResourceType.BOOKMARK, "b1");
    StatusOr<PermissionTuple> grant =
        engine.grant(
            caller(OWNER), ResourceType.BOOKMARK, "b1", Relation.VIEWER, SubjectType.USER, U2,
            null);

    assertTrue(AuthzError.IDENTITY_UNAVAILABLE.matches(check.getStatus()));
    assertTrue(AuthzError.IDENTITY_UNAVAILABLE.matches(list.getStatus()));
    assertTrue(AuthzError.IDENTITY_UNAVAILABLE.matches(effective.getStatus()));
    assertTrue(AuthzError.IDENTITY_UNAVAILABLE.matches(grant.getStatus()));
  }

  @Test
  void testUnmanagedResourceTypeIsNotFound() {
    AuthorizationEngine noTypes =
        new AuthorizationEngine(
            new AuthorizationEngine.Config(
                dataSource,
                resolver,
                Clock.fixed(NOW, ZoneOffset.UTC),
                EnumSet.noneOf(ResourceType.class)));

    StatusOr<CheckResult> check =
        noTypes.check(TENANT, U1, ResourceType.BOOKMARK, "b1", Permission.READ);
    StatusOr<PermissionTuple> grant =
        noTypes.grant(
            caller(OWNER), ResourceType.BOOKMARK, "b1", Relation.VIEWER, SubjectType.USER, U1,
            null);
    StatusOr<Integer> revoke =
        noTypes.revoke(caller(OWNER), ResourceType.BOOKMARK, "b1", SubjectType.USER, U1, null);

    assertTrue(AuthzError.NOT_FOUND.matches(check.getStatus()));
    assertTrue(AuthzError.NOT_FOUND.matches(grant.getStatus()));
    assertTrue(AuthzError.NOT_FOUND.matches(revoke.getStatus()));
  }

  @Test
  void testAccessChecker() {
    claim(OWNER, "b1");
    grantToUser(OWNER, "b1", Relation.VIEWER, U1, null);
    AccessChecker checker = new AccessChecker(engine);

    assertTrue(checker.requireRead(TENANT, U1, ResourceType.BOOKMARK, "b1").isOk());
    Status write = checker.requireWrite(TENANT, U1, ResourceType.BOOKMARK, "b1");
    assertEquals(StatusCode.PERMISSION_DENIED, write.getCode());
    assertEquals("access denied: InsufficientRelation", write.getMessage());
    assertTrue(checker.requireDelete(TENANT, OWNER, ResourceType.BOOKMARK, "b1").isOk());
    assertTrue(checker.requireShare(TENANT, OWNER, ResourceType.BOOKMARK, "b1").isOk());
  }

  @Test
  void testExportTuples_ScopedToCallersTenant() {
    // Given: Governed resources in two tenants
    claim(OWNER, "b1");
    grantToUser(OWNER, "b1", Relation.VIEWER, U1, NOW.minus(1, ChronoUnit.HOURS));
    assertTrue(engine.claimOwnership(outsider(), ResourceType.BOOKMARK, "b9").isOk());

    // When: A tenant member exports without naming a tenant
    StatusOr<TupleExport> exportOr = engine.exportTuples(caller(U1), null);

    // Then: Only their tenant's tuples are exported, the expired one included
    assertTrue(exportOr.isOk(), () -> exportOr.getStatus().toString());
    TupleExport export = exportOr.getValue();
    assertEquals(TENANT, export.tenantId());
    assertFalse(export.fullExport());
    assertEquals(NOW, export.exportedAt());
    assertEquals(2, export.tuples().size());
    assertTrue(export.tuples().stream().allMatch(tuple -> tuple.tenantId() == TENANT));

    // And: Naming another tenant is a tenant mismatch
    StatusOr<TupleExport> foreign = engine.exportTuples(caller(U1), OTHER_TENANT);
    assertTrue(AuthzError.TENANT_MISMATCH.matches(foreign.getStatus()));
  }

  @Test
  void testExportTuples_PlatformAdminExportsEveryTenant() {
    claim(OWNER, "b1");
    assertTrue(engine.claimOwnership(outsider(), ResourceType.BOOKMARK, "b9").isOk());

    StatusOr<TupleExport> full = engine.exportTuples(platformAdmin(), 0);
    StatusOr<TupleExport> single = engine.exportTuples(platformAdmin(), OTHER_TENANT);

    assertTrue(full.getValue().fullExport());
    assertEquals(0, full.getValue().tenantId());
    assertEquals(2, full.getValue().tuples().size());
    assertFalse(single.getValue().fullExport());
    assertEquals(OTHER_TENANT, single.getValue().tenantId());
    assertEquals(
        List.of("b9"),
        single.getValue().tuples().stream().map(PermissionTuple::resourceId).toList());
  }

  @Test
  void testImportTuples_RequiresPlatformAdmin() {
    StatusOr<ImportResult> result =
        engine.importTuples(
            caller(OWNER),
            List.of(restorable(TENANT, "b1", Relation.OWNER, OWNER, null)),
            PermissionTuples.ImportMode.SKIP);

    assertEquals(StatusCode.PERMISSION_DENIED, result.getStatus().getCode());
    assertEquals(
        0,
        engine.listTuples(TENANT, null, null, null, null, 0, 20).getValue().getTotalCount());
  }

  @Test
  void testImportTuples_RestoresAnExport() {
    // Given: An export of a tenant, after which the tuples are lost
    claim(OWNER, "b1");
    grantToUser(OWNER, "b1", Relation.EDITOR, U1, NOW.plus(1, ChronoUnit.DAYS));
    List<PermissionTuple> backup = engine.exportTuples(caller(OWNER), null).getValue().tuples();
    PostgresTestHelper.truncate(postgresContext.getConnection());

    // When: A platform administrator imports it
    StatusOr<ImportResult> resultOr =
        engine.importTuples(platformAdmin(), backup, PermissionTuples.ImportMode.SKIP);

    // Then: Every tuple is created and access is back
    assertTrue(resultOr.isOk(), () -> resultOr.getStatus().toString());
    ImportResult result = resultOr.getValue();
    assertTrue(result.success());
    assertEquals(2, result.total());
    assertEquals(2, result.created());
    assertTrue(check(U1, "b1", Permission.WRITE).allowed());
    assertTrue(check(OWNER, "b1", Permission.DELETE).allowed());
  }

  @Test
  void testImportTuples_SkipAndOverwriteModes() {
    // Given: u1 is VIEWER of b1 until in one hour
    claim(OWNER, "b1");
    Instant stored = NOW.plus(1, ChronoUnit.HOURS);
    grantToUser(OWNER, "b1", Relation.VIEWER, U1, stored);
    List<PermissionTuple> backup =
        List.of(
            restorable(TENANT, "b1", Relation.VIEWER, U1, null),
            restorable(TENANT, "b1", Relation.EDITOR, U2, null));

    // When: The same backup is imported in skip mode, then in overwrite mode
    ImportResult skipped =
        engine.importTuples(platformAdmin(), backup, PermissionTuples.ImportMode.SKIP).getValue();
    assertEquals(stored, storedViewerExpiry());
    ImportResult overwritten =
        engine.importTuples(platformAdmin(), backup, PermissionTuples.ImportMode.OVERWRITE)
            .getValue();

    // Then: Skip keeps the stored expiry and overwrite replaces it
    assertEquals(1, skipped.created());
    assertEquals(1, skipped.skipped());
    assertEquals(0, skipped.updated());
    assertEquals(2, overwritten.updated());
    assertEquals(0, overwritten.created());
    assertNull(storedViewerExpiry());
  }

  @Test
  void testImportTuples_RejectedTuplesAreCountedAndTheRestGoOn() {
    // Given: b9 is governed by the other tenant
    assertTrue(engine.claimOwnership(outsider(), ResourceType.BOOKMARK, "b9").isOk());
    List<PermissionTuple> backup =
        List.of(
            restorable(TENANT, "b9", Relation.VIEWER, U1, null),
            restorable(TENANT, "", Relation.VIEWER, U1, null),
            new PermissionTuple(
                0L, TENANT, ResourceType.BOOKMARK, "b2", Relation.VIEWER, SubjectType.TENANT,
                String.valueOf(OTHER_TENANT), null, null, Instant.EPOCH),
            restorable(TENANT, "b1", Relation.OWNER, OWNER, null));

    // When: The backup is imported
    ImportResult result =
        engine.importTuples(platformAdmin(), backup, PermissionTuples.ImportMode.SKIP).getValue();

    // Then: Three tuples fail with a warning each and the valid one is restored
    assertFalse(result.success());
    assertEquals(4, result.total());
    assertEquals(3, result.failed());
    assertEquals(1, result.created());
    assertEquals(3, result.warnings().size());
    assertTrue(result.warnings().get(0).contains("governed by tenant " + OTHER_TENANT));
    assertEquals(Set.of(OTHER_TENANT), tenantsOf("b9"));
    assertTrue(check(OWNER, "b1", Permission.DELETE).allowed());
  }

  /** Starts every task on its own thread, releases them together and waits for all results. */
  @SafeVarargs
  private static <T> List<T> runTogether(Callable<T>... tasks) throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(tasks.length);
    CountDownLatch ready = new CountDownLatch(tasks.length);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<T>> futures = new ArrayList<>();
      for (Callable<T> task : tasks) {
        futures.add(
            executor.submit(
                () -> {
                  ready.countDown();
                  start.await();
                  return task.call();
                }));
      }
      assertTrue(ready.await(10, TimeUnit.SECONDS));
      start.countDown();
      List<T> results = new ArrayList<>();
      for (Future<T> future : futures) {
        results.add(future.get(30, TimeUnit.SECONDS));
      }
      return results;
    } finally {
      executor.shutdownNow();
    }
  }

  private static RequestContext outsider() {
    return new RequestContext(OTHER_TENANT, OUTSIDER, "", List.of());
  }

  private static RequestContext platformAdmin() {
    return new RequestContext(0, "1", "admin", List.of(RequestContext.PLATFORM_ADMIN_ROLE));
  }

  private static PermissionTuple restorable(
      int tenantId, String bookmark, Relation relation, String userId, Instant expiresAt) {
    return new PermissionTuple(
        0L, tenantId, ResourceType.BOOKMARK, bookmark, relation, SubjectType.USER, userId, 100,
        expiresAt, Instant.EPOCH);
  }

  private static Instant storedViewerExpiry() {
    List<PermissionTuple> tuples =
        engine
            .listTuples(TENANT, ResourceType.BOOKMARK, "b1", SubjectType.USER, U1, 0, 20)
            .getValue()
            .getTuples();
    assertEquals(1, tuples.size());
    return tuples.get(0).expiresAt();
  }

  private static Set<Integer> tenantsOf(String bookmark) {
    return engine
        .exportTuples(platformAdmin(), null)
        .getValue()
        .tuples()
        .stream()
        .filter(tuple -> tuple.resourceId().equals(bookmark))
        .map(PermissionTuple::tenantId)
        .collect(Collectors.toSet());
  }

  private static RequestContext caller(String userId) {
    return new RequestContext(TENANT, userId, "", List.of());
  }

  private static void claim(String userId, String bookmark) {
    StatusOr<PermissionTuple> result =
        engine.claimOwnership(caller(userId), ResourceType.BOOKMARK, bookmark);
    assertTrue(result.isOk(), () -> "claim failed: " + result.getStatus());
  }

  private static void grantToUser(
      String grantor, String bookmark, Relation relation, String userId, Instant expiresAt) {
    StatusOr<PermissionTuple> result =
        engine.grant(
            caller(grantor), ResourceType.BOOKMARK, bookmark, relation, SubjectType.USER, userId,
            expiresAt);
    assertTrue(result.isOk(), () -> "grant failed: " + result.getStatus());
  }

  private static CheckResult check(String userId, String bookmark, Permission permission) {
    StatusOr<CheckResult> result =
        engine.check(TENANT, userId, ResourceType.BOOKMARK, bookmark, permission);
    assertTrue(result.isOk(), () -> "check failed: " + result.getStatus());
    return result.getValue();
  }
}
