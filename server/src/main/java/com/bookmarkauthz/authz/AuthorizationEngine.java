package com.bookmarkauthz.authz;

import com.bookmarkauthz.common.status.Status;
import com.bookmarkauthz.common.status.StatusCode;
import com.bookmarkauthz.common.status.StatusOr;
import com.bookmarkauthz.db.PermissionTuple;
import com.bookmarkauthz.db.PermissionTuples;
import com.bookmarkauthz.db.TupleKey;
import com.bookmarkauthz.db.util.DbUtil;
import com.bookmarkauthz.identity.SubjectResolver;
import com.bookmarkauthz.security.RequestContext;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;
import javax.sql.DataSource;
import org.tinylog.Logger;

/**
 * Decides and records who may do what to which resource.
 *
 * <p>Every operation is scoped to a single tenant. Reads (check, reverse lookup, effective
 * permissions) evaluate expiry against the engine's clock and never take locks. Writes are single
 * statements against the tuple's unique key, except ownership claims, which serialize on the
 * resource.
 *
 * <p>Denials are results, not errors: {@link #check} reports them as a {@link CheckResult}.
 * Infrastructure failures are returned as statuses carrying an {@link AuthzError} reason and are
 * never retried here.
 */
public class AuthorizationEngine {

  /**
   * @param dataSource The tuple store
   * @param subjectResolver Expands users into subjects
   * @param clock Source of the evaluation time for expiry
   * @param managedTypes Resource types this store governs
   */
  public record Config(
      DataSource dataSource,
      SubjectResolver subjectResolver,
      Clock clock,
      Set<ResourceType> managedTypes) {

    public Config(DataSource dataSource, SubjectResolver subjectResolver) {
      this(dataSource, subjectResolver, Clock.systemUTC(), EnumSet.allOf(ResourceType.class));
    }
  }

  private final Config config;

  public AuthorizationEngine(Config config) {
    this.config = config;
  }

  /**
   * Checks whether a user holds a permission on a resource.
   *
   * <p>Denial reasons are evaluated in order: TenantMismatch (the resource is governed by another
   * tenant, or the user is not a member of this one), NoGrant, Expired, InsufficientRelation.
   */
  public StatusOr<CheckResult> check(
      int tenantId,
      String userId,
      ResourceType resourceType,
      String resourceId,
      Permission permission) {
    Status valid = validateResource(resourceType, resourceId);
    if (!valid.isOk()) {
      return StatusOr.ofStatus(valid);
    }
    if (Strings.isNullOrEmpty(userId)) {
      return StatusOr.ofStatus(Status.invalidArgument("user_id is required"));
    }

    StatusOr<ImmutableSet<SubjectRef>> subjectsOr =
        config.subjectResolver().resolveSubjects(tenantId, userId);
    if (subjectsOr.isNotOk()) {
      if (AuthzError.TENANT_MISMATCH.matches(subjectsOr.getStatus())) {
        return StatusOr.ofValue(CheckResult.denied(DenialReason.TENANT_MISMATCH));
      }
      return StatusOr.ofStatus(subjectsOr.getStatus());
    }

    try (Connection conn = config.dataSource().getConnection()) {
      return checkWithSubjects(
          conn, tenantId, subjectsOr.getValue(), resourceType, resourceId, permission);
    } catch (SQLException e) {
      return StatusOr.ofStatus(storeUnavailable(e));
    }
  }

  /**
   * Reverse lookup of the resources a user can reach with a permission. Each resource appears once
   * however many tuples grant it, in ascending id order.
   */
  public StatusOr<AccessibleResources> listAccessibleResources(
      int tenantId,
      String userId,
      ResourceType resourceType,
      Permission permission,
      long offset,
      int limit) {
    if (!config.managedTypes().contains(resourceType)) {
      return StatusOr.ofStatus(unmanagedType(resourceType));
    }
    if (Strings.isNullOrEmpty(userId)) {
      return StatusOr.ofStatus(Status.invalidArgument("user_id is required"));
    }

    StatusOr<ImmutableSet<SubjectRef>> subjectsOr =
        config.subjectResolver().resolveSubjects(tenantId, userId);
    if (subjectsOr.isNotOk()) {
      return StatusOr.ofStatus(subjectsOr.getStatus());
    }

    try (Connection conn = config.dataSource().getConnection()) {
      StatusOr<PermissionTuples.ResourceIdPage> pageOr =
          PermissionTuples.queryAccessibleResourceIds(
              conn,
              tenantId,
              resourceType,
              Relation.grantingRelations(permission),
              subjectsOr.getValue(),
              now(),
              offset,
              limit);
      if (pageOr.isNotOk()) {
        return StatusOr.ofStatus(storeFailure("list accessible resources", pageOr.getStatus()));
      }
      PermissionTuples.ResourceIdPage page = pageOr.getValue();
      return StatusOr.ofValue(new AccessibleResources(page.resourceIds(), page.totalCount()));
    } catch (SQLException e) {
      return StatusOr.ofStatus(storeUnavailable(e));
    }
  }

  /**
   * Computes the union of the permissions a user holds on a resource and the highest relation
   * behind them. Resources governed by another tenant yield {@link EffectivePermissions#NONE}.
   */
  public StatusOr<EffectivePermissions> getEffectivePermissions(
      int tenantId, String userId, ResourceType resourceType, String resourceId) {
    Status valid = validateResource(resourceType, resourceId);
    if (!valid.isOk()) {
      return StatusOr.ofStatus(valid);
    }
    if (Strings.isNullOrEmpty(userId)) {
      return StatusOr.ofStatus(Status.invalidArgument("user_id is required"));
    }

    StatusOr<ImmutableSet<SubjectRef>> subjectsOr =
        config.subjectResolver().resolveSubjects(tenantId, userId);
    if (subjectsOr.isNotOk()) {
      return StatusOr.ofStatus(subjectsOr.getStatus());
    }

    try (Connection conn = config.dataSource().getConnection()) {
      StatusOr<Set<Integer>> tenantsOr =
          PermissionTuples.loadTenantsForResource(conn, resourceType, resourceId);
      if (tenantsOr.isNotOk()) {
        return StatusOr.ofStatus(storeFailure("load resource tenants", tenantsOr.getStatus()));
      }
      if (governedElsewhere(tenantsOr.getValue(), tenantId)) {
        return StatusOr.ofValue(EffectivePermissions.NONE);
      }

      StatusOr<List<PermissionTuple>> tuplesOr =
          PermissionTuples.loadForSubjects(
              conn, tenantId, resourceType, resourceId, subjectsOr.getValue());
      if (tuplesOr.isNotOk()) {
        return StatusOr.ofStatus(storeFailure("load tuples", tuplesOr.getStatus()));
      }
      return StatusOr.ofValue(effective(tuplesOr.getValue(), now()));
    } catch (SQLException e) {
      return StatusOr.ofStatus(storeUnavailable(e));
    }
  }

  /**
   * Grants a relation, or refreshes the expiry and grantor of an identical grant. The caller must
   * hold SHARE on the resource.
   *
   * @param expiresAt when the grant stops counting, or null for a permanent grant
   * @return the stored tuple
   */
  public StatusOr<PermissionTuple> grant(
      RequestContext caller,
      ResourceType resourceType,
      String resourceId,
      Relation relation,
      SubjectType subjectType,
      String subjectId,
      @Nullable Instant expiresAt) {
    Status valid = validateResource(resourceType, resourceId);
    if (!valid.isOk()) {
      return StatusOr.ofStatus(valid);
    }
    Status validSubject = validateSubject(caller.tenantId(), subjectType, subjectId);
    if (!validSubject.isOk()) {
      return StatusOr.ofStatus(validSubject);
    }

    StatusOr<ImmutableSet<SubjectRef>> callerSubjectsOr = resolveCaller(caller);
    if (callerSubjectsOr.isNotOk()) {
      return StatusOr.ofStatus(callerSubjectsOr.getStatus());
    }

    try (Connection conn = config.dataSource().getConnection()) {
      Status gate =
          requireShare(conn, caller, callerSubjectsOr.getValue(), resourceType, resourceId);
      if (!gate.isOk()) {
        return StatusOr.ofStatus(gate);
      }

      TupleKey key =
          new TupleKey(
              caller.tenantId(), resourceType, resourceId, relation, subjectType, subjectId);
      StatusOr<PermissionTuple> tupleOr =
          PermissionTuples.upsert(conn, key, caller.grantorId(), expiresAt);
      if (tupleOr.isNotOk()) {
        return StatusOr.ofStatus(storeFailure("grant", tupleOr.getStatus()));
      }
      Logger.info(
          "Granted {} on {}/{} to {}:{} in tenant {}",
          relation, resourceType, resourceId, subjectType, subjectId, caller.tenantId());
      return tupleOr;
    } catch (SQLException e) {
      return StatusOr.ofStatus(storeUnavailable(e));
    }
  }

  /**
   * Removes a subject's relation on a resource, or all of its relations when {@code relation} is
   * null. Revoking something that does not exist succeeds with a count of zero. The caller must
   * hold SHARE on the resource.
   *
   * @return the number of tuples removed
   */
  public StatusOr<Integer> revoke(
      RequestContext caller,
      ResourceType resourceType,
      String resourceId,
      SubjectType subjectType,
      String subjectId,
      @Nullable Relation relation) {
    Status valid = validateResource(resourceType, resourceId);
    if (!valid.isOk()) {
      return StatusOr.ofStatus(valid);
    }
    if (Strings.isNullOrEmpty(subjectId)) {
      return StatusOr.ofStatus(Status.invalidArgument("subject_id is required"));
    }

    StatusOr<ImmutableSet<SubjectRef>> callerSubjectsOr = resolveCaller(caller);
    if (callerSubjectsOr.isNotOk()) {
      return StatusOr.ofStatus(callerSubjectsOr.getStatus());
    }

    try (Connection conn = config.dataSource().getConnection()) {
      Status gate =
          requireShare(conn, caller, callerSubjectsOr.getValue(), resourceType, resourceId);
      if (!gate.isOk()) {
        return StatusOr.ofStatus(gate);
      }

      StatusOr<Integer> deletedOr =
          PermissionTuples.delete(
              conn, caller.tenantId(), resourceType, resourceId, subjectType, subjectId, relation);
      if (deletedOr.isNotOk()) {
        return StatusOr.ofStatus(storeFailure("revoke", deletedOr.getStatus()));
      }
      Logger.info(
          "Revoked {} on {}/{} from {}:{} in tenant {} ({} removed)",
          relation == null ? "all relations" : relation,
          resourceType, resourceId, subjectType, subjectId, caller.tenantId(),
          deletedOr.getValue());
      return deletedOr;
    } catch (SQLException e) {
      return StatusOr.ofStatus(storeUnavailable(e));
    }
  }

  /**
   * Administrative listing of a tenant's raw tuples, newest first, expired ones included.
   */
  public StatusOr<PermissionTuples.QueryResult> listTuples(
      int tenantId,
      @Nullable ResourceType resourceType,
      @Nullable String resourceId,
      @Nullable SubjectType subjectType,
      @Nullable String subjectId,
      long offset,
      int limit) {
    if (resourceType != null && !config.managedTypes().contains(resourceType)) {
      return StatusOr.ofStatus(unmanagedType(resourceType));
    }
    try (Connection conn = config.dataSource().getConnection()) {
      StatusOr<PermissionTuples.QueryResult> resultOr =
          PermissionTuples.queryTuples(
              conn, tenantId, resourceType, resourceId, subjectType, subjectId, offset, limit);
      if (resultOr.isNotOk()) {
        return StatusOr.ofStatus(storeFailure("list tuples", resultOr.getStatus()));
      }
      return resultOr;
    } catch (SQLException e) {
      return StatusOr.ofStatus(storeUnavailable(e));
    }
  }

  /**
   * Makes the caller OWNER of a resource nobody governs yet. Used when the resource is created.
   *
   * <p>Fails with ALREADY_EXISTS when the caller's tenant already has tuples on the resource, and
   * with TenantMismatch when another tenant does.
   */
  public StatusOr<PermissionTuple> claimOwnership(
      RequestContext caller, ResourceType resourceType, String resourceId) {
    Status valid = validateResource(resourceType, resourceId);
    if (!valid.isOk()) {
      return StatusOr.ofStatus(valid);
    }

    TupleKey key =
        new TupleKey(
            caller.tenantId(),
            resourceType,
            resourceId,
            Relation.OWNER,
            SubjectType.USER,
            caller.userId());

    try (Connection conn = config.dataSource().getConnection()) {
      conn.setAutoCommit(false);
      try {
        Status lock = PermissionTuples.lockResource(conn, resourceType, resourceId);
        if (!lock.isOk()) {
          conn.rollback();
          return StatusOr.ofStatus(storeFailure("lock resource", lock));
        }

        StatusOr<Optional<PermissionTuple>> insertedOr =
            PermissionTuples.insertIfUnclaimed(conn, key, caller.grantorId());
        if (insertedOr.isNotOk()) {
          conn.rollback();
          return StatusOr.ofStatus(storeFailure("claim ownership", insertedOr.getStatus()));
        }
        if (insertedOr.getValue().isPresent()) {
          conn.commit();
          Logger.info(
              "User {} claimed {}/{} in tenant {}",
              caller.userId(), resourceType, resourceId, caller.tenantId());
          return StatusOr.ofValue(insertedOr.getValue().get());
        }

        StatusOr<Set<Integer>> tenantsOr =
            PermissionTuples.loadTenantsForResource(conn, resourceType, resourceId);
        conn.rollback();
        if (tenantsOr.isNotOk()) {
          return StatusOr.ofStatus(storeFailure("load resource tenants", tenantsOr.getStatus()));
        }
        if (tenantsOr.getValue().contains(caller.tenantId())) {
          return StatusOr.ofStatus(
              Status.alreadyExists(resourceType + "/" + resourceId + " is already governed"));
        }
        Logger.warn(
            "Tenant {} tried to claim {}/{} governed by {}",
            caller.tenantId(), resourceType, resourceId, tenantsOr.getValue());
        return StatusOr.ofStatus(
            AuthzError.TENANT_MISMATCH.toStatus("resource belongs to another tenant"));
      } catch (SQLException e) {
        conn.rollback();
        throw e;
      } finally {
        conn.setAutoCommit(true);
      }
    } catch (SQLException e) {
      return StatusOr.ofStatus(storeUnavailable(e));
    }
  }

  /**
   * Removes every tuple on a resource in the caller's tenant. Used when the resource is deleted;
   * the caller must hold DELETE on it.
   *
   * @return the number of tuples removed
   */
  public StatusOr<Integer> deleteResourcePermissions(
      RequestContext caller, ResourceType resourceType, String resourceId) {
    Status valid = validateResource(resourceType, resourceId);
    if (!valid.isOk()) {
      return StatusOr.ofStatus(valid);
    }

    StatusOr<ImmutableSet<SubjectRef>> callerSubjectsOr = resolveCaller(caller);
    if (callerSubjectsOr.isNotOk()) {
      return StatusOr.ofStatus(callerSubjectsOr.getStatus());
    }

    try (Connection conn = config.dataSource().getConnection()) {
      StatusOr<CheckResult> gateOr =
          checkWithSubjects(
              conn,
              caller.tenantId(),
              callerSubjectsOr.getValue(),
              resourceType,
              resourceId,
              Permission.DELETE);
      Status gate = gateStatus(gateOr);
      if (!gate.isOk()) {
        return StatusOr.ofStatus(gate);
      }

      StatusOr<Integer> deletedOr =
          PermissionTuples.deleteAllForResource(
              conn, caller.tenantId(), resourceType, resourceId);
      if (deletedOr.isNotOk()) {
        return StatusOr.ofStatus(
            storeFailure("delete resource permissions", deletedOr.getStatus()));
      }
      Logger.info(
          "Removed {} tuples on {}/{} in tenant {}",
          deletedOr.getValue(), resourceType, resourceId, caller.tenantId());
      return deletedOr;
    } catch (SQLException e) {
      return StatusOr.ofStatus(storeUnavailable(e));
    }
  }

  /**
   * Deletes tuples that have expired by now, in every tenant. Expired tuples never count, so this
   * is housekeeping only.
   *
   * @return the number of tuples removed
   */
  public StatusOr<Integer> purgeExpired() {
    try (Connection conn = config.dataSource().getConnection()) {
      StatusOr<Integer> purgedOr = PermissionTuples.purgeExpired(conn, now());
      if (purgedOr.isNotOk()) {
        return StatusOr.ofStatus(storeFailure("purge expired", purgedOr.getStatus()));
      }
      Logger.info("Purged {} expired tuples", purgedOr.getValue());
      return purgedOr;
    } catch (SQLException e) {
      return StatusOr.ofStatus(storeUnavailable(e));
    }
  }

  /**
   * Exports stored tuples for backup, expired ones included.
   *
   * <p>Without a tenant, or with tenant 0, a platform administrator exports every tenant and any
   * other caller exports their own. Naming a tenant other than the caller's requires a platform
   * administrator.
   */
  public StatusOr<TupleExport> exportTuples(RequestContext caller, @Nullable Integer tenantId) {
    boolean tenantGiven = tenantId != null && tenantId != 0;
    boolean fullExport = !tenantGiven && caller.isPlatformAdmin();
    int exportTenant = tenantGiven ? tenantId : caller.tenantId();
    if (exportTenant != caller.tenantId() && !caller.isPlatformAdmin()) {
      Logger.warn("User {} tried to export tenant {}", caller.userId(), exportTenant);
      return StatusOr.ofStatus(
          AuthzError.TENANT_MISMATCH.toStatus("cannot export tenant " + exportTenant));
    }

    Instant exportedAt = now();
    try (Connection conn = config.dataSource().getConnection()) {
      StatusOr<List<PermissionTuple>> tuplesOr =
          PermissionTuples.exportAll(conn, fullExport ? null : exportTenant);
      if (tuplesOr.isNotOk()) {
        return StatusOr.ofStatus(storeFailure("export tuples", tuplesOr.getStatus()));
      }
      Logger.info(
          "Exported {} tuples of {}",
          tuplesOr.getValue().size(), fullExport ? "every tenant" : "tenant " + exportTenant);
      return StatusOr.ofValue(
          new TupleExport(
              fullExport ? 0 : exportTenant, fullExport, exportedAt, tuplesOr.getValue()));
    } catch (SQLException e) {
      return StatusOr.ofStatus(storeUnavailable(e));
    }
  }

  /**
   * Restores tuples from a backup into the tenants they name. Only platform administrators may
   * import. Ids and create times of the given tuples are ignored.
   *
   * <p>Each tuple is restored in its own transaction, serialized on its resource like an
   * ownership claim. A tuple that is malformed, or whose resource another tenant governs, is
   * counted as failed with a warning and the import goes on. Losing the store aborts the import;
   * tuples restored before that stay restored.
   */
  public StatusOr<ImportResult> importTuples(
      RequestContext caller, List<PermissionTuple> tuples, PermissionTuples.ImportMode mode) {
    if (!caller.isPlatformAdmin()) {
      Logger.warn("User {} tried to import tuples", caller.userId());
      return StatusOr.ofStatus(
          Status.permissionDenied("importing permissions requires a platform administrator"));
    }

    int created = 0;
    int updated = 0;
    int skipped = 0;
    List<String> warnings = new ArrayList<>();
    try (Connection conn = config.dataSource().getConnection()) {
      conn.setAutoCommit(false);
      try {
        for (PermissionTuple tuple : tuples) {
          Status valid = validateImported(tuple);
          if (!valid.isOk()) {
            warnings.add(describe(tuple) + ": " + valid.getMessage());
            continue;
          }

          StatusOr<PermissionTuples.ImportOutcome> outcomeOr = importOne(conn, tuple, mode);
          if (outcomeOr.isNotOk()) {
            conn.rollback();
            Status failure = outcomeOr.getStatus();
            if (!AuthzError.TENANT_MISMATCH.matches(failure)) {
              failure = storeFailure("import tuple", failure);
              if (AuthzError.STORE_UNAVAILABLE.matches(failure)) {
                return StatusOr.ofStatus(failure);
              }
            }
            warnings.add(describe(tuple) + ": " + failure.getMessage());
            continue;
          }
          conn.commit();

          switch (outcomeOr.getValue()) {
            case CREATED -> created++;
            case UPDATED -> updated++;
            case SKIPPED -> skipped++;
          }
        }
      } catch (SQLException e) {
        conn.rollback();
        throw e;
      } finally {
        conn.setAutoCommit(true);
      }
    } catch (SQLException e) {
      return StatusOr.ofStatus(storeUnavailable(e));
    }

    ImportResult result =
        new ImportResult(tuples.size(), created, updated, skipped, warnings.size(), warnings);
    Logger.info(
        "Imported tuples in {} mode: {} created, {} updated, {} skipped, {} failed",
        mode, created, updated, skipped, result.failed());
    return StatusOr.ofValue(result);
  }

  /**
   * Reduces the tuples linking a user's subjects to one resource into a check result.
   *
   * @param tuples every matching tuple, expired ones included
   * @param permission the permission being checked
   * @param now the evaluation time
   */
  public static CheckResult evaluate(
      List<PermissionTuple> tuples, Permission permission, Instant now) {
    if (tuples.isEmpty()) {
      return CheckResult.denied(DenialReason.NO_GRANT);
    }
    List<Relation> active = activeRelations(tuples, now);
    if (active.isEmpty()) {
      return CheckResult.denied(DenialReason.EXPIRED);
    }
    List<Relation> granting = new ArrayList<>();
    for (Relation relation : active) {
      if (relation.grants(permission)) {
        granting.add(relation);
      }
    }
    return Relation.highest(granting)
        .map(CheckResult::allowed)
        .orElseGet(() -> CheckResult.denied(DenialReason.INSUFFICIENT_RELATION));
  }

  /** Reduces the tuples linking a user's subjects to one resource into effective permissions. */
  public static EffectivePermissions effective(List<PermissionTuple> tuples, Instant now) {
    List<Relation> active = activeRelations(tuples, now);
    if (active.isEmpty()) {
      return EffectivePermissions.NONE;
    }
    return new EffectivePermissions(
        Relation.union(active), Relation.highest(active).orElse(null));
  }

  private StatusOr<CheckResult> checkWithSubjects(
      Connection conn,
      int tenantId,
      Set<SubjectRef> subjects,
      ResourceType resourceType,
      String resourceId,
      Permission permission) {
    StatusOr<Set<Integer>> tenantsOr =
        PermissionTuples.loadTenantsForResource(conn, resourceType, resourceId);
    if (tenantsOr.isNotOk()) {
      return StatusOr.ofStatus(storeFailure("load resource tenants", tenantsOr.getStatus()));
    }
    if (governedElsewhere(tenantsOr.getValue(), tenantId)) {
      return StatusOr.ofValue(CheckResult.denied(DenialReason.TENANT_MISMATCH));
    }

    StatusOr<List<PermissionTuple>> tuplesOr =
        PermissionTuples.loadForSubjects(conn, tenantId, resourceType, resourceId, subjects);
    if (tuplesOr.isNotOk()) {
      return StatusOr.ofStatus(storeFailure("load tuples", tuplesOr.getStatus()));
    }
    return StatusOr.ofValue(evaluate(tuplesOr.getValue(), permission, now()));
  }

  private Status requireShare(
      Connection conn,
      RequestContext caller,
      Set<SubjectRef> callerSubjects,
      ResourceType resourceType,
      String resourceId) {
    return gateStatus(
        checkWithSubjects(
            conn, caller.tenantId(), callerSubjects, resourceType, resourceId, Permission.SHARE));
  }

  /** Turns the caller's own check into the status of a guarded mutation. */
  private static Status gateStatus(StatusOr<CheckResult> resultOr) {
    if (resultOr.isNotOk()) {
      return resultOr.getStatus();
    }
    CheckResult result = resultOr.getValue();
    if (result.allowed()) {
      return Status.ok();
    }
    if (result.reason() == DenialReason.TENANT_MISMATCH) {
      return AuthzError.TENANT_MISMATCH.toStatus("resource belongs to another tenant");
    }
    return AccessChecker.denied(result);
  }

  private StatusOr<ImmutableSet<SubjectRef>> resolveCaller(RequestContext caller) {
    return config.subjectResolver().resolveSubjects(caller.tenantId(), caller.userId());
  }

  private StatusOr<PermissionTuples.ImportOutcome> importOne(
      Connection conn, PermissionTuple tuple, PermissionTuples.ImportMode mode) {
    Status lock = PermissionTuples.lockResource(conn, tuple.resourceType(), tuple.resourceId());
    if (!lock.isOk()) {
      return StatusOr.ofStatus(lock);
    }
    StatusOr<Set<Integer>> tenantsOr =
        PermissionTuples.loadTenantsForResource(conn, tuple.resourceType(), tuple.resourceId());
    if (tenantsOr.isNotOk()) {
      return StatusOr.ofStatus(tenantsOr.getStatus());
    }
    if (governedElsewhere(tenantsOr.getValue(), tuple.tenantId())) {
      return StatusOr.ofStatus(
          AuthzError.TENANT_MISMATCH.toStatus(
              "resource is governed by tenant " + tenantsOr.getValue().iterator().next()));
    }
    return PermissionTuples.importTuple(
        conn, tuple.key(), tuple.grantedBy(), tuple.expiresAt(), mode);
  }

  private Status validateImported(PermissionTuple tuple) {
    Status valid = validateResource(tuple.resourceType(), tuple.resourceId());
    if (!valid.isOk()) {
      return valid;
    }
    return validateSubject(tuple.tenantId(), tuple.subjectType(), tuple.subjectId());
  }

  private static String describe(PermissionTuple tuple) {
    return tuple.resourceType() + "/" + tuple.resourceId() + " " + tuple.relation() + " for "
        + tuple.subjectType() + ":" + tuple.subjectId() + " in tenant " + tuple.tenantId();
  }

  private Status validateResource(ResourceType resourceType, String resourceId) {
    if (!config.managedTypes().contains(resourceType)) {
      return unmanagedType(resourceType);
    }
    if (Strings.isNullOrEmpty(resourceId)) {
      return Status.invalidArgument("resource_id is required");
    }
    return Status.ok();
  }

  private static Status validateSubject(int tenantId, SubjectType subjectType, String subjectId) {
    if (Strings.isNullOrEmpty(subjectId)) {
      return Status.invalidArgument("subject_id is required");
    }
    // A tenant-wide grant may only name the tenant that owns it.
    if (subjectType == SubjectType.TENANT && !subjectId.equals(String.valueOf(tenantId))) {
      return AuthzError.TENANT_MISMATCH.toStatus(
          "tenant subject " + subjectId + " is not the caller's tenant");
    }
    return Status.ok();
  }

  private static Status unmanagedType(ResourceType resourceType) {
    return AuthzError.NOT_FOUND.toStatus("resource type " + resourceType + " is not governed here");
  }

  private static boolean governedElsewhere(Set<Integer> tenants, int tenantId) {
    return !tenants.isEmpty() && !tenants.contains(tenantId);
  }

  private static List<Relation> activeRelations(List<PermissionTuple> tuples, Instant now) {
    List<Relation> active = new ArrayList<>();
    for (PermissionTuple tuple : tuples) {
      if (tuple.isActive(now)) {
        active.add(tuple.relation());
      }
    }
    return active;
  }

  private Instant now() {
    return config.clock().instant();
  }

  private static Status storeUnavailable(SQLException e) {
    Logger.error(e, "Tuple store unavailable.");
    return AuthzError.STORE_UNAVAILABLE.toStatus("tuple store unavailable: " + e.getMessage(), e);
  }

  /** Reclassifies a DAO failure caused by a lost connection as StoreUnavailable. */
  private static Status storeFailure(String operation, Status status) {
    if (status.getCode() == StatusCode.INTERNAL && DbUtil.isConnectionFailure(status.getCause())) {
      Logger.error(status.getCause(), "Tuple store unavailable during {}.", operation);
      return AuthzError.STORE_UNAVAILABLE.toStatus(
          "tuple store unavailable: " + status.getMessage(), status.getCause());
    }
    Logger.error(status.getCause(), "Failed to {}: {}", operation, status.getMessage());
    return status;
  }
}
