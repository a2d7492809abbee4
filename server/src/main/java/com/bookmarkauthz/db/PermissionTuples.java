package com.bookmarkauthz.db;

import com.bookmarkauthz.authz.Relation;
import com.bookmarkauthz.authz.ResourceType;
import com.bookmarkauthz.authz.SubjectRef;
import com.bookmarkauthz.authz.SubjectType;
import com.bookmarkauthz.common.status.Status;
import com.bookmarkauthz.common.status.StatusOr;
import com.bookmarkauthz.db.util.DbUtil;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * DAO helper class for the 'bookmark_permissions' table.
 *
 * <p>Every mutation is a single statement against the unique key, so concurrent writers on the
 * same key never produce duplicate rows; the last commit wins.
 */
public final class PermissionTuples {

  private static final String COLUMNS =
      "id, tenant_id, resource_type, resource_id, relation, subject_type, subject_id,"
          + " granted_by, expires_at, create_time";

  private PermissionTuples() {
    // Utility class
  }

  /**
   * Inserts a tuple, or on a key collision replaces its expiry and grantor while leaving its id and
   * create_time untouched.
   *
   * @param conn an open JDBC connection
   * @param key the unique key of the tuple
   * @param grantedBy the granting user id, may be null
   * @param expiresAt the expiry instant, null for a grant that never expires
   * @return StatusOr containing the stored tuple or an error
   */
  @Nonnull
  public static StatusOr<PermissionTuple> upsert(
      Connection conn, TupleKey key, @Nullable Integer grantedBy, @Nullable Instant expiresAt) {
    String sql = """
        INSERT INTO bookmark_permissions
               (tenant_id, resource_type, resource_id, relation, subject_type, subject_id,
                granted_by, expires_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (tenant_id, resource_type, resource_id, relation, subject_type, subject_id)
        DO UPDATE SET granted_by = EXCLUDED.granted_by,
                      expires_at = EXCLUDED.expires_at
        RETURNING\s""" + COLUMNS;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      bindKey(stmt, key);
      DbUtil.setOptionalInteger(stmt, 7, grantedBy);
      DbUtil.setOptionalTimestamp(stmt, 8, expiresAt);
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          return StatusOr.ofStatus(Status.internal("Upsert returned no row", null));
        }
        return extractTuple(rs);
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Inserts a tuple only if no tuple exists for the key's resource in any tenant. Callers that
   * need this to be race free must hold {@link #lockResource} in the same transaction.
   *
   * @param conn an open JDBC connection
   * @param key the unique key of the tuple
   * @param grantedBy the granting user id, may be null
   * @return StatusOr containing the inserted tuple, or empty if the resource already had tuples
   */
  @Nonnull
  public static StatusOr<Optional<PermissionTuple>> insertIfUnclaimed(
      Connection conn, TupleKey key, @Nullable Integer grantedBy) {
    String sql = """
        INSERT INTO bookmark_permissions
               (tenant_id, resource_type, resource_id, relation, subject_type, subject_id,
                granted_by)
        SELECT ?, ?, ?, ?, ?, ?, ?
         WHERE NOT EXISTS (SELECT 1
                             FROM bookmark_permissions
                            WHERE resource_type = ?
                              AND resource_id = ?)
        RETURNING\s""" + COLUMNS;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      bindKey(stmt, key);
      DbUtil.setOptionalInteger(stmt, 7, grantedBy);
      stmt.setString(8, key.resourceType().toDatabaseValue());
      stmt.setString(9, key.resourceId());
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          return StatusOr.ofValue(Optional.empty());
        }
        return extractTuple(rs).map(Optional::of);
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Takes a transaction-scoped advisory lock on a resource, serializing writers that must see a
   * consistent view of all its tuples. Released at commit or rollback.
   */
  @Nonnull
  public static Status lockResource(
      Connection conn, ResourceType resourceType, String resourceId) {
    String sql = "SELECT pg_advisory_xact_lock(hashtext(?))";
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, resourceType.toDatabaseValue() + ":" + resourceId);
      try (ResultSet rs = stmt.executeQuery()) {
        return Status.ok();
      }
    } catch (SQLException e) {
      return Status.internal("Failed to lock resource: " + e.getMessage(), e);
    }
  }

  /**
   * Deletes the tuples linking a subject to a resource.
   *
   * @param conn an open JDBC connection
   * @param relation the relation to remove, or null to remove every relation of the subject
   * @return StatusOr containing the number of deleted rows (zero is not an error)
   */
  @Nonnull
  public static StatusOr<Integer> delete(
      Connection conn,
      int tenantId,
      ResourceType resourceType,
      String resourceId,
      SubjectType subjectType,
      String subjectId,
      @Nullable Relation relation) {
    StringBuilder sql = new StringBuilder("""
        DELETE FROM bookmark_permissions
         WHERE tenant_id = ?
           AND resource_type = ?
           AND resource_id = ?
           AND subject_type = ?
           AND subject_id = ?
        """);
    if (relation != null) {
      sql.append("   AND relation = ?");
    }
    try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
      stmt.setInt(1, tenantId);
      stmt.setString(2, resourceType.toDatabaseValue());
      stmt.setString(3, resourceId);
      stmt.setString(4, subjectType.toDatabaseValue());
      stmt.setString(5, subjectId);
      if (relation != null) {
        stmt.setString(6, relation.toDatabaseValue());
      }
      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Deletes every tuple of a resource within a tenant.
   *
   * @return StatusOr containing the number of deleted rows
   */
  @Nonnull
  public static StatusOr<Integer> deleteAllForResource(
      Connection conn, int tenantId, ResourceType resourceType, String resourceId) {
    String sql = """
        DELETE FROM bookmark_permissions
         WHERE tenant_id = ?
           AND resource_type = ?
           AND resource_id = ?
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setInt(1, tenantId);
      stmt.setString(2, resourceType.toDatabaseValue());
      stmt.setString(3, resourceId);
      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Deletes tuples whose expiry is at or before the given instant, in every tenant.
   *
   * @return StatusOr containing the number of deleted rows
   */
  @Nonnull
  public static StatusOr<Integer> purgeExpired(Connection conn, Instant before) {
    String sql = """
        DELETE FROM bookmark_permissions
         WHERE expires_at IS NOT NULL
           AND expires_at <= ?
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setTimestamp(1, DbUtil.toSqlTimestamp(before));
      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Loads every tuple of one tenant, or of every tenant when {@code tenantId} is null, oldest
   * first. Expired tuples are included.
   *
   * @return StatusOr containing the tuples or an error
   */
  @Nonnull
  public static StatusOr<List<PermissionTuple>> exportAll(
      Connection conn, @Nullable Integer tenantId) {
    String sql = "SELECT " + COLUMNS + " FROM bookmark_permissions"
        + (tenantId != null ? " WHERE tenant_id = ?" : "")
        + " ORDER BY create_time, id";
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      if (tenantId != null) {
        stmt.setInt(1, tenantId);
      }
      try (ResultSet rs = stmt.executeQuery()) {
        return extractAll(rs);
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Restores one tuple. A tuple whose key is free is inserted. On a key collision {@link
   * ImportMode#SKIP} leaves the stored tuple alone and {@link ImportMode#OVERWRITE} replaces its
   * grantor and expiry. Ids and create times are never restored.
   *
   * @param conn an open JDBC connection
   * @param key the unique key of the tuple
   * @param grantedBy the recorded grantor, may be null
   * @param expiresAt the recorded expiry, null for a permanent grant
   * @param mode what to do with a tuple that already exists
   * @return StatusOr containing what happened to the row, or an error
   */
  @Nonnull
  public static StatusOr<ImportOutcome> importTuple(
      Connection conn,
      TupleKey key,
      @Nullable Integer grantedBy,
      @Nullable Instant expiresAt,
      ImportMode mode) {
    String insert = """
        INSERT INTO bookmark_permissions
               (tenant_id, resource_type, resource_id, relation, subject_type, subject_id,
                granted_by, expires_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (tenant_id, resource_type, resource_id, relation, subject_type, subject_id)
        """;
    // xmax is zero only on a row this statement inserted
    String sql = switch (mode) {
      case SKIP -> insert + "DO NOTHING RETURNING true AS inserted";
      case OVERWRITE -> insert + """
          DO UPDATE SET granted_by = EXCLUDED.granted_by,
                        expires_at = EXCLUDED.expires_at
          RETURNING (xmax = 0) AS inserted""";
    };
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      bindKey(stmt, key);
      DbUtil.setOptionalInteger(stmt, 7, grantedBy);
      DbUtil.setOptionalTimestamp(stmt, 8, expiresAt);
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          return StatusOr.ofValue(ImportOutcome.SKIPPED);
        }
        return StatusOr.ofValue(
            rs.getBoolean("inserted") ? ImportOutcome.CREATED : ImportOutcome.UPDATED);
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Loads the tuples on one resource held by any of the given subjects, expired ones included.
   *
   * @return StatusOr containing the tuples in insertion order, or an error
   */
  @Nonnull
  public static StatusOr<List<PermissionTuple>> loadForSubjects(
      Connection conn,
      int tenantId,
      ResourceType resourceType,
      String resourceId,
      Collection<SubjectRef> subjects) {
    if (subjects.isEmpty()) {
      return StatusOr.ofValue(ImmutableList.of());
    }
    List<Object> params = new ArrayList<>();
    StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + """

          FROM bookmark_permissions
         WHERE tenant_id = ?
           AND resource_type = ?
           AND resource_id = ?
        """);
    params.add(tenantId);
    params.add(resourceType.toDatabaseValue());
    params.add(resourceId);
    appendSubjectFilter(sql, params, subjects);
    sql.append(" ORDER BY id");

    try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
      bindAll(stmt, params);
      try (ResultSet rs = stmt.executeQuery()) {
        return extractAll(rs);
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Returns the tenants holding any tuple on the resource. This is the tenant of record as far as
   * the tuple store can tell; an empty set means the resource is not governed yet.
   */
  @Nonnull
  public static StatusOr<Set<Integer>> loadTenantsForResource(
      Connection conn, ResourceType resourceType, String resourceId) {
    String sql = """
        SELECT DISTINCT tenant_id
          FROM bookmark_permissions
         WHERE resource_type = ?
           AND resource_id = ?
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, resourceType.toDatabaseValue());
      stmt.setString(2, resourceId);
      try (ResultSet rs = stmt.executeQuery()) {
        ImmutableSet.Builder<Integer> tenants = ImmutableSet.builder();
        while (rs.next()) {
          tenants.add(rs.getInt("tenant_id"));
        }
        return StatusOr.ofValue(tenants.build());
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Reverse lookup: the distinct resources of a type on which any of the subjects holds an active
   * tuple with one of the given relations.
   *
   * @param conn an open JDBC connection
   * @param tenantId the tenant to search
   * @param resourceType the kind of resource
   * @param relations relations that qualify
   * @param subjects subjects that qualify
   * @param now tuples expiring at or before this instant are ignored
   * @param offset number of resource ids to skip
   * @param limit maximum number of resource ids to return
   * @return StatusOr containing resource ids in ascending byte order and the unpaged total
   */
  @Nonnull
  public static StatusOr<ResourceIdPage> queryAccessibleResourceIds(
      Connection conn,
      int tenantId,
      ResourceType resourceType,
      Collection<Relation> relations,
      Collection<SubjectRef> subjects,
      Instant now,
      long offset,
      int limit) {
    if (relations.isEmpty() || subjects.isEmpty()) {
      return StatusOr.ofValue(new ResourceIdPage(ImmutableList.of(), 0));
    }
    List<Object> params = new ArrayList<>();
    StringBuilder where = new StringBuilder("""
          FROM bookmark_permissions
         WHERE tenant_id = ?
           AND resource_type = ?
           AND (expires_at IS NULL OR expires_at > ?)
        """);
    params.add(tenantId);
    params.add(resourceType.toDatabaseValue());
    params.add(DbUtil.toSqlTimestamp(now));

    where.append("   AND relation IN (")
        .append(Joiner.on(", ").join(Collections.nCopies(relations.size(), "?")))
        .append(")");
    for (Relation relation : relations) {
      params.add(relation.toDatabaseValue());
    }
    appendSubjectFilter(where, params, subjects);

    String countSql = "SELECT COUNT(DISTINCT resource_id)" + where;
    String dataSql = "SELECT resource_id" + where
        + " GROUP BY resource_id ORDER BY resource_id COLLATE \"C\" ASC LIMIT ? OFFSET ?";

    try {
      long total = 0;
      try (PreparedStatement countStmt = conn.prepareStatement(countSql)) {
        bindAll(countStmt, params);
        try (ResultSet rs = countStmt.executeQuery()) {
          if (rs.next()) {
            total = rs.getLong(1);
          }
        }
      }

      List<String> resourceIds = new ArrayList<>();
      try (PreparedStatement dataStmt = conn.prepareStatement(dataSql)) {
        bindAll(dataStmt, params);
        dataStmt.setInt(params.size() + 1, limit);
        dataStmt.setLong(params.size() + 2, offset);
        try (ResultSet rs = dataStmt.executeQuery()) {
          while (rs.next()) {
            resourceIds.add(rs.getString("resource_id"));
          }
        }
      }
      return StatusOr.ofValue(new ResourceIdPage(resourceIds, total));
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Administrative listing of a tenant's tuples with optional filters, newest first. Expired tuples
   * are included.
   *
   * @param conn an open JDBC connection
   * @param tenantId the tenant to list
   * @param resourceType optional resource type filter
   * @param resourceId optional resource id filter
   * @param subjectType optional subject type filter
   * @param subjectId optional subject id filter
   * @param offset number of rows to skip
   * @param limit maximum number of rows to return
   * @return StatusOr containing the page of tuples and the unpaged total, or an error
   */
  @Nonnull
  public static StatusOr<QueryResult> queryTuples(
      Connection conn,
      int tenantId,
      @Nullable ResourceType resourceType,
      @Nullable String resourceId,
      @Nullable SubjectType subjectType,
      @Nullable String subjectId,
      long offset,
      int limit) {
    List<Object> params = new ArrayList<>();
    StringBuilder where = new StringBuilder("""

          FROM bookmark_permissions
         WHERE tenant_id = ?""");
    params.add(tenantId);
    if (resourceType != null) {
      where.append(" AND resource_type = ?");
      params.add(resourceType.toDatabaseValue());
    }
    if (resourceId != null) {
      where.append(" AND resource_id = ?");
      params.add(resourceId);
    }
    if (subjectType != null) {
      where.append(" AND subject_type = ?");
      params.add(subjectType.toDatabaseValue());
    }
    if (subjectId != null) {
      where.append(" AND subject_id = ?");
      params.add(subjectId);
    }

    String countSql = "SELECT COUNT(*)" + where;
    String dataSql = "SELECT " + COLUMNS + where
        + " ORDER BY create_time DESC, id DESC LIMIT ? OFFSET ?";

    try {
      long totalCount = 0;
      try (PreparedStatement countStmt = conn.prepareStatement(countSql)) {
        bindAll(countStmt, params);
        try (ResultSet rs = countStmt.executeQuery()) {
          if (rs.next()) {
            totalCount = rs.getLong(1);
          }
        }
      }

      try (PreparedStatement dataStmt = conn.prepareStatement(dataSql)) {
        bindAll(dataStmt, params);
        dataStmt.setInt(params.size() + 1, limit);
        dataStmt.setLong(params.size() + 2, offset);
        try (ResultSet rs = dataStmt.executeQuery()) {
          StatusOr<List<PermissionTuple>> tuplesOr = extractAll(rs);
          if (tuplesOr.isNotOk()) {
            return StatusOr.ofStatus(tuplesOr.getStatus());
          }
          return StatusOr.ofValue(new QueryResult(tuplesOr.getValue(), totalCount));
        }
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  private static void bindKey(PreparedStatement stmt, TupleKey key) throws SQLException {
    stmt.setInt(1, key.tenantId());
    stmt.setString(2, key.resourceType().toDatabaseValue());
    stmt.setString(3, key.resourceId());
    stmt.setString(4, key.relation().toDatabaseValue());
    stmt.setString(5, key.subjectType().toDatabaseValue());
    stmt.setString(6, key.subjectId());
  }

  private static void bindAll(PreparedStatement stmt, List<Object> params) throws SQLException {
    for (int i = 0; i < params.size(); i++) {
      stmt.setObject(i + 1, params.get(i));
    }
  }

  private static void appendSubjectFilter(
      StringBuilder sql, List<Object> params, Collection<SubjectRef> subjects) {
    sql.append(" AND (subject_type, subject_id) IN (")
        .append(Joiner.on(", ").join(Collections.nCopies(subjects.size(), "(?, ?)")))
        .append(")");
    for (SubjectRef subject : subjects) {
      params.add(subject.type().toDatabaseValue());
      params.add(subject.id());
    }
  }

  @Nonnull
  private static StatusOr<List<PermissionTuple>> extractAll(ResultSet rs) throws SQLException {
    List<PermissionTuple> result = new ArrayList<>();
    while (rs.next()) {
      StatusOr<PermissionTuple> tupleOr = extractTuple(rs);
      if (tupleOr.isNotOk()) {
        return StatusOr.ofStatus(tupleOr.getStatus());
      }
      result.add(tupleOr.getValue());
    }
    return StatusOr.ofValue(ImmutableList.copyOf(result));
  }

  /** Extracts a PermissionTuple from the current row of a ResultSet. */
  @Nonnull
  private static StatusOr<PermissionTuple> extractTuple(ResultSet rs) throws SQLException {
    ResourceType resourceType;
    Relation relation;
    SubjectType subjectType;
    try {
      resourceType = ResourceType.fromDatabaseValue(rs.getString("resource_type"));
      relation = Relation.fromDatabaseValue(rs.getString("relation"));
      subjectType = SubjectType.fromDatabaseValue(rs.getString("subject_type"));
    } catch (IllegalArgumentException e) {
      return StatusOr.ofStatus(
          Status.internal("Unrecognized value in bookmark_permissions: " + e.getMessage(), e));
    }

    StatusOr<Optional<Integer>> grantedByOr = DbUtil.getOptionalInteger(rs, "granted_by");
    if (grantedByOr.isNotOk()) {
      return StatusOr.ofStatus(grantedByOr.getStatus());
    }

    StatusOr<Optional<Instant>> expiresAtOr = DbUtil.getOptionalInstant(rs, "expires_at");
    if (expiresAtOr.isNotOk()) {
      return StatusOr.ofStatus(expiresAtOr.getStatus());
    }

    StatusOr<Instant> createTimeOr = DbUtil.getInstant(rs, "create_time");
    if (createTimeOr.isNotOk()) {
      return StatusOr.ofStatus(createTimeOr.getStatus());
    }

    return StatusOr.ofValue(new PermissionTuple(
        rs.getLong("id"),
        rs.getInt("tenant_id"),
        resourceType,
        rs.getString("resource_id"),
        relation,
        subjectType,
        rs.getString("subject_id"),
        grantedByOr.getValue().orElse(null),
        expiresAtOr.getValue().orElse(null),
        createTimeOr.getValue()));
  }

  /** How an import treats a tuple whose key is already stored. */
  public enum ImportMode {
    SKIP,
    OVERWRITE
  }

  /** What an import did with one tuple. */
  public enum ImportOutcome {
    CREATED,
    UPDATED,
    SKIPPED
  }

  /** A page of resource ids with the unpaged total. */
  public record ResourceIdPage(List<String> resourceIds, long totalCount) {
    public ResourceIdPage {
      resourceIds = ImmutableList.copyOf(resourceIds);
    }
  }

  /** Container for query results with pagination information. */
  public static class QueryResult {
    private final List<PermissionTuple> tuples;
    private final long totalCount;

    public QueryResult(List<PermissionTuple> tuples, long totalCount) {
      this.tuples = ImmutableList.copyOf(tuples);
      this.totalCount = totalCount;
    }

    public List<PermissionTuple> getTuples() {
      return tuples;
    }

    public long getTotalCount() {
      return totalCount;
    }

    /** Returns true if rows remain beyond this page. */
    public boolean hasMore(long offset) {
      return offset + tuples.size() < totalCount;
    }
  }
}
