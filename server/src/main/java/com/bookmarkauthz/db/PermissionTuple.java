package com.bookmarkauthz.db;

import bookmarkauthz.v1.PermissionOuterClass;
import com.bookmarkauthz.authz.Relation;
import com.bookmarkauthz.authz.ResourceType;
import com.bookmarkauthz.authz.SubjectRef;
import com.bookmarkauthz.authz.SubjectType;
import com.bookmarkauthz.db.util.DbUtil;
import com.bookmarkauthz.util.EnumConverters;
import java.time.Instant;
import javax.annotation.Nullable;

/**
 * Represents a row in the 'bookmark_permissions' table.
 *
 * @param id Surrogate key assigned by the database
 * @param tenantId The owning tenant
 * @param resourceType The kind of resource
 * @param resourceId The resource identifier within its type
 * @param relation The relation held
 * @param subjectType The kind of principal holding the relation
 * @param subjectId The principal identifier
 * @param grantedBy User id of whoever last granted the tuple (audit only)
 * @param expiresAt When the tuple stops counting, or null if it never expires
 * @param createTime When the tuple was first inserted
 */
public record PermissionTuple(
    long id,
    int tenantId,
    ResourceType resourceType,
    String resourceId,
    Relation relation,
    SubjectType subjectType,
    String subjectId,
    @Nullable Integer grantedBy,
    @Nullable Instant expiresAt,
    Instant createTime) {

  /** A tuple is active until its expiry instant; at that instant it is already expired. */
  public boolean isActive(Instant now) {
    return expiresAt == null || expiresAt.isAfter(now);
  }

  public SubjectRef subject() {
    return new SubjectRef(subjectType, subjectId);
  }

  public TupleKey key() {
    return new TupleKey(tenantId, resourceType, resourceId, relation, subjectType, subjectId);
  }

  /**
   * Converts this database record to its corresponding Protocol Buffer message.
   *
   * @return The Protocol Buffer PermissionTuple message
   */
  public PermissionOuterClass.PermissionTuple toProto() {
    PermissionOuterClass.PermissionTuple.Builder builder =
        PermissionOuterClass.PermissionTuple.newBuilder()
            .setId(id)
            .setTenantId(tenantId)
            .setResourceType(EnumConverters.toProto(resourceType))
            .setResourceId(resourceId)
            .setRelation(EnumConverters.toProto(relation))
            .setSubjectType(EnumConverters.toProto(subjectType))
            .setSubjectId(subjectId)
            .setCreateTime(DbUtil.toProtoTimestamp(createTime));
    if (grantedBy != null) {
      builder.setGrantedBy(grantedBy);
    }
    if (expiresAt != null) {
      builder.setExpiresAt(DbUtil.toProtoTimestamp(expiresAt));
    }
    return builder.build();
  }
}
