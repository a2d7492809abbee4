package com.bookmarkauthz.util;

import bookmarkauthz.v1.PermissionOuterClass;
import com.bookmarkauthz.common.status.StatusOr;
import com.bookmarkauthz.rest.dto.PermissionTupleResponse;
import com.google.common.base.Strings;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import javax.annotation.Nullable;

/** Conversions between permission API Protobuf messages and their REST shapes. */
public final class RestMapper {

  private RestMapper() {
    // Utility class, no instances
  }

  public static PermissionTupleResponse toDto(PermissionOuterClass.PermissionTuple tuple) {
    return new PermissionTupleResponse(
        tuple.getId(),
        tuple.getTenantId(),
        tuple.getResourceType().name(),
        tuple.getResourceId(),
        tuple.getRelation().name(),
        tuple.getSubjectType().name(),
        tuple.getSubjectId(),
        tuple.hasGrantedBy() ? tuple.getGrantedBy() : null,
        tuple.hasExpiresAt() ? Timestamps.toMillis(tuple.getExpiresAt()) : null,
        Timestamps.toMillis(tuple.getCreateTime()));
  }

  /**
   * Converts a REST tuple back to its Protobuf form for restoring. Enum tokens are parsed the way
   * request fields are; the id and create time are dropped.
   */
  public static StatusOr<PermissionOuterClass.PermissionTuple> fromDto(
      PermissionTupleResponse dto) {
    StatusOr<PermissionOuterClass.ResourceType> resourceTypeOr =
        EnumConverters.parseToken(
            PermissionOuterClass.ResourceType.class, dto.resourceType(), "resourceType");
    if (resourceTypeOr.isNotOk()) {
      return StatusOr.ofStatus(resourceTypeOr.getStatus());
    }
    StatusOr<PermissionOuterClass.Relation> relationOr =
        EnumConverters.parseToken(PermissionOuterClass.Relation.class, dto.relation(), "relation");
    if (relationOr.isNotOk()) {
      return StatusOr.ofStatus(relationOr.getStatus());
    }
    StatusOr<PermissionOuterClass.SubjectType> subjectTypeOr =
        EnumConverters.parseToken(
            PermissionOuterClass.SubjectType.class, dto.subjectType(), "subjectType");
    if (subjectTypeOr.isNotOk()) {
      return StatusOr.ofStatus(subjectTypeOr.getStatus());
    }

    PermissionOuterClass.PermissionTuple.Builder builder =
        PermissionOuterClass.PermissionTuple.newBuilder()
            .setTenantId(dto.tenantId() == null ? 0 : dto.tenantId())
            .setResourceType(resourceTypeOr.getValue())
            .setResourceId(Strings.nullToEmpty(dto.resourceId()))
            .setRelation(relationOr.getValue())
            .setSubjectType(subjectTypeOr.getValue())
            .setSubjectId(Strings.nullToEmpty(dto.subjectId()));
    if (dto.grantedBy() != null) {
      builder.setGrantedBy(dto.grantedBy());
    }
    if (dto.expiresAt() != null) {
      builder.setExpiresAt(Timestamps.fromMillis(dto.expiresAt()));
    }
    return StatusOr.ofValue(builder.build());
  }

  /** Converts epoch milliseconds to a Timestamp, or null when absent. */
  @Nullable
  public static Timestamp fromMillis(@Nullable Long epochMillis) {
    return epochMillis == null ? null : Timestamps.fromMillis(epochMillis);
  }
}
