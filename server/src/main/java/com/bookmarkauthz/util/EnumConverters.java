package com.bookmarkauthz.util;

import bookmarkauthz.v1.PermissionOuterClass;
import com.bookmarkauthz.authz.AuthzError;
import com.bookmarkauthz.authz.DenialReason;
import com.bookmarkauthz.authz.Permission;
import com.bookmarkauthz.authz.Relation;
import com.bookmarkauthz.authz.ResourceType;
import com.bookmarkauthz.authz.SubjectType;
import com.bookmarkauthz.common.status.StatusOr;
import com.bookmarkauthz.db.PermissionTuples.ImportMode;
import com.google.common.base.Strings;
import java.util.Optional;

/**
 * Conversions between the wire enums of the permission API and the engine's closed enums.
 *
 * <p>Every switch here names each constant explicitly, so adding a constant on either side fails
 * compilation until it is mapped. The UNSPECIFIED zero values and unrecognized wire numbers are
 * rejected as {@link AuthzError#INVALID_ENUM}.
 */
public final class EnumConverters {

  private EnumConverters() {
    // Utility class, no instances
  }

  public static PermissionOuterClass.ResourceType toProto(ResourceType resourceType) {
    return switch (resourceType) {
      case BOOKMARK -> PermissionOuterClass.ResourceType.RESOURCE_TYPE_BOOKMARK;
    };
  }

  public static PermissionOuterClass.Relation toProto(Relation relation) {
    return switch (relation) {
      case OWNER -> PermissionOuterClass.Relation.RELATION_OWNER;
      case EDITOR -> PermissionOuterClass.Relation.RELATION_EDITOR;
      case VIEWER -> PermissionOuterClass.Relation.RELATION_VIEWER;
      case SHARER -> PermissionOuterClass.Relation.RELATION_SHARER;
    };
  }

  public static PermissionOuterClass.SubjectType toProto(SubjectType subjectType) {
    return switch (subjectType) {
      case USER -> PermissionOuterClass.SubjectType.SUBJECT_TYPE_USER;
      case ROLE -> PermissionOuterClass.SubjectType.SUBJECT_TYPE_ROLE;
      case TENANT -> PermissionOuterClass.SubjectType.SUBJECT_TYPE_TENANT;
    };
  }

  public static PermissionOuterClass.Permission toProto(Permission permission) {
    return switch (permission) {
      case READ -> PermissionOuterClass.Permission.PERMISSION_READ;
      case WRITE -> PermissionOuterClass.Permission.PERMISSION_WRITE;
      case DELETE -> PermissionOuterClass.Permission.PERMISSION_DELETE;
      case SHARE -> PermissionOuterClass.Permission.PERMISSION_SHARE;
    };
  }

  public static PermissionOuterClass.DenialReason toProto(DenialReason reason) {
    return switch (reason) {
      case TENANT_MISMATCH -> PermissionOuterClass.DenialReason.DENIAL_REASON_TENANT_MISMATCH;
      case NO_GRANT -> PermissionOuterClass.DenialReason.DENIAL_REASON_NO_GRANT;
      case EXPIRED -> PermissionOuterClass.DenialReason.DENIAL_REASON_EXPIRED;
      case INSUFFICIENT_RELATION ->
          PermissionOuterClass.DenialReason.DENIAL_REASON_INSUFFICIENT_RELATION;
    };
  }

  public static StatusOr<ResourceType> fromProto(PermissionOuterClass.ResourceType resourceType) {
    return switch (resourceType) {
      case RESOURCE_TYPE_BOOKMARK -> StatusOr.ofValue(ResourceType.BOOKMARK);
      case RESOURCE_TYPE_UNSPECIFIED, UNRECOGNIZED -> invalid("resource_type", resourceType);
    };
  }

  public static StatusOr<Relation> fromProto(PermissionOuterClass.Relation relation) {
    return switch (relation) {
      case RELATION_OWNER -> StatusOr.ofValue(Relation.OWNER);
      case RELATION_EDITOR -> StatusOr.ofValue(Relation.EDITOR);
      case RELATION_VIEWER -> StatusOr.ofValue(Relation.VIEWER);
      case RELATION_SHARER -> StatusOr.ofValue(Relation.SHARER);
      case RELATION_UNSPECIFIED, UNRECOGNIZED -> invalid("relation", relation);
    };
  }

  public static StatusOr<SubjectType> fromProto(PermissionOuterClass.SubjectType subjectType) {
    return switch (subjectType) {
      case SUBJECT_TYPE_USER -> StatusOr.ofValue(SubjectType.USER);
      case SUBJECT_TYPE_ROLE -> StatusOr.ofValue(SubjectType.ROLE);
      case SUBJECT_TYPE_TENANT -> StatusOr.ofValue(SubjectType.TENANT);
      case SUBJECT_TYPE_UNSPECIFIED, UNRECOGNIZED -> invalid("subject_type", subjectType);
    };
  }

  public static StatusOr<Permission> fromProto(PermissionOuterClass.Permission permission) {
    return switch (permission) {
      case PERMISSION_READ -> StatusOr.ofValue(Permission.READ);
      case PERMISSION_WRITE -> StatusOr.ofValue(Permission.WRITE);
      case PERMISSION_DELETE -> StatusOr.ofValue(Permission.DELETE);
      case PERMISSION_SHARE -> StatusOr.ofValue(Permission.SHARE);
      case PERMISSION_UNSPECIFIED, UNRECOGNIZED -> invalid("permission", permission);
    };
  }

  /** The unset value imports in skip mode. */
  public static StatusOr<ImportMode> fromProto(PermissionOuterClass.ImportMode mode) {
    return switch (mode) {
      case IMPORT_MODE_UNSPECIFIED, IMPORT_MODE_SKIP -> StatusOr.ofValue(ImportMode.SKIP);
      case IMPORT_MODE_OVERWRITE -> StatusOr.ofValue(ImportMode.OVERWRITE);
      case UNRECOGNIZED -> invalid("mode", mode);
    };
  }

  /** Returns the engine's reason for a wire reason, or empty for the unset value. */
  public static Optional<DenialReason> fromProto(PermissionOuterClass.DenialReason reason) {
    return switch (reason) {
      case DENIAL_REASON_TENANT_MISMATCH -> Optional.of(DenialReason.TENANT_MISMATCH);
      case DENIAL_REASON_NO_GRANT -> Optional.of(DenialReason.NO_GRANT);
      case DENIAL_REASON_EXPIRED -> Optional.of(DenialReason.EXPIRED);
      case DENIAL_REASON_INSUFFICIENT_RELATION -> Optional.of(DenialReason.INSUFFICIENT_RELATION);
      case DENIAL_REASON_UNSPECIFIED, UNRECOGNIZED -> Optional.empty();
    };
  }

  /**
   * Parses a wire token such as {@code RELATION_OWNER} into the proto enum of the given class.
   * Matching is case-insensitive. Empty, unknown and {@code UNRECOGNIZED} tokens are rejected.
   *
   * @param enumClass the proto enum class
   * @param token the token from a REST request
   * @param field the request field name, used in the error message
   */
  public static <E extends Enum<E>> StatusOr<E> parseToken(
      Class<E> enumClass, String token, String field) {
    if (Strings.isNullOrEmpty(token)) {
      return StatusOr.ofStatus(AuthzError.INVALID_ENUM.toStatus(field + " is required"));
    }
    String normalized = token.trim().toUpperCase();
    if (normalized.equals("UNRECOGNIZED")) {
      return StatusOr.ofStatus(
          AuthzError.INVALID_ENUM.toStatus("unrecognized " + field + ": " + token));
    }
    try {
      return StatusOr.ofValue(Enum.valueOf(enumClass, normalized));
    } catch (IllegalArgumentException e) {
      return StatusOr.ofStatus(
          AuthzError.INVALID_ENUM.toStatus("unrecognized " + field + ": " + token));
    }
  }

  private static <T> StatusOr<T> invalid(String field, Enum<?> value) {
    return StatusOr.ofStatus(AuthzError.INVALID_ENUM.toStatus("invalid " + field + ": " + value));
  }
}
