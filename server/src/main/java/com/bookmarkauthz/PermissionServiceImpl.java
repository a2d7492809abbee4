package com.bookmarkauthz;

import bookmarkauthz.v1.BookmarkPermissionServiceGrpc.BookmarkPermissionServiceImplBase;
import bookmarkauthz.v1.PermissionOuterClass;
import bookmarkauthz.v1.PermissionOuterClass.CheckAccessRequest;
import bookmarkauthz.v1.PermissionOuterClass.CheckAccessResponse;
import bookmarkauthz.v1.PermissionOuterClass.ClaimOwnershipRequest;
import bookmarkauthz.v1.PermissionOuterClass.ClaimOwnershipResponse;
import bookmarkauthz.v1.PermissionOuterClass.DeleteResourcePermissionsRequest;
import bookmarkauthz.v1.PermissionOuterClass.DeleteResourcePermissionsResponse;
import bookmarkauthz.v1.PermissionOuterClass.ExportPermissionsRequest;
import bookmarkauthz.v1.PermissionOuterClass.ExportPermissionsResponse;
import bookmarkauthz.v1.PermissionOuterClass.GetEffectivePermissionsRequest;
import bookmarkauthz.v1.PermissionOuterClass.GetEffectivePermissionsResponse;
import bookmarkauthz.v1.PermissionOuterClass.GrantAccessRequest;
import bookmarkauthz.v1.PermissionOuterClass.GrantAccessResponse;
import bookmarkauthz.v1.PermissionOuterClass.ImportPermissionsRequest;
import bookmarkauthz.v1.PermissionOuterClass.ImportPermissionsResponse;
import bookmarkauthz.v1.PermissionOuterClass.ListAccessibleResourcesRequest;
import bookmarkauthz.v1.PermissionOuterClass.ListAccessibleResourcesResponse;
import bookmarkauthz.v1.PermissionOuterClass.ListPermissionsRequest;
import bookmarkauthz.v1.PermissionOuterClass.ListPermissionsResponse;
import bookmarkauthz.v1.PermissionOuterClass.RevokeAccessRequest;
import com.bookmarkauthz.authz.AccessibleResources;
import com.bookmarkauthz.authz.AuthorizationEngine;
import com.bookmarkauthz.authz.CheckResult;
import com.bookmarkauthz.authz.EffectivePermissions;
import com.bookmarkauthz.authz.ImportResult;
import com.bookmarkauthz.authz.Permission;
import com.bookmarkauthz.authz.Relation;
import com.bookmarkauthz.authz.ResourceType;
import com.bookmarkauthz.authz.SubjectType;
import com.bookmarkauthz.authz.TupleExport;
import com.bookmarkauthz.common.status.Status;
import com.bookmarkauthz.common.status.StatusOr;
import com.bookmarkauthz.db.PermissionTuple;
import com.bookmarkauthz.db.PermissionTuples;
import com.bookmarkauthz.db.util.DbUtil;
import com.bookmarkauthz.security.RequestContext;
import com.bookmarkauthz.security.RequestContextInterceptor;
import com.bookmarkauthz.util.EnumConverters;
import com.google.common.base.Strings;
import com.google.protobuf.Empty;
import io.grpc.Metadata;
import io.grpc.stub.StreamObserver;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.tinylog.Logger;

public class PermissionServiceImpl extends BookmarkPermissionServiceImplBase {
  static final int DEFAULT_PAGE_SIZE = 20;
  static final int MAX_PAGE_SIZE = 100;

  /** Trailer carrying the error taxonomy token of a failed call, e.g. {@code StoreUnavailable}. */
  public static final Metadata.Key<String> AUTHZ_ERROR_KEY =
      Metadata.Key.of("x-authz-error", Metadata.ASCII_STRING_MARSHALLER);

  private final Config config;

  /**
   * @param engine The authorization engine answering every call
   */
  public record Config(AuthorizationEngine engine) {}

  public PermissionServiceImpl(Config config) {
    this.config = config;
  }

  /**
   * Grants a relation on a resource to a user, role or tenant.
   *
   * <p>Possible error conditions:
   * - UNAUTHENTICATED: No caller identity on the call
   * - INVALID_ARGUMENT: Unrecognized enum, empty id, or malformed expiry
   * - PERMISSION_DENIED: Caller lacks SHARE, or the resource or tenant subject belongs elsewhere
   * - UNAVAILABLE: Identity directory or tuple store unreachable
   */
  @Override
  public void grantAccess(
      GrantAccessRequest request, StreamObserver<GrantAccessResponse> responseObserver) {
    RequestContext caller = requireCaller(responseObserver);
    if (caller == null) {
      return;
    }
    Logger.info(
        "Granting {} on {} to {}:{}",
        request.getRelation(), request.getResourceId(),
        request.getSubjectType(), request.getSubjectId());

    StatusOr<ResourceType> resourceTypeOr = EnumConverters.fromProto(request.getResourceType());
    if (resourceTypeOr.isNotOk()) {
      sendError(responseObserver, resourceTypeOr.getStatus());
      return;
    }
    StatusOr<Relation> relationOr = EnumConverters.fromProto(request.getRelation());
    if (relationOr.isNotOk()) {
      sendError(responseObserver, relationOr.getStatus());
      return;
    }
    StatusOr<SubjectType> subjectTypeOr = EnumConverters.fromProto(request.getSubjectType());
    if (subjectTypeOr.isNotOk()) {
      sendError(responseObserver, subjectTypeOr.getStatus());
      return;
    }

    Instant expiresAt = null;
    if (request.hasExpiresAt()) {
      try {
        expiresAt = DbUtil.fromProtoTimestamp(request.getExpiresAt());
      } catch (IllegalArgumentException e) {
        sendError(
            responseObserver, Status.invalidArgument("Invalid expires_at: " + e.getMessage()));
        return;
      }
    }

    StatusOr<PermissionTuple> tupleOr =
        config.engine().grant(
            caller,
            resourceTypeOr.getValue(),
            request.getResourceId(),
            relationOr.getValue(),
            subjectTypeOr.getValue(),
            request.getSubjectId(),
            expiresAt);
    if (tupleOr.isNotOk()) {
      sendError(responseObserver, tupleOr.getStatus());
      return;
    }

    responseObserver.onNext(
        GrantAccessResponse.newBuilder().setPermission(tupleOr.getValue().toProto()).build());
    responseObserver.onCompleted();
  }

  /**
   * Revokes one relation, or every relation when none is given, of a subject on a resource.
   * Revoking a grant that does not exist succeeds.
   */
  @Override
  public void revokeAccess(RevokeAccessRequest request, StreamObserver<Empty> responseObserver) {
    RequestContext caller = requireCaller(responseObserver);
    if (caller == null) {
      return;
    }
    Logger.info(
        "Revoking {} on {} from {}:{}",
        request.hasRelation() ? request.getRelation() : "all relations",
        request.getResourceId(), request.getSubjectType(), request.getSubjectId());

    StatusOr<ResourceType> resourceTypeOr = EnumConverters.fromProto(request.getResourceType());
    if (resourceTypeOr.isNotOk()) {
      sendError(responseObserver, resourceTypeOr.getStatus());
      return;
    }
    StatusOr<SubjectType> subjectTypeOr = EnumConverters.fromProto(request.getSubjectType());
    if (subjectTypeOr.isNotOk()) {
      sendError(responseObserver, subjectTypeOr.getStatus());
      return;
    }
    Relation relation = null;
    if (request.hasRelation()) {
      StatusOr<Relation> relationOr = EnumConverters.fromProto(request.getRelation());
      if (relationOr.isNotOk()) {
        sendError(responseObserver, relationOr.getStatus());
        return;
      }
      relation = relationOr.getValue();
    }

    StatusOr<Integer> deletedOr =
        config.engine().revoke(
            caller,
            resourceTypeOr.getValue(),
            request.getResourceId(),
            subjectTypeOr.getValue(),
            request.getSubjectId(),
            relation);
    if (deletedOr.isNotOk()) {
      sendError(responseObserver, deletedOr.getStatus());
      return;
    }

    responseObserver.onNext(Empty.getDefaultInstance());
    responseObserver.onCompleted();
  }

  /** Lists the caller's tenant's raw tuples, newest first, expired ones included. */
  @Override
  public void listPermissions(
      ListPermissionsRequest request, StreamObserver<ListPermissionsResponse> responseObserver) {
    RequestContext caller = requireCaller(responseObserver);
    if (caller == null) {
      return;
    }
    Logger.info("Listing permissions for tenant {}", caller.tenantId());

    ResourceType resourceType = null;
    if (request.hasResourceType()) {
      StatusOr<ResourceType> resourceTypeOr = EnumConverters.fromProto(request.getResourceType());
      if (resourceTypeOr.isNotOk()) {
        sendError(responseObserver, resourceTypeOr.getStatus());
        return;
      }
      resourceType = resourceTypeOr.getValue();
    }
    SubjectType subjectType = null;
    if (request.hasSubjectType()) {
      StatusOr<SubjectType> subjectTypeOr = EnumConverters.fromProto(request.getSubjectType());
      if (subjectTypeOr.isNotOk()) {
        sendError(responseObserver, subjectTypeOr.getStatus());
        return;
      }
      subjectType = subjectTypeOr.getValue();
    }

    int pageSize = pageSize(request.hasPageSize(), request.getPageSize());
    long offset = offset(request.hasPage(), request.getPage(), pageSize);

    StatusOr<PermissionTuples.QueryResult> resultOr =
        config.engine().listTuples(
            caller.tenantId(),
            resourceType,
            request.hasResourceId() ? request.getResourceId() : null,
            subjectType,
            request.hasSubjectId() ? request.getSubjectId() : null,
            offset,
            pageSize);
    if (resultOr.isNotOk()) {
      sendError(responseObserver, resultOr.getStatus());
      return;
    }

    PermissionTuples.QueryResult result = resultOr.getValue();
    ListPermissionsResponse.Builder responseBuilder =
        ListPermissionsResponse.newBuilder().setTotal((int) result.getTotalCount());
    for (PermissionTuple tuple : result.getTuples()) {
      responseBuilder.addPermissions(tuple.toProto());
    }
    responseObserver.onNext(responseBuilder.build());
    responseObserver.onCompleted();
  }

  /**
   * Checks a permission. A denial is a successful response with {@code allowed = false} and a
   * reason; only validation and infrastructure faults fail the call.
   */
  @Override
  public void checkAccess(
      CheckAccessRequest request, StreamObserver<CheckAccessResponse> responseObserver) {
    RequestContext caller = requireCaller(responseObserver);
    if (caller == null) {
      return;
    }
    String userId = userIdOrCaller(request.getUserId(), caller);
    Logger.info(
        "Checking {} on {} for user {}", request.getPermission(), request.getResourceId(), userId);

    StatusOr<ResourceType> resourceTypeOr = EnumConverters.fromProto(request.getResourceType());
    if (resourceTypeOr.isNotOk()) {
      sendError(responseObserver, resourceTypeOr.getStatus());
      return;
    }
    StatusOr<Permission> permissionOr = EnumConverters.fromProto(request.getPermission());
    if (permissionOr.isNotOk()) {
      sendError(responseObserver, permissionOr.getStatus());
      return;
    }

    StatusOr<CheckResult> resultOr =
        config.engine().check(
            caller.tenantId(),
            userId,
            resourceTypeOr.getValue(),
            request.getResourceId(),
            permissionOr.getValue());
    if (resultOr.isNotOk()) {
      sendError(responseObserver, resultOr.getStatus());
      return;
    }

    CheckResult result = resultOr.getValue();
    CheckAccessResponse.Builder responseBuilder =
        CheckAccessResponse.newBuilder().setAllowed(result.allowed());
    result.denialReason()
        .ifPresent(reason -> responseBuilder.setReason(EnumConverters.toProto(reason)));
    result.relation()
        .ifPresent(
            relation -> responseBuilder.setMatchedRelation(EnumConverters.toProto(relation)));
    responseObserver.onNext(responseBuilder.build());
    responseObserver.onCompleted();
  }

  /** Lists, one page at a time, the resources a user can reach with a permission. */
  @Override
  public void listAccessibleResources(
      ListAccessibleResourcesRequest request,
      StreamObserver<ListAccessibleResourcesResponse> responseObserver) {
    RequestContext caller = requireCaller(responseObserver);
    if (caller == null) {
      return;
    }
    String userId = userIdOrCaller(request.getUserId(), caller);
    Logger.info("Listing resources user {} can {}", userId, request.getPermission());

    StatusOr<ResourceType> resourceTypeOr = EnumConverters.fromProto(request.getResourceType());
    if (resourceTypeOr.isNotOk()) {
      sendError(responseObserver, resourceTypeOr.getStatus());
      return;
    }
    StatusOr<Permission> permissionOr = EnumConverters.fromProto(request.getPermission());
    if (permissionOr.isNotOk()) {
      sendError(responseObserver, permissionOr.getStatus());
      return;
    }

    int pageSize = pageSize(request.hasPageSize(), request.getPageSize());
    long offset = offset(request.hasPage(), request.getPage(), pageSize);

    StatusOr<AccessibleResources> resourcesOr =
        config.engine().listAccessibleResources(
            caller.tenantId(),
            userId,
            resourceTypeOr.getValue(),
            permissionOr.getValue(),
            offset,
            pageSize);
    if (resourcesOr.isNotOk()) {
      sendError(responseObserver, resourcesOr.getStatus());
      return;
    }

    AccessibleResources resources = resourcesOr.getValue();
    responseObserver.onNext(
        ListAccessibleResourcesResponse.newBuilder()
            .addAllResourceIds(resources.resourceIds())
            .setTotal((int) resources.total())
            .build());
    responseObserver.onCompleted();
  }

  /** Returns every permission a user holds on a resource and the highest relation behind them. */
  @Override
  public void getEffectivePermissions(
      GetEffectivePermissionsRequest request,
      StreamObserver<GetEffectivePermissionsResponse> responseObserver) {
    RequestContext caller = requireCaller(responseObserver);
    if (caller == null) {
      return;
    }
    String userId = userIdOrCaller(request.getUserId(), caller);
    Logger.info(
        "Computing effective permissions on {} for user {}", request.getResourceId(), userId);

    StatusOr<ResourceType> resourceTypeOr = EnumConverters.fromProto(request.getResourceType());
    if (resourceTypeOr.isNotOk()) {
      sendError(responseObserver, resourceTypeOr.getStatus());
      return;
    }

    StatusOr<EffectivePermissions> effectiveOr =
        config.engine().getEffectivePermissions(
            caller.tenantId(), userId, resourceTypeOr.getValue(), request.getResourceId());
    if (effectiveOr.isNotOk()) {
      sendError(responseObserver, effectiveOr.getStatus());
      return;
    }

    EffectivePermissions effective = effectiveOr.getValue();
    GetEffectivePermissionsResponse.Builder responseBuilder =
        GetEffectivePermissionsResponse.newBuilder();
    for (Permission permission : effective.permissions()) {
      responseBuilder.addPermissions(EnumConverters.toProto(permission));
    }
    effective.highest()
        .ifPresent(
            relation -> responseBuilder.setHighestRelation(EnumConverters.toProto(relation)));
    responseObserver.onNext(responseBuilder.build());
    responseObserver.onCompleted();
  }

  /** Makes the caller OWNER of a resource that no tenant governs yet. */
  @Override
  public void claimOwnership(
      ClaimOwnershipRequest request, StreamObserver<ClaimOwnershipResponse> responseObserver) {
    RequestContext caller = requireCaller(responseObserver);
    if (caller == null) {
      return;
    }
    Logger.info("User {} claiming {}", caller.userId(), request.getResourceId());

    StatusOr<ResourceType> resourceTypeOr = EnumConverters.fromProto(request.getResourceType());
    if (resourceTypeOr.isNotOk()) {
      sendError(responseObserver, resourceTypeOr.getStatus());
      return;
    }

    StatusOr<PermissionTuple> tupleOr =
        config.engine().claimOwnership(caller, resourceTypeOr.getValue(), request.getResourceId());
    if (tupleOr.isNotOk()) {
      sendError(responseObserver, tupleOr.getStatus());
      return;
    }

    responseObserver.onNext(
        ClaimOwnershipResponse.newBuilder().setPermission(tupleOr.getValue().toProto()).build());
    responseObserver.onCompleted();
  }

  /** Removes every tuple on a deleted resource. The caller must hold DELETE on it. */
  @Override
  public void deleteResourcePermissions(
      DeleteResourcePermissionsRequest request,
      StreamObserver<DeleteResourcePermissionsResponse> responseObserver) {
    RequestContext caller = requireCaller(responseObserver);
    if (caller == null) {
      return;
    }
    Logger.info("Deleting all permissions on {}", request.getResourceId());

    StatusOr<ResourceType> resourceTypeOr = EnumConverters.fromProto(request.getResourceType());
    if (resourceTypeOr.isNotOk()) {
      sendError(responseObserver, resourceTypeOr.getStatus());
      return;
    }

    StatusOr<Integer> deletedOr =
        config.engine().deleteResourcePermissions(
            caller, resourceTypeOr.getValue(), request.getResourceId());
    if (deletedOr.isNotOk()) {
      sendError(responseObserver, deletedOr.getStatus());
      return;
    }

    responseObserver.onNext(
        DeleteResourcePermissionsResponse.newBuilder()
            .setDeletedCount(deletedOr.getValue())
            .build());
    responseObserver.onCompleted();
  }

  /**
   * Exports stored tuples for backup.
   *
   * <p>Possible error conditions:
   * - UNAUTHENTICATED: No caller identity on the call
   * - PERMISSION_DENIED: Another tenant was named by a caller who is not a platform administrator
   * - UNAVAILABLE: Tuple store unreachable
   */
  @Override
  public void exportPermissions(
      ExportPermissionsRequest request,
      StreamObserver<ExportPermissionsResponse> responseObserver) {
    RequestContext caller = requireCaller(responseObserver);
    if (caller == null) {
      return;
    }
    Logger.info(
        "Exporting permissions of {}",
        request.hasTenantId() ? "tenant " + request.getTenantId() : "the caller's scope");

    StatusOr<TupleExport> exportOr =
        config.engine().exportTuples(caller, request.hasTenantId() ? request.getTenantId() : null);
    if (exportOr.isNotOk()) {
      sendError(responseObserver, exportOr.getStatus());
      return;
    }

    TupleExport export = exportOr.getValue();
    ExportPermissionsResponse.Builder responseBuilder =
        ExportPermissionsResponse.newBuilder()
            .setTenantId(export.tenantId())
            .setFullExport(export.fullExport())
            .setExportedAt(DbUtil.toProtoTimestamp(export.exportedAt()));
    for (PermissionTuple tuple : export.tuples()) {
      responseBuilder.addPermissions(tuple.toProto());
    }
    responseObserver.onNext(responseBuilder.build());
    responseObserver.onCompleted();
  }

  /**
   * Restores tuples from a backup. Tuples that cannot be restored are reported in the response,
   * not as a failed call.
   *
   * <p>Possible error conditions:
   * - UNAUTHENTICATED: No caller identity on the call
   * - INVALID_ARGUMENT: Unrecognized enum or malformed timestamp in any tuple
   * - PERMISSION_DENIED: Caller is not a platform administrator
   * - UNAVAILABLE: Tuple store unreachable
   */
  @Override
  public void importPermissions(
      ImportPermissionsRequest request,
      StreamObserver<ImportPermissionsResponse> responseObserver) {
    RequestContext caller = requireCaller(responseObserver);
    if (caller == null) {
      return;
    }
    Logger.info(
        "Importing {} permissions in {}", request.getPermissionsCount(), request.getMode());

    StatusOr<PermissionTuples.ImportMode> modeOr = EnumConverters.fromProto(request.getMode());
    if (modeOr.isNotOk()) {
      sendError(responseObserver, modeOr.getStatus());
      return;
    }
    List<PermissionTuple> tuples = new ArrayList<>();
    for (PermissionOuterClass.PermissionTuple proto : request.getPermissionsList()) {
      StatusOr<PermissionTuple> tupleOr = fromProto(proto);
      if (tupleOr.isNotOk()) {
        sendError(responseObserver, tupleOr.getStatus());
        return;
      }
      tuples.add(tupleOr.getValue());
    }

    StatusOr<ImportResult> resultOr =
        config.engine().importTuples(caller, tuples, modeOr.getValue());
    if (resultOr.isNotOk()) {
      sendError(responseObserver, resultOr.getStatus());
      return;
    }

    ImportResult result = resultOr.getValue();
    responseObserver.onNext(
        ImportPermissionsResponse.newBuilder()
            .setSuccess(result.success())
            .setTotal(result.total())
            .setCreated(result.created())
            .setUpdated(result.updated())
            .setSkipped(result.skipped())
            .setFailed(result.failed())
            .addAllWarnings(result.warnings())
            .build());
    responseObserver.onCompleted();
  }

  /** Reads a tuple to restore; its id and create time are not kept. */
  private static StatusOr<PermissionTuple> fromProto(PermissionOuterClass.PermissionTuple proto) {
    StatusOr<ResourceType> resourceTypeOr = EnumConverters.fromProto(proto.getResourceType());
    if (resourceTypeOr.isNotOk()) {
      return StatusOr.ofStatus(resourceTypeOr.getStatus());
    }
    StatusOr<Relation> relationOr = EnumConverters.fromProto(proto.getRelation());
    if (relationOr.isNotOk()) {
      return StatusOr.ofStatus(relationOr.getStatus());
    }
    StatusOr<SubjectType> subjectTypeOr = EnumConverters.fromProto(proto.getSubjectType());
    if (subjectTypeOr.isNotOk()) {
      return StatusOr.ofStatus(subjectTypeOr.getStatus());
    }

    Instant expiresAt = null;
    if (proto.hasExpiresAt()) {
      try {
        expiresAt = DbUtil.fromProtoTimestamp(proto.getExpiresAt());
      } catch (IllegalArgumentException e) {
        return StatusOr.ofStatus(
            Status.invalidArgument("Invalid expires_at: " + e.getMessage()));
      }
    }

    return StatusOr.ofValue(
        new PermissionTuple(
            0L,
            proto.getTenantId(),
            resourceTypeOr.getValue(),
            proto.getResourceId(),
            relationOr.getValue(),
            subjectTypeOr.getValue(),
            proto.getSubjectId(),
            proto.hasGrantedBy() ? proto.getGrantedBy() : null,
            expiresAt,
            Instant.EPOCH));
  }

  /** Returns the caller of this call, or fails the call and returns null. */
  private static RequestContext requireCaller(StreamObserver<?> responseObserver) {
    RequestContext caller = RequestContextInterceptor.REQUEST_CONTEXT_KEY.get();
    if (caller == null) {
      Logger.error("No request context found");
      responseObserver.onError(
          io.grpc.Status.UNAUTHENTICATED
              .withDescription("Caller identity required")
              .asRuntimeException());
    }
    return caller;
  }

  private static String userIdOrCaller(String userId, RequestContext caller) {
    return Strings.isNullOrEmpty(userId) ? caller.userId() : userId;
  }

  /** Clamps the requested page size; the wire value is unsigned. */
  static int pageSize(boolean hasPageSize, int requested) {
    if (!hasPageSize) {
      return DEFAULT_PAGE_SIZE;
    }
    long size = Integer.toUnsignedLong(requested);
    return (int) Math.max(1L, Math.min(MAX_PAGE_SIZE, size));
  }

  /** Rows to skip for a 1-based page; the wire value is unsigned. */
  static long offset(boolean hasPage, int requested, int pageSize) {
    long page = hasPage ? Math.max(1L, Integer.toUnsignedLong(requested)) : 1L;
    return (page - 1) * pageSize;
  }

  /** Fails the call with the gRPC status of the same code, with the error token as a trailer. */
  private static void sendError(StreamObserver<?> responseObserver, Status status) {
    Logger.warn("Request failed: {}", status);
    Metadata trailers = new Metadata();
    if (status.getReason() != null) {
      trailers.put(AUTHZ_ERROR_KEY, status.getReason());
    }
    responseObserver.onError(
        io.grpc.Status.fromCode(status.getCode().toGrpcCode())
            .withDescription(status.getMessage())
            .asRuntimeException(trailers));
  }
}
