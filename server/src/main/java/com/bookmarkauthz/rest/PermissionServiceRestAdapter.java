package com.bookmarkauthz.rest;

import bookmarkauthz.v1.BookmarkPermissionServiceGrpc;
import bookmarkauthz.v1.PermissionOuterClass;
import com.bookmarkauthz.authz.DenialReason;
import com.bookmarkauthz.common.status.Status;
import com.bookmarkauthz.common.status.StatusOr;
import com.bookmarkauthz.rest.dto.CheckAccessRequest;
import com.bookmarkauthz.rest.dto.CheckAccessResponse;
import com.bookmarkauthz.rest.dto.ClaimOwnershipRequest;
import com.bookmarkauthz.rest.dto.DeleteResourcePermissionsResponse;
import com.bookmarkauthz.rest.dto.EffectivePermissionsResponse;
import com.bookmarkauthz.rest.dto.ExportPermissionsResponse;
import com.bookmarkauthz.rest.dto.GrantAccessRequest;
import com.bookmarkauthz.rest.dto.ImportPermissionsRequest;
import com.bookmarkauthz.rest.dto.ImportPermissionsResponse;
import com.bookmarkauthz.rest.dto.ListAccessibleResourcesResponse;
import com.bookmarkauthz.rest.dto.ListPermissionsResponse;
import com.bookmarkauthz.rest.dto.PermissionTupleResponse;
import com.bookmarkauthz.util.EnumConverters;
import com.bookmarkauthz.util.RestMapper;
import com.google.common.base.Strings;
import com.google.common.primitives.Ints;
import com.google.protobuf.util.Timestamps;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.MetadataUtils;
import io.javalin.http.Context;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiParam;
import io.javalin.openapi.OpenApiRequestBody;
import io.javalin.openapi.OpenApiResponse;
import java.util.List;
import java.util.Optional;
import org.tinylog.Logger;

/**
 * REST adapter for the permission endpoints under {@code /v1/permissions}.
 *
 * <p>Enum tokens are validated here so malformed requests are rejected with 400 before any gRPC
 * call. Everything else is decided by the gRPC service; its failures are mapped back to HTTP
 * codes with the taxonomy token in the {@code reason} field.
 */
public class PermissionServiceRestAdapter implements RestAdapter {

  private final BookmarkPermissionServiceGrpc.BookmarkPermissionServiceBlockingStub
      permissionService;

  /**
   * Creates a new PermissionServiceRestAdapter with the specified gRPC service stub.
   *
   * @param permissionService The gRPC service stub to delegate to
   */
  public PermissionServiceRestAdapter(
      BookmarkPermissionServiceGrpc.BookmarkPermissionServiceBlockingStub permissionService) {
    this.permissionService = permissionService;
  }

  @Override
  public void registerRoutes() {
    // No implementation required - route registration is handled by the caller
  }

  @OpenApi(
      path = "/v1/permissions",
      methods = {HttpMethod.POST},
      summary = "Grant access",
      description =
          "Grants a relation on a resource to a user, role or the caller's tenant. Granting an"
              + " existing relation again replaces its expiry. The caller must hold SHARE on the"
              + " resource.",
      operationId = "grantAccess",
      tags = "Permissions",
      requestBody =
          @OpenApiRequestBody(
              description = "The grant",
              required = true,
              content =
                  @OpenApiContent(
                      from = GrantAccessRequest.class,
                      example =
                          """
              {
                "resourceType": "RESOURCE_TYPE_BOOKMARK",
                "resourceId": "b1",
                "relation": "RELATION_EDITOR",
                "subjectType": "SUBJECT_TYPE_USER",
                "subjectId": "42"
              }
              """)),
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The stored tuple",
            content = @OpenApiContent(from = PermissionTupleResponse.class)),
        @OpenApiResponse(status = "400", description = "Unrecognized enum token or missing id"),
        @OpenApiResponse(
            status = "403",
            description = "Caller lacks SHARE, or the resource belongs to another tenant"),
        @OpenApiResponse(status = "503", description = "Identity directory or store unavailable")
      })
  public void handleGrantAccess(Context ctx) {
    Logger.info("REST GrantAccess request");
    GrantAccessRequest requestDto = ctx.bodyAsClass(GrantAccessRequest.class);

    StatusOr<PermissionOuterClass.ResourceType> resourceTypeOr =
        EnumConverters.parseToken(
            PermissionOuterClass.ResourceType.class, requestDto.resourceType(), "resourceType");
    if (resourceTypeOr.isNotOk()) {
      setError(ctx, resourceTypeOr.getStatus());
      return;
    }
    StatusOr<PermissionOuterClass.Relation> relationOr =
        EnumConverters.parseToken(
            PermissionOuterClass.Relation.class, requestDto.relation(), "relation");
    if (relationOr.isNotOk()) {
      setError(ctx, relationOr.getStatus());
      return;
    }
    StatusOr<PermissionOuterClass.SubjectType> subjectTypeOr =
        EnumConverters.parseToken(
            PermissionOuterClass.SubjectType.class, requestDto.subjectType(), "subjectType");
    if (subjectTypeOr.isNotOk()) {
      setError(ctx, subjectTypeOr.getStatus());
      return;
    }

    PermissionOuterClass.GrantAccessRequest.Builder requestBuilder =
        PermissionOuterClass.GrantAccessRequest.newBuilder()
            .setResourceType(resourceTypeOr.getValue())
            .setResourceId(Strings.nullToEmpty(requestDto.resourceId()))
            .setRelation(relationOr.getValue())
            .setSubjectType(subjectTypeOr.getValue())
            .setSubjectId(Strings.nullToEmpty(requestDto.subjectId()));
    if (requestDto.expiresAt() != null) {
      requestBuilder.setExpiresAt(RestMapper.fromMillis(requestDto.expiresAt()));
    }

    try {
      PermissionOuterClass.GrantAccessResponse response =
          stub(ctx).grantAccess(requestBuilder.build());
      ctx.json(RestMapper.toDto(response.getPermission()));
    } catch (StatusRuntimeException e) {
      setError(ctx, e);
    }
  }

  @OpenApi(
      path = "/v1/permissions",
      methods = {HttpMethod.DELETE},
      summary = "Revoke access",
      description =
          "Revokes one relation of a subject on a resource, or all of them when no relation is"
              + " given. Revoking a grant that does not exist succeeds.",
      operationId = "revokeAccess",
      tags = "Permissions",
      queryParams = {
        @OpenApiParam(name = "resourceType", required = true, example = "RESOURCE_TYPE_BOOKMARK"),
        @OpenApiParam(name = "resourceId", required = true, example = "b1"),
        @OpenApiParam(name = "subjectType", required = true, example = "SUBJECT_TYPE_USER"),
        @OpenApiParam(name = "subjectId", required = true, example = "42"),
        @OpenApiParam(
            name = "relation",
            description = "Relation to revoke. Omit to revoke every relation of the subject.",
            example = "RELATION_VIEWER")
      },
      responses = {
        @OpenApiResponse(status = "204", description = "Revoked, or nothing to revoke"),
        @OpenApiResponse(status = "400", description = "Unrecognized enum token"),
        @OpenApiResponse(status = "403", description = "Caller lacks SHARE on the resource")
      })
  public void handleRevokeAccess(Context ctx) {
    Logger.info("REST RevokeAccess request");

    StatusOr<PermissionOuterClass.ResourceType> resourceTypeOr =
        EnumConverters.parseToken(
            PermissionOuterClass.ResourceType.class,
            ctx.queryParam("resourceType"),
            "resourceType");
    if (resourceTypeOr.isNotOk()) {
      setError(ctx, resourceTypeOr.getStatus());
      return;
    }
    StatusOr<PermissionOuterClass.SubjectType> subjectTypeOr =
        EnumConverters.parseToken(
            PermissionOuterClass.SubjectType.class, ctx.queryParam("subjectType"), "subjectType");
    if (subjectTypeOr.isNotOk()) {
      setError(ctx, subjectTypeOr.getStatus());
      return;
    }

    PermissionOuterClass.RevokeAccessRequest.Builder requestBuilder =
        PermissionOuterClass.RevokeAccessRequest.newBuilder()
            .setResourceType(resourceTypeOr.getValue())
            .setResourceId(Strings.nullToEmpty(ctx.queryParam("resourceId")))
            .setSubjectType(subjectTypeOr.getValue())
            .setSubjectId(Strings.nullToEmpty(ctx.queryParam("subjectId")));
    String relation = ctx.queryParam("relation");
    if (!Strings.isNullOrEmpty(relation)) {
      StatusOr<PermissionOuterClass.Relation> relationOr =
          EnumConverters.parseToken(PermissionOuterClass.Relation.class, relation, "relation");
      if (relationOr.isNotOk()) {
        setError(ctx, relationOr.getStatus());
        return;
      }
      requestBuilder.setRelation(relationOr.getValue());
    }

    try {
      stub(ctx).revokeAccess(requestBuilder.build());
      ctx.status(204);
    } catch (StatusRuntimeException e) {
      setError(ctx, e);
    }
  }

  @OpenApi(
      path = "/v1/permissions",
      methods = {HttpMethod.GET},
      summary = "List permission tuples",
      description =
          "Administrative listing of the caller's tenant's tuples, newest first. Expired tuples"
              + " are included.",
      operationId = "listPermissions",
      tags = "Permissions",
      queryParams = {
        @OpenApiParam(name = "resourceType", example = "RESOURCE_TYPE_BOOKMARK"),
        @OpenApiParam(name = "resourceId", example = "b1"),
        @OpenApiParam(name = "subjectType", example = "SUBJECT_TYPE_ROLE"),
        @OpenApiParam(name = "subjectId", example = "auditor"),
        @OpenApiParam(name = "page", type = Integer.class, description = "1-based, default 1"),
        @OpenApiParam(
            name = "pageSize", type = Integer.class, description = "Default 20, at most 100")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "A page of tuples",
            content = @OpenApiContent(from = ListPermissionsResponse.class)),
        @OpenApiResponse(status = "400", description = "Unrecognized enum token or bad paging")
      })
  public void handleListPermissions(Context ctx) {
    Logger.info("REST ListPermissions request");
    PermissionOuterClass.ListPermissionsRequest.Builder requestBuilder =
        PermissionOuterClass.ListPermissionsRequest.newBuilder();

    String resourceType = ctx.queryParam("resourceType");
    if (!Strings.isNullOrEmpty(resourceType)) {
      StatusOr<PermissionOuterClass.ResourceType> resourceTypeOr =
          EnumConverters.parseToken(
              PermissionOuterClass.ResourceType.class, resourceType, "resourceType");
      if (resourceTypeOr.isNotOk()) {
        setError(ctx, resourceTypeOr.getStatus());
        return;
      }
      requestBuilder.setResourceType(resourceTypeOr.getValue());
    }
    String subjectType = ctx.queryParam("subjectType");
    if (!Strings.isNullOrEmpty(subjectType)) {
      StatusOr<PermissionOuterClass.SubjectType> subjectTypeOr =
          EnumConverters.parseToken(
              PermissionOuterClass.SubjectType.class, subjectType, "subjectType");
      if (subjectTypeOr.isNotOk()) {
        setError(ctx, subjectTypeOr.getStatus());
        return;
      }
      requestBuilder.setSubjectType(subjectTypeOr.getValue());
    }
    String resourceId = ctx.queryParam("resourceId");
    if (!Strings.isNullOrEmpty(resourceId)) {
      requestBuilder.setResourceId(resourceId);
    }
    String subjectId = ctx.queryParam("subjectId");
    if (!Strings.isNullOrEmpty(subjectId)) {
      requestBuilder.setSubjectId(subjectId);
    }

    StatusOr<Optional<Integer>> pageOr = parseCount(ctx.queryParam("page"), "page");
    if (pageOr.isNotOk()) {
      setError(ctx, pageOr.getStatus());
      return;
    }
    pageOr.getValue().ifPresent(requestBuilder::setPage);
    StatusOr<Optional<Integer>> pageSizeOr = parseCount(ctx.queryParam("pageSize"), "pageSize");
    if (pageSizeOr.isNotOk()) {
      setError(ctx, pageSizeOr.getStatus());
      return;
    }
    pageSizeOr.getValue().ifPresent(requestBuilder::setPageSize);

    try {
      PermissionOuterClass.ListPermissionsResponse response =
          stub(ctx).listPermissions(requestBuilder.build());
      List<PermissionTupleResponse> permissions =
          response.getPermissionsList().stream().map(RestMapper::toDto).toList();
      ctx.json(new ListPermissionsResponse(permissions, response.getTotal()));
    } catch (StatusRuntimeException e) {
      setError(ctx, e);
    }
  }

  @OpenApi(
      path = "/v1/permissions/check",
      methods = {HttpMethod.POST},
      summary = "Check access",
      description =
          "Checks whether a user holds a permission on a resource. A denial is a 200 response"
              + " with allowed=false and a reason.",
      operationId = "checkAccess",
      tags = "Permissions",
      requestBody =
          @OpenApiRequestBody(
              description = "The check",
              required = true,
              content =
                  @OpenApiContent(
                      from = CheckAccessRequest.class,
                      example =
                          """
              {
                "userId": "42",
                "resourceType": "RESOURCE_TYPE_BOOKMARK",
                "resourceId": "b1",
                "permission": "PERMISSION_WRITE"
              }
              """)),
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The decision",
            content = @OpenApiContent(from = CheckAccessResponse.class)),
        @OpenApiResponse(status = "400", description = "Unrecognized enum token"),
        @OpenApiResponse(status = "503", description = "Identity directory or store unavailable")
      })
  public void handleCheckAccess(Context ctx) {
    Logger.info("REST CheckAccess request");
    CheckAccessRequest requestDto = ctx.bodyAsClass(CheckAccessRequest.class);

    StatusOr<PermissionOuterClass.ResourceType> resourceTypeOr =
        EnumConverters.parseToken(
            PermissionOuterClass.ResourceType.class, requestDto.resourceType(), "resourceType");
    if (resourceTypeOr.isNotOk()) {
      setError(ctx, resourceTypeOr.getStatus());
      return;
    }
    StatusOr<PermissionOuterClass.Permission> permissionOr =
        EnumConverters.parseToken(
            PermissionOuterClass.Permission.class, requestDto.permission(), "permission");
    if (permissionOr.isNotOk()) {
      setError(ctx, permissionOr.getStatus());
      return;
    }

    PermissionOuterClass.CheckAccessRequest request =
        PermissionOuterClass.CheckAccessRequest.newBuilder()
            .setUserId(Strings.nullToEmpty(requestDto.userId()))
            .setResourceType(resourceTypeOr.getValue())
            .setResourceId(Strings.nullToEmpty(requestDto.resourceId()))
            .setPermission(permissionOr.getValue())
            .build();

    try {
      PermissionOuterClass.CheckAccessResponse response = stub(ctx).checkAccess(request);
      String reason =
          EnumConverters.fromProto(response.getReason()).map(DenialReason::wireName).orElse(null);
      String matchedRelation =
          response.getAllowed() ? response.getMatchedRelation().name() : null;
      ctx.json(new CheckAccessResponse(response.getAllowed(), reason, matchedRelation));
    } catch (StatusRuntimeException e) {
      setError(ctx, e);
    }
  }

  @OpenApi(
      path = "/v1/permissions/accessible",
      methods = {HttpMethod.GET},
      summary = "List accessible resources",
      description =
          "Lists the resources a user can reach with a permission, each once, in ascending id"
              + " order.",
      operationId = "listAccessibleResources",
      tags = "Permissions",
      queryParams = {
        @OpenApiParam(name = "userId", description = "Defaults to the caller", example = "42"),
        @OpenApiParam(name = "resourceType", required = true, example = "RESOURCE_TYPE_BOOKMARK"),
        @OpenApiParam(name = "permission", required = true, example = "PERMISSION_READ"),
        @OpenApiParam(name = "page", type = Integer.class, description = "1-based, default 1"),
        @OpenApiParam(
            name = "pageSize", type = Integer.class, description = "Default 20, at most 100")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "A page of resource ids",
            content = @OpenApiContent(from = ListAccessibleResourcesResponse.class)),
        @OpenApiResponse(status = "400", description = "Unrecognized enum token or bad paging"),
        @OpenApiResponse(status = "503", description = "Identity directory or store unavailable")
      })
  public void handleListAccessibleResources(Context ctx) {
    Logger.info("REST ListAccessibleResources request");

    StatusOr<PermissionOuterClass.ResourceType> resourceTypeOr =
        EnumConverters.parseToken(
            PermissionOuterClass.ResourceType.class,
            ctx.queryParam("resourceType"),
            "resourceType");
    if (resourceTypeOr.isNotOk()) {
      setError(ctx, resourceTypeOr.getStatus());
      return;
    }
    StatusOr<PermissionOuterClass.Permission> permissionOr =
        EnumConverters.parseToken(
            PermissionOuterClass.Permission.class, ctx.queryParam("permission"), "permission");
    if (permissionOr.isNotOk()) {
      setError(ctx, permissionOr.getStatus());
      return;
    }

    PermissionOuterClass.ListAccessibleResourcesRequest.Builder requestBuilder =
        PermissionOuterClass.ListAccessibleResourcesRequest.newBuilder()
            .setUserId(Strings.nullToEmpty(ctx.queryParam("userId")))
            .setResourceType(resourceTypeOr.getValue())
            .setPermission(permissionOr.getValue());

    StatusOr<Optional<Integer>> pageOr = parseCount(ctx.queryParam("page"), "page");
    if (pageOr.isNotOk()) {
      setError(ctx, pageOr.getStatus());
      return;
    }
    pageOr.getValue().ifPresent(requestBuilder::setPage);
    StatusOr<Optional<Integer>> pageSizeOr = parseCount(ctx.queryParam("pageSize"), "pageSize");
    if (pageSizeOr.isNotOk()) {
      setError(ctx, pageSizeOr.getStatus());
      return;
    }
    pageSizeOr.getValue().ifPresent(requestBuilder::setPageSize);

    try {
      PermissionOuterClass.ListAccessibleResourcesResponse response =
          stub(ctx).listAccessibleResources(requestBuilder.build());
      ctx.json(
          new ListAccessibleResourcesResponse(
              List.copyOf(response.getResourceIdsList()), response.getTotal()));
    } catch (StatusRuntimeException e) {
      setError(ctx, e);
    }
  }

  @OpenApi(
      path = "/v1/permissions/effective",
      methods = {HttpMethod.GET},
      summary = "Get effective permissions",
      description =
          "Returns every permission a user holds on a resource and the highest relation behind"
              + " them. Meant for deciding which actions to offer; mutations must still be"
              + " checked.",
      operationId = "getEffectivePermissions",
      tags = "Permissions",
      queryParams = {
        @OpenApiParam(name = "userId", description = "Defaults to the caller", example = "42"),
        @OpenApiParam(name = "resourceType", required = true, example = "RESOURCE_TYPE_BOOKMARK"),
        @OpenApiParam(name = "resourceId", required = true, example = "b1")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The effective permissions",
            content = @OpenApiContent(from = EffectivePermissionsResponse.class)),
        @OpenApiResponse(status = "400", description = "Unrecognized enum token"),
        @OpenApiResponse(status = "503", description = "Identity directory or store unavailable")
      })
  public void handleGetEffectivePermissions(Context ctx) {
    Logger.info("REST GetEffectivePermissions request");

    StatusOr<PermissionOuterClass.ResourceType> resourceTypeOr =
        EnumConverters.parseToken(
            PermissionOuterClass.ResourceType.class,
            ctx.queryParam("resourceType"),
            "resourceType");
    if (resourceTypeOr.isNotOk()) {
      setError(ctx, resourceTypeOr.getStatus());
      return;
    }

    PermissionOuterClass.GetEffectivePermissionsRequest request =
        PermissionOuterClass.GetEffectivePermissionsRequest.newBuilder()
            .setUserId(Strings.nullToEmpty(ctx.queryParam("userId")))
            .setResourceType(resourceTypeOr.getValue())
            .setResourceId(Strings.nullToEmpty(ctx.queryParam("resourceId")))
            .build();

    try {
      PermissionOuterClass.GetEffectivePermissionsResponse response =
          stub(ctx).getEffectivePermissions(request);
      List<String> permissions =
          response.getPermissionsList().stream().map(Enum::name).toList();
      ctx.json(
          new EffectivePermissionsResponse(permissions, response.getHighestRelation().name()));
    } catch (StatusRuntimeException e) {
      setError(ctx, e);
    }
  }

  @OpenApi(
      path = "/v1/permissions/owner",
      methods = {HttpMethod.POST},
      summary = "Claim ownership",
      description =
          "Makes the caller OWNER of a resource nobody governs yet. Called by the resource store"
              + " right after creating the resource.",
      operationId = "claimOwnership",
      tags = "Permissions",
      requestBody =
          @OpenApiRequestBody(
              description = "The new resource",
              required = true,
              content =
                  @OpenApiContent(
                      from = ClaimOwnershipRequest.class,
                      example =
                          """
              {
                "resourceType": "RESOURCE_TYPE_BOOKMARK",
                "resourceId": "b1"
              }
              """)),
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The OWNER tuple",
            content = @OpenApiContent(from = PermissionTupleResponse.class)),
        @OpenApiResponse(status = "403", description = "Another tenant governs the resource"),
        @OpenApiResponse(status = "409", description = "The resource is already governed")
      })
  public void handleClaimOwnership(Context ctx) {
    Logger.info("REST ClaimOwnership request");
    ClaimOwnershipRequest requestDto = ctx.bodyAsClass(ClaimOwnershipRequest.class);

    StatusOr<PermissionOuterClass.ResourceType> resourceTypeOr =
        EnumConverters.parseToken(
            PermissionOuterClass.ResourceType.class, requestDto.resourceType(), "resourceType");
    if (resourceTypeOr.isNotOk()) {
      setError(ctx, resourceTypeOr.getStatus());
      return;
    }

    PermissionOuterClass.ClaimOwnershipRequest request =
        PermissionOuterClass.ClaimOwnershipRequest.newBuilder()
            .setResourceType(resourceTypeOr.getValue())
            .setResourceId(Strings.nullToEmpty(requestDto.resourceId()))
            .build();

    try {
      PermissionOuterClass.ClaimOwnershipResponse response = stub(ctx).claimOwnership(request);
      ctx.json(RestMapper.toDto(response.getPermission()));
    } catch (StatusRuntimeException e) {
      setError(ctx, e);
    }
  }

  @OpenApi(
      path = "/v1/permissions/resource",
      methods = {HttpMethod.DELETE},
      summary = "Delete resource permissions",
      description =
          "Removes every tuple on a resource in the caller's tenant. Called by the resource store"
              + " when the resource is deleted; the caller must hold DELETE.",
      operationId = "deleteResourcePermissions",
      tags = "Permissions",
      queryParams = {
        @OpenApiParam(name = "resourceType", required = true, example = "RESOURCE_TYPE_BOOKMARK"),
        @OpenApiParam(name = "resourceId", required = true, example = "b1")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "Number of tuples removed",
            content = @OpenApiContent(from = DeleteResourcePermissionsResponse.class)),
        @OpenApiResponse(status = "403", description = "Caller lacks DELETE on the resource")
      })
  public void handleDeleteResourcePermissions(Context ctx) {
    Logger.info("REST DeleteResourcePermissions request");

    StatusOr<PermissionOuterClass.ResourceType> resourceTypeOr =
        EnumConverters.parseToken(
            PermissionOuterClass.ResourceType.class,
            ctx.queryParam("resourceType"),
            "resourceType");
    if (resourceTypeOr.isNotOk()) {
      setError(ctx, resourceTypeOr.getStatus());
      return;
    }

    PermissionOuterClass.DeleteResourcePermissionsRequest request =
        PermissionOuterClass.DeleteResourcePermissionsRequest.newBuilder()
            .setResourceType(resourceTypeOr.getValue())
            .setResourceId(Strings.nullToEmpty(ctx.queryParam("resourceId")))
            .build();

    try {
      PermissionOuterClass.DeleteResourcePermissionsResponse response =
          stub(ctx).deleteResourcePermissions(request);
      ctx.json(new DeleteResourcePermissionsResponse(response.getDeletedCount()));
    } catch (StatusRuntimeException e) {
      setError(ctx, e);
    }
  }

  @OpenApi(
      path = "/v1/permissions/export",
      methods = {HttpMethod.GET},
      summary = "Export permissions",
      description =
          "Exports stored tuples for backup, expired ones included. Without a tenant, platform"
              + " administrators export every tenant and other callers their own tenant.",
      operationId = "exportPermissions",
      tags = "Backup",
      queryParams = {
        @OpenApiParam(
            name = "tenantId",
            type = Integer.class,
            description = "Tenant to export. Another tenant needs a platform administrator.",
            example = "1")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The backup",
            content = @OpenApiContent(from = ExportPermissionsResponse.class)),
        @OpenApiResponse(status = "400", description = "Malformed tenant id"),
        @OpenApiResponse(status = "403", description = "Caller may not export that tenant"),
        @OpenApiResponse(status = "503", description = "Store unavailable")
      })
  public void handleExportPermissions(Context ctx) {
    Logger.info("REST ExportPermissions request");
    PermissionOuterClass.ExportPermissionsRequest.Builder requestBuilder =
        PermissionOuterClass.ExportPermissionsRequest.newBuilder();

    String tenantId = ctx.queryParam("tenantId");
    if (!Strings.isNullOrEmpty(tenantId)) {
      Integer parsed = Ints.tryParse(tenantId.trim());
      if (parsed == null || parsed < 0) {
        setError(
            ctx,
            Status.invalidArgument("tenantId must be a non-negative integer, got: " + tenantId));
        return;
      }
      requestBuilder.setTenantId(parsed);
    }

    try {
      PermissionOuterClass.ExportPermissionsResponse response =
          stub(ctx).exportPermissions(requestBuilder.build());
      List<PermissionTupleResponse> permissions =
          response.getPermissionsList().stream().map(RestMapper::toDto).toList();
      ctx.json(
          new ExportPermissionsResponse(
              response.getTenantId(),
              response.getFullExport(),
              Timestamps.toMillis(response.getExportedAt()),
              permissions));
    } catch (StatusRuntimeException e) {
      setError(ctx, e);
    }
  }

  @OpenApi(
      path = "/v1/permissions/import",
      methods = {HttpMethod.POST},
      summary = "Import permissions",
      description =
          "Restores tuples from a backup into the tenants they name. Only platform administrators"
              + " may import. Tuples that cannot be restored are counted and reported, not"
              + " failed.",
      operationId = "importPermissions",
      tags = "Backup",
      requestBody =
          @OpenApiRequestBody(
              description = "The tuples to restore, as exported",
              required = true,
              content =
                  @OpenApiContent(
                      from = ImportPermissionsRequest.class,
                      example =
                          """
              {
                "mode": "IMPORT_MODE_OVERWRITE",
                "permissions": [
                  {
                    "tenantId": 1,
                    "resourceType": "RESOURCE_TYPE_BOOKMARK",
                    "resourceId": "b1",
                    "relation": "RELATION_OWNER",
                    "subjectType": "SUBJECT_TYPE_USER",
                    "subjectId": "42"
                  }
                ]
              }
              """)),
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The tally",
            content = @OpenApiContent(from = ImportPermissionsResponse.class)),
        @OpenApiResponse(status = "400", description = "Unrecognized enum token"),
        @OpenApiResponse(status = "403", description = "Caller is not a platform administrator"),
        @OpenApiResponse(status = "503", description = "Store unavailable")
      })
  public void handleImportPermissions(Context ctx) {
    Logger.info("REST ImportPermissions request");
    ImportPermissionsRequest requestDto = ctx.bodyAsClass(ImportPermissionsRequest.class);

    PermissionOuterClass.ImportPermissionsRequest.Builder requestBuilder =
        PermissionOuterClass.ImportPermissionsRequest.newBuilder();
    if (!Strings.isNullOrEmpty(requestDto.mode())) {
      StatusOr<PermissionOuterClass.ImportMode> modeOr =
          EnumConverters.parseToken(
              PermissionOuterClass.ImportMode.class, requestDto.mode(), "mode");
      if (modeOr.isNotOk()) {
        setError(ctx, modeOr.getStatus());
        return;
      }
      requestBuilder.setMode(modeOr.getValue());
    }
    if (requestDto.permissions() != null) {
      for (PermissionTupleResponse tuple : requestDto.permissions()) {
        StatusOr<PermissionOuterClass.PermissionTuple> tupleOr = RestMapper.fromDto(tuple);
        if (tupleOr.isNotOk()) {
          setError(ctx, tupleOr.getStatus());
          return;
        }
        requestBuilder.addPermissions(tupleOr.getValue());
      }
    }

    try {
      PermissionOuterClass.ImportPermissionsResponse response =
          stub(ctx).importPermissions(requestBuilder.build());
      ctx.json(
          new ImportPermissionsResponse(
              response.getSuccess(),
              response.getTotal(),
              response.getCreated(),
              response.getUpdated(),
              response.getSkipped(),
              response.getFailed(),
              List.copyOf(response.getWarningsList())));
    } catch (StatusRuntimeException e) {
      setError(ctx, e);
    }
  }

  /** Returns the stub with the request's caller identity attached. */
  private BookmarkPermissionServiceGrpc.BookmarkPermissionServiceBlockingStub stub(Context ctx) {
    return permissionService.withInterceptors(
        MetadataUtils.newAttachHeadersInterceptor(forwardedHeaders(ctx)));
  }

  /** Parses an optional positive integer query parameter. */
  private static StatusOr<Optional<Integer>> parseCount(String value, String name) {
    if (Strings.isNullOrEmpty(value)) {
      return StatusOr.ofValue(Optional.empty());
    }
    Integer parsed = Ints.tryParse(value.trim());
    if (parsed == null || parsed < 1) {
      return StatusOr.ofStatus(
          Status.invalidArgument(name + " must be a positive integer, got: " + value));
    }
    return StatusOr.ofValue(Optional.of(parsed));
  }
}
