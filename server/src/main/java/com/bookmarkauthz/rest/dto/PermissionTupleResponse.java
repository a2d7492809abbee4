package com.bookmarkauthz.rest.dto;

import bookmarkauthz.v1.PermissionOuterClass;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;

/**
 * One stored grant as returned by the REST API.
 *
 * <p>Timestamps are milliseconds since epoch.
 */
@OpenApiDescription("A permission tuple: one relation held by one subject on one resource.")
@OpenApiName("PermissionTuple")
@ProtobufEquivalent(PermissionOuterClass.PermissionTuple.class)
public record PermissionTupleResponse(
    @OpenApiDescription("Identifier of the tuple.")
    @OpenApiExample("1024")
    Long id,

    @OpenApiDescription("Tenant that owns the tuple.")
    @OpenApiExample("1")
    Integer tenantId,

    @OpenApiDescription("Kind of resource.")
    @OpenApiExample("RESOURCE_TYPE_BOOKMARK")
    String resourceType,

    @OpenApiDescription("Identifier of the resource.")
    @OpenApiExample("7f1c2d9e-5b3a-4c8e-9f10-2a4b6c8d0e12")
    String resourceId,

    @OpenApiDescription("Relation held.")
    @OpenApiExample("RELATION_EDITOR")
    String relation,

    @OpenApiDescription("Kind of principal holding the relation.")
    @OpenApiExample("SUBJECT_TYPE_USER")
    String subjectType,

    @OpenApiDescription("User id, role code or tenant id.")
    @OpenApiExample("42")
    String subjectId,

    @OpenApiDescription("User who last granted the tuple.")
    @OpenApiExample("7")
    @OpenApiNullable
    Integer grantedBy,

    @OpenApiDescription("When the tuple stops counting. Absent for a permanent grant.")
    @OpenApiExample("1767225600000")
    @OpenApiNullable
    Long expiresAt,

    @OpenApiDescription("When the tuple was first created.")
    @OpenApiExample("1735689600000")
    Long createTime) {

  public PermissionTupleResponse() {
    this(null, null, null, null, null, null, null, null, null, null);
  }
}
