package com.bookmarkauthz.rest.dto;

import bookmarkauthz.v1.PermissionOuterClass;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;
import io.javalin.openapi.OpenApiRequired;

/** Request body for granting a relation on a resource. */
@OpenApiDescription("Grants a relation on a resource to a user, role or the caller's tenant.")
@OpenApiName("GrantAccessRequest")
@ProtobufEquivalent(
    value = PermissionOuterClass.GrantAccessRequest.class,
    description = "expiresAt is epoch milliseconds instead of a Timestamp")
public record GrantAccessRequest(
    @OpenApiDescription("Kind of resource.")
    @OpenApiExample("RESOURCE_TYPE_BOOKMARK")
    @OpenApiRequired
    String resourceType,

    @OpenApiDescription("Identifier of the resource.")
    @OpenApiExample("7f1c2d9e-5b3a-4c8e-9f10-2a4b6c8d0e12")
    @OpenApiRequired
    String resourceId,

    @OpenApiDescription("Relation to grant: RELATION_OWNER, RELATION_EDITOR, RELATION_VIEWER or RELATION_SHARER.")
    @OpenApiExample("RELATION_EDITOR")
    @OpenApiRequired
    String relation,

    @OpenApiDescription("Kind of principal receiving the relation.")
    @OpenApiExample("SUBJECT_TYPE_USER")
    @OpenApiRequired
    String subjectType,

    @OpenApiDescription("User id, role code, or the caller's tenant id for a tenant-wide grant.")
    @OpenApiExample("42")
    @OpenApiRequired
    String subjectId,

    @OpenApiDescription("When the grant stops counting, in milliseconds since epoch. Omit for a permanent grant.")
    @OpenApiExample("1767225600000")
    @OpenApiNullable
    Long expiresAt) {

  public GrantAccessRequest() {
    this(null, null, null, null, null, null);
  }
}
