package com.bookmarkauthz.rest.dto;

import bookmarkauthz.v1.PermissionOuterClass;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;

/**
 * Result of a check. A denial is a normal response: {@code allowed} is false and {@code reason}
 * says why.
 */
@OpenApiDescription("Result of a permission check.")
@OpenApiName("CheckAccessResponse")
@ProtobufEquivalent(
    value = PermissionOuterClass.CheckAccessResponse.class,
    description = "reason uses the short tokens, e.g. InsufficientRelation")
public record CheckAccessResponse(
    @OpenApiDescription("Whether the permission is held.")
    @OpenApiExample("false")
    Boolean allowed,

    @OpenApiDescription("Why the check was denied: TenantMismatch, NoGrant, Expired or InsufficientRelation.")
    @OpenApiExample("InsufficientRelation")
    @OpenApiNullable
    String reason,

    @OpenApiDescription("Relation that satisfied the check.")
    @OpenApiExample("RELATION_EDITOR")
    @OpenApiNullable
    String matchedRelation) {

  public CheckAccessResponse() {
    this(false, null, null);
  }
}
