package com.bookmarkauthz.rest.dto;

import bookmarkauthz.v1.PermissionOuterClass;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;
import io.javalin.openapi.OpenApiRequired;

@OpenApiDescription("Asks whether a user holds a permission on a resource.")
@OpenApiName("CheckAccessRequest")
@ProtobufEquivalent(PermissionOuterClass.CheckAccessRequest.class)
public record CheckAccessRequest(
    @OpenApiDescription("User to check. Defaults to the caller.")
    @OpenApiExample("42")
    @OpenApiNullable
    String userId,

    @OpenApiDescription("Kind of resource.")
    @OpenApiExample("RESOURCE_TYPE_BOOKMARK")
    @OpenApiRequired
    String resourceType,

    @OpenApiDescription("Identifier of the resource.")
    @OpenApiExample("7f1c2d9e-5b3a-4c8e-9f10-2a4b6c8d0e12")
    @OpenApiRequired
    String resourceId,

    @OpenApiDescription("Permission to check: PERMISSION_READ, PERMISSION_WRITE, PERMISSION_DELETE or PERMISSION_SHARE.")
    @OpenApiExample("PERMISSION_WRITE")
    @OpenApiRequired
    String permission) {

  public CheckAccessRequest() {
    this(null, null, null, null);
  }
}
