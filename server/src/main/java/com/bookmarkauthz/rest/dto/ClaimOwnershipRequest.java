package com.bookmarkauthz.rest.dto;

import bookmarkauthz.v1.PermissionOuterClass;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiRequired;

@OpenApiDescription("Claims ownership of a newly created resource for the caller.")
@OpenApiName("ClaimOwnershipRequest")
@ProtobufEquivalent(PermissionOuterClass.ClaimOwnershipRequest.class)
public record ClaimOwnershipRequest(
    @OpenApiDescription("Kind of resource.")
    @OpenApiExample("RESOURCE_TYPE_BOOKMARK")
    @OpenApiRequired
    String resourceType,

    @OpenApiDescription("Identifier of the resource.")
    @OpenApiExample("7f1c2d9e-5b3a-4c8e-9f10-2a4b6c8d0e12")
    @OpenApiRequired
    String resourceId) {

  public ClaimOwnershipRequest() {
    this(null, null);
  }
}
