package com.bookmarkauthz.rest.dto;

import bookmarkauthz.v1.PermissionOuterClass;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;

@OpenApiDescription("Outcome of removing every permission on a deleted resource.")
@OpenApiName("DeleteResourcePermissionsResponse")
@ProtobufEquivalent(PermissionOuterClass.DeleteResourcePermissionsResponse.class)
public record DeleteResourcePermissionsResponse(
    @OpenApiDescription("Number of tuples removed.")
    @OpenApiExample("3")
    Integer deletedCount) {

  public DeleteResourcePermissionsResponse() {
    this(0);
  }
}
