package com.bookmarkauthz.rest.dto;

import bookmarkauthz.v1.PermissionOuterClass;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import java.util.List;

@OpenApiDescription("A page of the tenant's permission tuples, newest first.")
@OpenApiName("ListPermissionsResponse")
@ProtobufEquivalent(PermissionOuterClass.ListPermissionsResponse.class)
public record ListPermissionsResponse(
    @OpenApiDescription("Tuples on this page, expired ones included.")
    List<PermissionTupleResponse> permissions,

    @OpenApiDescription("Number of matching tuples across all pages.")
    @OpenApiExample("57")
    Integer total) {

  public ListPermissionsResponse() {
    this(List.of(), 0);
  }
}
