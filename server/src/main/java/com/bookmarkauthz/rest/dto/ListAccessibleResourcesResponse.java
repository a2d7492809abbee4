package com.bookmarkauthz.rest.dto;

import bookmarkauthz.v1.PermissionOuterClass;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import java.util.List;

@OpenApiDescription("A page of the resources a user can reach with a permission.")
@OpenApiName("ListAccessibleResourcesResponse")
@ProtobufEquivalent(PermissionOuterClass.ListAccessibleResourcesResponse.class)
public record ListAccessibleResourcesResponse(
    @OpenApiDescription("Distinct resource ids in ascending order.")
    @OpenApiExample("[\"b1\", \"b2\"]")
    List<String> resourceIds,

    @OpenApiDescription("Number of distinct resources across all pages.")
    @OpenApiExample("2")
    Integer total) {

  public ListAccessibleResourcesResponse() {
    this(List.of(), 0);
  }
}
