package com.bookmarkauthz.rest.dto;

import bookmarkauthz.v1.PermissionOuterClass;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import java.util.List;

@OpenApiDescription("Tally of a permission import.")
@OpenApiName("ImportPermissionsResponse")
@ProtobufEquivalent(PermissionOuterClass.ImportPermissionsResponse.class)
public record ImportPermissionsResponse(
    @OpenApiDescription("False when any tuple failed.")
    @OpenApiExample("true")
    Boolean success,

    @OpenApiDescription("Tuples submitted.")
    @OpenApiExample("12")
    Integer total,

    @OpenApiDescription("Tuples inserted.")
    @OpenApiExample("10")
    Integer created,

    @OpenApiDescription("Stored tuples overwritten.")
    @OpenApiExample("0")
    Integer updated,

    @OpenApiDescription("Stored tuples left alone.")
    @OpenApiExample("2")
    Integer skipped,

    @OpenApiDescription("Tuples rejected.")
    @OpenApiExample("0")
    Integer failed,

    @OpenApiDescription("One line per rejected tuple.")
    List<String> warnings) {

  public ImportPermissionsResponse() {
    this(false, 0, 0, 0, 0, 0, List.of());
  }
}
