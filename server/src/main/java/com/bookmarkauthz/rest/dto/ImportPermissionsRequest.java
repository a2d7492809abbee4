package com.bookmarkauthz.rest.dto;

import bookmarkauthz.v1.PermissionOuterClass;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;
import io.javalin.openapi.OpenApiRequired;
import java.util.List;

/** Request body for restoring tuples, in the shape they were exported in. */
@OpenApiDescription("Restores permission tuples from a backup.")
@OpenApiName("ImportPermissionsRequest")
@ProtobufEquivalent(PermissionOuterClass.ImportPermissionsRequest.class)
public record ImportPermissionsRequest(
    @OpenApiDescription(
        "IMPORT_MODE_SKIP keeps stored tuples, IMPORT_MODE_OVERWRITE replaces their grantor and"
            + " expiry. Defaults to skip.")
    @OpenApiExample("IMPORT_MODE_SKIP")
    @OpenApiNullable
    String mode,

    @OpenApiDescription("Tuples to restore. Ids and create times are ignored.")
    @OpenApiRequired
    List<PermissionTupleResponse> permissions) {

  public ImportPermissionsRequest() {
    this(null, List.of());
  }
}
