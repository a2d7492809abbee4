package com.bookmarkauthz.rest.dto;

import bookmarkauthz.v1.PermissionOuterClass;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import java.util.List;

@OpenApiDescription("A backup of stored permission tuples.")
@OpenApiName("ExportPermissionsResponse")
@ProtobufEquivalent(
    value = PermissionOuterClass.ExportPermissionsResponse.class,
    description = "exportedAt is epoch milliseconds instead of a Timestamp")
public record ExportPermissionsResponse(
    @OpenApiDescription("Exported tenant, or 0 when every tenant was exported.")
    @OpenApiExample("1")
    Integer tenantId,

    @OpenApiDescription("True when every tenant was exported.")
    @OpenApiExample("false")
    Boolean fullExport,

    @OpenApiDescription("When the backup was taken, in milliseconds since epoch.")
    @OpenApiExample("1767225600000")
    Long exportedAt,

    @OpenApiDescription("Tuples, oldest first, expired ones included.")
    List<PermissionTupleResponse> permissions) {

  public ExportPermissionsResponse() {
    this(0, false, null, List.of());
  }
}
