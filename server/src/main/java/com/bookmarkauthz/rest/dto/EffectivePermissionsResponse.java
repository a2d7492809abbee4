package com.bookmarkauthz.rest.dto;

import bookmarkauthz.v1.PermissionOuterClass;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import java.util.List;

@OpenApiDescription(
    "Every permission a user holds on a resource. For rendering only; mutations must still be checked.")
@OpenApiName("EffectivePermissionsResponse")
@ProtobufEquivalent(PermissionOuterClass.GetEffectivePermissionsResponse.class)
public record EffectivePermissionsResponse(
    @OpenApiDescription("Union of the permissions of every active matching relation.")
    @OpenApiExample("[\"PERMISSION_READ\", \"PERMISSION_WRITE\"]")
    List<String> permissions,

    @OpenApiDescription("Highest matching relation, RELATION_UNSPECIFIED when none matches.")
    @OpenApiExample("RELATION_EDITOR")
    String highestRelation) {

  public EffectivePermissionsResponse() {
    this(List.of(), null);
  }
}
