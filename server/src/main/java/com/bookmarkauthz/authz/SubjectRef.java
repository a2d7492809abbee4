package com.bookmarkauthz.authz;

import java.util.Objects;

/**
 * A principal that may match the subject side of a tuple.
 *
 * @param type the kind of principal
 * @param id the user id, role code or tenant id
 */
public record SubjectRef(SubjectType type, String id) {

  public SubjectRef {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(id, "id");
  }

  public static SubjectRef user(String userId) {
    return new SubjectRef(SubjectType.USER, userId);
  }

  public static SubjectRef role(String roleCode) {
    return new SubjectRef(SubjectType.ROLE, roleCode);
  }

  public static SubjectRef tenant(int tenantId) {
    return new SubjectRef(SubjectType.TENANT, String.valueOf(tenantId));
  }
}
