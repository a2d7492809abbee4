package com.bookmarkauthz.authz;

/** Why a check was denied, listed in the order they are evaluated. */
public enum DenialReason {
  /** The resource is governed by a different tenant than the caller's. */
  TENANT_MISMATCH("TenantMismatch"),
  /** No tuple links any of the user's subjects to the resource. */
  NO_GRANT("NoGrant"),
  /** Matching tuples exist, but every one of them has expired. */
  EXPIRED("Expired"),
  /** An active tuple exists, but its relation does not grant the permission. */
  INSUFFICIENT_RELATION("InsufficientRelation");

  private final String wireName;

  DenialReason(String wireName) {
    this.wireName = wireName;
  }

  /** Returns the token used for this reason in REST responses and error messages. */
  public String wireName() {
    return wireName;
  }
}
