package com.bookmarkauthz.authz;

import com.bookmarkauthz.common.status.Status;
import com.bookmarkauthz.common.status.StatusCode;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Failures the authorization engine reports as errors, as opposed to a denied check. Each member
 * is bound to a status code and travels as the status reason, so callers can tell, for instance,
 * an identity outage from a store outage.
 */
public enum AuthzError {
  /** The resource or subject belongs to a tenant other than the caller's. Never retried. */
  TENANT_MISMATCH("TenantMismatch", StatusCode.PERMISSION_DENIED),
  /** An enum token was missing or not recognized. Rejected before any store access. */
  INVALID_ENUM("InvalidEnum", StatusCode.INVALID_ARGUMENT),
  /** The resource type is not one this store governs. */
  NOT_FOUND("NotFound", StatusCode.NOT_FOUND),
  /** Subject resolution failed or timed out. Transient. */
  IDENTITY_UNAVAILABLE("IdentityUnavailable", StatusCode.UNAVAILABLE),
  /** The tuple store could not be reached. Transient. */
  STORE_UNAVAILABLE("StoreUnavailable", StatusCode.UNAVAILABLE);

  private final String reason;
  private final StatusCode code;

  AuthzError(String reason, StatusCode code) {
    this.reason = reason;
    this.code = code;
  }

  public String reason() {
    return reason;
  }

  public StatusCode code() {
    return code;
  }

  public Status toStatus(String message) {
    return Status.of(code, reason, message, null);
  }

  public Status toStatus(String message, @Nullable Throwable cause) {
    return Status.of(code, reason, message, cause);
  }

  /** Returns true if the status carries this error. */
  public boolean matches(Status status) {
    return status.getCode() == code && reason.equals(status.getReason());
  }

  /** Returns the error carried by the status, if any. */
  public static Optional<AuthzError> fromStatus(Status status) {
    return fromReason(status.getReason());
  }

  /** Looks an error up by its reason token. */
  public static Optional<AuthzError> fromReason(@Nullable String reason) {
    if (reason == null) {
      return Optional.empty();
    }
    for (AuthzError error : values()) {
      if (error.reason.equals(reason)) {
        return Optional.of(error);
      }
    }
    return Optional.empty();
  }
}
