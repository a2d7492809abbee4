package com.bookmarkauthz.authz;

import com.bookmarkauthz.common.status.Status;
import com.bookmarkauthz.common.status.StatusOr;

/**
 * Guards for callers that need a yes or no before mutating a resource. A denied check becomes a
 * PERMISSION_DENIED status naming the denial reason; engine failures pass through unchanged.
 */
public class AccessChecker {

  private final AuthorizationEngine engine;

  public AccessChecker(AuthorizationEngine engine) {
    this.engine = engine;
  }

  public Status requireRead(int tenantId, String userId, ResourceType type, String resourceId) {
    return requirePermission(tenantId, userId, type, resourceId, Permission.READ);
  }

  public Status requireWrite(int tenantId, String userId, ResourceType type, String resourceId) {
    return requirePermission(tenantId, userId, type, resourceId, Permission.WRITE);
  }

  public Status requireDelete(int tenantId, String userId, ResourceType type, String resourceId) {
    return requirePermission(tenantId, userId, type, resourceId, Permission.DELETE);
  }

  public Status requireShare(int tenantId, String userId, ResourceType type, String resourceId) {
    return requirePermission(tenantId, userId, type, resourceId, Permission.SHARE);
  }

  /** Returns OK if the user holds the permission, otherwise why not. */
  public Status requirePermission(
      int tenantId, String userId, ResourceType type, String resourceId, Permission permission) {
    StatusOr<CheckResult> resultOr = engine.check(tenantId, userId, type, resourceId, permission);
    if (resultOr.isNotOk()) {
      return resultOr.getStatus();
    }
    CheckResult result = resultOr.getValue();
    return result.allowed() ? Status.ok() : denied(result);
  }

  static Status denied(CheckResult result) {
    String reason = result.denialReason().map(DenialReason::wireName).orElse("unknown");
    return Status.permissionDenied("access denied: " + reason);
  }
}
