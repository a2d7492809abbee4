package com.bookmarkauthz.identity;

import bookmarkauthz.v1.Identity;
import bookmarkauthz.v1.IdentityDirectoryServiceGrpc;
import com.bookmarkauthz.authz.AuthzError;
import com.bookmarkauthz.common.status.StatusOr;
import io.grpc.StatusRuntimeException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.tinylog.Logger;

/** Reads membership from the identity directory's gRPC service, with a per-call deadline. */
public class GrpcIdentityDirectory implements IdentityDirectory {

  private final IdentityDirectoryServiceGrpc.IdentityDirectoryServiceBlockingStub stub;
  private final Duration deadline;

  public GrpcIdentityDirectory(
      IdentityDirectoryServiceGrpc.IdentityDirectoryServiceBlockingStub stub, Duration deadline) {
    this.stub = stub;
    this.deadline = deadline;
  }

  @Override
  public StatusOr<Membership> lookupMembership(int tenantId, String userId) {
    Identity.GetUserRolesRequest request =
        Identity.GetUserRolesRequest.newBuilder().setTenantId(tenantId).setUserId(userId).build();
    try {
      Identity.GetUserRolesResponse response =
          stub.withDeadlineAfter(deadline.toMillis(), TimeUnit.MILLISECONDS).getUserRoles(request);
      return StatusOr.ofValue(
          new Membership(response.getTenantId(), response.getRoleCodesList()));
    } catch (StatusRuntimeException e) {
      Logger.warn("Identity directory call for user {} failed: {}", userId, e.getStatus());
      return StatusOr.ofStatus(AuthzError.IDENTITY_UNAVAILABLE.toStatus(
          "identity directory returned " + e.getStatus().getCode(), e));
    }
  }
}
