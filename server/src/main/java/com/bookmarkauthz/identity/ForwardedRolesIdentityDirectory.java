package com.bookmarkauthz.identity;

import com.bookmarkauthz.authz.AuthzError;
import com.bookmarkauthz.common.status.StatusOr;
import com.bookmarkauthz.security.RequestContext;
import com.bookmarkauthz.security.RequestContextInterceptor;

/**
 * Membership taken from the identity the gateway forwarded with the request. It only knows about
 * the calling user; asking about anyone else is reported as unavailable rather than answered with
 * an empty role list.
 */
public class ForwardedRolesIdentityDirectory implements IdentityDirectory {

  @Override
  public StatusOr<Membership> lookupMembership(int tenantId, String userId) {
    RequestContext caller = RequestContextInterceptor.REQUEST_CONTEXT_KEY.get();
    if (caller == null) {
      return StatusOr.ofStatus(
          AuthzError.IDENTITY_UNAVAILABLE.toStatus("no forwarded identity on this call"));
    }
    if (!caller.userId().equals(userId)) {
      return StatusOr.ofStatus(AuthzError.IDENTITY_UNAVAILABLE.toStatus(
          "no role information for user " + userId));
    }
    return StatusOr.ofValue(new Membership(caller.tenantId(), caller.roles()));
  }
}
