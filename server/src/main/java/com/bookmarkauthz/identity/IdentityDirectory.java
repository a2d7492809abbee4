package com.bookmarkauthz.identity;

import com.bookmarkauthz.common.status.StatusOr;

/** Source of tenant and role membership. Implementations may block on network I/O. */
public interface IdentityDirectory {

  /**
   * Looks up a user's membership.
   *
   * @param tenantId the tenant the caller is acting in
   * @param userId the user to look up
   * @return the user's membership, or a failed status if the directory cannot answer
   */
  StatusOr<Membership> lookupMembership(int tenantId, String userId);
}
