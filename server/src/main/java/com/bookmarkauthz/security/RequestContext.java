package com.bookmarkauthz.security;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Identity of the caller of a request, as forwarded by the gateway.
 *
 * @param tenantId the caller's tenant; 0 only for platform administrators
 * @param userId the caller's user id, never empty
 * @param username the caller's display name, possibly empty
 * @param roles role codes the gateway reported for the caller
 */
public record RequestContext(int tenantId, String userId, String username, List<String> roles) {

  public static final String PLATFORM_ADMIN_ROLE = "platform:admin";
  public static final String SUPER_ADMIN_ROLE = "super:admin";

  public RequestContext {
    roles = ImmutableList.copyOf(roles);
  }

  public boolean isPlatformAdmin() {
    return roles.contains(PLATFORM_ADMIN_ROLE) || roles.contains(SUPER_ADMIN_ROLE);
  }

  /** Returns the user id as recorded in granted_by, or null when it is not numeric. */
  @Nullable
  public Integer grantorId() {
    return Ints.tryParse(userId);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("tenantId", tenantId)
        .add("userId", userId)
        .add("roles", roles)
        .toString();
  }
}
