package com.bookmarkauthz.identity;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * What the identity directory knows about a user.
 *
 * @param tenantId the tenant the user belongs to
 * @param roleCodes the roles the user holds in that tenant
 */
public record Membership(int tenantId, List<String> roleCodes) {

  public Membership {
    roleCodes = ImmutableList.copyOf(roleCodes);
  }
}
