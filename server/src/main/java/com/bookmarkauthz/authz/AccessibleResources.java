package com.bookmarkauthz.authz;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * One page of the resources a user can reach with a permission.
 *
 * @param resourceIds distinct resource ids, ascending
 * @param total number of distinct resources before paging
 */
public record AccessibleResources(List<String> resourceIds, long total) {

  public AccessibleResources {
    resourceIds = ImmutableList.copyOf(resourceIds);
  }
}
