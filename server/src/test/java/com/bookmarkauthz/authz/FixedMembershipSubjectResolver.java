package com.bookmarkauthz.authz;

import com.bookmarkauthz.common.status.Status;
import com.bookmarkauthz.common.status.StatusOr;
import com.bookmarkauthz.identity.Membership;
import com.bookmarkauthz.identity.SubjectResolver;
import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Subject resolver backed by a fixed membership table. Users that were never added belong to the
 * tenant they are asked about and hold no roles.
 */
public class FixedMembershipSubjectResolver implements SubjectResolver {

  private final Map<String, Membership> memberships = new HashMap<>();
  @Nullable private Status failure;

  public FixedMembershipSubjectResolver addUser(int tenantId, String userId, String... roles) {
    memberships.put(userId, new Membership(tenantId, List.of(roles)));
    return this;
  }

  /** Makes every following resolution fail with the given status, or succeed again if null. */
  public void failWith(@Nullable Status status) {
    this.failure = status;
  }

  public void clear() {
    memberships.clear();
    failure = null;
  }

  @Override
  public StatusOr<ImmutableSet<SubjectRef>> resolveSubjects(int tenantId, String userId) {
    if (failure != null) {
      return StatusOr.ofStatus(failure);
    }
    Membership membership = memberships.getOrDefault(userId, new Membership(tenantId, List.of()));
    if (membership.tenantId() != tenantId) {
      return StatusOr.ofStatus(
          AuthzError.TENANT_MISMATCH.toStatus("user " + userId + " is not in tenant " + tenantId));
    }
    return StatusOr.ofValue(SubjectResolver.subjectSet(tenantId, userId, membership.roleCodes()));
  }
}
