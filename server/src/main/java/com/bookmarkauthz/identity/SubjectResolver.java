package com.bookmarkauthz.identity;

import com.bookmarkauthz.authz.SubjectRef;
import com.bookmarkauthz.common.status.StatusOr;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;

/**
 * Expands a user into the subjects a permission tuple may name on their behalf.
 *
 * <p>The resolved set holds exactly, in this order: {@code (USER, userId)}, one
 * {@code (ROLE, code)} per role the user holds in the tenant, and {@code (TENANT, tenantId)}.
 *
 * <p>Failures are errors, never an empty set: an unreachable or slow identity source yields
 * {@link com.bookmarkauthz.authz.AuthzError#IDENTITY_UNAVAILABLE}, and a user who belongs to a
 * different tenant yields {@link com.bookmarkauthz.authz.AuthzError#TENANT_MISMATCH}.
 */
public interface SubjectResolver {

  StatusOr<ImmutableSet<SubjectRef>> resolveSubjects(int tenantId, String userId);

  /** Builds the ordered subject set for a user holding the given roles. */
  static ImmutableSet<SubjectRef> subjectSet(
      int tenantId, String userId, Collection<String> roleCodes) {
    ImmutableSet.Builder<SubjectRef> subjects = ImmutableSet.builder();
    subjects.add(SubjectRef.user(userId));
    for (String roleCode : roleCodes) {
      subjects.add(SubjectRef.role(roleCode));
    }
    subjects.add(SubjectRef.tenant(tenantId));
    return subjects.build();
  }
}
