package com.bookmarkauthz.authz;

import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * The permissions a user holds on one resource after combining every active tuple that matches
 * one of the user's subjects.
 *
 * <p>Meant for deciding which actions a UI offers. Mutations must still go through a check.
 *
 * @param permissions union of the permissions of every matching relation
 * @param highestRelation highest-priority matching relation, or null when nothing matches
 */
public record EffectivePermissions(Set<Permission> permissions, @Nullable Relation highestRelation) {

  public static final EffectivePermissions NONE = new EffectivePermissions(ImmutableSet.of(), null);

  public EffectivePermissions {
    permissions = ImmutableSet.copyOf(permissions);
  }

  public Optional<Relation> highest() {
    return Optional.ofNullable(highestRelation);
  }
}
