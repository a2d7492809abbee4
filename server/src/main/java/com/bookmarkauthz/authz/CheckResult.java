package com.bookmarkauthz.authz;

import java.util.Optional;
import javax.annotation.Nullable;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Outcome of a permission check. A denial is a normal result, not an error.
 *
 * @param allowed whether the permission is held
 * @param matchedRelation the relation that satisfied the check, set only when allowed
 * @param reason why the check was denied, set only when denied
 */
public record CheckResult(
    boolean allowed, @Nullable Relation matchedRelation, @Nullable DenialReason reason) {

  @NotNull
  @Contract("_ -> new")
  public static CheckResult allowed(Relation matchedRelation) {
    return new CheckResult(true, matchedRelation, null);
  }

  @NotNull
  @Contract("_ -> new")
  public static CheckResult denied(DenialReason reason) {
    return new CheckResult(false, null, reason);
  }

  public Optional<DenialReason> denialReason() {
    return Optional.ofNullable(reason);
  }

  public Optional<Relation> relation() {
    return Optional.ofNullable(matchedRelation);
  }
}
