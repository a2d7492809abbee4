package com.bookmarkauthz.authz;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Tally of a tuple import.
 *
 * @param total tuples submitted
 * @param created tuples inserted under a free key
 * @param updated stored tuples overwritten
 * @param skipped stored tuples left alone
 * @param failed tuples rejected; each has a warning
 * @param warnings one line per rejected tuple
 */
public record ImportResult(
    int total, int created, int updated, int skipped, int failed, List<String> warnings) {

  public ImportResult {
    warnings = ImmutableList.copyOf(warnings);
  }

  /** Returns true if no tuple was rejected. */
  public boolean success() {
    return failed == 0;
  }
}
