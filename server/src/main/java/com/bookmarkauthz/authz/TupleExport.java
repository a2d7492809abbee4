package com.bookmarkauthz.authz;

import com.bookmarkauthz.db.PermissionTuple;
import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.List;

/**
 * A snapshot of stored tuples, taken for backup.
 *
 * @param tenantId the exported tenant, or 0 for an export of every tenant
 * @param fullExport true when every tenant was exported
 * @param exportedAt when the snapshot was taken
 * @param tuples the tuples, oldest first, expired ones included
 */
public record TupleExport(
    int tenantId, boolean fullExport, Instant exportedAt, List<PermissionTuple> tuples) {

  public TupleExport {
    tuples = ImmutableList.copyOf(tuples);
  }
}
