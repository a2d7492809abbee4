/**
 * Status values used instead of exceptions for expected failures.
 *
 * <p>{@link com.bookmarkauthz.common.status.StatusOr} holds either a value or a non-OK
 * {@link com.bookmarkauthz.common.status.Status}. DAO helpers, the authorization engine and the
 * subject resolvers all return it; the gRPC layer translates a failed status into a gRPC error
 * carrying the same code name.
 *
 * <pre>
 * StatusOr&lt;CheckResult&gt; resultOr = engine.check(tenantId, userId, type, resourceId, perm);
 * if (resultOr.isNotOk()) {
 *   Logger.warn("Check failed: {}", resultOr.getStatus());
 *   return;
 * }
 * </pre>
 */
package com.bookmarkauthz.common.status;
