package com.bookmarkauthz.identity;

import com.bookmarkauthz.authz.AuthzError;
import com.bookmarkauthz.authz.SubjectRef;
import com.bookmarkauthz.common.status.Status;
import com.bookmarkauthz.common.status.StatusOr;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.grpc.Context;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.tinylog.Logger;

/**
 * Resolves subjects through an {@link IdentityDirectory}, bounding every lookup by a timeout.
 *
 * <p>A lookup that does not answer in time is cancelled and reported as
 * {@link AuthzError#IDENTITY_UNAVAILABLE}. The lookup runs with the caller's gRPC context, so
 * directories that read the forwarded request identity keep working.
 */
public class DirectorySubjectResolver implements SubjectResolver, AutoCloseable {

  /**
   * @param directory The membership source
   * @param timeout Upper bound on a single lookup
   */
  public record Config(IdentityDirectory directory, Duration timeout) {}

  private final Config config;
  private final ExecutorService executor;

  public DirectorySubjectResolver(Config config) {
    this.config = config;
    this.executor =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("identity-lookup-%d").setDaemon(true).build());
  }

  @Override
  public StatusOr<ImmutableSet<SubjectRef>> resolveSubjects(int tenantId, String userId) {
    Callable<StatusOr<Membership>> lookup =
        Context.current().wrap(() -> config.directory().lookupMembership(tenantId, userId));

    StatusOr<Membership> membershipOr;
    Future<StatusOr<Membership>> future = executor.submit(lookup);
    try {
      membershipOr = future.get(config.timeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      Logger.warn(
          "Identity lookup for user {} in tenant {} timed out after {} ms",
          userId, tenantId, config.timeout().toMillis());
      return StatusOr.ofStatus(AuthzError.IDENTITY_UNAVAILABLE.toStatus(
          "identity lookup timed out after " + config.timeout().toMillis() + " ms", e));
    } catch (ExecutionException e) {
      Logger.error(e.getCause(), "Identity lookup for user {} failed.", userId);
      return StatusOr.ofStatus(AuthzError.IDENTITY_UNAVAILABLE.toStatus(
          "identity lookup failed: " + e.getCause().getMessage(), e.getCause()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return StatusOr.ofStatus(
          AuthzError.IDENTITY_UNAVAILABLE.toStatus("identity lookup interrupted", e));
    }

    if (membershipOr.isNotOk()) {
      Status status = membershipOr.getStatus();
      if (AuthzError.TENANT_MISMATCH.matches(status)
          || AuthzError.IDENTITY_UNAVAILABLE.matches(status)) {
        return StatusOr.ofStatus(status);
      }
      return StatusOr.ofStatus(AuthzError.IDENTITY_UNAVAILABLE.toStatus(
          "identity lookup failed: " + status.getMessage(), status.getCause()));
    }

    Membership membership = membershipOr.getValue();
    if (membership.tenantId() != tenantId) {
      Logger.warn(
          "User {} belongs to tenant {}, not {}", userId, membership.tenantId(), tenantId);
      return StatusOr.ofStatus(AuthzError.TENANT_MISMATCH.toStatus(
          "user " + userId + " does not belong to tenant " + tenantId));
    }
    return StatusOr.ofValue(SubjectResolver.subjectSet(tenantId, userId, membership.roleCodes()));
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
