package com.bookmarkauthz.identity;

import static org.junit.jupiter.api.Assertions.*;

import com.bookmarkauthz.authz.AuthzError;
import com.bookmarkauthz.common.status.StatusOr;
import com.bookmarkauthz.security.RequestContext;
import com.bookmarkauthz.security.RequestContextInterceptor;
import io.grpc.Context;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ForwardedRolesIdentityDirectoryTest {

  private final ForwardedRolesIdentityDirectory directory = new ForwardedRolesIdentityDirectory();

  @Test
  void testReturnsForwardedRolesOfTheCaller() throws Exception {
    RequestContext caller = new RequestContext(4, "101", "ada", List.of("editor", "team"));

    StatusOr<Membership> result = withCaller(caller, "101");

    assertEquals(new Membership(4, List.of("editor", "team")), result.getValue());
  }

  @Test
  void testOtherUsersAreUnavailable() throws Exception {
    RequestContext caller = new RequestContext(4, "101", "ada", List.of("editor"));

    StatusOr<Membership> result = withCaller(caller, "102");

    assertTrue(AuthzError.IDENTITY_UNAVAILABLE.matches(result.getStatus()));
  }

  @Test
  void testNoForwardedIdentityIsUnavailable() {
    StatusOr<Membership> result = directory.lookupMembership(4, "101");

    assertTrue(AuthzError.IDENTITY_UNAVAILABLE.matches(result.getStatus()));
  }

  private StatusOr<Membership> withCaller(RequestContext caller, String userId) throws Exception {
    return Context.current()
        .withValue(RequestContextInterceptor.REQUEST_CONTEXT_KEY, caller)
        .call(() -> directory.lookupMembership(caller.tenantId(), userId));
  }
}
