package com.bookmarkauthz.security;

import com.bookmarkauthz.common.status.Status;
import com.bookmarkauthz.common.status.StatusOr;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.primitives.Ints;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import java.util.List;
import org.tinylog.Logger;

/**
 * Reads the caller identity forwarded by the gateway and attaches it to the gRPC context.
 *
 * <p>Calls without a user id, or with tenant 0 from anyone but a platform administrator, are
 * closed with UNAUTHENTICATED before reaching the service.
 */
public class RequestContextInterceptor implements ServerInterceptor {
  public static final String TENANT_ID_HEADER = "x-md-global-tenant-id";
  public static final String USER_ID_HEADER = "x-md-global-user-id";
  public static final String USERNAME_HEADER = "x-md-global-username";
  public static final String ROLES_HEADER = "x-md-global-roles";

  public static final Metadata.Key<String> TENANT_ID_KEY =
      Metadata.Key.of(TENANT_ID_HEADER, Metadata.ASCII_STRING_MARSHALLER);
  public static final Metadata.Key<String> USER_ID_KEY =
      Metadata.Key.of(USER_ID_HEADER, Metadata.ASCII_STRING_MARSHALLER);
  public static final Metadata.Key<String> USERNAME_KEY =
      Metadata.Key.of(USERNAME_HEADER, Metadata.ASCII_STRING_MARSHALLER);
  public static final Metadata.Key<String> ROLES_KEY =
      Metadata.Key.of(ROLES_HEADER, Metadata.ASCII_STRING_MARSHALLER);

  // Context key for the caller of the current call
  public static final Context.Key<RequestContext> REQUEST_CONTEXT_KEY =
      Context.key("request-context");

  private static final Splitter ROLE_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  /**
   * Extracts the caller identity from request metadata.
   *
   * @return the caller, or UNAUTHENTICATED if the metadata does not identify one
   */
  public static StatusOr<RequestContext> extract(Metadata headers) {
    Integer parsedTenant = Ints.tryParse(Strings.nullToEmpty(headers.get(TENANT_ID_KEY)).trim());
    int tenantId = parsedTenant == null ? 0 : parsedTenant;

    List<String> roles = ROLE_SPLITTER.splitToList(Strings.nullToEmpty(headers.get(ROLES_KEY)));
    String userId = Strings.nullToEmpty(headers.get(USER_ID_KEY)).trim();
    String username = Strings.nullToEmpty(headers.get(USERNAME_KEY));

    RequestContext context = new RequestContext(tenantId, userId, username, roles);
    if (tenantId == 0 && !context.isPlatformAdmin()) {
      return StatusOr.ofStatus(Status.unauthenticated("missing or invalid tenant_id"));
    }
    if (userId.isEmpty()) {
      return StatusOr.ofStatus(Status.unauthenticated("missing user_id"));
    }
    return StatusOr.ofValue(context);
  }

  @Override
  public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
      ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
    StatusOr<RequestContext> contextOr = extract(headers);
    if (contextOr.isNotOk()) {
      String errorMsg = contextOr.getStatus().getMessage();
      Logger.warn(
          "Rejecting {}: {}", call.getMethodDescriptor().getFullMethodName(), errorMsg);
      call.close(io.grpc.Status.UNAUTHENTICATED.withDescription(errorMsg), new Metadata());
      return new ServerCall.Listener<ReqT>() {};
    }

    Context context = Context.current().withValue(REQUEST_CONTEXT_KEY, contextOr.getValue());
    return Contexts.interceptCall(context, call, headers, next);
  }
}
