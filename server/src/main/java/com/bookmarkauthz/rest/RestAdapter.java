package com.bookmarkauthz.rest;

import com.bookmarkauthz.PermissionServiceImpl;
import com.bookmarkauthz.common.status.Status;
import com.bookmarkauthz.common.status.StatusCode;
import com.bookmarkauthz.security.RequestContextInterceptor;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import io.grpc.Metadata;
import io.grpc.StatusRuntimeException;
import io.javalin.http.Context;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Base interface for REST adapters that bridge HTTP endpoints to a gRPC service.
 *
 * <p>Provides the shared error responses ({@code {"error": ..., "reason": ...}}) and the
 * forwarding of the gateway's identity headers onto the gRPC call.
 */
public interface RestAdapter {

  List<Metadata.Key<String>> FORWARDED_HEADERS =
      List.of(
          RequestContextInterceptor.TENANT_ID_KEY,
          RequestContextInterceptor.USER_ID_KEY,
          RequestContextInterceptor.USERNAME_KEY,
          RequestContextInterceptor.ROLES_KEY);

  /**
   * Sets an error response with the specified status code and message.
   *
   * @param ctx The Javalin context to set the error on
   * @param statusCode The HTTP status code to set
   * @param message The error message to include in the response
   */
  default void setError(Context ctx, int statusCode, String message) {
    setError(ctx, statusCode, message, null);
  }

  /**
   * Sets an error response that also names the failure's taxonomy token, such as {@code
   * TenantMismatch}.
   */
  default void setError(Context ctx, int statusCode, String message, @Nullable String reason) {
    Map<String, String> body =
        reason == null
            ? Map.of("error", Strings.nullToEmpty(message))
            : ImmutableMap.of("error", Strings.nullToEmpty(message), "reason", reason);
    ctx.status(statusCode).json(body);
    Logger.error("Error response: {} - {}", statusCode, message);
  }

  /** Sets an error response for a status produced before reaching the gRPC service. */
  default void setError(Context ctx, Status status) {
    setError(ctx, status.getHttpCode(), status.getMessage(), status.getReason());
  }

  /** Translates a failed gRPC call into the matching HTTP error. */
  default void setError(Context ctx, StatusRuntimeException e) {
    io.grpc.Status grpcStatus = e.getStatus();
    Metadata trailers = e.getTrailers();
    String reason = trailers == null ? null : trailers.get(PermissionServiceImpl.AUTHZ_ERROR_KEY);
    String message =
        grpcStatus.getDescription() == null
            ? grpcStatus.getCode().name()
            : grpcStatus.getDescription();
    setError(ctx, StatusCode.fromGrpcCode(grpcStatus.getCode()).getHttpCode(), message, reason);
  }

  /** Copies the caller identity headers of the HTTP request into gRPC metadata. */
  default Metadata forwardedHeaders(Context ctx) {
    Metadata headers = new Metadata();
    for (Metadata.Key<String> key : FORWARDED_HEADERS) {
      String value = ctx.header(key.name());
      if (value != null) {
        headers.put(key, value);
      }
    }
    return headers;
  }

  /**
   * Registers the REST endpoints handled by this adapter.
   *
   * <p>Route registration is normally done by {@link RestAdapterFactory}; adapters that need no
   * extra wiring leave this empty.
   */
  void registerRoutes();
}
