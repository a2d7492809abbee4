package com.bookmarkauthz.common.status;

/**
 * Status codes aligned with the gRPC code names, each mapped to the HTTP status the REST facade
 * answers with.
 */
public enum StatusCode {
  OK(200),
  CANCELLED(499),          // Client Closed Request
  UNKNOWN(500),
  INVALID_ARGUMENT(400),
  DEADLINE_EXCEEDED(504),
  NOT_FOUND(404),
  ALREADY_EXISTS(409),
  PERMISSION_DENIED(403),
  RESOURCE_EXHAUSTED(429),
  FAILED_PRECONDITION(400),
  ABORTED(409),
  OUT_OF_RANGE(400),
  UNIMPLEMENTED(501),
  INTERNAL(500),
  UNAVAILABLE(503),
  DATA_LOSS(500),
  UNAUTHENTICATED(401);

  private final int httpCode;

  StatusCode(int httpCode) {
    this.httpCode = httpCode;
  }

  /** Returns the corresponding HTTP status code. */
  public int getHttpCode() {
    return httpCode;
  }

  /** Returns the gRPC status code of the same name. */
  public io.grpc.Status.Code toGrpcCode() {
    return io.grpc.Status.Code.valueOf(name());
  }

  /** Returns the code of the same name as the given gRPC code. */
  public static StatusCode fromGrpcCode(io.grpc.Status.Code grpcCode) {
    return valueOf(grpcCode.name());
  }
}
