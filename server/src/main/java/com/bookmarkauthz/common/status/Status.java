package com.bookmarkauthz.common.status;

import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Represents the status of an operation, possibly with additional error details. Modeled on the
 * gRPC Status: a code, a human readable message, an optional cause, and an optional
 * machine-readable reason (the equivalent of {@code google.rpc.ErrorInfo.reason}) that lets
 * callers tell apart failures sharing a code.
 */
public class Status {
  private final StatusCode code;
  private final String message;
  private final String reason;
  private final Throwable cause;

  private Status(StatusCode code, String message, String reason, Throwable cause) {
    this.code = Objects.requireNonNull(code);
    this.message = message;
    this.reason = reason;
    this.cause = cause;
  }

  /** Creates a new status with the given code and message. */
  public static Status of(StatusCode code, String message) {
    return new Status(code, message, null, null);
  }

  /** Creates a new status with the given code, message, and cause. */
  public static Status of(StatusCode code, String message, Throwable cause) {
    return new Status(code, message, null, cause);
  }

  /** Creates a new status with the given code, reason, message, and cause. */
  public static Status of(
      StatusCode code, String reason, String message, @Nullable Throwable cause) {
    return new Status(code, message, reason, cause);
  }

  /** Creates a new OK status. */
  public static Status ok() {
    return new Status(StatusCode.OK, null, null, null);
  }

  /** Creates a new NOT_FOUND status with the given message. */
  public static Status notFound(String message) {
    return new Status(StatusCode.NOT_FOUND, message, null, null);
  }

  /** Creates a new INTERNAL status with the given message and cause. */
  public static Status internal(String message, Throwable cause) {
    return new Status(StatusCode.INTERNAL, message, null, cause);
  }

  /** Creates a new INVALID_ARGUMENT status with the given message. */
  public static Status invalidArgument(String message) {
    return new Status(StatusCode.INVALID_ARGUMENT, message, null, null);
  }

  /** Creates a new ALREADY_EXISTS status with the given message. */
  public static Status alreadyExists(String message) {
    return new Status(StatusCode.ALREADY_EXISTS, message, null, null);
  }

  /** Creates a new UNAUTHENTICATED status with the given message. */
  public static Status unauthenticated(String message) {
    return new Status(StatusCode.UNAUTHENTICATED, message, null, null);
  }

  /** Creates a new PERMISSION_DENIED status with the given message. */
  public static Status permissionDenied(String message) {
    return new Status(StatusCode.PERMISSION_DENIED, message, null, null);
  }

  /** Creates a new UNAVAILABLE status with the given message and cause. */
  public static Status unavailable(String message, @Nullable Throwable cause) {
    return new Status(StatusCode.UNAVAILABLE, message, null, cause);
  }

  /** Returns the code for this status. */
  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  /** Returns the HTTP status code corresponding to this status. */
  public int getHttpCode() {
    return code.getHttpCode();
  }

  /** Returns the message for this status, or null if there is no message. */
  public String getMessage() {
    return message;
  }

  /** Returns the machine-readable reason, or null if none was attached. */
  @Nullable
  public String getReason() {
    return reason;
  }

  /** Returns the cause of this status, or null if there is no cause. */
  public Throwable getCause() {
    return cause;
  }

  /** Returns true if this status represents an error (i.e., the code is not OK). */
  public boolean isError() {
    return code != StatusCode.OK;
  }

  /** Returns true if this status is OK. */
  public boolean isOk() {
    return code == StatusCode.OK;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(code.toString());
    if (reason != null) {
      sb.append(" [").append(reason).append(']');
    }
    if (message != null) {
      sb.append(": ").append(message);
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Status other = (Status) obj;
    return code == other.code
        && Objects.equals(message, other.message)
        && Objects.equals(reason, other.reason)
        && Objects.equals(cause, other.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, reason, cause);
  }
}
