package com.bookmarkauthz.db.util;

import com.bookmarkauthz.common.status.Status;
import com.bookmarkauthz.common.status.StatusOr;
import com.google.protobuf.util.Timestamps;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.sql.Types;
import java.time.Instant;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Utility methods for database operations. */
public final class DbUtil {

  /** SQLState class for connection exceptions. */
  private static final String CONNECTION_EXCEPTION_CLASS = "08";

  private DbUtil() {
    // Utility class, no instances
  }

  /** Converts a java.time.Instant to java.sql.Timestamp. */
  @Nonnull
  public static java.sql.Timestamp toSqlTimestamp(Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null");
    }
    return java.sql.Timestamp.from(instant);
  }

  /** Converts a java.time.Instant to a Protocol Buffer Timestamp, keeping nanosecond precision. */
  @Nonnull
  public static com.google.protobuf.Timestamp toProtoTimestamp(Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null");
    }
    return com.google.protobuf.Timestamp.newBuilder()
        .setSeconds(instant.getEpochSecond())
        .setNanos(instant.getNano())
        .build();
  }

  /**
   * Converts a Protocol Buffer Timestamp to a java.time.Instant.
   *
   * @throws IllegalArgumentException if the timestamp is out of the valid range
   */
  @Nonnull
  public static Instant fromProtoTimestamp(com.google.protobuf.Timestamp timestamp) {
    if (timestamp == null) {
      throw new IllegalArgumentException("Timestamp cannot be null");
    }
    Timestamps.checkValid(timestamp);
    return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
  }

  /** Gets a non-null Instant from a ResultSet column. */
  @Nonnull
  public static StatusOr<Instant> getInstant(ResultSet rs, String columnName) {
    try {
      java.sql.Timestamp timestamp = rs.getTimestamp(columnName);
      if (rs.wasNull() || timestamp == null) {
        return StatusOr.ofStatus(Status.invalidArgument("Column " + columnName + " is null"));
      }
      return StatusOr.ofValue(timestamp.toInstant());
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get Instant: " + e.getMessage(), e));
    }
  }

  /** Gets an optional Instant from a ResultSet column. */
  @Nonnull
  public static StatusOr<Optional<Instant>> getOptionalInstant(ResultSet rs, String columnName) {
    try {
      java.sql.Timestamp timestamp = rs.getTimestamp(columnName);
      if (rs.wasNull() || timestamp == null) {
        return StatusOr.ofValue(Optional.empty());
      }
      return StatusOr.ofValue(Optional.of(timestamp.toInstant()));
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get Instant: " + e.getMessage(), e));
    }
  }

  /** Gets an optional Integer from a ResultSet column. */
  @Nonnull
  public static StatusOr<Optional<Integer>> getOptionalInteger(ResultSet rs, String columnName) {
    try {
      int value = rs.getInt(columnName);
      if (rs.wasNull()) {
        return StatusOr.ofValue(Optional.empty());
      }
      return StatusOr.ofValue(Optional.of(value));
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get Integer: " + e.getMessage(), e));
    }
  }

  /** Binds a nullable Instant as a TIMESTAMPTZ parameter. */
  public static void setOptionalTimestamp(
      PreparedStatement stmt, int parameterIndex, @Nullable Instant instant) throws SQLException {
    if (instant == null) {
      stmt.setNull(parameterIndex, Types.TIMESTAMP);
    } else {
      stmt.setTimestamp(parameterIndex, toSqlTimestamp(instant));
    }
  }

  /** Binds a nullable Integer parameter. */
  public static void setOptionalInteger(
      PreparedStatement stmt, int parameterIndex, @Nullable Integer value) throws SQLException {
    if (value == null) {
      stmt.setNull(parameterIndex, Types.INTEGER);
    } else {
      stmt.setInt(parameterIndex, value);
    }
  }

  /**
   * Returns true if the exception means the database could not be reached at all, as opposed to a
   * failing statement.
   */
  public static boolean isConnectionFailure(@Nullable Throwable throwable) {
    if (throwable instanceof SQLTransientConnectionException) {
      return true;
    }
    if (throwable instanceof SQLException) {
      String state = ((SQLException) throwable).getSQLState();
      return state != null && state.startsWith(CONNECTION_EXCEPTION_CLASS);
    }
    return false;
  }
}
