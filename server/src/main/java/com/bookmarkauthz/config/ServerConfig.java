package com.bookmarkauthz.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.primitives.Ints;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Configuration of the authorization server, read once from the environment at start.
 *
 * @param dbUrl JDBC URL of the PostgreSQL tuple store
 * @param dbUser Database user
 * @param dbPassword Database password
 * @param dbMaxConnections Size of the connection pool
 * @param grpcPort Port the gRPC service listens on
 * @param restPort Port the REST facade listens on
 * @param identityTarget {@code host:port} of the identity directory, or null to rely on the roles
 *     forwarded with each request
 * @param identityTimeout Upper bound on a single subject resolution
 */
public record ServerConfig(
    String dbUrl,
    String dbUser,
    String dbPassword,
    int dbMaxConnections,
    int grpcPort,
    int restPort,
    @Nullable String identityTarget,
    Duration identityTimeout) {

  static final int DEFAULT_DB_MAX_CONNECTIONS = 20;
  static final int DEFAULT_GRPC_PORT = 9090;
  static final int DEFAULT_REST_PORT = 8080;
  static final int DEFAULT_IDENTITY_TIMEOUT_MS = 2000;

  /**
   * Reads the configuration from environment variables.
   *
   * @throws IllegalArgumentException if a numeric variable is not a positive integer
   */
  public static ServerConfig fromEnvironment(Map<String, String> env) {
    return new ServerConfig(
        env.get("DB_URL"),
        env.get("DB_USER"),
        env.get("DB_PASSWORD"),
        positiveInt(env, "DB_MAX_CONNECTIONS", DEFAULT_DB_MAX_CONNECTIONS),
        positiveInt(env, "GRPC_PORT", DEFAULT_GRPC_PORT),
        positiveInt(env, "REST_PORT", DEFAULT_REST_PORT),
        Strings.emptyToNull(env.get("IDENTITY_TARGET")),
        Duration.ofMillis(
            positiveInt(env, "IDENTITY_TIMEOUT_MS", DEFAULT_IDENTITY_TIMEOUT_MS)));
  }

  public Optional<String> identityDirectoryTarget() {
    return Optional.ofNullable(identityTarget);
  }

  /**
   * Returns a string representation of this object without the database password, safe for logs.
   */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("dbUrl", dbUrl())
        .add("dbUser", dbUser())
        .add("dbMaxConnections", dbMaxConnections())
        .add("grpcPort", grpcPort())
        .add("restPort", restPort())
        .add("identityTarget", identityTarget())
        .add("identityTimeout", identityTimeout())
        .toString();
  }

  private static int positiveInt(Map<String, String> env, String name, int defaultValue) {
    String raw = env.get(name);
    if (Strings.isNullOrEmpty(raw)) {
      return defaultValue;
    }
    Integer value = Ints.tryParse(raw.trim());
    if (value == null || value <= 0) {
      throw new IllegalArgumentException(name + " must be a positive integer, got: " + raw);
    }
    return value;
  }
}
