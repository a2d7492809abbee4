package com.bookmarkauthz;

import bookmarkauthz.v1.IdentityDirectoryServiceGrpc;
import com.bookmarkauthz.authz.AuthorizationEngine;
import com.bookmarkauthz.common.status.Status;
import com.bookmarkauthz.config.ServerConfig;
import com.bookmarkauthz.identity.DirectorySubjectResolver;
import com.bookmarkauthz.identity.ForwardedRolesIdentityDirectory;
import com.bookmarkauthz.identity.GrpcIdentityDirectory;
import com.bookmarkauthz.identity.IdentityDirectory;
import com.bookmarkauthz.rest.RestAdapterFactory;
import com.bookmarkauthz.security.RequestContextInterceptor;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.grpc.Grpc;
import io.grpc.InsecureChannelCredentials;
import io.grpc.InsecureServerCredentials;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.protobuf.services.ProtoReflectionServiceV1;
import io.javalin.Javalin;
import io.javalin.openapi.OpenApiInfo;
import io.javalin.openapi.OpenApiServer;
import io.javalin.openapi.plugin.OpenApiPlugin;
import io.javalin.openapi.plugin.redoc.ReDocPlugin;
import io.javalin.openapi.plugin.swagger.SwaggerPlugin;
import io.javalin.plugin.bundled.CorsPluginConfig.CorsRule;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import org.tinylog.Logger;

/**
 * Entry point of the bookmark authorization server.
 *
 * <p>Starts the gRPC {@code BookmarkPermissionService} and a REST facade that reaches the same
 * service through an in-process channel. Both surfaces read the caller from the gateway's
 * {@code x-md-global-*} headers.
 */
public class Main {

  private static final String IN_PROCESS_NAME = "bookmark-authz";

  private final ServerConfig serverConfig;
  private final HikariDataSource dataSource;
  private final DirectorySubjectResolver subjectResolver;
  private final PermissionServiceImpl permissionServiceImpl;
  private final ManagedChannel inProcessChannel;
  private ManagedChannel identityChannel;

  private Server grpcServer;
  private Server inProcessServer;

  public Main(ServerConfig serverConfig) {
    this.serverConfig = serverConfig;
    Logger.info("Starting with configuration {}", serverConfig.toSecureString());

    // Initialize database connection pool
    this.dataSource = setupDataSource();

    this.subjectResolver =
        new DirectorySubjectResolver(
            new DirectorySubjectResolver.Config(
                setupIdentityDirectory(), serverConfig.identityTimeout()));

    AuthorizationEngine engine =
        new AuthorizationEngine(new AuthorizationEngine.Config(dataSource, subjectResolver));
    this.permissionServiceImpl =
        new PermissionServiceImpl(new PermissionServiceImpl.Config(engine));

    // Create an in-process channel for REST-to-gRPC communication
    this.inProcessChannel = InProcessChannelBuilder.forName(IN_PROCESS_NAME).build();
  }

  /**
   * Sets up and configures the HikariCP connection pool.
   *
   * @return A configured HikariDataSource for database connections
   */
  private HikariDataSource setupDataSource() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(serverConfig.dbUrl());
    config.setUsername(serverConfig.dbUser());
    config.setPassword(serverConfig.dbPassword());
    config.setMaximumPoolSize(serverConfig.dbMaxConnections());
    config.setMinimumIdle(2);
    config.setIdleTimeout(30000);
    config.setMaxLifetime(1800000);
    config.setConnectionTimeout(5000);
    config.setAutoCommit(true);
    config.setPoolName("BookmarkAuthzPool");
    config.addDataSourceProperty("cachePrepStmts", "true");
    config.addDataSourceProperty("prepStmtCacheSize", "250");
    config.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");

    Logger.info(
        "Initializing database connection pool with URL: {} and user {}",
        serverConfig.dbUrl(), serverConfig.dbUser());
    return new HikariDataSource(config);
  }

  private IdentityDirectory setupIdentityDirectory() {
    if (serverConfig.identityDirectoryTarget().isEmpty()) {
      Logger.info("No identity directory configured; using roles forwarded with each request.");
      return new ForwardedRolesIdentityDirectory();
    }
    String target = serverConfig.identityDirectoryTarget().get();
    Logger.info("Using identity directory at {}", target);
    identityChannel = Grpc.newChannelBuilder(target, InsecureChannelCredentials.create()).build();
    return new GrpcIdentityDirectory(
        IdentityDirectoryServiceGrpc.newBlockingStub(identityChannel),
        serverConfig.identityTimeout());
  }

  public Status startGrpcServer() throws IOException {
    ServerServiceDefinition permissionDefinition =
        ServerInterceptors.intercept(permissionServiceImpl, new RequestContextInterceptor());

    grpcServer =
        Grpc.newServerBuilderForPort(serverConfig.grpcPort(), InsecureServerCredentials.create())
            .addService(permissionDefinition)
            .addService(ProtoReflectionServiceV1.newInstance())
            .build()
            .start();
    Logger.info("gRPC Server started, listening on port {}", serverConfig.grpcPort());

    inProcessServer =
        InProcessServerBuilder.forName(IN_PROCESS_NAME)
            .addService(permissionDefinition)
            .build()
            .start();

    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  Logger.info("Shutting down server since JVM is shutting down");
                  try {
                    Main.this.stopGrpcServer();
                    Main.this.shutdown();
                  } catch (InterruptedException e) {
                    Logger.error(e, "Server shutdown interrupted.");
                  } catch (Exception e) {
                    Logger.error(e, "Error during shutdown.");
                  }
                }));
    return Status.ok();
  }

  private void stopGrpcServer() throws InterruptedException {
    inProcessChannel.shutdown().awaitTermination(5, TimeUnit.SECONDS);
    if (inProcessServer != null) {
      inProcessServer.shutdown().awaitTermination(5, TimeUnit.SECONDS);
    }
    if (grpcServer != null) {
      grpcServer.shutdown().awaitTermination(30, TimeUnit.SECONDS);
    }
  }

  private void shutdown() throws InterruptedException {
    subjectResolver.close();
    if (identityChannel != null) {
      identityChannel.shutdown().awaitTermination(5, TimeUnit.SECONDS);
    }
    // Shut down HikariCP connection pool
    if (dataSource != null && !dataSource.isClosed()) {
      Logger.info("Shutting down database connection pool");
      dataSource.close();
    }
  }

  private OpenApiInfo getOpenApiInfo(OpenApiInfo openApiInfo) {
    return openApiInfo
        .title("Bookmark Authorization API")
        .description(
            "Relationship-based access control for bookmarks: grant and revoke relations,"
                + " check permissions, list the bookmarks a user can reach, and compute the"
                + " permissions a user holds on a bookmark. Every call is scoped to the tenant"
                + " forwarded by the gateway.")
        .version("v1");
  }

  private OpenApiServer getOpenApiServer(String version, OpenApiServer openApiServer) {
    return openApiServer
        .description("Bookmark authorization REST endpoint")
        .url("http://localhost:{port}{basePath}/" + version + "/")
        .variable("port", "Server's REST port", "8080", "8080")
        .variable("basePath", "Base path of the API", "/v1", "", "/v1");
  }

  public void startJavalinServer() {
    RestAdapterFactory restAdapterFactory = RestAdapterFactory.createWithChannel(inProcessChannel);

    // Note: redoc is available at /openapi
    Javalin app =
        Javalin.create(
            config -> {
              config.bundledPlugins.enableCors(cors -> cors.addRule(CorsRule::anyHost));
              config.registerPlugin(
                  new OpenApiPlugin(
                      openApiConfig ->
                          openApiConfig
                              .withPrettyOutput()
                              .withDefinitionConfiguration(
                                  (version, openApiDefinition) ->
                                      openApiDefinition
                                          .withInfo(this::getOpenApiInfo)
                                          .withServer(
                                              openApiServer ->
                                                  getOpenApiServer(version, openApiServer))
                                          .withSecurity(
                                              openApiSecurity ->
                                                  openApiSecurity
                                                      .withApiKeyAuth(
                                                          "TenantHeader",
                                                          RequestContextInterceptor
                                                              .TENANT_ID_HEADER)
                                                      .withApiKeyAuth(
                                                          "UserHeader",
                                                          RequestContextInterceptor
                                                              .USER_ID_HEADER)))));

              config.registerPlugin(
                  new ReDocPlugin(
                      reDocConfiguration -> reDocConfiguration.setDocumentationPath("/openapi")));

              config.registerPlugin(
                  new SwaggerPlugin(
                      swaggerConfiguration ->
                          swaggerConfiguration.setDocumentationPath("/openapi")));

              restAdapterFactory.configureRoutes(config.router);
            });

    app.start(serverConfig.restPort());

    Logger.info("REST server started, listening on port {}.", serverConfig.restPort());
  }

  public static void main(String[] args) throws IOException {
    Main server = new Main(ServerConfig.fromEnvironment(System.getenv()));
    server.startGrpcServer();
    server.startJavalinServer();
  }
}
