package com.bookmarkauthz.rest;

import static io.javalin.apibuilder.ApiBuilder.delete;
import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.path;
import static io.javalin.apibuilder.ApiBuilder.post;

import bookmarkauthz.v1.BookmarkPermissionServiceGrpc;
import io.grpc.ManagedChannel;
import io.javalin.config.RouterConfig;
import java.util.ArrayList;
import java.util.List;

/**
 * Factory for the REST adapters, wiring each to its gRPC service stub and to its routes.
 */
public class RestAdapterFactory {

  private final List<RestAdapter> adapters = new ArrayList<>();
  private final PermissionServiceRestAdapter permissionAdapter;

  /**
   * Creates a new RestAdapterFactory with the specified gRPC service stub.
   *
   * @param permissionService The BookmarkPermissionService gRPC stub
   */
  public RestAdapterFactory(
      BookmarkPermissionServiceGrpc.BookmarkPermissionServiceBlockingStub permissionService) {
    this.permissionAdapter = new PermissionServiceRestAdapter(permissionService);
    adapters.add(permissionAdapter);
  }

  /**
   * Creates a new RestAdapterFactory with service stubs created from the provided channel.
   *
   * @param channel The gRPC managed channel to use for creating service stubs
   * @return A new RestAdapterFactory instance
   */
  public static RestAdapterFactory createWithChannel(ManagedChannel channel) {
    return new RestAdapterFactory(BookmarkPermissionServiceGrpc.newBlockingStub(channel));
  }

  /**
   * Configures the Javalin router to use the REST adapters.
   */
  public void configureRoutes(RouterConfig router) {
    router.apiBuilder(
        () -> {
          path(
              "/v1/permissions",
              () -> {
                post(permissionAdapter::handleGrantAccess);
                get(permissionAdapter::handleListPermissions);
                delete(permissionAdapter::handleRevokeAccess);
                path("check", () -> post(permissionAdapter::handleCheckAccess));
                path("accessible", () -> get(permissionAdapter::handleListAccessibleResources));
                path("effective", () -> get(permissionAdapter::handleGetEffectivePermissions));
                path("owner", () -> post(permissionAdapter::handleClaimOwnership));
                path("resource", () -> delete(permissionAdapter::handleDeleteResourcePermissions));
                path("export", () -> get(permissionAdapter::handleExportPermissions));
                path("import", () -> post(permissionAdapter::handleImportPermissions));
              });
        });
    adapters.forEach(RestAdapter::registerRoutes);
  }

  public PermissionServiceRestAdapter getPermissionAdapter() {
    return permissionAdapter;
  }
}
