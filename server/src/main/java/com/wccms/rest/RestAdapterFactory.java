package com.wccms.rest;

import com.wccms.acl.FolderAccessControl;
import com.wccms.auth.AuthService;
import com.wccms.security.CsrfGuard;
import com.wccms.security.gate.AuthorizationGates;
import io.javalin.config.RouterConfig;
import java.time.Clock;
import java.util.List;

/**
 * Creates the REST adapters and registers their routes on the Javalin router.
 */
public class RestAdapterFactory {

  private final AuthRestAdapter authAdapter;
  private final FolderRestAdapter folderAdapter;
  private final List<RestAdapter> adapters;

  public RestAdapterFactory(
      AuthService authService,
      FolderAccessControl folderAccessControl,
      CsrfGuard csrfGuard,
      AuthorizationGates gates,
      Clock clock) {
    this.authAdapter = new AuthRestAdapter(authService, csrfGuard, gates);
    this.folderAdapter = new FolderRestAdapter(folderAccessControl, gates, clock);
    this.adapters = List.of(authAdapter, folderAdapter);
  }

  /**
   * Configures the Javalin router to use the REST adapters.
   */
  public void configureRoutes(RouterConfig router) {
    router.apiBuilder(() -> adapters.forEach(RestAdapter::registerRoutes));
  }

  public AuthRestAdapter getAuthAdapter() {
    return authAdapter;
  }

  public FolderRestAdapter getFolderAdapter() {
    return folderAdapter;
  }
}
