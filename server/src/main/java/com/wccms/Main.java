package com.wccms;

import com.google.common.base.Strings;
import com.wccms.acl.FolderAccessControl;
import com.wccms.auth.AuthService;
import com.wccms.config.AuthConfig;
import com.wccms.db.JdbcFolderStore;
import com.wccms.db.JdbcUserDirectory;
import com.wccms.rest.RestAdapterFactory;
import com.wccms.security.CsrfGuard;
import com.wccms.security.PasswordService;
import com.wccms.security.PermissionMatrix;
import com.wccms.security.RolePolicies;
import com.wccms.security.TokenService;
import com.wccms.security.gate.AuthorizationGates;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.javalin.Javalin;
import io.javalin.plugin.bundled.CorsPluginConfig.CorsRule;
import java.time.Clock;
import org.tinylog.Logger;

/**
 * Entry point of the CMS authentication and access-control server.
 *
 * <p>Reads {@link AuthConfig} and the database settings from the environment, wires the engine
 * together and serves it over Javalin.
 *
 * <h2>Error Handling</h2>
 *
 * <ul>
 *   <li>Validation errors return 400 Bad Request
 *   <li>Authentication errors return 401 Unauthorized
 *   <li>Permission and anti-forgery errors return 403 Forbidden
 *   <li>Not found errors return 404 Not Found
 *   <li>Server errors, including indeterminate ownership checks, return 500
 * </ul>
 */
public class Main {

  private static final int DEFAULT_REST_PORT = 8080;

  private final HikariDataSource dataSource;
  private final PasswordService passwordService;
  private final RestAdapterFactory restAdapterFactory;
  private Javalin app;

  public Main(AuthConfig config) {
    Logger.info("Configured authentication: {}", config.toSecureString());
    this.dataSource = setupDataSource();

    Clock clock = Clock.systemUTC();
    PermissionMatrix matrix = PermissionMatrix.STANDARD;
    RolePolicies policies = new RolePolicies(matrix);
    TokenService tokenService = new TokenService(config, clock);
    CsrfGuard csrfGuard = new CsrfGuard(config);
    this.passwordService = new PasswordService(config);
    JdbcUserDirectory users = new JdbcUserDirectory(dataSource);
    FolderAccessControl folders =
        new FolderAccessControl(new JdbcFolderStore(dataSource, clock));
    AuthorizationGates gates =
        new AuthorizationGates(tokenService, users, matrix, csrfGuard, clock);
    AuthService authService =
        new AuthService(users, passwordService, tokenService, policies, clock);

    this.restAdapterFactory =
        new RestAdapterFactory(authService, folders, csrfGuard, gates, clock);
  }

  /**
   * Sets up and configures the HikariCP connection pool with database properties from the
   * environment.
   *
   * @return A configured HikariDataSource for database connections
   */
  private HikariDataSource setupDataSource() {
    String dbUrl = System.getenv("DB_URL");
    String dbUser = System.getenv("DB_USER");
    String dbPassword = System.getenv("DB_PASSWORD");

    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(dbUrl);
    config.setUsername(dbUser);
    config.setPassword(dbPassword);
    config.setMaximumPoolSize(10);
    config.setMinimumIdle(2);
    config.setIdleTimeout(30000);
    config.setMaxLifetime(1800000);
    config.setConnectionTimeout(30000);
    config.setAutoCommit(true);
    config.setPoolName("WccmsPool");
    config.addDataSourceProperty("cachePrepStmts", "true");
    config.addDataSourceProperty("prepStmtCacheSize", "250");
    config.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");

    Logger.info("Initializing database connection pool with URL: {} and user {}", dbUrl, dbUser);
    return new HikariDataSource(config);
  }

  public void startJavalinServer(int port) {
    app =
        Javalin.create(
            config -> {
              config.bundledPlugins.enableCors(cors -> cors.addRule(CorsRule::anyHost));
              restAdapterFactory.configureRoutes(config.router);
            });
    app.exception(
        Exception.class,
        (e, ctx) -> {
          Logger.error(e, "Unhandled failure on {} {}.", ctx.method(), ctx.path());
          restAdapterFactory
              .getAuthAdapter()
              .setError(ctx, 500, "INTERNAL_ERROR", "Internal server error");
        });
    app.start(port);
    Logger.info("REST server started, listening on port {}.", port);

    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  Logger.info("Shutting down server since JVM is shutting down");
                  try {
                    shutdown();
                  } catch (Exception e) {
                    Logger.error(e, "Error during shutdown.");
                  }
                }));
  }

  private void shutdown() {
    if (app != null) {
      app.stop();
    }
    passwordService.close();
    // Shut down HikariCP connection pool
    if (dataSource != null && !dataSource.isClosed()) {
      Logger.info("Shutting down database connection pool");
      dataSource.close();
    }
  }

  public static void main(String[] args) {
    String port = System.getenv("REST_PORT");
    Main server = new Main(AuthConfig.fromEnvironment());
    server.startJavalinServer(
        Strings.isNullOrEmpty(port) ? DEFAULT_REST_PORT : Integer.parseInt(port));
  }
}
