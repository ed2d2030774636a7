package com.wccms.rest;

import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.path;
import static io.javalin.apibuilder.ApiBuilder.post;

import com.wccms.auth.AuthService;
import com.wccms.auth.AuthSession;
import com.wccms.common.status.StatusOr;
import com.wccms.db.User;
import com.wccms.rest.dto.ApiResponse;
import com.wccms.rest.dto.AuthResponse;
import com.wccms.rest.dto.CsrfTokenResponse;
import com.wccms.rest.dto.LoginRequest;
import com.wccms.rest.dto.RefreshRequest;
import com.wccms.rest.dto.RegisterRequest;
import com.wccms.rest.dto.UserResponse;
import com.wccms.security.CsrfGuard;
import com.wccms.security.PasswordService;
import com.wccms.security.gate.AuthorizationGates;
import com.wccms.security.gate.GatePipeline;
import io.javalin.http.Context;
import java.util.Map;
import org.tinylog.Logger;

/** REST adapter for login, token refresh, registration, profile and anti-forgery tokens. */
public class AuthRestAdapter implements RestAdapter {

  private final AuthService authService;
  private final CsrfGuard csrfGuard;
  private final AuthorizationGates gates;

  public AuthRestAdapter(AuthService authService, CsrfGuard csrfGuard, AuthorizationGates gates) {
    this.authService = authService;
    this.csrfGuard = csrfGuard;
    this.gates = gates;
  }

  @Override
  public void registerRoutes() {
    path(
        "/v1/auth",
        () -> {
          post("login", this::handleLogin);
          post("refresh", this::handleRefresh);
          get("csrf-token", this::handleCsrfToken);
          get(
              "profile",
              new GatedHandler(GatePipeline.of(gates.authenticate()), this::handleProfile));
          post(
              "register",
              new GatedHandler(
                  GatePipeline.of(gates.verifyCsrf(), gates.authenticate(), gates.requireAdmin()),
                  this::handleRegister));
        });
  }

  /**
   * Handles {@code POST /v1/auth/login}.
   *
   * @param ctx The Javalin context containing the request and response
   */
  public void handleLogin(Context ctx) {
    StatusOr<LoginRequest> bodyOr = parseBody(ctx, LoginRequest.class);
    if (bodyOr.isNotOk()) {
      setError(ctx, bodyOr.getStatus());
      return;
    }
    LoginRequest body = bodyOr.getValue();
    writeSession(ctx, authService.login(body.username(), body.password()), 200);
  }

  /** Handles {@code POST /v1/auth/refresh}. */
  public void handleRefresh(Context ctx) {
    StatusOr<RefreshRequest> bodyOr = parseBody(ctx, RefreshRequest.class);
    if (bodyOr.isNotOk()) {
      setError(ctx, bodyOr.getStatus());
      return;
    }
    writeSession(ctx, authService.refresh(bodyOr.getValue().refreshToken()), 200);
  }

  /** Handles {@code POST /v1/auth/register}; administrators only. */
  public void handleRegister(Context ctx) {
    StatusOr<RegisterRequest> bodyOr = parseBody(ctx, RegisterRequest.class);
    if (bodyOr.isNotOk()) {
      setError(ctx, bodyOr.getStatus());
      return;
    }
    RegisterRequest body = bodyOr.getValue();
    StatusOr<AuthSession> sessionOr =
        authService.register(identity(ctx), body.toRegistration());
    if (sessionOr.isNotOk() && "WEAK_PASSWORD".equals(sessionOr.getStatus().getReason())) {
      setError(
          ctx,
          sessionOr.getStatus().getHttpCode(),
          "WEAK_PASSWORD",
          sessionOr.getStatus().getMessage(),
          Map.of("errors", PasswordService.checkStrength(body.password()).violations()));
      return;
    }
    writeSession(ctx, sessionOr, 201);
  }

  /** Handles {@code GET /v1/auth/profile}. */
  public void handleProfile(Context ctx) {
    StatusOr<User> userOr = authService.profile(identity(ctx).userId());
    if (userOr.isNotOk()) {
      setError(ctx, userOr.getStatus());
      return;
    }
    ctx.json(ApiResponse.of(UserResponse.from(userOr.getValue())));
  }

  /**
   * Handles {@code GET /v1/auth/csrf-token}. The token is bound to the {@value
   * CsrfGuard#SESSION_HEADER} session and also returned in the {@value CsrfGuard#HEADER} header.
   */
  public void handleCsrfToken(Context ctx) {
    String sessionId = AuthorizationGates.sessionId(new JavalinRequestContext(ctx));
    String token = csrfGuard.issue(sessionId);
    Logger.debug("Issued CSRF token for session {}.", sessionId);
    ctx.header(CsrfGuard.HEADER, token);
    ctx.json(ApiResponse.of(new CsrfTokenResponse(token, sessionId)));
  }

  private void writeSession(Context ctx, StatusOr<AuthSession> sessionOr, int successCode) {
    if (sessionOr.isNotOk()) {
      setError(ctx, sessionOr.getStatus());
      return;
    }
    ctx.status(successCode).json(ApiResponse.of(AuthResponse.from(sessionOr.getValue())));
  }
}
