package com.wccms.security.gate;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.wccms.common.status.StatusOr;
import com.wccms.db.User;
import com.wccms.db.UserDirectory;
import com.wccms.security.CsrfGuard;
import com.wccms.security.IdentityClaim;
import com.wccms.security.Permission;
import com.wccms.security.PermissionChecker;
import com.wccms.security.PermissionMatrix;
import com.wccms.security.Role;
import com.wccms.security.TokenService;
import com.wccms.security.TokenUse;
import com.wccms.security.TokenVerificationException;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import org.tinylog.Logger;

/**
 * Factory for the request gates that routes compose into a {@link GatePipeline}.
 *
 * <p>Layering is fixed: a gate that needs an identity reports 401 before any 403, and the
 * ownership gate reports a missing resource id only once the caller is known.
 */
public class AuthorizationGates {

  public static final String AUTHORIZATION_HEADER = "Authorization";

  private static final Set<String> SAFE_METHODS = ImmutableSet.of("GET", "HEAD", "OPTIONS");

  private final TokenService tokens;
  private final UserDirectory users;
  private final PermissionMatrix matrix;
  private final CsrfGuard csrf;
  private final Clock clock;

  public AuthorizationGates(
      TokenService tokens,
      UserDirectory users,
      PermissionMatrix matrix,
      CsrfGuard csrf,
      Clock clock) {
    this.tokens = tokens;
    this.users = users;
    this.matrix = matrix;
    this.csrf = csrf;
    this.clock = clock;
  }

  /**
   * Verifies the bearer access token and re-checks the account it names. The token alone cannot
   * reveal a deactivation, so the account lookup happens on every request.
   */
  public Gate authenticate() {
    return Gate.of(Stage.AUTHENTICATION, "authenticate", this::authenticate);
  }

  private GateResult authenticate(RequestContext ctx) {
    String token = TokenService.extractFromHeader(ctx.header(AUTHORIZATION_HEADER));
    if (token == null) {
      return fail(ErrorCode.MISSING_TOKEN);
    }
    IdentityClaim claim;
    try {
      claim = tokens.verify(token, TokenUse.ACCESS);
    } catch (TokenVerificationException e) {
      return fail(ErrorCode.AUTHENTICATION_FAILED, e.getMessage());
    }
    StatusOr<Optional<User>> userOr = users.findById(claim.userId());
    if (userOr.isNotOk()) {
      Logger.error("Account lookup for {} failed: {}", claim.userId(), userOr.getStatus());
      return fail(ErrorCode.AUTHENTICATION_FAILED);
    }
    Optional<User> user = userOr.getValue();
    if (user.isEmpty() || !user.get().active()) {
      return fail(ErrorCode.INVALID_USER);
    }
    ctx.setIdentity(claim);
    Logger.debug("Authenticated {} as {}.", claim.username(), claim.role());
    return GateResult.pass();
  }

  /** Like {@link #authenticate()}, but any failure just leaves the request anonymous. */
  public Gate optionalAuth() {
    return Gate.of(
        Stage.AUTHENTICATION,
        "optionalAuth",
        ctx -> {
          try {
            if (authenticate(ctx).failure().isPresent()) {
              Logger.debug("{} {} continues unauthenticated.", ctx.method(), ctx.path());
            }
          } catch (RuntimeException e) {
            Logger.debug(
                e, "{} {} continues unauthenticated after an error.", ctx.method(), ctx.path());
          }
          return GateResult.pass();
        });
  }

  public Gate requireRole(Role... allowed) {
    ImmutableSet<Role> roles = ImmutableSet.copyOf(allowed);
    return Gate.of(
        Stage.AUTHORIZATION,
        "requireRole" + roles,
        ctx -> {
          Optional<IdentityClaim> identity = ctx.identity();
          if (identity.isEmpty()) {
            return fail(ErrorCode.AUTHENTICATION_REQUIRED);
          }
          if (!roles.contains(identity.get().role())) {
            return fail(ErrorCode.INSUFFICIENT_PERMISSIONS);
          }
          return GateResult.pass();
        });
  }

  public Gate requireAdmin() {
    return requireRole(Role.ADMINISTRATOR);
  }

  /** Editors and administrators. */
  public Gate requireEditor() {
    return requireRole(Role.ADMINISTRATOR, Role.EDITOR);
  }

  /** Requires at least one of the capabilities. */
  public Gate requirePermission(Permission... permissions) {
    return requirePermission(PermissionMode.ANY, permissions);
  }

  public Gate requireAllPermissions(Permission... permissions) {
    return requirePermission(PermissionMode.ALL, permissions);
  }

  public Gate requirePermission(PermissionMode mode, Permission... permissions) {
    ImmutableList<Permission> required = ImmutableList.copyOf(permissions);
    return Gate.of(
        Stage.AUTHORIZATION,
        "requirePermission" + required,
        ctx -> {
          Optional<IdentityClaim> identity = ctx.identity();
          if (identity.isEmpty()) {
            return fail(ErrorCode.AUTHENTICATION_REQUIRED);
          }
          if (!permitted(identity.get().role(), mode, required)) {
            return fail(ErrorCode.INSUFFICIENT_PERMISSIONS, insufficientMessage(mode, required));
          }
          return GateResult.pass();
        });
  }

  /**
   * Grants access to the owner of the resource named by the descriptor's path parameter, or to
   * an administrator when the descriptor allows it. An administrator covered by the override is
   * let through without consulting the ownership predicate.
   */
  public Gate requireOwnershipOrAdmin(OwnershipDescriptor descriptor) {
    return Gate.of(
        Stage.OWNERSHIP,
        "requireOwnershipOrAdmin",
        ctx -> {
          Optional<IdentityClaim> identity = ctx.identity();
          if (identity.isEmpty()) {
            return fail(ErrorCode.AUTHENTICATION_REQUIRED);
          }
          String resourceId = ctx.pathParam(descriptor.paramName());
          if (Strings.isNullOrEmpty(resourceId)) {
            return fail(
                ErrorCode.MISSING_RESOURCE_ID,
                "Resource ID parameter '" + descriptor.paramName() + "' is required");
          }
          IdentityClaim claim = identity.get();
          if (descriptor.allowAdminOverride() && claim.isAdministrator()) {
            return GateResult.pass();
          }
          boolean owner;
          try {
            owner = descriptor.check().isOwner(claim.userId(), resourceId);
          } catch (Exception e) {
            Logger.error(e, "Ownership check of {} for {} failed.", resourceId, claim.userId());
            return fail(ErrorCode.OWNERSHIP_CHECK_FAILED);
          }
          return owner ? GateResult.pass() : fail(ErrorCode.ACCESS_DENIED);
        });
  }

  /**
   * Administrator override, then self access, then the capability check. With self access
   * enabled and no capabilities configured, a caller who is neither gets ACCESS_DENIED.
   */
  public Gate conditionalAuth(ConditionalAccess access) {
    return Gate.of(
        Stage.AUTHORIZATION,
        "conditionalAuth",
        ctx -> {
          Optional<IdentityClaim> identity = ctx.identity();
          if (identity.isEmpty()) {
            return fail(ErrorCode.AUTHENTICATION_REQUIRED);
          }
          IdentityClaim claim = identity.get();
          if (access.adminOverride() && claim.isAdministrator()) {
            return GateResult.pass();
          }
          if (access.allowSelf() && claim.userId().equals(ctx.pathParam(access.paramName()))) {
            return GateResult.pass();
          }
          if (access.permissions().isEmpty()) {
            return access.allowSelf() ? fail(ErrorCode.ACCESS_DENIED) : GateResult.pass();
          }
          if (!permitted(claim.role(), access.mode(), access.permissions())) {
            return fail(
                ErrorCode.INSUFFICIENT_PERMISSIONS,
                insufficientMessage(access.mode(), access.permissions()));
          }
          return GateResult.pass();
        });
  }

  /**
   * Double-submit check for state-changing methods. GET, HEAD and OPTIONS pass untouched. The
   * session comes from {@value CsrfGuard#SESSION_HEADER}, defaulting to {@value
   * CsrfGuard#ANONYMOUS_SESSION}.
   */
  public Gate verifyCsrf() {
    return Gate.of(
        Stage.CSRF,
        "verifyCsrf",
        ctx -> {
          if (SAFE_METHODS.contains(ctx.method())) {
            return GateResult.pass();
          }
          String token = ctx.header(CsrfGuard.HEADER);
          if (Strings.isNullOrEmpty(token)) {
            return fail(ErrorCode.CSRF_TOKEN_MISSING);
          }
          if (!csrf.verify(token, sessionId(ctx))) {
            return fail(ErrorCode.CSRF_TOKEN_INVALID);
          }
          return GateResult.pass();
        });
  }

  /** The anti-forgery session id of a request. */
  public static String sessionId(RequestContext ctx) {
    String session = ctx.header(CsrfGuard.SESSION_HEADER);
    return Strings.isNullOrEmpty(session) ? CsrfGuard.ANONYMOUS_SESSION : session;
  }

  private boolean permitted(Role role, PermissionMode mode, ImmutableList<Permission> required) {
    PermissionChecker checker = matrix.checkerFor(role);
    Permission[] permissions = required.toArray(new Permission[0]);
    return mode == PermissionMode.ALL
        ? checker.hasAllPermissions(permissions)
        : checker.hasAnyPermission(permissions);
  }

  private static String insufficientMessage(
      PermissionMode mode, ImmutableList<Permission> required) {
    return "Insufficient permissions. Required: " + Joiner.on(mode.separator()).join(required);
  }

  private GateResult fail(ErrorCode code) {
    return fail(code, code.getDefaultMessage());
  }

  private GateResult fail(ErrorCode code, String message) {
    return GateResult.fail(new GateFailure(code, message, clock.instant()));
  }
}
