package com.wccms.auth;

import com.google.common.base.Strings;
import com.wccms.common.status.Status;
import com.wccms.common.status.StatusCode;
import com.wccms.common.status.StatusOr;
import com.wccms.db.User;
import com.wccms.db.UserDirectory;
import com.wccms.security.IdentityClaim;
import com.wccms.security.PasswordService;
import com.wccms.security.PasswordStrength;
import com.wccms.security.PolicyDecision;
import com.wccms.security.Role;
import com.wccms.security.RolePolicies;
import com.wccms.security.TokenService;
import com.wccms.security.TokenUse;
import com.wccms.security.TokenVerificationException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import org.tinylog.Logger;

/**
 * Login, registration, refresh-token exchange and profile lookup.
 *
 * <p>Failures are returned as statuses whose reason is a stable code such as {@code
 * INVALID_CREDENTIALS}. Unknown usernames and wrong passwords produce the same failure.
 */
public class AuthService {

  static final String INVALID_CREDENTIALS_MESSAGE = "Invalid username or password";

  private final UserDirectory users;
  private final PasswordService passwords;
  private final TokenService tokens;
  private final RolePolicies policies;
  private final Clock clock;

  public AuthService(
      UserDirectory users,
      PasswordService passwords,
      TokenService tokens,
      RolePolicies policies,
      Clock clock) {
    this.users = users;
    this.passwords = passwords;
    this.tokens = tokens;
    this.policies = policies;
    this.clock = clock;
  }

  public StatusOr<AuthSession> login(String username, String password) {
    if (Strings.isNullOrEmpty(username) || Strings.isNullOrEmpty(password)) {
      return failure(
          StatusCode.INVALID_ARGUMENT,
          "MISSING_CREDENTIALS",
          "Username and password are required");
    }
    StatusOr<Optional<User>> userOr = users.findByUsername(username);
    if (userOr.isNotOk()) {
      Logger.error("Login lookup for {} failed: {}", username, userOr.getStatus());
      return failure(StatusCode.INTERNAL, "LOGIN_FAILED", "Login failed due to server error");
    }
    if (userOr.getValue().isEmpty()) {
      return invalidCredentials(username);
    }
    User user = userOr.getValue().get();
    if (!user.active()) {
      return failure(StatusCode.UNAUTHENTICATED, "ACCOUNT_INACTIVE", "Account is inactive");
    }
    if (!passwords.verify(password, user.passwordHash())) {
      return invalidCredentials(username);
    }
    Instant now = clock.instant();
    Status recorded = users.updateLastLogin(user.id(), now);
    if (recorded.isError()) {
      Logger.warn("Could not record login of {}: {}", user.id(), recorded);
    }
    if (passwords.needsRehash(user.passwordHash())) {
      Logger.info("Password hash of {} uses outdated parameters.", user.id());
    }
    Logger.info("User {} logged in.", username);
    User loggedIn =
        new User(
            user.id(),
            user.username(),
            user.email(),
            user.passwordHash(),
            user.role(),
            user.active(),
            user.createdAt(),
            user.updatedAt(),
            now);
    return StatusOr.ofValue(session(loggedIn));
  }

  private StatusOr<AuthSession> invalidCredentials(String username) {
    Logger.info("Rejected login for {}.", username);
    return failure(StatusCode.UNAUTHENTICATED, "INVALID_CREDENTIALS", INVALID_CREDENTIALS_MESSAGE);
  }

  /**
   * Creates an account on behalf of {@code assigner}. Password violations are reported as a
   * single {@code WEAK_PASSWORD} failure; {@link PasswordService#checkStrength(String)} lists them.
   */
  public StatusOr<AuthSession> register(IdentityClaim assigner, RegistrationRequest request) {
    if (Strings.isNullOrEmpty(request.username())
        || Strings.isNullOrEmpty(request.email())
        || Strings.isNullOrEmpty(request.password())
        || Strings.isNullOrEmpty(request.role())) {
      return failure(
          StatusCode.INVALID_ARGUMENT,
          "MISSING_FIELDS",
          "Username, email, password, and role are required");
    }
    PolicyDecision assignable = policies.canAssignRole(assigner.role(), request.role());
    if (!assignable.allowed()) {
      StatusCode code =
          "INVALID_ROLE".equals(assignable.code())
              ? StatusCode.INVALID_ARGUMENT
              : StatusCode.PERMISSION_DENIED;
      return failure(code, assignable.code(), assignable.message());
    }
    PasswordStrength strength = PasswordService.checkStrength(request.password());
    if (!strength.isValid()) {
      return failure(
          StatusCode.INVALID_ARGUMENT,
          "WEAK_PASSWORD",
          "Password does not meet security requirements");
    }

    StatusOr<Optional<User>> byUsername = users.findByUsername(request.username());
    if (byUsername.isNotOk()) {
      return registrationFailed(byUsername.getStatus());
    }
    if (byUsername.getValue().isPresent()) {
      return failure(StatusCode.ALREADY_EXISTS, "USERNAME_EXISTS", "Username already exists");
    }
    StatusOr<Optional<User>> byEmail = users.findByEmail(request.email());
    if (byEmail.isNotOk()) {
      return registrationFailed(byEmail.getStatus());
    }
    if (byEmail.getValue().isPresent()) {
      return failure(StatusCode.ALREADY_EXISTS, "EMAIL_EXISTS", "Email already exists");
    }

    String hash;
    try {
      hash = passwords.hashAsync(request.password()).get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return registrationFailed(Status.internal("Interrupted while hashing", e));
    } catch (ExecutionException e) {
      return registrationFailed(Status.internal("Password hashing failed", e.getCause()));
    }

    Instant now = clock.instant();
    Role role = Role.fromWireName(request.role()).orElseThrow();
    User user =
        new User(
            UUID.randomUUID().toString(),
            request.username(),
            request.email(),
            hash,
            role,
            true,
            now,
            now,
            null);
    Status saved = users.save(user);
    if (saved.isError()) {
      return registrationFailed(saved);
    }
    Logger.info("User {} registered as {} by {}.", user.username(), role, assigner.username());
    return StatusOr.ofValue(session(user));
  }

  private StatusOr<AuthSession> registrationFailed(Status cause) {
    Logger.error("Registration failed: {}", cause);
    return failure(
        StatusCode.INTERNAL, "REGISTRATION_FAILED", "Registration failed due to server error");
  }

  /**
   * Exchanges a refresh token for a new pair. The account is re-read, so the new tokens carry its
   * current role, and a deactivated account is refused.
   */
  public StatusOr<AuthSession> refresh(String refreshToken) {
    if (Strings.isNullOrEmpty(refreshToken)) {
      return failure(
          StatusCode.INVALID_ARGUMENT, "MISSING_REFRESH_TOKEN", "Refresh token is required");
    }
    IdentityClaim claim;
    try {
      claim = tokens.verify(refreshToken, TokenUse.REFRESH);
    } catch (TokenVerificationException e) {
      Logger.info("Refresh token rejected: {}", e.getReason());
      return failure(StatusCode.UNAUTHENTICATED, "TOKEN_REFRESH_FAILED", "Failed to refresh token");
    }
    StatusOr<Optional<User>> userOr = users.findById(claim.userId());
    if (userOr.isNotOk()) {
      Logger.error("Refresh lookup for {} failed: {}", claim.userId(), userOr.getStatus());
      return failure(StatusCode.INTERNAL, "TOKEN_REFRESH_FAILED", "Failed to refresh token");
    }
    Optional<User> user = userOr.getValue();
    if (user.isEmpty() || !user.get().active()) {
      return failure(
          StatusCode.UNAUTHENTICATED, "INVALID_USER", "User account is invalid or inactive");
    }
    return StatusOr.ofValue(session(user.get()));
  }

  public StatusOr<User> profile(String userId) {
    StatusOr<Optional<User>> userOr = users.findById(userId);
    if (userOr.isNotOk()) {
      return StatusOr.ofStatus(userOr.getStatus());
    }
    Optional<User> user = userOr.getValue();
    if (user.isEmpty() || !user.get().active()) {
      return failure(StatusCode.NOT_FOUND, "USER_NOT_FOUND", "User not found or inactive");
    }
    return StatusOr.ofValue(user.get());
  }

  private AuthSession session(User user) {
    return new AuthSession(user, tokens.issuePair(user.id(), user.username(), user.role()));
  }

  private static <T> StatusOr<T> failure(StatusCode code, String reason, String message) {
    return StatusOr.ofStatus(Status.withReason(code, reason, message));
  }
}
