package com.wccms.security;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.google.common.base.Strings;
import com.wccms.config.AuthConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Issues and verifies HMAC-SHA256 signed identity tokens.
 *
 * <p>Tokens are self-contained: verification depends only on the token and the signing secret,
 * with no lookup. A token therefore stays valid until expiry even after the account is
 * deactivated, and callers that trust a token must re-check the account themselves.
 *
 * <p>Instances hold no mutable state and are safe to share between threads.
 */
public class TokenService {

  public static final String ISSUER = "web-communication-cms";

  static final String CLAIM_USER_ID = "userId";
  static final String CLAIM_USERNAME = "username";
  static final String CLAIM_ROLE = "role";
  static final String CLAIM_TOKEN_USE = "token_use";

  private static final String BEARER = "Bearer";

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final Duration accessTtl;
  private final Duration refreshTtl;
  private final Clock clock;

  public TokenService(AuthConfig config) {
    this(config, Clock.systemUTC());
  }

  public TokenService(AuthConfig config, Clock clock) {
    this.algorithm = Algorithm.HMAC256(config.jwtSecret());
    this.accessTtl = config.accessTokenTtl();
    this.refreshTtl = config.refreshTokenTtl();
    this.clock = clock;
    this.verifier =
        ((JWTVerifier.BaseVerification) JWT.require(algorithm).withIssuer(ISSUER)).build(clock);
  }

  public String issueAccess(String userId, String username, Role role) {
    return issue(userId, username, role, TokenUse.ACCESS, accessTtl);
  }

  public String issueRefresh(String userId, String username, Role role) {
    return issue(userId, username, role, TokenUse.REFRESH, refreshTtl);
  }

  /** Issues an access token and a refresh token for the same identity. */
  public TokenPair issuePair(String userId, String username, Role role) {
    return new TokenPair(
        issueAccess(userId, username, role), issueRefresh(userId, username, role));
  }

  private String issue(String userId, String username, Role role, TokenUse use, Duration ttl) {
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    return JWT.create()
        .withIssuer(ISSUER)
        .withIssuedAt(Date.from(now))
        .withExpiresAt(Date.from(now.plus(ttl)))
        .withClaim(CLAIM_USER_ID, userId)
        .withClaim(CLAIM_USERNAME, username)
        .withClaim(CLAIM_ROLE, role.getWireName())
        .withClaim(CLAIM_TOKEN_USE, use.getClaimValue())
        .sign(algorithm);
  }

  /**
   * Verifies a token of either use.
   *
   * @throws TokenVerificationException with {@code EXPIRED} past expiry, {@code INVALID} for a
   *     bad signature, issuer or structure, and {@code VERIFICATION_FAILED} otherwise
   */
  public IdentityClaim verify(@Nullable String token) throws TokenVerificationException {
    if (Strings.isNullOrEmpty(token)) {
      throw new TokenVerificationException(TokenVerificationException.Reason.VERIFICATION_FAILED);
    }
    DecodedJWT decoded;
    try {
      decoded = verifier.verify(token);
    } catch (TokenExpiredException e) {
      throw new TokenVerificationException(TokenVerificationException.Reason.EXPIRED, e);
    } catch (JWTVerificationException e) {
      throw new TokenVerificationException(TokenVerificationException.Reason.INVALID, e);
    } catch (RuntimeException e) {
      throw new TokenVerificationException(
          TokenVerificationException.Reason.VERIFICATION_FAILED, e);
    }
    return toClaim(decoded);
  }

  /**
   * Verifies a token and requires it to have been issued for {@code expectedUse}.
   *
   * @throws TokenVerificationException as {@link #verify(String)}, and {@code INVALID} when the
   *     token was issued for the other use
   */
  public IdentityClaim verify(@Nullable String token, TokenUse expectedUse)
      throws TokenVerificationException {
    IdentityClaim claim = verify(token);
    if (claim.tokenUse() != expectedUse) {
      throw new TokenVerificationException(TokenVerificationException.Reason.INVALID);
    }
    return claim;
  }

  /** Returns true when the token is expired or does not verify at all. */
  public boolean isExpired(@Nullable String token) {
    try {
      verify(token);
      return false;
    } catch (TokenVerificationException e) {
      return true;
    }
  }

  private static IdentityClaim toClaim(DecodedJWT decoded) throws TokenVerificationException {
    String userId = decoded.getClaim(CLAIM_USER_ID).asString();
    String username = decoded.getClaim(CLAIM_USERNAME).asString();
    Optional<Role> role = Role.fromWireName(decoded.getClaim(CLAIM_ROLE).asString());
    TokenUse use = TokenUse.fromClaimValue(decoded.getClaim(CLAIM_TOKEN_USE).asString());
    if (userId == null
        || username == null
        || role.isEmpty()
        || use == null
        || decoded.getIssuedAtAsInstant() == null
        || decoded.getExpiresAtAsInstant() == null) {
      throw new TokenVerificationException(TokenVerificationException.Reason.INVALID);
    }
    return new IdentityClaim(
        userId,
        username,
        role.get(),
        decoded.getIssuedAtAsInstant(),
        decoded.getExpiresAtAsInstant(),
        decoded.getIssuer(),
        use);
  }

  /**
   * Extracts the token from an {@code Authorization} header value.
   *
   * @return the token for a two-part {@code Bearer <token>} value, otherwise null
   */
  @Nullable
  public static String extractFromHeader(@Nullable String headerValue) {
    if (headerValue == null) {
      return null;
    }
    String[] parts = headerValue.split(" ", -1);
    if (parts.length != 2 || !BEARER.equals(parts[0]) || parts[1].isEmpty()) {
      return null;
    }
    return parts[1];
  }
}
