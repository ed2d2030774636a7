package com.wccms.security;

import java.time.Instant;

/**
 * The verified payload of a bearer token. Lives for one request and is never persisted.
 *
 * @param userId the account identifier
 * @param username the account name at issuance
 * @param role the role at issuance; later role changes are not reflected
 * @param issuedAt issuance time, second precision
 * @param expiresAt expiry time, second precision
 * @param issuer the issuer tag
 * @param tokenUse whether this came from an access or a refresh token
 */
public record IdentityClaim(
    String userId,
    String username,
    Role role,
    Instant issuedAt,
    Instant expiresAt,
    String issuer,
    TokenUse tokenUse) {

  public boolean isAdministrator() {
    return role == Role.ADMINISTRATOR;
  }
}
