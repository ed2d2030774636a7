package com.wccms.security;

import com.google.common.base.Splitter;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.wccms.config.AuthConfig;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Issues and verifies session-bound anti-forgery tokens.
 *
 * <p>A token has three dot-separated parts: the session id (base64url), the issuance time in
 * epoch milliseconds, and a hex HMAC-SHA256 of {@code sessionId:timestamp} under the CSRF
 * secret. Nothing is stored; verification recomputes the signature. Exemption of safe HTTP
 * methods is a pipeline concern, not handled here.
 */
public class CsrfGuard {

  public static final String HEADER = "X-CSRF-Token";
  public static final String SESSION_HEADER = "X-Session-Id";
  public static final String ANONYMOUS_SESSION = "anonymous";

  private static final Splitter DOT = Splitter.on('.');
  private static final Base64.Encoder SESSION_ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder SESSION_DECODER = Base64.getUrlDecoder();

  private final HashFunction hmac;
  private final long ttlMillis;
  private final Clock clock;

  public CsrfGuard(AuthConfig config) {
    this(config.csrfSecret(), config.csrfTtl(), Clock.systemUTC());
  }

  public CsrfGuard(String secret, Duration ttl, Clock clock) {
    this.hmac = Hashing.hmacSha256(secret.getBytes(StandardCharsets.UTF_8));
    this.ttlMillis = ttl.toMillis();
    this.clock = clock;
  }

  /** Issues a token bound to {@code sessionId} and the current time. */
  public String issue(String sessionId) {
    long timestamp = clock.millis();
    return SESSION_ENCODER.encodeToString(sessionId.getBytes(StandardCharsets.UTF_8))
        + "."
        + timestamp
        + "."
        + sign(sessionId, timestamp);
  }

  /**
   * Returns true only for a well-formed token issued to {@code sessionId} within the configured
   * lifetime.
   */
  public boolean verify(@Nullable String token, @Nullable String sessionId) {
    if (token == null || sessionId == null) {
      return false;
    }
    List<String> parts = DOT.splitToList(token);
    if (parts.size() != 3) {
      return false;
    }
    String embeddedSession;
    long timestamp;
    try {
      embeddedSession =
          new String(SESSION_DECODER.decode(parts.get(0)), StandardCharsets.UTF_8);
      timestamp = Long.parseLong(parts.get(1));
    } catch (IllegalArgumentException e) {
      // NumberFormatException included.
      return false;
    }
    if (!embeddedSession.equals(sessionId)) {
      return false;
    }
    byte[] expected = sign(sessionId, timestamp).getBytes(StandardCharsets.UTF_8);
    byte[] actual = parts.get(2).getBytes(StandardCharsets.UTF_8);
    if (!MessageDigest.isEqual(expected, actual)) {
      return false;
    }
    long age = clock.millis() - timestamp;
    return age >= 0 && age <= ttlMillis;
  }

  private String sign(String sessionId, long timestamp) {
    return hmac.hashString(sessionId + ":" + timestamp, StandardCharsets.UTF_8).toString();
  }
}
