package com.wccms.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.function.Function;
import org.tinylog.Logger;

/**
 * Secrets, lifetimes and cost factors for the authentication engine.
 *
 * @param jwtSecret HMAC secret used to sign identity tokens
 * @param accessTokenTtl lifetime of access tokens
 * @param refreshTokenTtl lifetime of refresh tokens
 * @param csrfSecret HMAC secret used to sign anti-forgery tokens
 * @param csrfTtl lifetime of anti-forgery tokens
 * @param hashIterations Argon2 iteration count
 * @param hashMemoryKib Argon2 memory cost in KiB
 * @param hashParallelism Argon2 lane count
 */
public record AuthConfig(
    String jwtSecret,
    Duration accessTokenTtl,
    Duration refreshTokenTtl,
    String csrfSecret,
    Duration csrfTtl,
    int hashIterations,
    int hashMemoryKib,
    int hashParallelism) {

  public static final Duration DEFAULT_ACCESS_TTL = Duration.ofHours(24);
  public static final Duration DEFAULT_REFRESH_TTL = Duration.ofDays(7);
  public static final Duration DEFAULT_CSRF_TTL = Duration.ofSeconds(3600);
  public static final int DEFAULT_HASH_ITERATIONS = 3;
  public static final int DEFAULT_HASH_MEMORY_KIB = 65536;
  public static final int DEFAULT_HASH_PARALLELISM = 4;

  public AuthConfig {
    if (Strings.isNullOrEmpty(jwtSecret)) {
      throw new IllegalArgumentException("JWT secret must be configured");
    }
    if (Strings.isNullOrEmpty(csrfSecret)) {
      throw new IllegalArgumentException("CSRF secret must be configured");
    }
    if (accessTokenTtl.isNegative()
        || accessTokenTtl.isZero()
        || refreshTokenTtl.isNegative()
        || refreshTokenTtl.isZero()
        || csrfTtl.isNegative()
        || csrfTtl.isZero()) {
      throw new IllegalArgumentException("Token lifetimes must be positive");
    }
  }

  /** Reads the configuration from the process environment. */
  public static AuthConfig fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Reads the configuration from the given variables.
   *
   * <p>{@code JWT_SECRET} is required. A missing {@code CSRF_SECRET} is replaced by a random
   * per-process secret, which invalidates outstanding anti-forgery tokens on restart.
   *
   * @throws IllegalArgumentException if a value cannot be parsed or a secret is missing
   */
  public static AuthConfig fromEnvironment(Map<String, String> env) {
    Function<String, String> get = key -> Strings.emptyToNull(env.get(key));
    String csrfSecret = get.apply("CSRF_SECRET");
    if (csrfSecret == null) {
      Logger.warn("CSRF_SECRET is not set; using a random per-process secret.");
      byte[] random = new byte[32];
      new SecureRandom().nextBytes(random);
      csrfSecret = Base64.getEncoder().encodeToString(random);
    }
    String csrfTtl = get.apply("CSRF_TTL_SECONDS");
    return new AuthConfig(
        get.apply("JWT_SECRET"),
        parseDuration(get.apply("JWT_EXPIRES_IN"), DEFAULT_ACCESS_TTL),
        parseDuration(get.apply("JWT_REFRESH_EXPIRES_IN"), DEFAULT_REFRESH_TTL),
        csrfSecret,
        csrfTtl == null ? DEFAULT_CSRF_TTL : Duration.ofSeconds(Long.parseLong(csrfTtl)),
        parseInt(get.apply("PASSWORD_HASH_ITERATIONS"), DEFAULT_HASH_ITERATIONS),
        parseInt(get.apply("PASSWORD_HASH_MEMORY_KIB"), DEFAULT_HASH_MEMORY_KIB),
        parseInt(get.apply("PASSWORD_HASH_PARALLELISM"), DEFAULT_HASH_PARALLELISM));
  }

  /**
   * Parses durations of the form {@code 30s}, {@code 15m}, {@code 24h} or {@code 7d}. A bare
   * number is taken as seconds.
   */
  public static Duration parseDuration(String value, Duration defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      return defaultValue;
    }
    char unit = trimmed.charAt(trimmed.length() - 1);
    if (Character.isDigit(unit)) {
      return Duration.ofSeconds(Long.parseLong(trimmed));
    }
    long amount;
    try {
      amount = Long.parseLong(trimmed.substring(0, trimmed.length() - 1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration: " + value, e);
    }
    switch (unit) {
      case 's':
        return Duration.ofSeconds(amount);
      case 'm':
        return Duration.ofMinutes(amount);
      case 'h':
        return Duration.ofHours(amount);
      case 'd':
        return Duration.ofDays(amount);
      default:
        throw new IllegalArgumentException("Invalid duration unit in: " + value);
    }
  }

  private static int parseInt(String value, int defaultValue) {
    return value == null ? defaultValue : Integer.parseInt(value.trim());
  }

  /** Returns a string representation of this object without the secrets. */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("accessTokenTtl", accessTokenTtl())
        .add("refreshTokenTtl", refreshTokenTtl())
        .add("csrfTtl", csrfTtl())
        .add("hashIterations", hashIterations())
        .add("hashMemoryKib", hashMemoryKib())
        .add("hashParallelism", hashParallelism())
        .toString();
  }
}
