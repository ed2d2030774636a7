package com.wccms.config;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AuthConfigTest {

  @Test
  void testFromEnvironment_UsesDefaults() {
    AuthConfig config = AuthConfig.fromEnvironment(Map.of("JWT_SECRET", "s3cret"));

    assertEquals("s3cret", config.jwtSecret());
    assertEquals(Duration.ofHours(24), config.accessTokenTtl());
    assertEquals(Duration.ofDays(7), config.refreshTokenTtl());
    assertEquals(Duration.ofSeconds(3600), config.csrfTtl());
    assertEquals(3, config.hashIterations());
    assertEquals(65536, config.hashMemoryKib());
    assertEquals(4, config.hashParallelism());
    // A random CSRF secret is generated when none is configured.
    assertFalse(config.csrfSecret().isEmpty());
  }

  @Test
  void testFromEnvironment_ReadsOverrides() {
    AuthConfig config =
        AuthConfig.fromEnvironment(
            Map.of(
                "JWT_SECRET", "s3cret",
                "JWT_EXPIRES_IN", "15m",
                "JWT_REFRESH_EXPIRES_IN", "30d",
                "CSRF_SECRET", "csrf",
                "CSRF_TTL_SECONDS", "600",
                "PASSWORD_HASH_ITERATIONS", "2",
                "PASSWORD_HASH_MEMORY_KIB", "19456",
                "PASSWORD_HASH_PARALLELISM", "1"));

    assertEquals(Duration.ofMinutes(15), config.accessTokenTtl());
    assertEquals(Duration.ofDays(30), config.refreshTokenTtl());
    assertEquals("csrf", config.csrfSecret());
    assertEquals(Duration.ofMinutes(10), config.csrfTtl());
    assertEquals(2, config.hashIterations());
    assertEquals(19456, config.hashMemoryKib());
    assertEquals(1, config.hashParallelism());
  }

  @Test
  void testFromEnvironment_RequiresJwtSecret() {
    assertThrows(IllegalArgumentException.class, () -> AuthConfig.fromEnvironment(Map.of()));
    assertThrows(
        IllegalArgumentException.class,
        () -> AuthConfig.fromEnvironment(Map.of("JWT_SECRET", "")));
  }

  @Test
  void testParseDuration() {
    Duration fallback = Duration.ofMinutes(1);
    assertEquals(Duration.ofSeconds(45), AuthConfig.parseDuration("45s", fallback));
    assertEquals(Duration.ofSeconds(90), AuthConfig.parseDuration("90", fallback));
    assertEquals(Duration.ofHours(24), AuthConfig.parseDuration("24h", fallback));
    assertEquals(Duration.ofDays(7), AuthConfig.parseDuration(" 7d ", fallback));
    assertEquals(fallback, AuthConfig.parseDuration(null, fallback));
    assertEquals(fallback, AuthConfig.parseDuration("  ", fallback));
    assertThrows(IllegalArgumentException.class, () -> AuthConfig.parseDuration("7w", fallback));
    assertThrows(IllegalArgumentException.class, () -> AuthConfig.parseDuration("xh", fallback));
  }

  @Test
  void testConstructor_RejectsNonPositiveLifetimes() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new AuthConfig(
                "jwt", Duration.ZERO, Duration.ofDays(1), "csrf", Duration.ofHours(1), 1, 1024, 1));
  }

  @Test
  void testToSecureString_OmitsSecrets() {
    AuthConfig config =
        AuthConfig.fromEnvironment(Map.of("JWT_SECRET", "top-secret", "CSRF_SECRET", "hidden"));

    String text = config.toSecureString();

    assertFalse(text.contains("top-secret"));
    assertFalse(text.contains("hidden"));
    assertTrue(text.contains("accessTokenTtl"));
  }
}
