package com.wccms.security;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.wccms.config.AuthConfig;
import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Hashes and verifies passwords with Argon2id, and checks password strength.
 *
 * <p>Hashing is deliberately slow. {@link #hashAsync(String)} runs it on a small dedicated pool
 * so that bursts of logins or registrations do not tie up request threads.
 */
public class PasswordService implements AutoCloseable {

  public static final int MIN_LENGTH = 8;
  public static final int MAX_LENGTH = 128;
  static final String SYMBOLS = "!@#$%^&*()_+-=[]{};':\"\\|,.<>/?";

  private static final int SALT_LENGTH = 16;
  private static final int HASH_LENGTH = 32;

  private final Argon2 argon2;
  private final int iterations;
  private final int memoryKib;
  private final int parallelism;
  private final ListeningExecutorService hashExecutor;

  public PasswordService(AuthConfig config) {
    this(config.hashIterations(), config.hashMemoryKib(), config.hashParallelism());
  }

  public PasswordService(int iterations, int memoryKib, int parallelism) {
    this.argon2 =
        Argon2Factory.create(Argon2Factory.Argon2Types.ARGON2id, SALT_LENGTH, HASH_LENGTH);
    this.iterations = iterations;
    this.memoryKib = memoryKib;
    this.parallelism = parallelism;
    ExecutorService pool =
        Executors.newFixedThreadPool(
            Math.max(1, Runtime.getRuntime().availableProcessors() / 2),
            new ThreadFactoryBuilder().setNameFormat("password-hash-%d").setDaemon(true).build());
    this.hashExecutor = MoreExecutors.listeningDecorator(pool);
  }

  /**
   * Hashes a password into an encoded Argon2id string.
   *
   * @throws WeakPasswordException if the password is null, empty or shorter than {@link
   *     #MIN_LENGTH}
   */
  public String hash(@Nullable String password) {
    if (password == null || password.isEmpty()) {
      throw new WeakPasswordException("Password is required");
    }
    if (password.length() < MIN_LENGTH) {
      throw new WeakPasswordException(
          "Password must be at least " + MIN_LENGTH + " characters long");
    }
    char[] chars = password.toCharArray();
    try {
      return argon2.hash(iterations, memoryKib, parallelism, chars);
    } finally {
      argon2.wipeArray(chars);
    }
  }

  /** Runs {@link #hash(String)} on the hashing pool. */
  public ListenableFuture<String> hashAsync(@Nullable String password) {
    return hashExecutor.submit(() -> hash(password));
  }

  /** Returns whether the password matches. Never throws; malformed input yields false. */
  public boolean verify(@Nullable String password, @Nullable String hash) {
    if (password == null || password.isEmpty() || hash == null || hash.isEmpty()) {
      return false;
    }
    char[] chars = password.toCharArray();
    try {
      return argon2.verify(hash, chars);
    } catch (RuntimeException e) {
      Logger.debug("Rejected malformed password hash: {}", e.getMessage());
      return false;
    } finally {
      argon2.wipeArray(chars);
    }
  }

  /** Returns true when {@code hash} is not Argon2id or was made with other cost parameters. */
  public boolean needsRehash(@Nullable String hash) {
    if (hash == null || !hash.startsWith("$argon2id$")) {
      return true;
    }
    // $argon2id$v=19$m=65536,t=3,p=4$<salt>$<hash>
    String[] parts = hash.split("\\$");
    if (parts.length < 5) {
      return true;
    }
    String expected = "m=" + memoryKib + ",t=" + iterations + ",p=" + parallelism;
    return !expected.equals(parts[3]);
  }

  /** Evaluates every strength rule and reports all that fail. */
  public static PasswordStrength checkStrength(@Nullable String password) {
    if (password == null || password.isEmpty()) {
      return new PasswordStrength(ImmutableList.of("Password is required"));
    }
    ImmutableList.Builder<String> violations = ImmutableList.builder();
    if (password.length() < MIN_LENGTH) {
      violations.add("Password must be at least " + MIN_LENGTH + " characters long");
    }
    if (password.length() > MAX_LENGTH) {
      violations.add("Password must be less than " + MAX_LENGTH + " characters long");
    }
    if (password.chars().noneMatch(c -> c >= 'a' && c <= 'z')) {
      violations.add("Password must contain at least one lowercase letter");
    }
    if (password.chars().noneMatch(c -> c >= 'A' && c <= 'Z')) {
      violations.add("Password must contain at least one uppercase letter");
    }
    if (password.chars().noneMatch(c -> c >= '0' && c <= '9')) {
      violations.add("Password must contain at least one number");
    }
    if (password.chars().noneMatch(c -> SYMBOLS.indexOf(c) >= 0)) {
      violations.add("Password must contain at least one special character");
    }
    return new PasswordStrength(violations.build());
  }

  @Override
  public void close() {
    MoreExecutors.shutdownAndAwaitTermination(hashExecutor, 10, TimeUnit.SECONDS);
  }
}
