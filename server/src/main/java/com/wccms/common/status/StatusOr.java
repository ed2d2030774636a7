package com.wccms.common.status;

import java.util.Objects;
import java.util.function.Function;
import javax.annotation.Nonnull;

/**
 * Either a value or an error {@link Status}. Store and service calls return this instead of
 * throwing so that callers decide how each failure surfaces.
 *
 * @param <T> The type of the value in case of success.
 */
public final class StatusOr<T> {
  private final Status status;
  private final T value;

  private StatusOr(Status status, T value) {
    if (status.isOk() && value == null) {
      throw new IllegalArgumentException("Value cannot be null when status is OK");
    }
    if (!status.isOk() && value != null) {
      throw new IllegalArgumentException("Value must be null when status is not OK");
    }
    this.status = Objects.requireNonNull(status);
    this.value = value;
  }

  /**
   * Wraps a successful value.
   *
   * @param value the non-null value to wrap
   * @return an OK StatusOr holding the value
   * @throws NullPointerException if value is null
   */
  public static <T> StatusOr<T> ofValue(@Nonnull T value) {
    return new StatusOr<>(Status.ok(), Objects.requireNonNull(value));
  }

  /**
   * Wraps a non-OK status.
   *
   * @param status the error to carry
   * @return a StatusOr holding no value
   * @throws IllegalArgumentException if status is OK
   */
  public static <T> StatusOr<T> ofStatus(@Nonnull Status status) {
    if (status.isOk()) {
      throw new IllegalArgumentException("Status must not be OK when using ofStatus");
    }
    return new StatusOr<>(status, null);
  }

  /**
   * Wraps an exception as an INTERNAL status.
   *
   * @param throwable the exception, kept as the status cause
   * @return a StatusOr representing the error
   */
  public static <T> StatusOr<T> ofException(@Nonnull Throwable throwable) {
    return ofStatus(Status.internal("Exception: " + throwable.getMessage(), throwable));
  }

  /** Returns the status; OK when a value is present. */
  @Nonnull
  public Status getStatus() {
    return status;
  }

  /**
   * Returns the value.
   *
   * @throws IllegalStateException if the status is not OK
   */
  @Nonnull
  public T getValue() {
    if (!status.isOk()) {
      throw new IllegalStateException("Cannot get value from failed StatusOr: " + status);
    }
    return value;
  }

  /** Returns true if this holds a value. */
  public boolean isOk() {
    return status.isOk();
  }

  /** Returns true if this holds an error. */
  public boolean isNotOk() {
    return !status.isOk();
  }

  /**
   * Transforms the value, passing an error through unchanged.
   *
   * @param mapper the function to apply to the value; must not return null
   * @return the mapped value or the original error
   */
  @Nonnull
  public <U> StatusOr<U> map(@Nonnull Function<T, U> mapper) {
    if (status.isOk()) {
      return StatusOr.ofValue(mapper.apply(value));
    }
    return StatusOr.ofStatus(status);
  }

  /**
   * Chains a call that may itself fail, passing an error through unchanged.
   *
   * @param mapper the function to apply to the value
   * @return the mapper's result or the original error
   */
  @Nonnull
  public <U> StatusOr<U> flatMap(@Nonnull Function<T, StatusOr<U>> mapper) {
    if (status.isOk()) {
      return mapper.apply(value);
    }
    return StatusOr.ofStatus(status);
  }

  /**
   * Returns the value if OK, otherwise {@code defaultValue}.
   *
   * @param defaultValue the value to return on error
   * @return the value or the default
   */
  @Nonnull
  public T getOrDefault(@Nonnull T defaultValue) {
    return status.isOk() ? value : defaultValue;
  }

  /** Shows either the value or the status. */
  @Override
  public String toString() {
    return status.isOk() ? "StatusOr{value=" + value + "}" : "StatusOr{status=" + status + "}";
  }
}
