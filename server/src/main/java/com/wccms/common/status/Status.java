package com.wccms.common.status;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * The outcome of an operation: {@link StatusCode#OK}, or an error code with a message and an
 * optional cause. Errors carry an application-level reason string (for example
 * {@code INVALID_CREDENTIALS}) when the caller needs more than the coarse code.
 */
public class Status {
  private static final Status OK = new Status(StatusCode.OK, null, null, null);

  private final StatusCode code;
  private final String reason;
  private final String message;
  private final Throwable cause;

  private Status(StatusCode code, String reason, String message, Throwable cause) {
    this.code = Objects.requireNonNull(code);
    this.reason = reason;
    this.message = message;
    this.cause = cause;
  }

  /** Returns the shared OK status. */
  public static Status ok() {
    return OK;
  }

  /** Creates a status with the given code and message and no reason. */
  public static Status of(StatusCode code, String message) {
    return new Status(code, null, message, null);
  }

  /**
   * Creates an error status tagged with an application reason code.
   *
   * @param code the coarse status code, which decides the HTTP status
   * @param reason the stable reason surfaced as the error envelope's code
   * @param message a human-readable message
   * @return a new status
   */
  public static Status withReason(StatusCode code, String reason, String message) {
    return new Status(code, reason, message, null);
  }

  /** Creates a NOT_FOUND status with the given message. */
  public static Status notFound(String message) {
    return new Status(StatusCode.NOT_FOUND, null, message, null);
  }

  /** Creates an INTERNAL status with the given message and cause. */
  public static Status internal(String message, Throwable cause) {
    return new Status(StatusCode.INTERNAL, null, message, cause);
  }

  /** Creates an INVALID_ARGUMENT status with the given message. */
  public static Status invalidArgument(String message) {
    return new Status(StatusCode.INVALID_ARGUMENT, null, message, null);
  }

  /** Creates a FAILED_PRECONDITION status with the given message. */
  public static Status failedPrecondition(String message) {
    return new Status(StatusCode.FAILED_PRECONDITION, null, message, null);
  }

  /** Creates an ALREADY_EXISTS status with the given message. */
  public static Status alreadyExists(String message) {
    return new Status(StatusCode.ALREADY_EXISTS, null, message, null);
  }

  /** Creates an UNAUTHENTICATED status with the given message. */
  public static Status unauthenticated(String message) {
    return new Status(StatusCode.UNAUTHENTICATED, null, message, null);
  }

  /** Creates a PERMISSION_DENIED status with the given message. */
  public static Status permissionDenied(String message) {
    return new Status(StatusCode.PERMISSION_DENIED, null, message, null);
  }

  /** Returns the status code. */
  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  /** Returns the HTTP status code corresponding to this status. */
  public int getHttpCode() {
    return code.getHttpCode();
  }

  /** Returns the application reason, falling back to the code name. */
  @Nonnull
  public String getReason() {
    return reason != null ? reason : code.name();
  }

  /** Returns the message, or null for OK. */
  public String getMessage() {
    return message;
  }

  /** Returns the underlying cause, if any. */
  public Throwable getCause() {
    return cause;
  }

  /** Returns true if this status is OK. */
  public boolean isOk() {
    return code == StatusCode.OK;
  }

  /** Returns true if this status is an error. */
  public boolean isError() {
    return code != StatusCode.OK;
  }

  /** Returns the code, the reason in brackets when set, then the message. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(code.toString());
    if (reason != null) {
      sb.append('[').append(reason).append(']');
    }
    if (message != null) {
      sb.append(": ").append(message);
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Status other = (Status) obj;
    return code == other.code
        && Objects.equals(reason, other.reason)
        && Objects.equals(message, other.message)
        && Objects.equals(cause, other.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, reason, message, cause);
  }
}
