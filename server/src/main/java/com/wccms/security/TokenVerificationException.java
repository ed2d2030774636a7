package com.wccms.security;

/** Thrown when a bearer token cannot be turned into an {@link IdentityClaim}. */
public class TokenVerificationException extends Exception {

  /** Why verification failed. */
  public enum Reason {
    /** Well-formed and correctly signed, but past its expiry. Recoverable by refreshing. */
    EXPIRED("Token expired"),
    /** Bad signature, wrong issuer, wrong use or malformed structure. */
    INVALID("Invalid token"),
    /** Anything else, such as a missing token. */
    VERIFICATION_FAILED("Token verification failed");

    private final String message;

    Reason(String message) {
      this.message = message;
    }

    public String getMessage() {
      return message;
    }
  }

  private final Reason reason;

  public TokenVerificationException(Reason reason, Throwable cause) {
    super(reason.getMessage(), cause);
    this.reason = reason;
  }

  public TokenVerificationException(Reason reason) {
    this(reason, null);
  }

  public Reason getReason() {
    return reason;
  }
}
