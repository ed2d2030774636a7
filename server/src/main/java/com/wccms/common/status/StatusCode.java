package com.wccms.common.status;

/**
 * Outcome codes for store and service calls, each tied to the HTTP status the REST layer
 * reports for it.
 */
public enum StatusCode {
  OK(200),
  INVALID_ARGUMENT(400),
  FAILED_PRECONDITION(400),
  UNAUTHENTICATED(401),
  PERMISSION_DENIED(403),
  NOT_FOUND(404),
  ALREADY_EXISTS(409),
  INTERNAL(500);

  private final int httpCode;

  StatusCode(int httpCode) {
    this.httpCode = httpCode;
  }

  /** Returns the corresponding HTTP status code. */
  public int getHttpCode() {
    return httpCode;
  }

  /** Returns whether this status code represents a successful operation. */
  public boolean isSuccess() {
    return this == OK;
  }
}
