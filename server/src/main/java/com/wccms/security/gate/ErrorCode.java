package com.wccms.security.gate;

/**
 * Failure codes reported by gates, with the HTTP status each one maps to. The routing layer and
 * its clients rely on this mapping verbatim.
 */
public enum ErrorCode {
  MISSING_TOKEN(401, "Access token is required"),
  AUTHENTICATION_FAILED(401, "Authentication failed"),
  INVALID_USER(401, "User account is invalid or inactive"),
  AUTHENTICATION_REQUIRED(401, "Authentication required"),
  INSUFFICIENT_PERMISSIONS(403, "Insufficient permissions for this operation"),
  ACCESS_DENIED(403, "Access denied. You can only access your own resources."),
  MISSING_RESOURCE_ID(400, "Resource ID parameter 'id' is required"),
  OWNERSHIP_CHECK_FAILED(500, "Failed to verify resource ownership"),
  CSRF_TOKEN_MISSING(403, "CSRF token missing"),
  CSRF_TOKEN_INVALID(403, "Invalid CSRF token");

  private final int httpStatus;
  private final String defaultMessage;

  ErrorCode(int httpStatus, String defaultMessage) {
    this.httpStatus = httpStatus;
    this.defaultMessage = defaultMessage;
  }

  public int getHttpStatus() {
    return httpStatus;
  }

  public String getDefaultMessage() {
    return defaultMessage;
  }
}
