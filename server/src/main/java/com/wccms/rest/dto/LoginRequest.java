package com.wccms.rest.dto;

/** Body of {@code POST /v1/auth/login}. */
public record LoginRequest(String username, String password) {
  /**
   * Empty constructor for JSON deserialization.
   */
  public LoginRequest() {
    this(null, null);
  }
}
