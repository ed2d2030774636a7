package com.wccms.rest.dto;

/** Body of {@code POST /v1/auth/refresh}. */
public record RefreshRequest(String refreshToken) {
  public RefreshRequest() {
    this(null);
  }
}
