package com.wccms.rest.dto;

import com.wccms.auth.AuthSession;

/** Account plus token pair, returned by login, refresh and registration. */
public record AuthResponse(UserResponse user, String accessToken, String refreshToken) {

  public static AuthResponse from(AuthSession session) {
    return new AuthResponse(
        UserResponse.from(session.user()),
        session.tokens().accessToken(),
        session.tokens().refreshToken());
  }
}
