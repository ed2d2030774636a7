package com.wccms.rest.dto;

import com.wccms.auth.RegistrationRequest;

/** Body of {@code POST /v1/auth/register}. {@code role} is a role wire name. */
public record RegisterRequest(String username, String email, String password, String role) {
  public RegisterRequest() {
    this(null, null, null, null);
  }

  public RegistrationRequest toRegistration() {
    return new RegistrationRequest(username, email, password, role);
  }
}
