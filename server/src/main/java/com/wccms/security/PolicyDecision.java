package com.wccms.security;

import javax.annotation.Nullable;

/**
 * Outcome of a {@link RolePolicies} check. A denial carries a stable code and a message that can
 * be shown to the caller as is.
 */
public record PolicyDecision(boolean allowed, @Nullable String code, @Nullable String message) {

  private static final PolicyDecision ALLOW = new PolicyDecision(true, null, null);

  public static PolicyDecision allow() {
    return ALLOW;
  }

  public static PolicyDecision deny(String code, String message) {
    return new PolicyDecision(false, code, message);
  }
}
