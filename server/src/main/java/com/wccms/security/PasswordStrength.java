package com.wccms.security;

import com.google.common.collect.ImmutableList;

/**
 * Result of a strength check. {@code violations} lists every rule the password broke, in a fixed
 * order, and is empty when the password is acceptable.
 */
public record PasswordStrength(ImmutableList<String> violations) {

  public boolean isValid() {
    return violations.isEmpty();
  }
}
