package com.wccms.security;

/** Distinguishes short-lived access tokens from long-lived refresh tokens. */
public enum TokenUse {
  ACCESS("access"),
  REFRESH("refresh");

  private final String claimValue;

  TokenUse(String claimValue) {
    this.claimValue = claimValue;
  }

  public String getClaimValue() {
    return claimValue;
  }

  static TokenUse fromClaimValue(String value) {
    for (TokenUse use : values()) {
      if (use.claimValue.equals(value)) {
        return use;
      }
    }
    return null;
  }
}
