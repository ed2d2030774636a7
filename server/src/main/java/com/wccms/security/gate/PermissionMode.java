package com.wccms.security.gate;

/** How a multi-capability check combines its capabilities. */
public enum PermissionMode {
  ANY(" or "),
  ALL(" and ");

  private final String separator;

  PermissionMode(String separator) {
    this.separator = separator;
  }

  String separator() {
    return separator;
  }
}
