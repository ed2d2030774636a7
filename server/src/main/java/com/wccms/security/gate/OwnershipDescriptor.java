package com.wccms.security.gate;

import java.util.Objects;

/**
 * Per-route configuration of the ownership-or-admin gate.
 *
 * @param check the ownership predicate
 * @param allowAdminOverride whether administrators skip the predicate
 * @param paramName the path parameter holding the resource id
 */
public record OwnershipDescriptor(
    OwnershipCheck check, boolean allowAdminOverride, String paramName) {

  public static final String DEFAULT_PARAM = "id";

  public OwnershipDescriptor {
    Objects.requireNonNull(check, "check");
    Objects.requireNonNull(paramName, "paramName");
  }

  /** Admin override on, resource id in the {@code id} path parameter. */
  public static OwnershipDescriptor of(OwnershipCheck check) {
    return new OwnershipDescriptor(check, true, DEFAULT_PARAM);
  }
}
