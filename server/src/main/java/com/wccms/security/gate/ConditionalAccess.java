package com.wccms.security.gate;

import com.google.common.collect.ImmutableList;
import com.wccms.security.Permission;

/**
 * Options for {@link AuthorizationGates#conditionalAuth(ConditionalAccess)}. Checks are tried in
 * order: administrator override, self access, then capabilities.
 *
 * @param permissions capabilities that grant access; empty means no capability check
 * @param mode how {@code permissions} combine
 * @param allowSelf grant access when the path parameter equals the caller's user id
 * @param adminOverride grant access to administrators outright
 * @param paramName the path parameter compared for self access
 */
public record ConditionalAccess(
    ImmutableList<Permission> permissions,
    PermissionMode mode,
    boolean allowSelf,
    boolean adminOverride,
    String paramName) {

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private ImmutableList<Permission> permissions = ImmutableList.of();
    private PermissionMode mode = PermissionMode.ANY;
    private boolean allowSelf;
    private boolean adminOverride = true;
    private String paramName = OwnershipDescriptor.DEFAULT_PARAM;

    private Builder() {}

    public Builder permissions(PermissionMode mode, Permission... permissions) {
      this.mode = mode;
      this.permissions = ImmutableList.copyOf(permissions);
      return this;
    }

    public Builder allowSelf(boolean allowSelf) {
      this.allowSelf = allowSelf;
      return this;
    }

    public Builder adminOverride(boolean adminOverride) {
      this.adminOverride = adminOverride;
      return this;
    }

    public Builder paramName(String paramName) {
      this.paramName = paramName;
      return this;
    }

    public ConditionalAccess build() {
      return new ConditionalAccess(permissions, mode, allowSelf, adminOverride, paramName);
    }
  }
}
