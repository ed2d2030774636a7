package com.wccms.security;

/**
 * Contract for answering capability questions about a single subject.
 *
 * <p>{@link PermissionMatrix#checkerFor(Role)} returns one of these bound to a role. The
 * permission gates ask it about the caller's role on every request. The any/all variants follow
 * the usual set semantics: an empty argument list yields {@code false} for "any" and {@code
 * true} for "all".
 */
@FunctionalInterface
public interface PermissionChecker {
  /**
   * Checks if this subject has the specified permission.
   *
   * @param permission The permission to check
   * @return true if the subject has the permission, false otherwise
   */
  boolean hasPermission(Permission permission);

  /**
   * Returns true if at least one of the permissions is granted.
   *
   * @param permissions The permissions to check
   */
  default boolean hasAnyPermission(Permission... permissions) {
    for (Permission p : permissions) {
      if (hasPermission(p)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns true only if all of the permissions are granted.
   *
   * @param permissions The permissions to check
   */
  default boolean hasAllPermissions(Permission... permissions) {
    for (Permission p : permissions) {
      if (!hasPermission(p)) {
        return false;
      }
    }
    return true;
  }
}
