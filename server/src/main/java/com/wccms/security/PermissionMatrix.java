package com.wccms.security;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * The immutable role to capability table.
 *
 * <p>Roles are flat entries in a single map, not a class hierarchy, so the whole policy can be
 * audited in {@link #STANDARD}. The constructor refuses to build a table where the administrator
 * entry is not a superset of every other entry, or where some capability is granted to no role.
 * Instances are safe for unsynchronized concurrent reads.
 */
public final class PermissionMatrix {

  /** The table the server runs with. */
  public static final PermissionMatrix STANDARD =
      new PermissionMatrix(
          ImmutableMap.of(
              Role.ADMINISTRATOR,
              EnumSet.allOf(Permission.class),
              Role.EDITOR,
              EnumSet.of(
                  Permission.CREATE_CONTENT,
                  Permission.READ_CONTENT,
                  Permission.UPDATE_CONTENT,
                  Permission.DELETE_CONTENT,
                  Permission.PUBLISH_CONTENT,
                  Permission.UPLOAD_DOCUMENT,
                  Permission.READ_DOCUMENT,
                  Permission.DELETE_DOCUMENT,
                  Permission.MANAGE_FOLDERS,
                  Permission.READ_TEMPLATE),
              Role.READ_ONLY,
              EnumSet.of(
                  Permission.READ_CONTENT, Permission.READ_DOCUMENT, Permission.READ_TEMPLATE)));

  private final ImmutableMap<Role, ImmutableSet<Permission>> entries;

  /**
   * Builds a matrix from the given entries.
   *
   * @throws IllegalArgumentException if a role is missing, the administrator entry is not a
   *     superset of every other entry, or a capability is reachable from no role
   */
  public PermissionMatrix(Map<Role, ? extends Set<Permission>> entries) {
    ImmutableMap.Builder<Role, ImmutableSet<Permission>> builder = ImmutableMap.builder();
    for (Role role : Role.values()) {
      Set<Permission> granted = entries.get(role);
      if (granted == null) {
        throw new IllegalArgumentException("No capability entry for role " + role);
      }
      builder.put(role, ImmutableSet.copyOf(granted));
    }
    this.entries = builder.build();

    ImmutableSet<Permission> admin = this.entries.get(Role.ADMINISTRATOR);
    Set<Permission> reachable = EnumSet.noneOf(Permission.class);
    for (Map.Entry<Role, ImmutableSet<Permission>> entry : this.entries.entrySet()) {
      if (!admin.containsAll(entry.getValue())) {
        throw new IllegalArgumentException(
            "Administrator entry lacks "
                + Sets.difference(entry.getValue(), admin)
                + " granted to "
                + entry.getKey());
      }
      reachable.addAll(entry.getValue());
    }
    Set<Permission> unreachable =
        Sets.difference(EnumSet.allOf(Permission.class), reachable);
    if (!unreachable.isEmpty()) {
      throw new IllegalArgumentException("Capabilities granted to no role: " + unreachable);
    }
  }

  /** Returns the capabilities granted to {@code role}, or an empty set for a null role. */
  public ImmutableSet<Permission> permissionsFor(@Nullable Role role) {
    if (role == null) {
      return ImmutableSet.of();
    }
    return entries.get(role);
  }

  public boolean hasPermission(@Nullable Role role, Permission permission) {
    return permissionsFor(role).contains(permission);
  }

  public boolean hasAny(@Nullable Role role, Collection<Permission> permissions) {
    ImmutableSet<Permission> granted = permissionsFor(role);
    for (Permission p : permissions) {
      if (granted.contains(p)) {
        return true;
      }
    }
    return false;
  }

  public boolean hasAll(@Nullable Role role, Collection<Permission> permissions) {
    return permissionsFor(role).containsAll(permissions);
  }

  /** Returns a checker bound to {@code role}. */
  public PermissionChecker checkerFor(@Nullable Role role) {
    ImmutableSet<Permission> granted = permissionsFor(role);
    return granted::contains;
  }
}
