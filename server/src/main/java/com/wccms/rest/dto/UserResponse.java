package com.wccms.rest.dto;

import com.wccms.db.User;

/**
 * An account as returned to clients. The password hash is never included.
 *
 * @param role role wire name
 * @param createdAt milliseconds since epoch
 * @param updatedAt milliseconds since epoch
 * @param lastLogin milliseconds since epoch, null if the user never logged in
 */
public record UserResponse(
    String id,
    String username,
    String email,
    String role,
    boolean isActive,
    Long createdAt,
    Long updatedAt,
    Long lastLogin) {

  public static UserResponse from(User user) {
    return new UserResponse(
        user.id(),
        user.username(),
        user.email(),
        user.role().getWireName(),
        user.active(),
        user.createdAt().toEpochMilli(),
        user.updatedAt().toEpochMilli(),
        user.lastLogin() != null ? user.lastLogin().toEpochMilli() : null);
  }
}
