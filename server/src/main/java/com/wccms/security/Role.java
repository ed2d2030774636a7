package com.wccms.security;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The closed set of roles a user account can hold.
 *
 * <p>A role is embedded in every issued token under its wire name ({@code administrator},
 * {@code editor}, {@code read-only}), so a role change takes effect only on the next token
 * issuance. Capabilities are not attached here; see {@link PermissionMatrix}.
 */
public enum Role {
  ADMINISTRATOR("administrator", 3),
  EDITOR("editor", 2),
  READ_ONLY("read-only", 1);

  private final String wireName;
  private final int level;

  Role(String wireName, int level) {
    this.wireName = wireName;
    this.level = level;
  }

  /** The name used in tokens, database rows and JSON payloads. */
  public String getWireName() {
    return wireName;
  }

  /** Privilege level: read-only 1, editor 2, administrator 3. */
  public int getLevel() {
    return level;
  }

  /**
   * Parses a wire name.
   *
   * @param wireName the name as stored or transmitted, may be null
   * @return the matching role, or empty for null and unknown names
   */
  public static Optional<Role> fromWireName(@Nullable String wireName) {
    if (wireName == null) {
      return Optional.empty();
    }
    for (Role role : values()) {
      if (role.wireName.equals(wireName)) {
        return Optional.of(role);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return wireName;
  }
}
