package com.wccms.security;

import java.util.Optional;

/**
 * The closed set of capabilities checked by route gates.
 *
 * <p>Capabilities are grouped by resource: content, document, folder, template and user
 * management, plus {@link #SYSTEM_ADMIN}. They exist only as members of a {@link
 * PermissionMatrix} entry and are never granted to a user individually.
 */
public enum Permission {

  // Content
  CREATE_CONTENT("create-content"),
  READ_CONTENT("read-content"),
  UPDATE_CONTENT("update-content"),
  DELETE_CONTENT("delete-content"),
  PUBLISH_CONTENT("publish-content"),

  // Documents
  UPLOAD_DOCUMENT("upload-document"),
  READ_DOCUMENT("read-document"),
  DELETE_DOCUMENT("delete-document"),

  // Folders
  /** Create, rename and move folders. */
  MANAGE_FOLDERS("manage-folders"),
  /** Change the explicit read and write lists of any folder. */
  SET_FOLDER_PERMISSIONS("set-folder-permissions"),

  // Templates
  CREATE_TEMPLATE("create-template"),
  READ_TEMPLATE("read-template"),
  UPDATE_TEMPLATE("update-template"),
  DELETE_TEMPLATE("delete-template"),

  // User management
  CREATE_USER("create-user"),
  READ_USER("read-user"),
  UPDATE_USER("update-user"),
  DELETE_USER("delete-user"),

  /** System settings, backups and other administrative endpoints. */
  SYSTEM_ADMIN("system-admin");

  private final String wireName;

  Permission(String wireName) {
    this.wireName = wireName;
  }

  public String getWireName() {
    return wireName;
  }

  public static Optional<Permission> fromWireName(String wireName) {
    for (Permission permission : values()) {
      if (permission.wireName.equals(wireName)) {
        return Optional.of(permission);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return wireName;
  }
}
