package com.wccms.db;

import java.time.Instant;
import javax.annotation.Nullable;

/**
 * Represents a row in the 'folders' table.
 *
 * @param id The unique identifier of the folder
 * @param name The display name
 * @param parentId The parent folder, null for a root folder
 * @param isPublic Whether every authenticated user may read the folder
 * @param permissions The explicit read and write lists
 * @param createdBy The creator's user id
 * @param createdAt Timestamp when the record was created
 * @param updatedAt Timestamp when the record was last updated
 */
public record Folder(
    String id,
    String name,
    @Nullable String parentId,
    boolean isPublic,
    FolderPermissions permissions,
    String createdBy,
    Instant createdAt,
    Instant updatedAt) {

  public boolean isRoot() {
    return parentId == null;
  }

  public Folder withParent(@Nullable String newParentId, Instant now) {
    return new Folder(id, name, newParentId, isPublic, permissions, createdBy, createdAt, now);
  }

  public Folder withPermissions(FolderPermissions newPermissions, Instant now) {
    return new Folder(id, name, parentId, isPublic, newPermissions, createdBy, createdAt, now);
  }
}
