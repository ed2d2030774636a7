package com.wccms.rest.dto;

import com.wccms.db.Folder;
import java.util.List;

/**
 * A folder as returned to clients.
 *
 * @param parentId null for a root folder
 * @param createdAt milliseconds since epoch
 * @param updatedAt milliseconds since epoch
 */
public record FolderResponse(
    String id,
    String name,
    String parentId,
    boolean isPublic,
    FolderPermissionsBody permissions,
    String createdBy,
    Long createdAt,
    Long updatedAt) {

  public static FolderResponse from(Folder folder) {
    return new FolderResponse(
        folder.id(),
        folder.name(),
        folder.parentId(),
        folder.isPublic(),
        new FolderPermissionsBody(
            folder.permissions().read().asList(), folder.permissions().write().asList()),
        folder.createdBy(),
        folder.createdAt().toEpochMilli(),
        folder.updatedAt().toEpochMilli());
  }

  public static List<FolderResponse> fromAll(List<Folder> folders) {
    return folders.stream().map(FolderResponse::from).toList();
  }
}
