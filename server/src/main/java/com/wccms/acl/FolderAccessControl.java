package com.wccms.acl;

import com.google.common.collect.ImmutableList;
import com.wccms.common.status.Status;
import com.wccms.common.status.StatusOr;
import com.wccms.db.Folder;
import com.wccms.db.FolderPermissions;
import com.wccms.security.Role;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Access decisions and shape rules for the folder forest.
 *
 * <p>Visibility is decided per folder from its public flag, its explicit read and write lists and
 * its creator; access is not inherited from ancestors. Administrators pass every check.
 *
 * <p>The parent pointers must form a forest. {@link #reparent(String, String)} re-checks this
 * inside a tree transaction of the {@link FolderStore}, so two concurrent moves cannot both pass
 * the check and together close a loop.
 */
public class FolderAccessControl {

  public static final String CIRCULAR_REFERENCE_MESSAGE =
      "Cannot move folder: would create circular reference";

  private final FolderStore store;

  public FolderAccessControl(FolderStore store) {
    this.store = store;
  }

  /**
   * Returns the folders from the root down to {@code folderId}, inclusive.
   *
   * @return NOT_FOUND if the folder does not exist, INTERNAL if the stored parent pointers loop
   */
  public StatusOr<List<Folder>> getPath(String folderId) {
    Deque<Folder> path = new ArrayDeque<>();
    Set<String> seen = new HashSet<>();
    String currentId = folderId;
    while (currentId != null) {
      if (!seen.add(currentId)) {
        Logger.error("Folder {} has a cyclic ancestry at {}.", folderId, currentId);
        return StatusOr.ofStatus(Status.internal("Folder ancestry is cyclic", null));
      }
      StatusOr<Optional<Folder>> folderOr = store.findById(currentId);
      if (folderOr.isNotOk()) {
        return StatusOr.ofStatus(folderOr.getStatus());
      }
      if (folderOr.getValue().isEmpty()) {
        if (currentId.equals(folderId)) {
          return StatusOr.ofStatus(Status.notFound("Folder not found: " + folderId));
        }
        // Dangling parent pointer: treat the last folder found as the root.
        break;
      }
      Folder folder = folderOr.getValue().get();
      path.addFirst(folder);
      currentId = folder.parentId();
    }
    return StatusOr.ofValue(ImmutableList.copyOf(path));
  }

  /** Returns every folder below {@code folderId}, depth first. Empty for an unknown folder. */
  public StatusOr<List<Folder>> getDescendants(String folderId) {
    return collectDescendants(store, folderId);
  }

  private static StatusOr<List<Folder>> collectDescendants(FolderStore from, String folderId) {
    ImmutableList.Builder<Folder> result = ImmutableList.builder();
    Set<String> seen = new HashSet<>();
    seen.add(folderId);
    Status status = collectInto(from, folderId, result, seen);
    if (status.isError()) {
      return StatusOr.ofStatus(status);
    }
    return StatusOr.ofValue(result.build());
  }

  private static Status collectInto(
      FolderStore from, String parentId, ImmutableList.Builder<Folder> out, Set<String> seen) {
    StatusOr<List<Folder>> childrenOr = from.findChildren(parentId);
    if (childrenOr.isNotOk()) {
      return childrenOr.getStatus();
    }
    for (Folder child : childrenOr.getValue()) {
      if (!seen.add(child.id())) {
        continue;
      }
      out.add(child);
      Status status = collectInto(from, child.id(), out, seen);
      if (status.isError()) {
        return status;
      }
    }
    return Status.ok();
  }

  /**
   * Returns whether moving {@code folderId} under {@code newParentId} keeps the forest acyclic.
   * Moving to the root is always allowed and a folder can never be its own parent.
   */
  public StatusOr<Boolean> canReparent(String folderId, @Nullable String newParentId) {
    return canReparent(store, folderId, newParentId);
  }

  private static StatusOr<Boolean> canReparent(
      FolderStore from, String folderId, @Nullable String newParentId) {
    if (newParentId == null) {
      return StatusOr.ofValue(true);
    }
    if (newParentId.equals(folderId)) {
      return StatusOr.ofValue(false);
    }
    return collectDescendants(from, folderId)
        .map(descendants -> descendants.stream().noneMatch(f -> f.id().equals(newParentId)));
  }

  /**
   * Moves a folder. The cycle check and the write happen in one tree transaction.
   *
   * @return NOT_FOUND if the folder or the new parent does not exist, FAILED_PRECONDITION with
   *     {@link #CIRCULAR_REFERENCE_MESSAGE} if the move would create a cycle
   */
  public Status reparent(String folderId, @Nullable String newParentId) {
    StatusOr<Boolean> moved =
        store.inTreeTransaction(
            tx -> {
              StatusOr<Optional<Folder>> folderOr = tx.findById(folderId);
              if (folderOr.isNotOk()) {
                return StatusOr.ofStatus(folderOr.getStatus());
              }
              if (folderOr.getValue().isEmpty()) {
                return StatusOr.ofStatus(Status.notFound("Folder not found: " + folderId));
              }
              if (newParentId != null) {
                StatusOr<Optional<Folder>> parentOr = tx.findById(newParentId);
                if (parentOr.isNotOk()) {
                  return StatusOr.ofStatus(parentOr.getStatus());
                }
                if (parentOr.getValue().isEmpty()) {
                  return StatusOr.ofStatus(
                      Status.notFound("Parent folder not found: " + newParentId));
                }
              }
              StatusOr<Boolean> allowed = canReparent(tx, folderId, newParentId);
              if (allowed.isNotOk()) {
                return allowed;
              }
              if (!allowed.getValue()) {
                return StatusOr.ofStatus(Status.failedPrecondition(CIRCULAR_REFERENCE_MESSAGE));
              }
              Status updated = tx.updateParent(folderId, newParentId);
              return updated.isOk() ? StatusOr.ofValue(true) : StatusOr.ofStatus(updated);
            });
    if (moved.isNotOk()) {
      Logger.info(
          "Move of folder {} under {} refused: {}", folderId, newParentId, moved.getStatus());
      return moved.getStatus();
    }
    Logger.info("Moved folder {} under {}.", folderId, newParentId);
    return Status.ok();
  }

  /** Administrators, anyone for a public folder, and users on the read list. */
  public boolean hasReadAccess(String folderId, String userId, Role role) {
    return load(folderId).map(folder -> canRead(folder, userId, role)).orElse(false);
  }

  /** Administrators, the creator, and users on the write list. Public folders are not writable. */
  public boolean hasWriteAccess(String folderId, String userId, Role role) {
    return load(folderId).map(folder -> canWrite(folder, userId, role)).orElse(false);
  }

  static boolean canRead(Folder folder, String userId, Role role) {
    return role == Role.ADMINISTRATOR
        || folder.isPublic()
        || folder.permissions().read().contains(userId);
  }

  static boolean canWrite(Folder folder, String userId, Role role) {
    return role == Role.ADMINISTRATOR
        || Objects.equals(folder.createdBy(), userId)
        || folder.permissions().write().contains(userId);
  }

  /**
   * Returns the folders shown to a user in listings: all of them for an administrator, otherwise
   * the public ones, the user's own, and those naming the user on either list.
   */
  public StatusOr<List<Folder>> accessibleFolders(String userId, Role role) {
    StatusOr<List<Folder>> allOr = store.findAll();
    if (allOr.isNotOk() || role == Role.ADMINISTRATOR) {
      return allOr;
    }
    return StatusOr.ofValue(
        allOr.getValue().stream()
            .filter(folder -> isListedFor(folder, userId))
            .collect(ImmutableList.toImmutableList()));
  }

  private static boolean isListedFor(Folder folder, String userId) {
    FolderPermissions permissions = folder.permissions();
    return folder.isPublic()
        || Objects.equals(folder.createdBy(), userId)
        || permissions.read().contains(userId)
        || permissions.write().contains(userId);
  }

  /** A folder may be created at the root by anyone, or under a folder the user can write. */
  public boolean canCreateIn(@Nullable String parentId, String userId, Role role) {
    return parentId == null || hasWriteAccess(parentId, userId, role);
  }

  /** Replaces the explicit read and write lists of a folder. */
  public Status updatePermissions(String folderId, FolderPermissions permissions) {
    Status status = store.updatePermissions(folderId, permissions);
    if (status.isOk()) {
      Logger.info(
          "Folder {} permissions set: {} readers, {} writers.",
          folderId,
          permissions.read().size(),
          permissions.write().size());
    }
    return status;
  }

  private Optional<Folder> load(String folderId) {
    StatusOr<Optional<Folder>> folderOr = store.findById(folderId);
    if (folderOr.isNotOk()) {
      Logger.error("Could not load folder {}: {}", folderId, folderOr.getStatus());
      return Optional.empty();
    }
    return folderOr.getValue();
  }
}
