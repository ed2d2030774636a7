package com.wccms.acl;

import com.wccms.common.status.Status;
import com.wccms.common.status.StatusOr;
import com.wccms.db.Folder;
import com.wccms.db.FolderPermissions;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Persistence seam for folder records. {@link FolderAccessControl} owns all tree logic; a store
 * only reads and writes rows.
 */
public interface FolderStore {

  StatusOr<Optional<Folder>> findById(String id);

  /** Returns the direct children of {@code parentId}. */
  StatusOr<List<Folder>> findChildren(String parentId);

  StatusOr<List<Folder>> findAll();

  /** Inserts or updates a folder. */
  Status save(Folder folder);

  Status updateParent(String id, @Nullable String parentId);

  Status updatePermissions(String id, FolderPermissions permissions);

  /**
   * Runs {@code work} against a view of this store while holding the tree-wide write lock. Every
   * write made through the view becomes visible atomically, or not at all if the work returns a
   * failed status.
   */
  <T> StatusOr<T> inTreeTransaction(TreeWork<T> work);

  /** A unit of work run by {@link #inTreeTransaction(TreeWork)}. */
  @FunctionalInterface
  interface TreeWork<T> {
    StatusOr<T> run(FolderStore tx);
  }
}
