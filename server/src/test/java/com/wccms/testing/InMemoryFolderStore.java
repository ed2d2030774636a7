package com.wccms.testing;

import com.google.common.collect.ImmutableList;
import com.wccms.acl.FolderStore;
import com.wccms.common.status.Status;
import com.wccms.common.status.StatusOr;
import com.wccms.db.Folder;
import com.wccms.db.FolderPermissions;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;

/**
 * {@link FolderStore} backed by a map. Tree transactions hold a lock and restore the previous
 * contents when the work fails.
 */
public class InMemoryFolderStore implements FolderStore {

  private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");

  private final Map<String, Folder> folders = new ConcurrentHashMap<>();
  private final ReentrantLock treeLock = new ReentrantLock();
  private final AtomicInteger lookups = new AtomicInteger();
  private volatile boolean failing;

  /** Adds a folder with empty permission lists. */
  public Folder add(String id, @Nullable String parentId, boolean isPublic, String createdBy) {
    return add(id, parentId, isPublic, createdBy, FolderPermissions.EMPTY);
  }

  public Folder add(
      String id,
      @Nullable String parentId,
      boolean isPublic,
      String createdBy,
      FolderPermissions permissions) {
    Folder folder =
        new Folder(id, "Folder " + id, parentId, isPublic, permissions, createdBy, CREATED, CREATED);
    folders.put(id, folder);
    return folder;
  }

  /** Makes every following call fail with an INTERNAL status. */
  public void setFailing(boolean failing) {
    this.failing = failing;
  }

  public int lookupCount() {
    return lookups.get();
  }

  public Folder get(String id) {
    return folders.get(id);
  }

  @Override
  public StatusOr<Optional<Folder>> findById(String id) {
    lookups.incrementAndGet();
    if (failing) {
      return StatusOr.ofStatus(Status.internal("store unavailable", null));
    }
    return StatusOr.ofValue(Optional.ofNullable(folders.get(id)));
  }

  @Override
  public StatusOr<List<Folder>> findChildren(String parentId) {
    if (failing) {
      return StatusOr.ofStatus(Status.internal("store unavailable", null));
    }
    return StatusOr.ofValue(
        folders.values().stream()
            .filter(f -> Objects.equals(f.parentId(), parentId))
            .sorted(Comparator.comparing(Folder::id))
            .collect(ImmutableList.toImmutableList()));
  }

  @Override
  public StatusOr<List<Folder>> findAll() {
    if (failing) {
      return StatusOr.ofStatus(Status.internal("store unavailable", null));
    }
    return StatusOr.ofValue(
        folders.values().stream()
            .sorted(Comparator.comparing(Folder::id))
            .collect(ImmutableList.toImmutableList()));
  }

  @Override
  public Status save(Folder folder) {
    folders.put(folder.id(), folder);
    return Status.ok();
  }

  @Override
  public Status updateParent(String id, @Nullable String parentId) {
    Folder folder = folders.get(id);
    if (folder == null) {
      return Status.notFound("Folder not found: " + id);
    }
    folders.put(id, folder.withParent(parentId, folder.updatedAt()));
    return Status.ok();
  }

  @Override
  public Status updatePermissions(String id, FolderPermissions permissions) {
    Folder folder = folders.get(id);
    if (folder == null) {
      return Status.notFound("Folder not found: " + id);
    }
    folders.put(id, folder.withPermissions(permissions, folder.updatedAt()));
    return Status.ok();
  }

  @Override
  public <T> StatusOr<T> inTreeTransaction(TreeWork<T> work) {
    treeLock.lock();
    try {
      Map<String, Folder> snapshot = new HashMap<>(folders);
      StatusOr<T> result = work.run(this);
      if (result.isNotOk()) {
        folders.clear();
        folders.putAll(snapshot);
      }
      return result;
    } finally {
      treeLock.unlock();
    }
  }
}
