package com.wccms.db;

import com.wccms.acl.FolderStore;
import com.wccms.common.status.Status;
import com.wccms.common.status.StatusOr;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nullable;
import javax.sql.DataSource;
import org.tinylog.Logger;

/**
 * {@link FolderStore} over the 'folders' table.
 *
 * <p>Tree transactions take a transaction-scoped Postgres advisory lock on a fixed key, so every
 * structural change to the folder forest is serialized and the lock is released on commit or
 * rollback.
 */
public class JdbcFolderStore implements FolderStore {

  /** Advisory lock key shared by every tree transaction. */
  static final long TREE_LOCK_KEY = 0x57434d53_464f4c44L;

  private final DataSource dataSource;
  private final Clock clock;

  public JdbcFolderStore(DataSource dataSource) {
    this(dataSource, Clock.systemUTC());
  }

  public JdbcFolderStore(DataSource dataSource, Clock clock) {
    this.dataSource = dataSource;
    this.clock = clock;
  }

  @Override
  public StatusOr<Optional<Folder>> findById(String id) {
    return withConnection(conn -> new Bound(conn, clock).findById(id));
  }

  @Override
  public StatusOr<List<Folder>> findChildren(String parentId) {
    return withConnection(conn -> new Bound(conn, clock).findChildren(parentId));
  }

  @Override
  public StatusOr<List<Folder>> findAll() {
    return withConnection(conn -> new Bound(conn, clock).findAll());
  }

  @Override
  public Status save(Folder folder) {
    return withConnection(conn -> toStatusOr(new Bound(conn, clock).save(folder))).getStatus();
  }

  @Override
  public Status updateParent(String id, @Nullable String parentId) {
    return withConnection(conn -> toStatusOr(new Bound(conn, clock).updateParent(id, parentId)))
        .getStatus();
  }

  @Override
  public Status updatePermissions(String id, FolderPermissions permissions) {
    return withConnection(
            conn -> toStatusOr(new Bound(conn, clock).updatePermissions(id, permissions)))
        .getStatus();
  }

  @Override
  public <T> StatusOr<T> inTreeTransaction(TreeWork<T> work) {
    try (Connection conn = dataSource.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        try (PreparedStatement lock = conn.prepareStatement("SELECT pg_advisory_xact_lock(?)")) {
          lock.setLong(1, TREE_LOCK_KEY);
          lock.execute();
        }
        StatusOr<T> result = work.run(new Bound(conn, clock));
        if (result.isOk()) {
          conn.commit();
        } else {
          conn.rollback();
        }
        return result;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      Logger.error(e, "Folder tree transaction failed.");
      return StatusOr.ofException(e);
    }
  }

  private <T> StatusOr<T> withConnection(Function<Connection, StatusOr<T>> work) {
    try (Connection conn = dataSource.getConnection()) {
      return work.apply(conn);
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  private static StatusOr<Boolean> toStatusOr(Status status) {
    return status.isOk() ? StatusOr.ofValue(true) : StatusOr.ofStatus(status);
  }

  /** A store bound to one connection; inside a tree transaction it is the transaction view. */
  private static final class Bound implements FolderStore {
    private final Connection conn;
    private final Clock clock;

    Bound(Connection conn, Clock clock) {
      this.conn = conn;
      this.clock = clock;
    }

    @Override
    public StatusOr<Optional<Folder>> findById(String id) {
      return Folders.loadById(conn, id);
    }

    @Override
    public StatusOr<List<Folder>> findChildren(String parentId) {
      return Folders.loadChildren(conn, parentId);
    }

    @Override
    public StatusOr<List<Folder>> findAll() {
      return Folders.loadAll(conn);
    }

    @Override
    public Status save(Folder folder) {
      return Folders.save(conn, folder).getStatus();
    }

    @Override
    public Status updateParent(String id, @Nullable String parentId) {
      return rowStatus(Folders.updateParent(conn, id, parentId, clock.instant()), id);
    }

    @Override
    public Status updatePermissions(String id, FolderPermissions permissions) {
      return rowStatus(Folders.updatePermissions(conn, id, permissions, clock.instant()), id);
    }

    @Override
    public <T> StatusOr<T> inTreeTransaction(TreeWork<T> work) {
      // Already inside the transaction that holds the lock.
      return work.run(this);
    }

    private static Status rowStatus(StatusOr<Integer> updated, String id) {
      if (updated.isNotOk()) {
        return updated.getStatus();
      }
      return updated.getValue() == 0 ? Status.notFound("Folder not found: " + id) : Status.ok();
    }
  }
}
