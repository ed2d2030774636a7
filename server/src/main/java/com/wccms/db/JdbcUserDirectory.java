package com.wccms.db;

import com.wccms.common.status.Status;
import com.wccms.common.status.StatusOr;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;
import javax.sql.DataSource;

/** {@link UserDirectory} over the 'users' table, one pooled connection per call. */
public class JdbcUserDirectory implements UserDirectory {

  private final DataSource dataSource;

  public JdbcUserDirectory(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  @Override
  public StatusOr<Optional<User>> findById(String id) {
    return withConnection(conn -> Users.loadById(conn, id));
  }

  @Override
  public StatusOr<Optional<User>> findByUsername(String username) {
    return withConnection(conn -> Users.loadByUsername(conn, username));
  }

  @Override
  public StatusOr<Optional<User>> findByEmail(String email) {
    return withConnection(conn -> Users.loadByEmail(conn, email));
  }

  @Override
  public Status save(User user) {
    return withConnection(conn -> Users.save(conn, user)).getStatus();
  }

  @Override
  public Status updateLastLogin(String id, Instant at) {
    StatusOr<Integer> updated = withConnection(conn -> Users.updateLastLogin(conn, id, at));
    if (updated.isNotOk()) {
      return updated.getStatus();
    }
    return updated.getValue() == 0 ? Status.notFound("User not found: " + id) : Status.ok();
  }

  private <T> StatusOr<T> withConnection(Function<Connection, StatusOr<T>> work) {
    try (Connection conn = dataSource.getConnection()) {
      return work.apply(conn);
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }
}
