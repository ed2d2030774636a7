package com.wccms.db;

import com.wccms.common.status.Status;
import com.wccms.common.status.StatusOr;
import com.wccms.db.util.DbUtil;
import com.wccms.security.Role;

import javax.annotation.Nonnull;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

/**
 * DAO helper class for the 'users' table.
 */
public final class Users {

    private static final String COLUMNS = """
            id, username, email, password_hash, role, is_active,
            created_at, updated_at, last_login
            """;

    private Users() {
        // Utility class
    }

    /**
     * Loads a single user by ID.
     *
     * @param conn an open JDBC connection
     * @param id the id of the user to load
     * @return StatusOr containing an Optional User or an error
     */
    @Nonnull
    public static StatusOr<Optional<User>> loadById(Connection conn, String id) {
        return loadOne(conn, "SELECT " + COLUMNS + " FROM users WHERE id = ?", id);
    }

    /**
     * Loads a single user by username.
     *
     * @param conn an open JDBC connection
     * @param username the login name
     * @return StatusOr containing an Optional User or an error
     */
    @Nonnull
    public static StatusOr<Optional<User>> loadByUsername(Connection conn, String username) {
        return loadOne(conn, "SELECT " + COLUMNS + " FROM users WHERE username = ?", username);
    }

    /**
     * Loads a single user by email.
     *
     * @param conn an open JDBC connection
     * @param email the email of the user to load
     * @return StatusOr containing an Optional User or an error
     */
    @Nonnull
    public static StatusOr<Optional<User>> loadByEmail(Connection conn, String email) {
        return loadOne(conn, "SELECT " + COLUMNS + " FROM users WHERE email = ?", email);
    }

    @Nonnull
    private static StatusOr<Optional<User>> loadOne(Connection conn, String sql, String key) {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    StatusOr<User> userOr = extractUser(rs);
                    if (userOr.isNotOk()) {
                        return StatusOr.ofStatus(userOr.getStatus());
                    }
                    return StatusOr.ofValue(Optional.of(userOr.getValue()));
                }
                return StatusOr.ofValue(Optional.empty());
            }
        } catch (SQLException e) {
            return StatusOr.ofException(e);
        }
    }

    /**
     * Inserts or updates a user row (upsert). The creation time of an existing row is kept.
     *
     * @param conn an open JDBC connection
     * @param user the User object to save
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> save(Connection conn, User user) {
        String sql = """
                INSERT INTO users
                       (id, username, email, password_hash, role, is_active,
                        created_at, updated_at, last_login)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(id)
                DO UPDATE SET username      = excluded.username,
                              email         = excluded.email,
                              password_hash = excluded.password_hash,
                              role          = excluded.role,
                              is_active     = excluded.is_active,
                              updated_at    = excluded.updated_at,
                              last_login    = excluded.last_login
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, user.id());
            stmt.setString(2, user.username());
            stmt.setString(3, user.email());
            stmt.setString(4, user.passwordHash());
            stmt.setString(5, user.role().getWireName());
            stmt.setBoolean(6, user.active());
            stmt.setTimestamp(7, DbUtil.toSqlTimestamp(user.createdAt()));
            stmt.setTimestamp(8, DbUtil.toSqlTimestamp(user.updatedAt()));
            stmt.setTimestamp(9, user.lastLogin() != null
                    ? DbUtil.toSqlTimestamp(user.lastLogin()) : null);

            int rowsAffected = stmt.executeUpdate();
            return StatusOr.ofValue(rowsAffected);
        } catch (SQLException e) {
            return StatusOr.ofException(e);
        }
    }

    /**
     * Records a successful login.
     *
     * @param conn an open JDBC connection
     * @param id the id of the user
     * @param at the login time
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> updateLastLogin(Connection conn, String id, Instant at) {
        String sql = """
                UPDATE users
                   SET last_login = ?
                 WHERE id = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setTimestamp(1, DbUtil.toSqlTimestamp(at));
            stmt.setString(2, id);
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return StatusOr.ofException(e);
        }
    }

    /**
     * Extracts a User from the current row of a ResultSet.
     */
    @Nonnull
    private static StatusOr<User> extractUser(ResultSet rs) throws SQLException {
        String roleName = rs.getString("role");
        Optional<Role> role = Role.fromWireName(roleName);
        if (role.isEmpty()) {
            return StatusOr.ofStatus(Status.internal("Unknown role in users row: " + roleName, null));
        }

        StatusOr<Instant> createdAtOr = DbUtil.getInstant(rs, "created_at");
        if (createdAtOr.isNotOk()) {
            return StatusOr.ofStatus(createdAtOr.getStatus());
        }

        StatusOr<Instant> updatedAtOr = DbUtil.getInstant(rs, "updated_at");
        if (updatedAtOr.isNotOk()) {
            return StatusOr.ofStatus(updatedAtOr.getStatus());
        }

        StatusOr<Optional<Instant>> lastLoginOr = DbUtil.getOptionalInstant(rs, "last_login");
        if (lastLoginOr.isNotOk()) {
            return StatusOr.ofStatus(lastLoginOr.getStatus());
        }

        return StatusOr.ofValue(new User(
                rs.getString("id"),
                rs.getString("username"),
                rs.getString("email"),
                rs.getString("password_hash"),
                role.get(),
                rs.getBoolean("is_active"),
                createdAtOr.getValue(),
                updatedAtOr.getValue(),
                lastLoginOr.getValue().orElse(null)
        ));
    }
}
