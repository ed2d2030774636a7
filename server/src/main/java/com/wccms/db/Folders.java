package com.wccms.db;

import com.google.common.collect.ImmutableList;
import com.wccms.common.status.Status;
import com.wccms.common.status.StatusOr;
import com.wccms.db.util.DbUtil;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DAO helper class for the 'folders' table.
 */
public final class Folders {

    private static final String COLUMNS = """
            id, name, parent_id, is_public, permissions, created_by, created_at, updated_at
            """;

    private Folders() {
        // Utility class
    }

    /**
     * Loads all folders ordered by name.
     *
     * @param conn an open JDBC connection
     * @return StatusOr containing a list of Folder objects or an error
     */
    @Nonnull
    public static StatusOr<List<Folder>> loadAll(Connection conn) {
        String sql = "SELECT " + COLUMNS + " FROM folders ORDER BY name, id";
        try (PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            return extractAll(rs);
        } catch (SQLException e) {
            return StatusOr.ofException(e);
        }
    }

    /**
     * Loads a single folder by ID.
     *
     * @param conn an open JDBC connection
     * @param id the folder id
     * @return StatusOr containing an Optional Folder or an error
     */
    @Nonnull
    public static StatusOr<Optional<Folder>> loadById(Connection conn, String id) {
        String sql = "SELECT " + COLUMNS + " FROM folders WHERE id = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    StatusOr<Folder> folderOr = extractFolder(rs);
                    if (folderOr.isNotOk()) {
                        return StatusOr.ofStatus(folderOr.getStatus());
                    }
                    return StatusOr.ofValue(Optional.of(folderOr.getValue()));
                }
                return StatusOr.ofValue(Optional.empty());
            }
        } catch (SQLException e) {
            return StatusOr.ofException(e);
        }
    }

    /**
     * Loads the direct children of a folder.
     *
     * @param conn an open JDBC connection
     * @param parentId the parent folder id
     * @return StatusOr containing the children or an error
     */
    @Nonnull
    public static StatusOr<List<Folder>> loadChildren(Connection conn, String parentId) {
        String sql = "SELECT " + COLUMNS + " FROM folders WHERE parent_id = ? ORDER BY name, id";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, parentId);
            try (ResultSet rs = stmt.executeQuery()) {
                return extractAll(rs);
            }
        } catch (SQLException e) {
            return StatusOr.ofException(e);
        }
    }

    /**
     * Inserts or updates a folder row (upsert).
     *
     * @param conn an open JDBC connection
     * @param folder the Folder object to save
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> save(Connection conn, Folder folder) {
        String sql = """
                INSERT INTO folders
                       (id, name, parent_id, is_public, permissions, created_by,
                        created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(id)
                DO UPDATE SET name        = excluded.name,
                              parent_id   = excluded.parent_id,
                              is_public   = excluded.is_public,
                              permissions = excluded.permissions,
                              updated_at  = excluded.updated_at
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, folder.id());
            stmt.setString(2, folder.name());
            stmt.setString(3, folder.parentId());
            stmt.setBoolean(4, folder.isPublic());
            Status jsonStatus = DbUtil.setJsonbParameter(
                    stmt, 5, FolderPermissions.Json.of(folder.permissions()));
            if (jsonStatus.isError()) {
                return StatusOr.ofStatus(jsonStatus);
            }
            stmt.setString(6, folder.createdBy());
            stmt.setTimestamp(7, DbUtil.toSqlTimestamp(folder.createdAt()));
            stmt.setTimestamp(8, DbUtil.toSqlTimestamp(folder.updatedAt()));

            int rowsAffected = stmt.executeUpdate();
            return StatusOr.ofValue(rowsAffected);
        } catch (SQLException e) {
            return StatusOr.ofException(e);
        }
    }

    /**
     * Points a folder at a new parent.
     *
     * @param conn an open JDBC connection
     * @param id the folder id
     * @param parentId the new parent, null for root
     * @param at the modification time
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> updateParent(
            Connection conn, String id, @Nullable String parentId, Instant at) {
        String sql = """
                UPDATE folders
                   SET parent_id = ?, updated_at = ?
                 WHERE id = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, parentId);
            stmt.setTimestamp(2, DbUtil.toSqlTimestamp(at));
            stmt.setString(3, id);
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return StatusOr.ofException(e);
        }
    }

    /**
     * Replaces the explicit access lists of a folder.
     *
     * @param conn an open JDBC connection
     * @param id the folder id
     * @param permissions the new lists
     * @param at the modification time
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> updatePermissions(
            Connection conn, String id, FolderPermissions permissions, Instant at) {
        String sql = """
                UPDATE folders
                   SET permissions = ?, updated_at = ?
                 WHERE id = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            Status jsonStatus = DbUtil.setJsonbParameter(
                    stmt, 1, FolderPermissions.Json.of(permissions));
            if (jsonStatus.isError()) {
                return StatusOr.ofStatus(jsonStatus);
            }
            stmt.setTimestamp(2, DbUtil.toSqlTimestamp(at));
            stmt.setString(3, id);
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return StatusOr.ofException(e);
        }
    }

    @Nonnull
    private static StatusOr<List<Folder>> extractAll(ResultSet rs) throws SQLException {
        List<Folder> result = new ArrayList<>();
        while (rs.next()) {
            StatusOr<Folder> folderOr = extractFolder(rs);
            if (folderOr.isNotOk()) {
                return StatusOr.ofStatus(folderOr.getStatus());
            }
            result.add(folderOr.getValue());
        }
        return StatusOr.ofValue(ImmutableList.copyOf(result));
    }

    /**
     * Extracts a Folder from the current row of a ResultSet.
     */
    @Nonnull
    private static StatusOr<Folder> extractFolder(ResultSet rs) throws SQLException {
        StatusOr<FolderPermissions.Json> permissionsOr = DbUtil.parseJsonb(
                rs, "permissions", FolderPermissions.Json.class,
                FolderPermissions.Json.of(FolderPermissions.EMPTY));
        if (permissionsOr.isNotOk()) {
            return StatusOr.ofStatus(permissionsOr.getStatus());
        }

        StatusOr<Instant> createdAtOr = DbUtil.getInstant(rs, "created_at");
        if (createdAtOr.isNotOk()) {
            return StatusOr.ofStatus(createdAtOr.getStatus());
        }

        StatusOr<Instant> updatedAtOr = DbUtil.getInstant(rs, "updated_at");
        if (updatedAtOr.isNotOk()) {
            return StatusOr.ofStatus(updatedAtOr.getStatus());
        }

        return StatusOr.ofValue(new Folder(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("parent_id"),
                rs.getBoolean("is_public"),
                permissionsOr.getValue().toPermissions(),
                rs.getString("created_by"),
                createdAtOr.getValue(),
                updatedAtOr.getValue()
        ));
    }
}
