package com.wccms.db;

import com.wccms.security.Role;
import java.time.Instant;
import javax.annotation.Nullable;

/**
 * Represents a row in the 'users' table.
 *
 * @param id The unique identifier of the user
 * @param username The login name, unique
 * @param email The email address, unique
 * @param passwordHash The encoded password hash
 * @param role The role embedded in tokens issued to this user
 * @param active Whether the account may authenticate
 * @param createdAt Timestamp when the record was created
 * @param updatedAt Timestamp when the record was last updated
 * @param lastLogin Timestamp of the last successful login, null if never
 */
public record User(
    String id,
    String username,
    String email,
    String passwordHash,
    Role role,
    boolean active,
    Instant createdAt,
    Instant updatedAt,
    @Nullable Instant lastLogin) {}
