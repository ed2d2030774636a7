package com.wccms.db.util;

import com.google.common.base.Strings;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.wccms.common.status.Status;
import com.wccms.common.status.StatusOr;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Optional;
import javax.annotation.Nonnull;

/** Utility methods for database operations. */
public final class DbUtil {

  private static final Gson GSON = new Gson();

  private DbUtil() {
    // Utility class, no instances
  }

  /** Converts a java.time.Instant to java.sql.Timestamp. */
  @Nonnull
  public static java.sql.Timestamp toSqlTimestamp(Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null");
    }
    return java.sql.Timestamp.from(instant);
  }

  /** Gets an Instant from a ResultSet column using column name. */
  @Nonnull
  public static StatusOr<Instant> getInstant(ResultSet rs, String columnName) {
    try {
      java.sql.Timestamp timestamp = rs.getTimestamp(columnName);
      if (rs.wasNull() || timestamp == null) {
        return StatusOr.ofStatus(Status.invalidArgument("Column " + columnName + " is null"));
      }
      return StatusOr.ofValue(timestamp.toInstant());
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get Instant: " + e.getMessage(), e));
    }
  }

  /**
   * Gets an optional Instant from a ResultSet column, returning Optional.empty() if the column is
   * null.
   */
  public static StatusOr<Optional<Instant>> getOptionalInstant(ResultSet rs, String columnName) {
    try {
      java.sql.Timestamp timestamp = rs.getTimestamp(columnName);
      if (rs.wasNull() || timestamp == null) {
        return StatusOr.ofValue(Optional.empty());
      }
      return StatusOr.ofValue(Optional.of(timestamp.toInstant()));
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get Instant: " + e.getMessage(), e));
    }
  }

  /**
   * Reads a JSONB column into an object of the given class with Gson. A null or empty column
   * yields {@code emptyValue}.
   */
  @Nonnull
  public static <T> StatusOr<T> parseJsonb(
      ResultSet rs, String columnName, Class<T> type, T emptyValue) {
    try {
      String json = rs.getString(columnName);
      if (rs.wasNull() || Strings.isNullOrEmpty(json)) {
        return StatusOr.ofValue(emptyValue);
      }
      T value = GSON.fromJson(json, type);
      return StatusOr.ofValue(value != null ? value : emptyValue);
    } catch (JsonParseException e) {
      return StatusOr.ofStatus(Status.internal("Failed to parse JSON: " + e.getMessage(), e));
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to retrieve JSONB: " + e.getMessage(), e));
    }
  }

  /** Binds {@code value}, serialized by Gson, as a JSONB parameter. */
  @Nonnull
  public static Status setJsonbParameter(PreparedStatement stmt, int parameterIndex, Object value) {
    try {
      stmt.setObject(parameterIndex, GSON.toJson(value), Types.OTHER);
      return Status.ok();
    } catch (SQLException e) {
      return Status.internal("Failed to set JSONB parameter: " + e.getMessage(), e);
    }
  }
}
