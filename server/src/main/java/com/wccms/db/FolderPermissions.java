package com.wccms.db;

import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.List;

/**
 * The explicit access lists of a folder.
 *
 * @param read user ids granted read access
 * @param write user ids granted write access
 */
public record FolderPermissions(ImmutableSet<String> read, ImmutableSet<String> write) {

  public static final FolderPermissions EMPTY =
      new FolderPermissions(ImmutableSet.of(), ImmutableSet.of());

  public static FolderPermissions of(Collection<String> read, Collection<String> write) {
    return new FolderPermissions(ImmutableSet.copyOf(read), ImmutableSet.copyOf(write));
  }

  /** JSONB layout: {@code {"read": [...], "write": [...]}}. */
  static final class Json {
    List<String> read;
    List<String> write;

    static Json of(FolderPermissions permissions) {
      Json json = new Json();
      json.read = permissions.read().asList();
      json.write = permissions.write().asList();
      return json;
    }

    FolderPermissions toPermissions() {
      return FolderPermissions.of(
          read != null ? read : List.of(), write != null ? write : List.of());
    }
  }
}
