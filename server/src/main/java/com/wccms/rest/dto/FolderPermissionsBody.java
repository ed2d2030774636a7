package com.wccms.rest.dto;

import java.util.List;

/** Explicit folder access lists; also the body of {@code PUT /v1/folders/{id}/permissions}. */
public record FolderPermissionsBody(List<String> read, List<String> write) {
  public FolderPermissionsBody() {
    this(null, null);
  }
}
