package com.wccms.rest.dto;

/** Body of {@code PUT /v1/folders/{id}/parent}. A null parent moves the folder to the root. */
public record MoveFolderRequest(String parentId) {
  public MoveFolderRequest() {
    this(null);
  }
}
