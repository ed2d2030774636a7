package com.wccms.security;

import com.google.common.collect.ImmutableSet;
import java.util.Locale;

/**
 * Role-based rules that handlers apply on top of the route gates: account administration,
 * content and document visibility, bulk operations and upload limits.
 */
public final class RolePolicies {

  /** Publication state of a content item. */
  public enum ContentStatus {
    DRAFT,
    PUBLISHED,
    ARCHIVED
  }

  public enum TemplateOperation {
    READ(Permission.READ_TEMPLATE),
    CREATE(Permission.CREATE_TEMPLATE),
    UPDATE(Permission.UPDATE_TEMPLATE),
    DELETE(Permission.DELETE_TEMPLATE);

    private final Permission required;

    TemplateOperation(Permission required) {
      this.required = required;
    }
  }

  public enum BulkOperation {
    DELETE,
    UPDATE,
    PUBLISH
  }

  public enum ResourceType {
    CONTENT,
    DOCUMENT,
    USER
  }

  private static final long MIB = 1024L * 1024L;

  private static final ImmutableSet<String> ALLOWED_UPLOAD_TYPES =
      ImmutableSet.of(
          "application/pdf",
          "application/msword",
          "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
          "application/vnd.ms-excel",
          "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
          "text/plain",
          "text/csv",
          "image/jpeg",
          "image/png",
          "image/gif",
          "image/webp");

  private final PermissionMatrix matrix;

  public RolePolicies(PermissionMatrix matrix) {
    this.matrix = matrix;
  }

  /**
   * Only administrators assign roles, and only to one of the known role names.
   *
   * @param targetRole the requested role as received on the wire
   */
  public PolicyDecision canAssignRole(Role assignerRole, String targetRole) {
    if (assignerRole != Role.ADMINISTRATOR) {
      return PolicyDecision.deny(
          "INSUFFICIENT_PRIVILEGES", "Only administrators can assign user roles");
    }
    if (Role.fromWireName(targetRole).isEmpty()) {
      return PolicyDecision.deny("INVALID_ROLE", "Invalid role specified");
    }
    return PolicyDecision.allow();
  }

  public PolicyDecision canModifyUser(Role modifierRole, boolean isSelf) {
    if (isSelf || modifierRole == Role.ADMINISTRATOR) {
      return PolicyDecision.allow();
    }
    return PolicyDecision.deny(
        "INSUFFICIENT_PRIVILEGES", "Only administrators can modify other user accounts");
  }

  /** Nobody deletes their own account, administrators included. */
  public PolicyDecision canDeleteUser(Role deleterRole, boolean isSelf) {
    if (isSelf) {
      return PolicyDecision.deny("SELF_DELETE_FORBIDDEN", "Users cannot delete their own account");
    }
    if (deleterRole != Role.ADMINISTRATOR) {
      return PolicyDecision.deny(
          "INSUFFICIENT_PRIVILEGES", "Only administrators can delete user accounts");
    }
    return PolicyDecision.allow();
  }

  public PolicyDecision canAccessContent(Role role, ContentStatus status, boolean isOwner) {
    if (status == ContentStatus.PUBLISHED
        || isOwner
        || matrix.hasPermission(role, Permission.UPDATE_CONTENT)) {
      return PolicyDecision.allow();
    }
    return PolicyDecision.deny(
        "CONTENT_ACCESS_DENIED", "Insufficient permissions to access this content");
  }

  public PolicyDecision canAccessDocument(
      Role role, boolean inPublicFolder, boolean hasExplicitAccess) {
    if (inPublicFolder
        || hasExplicitAccess
        || matrix.hasPermission(role, Permission.UPLOAD_DOCUMENT)) {
      return PolicyDecision.allow();
    }
    return PolicyDecision.deny(
        "DOCUMENT_ACCESS_DENIED", "Insufficient permissions to access this document");
  }

  /** Creators always manage their folder; otherwise a folder capability is required. */
  public PolicyDecision canManageFolderPermissions(Role role, boolean isOwner) {
    if (isOwner
        || matrix.hasAny(
            role,
            ImmutableSet.of(Permission.SET_FOLDER_PERMISSIONS, Permission.MANAGE_FOLDERS))) {
      return PolicyDecision.allow();
    }
    return PolicyDecision.deny(
        "FOLDER_PERMISSION_DENIED", "Insufficient permissions to manage folder permissions");
  }

  public PolicyDecision canAccessTemplate(Role role, TemplateOperation operation) {
    if (matrix.hasPermission(role, operation.required)) {
      return PolicyDecision.allow();
    }
    return PolicyDecision.deny(
        "TEMPLATE_ACCESS_DENIED",
        "Insufficient permissions to " + operation.name().toLowerCase(Locale.ROOT) + " templates");
  }

  public static int roleLevel(Role role) {
    return role.getLevel();
  }

  public static boolean hasHigherPrivileges(Role first, Role second) {
    return first.getLevel() > second.getLevel();
  }

  public PolicyDecision canPerformBulkOperation(
      Role role, BulkOperation operation, ResourceType resourceType) {
    Permission required = bulkPermission(operation, resourceType);
    String op = operation.name().toLowerCase(Locale.ROOT);
    String type = resourceType.name().toLowerCase(Locale.ROOT);
    if (required == null) {
      return PolicyDecision.deny("INVALID_BULK_OPERATION", "Invalid bulk operation specified");
    }
    if (matrix.hasPermission(role, required)) {
      return PolicyDecision.allow();
    }
    return PolicyDecision.deny(
        "BULK_OPERATION_DENIED",
        "Insufficient permissions for bulk " + op + " operation on " + type);
  }

  private static Permission bulkPermission(BulkOperation operation, ResourceType resourceType) {
    switch (resourceType) {
      case CONTENT:
        switch (operation) {
          case DELETE:
            return Permission.DELETE_CONTENT;
          case UPDATE:
            return Permission.UPDATE_CONTENT;
          default:
            return Permission.PUBLISH_CONTENT;
        }
      case DOCUMENT:
        if (operation == BulkOperation.DELETE) {
          return Permission.DELETE_DOCUMENT;
        }
        // Replacing a document's file is an upload.
        return operation == BulkOperation.UPDATE ? Permission.UPLOAD_DOCUMENT : null;
      case USER:
        if (operation == BulkOperation.DELETE) {
          return Permission.DELETE_USER;
        }
        return operation == BulkOperation.UPDATE ? Permission.UPDATE_USER : null;
      default:
        return null;
    }
  }

  public PolicyDecision canAccessSystemAdmin(Role role) {
    if (matrix.hasPermission(role, Permission.SYSTEM_ADMIN)) {
      return PolicyDecision.allow();
    }
    return PolicyDecision.deny(
        "SYSTEM_ADMIN_REQUIRED", "System administration privileges required");
  }

  public static boolean isExemptFromRateLimit(Role role) {
    return role == Role.ADMINISTRATOR;
  }

  /** Largest upload accepted for the role, in bytes. */
  public static long maxUploadSize(Role role) {
    switch (role) {
      case ADMINISTRATOR:
        return 100 * MIB;
      case EDITOR:
        return 50 * MIB;
      default:
        return 0;
    }
  }

  public PolicyDecision canUploadFile(Role role, long sizeBytes, String mimeType) {
    if (!matrix.hasPermission(role, Permission.UPLOAD_DOCUMENT)) {
      return PolicyDecision.deny(
          "UPLOAD_PERMISSION_DENIED", "Insufficient permissions to upload files");
    }
    long limit = maxUploadSize(role);
    if (sizeBytes > limit) {
      return PolicyDecision.deny(
          "FILE_SIZE_EXCEEDED", "File size exceeds limit for your role (" + limit / MIB + "MB)");
    }
    if (!ALLOWED_UPLOAD_TYPES.contains(mimeType)) {
      return PolicyDecision.deny("INVALID_FILE_TYPE", "File type not allowed");
    }
    return PolicyDecision.allow();
  }
}
