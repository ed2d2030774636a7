package com.wccms.rest;

import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.path;
import static io.javalin.apibuilder.ApiBuilder.put;

import com.google.common.base.Strings;
import com.wccms.acl.FolderAccessControl;
import com.wccms.common.status.Status;
import com.wccms.common.status.StatusCode;
import com.wccms.common.status.StatusOr;
import com.wccms.db.Folder;
import com.wccms.db.FolderPermissions;
import com.wccms.rest.dto.ApiResponse;
import com.wccms.rest.dto.FolderPermissionsBody;
import com.wccms.rest.dto.FolderResponse;
import com.wccms.rest.dto.MoveFolderRequest;
import com.wccms.security.IdentityClaim;
import com.wccms.security.Permission;
import com.wccms.security.gate.AuthorizationGates;
import com.wccms.security.gate.ErrorCode;
import com.wccms.security.gate.Gate;
import com.wccms.security.gate.GateFailure;
import com.wccms.security.gate.GatePipeline;
import com.wccms.security.gate.GateResult;
import com.wccms.security.gate.OwnershipDescriptor;
import com.wccms.security.gate.Stage;
import io.javalin.http.Context;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/** REST adapter for folder listings, moves and permission changes. */
public class FolderRestAdapter implements RestAdapter {

  static final String FOLDER_ACCESS_DENIED = "Access denied to this folder";

  private final FolderAccessControl acl;
  private final AuthorizationGates gates;
  private final Clock clock;

  public FolderRestAdapter(FolderAccessControl acl, AuthorizationGates gates, Clock clock) {
    this.acl = acl;
    this.gates = gates;
    this.clock = clock;
  }

  @Override
  public void registerRoutes() {
    path(
        "/v1/folders",
        () -> {
          get(new GatedHandler(GatePipeline.of(gates.authenticate()), this::handleListFolders));
          path(
              "{id}",
              () -> {
                get(
                    "path",
                    new GatedHandler(
                        GatePipeline.of(gates.authenticate(), requireFolderAccess(false)),
                        this::handleGetPath));
                get(
                    "descendants",
                    new GatedHandler(
                        GatePipeline.of(gates.authenticate(), requireFolderAccess(false)),
                        this::handleGetDescendants));
                put("parent", new GatedHandler(movePipeline(), this::handleMoveFolder));
                put(
                    "permissions",
                    new GatedHandler(permissionsPipeline(), this::handleUpdatePermissions));
              });
        });
  }

  GatePipeline movePipeline() {
    return GatePipeline.of(
        gates.verifyCsrf(),
        gates.authenticate(),
        gates.requirePermission(Permission.MANAGE_FOLDERS),
        requireFolderAccess(true));
  }

  /** Anyone who may write to the folder may change its lists, as may administrators. */
  GatePipeline permissionsPipeline() {
    return GatePipeline.of(gates.verifyCsrf(), gates.authenticate(), requireFolderAccess(true));
  }

  /** Gate granting read (or write) access to the folder in the {@code id} path parameter. */
  Gate requireFolderAccess(boolean write) {
    return Gate.of(
        Stage.OWNERSHIP,
        write ? "folderWriteAccess" : "folderReadAccess",
        ctx -> {
          Optional<IdentityClaim> identity = ctx.identity();
          if (identity.isEmpty()) {
            return fail(ErrorCode.AUTHENTICATION_REQUIRED, null);
          }
          String folderId = ctx.pathParam(OwnershipDescriptor.DEFAULT_PARAM);
          if (Strings.isNullOrEmpty(folderId)) {
            return fail(ErrorCode.MISSING_RESOURCE_ID, null);
          }
          IdentityClaim claim = identity.get();
          boolean allowed =
              write
                  ? acl.hasWriteAccess(folderId, claim.userId(), claim.role())
                  : acl.hasReadAccess(folderId, claim.userId(), claim.role());
          return allowed ? GateResult.pass() : fail(ErrorCode.ACCESS_DENIED, FOLDER_ACCESS_DENIED);
        });
  }

  private GateResult fail(ErrorCode code, String message) {
    String text = message != null ? message : code.getDefaultMessage();
    return GateResult.fail(new GateFailure(code, text, clock.instant()));
  }

  /** Handles {@code GET /v1/folders}: the folders visible to the caller. */
  public void handleListFolders(Context ctx) {
    IdentityClaim claim = identity(ctx);
    StatusOr<List<Folder>> foldersOr = acl.accessibleFolders(claim.userId(), claim.role());
    if (foldersOr.isNotOk()) {
      setError(ctx, foldersOr.getStatus());
      return;
    }
    ctx.json(ApiResponse.of(FolderResponse.fromAll(foldersOr.getValue())));
  }

  /** Handles {@code GET /v1/folders/{id}/path}: root first, the folder itself last. */
  public void handleGetPath(Context ctx) {
    StatusOr<List<Folder>> pathOr = acl.getPath(ctx.pathParam("id"));
    if (pathOr.isNotOk()) {
      setError(ctx, pathOr.getStatus());
      return;
    }
    ctx.json(ApiResponse.of(FolderResponse.fromAll(pathOr.getValue())));
  }

  /** Handles {@code GET /v1/folders/{id}/descendants}. */
  public void handleGetDescendants(Context ctx) {
    StatusOr<List<Folder>> descendantsOr = acl.getDescendants(ctx.pathParam("id"));
    if (descendantsOr.isNotOk()) {
      setError(ctx, descendantsOr.getStatus());
      return;
    }
    ctx.json(ApiResponse.of(FolderResponse.fromAll(descendantsOr.getValue())));
  }

  /**
   * Handles {@code PUT /v1/folders/{id}/parent}. The caller needs write access to the folder
   * (checked by the gate) and to the destination.
   */
  public void handleMoveFolder(Context ctx) {
    StatusOr<MoveFolderRequest> bodyOr = parseBody(ctx, MoveFolderRequest.class);
    if (bodyOr.isNotOk()) {
      setError(ctx, bodyOr.getStatus());
      return;
    }
    IdentityClaim claim = identity(ctx);
    String folderId = ctx.pathParam("id");
    String parentId = Strings.emptyToNull(bodyOr.getValue().parentId());
    if (parentId != null && !acl.hasWriteAccess(parentId, claim.userId(), claim.role())) {
      setError(ctx, 403, ErrorCode.ACCESS_DENIED.name(), FOLDER_ACCESS_DENIED);
      return;
    }
    Status moved = acl.reparent(folderId, parentId);
    if (moved.getCode() == StatusCode.FAILED_PRECONDITION) {
      setError(ctx, moved.getHttpCode(), "CIRCULAR_REFERENCE", moved.getMessage());
      return;
    }
    if (moved.isError()) {
      setError(ctx, moved);
      return;
    }
    StatusOr<List<Folder>> pathOr = acl.getPath(folderId);
    if (pathOr.isNotOk()) {
      setError(ctx, pathOr.getStatus());
      return;
    }
    List<Folder> path = pathOr.getValue();
    ctx.json(ApiResponse.of(FolderResponse.from(path.get(path.size() - 1))));
  }

  /** Handles {@code PUT /v1/folders/{id}/permissions}; anyone with write access to the folder. */
  public void handleUpdatePermissions(Context ctx) {
    StatusOr<FolderPermissionsBody> bodyOr = parseBody(ctx, FolderPermissionsBody.class);
    if (bodyOr.isNotOk()) {
      setError(ctx, bodyOr.getStatus());
      return;
    }
    FolderPermissionsBody body = bodyOr.getValue();
    FolderPermissions permissions =
        FolderPermissions.of(
            body.read() != null ? body.read() : List.of(),
            body.write() != null ? body.write() : List.of());
    Status updated = acl.updatePermissions(ctx.pathParam("id"), permissions);
    if (updated.isError()) {
      setError(ctx, updated);
      return;
    }
    ctx.json(
        ApiResponse.of(
            new FolderPermissionsBody(permissions.read().asList(), permissions.write().asList())));
  }
}
