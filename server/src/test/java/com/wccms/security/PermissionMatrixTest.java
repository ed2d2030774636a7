package com.wccms.security;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PermissionMatrixTest {

  private final PermissionMatrix matrix = PermissionMatrix.STANDARD;

  @Test
  void testAdministratorHoldsEveryCapability() {
    assertEquals(EnumSet.allOf(Permission.class), matrix.permissionsFor(Role.ADMINISTRATOR));
    for (Role role : Role.values()) {
      assertTrue(matrix.permissionsFor(Role.ADMINISTRATOR).containsAll(matrix.permissionsFor(role)));
    }
  }

  @Test
  void testEditorCapabilities() {
    assertTrue(matrix.hasPermission(Role.EDITOR, Permission.PUBLISH_CONTENT));
    assertTrue(matrix.hasPermission(Role.EDITOR, Permission.MANAGE_FOLDERS));
    assertTrue(matrix.hasPermission(Role.EDITOR, Permission.READ_TEMPLATE));
    assertFalse(matrix.hasPermission(Role.EDITOR, Permission.SET_FOLDER_PERMISSIONS));
    assertFalse(matrix.hasPermission(Role.EDITOR, Permission.CREATE_TEMPLATE));
    assertFalse(matrix.hasPermission(Role.EDITOR, Permission.READ_USER));
    assertFalse(matrix.hasPermission(Role.EDITOR, Permission.SYSTEM_ADMIN));
  }

  @Test
  void testReadOnlyCapabilities() {
    assertEquals(
        EnumSet.of(Permission.READ_CONTENT, Permission.READ_DOCUMENT, Permission.READ_TEMPLATE),
        matrix.permissionsFor(Role.READ_ONLY));
  }

  @Test
  void testNullRole_HasNothing() {
    assertTrue(matrix.permissionsFor(null).isEmpty());
    assertFalse(matrix.hasPermission(null, Permission.READ_CONTENT));
    assertFalse(matrix.hasAny(null, List.of(Permission.READ_CONTENT)));
  }

  @Test
  void testHasAnyAndHasAll() {
    List<Permission> mixed = List.of(Permission.READ_CONTENT, Permission.CREATE_USER);

    assertTrue(matrix.hasAny(Role.READ_ONLY, mixed));
    assertFalse(matrix.hasAll(Role.READ_ONLY, mixed));
    assertTrue(matrix.hasAll(Role.ADMINISTRATOR, mixed));
  }

  @Test
  void testEmptyRequirement_AnyIsFalseAllIsTrue() {
    assertFalse(matrix.hasAny(Role.ADMINISTRATOR, List.of()));
    assertTrue(matrix.hasAll(Role.READ_ONLY, List.of()));
  }

  @Test
  void testCheckerFor_MatchesMatrix() {
    PermissionChecker checker = matrix.checkerFor(Role.EDITOR);

    assertTrue(checker.hasPermission(Permission.UPLOAD_DOCUMENT));
    assertFalse(checker.hasPermission(Permission.DELETE_USER));
    assertTrue(checker.hasAnyPermission(Permission.DELETE_USER, Permission.DELETE_CONTENT));
    assertFalse(checker.hasAllPermissions(Permission.DELETE_USER, Permission.DELETE_CONTENT));
  }

  @Test
  void testConstructor_RejectsAdministratorThatIsNotASuperset() {
    Map<Role, EnumSet<Permission>> entries =
        Map.of(
            Role.ADMINISTRATOR, EnumSet.complementOf(EnumSet.of(Permission.PUBLISH_CONTENT)),
            Role.EDITOR, EnumSet.of(Permission.PUBLISH_CONTENT),
            Role.READ_ONLY, EnumSet.noneOf(Permission.class));

    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> new PermissionMatrix(entries));
    assertTrue(e.getMessage().contains("publish-content"));
  }

  @Test
  void testConstructor_RejectsUnreachableCapability() {
    Map<Role, EnumSet<Permission>> entries =
        Map.of(
            Role.ADMINISTRATOR, EnumSet.complementOf(EnumSet.of(Permission.SYSTEM_ADMIN)),
            Role.EDITOR, EnumSet.noneOf(Permission.class),
            Role.READ_ONLY, EnumSet.noneOf(Permission.class));

    assertThrows(IllegalArgumentException.class, () -> new PermissionMatrix(entries));
  }

  @Test
  void testConstructor_RejectsMissingRole() {
    Map<Role, EnumSet<Permission>> entries =
        Map.of(Role.ADMINISTRATOR, EnumSet.allOf(Permission.class));

    assertThrows(IllegalArgumentException.class, () -> new PermissionMatrix(entries));
  }

  @Test
  void testWireNames() {
    assertEquals("set-folder-permissions", Permission.SET_FOLDER_PERMISSIONS.getWireName());
    assertEquals(Permission.MANAGE_FOLDERS, Permission.fromWireName("manage-folders").orElseThrow());
    assertTrue(Permission.fromWireName("manage_folders").isEmpty());
    assertEquals(Role.READ_ONLY, Role.fromWireName("read-only").orElseThrow());
    assertTrue(Role.fromWireName("superuser").isEmpty());
    assertTrue(Role.fromWireName(null).isEmpty());
  }
}
