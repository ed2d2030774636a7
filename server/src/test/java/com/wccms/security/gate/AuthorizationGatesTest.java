package com.wccms.security.gate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.wccms.common.status.Status;
import com.wccms.common.status.StatusOr;
import com.wccms.config.AuthConfig;
import com.wccms.db.User;
import com.wccms.db.UserDirectory;
import com.wccms.security.CsrfGuard;
import com.wccms.security.IdentityClaim;
import com.wccms.security.Permission;
import com.wccms.security.PermissionMatrix;
import com.wccms.security.Role;
import com.wccms.security.TokenService;
import com.wccms.security.TokenUse;
import com.wccms.testing.MutableClock;
import com.wccms.testing.TestRequestContext;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuthorizationGatesTest {

  private static final AuthConfig CONFIG =
      new AuthConfig(
          "gate-jwt-secret",
          Duration.ofHours(24),
          Duration.ofDays(7),
          "gate-csrf-secret",
          Duration.ofHours(1),
          1,
          1024,
          1);

  private MutableClock clock;
  private TokenService tokens;
  private CsrfGuard csrf;
  @Mock private UserDirectory users;
  private AuthorizationGates gates;

  @BeforeEach
  void setUp() {
    clock = MutableClock.atDefaultStart();
    tokens = new TokenService(CONFIG, clock);
    csrf = new CsrfGuard(CONFIG.csrfSecret(), CONFIG.csrfTtl(), clock);
    gates = new AuthorizationGates(tokens, users, PermissionMatrix.STANDARD, csrf, clock);
  }

  private User user(String id, Role role, boolean active) {
    Instant now = clock.instant();
    return new User(id, id + "-name", id + "@example.com", "hash", role, active, now, now, null);
  }

  private IdentityClaim claim(String userId, Role role) {
    Instant now = clock.instant();
    return new IdentityClaim(
        userId, userId + "-name", role, now, now.plusSeconds(60), TokenService.ISSUER,
        TokenUse.ACCESS);
  }

  private static ErrorCode failureCode(GateResult result) {
    return result.failure().orElseThrow().code();
  }

  // Authentication

  @Test
  void testAuthenticate_SetsIdentityForActiveUser() {
    // Given
    when(users.findById("u1"))
        .thenReturn(StatusOr.ofValue(Optional.of(user("u1", Role.EDITOR, true))));
    String token = tokens.issueAccess("u1", "alice", Role.EDITOR);
    TestRequestContext ctx =
        TestRequestContext.get("/v1/auth/profile").withHeader("authorization", "Bearer " + token);

    // When
    GateResult result = gates.authenticate().check(ctx);

    // Then
    assertTrue(result.isPassed());
    assertEquals("u1", ctx.identity().orElseThrow().userId());
    assertEquals(Role.EDITOR, ctx.identity().orElseThrow().role());
  }

  @Test
  void testAuthenticate_MissingOrMalformedHeader() {
    assertEquals(
        ErrorCode.MISSING_TOKEN,
        failureCode(gates.authenticate().check(TestRequestContext.get("/x"))));
    assertEquals(
        ErrorCode.MISSING_TOKEN,
        failureCode(
            gates.authenticate()
                .check(TestRequestContext.get("/x").withHeader("Authorization", "Token abc"))));
    verifyNoInteractions(users);
  }

  @Test
  void testAuthenticate_ExpiredToken() {
    String token = tokens.issueAccess("u1", "alice", Role.EDITOR);
    clock.advance(Duration.ofDays(2));

    GateResult result =
        gates.authenticate()
            .check(TestRequestContext.get("/x").withHeader("Authorization", "Bearer " + token));

    GateFailure failure = result.failure().orElseThrow();
    assertEquals(ErrorCode.AUTHENTICATION_FAILED, failure.code());
    assertEquals("Token expired", failure.message());
    assertEquals(401, failure.httpStatus());
    assertEquals(clock.instant(), failure.timestamp());
  }

  @Test
  void testAuthenticate_RejectsRefreshToken() {
    String refresh = tokens.issueRefresh("u1", "alice", Role.EDITOR);

    GateResult result =
        gates.authenticate()
            .check(TestRequestContext.get("/x").withHeader("Authorization", "Bearer " + refresh));

    assertEquals(ErrorCode.AUTHENTICATION_FAILED, failureCode(result));
    assertEquals("Invalid token", result.failure().orElseThrow().message());
  }

  @Test
  void testAuthenticate_InactiveOrMissingAccount() {
    String token = tokens.issueAccess("u1", "alice", Role.EDITOR);
    TestRequestContext ctx =
        TestRequestContext.get("/x").withHeader("Authorization", "Bearer " + token);

    when(users.findById("u1"))
        .thenReturn(StatusOr.ofValue(Optional.of(user("u1", Role.EDITOR, false))));
    assertEquals(ErrorCode.INVALID_USER, failureCode(gates.authenticate().check(ctx)));

    when(users.findById("u1")).thenReturn(StatusOr.ofValue(Optional.empty()));
    assertEquals(ErrorCode.INVALID_USER, failureCode(gates.authenticate().check(ctx)));
    assertTrue(ctx.identity().isEmpty());
  }

  @Test
  void testAuthenticate_DirectoryFailure() {
    String token = tokens.issueAccess("u1", "alice", Role.EDITOR);
    when(users.findById("u1")).thenReturn(StatusOr.ofStatus(Status.internal("db down", null)));

    GateResult result =
        gates.authenticate()
            .check(TestRequestContext.get("/x").withHeader("Authorization", "Bearer " + token));

    assertEquals(ErrorCode.AUTHENTICATION_FAILED, failureCode(result));
  }

  @Test
  void testOptionalAuth_NeverFails() {
    TestRequestContext anonymous = TestRequestContext.get("/x");
    assertTrue(gates.optionalAuth().check(anonymous).isPassed());
    assertTrue(anonymous.identity().isEmpty());

    TestRequestContext broken =
        TestRequestContext.get("/x").withHeader("Authorization", "Bearer garbage");
    assertTrue(gates.optionalAuth().check(broken).isPassed());
    assertTrue(broken.identity().isEmpty());

    when(users.findById("u1"))
        .thenReturn(StatusOr.ofValue(Optional.of(user("u1", Role.READ_ONLY, true))));
    TestRequestContext valid =
        TestRequestContext.get("/x")
            .withHeader("Authorization", "Bearer " + tokens.issueAccess("u1", "a", Role.READ_ONLY));
    assertTrue(gates.optionalAuth().check(valid).isPassed());
    assertEquals("u1", valid.identity().orElseThrow().userId());
  }

  @Test
  void testOptionalAuth_DirectoryThrowingLeavesRequestAnonymous() {
    // Given
    when(users.findById("u1")).thenThrow(new IllegalStateException("pool closed"));
    TestRequestContext ctx =
        TestRequestContext.get("/x")
            .withHeader("Authorization", "Bearer " + tokens.issueAccess("u1", "a", Role.EDITOR));

    // When
    GateResult result = gates.optionalAuth().check(ctx);

    // Then
    assertTrue(result.isPassed());
    assertTrue(ctx.identity().isEmpty());
  }

  // Roles and capabilities

  @Test
  void testRequireRole() {
    assertEquals(
        ErrorCode.AUTHENTICATION_REQUIRED,
        failureCode(gates.requireAdmin().check(TestRequestContext.get("/x"))));
    assertEquals(
        ErrorCode.INSUFFICIENT_PERMISSIONS,
        failureCode(
            gates.requireAdmin()
                .check(TestRequestContext.get("/x").withIdentity(claim("u1", Role.EDITOR)))));
    assertTrue(
        gates.requireAdmin()
            .check(TestRequestContext.get("/x").withIdentity(claim("u1", Role.ADMINISTRATOR)))
            .isPassed());
    assertTrue(
        gates.requireEditor()
            .check(TestRequestContext.get("/x").withIdentity(claim("u1", Role.EDITOR)))
            .isPassed());
    assertEquals(
        ErrorCode.INSUFFICIENT_PERMISSIONS,
        failureCode(
            gates.requireEditor()
                .check(TestRequestContext.get("/x").withIdentity(claim("u1", Role.READ_ONLY)))));
  }

  @Test
  void testRequirePermission_AnyMode() {
    Gate gate = gates.requirePermission(Permission.CREATE_USER, Permission.READ_CONTENT);

    assertTrue(
        gate.check(TestRequestContext.get("/x").withIdentity(claim("u1", Role.READ_ONLY)))
            .isPassed());

    GateResult denied =
        gates.requirePermission(Permission.CREATE_USER, Permission.DELETE_USER)
            .check(TestRequestContext.get("/x").withIdentity(claim("u1", Role.EDITOR)));
    assertEquals(ErrorCode.INSUFFICIENT_PERMISSIONS, failureCode(denied));
    assertEquals(
        "Insufficient permissions. Required: create-user or delete-user",
        denied.failure().orElseThrow().message());
  }

  @Test
  void testRequirePermission_AllMode() {
    Gate gate = gates.requireAllPermissions(Permission.READ_CONTENT, Permission.MANAGE_FOLDERS);

    assertTrue(
        gate.check(TestRequestContext.get("/x").withIdentity(claim("u1", Role.EDITOR)))
            .isPassed());

    GateResult denied =
        gate.check(TestRequestContext.get("/x").withIdentity(claim("u1", Role.READ_ONLY)));
    assertEquals(
        "Insufficient permissions. Required: read-content and manage-folders",
        denied.failure().orElseThrow().message());
  }

  @Test
  void testRequirePermission_WithoutIdentity() {
    assertEquals(
        ErrorCode.AUTHENTICATION_REQUIRED,
        failureCode(
            gates.requirePermission(Permission.READ_CONTENT).check(TestRequestContext.get("/x"))));
  }

  // Ownership

  @Test
  void testRequireOwnershipOrAdmin_AdminSkipsPredicate() throws Exception {
    // Given
    OwnershipCheck check = mock(OwnershipCheck.class);
    Gate gate = gates.requireOwnershipOrAdmin(OwnershipDescriptor.of(check));
    TestRequestContext ctx =
        TestRequestContext.get("/x")
            .withPathParam("id", "doc-1")
            .withIdentity(claim("admin", Role.ADMINISTRATOR));

    // When
    GateResult result = gate.check(ctx);

    // Then
    assertTrue(result.isPassed());
    verify(check, never()).isOwner(any(), any());
  }

  @Test
  void testRequireOwnershipOrAdmin_OwnerAndNonOwner() throws Exception {
    OwnershipCheck check = mock(OwnershipCheck.class);
    when(check.isOwner("u1", "doc-1")).thenReturn(true);
    when(check.isOwner("u2", "doc-1")).thenReturn(false);
    Gate gate = gates.requireOwnershipOrAdmin(OwnershipDescriptor.of(check));

    assertTrue(
        gate.check(
                TestRequestContext.get("/x")
                    .withPathParam("id", "doc-1")
                    .withIdentity(claim("u1", Role.READ_ONLY)))
            .isPassed());
    GateResult denied =
        gate.check(
            TestRequestContext.get("/x")
                .withPathParam("id", "doc-1")
                .withIdentity(claim("u2", Role.EDITOR)));
    assertEquals(ErrorCode.ACCESS_DENIED, failureCode(denied));
    assertEquals(403, denied.failure().orElseThrow().httpStatus());
  }

  @Test
  void testRequireOwnershipOrAdmin_OverrideDisabledConsultsPredicate() throws Exception {
    OwnershipCheck check = mock(OwnershipCheck.class);
    when(check.isOwner(anyString(), anyString())).thenReturn(false);
    Gate gate = gates.requireOwnershipOrAdmin(new OwnershipDescriptor(check, false, "docId"));

    GateResult result =
        gate.check(
            TestRequestContext.get("/x")
                .withPathParam("docId", "doc-1")
                .withIdentity(claim("admin", Role.ADMINISTRATOR)));

    assertEquals(ErrorCode.ACCESS_DENIED, failureCode(result));
    verify(check).isOwner("admin", "doc-1");
  }

  @Test
  void testRequireOwnershipOrAdmin_LayeredFailures() throws Exception {
    OwnershipCheck check = mock(OwnershipCheck.class);
    Gate gate = gates.requireOwnershipOrAdmin(OwnershipDescriptor.of(check));

    // Anonymous caller with no resource id: 401 comes first.
    GateResult anonymous = gate.check(TestRequestContext.get("/x"));
    assertEquals(ErrorCode.AUTHENTICATION_REQUIRED, failureCode(anonymous));

    GateResult missingId =
        gate.check(TestRequestContext.get("/x").withIdentity(claim("u1", Role.EDITOR)));
    assertEquals(ErrorCode.MISSING_RESOURCE_ID, failureCode(missingId));
    assertEquals(400, missingId.failure().orElseThrow().httpStatus());
    assertEquals(
        "Resource ID parameter 'id' is required", missingId.failure().orElseThrow().message());

    verifyNoInteractions(check);
  }

  @Test
  void testRequireOwnershipOrAdmin_PredicateErrorIs500() throws Exception {
    OwnershipCheck check = mock(OwnershipCheck.class);
    when(check.isOwner(anyString(), anyString())).thenThrow(new IllegalStateException("db down"));
    Gate gate = gates.requireOwnershipOrAdmin(OwnershipDescriptor.of(check));

    GateResult result =
        gate.check(
            TestRequestContext.get("/x")
                .withPathParam("id", "doc-1")
                .withIdentity(claim("u1", Role.EDITOR)));

    assertEquals(ErrorCode.OWNERSHIP_CHECK_FAILED, failureCode(result));
    assertEquals(500, result.failure().orElseThrow().httpStatus());
  }

  // Conditional access

  @Test
  void testConditionalAuth_SelfAccess() {
    Gate gate =
        gates.conditionalAuth(
            ConditionalAccess.builder()
                .allowSelf(true)
                .permissions(PermissionMode.ANY, Permission.READ_USER)
                .build());

    assertTrue(
        gate.check(
                TestRequestContext.get("/users/u1")
                    .withPathParam("id", "u1")
                    .withIdentity(claim("u1", Role.READ_ONLY)))
            .isPassed());
    assertEquals(
        ErrorCode.INSUFFICIENT_PERMISSIONS,
        failureCode(
            gate.check(
                TestRequestContext.get("/users/u2")
                    .withPathParam("id", "u2")
                    .withIdentity(claim("u1", Role.EDITOR)))));
    assertTrue(
        gate.check(
                TestRequestContext.get("/users/u2")
                    .withPathParam("id", "u2")
                    .withIdentity(claim("root", Role.ADMINISTRATOR)))
            .isPassed());
  }

  @Test
  void testConditionalAuth_SelfOnlyDeniesOthers() {
    Gate gate = gates.conditionalAuth(ConditionalAccess.builder().allowSelf(true).build());

    GateResult result =
        gate.check(
            TestRequestContext.get("/users/u2")
                .withPathParam("id", "u2")
                .withIdentity(claim("u1", Role.EDITOR)));

    assertEquals(ErrorCode.ACCESS_DENIED, failureCode(result));
  }

  @Test
  void testConditionalAuth_AdminOverrideDisabled() {
    Gate gate =
        gates.conditionalAuth(
            ConditionalAccess.builder()
                .adminOverride(false)
                .permissions(PermissionMode.ALL, Permission.SYSTEM_ADMIN)
                .build());

    assertTrue(
        gate.check(TestRequestContext.get("/x").withIdentity(claim("a", Role.ADMINISTRATOR)))
            .isPassed());
    assertEquals(
        ErrorCode.INSUFFICIENT_PERMISSIONS,
        failureCode(gate.check(TestRequestContext.get("/x").withIdentity(claim("e", Role.EDITOR)))));
  }

  @Test
  void testConditionalAuth_NoRulesPassesAuthenticatedCaller() {
    Gate gate = gates.conditionalAuth(ConditionalAccess.builder().build());

    assertTrue(
        gate.check(TestRequestContext.get("/x").withIdentity(claim("u1", Role.READ_ONLY)))
            .isPassed());
    assertEquals(
        ErrorCode.AUTHENTICATION_REQUIRED, failureCode(gate.check(TestRequestContext.get("/x"))));
  }

  // CSRF

  @Test
  void testVerifyCsrf_SafeMethodsPass() {
    assertTrue(gates.verifyCsrf().check(TestRequestContext.get("/x")).isPassed());
    assertTrue(gates.verifyCsrf().check(new TestRequestContext("HEAD", "/x")).isPassed());
    assertTrue(gates.verifyCsrf().check(new TestRequestContext("OPTIONS", "/x")).isPassed());
  }

  @Test
  void testVerifyCsrf_StateChangingMethods() {
    assertEquals(
        ErrorCode.CSRF_TOKEN_MISSING,
        failureCode(gates.verifyCsrf().check(TestRequestContext.post("/x"))));

    String token = csrf.issue("s1");
    assertTrue(
        gates.verifyCsrf()
            .check(
                TestRequestContext.post("/x")
                    .withHeader("X-CSRF-Token", token)
                    .withHeader("X-Session-Id", "s1"))
            .isPassed());
    assertEquals(
        ErrorCode.CSRF_TOKEN_INVALID,
        failureCode(
            gates.verifyCsrf()
                .check(
                    new TestRequestContext("DELETE", "/x")
                        .withHeader("X-CSRF-Token", token)
                        .withHeader("X-Session-Id", "s2"))));
  }

  @Test
  void testVerifyCsrf_DefaultsToAnonymousSession() {
    String token = csrf.issue(CsrfGuard.ANONYMOUS_SESSION);

    assertTrue(
        gates.verifyCsrf()
            .check(new TestRequestContext("PUT", "/x").withHeader("x-csrf-token", token))
            .isPassed());
    assertEquals(
        CsrfGuard.ANONYMOUS_SESSION, AuthorizationGates.sessionId(TestRequestContext.post("/x")));
  }

  @Test
  void testPipeline_AuthenticationBeforeAuthorization() {
    GatePipeline pipeline =
        GatePipeline.of(gates.requireAdmin(), gates.authenticate(), gates.verifyCsrf());

    GateResult result = pipeline.run(TestRequestContext.get("/x"));

    assertEquals(ErrorCode.MISSING_TOKEN, failureCode(result));
  }
}
