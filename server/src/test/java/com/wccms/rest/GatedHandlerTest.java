package com.wccms.rest;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.wccms.rest.dto.ErrorResponse;
import com.wccms.security.IdentityClaim;
import com.wccms.security.Role;
import com.wccms.security.TokenService;
import com.wccms.security.TokenUse;
import com.wccms.security.gate.ErrorCode;
import com.wccms.security.gate.Gate;
import com.wccms.security.gate.GateFailure;
import com.wccms.security.gate.GatePipeline;
import com.wccms.security.gate.GateResult;
import com.wccms.security.gate.Stage;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.javalin.http.HandlerType;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class GatedHandlerTest {

  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

  private Context ctx;
  private Handler delegate;

  @BeforeEach
  void setUp() {
    ctx = mock(Context.class);
    delegate = mock(Handler.class);
    when(ctx.method()).thenReturn(HandlerType.POST);
    when(ctx.path()).thenReturn("/v1/folders/f1/parent");
    when(ctx.status(anyInt())).thenReturn(ctx);
  }

  @Test
  void testHandle_FailingGateWritesEnvelopeAndSkipsHandler() throws Exception {
    // Given
    Gate deny =
        Gate.of(
            Stage.CSRF,
            "deny",
            c ->
                GateResult.fail(
                    new GateFailure(ErrorCode.CSRF_TOKEN_MISSING, "CSRF token missing", NOW)));
    GatedHandler handler = new GatedHandler(GatePipeline.of(deny), delegate);

    // When
    handler.handle(ctx);

    // Then
    verify(ctx).status(403);
    ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
    verify(ctx).json(body.capture());
    ErrorResponse response = (ErrorResponse) body.getValue();
    assertFalse(response.success());
    assertEquals("CSRF_TOKEN_MISSING", response.error().code());
    assertEquals("CSRF token missing", response.error().message());
    assertEquals("2024-03-01T10:00:00Z", response.error().timestamp());
    verifyNoInteractions(delegate);
  }

  @Test
  void testHandle_PassingPipelineRunsHandler() throws Exception {
    GatedHandler handler = new GatedHandler(GatePipeline.empty(), delegate);

    handler.handle(ctx);

    verify(delegate).handle(ctx);
    verify(ctx, never()).status(anyInt());
  }

  @Test
  void testRequestContext_ReadsRequestAndStoresIdentity() {
    when(ctx.header("X-Session-Id")).thenReturn("s1");
    when(ctx.pathParamMap()).thenReturn(Map.of("id", "f1"));
    IdentityClaim claim =
        new IdentityClaim(
            "u1", "alice", Role.EDITOR, NOW, NOW.plusSeconds(60), TokenService.ISSUER,
            TokenUse.ACCESS);

    JavalinRequestContext requestContext = new JavalinRequestContext(ctx);
    requestContext.setIdentity(claim);

    assertEquals("POST", requestContext.method());
    assertEquals("/v1/folders/f1/parent", requestContext.path());
    assertEquals("s1", requestContext.header("X-Session-Id"));
    assertEquals("f1", requestContext.pathParam("id"));
    assertNull(requestContext.pathParam("other"));
    verify(ctx).attribute(eq(JavalinRequestContext.IDENTITY_ATTRIBUTE), any());
  }
}
