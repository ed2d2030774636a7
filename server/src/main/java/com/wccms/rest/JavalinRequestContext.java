package com.wccms.rest;

import com.wccms.security.IdentityClaim;
import com.wccms.security.gate.RequestContext;
import io.javalin.http.Context;
import java.util.Optional;
import javax.annotation.Nullable;

/** {@link RequestContext} over a Javalin request. The identity lives in a request attribute. */
public class JavalinRequestContext implements RequestContext {

  static final String IDENTITY_ATTRIBUTE = "wccms.identity";

  private final Context ctx;

  public JavalinRequestContext(Context ctx) {
    this.ctx = ctx;
  }

  /** Returns the identity the authentication gate attached to this request, if any. */
  public static Optional<IdentityClaim> identityOf(Context ctx) {
    return Optional.ofNullable(ctx.attribute(IDENTITY_ATTRIBUTE));
  }

  @Override
  public String method() {
    return ctx.method().name();
  }

  @Override
  public String path() {
    return ctx.path();
  }

  @Nullable
  @Override
  public String header(String name) {
    return ctx.header(name);
  }

  @Nullable
  @Override
  public String pathParam(String name) {
    return ctx.pathParamMap().get(name);
  }

  @Override
  public Optional<IdentityClaim> identity() {
    return identityOf(ctx);
  }

  @Override
  public void setIdentity(IdentityClaim claim) {
    ctx.attribute(IDENTITY_ATTRIBUTE, claim);
  }
}
