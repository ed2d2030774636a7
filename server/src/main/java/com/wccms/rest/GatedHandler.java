package com.wccms.rest;

import com.wccms.rest.dto.ErrorResponse;
import com.wccms.security.gate.GateFailure;
import com.wccms.security.gate.GatePipeline;
import com.wccms.security.gate.GateResult;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.util.Optional;

/**
 * Runs a {@link GatePipeline} before a handler. A failing gate ends the request with the failure
 * envelope and the status its code maps to; the handler never runs.
 */
public class GatedHandler implements Handler {

  private final GatePipeline pipeline;
  private final Handler delegate;

  public GatedHandler(GatePipeline pipeline, Handler delegate) {
    this.pipeline = pipeline;
    this.delegate = delegate;
  }

  @Override
  public void handle(Context ctx) throws Exception {
    GateResult result = pipeline.run(new JavalinRequestContext(ctx));
    Optional<GateFailure> failure = result.failure();
    if (failure.isPresent()) {
      ctx.status(failure.get().httpStatus()).json(ErrorResponse.of(failure.get()));
      return;
    }
    delegate.handle(ctx);
  }
}
