package com.wccms.security.gate;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.tinylog.Logger;

/**
 * An ordered chain of gates. Gates are sorted by {@link Stage}, keeping declaration order within a
 * stage, and the first failure ends the run.
 */
public final class GatePipeline {

  private static final GatePipeline EMPTY = new GatePipeline(ImmutableList.of());

  private final ImmutableList<Gate> gates;

  private GatePipeline(ImmutableList<Gate> gates) {
    this.gates = gates;
  }

  public static GatePipeline empty() {
    return EMPTY;
  }

  public static GatePipeline of(Gate... gates) {
    return of(List.of(gates));
  }

  public static GatePipeline of(List<Gate> gates) {
    List<Gate> sorted = new ArrayList<>(gates);
    sorted.sort(Comparator.comparing(Gate::stage));
    return new GatePipeline(ImmutableList.copyOf(sorted));
  }

  public ImmutableList<Gate> gates() {
    return gates;
  }

  public GateResult run(RequestContext ctx) {
    for (Gate gate : gates) {
      GateResult result = gate.check(ctx);
      Optional<GateFailure> failure = result.failure();
      if (failure.isPresent()) {
        Logger.warn(
            "{} {} stopped at {}: {}",
            ctx.method(),
            ctx.path(),
            gate.name(),
            failure.get().code());
        return result;
      }
    }
    return GateResult.pass();
  }
}
