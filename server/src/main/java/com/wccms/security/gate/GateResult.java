package com.wccms.security.gate;

import java.util.Objects;
import java.util.Optional;

/** Either a pass or a {@link GateFailure}. */
public final class GateResult {
  private static final GateResult PASS = new GateResult(null);

  private final GateFailure failure;

  private GateResult(GateFailure failure) {
    this.failure = failure;
  }

  public static GateResult pass() {
    return PASS;
  }

  public static GateResult fail(GateFailure failure) {
    return new GateResult(Objects.requireNonNull(failure));
  }

  public boolean isPassed() {
    return failure == null;
  }

  public Optional<GateFailure> failure() {
    return Optional.ofNullable(failure);
  }

  @Override
  public String toString() {
    return failure == null ? "GateResult{pass}" : "GateResult{" + failure + "}";
  }
}
