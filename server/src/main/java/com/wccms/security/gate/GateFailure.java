package com.wccms.security.gate;

import java.time.Instant;

/**
 * Why a gate stopped a request.
 *
 * @param code the failure code, which fixes the HTTP status
 * @param message a caller-facing message that never names other users or policy internals
 * @param timestamp when the failure was decided
 */
public record GateFailure(ErrorCode code, String message, Instant timestamp) {

  public int httpStatus() {
    return code.getHttpStatus();
  }
}
