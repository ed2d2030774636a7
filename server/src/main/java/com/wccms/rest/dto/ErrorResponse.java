package com.wccms.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wccms.security.gate.GateFailure;
import java.time.Instant;
import java.util.Map;

/**
 * Failure envelope: {@code {"success": false, "error": {"code", "message", "timestamp"}}}.
 */
public record ErrorResponse(boolean success, ErrorBody error) {

  /**
   * @param timestamp ISO-8601 instant
   * @param details extra structured information, omitted when null
   */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ErrorBody(
      String code, String message, String timestamp, Map<String, Object> details) {}

  public static ErrorResponse of(GateFailure failure) {
    return new ErrorResponse(
        false,
        new ErrorBody(
            failure.code().name(), failure.message(), failure.timestamp().toString(), null));
  }

  public static ErrorResponse of(
      String code, String message, Instant timestamp, Map<String, Object> details) {
    return new ErrorResponse(
        false, new ErrorBody(code, message, timestamp.toString(), details));
  }
}
