package com.wccms.rest;

import com.wccms.common.status.Status;
import com.wccms.common.status.StatusCode;
import com.wccms.common.status.StatusOr;
import com.wccms.rest.dto.ErrorResponse;
import com.wccms.security.IdentityClaim;
import io.javalin.http.Context;
import java.time.Instant;
import java.util.Map;
import org.tinylog.Logger;

/**
 * Base interface for REST adapters.
 *
 * <p>Adapters declare their routes with the Javalin {@code ApiBuilder} statics from {@link
 * #registerRoutes()}, which {@link RestAdapterFactory} calls inside the router's API builder.
 */
public interface RestAdapter {

  /**
   * Writes the failure envelope.
   *
   * @param ctx The Javalin context to set the error on
   * @param statusCode The HTTP status code to set
   * @param code The stable error code
   * @param message The error message to include in the response
   * @param details Extra structured data, may be null
   */
  default void setError(
      Context ctx, int statusCode, String code, String message, Map<String, Object> details) {
    ctx.status(statusCode).json(ErrorResponse.of(code, message, Instant.now(), details));
    if (statusCode >= 500) {
      Logger.error("Error response: {} {} - {}", statusCode, code, message);
    } else {
      Logger.info("Error response: {} {} - {}", statusCode, code, message);
    }
  }

  default void setError(Context ctx, int statusCode, String code, String message) {
    setError(ctx, statusCode, code, message, null);
  }

  /** Writes a failed status using its HTTP mapping and reason. */
  default void setError(Context ctx, Status status) {
    String message = status.getMessage();
    if (status.getHttpCode() >= 500) {
      // Do not leak store internals.
      message = "Internal server error";
    }
    setError(ctx, status.getHttpCode(), status.getReason(), message);
  }

  /**
   * Parses the request body.
   *
   * @return the parsed body, or INVALID_ARGUMENT for a missing or malformed one
   */
  default <T> StatusOr<T> parseBody(Context ctx, Class<T> type) {
    try {
      T body = ctx.bodyAsClass(type);
      if (body == null) {
        return StatusOr.ofStatus(
            Status.withReason(
                StatusCode.INVALID_ARGUMENT, "INVALID_REQUEST", "Request body is required"));
      }
      return StatusOr.ofValue(body);
    } catch (Exception e) {
      Logger.info("Unparseable {} body: {}", type.getSimpleName(), e.getMessage());
      return StatusOr.ofStatus(
          Status.withReason(
              StatusCode.INVALID_ARGUMENT, "INVALID_REQUEST", "Request body is malformed"));
    }
  }

  /**
   * Returns the identity attached by the authentication gate. Only valid on routes gated with
   * authentication.
   *
   * @throws IllegalStateException if the route was registered without authentication
   */
  default IdentityClaim identity(Context ctx) {
    return JavalinRequestContext.identityOf(ctx)
        .orElseThrow(() -> new IllegalStateException("Route is not authenticated: " + ctx.path()));
  }

  /** Registers the REST endpoints handled by this adapter. */
  void registerRoutes();
}
