package io.github.themoah.hoverlog.api;

import io.github.themoah.hoverlog.model.ValidationException;
import io.vertx.core.json.JsonObject;

/**
 * Error body returned by the HTTP API.
 *
 * @param error short error title
 * @param message human readable detail
 * @param code HTTP status code (omitted when null)
 * @param category machine-checkable category (omitted when null)
 */
public record ErrorResponse(
  String error,
  String message,
  Integer code,
  String category
) {

  static final String CANCELLED_CATEGORY = "cancelled";

  public static ErrorResponse validation(ValidationException e) {
    return new ErrorResponse(e.getCategory().getTitle(), e.getMessage(), 400, e.getCategory().getValue());
  }

  public static ErrorResponse cancelled(String message) {
    return new ErrorResponse("Request cancelled", message, 504, CANCELLED_CATEGORY);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("error", error)
      .put("message", message);
    if (code != null) {
      json.put("code", code);
    }
    if (category != null) {
      json.put("category", category);
    }
    return json;
  }
}
