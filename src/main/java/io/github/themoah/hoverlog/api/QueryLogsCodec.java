package io.github.themoah.hoverlog.api;

import io.github.themoah.hoverlog.model.AnalysisResult;
import io.github.themoah.hoverlog.model.LogGroup;
import io.github.themoah.hoverlog.model.ValidationException;
import io.github.themoah.hoverlog.service.LogQueryRequest;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * JSON mapping of the {@code /query_logs} request and response.
 *
 * <p>Template IDs and KL contributions stay internal; only the example lines and the
 * relative change are returned.
 */
public final class QueryLogsCodec {

  private QueryLogsCodec() {}

  /**
   * Decodes the request body. Only the shape is checked here; field presence and the
   * time range are validated by the service.
   *
   * @param body request JSON, may be null
   * @return the raw request
   * @throws ValidationException with {@code MALFORMED_REQUEST} if the body cannot be read
   */
  public static LogQueryRequest decodeRequest(JsonObject body) {
    if (body == null) {
      throw malformed("Request body must be a JSON object");
    }
    return new LogQueryRequest(
      stringField(body, "org"),
      stringField(body, "dashboard"),
      stringField(body, "panel_title"),
      stringField(body, "metric_name"),
      timestampField(body, "start_time"),
      timestampField(body, "end_time")
    );
  }

  public static JsonObject encodeResult(AnalysisResult result) {
    JsonArray groups = new JsonArray();
    for (LogGroup group : result.logGroups()) {
      groups.add(new JsonObject()
        .put("representative_logs", new JsonArray(group.representativeLogs()))
        .put("relative_change", group.relativeChange()));
    }
    return new JsonObject().put("log_groups", groups);
  }

  private static String stringField(JsonObject body, String name) {
    Object value = body.getValue(name);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String text)) {
      throw malformed("Field " + name + " must be a string");
    }
    return text;
  }

  private static Instant timestampField(JsonObject body, String name) {
    String text = stringField(body, name);
    if (text == null || text.isBlank()) {
      return null;
    }
    try {
      return OffsetDateTime.parse(text).toInstant();
    } catch (DateTimeParseException e) {
      throw malformed("Field " + name + " must be an RFC 3339 timestamp: " + text);
    }
  }

  private static ValidationException malformed(String message) {
    return new ValidationException(ValidationException.Category.MALFORMED_REQUEST, message);
  }
}
