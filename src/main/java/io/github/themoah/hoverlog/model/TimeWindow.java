package io.github.themoah.hoverlog.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open time interval {@code [start, end)}. Start must be strictly before end.
 *
 * @param start inclusive start
 * @param end exclusive end
 */
public record TimeWindow(Instant start, Instant end) {

  public TimeWindow {
    if (start == null || end == null) {
      throw new ValidationException(
        ValidationException.Category.MISSING_FIELD,
        "Missing required field: " + (start == null ? "start_time" : "end_time")
      );
    }
    if (!start.isBefore(end)) {
      throw new ValidationException(
        ValidationException.Category.INVALID_TIME_RANGE,
        "Start time must be before end time"
      );
    }
  }

  public Duration duration() {
    return Duration.between(start, end);
  }
}
