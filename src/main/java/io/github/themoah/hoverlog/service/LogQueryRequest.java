package io.github.themoah.hoverlog.service;

import io.github.themoah.hoverlog.model.Identity;
import io.github.themoah.hoverlog.model.TimeWindow;
import java.time.Instant;

/**
 * Raw, not yet validated log query parameters.
 *
 * @param org organization name
 * @param dashboard dashboard name
 * @param panelTitle panel title
 * @param metricName metric name
 * @param startTime inclusive window start
 * @param endTime exclusive window end
 */
public record LogQueryRequest(
  String org,
  String dashboard,
  String panelTitle,
  String metricName,
  Instant startTime,
  Instant endTime
) {

  /**
   * @throws io.github.themoah.hoverlog.model.ValidationException if a field is missing
   */
  public Identity identity() {
    return new Identity(org, dashboard, panelTitle, metricName);
  }

  /**
   * @throws io.github.themoah.hoverlog.model.ValidationException if a bound is missing or start is not before end
   */
  public TimeWindow window() {
    return new TimeWindow(startTime, endTime);
  }
}
