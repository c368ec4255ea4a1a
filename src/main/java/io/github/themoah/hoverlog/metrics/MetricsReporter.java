package io.github.themoah.hoverlog.metrics;

import java.time.Duration;

/**
 * Interface for reporting log query metrics to external systems.
 */
public interface MetricsReporter {

  /**
   * Records a finished log query.
   *
   * @param outcome how the query ended
   * @param duration wall-clock time spent on the query
   * @param logGroups number of log groups returned
   */
  void recordAnalysis(AnalysisOutcome outcome, Duration duration, int logGroups);

  /**
   * Reporter that drops everything, used when metrics are disabled.
   */
  static MetricsReporter noop() {
    return (outcome, duration, logGroups) -> { };
  }
}
