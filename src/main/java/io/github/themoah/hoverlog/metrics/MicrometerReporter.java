package io.github.themoah.hoverlog.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports metrics using Micrometer MeterRegistry.
 * Works with any Micrometer-supported backend (Datadog, Prometheus, etc).
 */
public class MicrometerReporter implements MetricsReporter {

  private static final Logger log = LoggerFactory.getLogger(MicrometerReporter.class);

  static final String REQUESTS = "hoverlog.analysis.requests";
  static final String DURATION = "hoverlog.analysis.duration";
  static final String LOG_GROUPS = "hoverlog.analysis.log_groups";

  private final MeterRegistry registry;
  private final DistributionSummary logGroupsSummary;

  public MicrometerReporter(MeterRegistry registry) {
    this.registry = registry;
    this.logGroupsSummary = DistributionSummary.builder(LOG_GROUPS)
      .description("Log groups returned per query")
      .register(registry);
  }

  @Override
  public void recordAnalysis(AnalysisOutcome outcome, Duration duration, int logGroups) {
    String tag = outcome.toMetricValue();
    log.debug("Recording analysis outcome={}, duration={}ms, logGroups={}", tag, duration.toMillis(), logGroups);

    Counter.builder(REQUESTS)
      .description("Log queries by outcome")
      .tag("outcome", tag)
      .register(registry)
      .increment();
    Timer.builder(DURATION)
      .description("Log query latency by outcome")
      .tag("outcome", tag)
      .register(registry)
      .record(duration);
    logGroupsSummary.record(logGroups);
  }
}
