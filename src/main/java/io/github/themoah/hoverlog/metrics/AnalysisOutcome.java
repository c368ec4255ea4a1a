package io.github.themoah.hoverlog.metrics;

import io.github.themoah.hoverlog.resilience.FallbackCategory;

/**
 * Outcome of one log query, used as a metric tag.
 */
public enum AnalysisOutcome {
  SUCCESS,
  DEGRADED_CONNECTIVITY,
  DEGRADED_SCHEMA_MISSING,
  DEGRADED_UNCLASSIFIED,
  CANCELLED,
  REJECTED;

  public static AnalysisOutcome degraded(FallbackCategory category) {
    return switch (category) {
      case CONNECTIVITY -> DEGRADED_CONNECTIVITY;
      case SCHEMA_MISSING -> DEGRADED_SCHEMA_MISSING;
      case UNCLASSIFIED -> DEGRADED_UNCLASSIFIED;
    };
  }

  public String toMetricValue() {
    return name().toLowerCase();
  }
}
