package io.github.themoah.hoverlog.analyzer;

import io.github.themoah.hoverlog.model.TimeWindow;
import java.time.Duration;
import java.time.Instant;

/**
 * Derives the baseline window for a requested window.
 * The baseline has the same duration and ends exactly where the current window starts.
 */
public final class WindowPlanner {

  public TimeWindow plan(TimeWindow current) {
    Duration duration = current.duration();
    Instant baselineEnd = current.start();
    return new TimeWindow(baselineEnd.minus(duration), baselineEnd);
  }
}
