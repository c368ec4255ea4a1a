package io.github.themoah.hoverlog.analyzer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.hoverlog.model.TimeWindow;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for WindowPlanner.
 */
public class WindowPlannerTest {

  private final WindowPlanner planner = new WindowPlanner();

  @Test
  void baselineEndsWhereCurrentStarts() {
    Instant start = Instant.parse("2026-10-19T10:00:00Z");
    TimeWindow current = new TimeWindow(start, start.plus(Duration.ofHours(1)));

    TimeWindow baseline = planner.plan(current);

    assertEquals(start, baseline.end());
    assertEquals(Instant.parse("2026-10-19T09:00:00Z"), baseline.start());
  }

  @Test
  void baselineHasSameDuration() {
    Instant start = Instant.parse("2026-10-19T10:00:00.250Z");
    TimeWindow current = new TimeWindow(start, start.plusMillis(1_337));

    TimeWindow baseline = planner.plan(current);

    assertEquals(current.duration(), baseline.duration());
    assertTrue(baseline.start().isBefore(current.start()));
  }

  @Test
  void oneNanosecondWindow() {
    Instant start = Instant.parse("2026-01-01T00:00:00Z");
    TimeWindow current = new TimeWindow(start, start.plusNanos(1));

    TimeWindow baseline = planner.plan(current);

    assertEquals(start.minusNanos(1), baseline.start());
    assertEquals(start, baseline.end());
  }
}
