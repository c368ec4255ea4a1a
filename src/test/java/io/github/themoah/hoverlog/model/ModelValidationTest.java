package io.github.themoah.hoverlog.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the model records and their validation.
 */
public class ModelValidationTest {

  private static final Instant T0 = Instant.parse("2026-10-19T10:00:00Z");

  @Test
  void timeWindow_startEqualsEnd_rejected() {
    ValidationException e = assertThrows(ValidationException.class, () -> new TimeWindow(T0, T0));

    assertEquals(ValidationException.Category.INVALID_TIME_RANGE, e.getCategory());
    assertEquals("Start time must be before end time", e.getMessage());
    assertEquals("Invalid time range", e.getCategory().getTitle());
  }

  @Test
  void timeWindow_reversed_rejected() {
    ValidationException e = assertThrows(ValidationException.class,
      () -> new TimeWindow(T0, T0.minusSeconds(1)));

    assertEquals(ValidationException.Category.INVALID_TIME_RANGE, e.getCategory());
  }

  @Test
  void timeWindow_missingBound_rejected() {
    ValidationException e = assertThrows(ValidationException.class, () -> new TimeWindow(null, T0));

    assertEquals(ValidationException.Category.MISSING_FIELD, e.getCategory());
    assertEquals("Missing required field: start_time", e.getMessage());
  }

  @Test
  void timeWindow_duration() {
    assertEquals(Duration.ofMinutes(15), new TimeWindow(T0, T0.plusSeconds(900)).duration());
  }

  @Test
  void identity_emptyField_rejected() {
    ValidationException e = assertThrows(ValidationException.class,
      () -> new Identity("acme", "checkout", "", "latency"));

    assertEquals(ValidationException.Category.MISSING_FIELD, e.getCategory());
    assertEquals("Missing required field: panel_title", e.getMessage());
    assertEquals("missing_field", e.getCategory().getValue());
  }

  @Test
  void identity_whitespaceValueIsPresent() {
    Identity identity = new Identity("acme", " ", "Latency p99", "http_latency");

    assertEquals(" ", identity.dashboard());
  }

  @Test
  void identity_nullField_rejected() {
    ValidationException e = assertThrows(ValidationException.class,
      () -> new Identity(null, "checkout", "Latency p99", "http_latency"));

    assertEquals("Missing required field: org", e.getMessage());
  }

  @Test
  void templateCounts_nullCountTreatedAsZero() {
    Map<String, Long> raw = new HashMap<>();
    raw.put("a", 5L);
    raw.put("b", null);

    TemplateCounts counts = TemplateCounts.of(raw);

    assertEquals(5L, counts.total());
    assertEquals(0L, counts.count("b"));
    assertEquals(0L, counts.count("missing"));
  }

  @Test
  void templateCounts_negativeRejected() {
    assertThrows(IllegalArgumentException.class, () -> TemplateCounts.of(Map.of("a", -1L)));
  }

  @Test
  void templateCounts_copiesInputMap() {
    Map<String, Long> raw = new HashMap<>(Map.of("a", 1L));
    TemplateCounts counts = TemplateCounts.of(raw);

    raw.put("b", 10L);

    assertEquals(1, counts.size());
    assertEquals(1L, counts.total());
  }

  @Test
  void logGroup_placeholderIds() {
    assertTrue(new LogGroup("error", List.of("x"), 0.0, 0.0).isPlaceholder());
    assertTrue(new LogGroup("mock_info_template", List.of("x"), 0.0, 0.0).isPlaceholder());
    assertFalse(new LogGroup("tmpl-42", List.of("x"), 0.0, 0.0).isPlaceholder());
  }

  @Test
  void analysisResult_degradedOnlyWhenAllPlaceholders() {
    LogGroup real = new LogGroup("tmpl-1", List.of("x"), 1.0, 0.1);
    LogGroup mock = new LogGroup("mock_error_template", List.of("x"), 1.0, 0.1);

    assertFalse(AnalysisResult.empty().isDegraded());
    assertFalse(new AnalysisResult(List.of(real, mock)).isDegraded());
    assertTrue(new AnalysisResult(List.of(mock)).isDegraded());
  }
}
