package io.github.themoah.hoverlog.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MicrometerConfig.
 */
public class MicrometerConfigTest {

  private static Function<String, String> env(Map<String, String> values) {
    return values::get;
  }

  @Test
  void prometheusRegistry_carriesServiceTag() {
    MeterRegistry registry = MicrometerConfig.createRegistry("Prometheus");

    assertInstanceOf(PrometheusMeterRegistry.class, registry);
    registry.counter("sample.counter").increment();
    assertEquals("hoverlog", registry.get("sample.counter").counter().getId().getTag("service"));
    registry.close();
  }

  @Test
  void unknownReporter_noRegistry() {
    assertNull(MicrometerConfig.createRegistry("statsd"));
    assertNull(MicrometerConfig.createRegistry(null));
  }

  @Test
  void otlpUrl_resolution() {
    assertEquals("http://localhost:4318/v1/metrics", MicrometerConfig.otlpUrl(env(Map.of())));
    assertEquals("http://collector:4318/v1/metrics",
      MicrometerConfig.otlpUrl(env(Map.of("OTEL_EXPORTER_OTLP_ENDPOINT", "http://collector:4318"))));
    assertEquals("http://metrics:9999/ingest", MicrometerConfig.otlpUrl(env(Map.of(
      "OTEL_EXPORTER_OTLP_ENDPOINT", "http://collector:4318",
      "OTEL_EXPORTER_OTLP_METRICS_ENDPOINT", "http://metrics:9999/ingest"))));
  }

  @Test
  void otlpStep_invalidFallsBackToDefault() {
    assertEquals(Duration.ofSeconds(60), MicrometerConfig.otlpStep(env(Map.of())));
    assertEquals(Duration.ofMillis(15000),
      MicrometerConfig.otlpStep(env(Map.of("OTEL_METRIC_EXPORT_INTERVAL", "15000"))));
    assertEquals(Duration.ofSeconds(60),
      MicrometerConfig.otlpStep(env(Map.of("OTEL_METRIC_EXPORT_INTERVAL", "soon"))));
  }

  @Test
  void parseKeyValues_skipsMalformedPairs() {
    Map<String, String> parsed = MicrometerConfig.parseKeyValues("env=prod, team = logs ,broken,=x");

    assertEquals(Map.of("env", "prod", "team", "logs"), parsed);
    assertTrue(MicrometerConfig.parseKeyValues(null).isEmpty());
  }
}
