package io.github.themoah.hoverlog.metrics;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.datadog.DatadogConfig;
import io.micrometer.datadog.DatadogMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.registry.otlp.AggregationTemporality;
import io.micrometer.registry.otlp.OtlpConfig;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating Micrometer registries. Every registry carries a
 * {@code service=hoverlog} common tag.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  static final String SERVICE_NAME = "hoverlog";
  private static final String DEFAULT_OTLP_URL = "http://localhost:4318/v1/metrics";
  private static final Duration DEFAULT_STEP = Duration.ofSeconds(60);

  private MicrometerConfig() {}

  /**
   * Creates a Datadog meter registry configured from DD_API_KEY, DD_APP_KEY and DD_SITE.
   */
  public static MeterRegistry createDatadogRegistry() {
    log.info("Creating Datadog meter registry");

    DatadogConfig config = new DatadogConfig() {
      @Override
      public String apiKey() {
        return System.getenv("DD_API_KEY");
      }

      @Override
      public String applicationKey() {
        return System.getenv("DD_APP_KEY");
      }

      @Override
      public String uri() {
        return "https://api." + System.getenv().getOrDefault("DD_SITE", "datadoghq.com");
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    return new DatadogMeterRegistry(config, Clock.SYSTEM);
  }

  public static PrometheusMeterRegistry createPrometheusRegistry() {
    log.info("Creating Prometheus meter registry");
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  /**
   * Creates an OTLP meter registry (HTTP, cumulative temporality) configured from the
   * standard OTEL_* environment variables.
   */
  public static MeterRegistry createOtlpRegistry() {
    log.info("Creating OTLP meter registry");
    Function<String, String> env = System::getenv;

    OtlpConfig config = new OtlpConfig() {
      @Override
      public String url() {
        return otlpUrl(env);
      }

      @Override
      public AggregationTemporality aggregationTemporality() {
        return AggregationTemporality.CUMULATIVE;
      }

      @Override
      public Duration step() {
        return otlpStep(env);
      }

      @Override
      public Map<String, String> headers() {
        return parseKeyValues(firstNonBlank(env,
          "OTEL_EXPORTER_OTLP_METRICS_HEADERS", "OTEL_EXPORTER_OTLP_HEADERS"));
      }

      @Override
      public Map<String, String> resourceAttributes() {
        Map<String, String> attributes = new HashMap<>(parseKeyValues(env.apply("OTEL_RESOURCE_ATTRIBUTES")));
        String serviceName = env.apply("OTEL_SERVICE_NAME");
        attributes.put("service.name",
          (serviceName != null && !serviceName.isBlank()) ? serviceName : SERVICE_NAME);
        return attributes;
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    OtlpMeterRegistry registry = new OtlpMeterRegistry(config, Clock.SYSTEM);
    log.info("OTLP registry created - endpoint: {}", config.url());
    return registry;
  }

  /**
   * Creates a meter registry based on the reporter type.
   *
   * @param reporterType the type of reporter ("datadog", "prometheus", "otlp")
   * @return the configured MeterRegistry, or null if type is unknown
   */
  public static MeterRegistry createRegistry(String reporterType) {
    if (reporterType == null) {
      return null;
    }

    MeterRegistry registry = switch (reporterType.toLowerCase()) {
      case "datadog" -> createDatadogRegistry();
      case "prometheus" -> createPrometheusRegistry();
      case "otlp" -> createOtlpRegistry();
      default -> {
        log.warn("Unknown reporter type: {}", reporterType);
        yield null;
      }
    };
    if (registry != null) {
      registry.config().commonTags("service", SERVICE_NAME);
    }
    return registry;
  }

  /**
   * Binds JVM metrics (memory, GC, threads, CPU) to the given registry.
   */
  public static void bindJvmMetrics(MeterRegistry registry) {
    log.info("Binding JVM metrics to registry");
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
  }

  static String otlpUrl(Function<String, String> env) {
    String url = env.apply("OTEL_EXPORTER_OTLP_METRICS_ENDPOINT");
    if (url != null && !url.isBlank()) {
      return url;
    }
    String base = env.apply("OTEL_EXPORTER_OTLP_ENDPOINT");
    if (base != null && !base.isBlank()) {
      return base.endsWith("/v1/metrics") ? base : base + "/v1/metrics";
    }
    return DEFAULT_OTLP_URL;
  }

  static Duration otlpStep(Function<String, String> env) {
    String interval = env.apply("OTEL_METRIC_EXPORT_INTERVAL");
    if (interval == null || interval.isBlank()) {
      return DEFAULT_STEP;
    }
    try {
      return Duration.ofMillis(Long.parseLong(interval.trim()));
    } catch (NumberFormatException e) {
      log.warn("Invalid OTEL_METRIC_EXPORT_INTERVAL: {}, using default {}", interval, DEFAULT_STEP);
      return DEFAULT_STEP;
    }
  }

  /**
   * Parses {@code key1=value1,key2=value2}. Malformed pairs are skipped with a warning.
   */
  static Map<String, String> parseKeyValues(String raw) {
    Map<String, String> result = new HashMap<>();
    if (raw == null || raw.isBlank()) {
      return result;
    }
    for (String pair : raw.split(",")) {
      String[] parts = pair.trim().split("=", 2);
      if (parts.length == 2 && !parts[0].isBlank()) {
        result.put(parts[0].trim(), parts[1].trim());
      } else {
        log.warn("Invalid key=value pair: {}", pair);
      }
    }
    return result;
  }

  private static String firstNonBlank(Function<String, String> env, String... names) {
    for (String name : names) {
      String value = env.apply(name);
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }
}
