package io.github.themoah.hoverlog.config;

import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tuning of the anomaly scoring.
 *
 * @param smoothing additive smoothing constant, strictly positive (default 1e-10)
 * @param topK number of templates kept after ranking (default 10)
 */
public record AnalysisConfig(double smoothing, int topK) {

  private static final Logger log = LoggerFactory.getLogger(AnalysisConfig.class);

  public static final double DEFAULT_SMOOTHING = 1e-10;
  public static final int DEFAULT_TOP_K = 10;

  public AnalysisConfig {
    if (!(smoothing > 0.0) || Double.isInfinite(smoothing)) {
      throw new IllegalArgumentException("smoothing must be a positive finite value, got " + smoothing);
    }
    if (topK <= 0) {
      throw new IllegalArgumentException("topK must be positive, got " + topK);
    }
  }

  public static AnalysisConfig defaults() {
    return new AnalysisConfig(DEFAULT_SMOOTHING, DEFAULT_TOP_K);
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>ANALYSIS_SMOOTHING - additive smoothing constant (default: 1e-10)</li>
   *   <li>ANALYSIS_TOP_K - templates returned per query (default: 10)</li>
   * </ul>
   */
  public static AnalysisConfig fromEnvironment() {
    return fromLookup(System::getenv);
  }

  static AnalysisConfig fromLookup(Function<String, String> env) {
    double smoothing = parseDouble(env, "ANALYSIS_SMOOTHING", DEFAULT_SMOOTHING);
    int topK = parseInt(env, "ANALYSIS_TOP_K", DEFAULT_TOP_K);

    if (!(smoothing > 0.0) || Double.isInfinite(smoothing)) {
      log.warn("ANALYSIS_SMOOTHING must be positive and finite, using default: {}", DEFAULT_SMOOTHING);
      smoothing = DEFAULT_SMOOTHING;
    }
    if (topK <= 0) {
      log.warn("ANALYSIS_TOP_K must be positive, using default: {}", DEFAULT_TOP_K);
      topK = DEFAULT_TOP_K;
    }

    log.info("Analysis config: smoothing={}, topK={}", smoothing, topK);
    return new AnalysisConfig(smoothing, topK);
  }

  private static double parseDouble(Function<String, String> env, String name, double defaultValue) {
    String value = env.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }

  private static int parseInt(Function<String, String> env, String name, int defaultValue) {
    String value = env.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }
}
