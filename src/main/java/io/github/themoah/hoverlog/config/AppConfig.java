package io.github.themoah.hoverlog.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration loaded from environment variables.
 *
 * @param httpHost HTTP server bind address
 * @param httpPort HTTP server port
 * @param requestTimeoutMs deadline for a single analysis request in milliseconds
 * @param healthCheckIntervalMs store health check interval in milliseconds
 * @param schemaAutoProvision whether missing tables are created at startup
 */
public record AppConfig(
  String httpHost,
  int httpPort,
  long requestTimeoutMs,
  long healthCheckIntervalMs,
  boolean schemaAutoProvision
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final String DEFAULT_HTTP_HOST = "127.0.0.1";
  private static final int DEFAULT_HTTP_PORT = 8080;
  private static final long DEFAULT_REQUEST_TIMEOUT_MS = 30_000L;
  private static final long DEFAULT_HEALTH_CHECK_INTERVAL_MS = 30_000L;
  private static final boolean DEFAULT_SCHEMA_AUTO_PROVISION = true;

  /**
   * Loads configuration from environment variables with defaults.
   *
   * @return AppConfig instance
   */
  public static AppConfig fromEnvironment() {
    String host = getEnvString("HTTP_HOST", DEFAULT_HTTP_HOST);
    int port = getEnvInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    long requestTimeout = getEnvLong("REQUEST_TIMEOUT_MS", DEFAULT_REQUEST_TIMEOUT_MS);
    long interval = getEnvLong("STORE_HEALTH_CHECK_INTERVAL_MS", DEFAULT_HEALTH_CHECK_INTERVAL_MS);
    boolean provision = getEnvBoolean("SCHEMA_AUTO_PROVISION", DEFAULT_SCHEMA_AUTO_PROVISION);

    if (requestTimeout <= 0) {
      log.warn("REQUEST_TIMEOUT_MS must be positive, using default: {}", DEFAULT_REQUEST_TIMEOUT_MS);
      requestTimeout = DEFAULT_REQUEST_TIMEOUT_MS;
    }

    log.info("AppConfig loaded: httpHost={}, httpPort={}, requestTimeoutMs={}, healthCheckIntervalMs={}, schemaAutoProvision={}",
      host, port, requestTimeout, interval, provision);
    return new AppConfig(host, port, requestTimeout, interval, provision);
  }

  private static String getEnvString(String name, String defaultValue) {
    String value = System.getenv(name);
    return (value != null && !value.isBlank()) ? value : defaultValue;
  }

  private static boolean getEnvBoolean(String name, boolean defaultValue) {
    String value = System.getenv(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value);
  }

  private static int getEnvInt(String name, int defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  private static long getEnvLong(String name, long defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Long.parseLong(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }
}
