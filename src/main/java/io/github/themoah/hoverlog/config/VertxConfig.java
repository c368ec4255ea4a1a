package io.github.themoah.hoverlog.config;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x configuration. The worker pool size can be set via VERTX_WORKER_POOL_SIZE.
 */
public class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_WORKER_POOL_SIZE = "VERTX_WORKER_POOL_SIZE";

  public static VertxOptions createVertxOptions() {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);
    Integer workerPoolSize = workerPoolSize();
    if (workerPoolSize != null) {
      log.info("Using worker pool size {}", workerPoolSize);
      options.setWorkerPoolSize(workerPoolSize);
    }
    return options;
  }

  public static DeploymentOptions createDeploymentOptions() {
    return new DeploymentOptions();
  }

  static Integer workerPoolSize() {
    String value = System.getenv(ENV_WORKER_POOL_SIZE);
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      int size = Integer.parseInt(value);
      if (size > 0) {
        return size;
      }
      log.warn("{} must be positive, got {}; using Vert.x default", ENV_WORKER_POOL_SIZE, size);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using Vert.x default", ENV_WORKER_POOL_SIZE, value);
    }
    return null;
  }
}
