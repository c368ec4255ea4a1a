package io.github.themoah.hoverlog.health;

import io.github.themoah.hoverlog.store.TemplateStore;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks template store reachability with a periodic ping.
 */
public class StoreHealthMonitor {

  private static final Logger log = LoggerFactory.getLogger(StoreHealthMonitor.class);

  private final Vertx vertx;
  private final TemplateStore store;
  private final long heartbeatIntervalMs;
  private final AtomicReference<HealthStatus> storeStatus = new AtomicReference<>(HealthStatus.DOWN);

  private Long timerId;

  public StoreHealthMonitor(Vertx vertx, TemplateStore store, long heartbeatIntervalMs) {
    this.vertx = vertx;
    this.store = store;
    this.heartbeatIntervalMs = heartbeatIntervalMs;
  }

  /**
   * Runs an initial check and schedules the heartbeat. Never fails: an unreachable store
   * only marks the service as not ready.
   */
  public Future<Void> start() {
    log.info("Starting store health monitor with heartbeat interval: {}ms", heartbeatIntervalMs);
    return performHealthCheck()
      .onComplete(ar -> {
        timerId = vertx.setPeriodic(heartbeatIntervalMs, id -> performHealthCheck());
        log.debug("Store health monitor timer ID: {}", timerId);
      });
  }

  public Future<Void> stop() {
    log.info("Stopping store health monitor");
    if (timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
    storeStatus.set(HealthStatus.DOWN);
    return Future.succeededFuture();
  }

  public HealthStatus getStoreStatus() {
    return storeStatus.get();
  }

  public boolean isStoreReachable() {
    return storeStatus.get() == HealthStatus.UP;
  }

  Future<Void> performHealthCheck() {
    return store.ping()
      .onSuccess(v -> {
        if (storeStatus.getAndSet(HealthStatus.UP) == HealthStatus.DOWN) {
          log.info("ClickHouse connection established");
        }
      })
      .onFailure(err -> {
        if (storeStatus.getAndSet(HealthStatus.DOWN) == HealthStatus.UP) {
          log.warn("ClickHouse connection lost: {}", err.getMessage());
        } else {
          log.debug("ClickHouse health check failed: {}", err.getMessage());
        }
      })
      .recover(err -> Future.succeededFuture());
  }
}
