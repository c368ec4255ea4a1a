package io.github.themoah.hoverlog.health;

import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for liveness and readiness probes.
 */
public class HealthCheckHandler {

  private static final Logger log = LoggerFactory.getLogger(HealthCheckHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final StoreHealthMonitor healthMonitor;

  public HealthCheckHandler(StoreHealthMonitor healthMonitor) {
    this.healthMonitor = healthMonitor;
  }

  public void registerRoutes(Router router) {
    router.get("/healthz").handler(this::handleLiveness);
    router.get("/readyz").handler(this::handleReadiness);
    log.info("Health check routes registered: /healthz, /readyz");
  }

  private void handleLiveness(RoutingContext ctx) {
    write(ctx, 200, HealthCheckResponse.liveness());
  }

  /**
   * Returns 200 while the store answers heartbeats, 503 otherwise.
   */
  private void handleReadiness(RoutingContext ctx) {
    boolean reachable = healthMonitor.isStoreReachable();
    write(ctx, reachable ? 200 : 503, HealthCheckResponse.readiness(reachable));
  }

  private static void write(RoutingContext ctx, int status, HealthCheckResponse response) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(status)
      .end(response.toJson().encode());
  }
}
