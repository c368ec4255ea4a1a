package io.github.themoah.hoverlog.health;

import io.vertx.core.json.JsonObject;

/**
 * Immutable health check response.
 *
 * @param status overall health status
 * @param store template store status (null for liveness check)
 */
public record HealthCheckResponse(
  HealthStatus status,
  String store
) {

  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null);
  }

  /**
   * Creates a readiness response. The service answers queries even when the store is
   * down, but reports DOWN so orchestrators can see the degraded state.
   *
   * @param storeReachable true if the last store heartbeat succeeded
   */
  public static HealthCheckResponse readiness(boolean storeReachable) {
    HealthStatus status = HealthStatus.fromReachable(storeReachable);
    return new HealthCheckResponse(status, status.storeLabel());
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.getValue());
    if (store != null) {
      json.put("clickhouse", store);
    }
    return json;
  }
}
