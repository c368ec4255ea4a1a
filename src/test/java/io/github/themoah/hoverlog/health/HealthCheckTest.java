package io.github.themoah.hoverlog.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.hoverlog.store.FakeTemplateStore;
import io.github.themoah.hoverlog.store.StorageException;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for health check components.
 */
@ExtendWith(VertxExtension.class)
public class HealthCheckTest {

  @Test
  void healthStatus_values() {
    assertEquals("UP", HealthStatus.UP.getValue());
    assertEquals("DOWN", HealthStatus.DOWN.getValue());
    assertEquals(HealthStatus.UP, HealthStatus.fromReachable(true));
    assertEquals("unreachable", HealthStatus.fromReachable(false).storeLabel());
  }

  @Test
  void healthCheckResponse_liveness() {
    HealthCheckResponse response = HealthCheckResponse.liveness();

    assertEquals(HealthStatus.UP, response.status());
    assertNull(response.store());

    JsonObject json = response.toJson();
    assertEquals("UP", json.getString("status"));
    assertFalse(json.containsKey("clickhouse"));
  }

  @Test
  void healthCheckResponse_readiness_reachable() {
    JsonObject json = HealthCheckResponse.readiness(true).toJson();

    assertEquals("UP", json.getString("status"));
    assertEquals("reachable", json.getString("clickhouse"));
  }

  @Test
  void healthCheckResponse_readiness_unreachable() {
    HealthCheckResponse response = HealthCheckResponse.readiness(false);

    assertEquals(HealthStatus.DOWN, response.status());
    assertEquals("unreachable", response.toJson().getString("clickhouse"));
  }

  @Test
  void monitor_tracksPingResult(Vertx vertx) {
    StoreHealthMonitor up = new StoreHealthMonitor(vertx, new FakeTemplateStore(), 60_000);
    assertFalse(up.isStoreReachable());

    assertTrue(up.performHealthCheck().succeeded());
    assertTrue(up.isStoreReachable());

    FakeTemplateStore broken = new FakeTemplateStore()
      .failCountsWith(StorageException.unavailable("Connection refused", null));
    StoreHealthMonitor down = new StoreHealthMonitor(vertx, broken, 60_000);

    assertTrue(down.performHealthCheck().succeeded());
    assertFalse(down.isStoreReachable());
    assertEquals(HealthStatus.DOWN, down.getStoreStatus());
  }
}
