package io.github.themoah.hoverlog.health;

/**
 * Probe status reported by {@code /healthz} and {@code /readyz}.
 */
public enum HealthStatus {
  UP("UP"),
  DOWN("DOWN");

  private final String value;

  HealthStatus(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  public static HealthStatus fromReachable(boolean reachable) {
    return reachable ? UP : DOWN;
  }

  /**
   * Label used for the {@code clickhouse} field of the readiness body.
   */
  public String storeLabel() {
    return this == UP ? "reachable" : "unreachable";
  }
}
