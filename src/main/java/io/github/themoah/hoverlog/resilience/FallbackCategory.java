package io.github.themoah.hoverlog.resilience;

/**
 * Degraded-mode response categories, in classification priority order.
 */
public enum FallbackCategory {
  /** Store unreachable: example anomalies for exercising the UI. */
  CONNECTIVITY("connectivity"),
  /** Tables not provisioned yet. */
  SCHEMA_MISSING("schema_missing"),
  /** Any other failure: generic apology with the raw error text. */
  UNCLASSIFIED("unclassified");

  private final String value;

  FallbackCategory(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
