package io.github.themoah.hoverlog.model;

/**
 * Scope of a log analysis query. The values are opaque; only presence is checked.
 *
 * @param org organization name
 * @param dashboard dashboard name
 * @param panelTitle panel title
 * @param metricName metric name
 */
public record Identity(
  String org,
  String dashboard,
  String panelTitle,
  String metricName
) {

  public Identity {
    requirePresent("org", org);
    requirePresent("dashboard", dashboard);
    requirePresent("panel_title", panelTitle);
    requirePresent("metric_name", metricName);
  }

  private static void requirePresent(String field, String value) {
    if (value == null || value.isEmpty()) {
      throw new ValidationException(
        ValidationException.Category.MISSING_FIELD,
        "Missing required field: " + field
      );
    }
  }
}
