package io.github.themoah.hoverlog.model;

/**
 * Thrown when a request is rejected before any analysis starts.
 * Never retried and never converted into fallback data.
 */
public class ValidationException extends RuntimeException {

  /**
   * Machine-checkable reason for the rejection.
   */
  public enum Category {
    MALFORMED_REQUEST("malformed_request", "Invalid request"),
    MISSING_FIELD("missing_field", "Invalid request"),
    INVALID_TIME_RANGE("invalid_time_range", "Invalid time range");

    private final String value;
    private final String title;

    Category(String value, String title) {
      this.value = value;
      this.title = title;
    }

    public String getValue() {
      return value;
    }

    public String getTitle() {
      return title;
    }
  }

  private final Category category;

  public ValidationException(Category category, String message) {
    super(message);
    this.category = category;
  }

  public Category getCategory() {
    return category;
  }
}
