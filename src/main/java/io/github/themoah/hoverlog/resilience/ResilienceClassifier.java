package io.github.themoah.hoverlog.resilience;

import io.github.themoah.hoverlog.model.AnalysisResult;
import io.github.themoah.hoverlog.model.LogGroup;
import io.github.themoah.hoverlog.store.StorageException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts analysis failures into clearly marked synthetic results so the panel always
 * has something to render.
 *
 * <p>Every synthetic group uses a reserved template ID ({@code error} or {@code mock_*})
 * and every line starts with {@link #MOCK_MARKER} or {@link #ERROR_MARKER}.
 */
public class ResilienceClassifier {

  private static final Logger log = LoggerFactory.getLogger(ResilienceClassifier.class);

  public static final String MOCK_MARKER = "[MOCK DATA]";
  public static final String ERROR_MARKER = "[ERROR]";

  private static final List<LogGroup> CONNECTIVITY_GROUPS = List.of(
    new LogGroup(
      "mock_error_template",
      List.of(
        MOCK_MARKER + " Log database is not connected",
        MOCK_MARKER + " Example anomaly: ERROR: Out of memory on node-3",
        MOCK_MARKER + " Example anomaly: WARNING: High CPU usage detected (95%)",
        MOCK_MARKER + " Example anomaly: CRITICAL: Disk space below 5%"
      ),
      2.5,
      0.8
    ),
    new LogGroup(
      "mock_warning_template",
      List.of(
        MOCK_MARKER + " Example pattern: Connection timeout after 30s",
        MOCK_MARKER + " Example pattern: Retrying connection attempt 3/5"
      ),
      1.2,
      0.4
    ),
    new LogGroup(
      "mock_info_template",
      List.of(
        MOCK_MARKER + " Example info: Service started successfully",
        MOCK_MARKER + " Example info: Health check passed"
      ),
      0.3,
      0.1
    )
  );

  private static final List<LogGroup> SCHEMA_MISSING_GROUPS = List.of(
    new LogGroup(
      LogGroup.ERROR_TEMPLATE_ID,
      List.of(
        MOCK_MARKER + " Required tables missing. Please restart the service to auto-create tables.",
        MOCK_MARKER + " These are example logs shown because tables don't exist yet"
      ),
      0.0,
      0.0
    )
  );

  /**
   * Picks the fallback category for a failure. Storage failures are matched on their kind,
   * found anywhere in the cause chain; anything else is unclassified.
   *
   * @param error the failure
   * @return the fallback category
   */
  public FallbackCategory classify(Throwable error) {
    StorageException storageError = findStorageException(error);
    if (storageError == null) {
      return FallbackCategory.UNCLASSIFIED;
    }
    return switch (storageError.getKind()) {
      case UNAVAILABLE -> FallbackCategory.CONNECTIVITY;
      case SCHEMA_MISSING -> FallbackCategory.SCHEMA_MISSING;
      case UNCLASSIFIED -> FallbackCategory.UNCLASSIFIED;
    };
  }

  /**
   * Builds the synthetic result for a failure.
   *
   * @param error the failure
   * @return marked placeholder result
   */
  public AnalysisResult fallbackFor(Throwable error) {
    FallbackCategory category = classify(error);
    log.warn("Returning {} fallback for analysis failure: {}", category.getValue(), describe(error));
    return fallbackFor(category, error);
  }

  AnalysisResult fallbackFor(FallbackCategory category, Throwable error) {
    return switch (category) {
      case CONNECTIVITY -> new AnalysisResult(CONNECTIVITY_GROUPS);
      case SCHEMA_MISSING -> new AnalysisResult(SCHEMA_MISSING_GROUPS);
      case UNCLASSIFIED -> new AnalysisResult(List.of(
        new LogGroup(
          LogGroup.ERROR_TEMPLATE_ID,
          List.of(
            ERROR_MARKER + " Hover log database encountered an error. Please contact support.",
            ERROR_MARKER + " Error details: " + describe(error)
          ),
          0.0,
          0.0
        )
      ));
    };
  }

  private static StorageException findStorageException(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof StorageException storageException) {
        return storageException;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return null;
  }

  private static String describe(Throwable error) {
    if (error == null) {
      return "unknown error";
    }
    String message = error.getMessage();
    return (message == null || message.isBlank()) ? error.getClass().getSimpleName() : message;
  }
}
