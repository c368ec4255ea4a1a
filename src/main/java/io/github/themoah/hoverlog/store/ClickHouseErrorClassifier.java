package io.github.themoah.hoverlog.store;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps ClickHouse driver and transport failures onto {@link StorageException.Kind}.
 * The whole cause chain is inspected; connectivity wins over missing schema.
 */
public class ClickHouseErrorClassifier {

  /** ClickHouse server error code for UNKNOWN_TABLE. */
  static final int UNKNOWN_TABLE_CODE = 60;

  private static final List<Class<? extends Throwable>> CONNECTIVITY_TYPES = List.of(
    ConnectException.class,
    NoRouteToHostException.class,
    UnknownHostException.class,
    SocketTimeoutException.class,
    SQLTransientConnectionException.class,
    SQLNonTransientConnectionException.class,
    SQLTimeoutException.class,
    TimeoutException.class
  );

  private static final List<String> CONNECTIVITY_TEXT = List.of(
    "connection refused", "connect", "timeout", "timed out", "unreachable"
  );

  private static final List<String> SCHEMA_TEXT = List.of(
    "unknown_table", "doesn't exist", "does not exist"
  );

  /**
   * Wraps a failure into a typed storage exception.
   *
   * @param error the raw failure
   * @param operation short description of what was attempted, used in the message
   * @return the classified exception, or the input itself if it is already classified
   */
  public StorageException classify(Throwable error, String operation) {
    if (error instanceof StorageException storageException) {
      return storageException;
    }
    String detail = operation + " failed: " + rootMessage(error);
    return switch (kindOf(error)) {
      case UNAVAILABLE -> StorageException.unavailable(detail, error);
      case SCHEMA_MISSING -> StorageException.schemaMissing(detail, error);
      case UNCLASSIFIED -> StorageException.unclassified(detail, error);
    };
  }

  StorageException.Kind kindOf(Throwable error) {
    if (isConnectivity(error)) {
      return StorageException.Kind.UNAVAILABLE;
    }
    if (isSchemaMissing(error)) {
      return StorageException.Kind.SCHEMA_MISSING;
    }
    return StorageException.Kind.UNCLASSIFIED;
  }

  private boolean isConnectivity(Throwable error) {
    for (Throwable t = error; t != null; t = nextCause(t)) {
      for (Class<? extends Throwable> type : CONNECTIVITY_TYPES) {
        if (type.isInstance(t)) {
          return true;
        }
      }
      if (containsAny(t.getMessage(), CONNECTIVITY_TEXT)) {
        return true;
      }
    }
    return false;
  }

  private boolean isSchemaMissing(Throwable error) {
    for (Throwable t = error; t != null; t = nextCause(t)) {
      if (t instanceof SQLException sqlException && sqlException.getErrorCode() == UNKNOWN_TABLE_CODE) {
        return true;
      }
      if (containsAny(t.getMessage(), SCHEMA_TEXT)) {
        return true;
      }
    }
    return false;
  }

  private static Throwable nextCause(Throwable t) {
    Throwable cause = t.getCause();
    return cause == t ? null : cause;
  }

  private static boolean containsAny(String message, List<String> needles) {
    if (message == null) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    for (String needle : needles) {
      if (lower.contains(needle)) {
        return true;
      }
    }
    return false;
  }

  private static String rootMessage(Throwable error) {
    String message = error.getMessage();
    if (message == null || message.isBlank()) {
      return error.getClass().getSimpleName();
    }
    return message;
  }
}
