package io.github.themoah.hoverlog.store;

/**
 * Failure of the template store, tagged with a closed set of kinds so callers can branch
 * without inspecting driver-specific error text.
 */
public class StorageException extends RuntimeException {

  /**
   * Kind of storage failure.
   */
  public enum Kind {
    /** Connection refused, unreachable host or timeout. */
    UNAVAILABLE,
    /** A required table does not exist. */
    SCHEMA_MISSING,
    /** Any other store failure. */
    UNCLASSIFIED
  }

  private final Kind kind;

  public StorageException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public static StorageException unavailable(String message, Throwable cause) {
    return new StorageException(Kind.UNAVAILABLE, message, cause);
  }

  public static StorageException schemaMissing(String message, Throwable cause) {
    return new StorageException(Kind.SCHEMA_MISSING, message, cause);
  }

  public static StorageException unclassified(String message, Throwable cause) {
    return new StorageException(Kind.UNCLASSIFIED, message, cause);
  }

  public Kind getKind() {
    return kind;
  }
}
