package io.intellixity.strata.persistence.error;

import java.util.Map;

/**
 * Classified failure of a save.\n
 *
 * The original store exception is kept as the cause. {@code details} carries dialect-extracted context
 * (constraint, table, column) when the driver exposes it.
 */
public class SaveException extends RuntimeException {
  private final StoreErrorKind kind;
  private final String sqlState;
  private final String partition;
  private final Map<String, String> details;

  public SaveException(StoreErrorKind kind, String sqlState, String partition, String message,
                       Map<String, String> details, Throwable cause) {
    super(message, cause);
    this.kind = (kind == null) ? StoreErrorKind.UNKNOWN : kind;
    this.sqlState = sqlState;
    this.partition = partition;
    this.details = (details == null) ? Map.of() : Map.copyOf(details);
  }

  public SaveException(StoreErrorKind kind, String partition, String message, Throwable cause) {
    this(kind, StoreErrorKind.sqlStateOf(cause), partition, message, Map.of(), cause);
  }

  public static SaveException classify(String partition, Throwable cause, Map<String, String> details) {
    if (cause instanceof SaveException se) return se;
    String state = StoreErrorKind.sqlStateOf(cause);
    StoreErrorKind kind = StoreErrorKind.fromSqlState(state);
    String msg = "Save failed on partition=" + partition + " kind=" + kind +
        (state == null ? "" : " sqlState=" + state) +
        (cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage());
    return new SaveException(kind, state, partition, msg, details, cause);
  }

  public StoreErrorKind kind() { return kind; }
  public String sqlState() { return sqlState; }
  public String partition() { return partition; }
  public Map<String, String> details() { return details; }
}
