package io.intellixity.strata.persistence.error;

/** Classified store failure of a resolver query. The driver exception is kept as the cause. */
public class ReadException extends RuntimeException {
  private final StoreErrorKind kind;
  private final String sqlState;
  private final String resolver;

  public ReadException(String resolver, Throwable cause) {
    super("Resolver " + resolver + " failed" + (cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage()), cause);
    this.resolver = resolver;
    this.sqlState = StoreErrorKind.sqlStateOf(cause);
    this.kind = StoreErrorKind.fromSqlState(sqlState);
  }

  public StoreErrorKind kind() { return kind; }
  public String sqlState() { return sqlState; }
  public String resolver() { return resolver; }
}
