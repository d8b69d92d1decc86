package io.intellixity.strata.persistence.error;

import java.sql.SQLException;

/** Semantic classification of store failures, keyed by SQLState. */
public enum StoreErrorKind {
  CONNECTION_UNAVAILABLE("08003"),
  STRING_TOO_LONG("22001"),
  INVALID_ENCODING("22021"),
  INVALID_VALUE_REPRESENTATION("22P02"),
  NOT_NULL_VIOLATION("23502"),
  UNIQUENESS_VIOLATION("23505"),
  CHECK_VIOLATION("23514"),
  SERIALIZATION_CONFLICT("40001"),
  STATEMENT_TIMEOUT("57014"),
  UNKNOWN(null);

  private final String sqlState;

  StoreErrorKind(String sqlState) {
    this.sqlState = sqlState;
  }

  /** Canonical SQLState, {@code null} for {@link #UNKNOWN}. */
  public String sqlState() { return sqlState; }

  public boolean retryable() {
    return this == SERIALIZATION_CONFLICT;
  }

  public static StoreErrorKind fromSqlState(String state) {
    if (state == null || state.isBlank()) return UNKNOWN;
    for (StoreErrorKind k : values()) {
      if (state.equals(k.sqlState)) return k;
    }
    // class 08: connection exception
    if (state.startsWith("08")) return CONNECTION_UNAVAILABLE;
    return UNKNOWN;
  }

  /** Classify by the first SQLState found along the cause chain and {@link SQLException#getNextException()}. */
  public static StoreErrorKind classify(Throwable t) {
    return fromSqlState(sqlStateOf(t));
  }

  public static String sqlStateOf(Throwable t) {
    Throwable cur = t;
    int guard = 0;
    while (cur != null && guard++ < 32) {
      if (cur instanceof SQLException se) {
        SQLException s = se;
        while (s != null) {
          if (s.getSQLState() != null) return s.getSQLState();
          s = s.getNextException();
        }
      }
      if (cur.getCause() == cur) break;
      cur = cur.getCause();
    }
    return null;
  }
}
