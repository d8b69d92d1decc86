package io.intellixity.strata.persistence.jdbc.dialect;

import io.intellixity.strata.persistence.jdbc.SqlStatement;
import io.intellixity.strata.persistence.spi.sql.Dialect;

import java.sql.Connection;

/**
 * SQL rendering for a JDBC store.\n
 *
 * Write plans render as {@link SqlStatement.ExecKind#UPDATE} statements; sequence allocation and resolver
 * batches render as {@link SqlStatement.ExecKind#QUERY}. Binds use {@code :bN} placeholders, compiled to
 * {@code ?} by the statement runner.
 */
public interface JdbcDialect extends Dialect<SqlStatement> {
  /** Isolation every write transaction runs at; a serialization failure at this level is replayed by the retrier. */
  default int writeIsolation() {
    return Connection.TRANSACTION_SERIALIZABLE;
  }
}
