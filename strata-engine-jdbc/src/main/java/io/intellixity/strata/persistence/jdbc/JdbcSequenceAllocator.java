package io.intellixity.strata.persistence.jdbc;

import io.intellixity.strata.persistence.error.SaveException;
import io.intellixity.strata.persistence.ids.SequenceAllocator;
import io.intellixity.strata.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.strata.persistence.spi.bind.BindOpKind;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Allocates sequence values for one partition: one query per sequence, all on one connection, outside the
 * write transaction. Values are returned raw; callers decode them with the identity codec.
 */
public final class JdbcSequenceAllocator implements SequenceAllocator {
  private final JdbcHandle handle;
  private final JdbcDialect dialect;
  private final JdbcStatementRunner runner;

  public JdbcSequenceAllocator(JdbcHandle handle, JdbcDialect dialect, JdbcStatementRunner runner) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  @Override
  public Map<String, List<Object>> allocate(String partition, Map<String, Integer> countsBySequence) {
    Map<String, List<Object>> out = new LinkedHashMap<>();
    if (countsBySequence.isEmpty()) return out;
    try (Connection c = handle.client().getConnection()) {
      for (var e : countsBySequence.entrySet()) {
        int count = e.getValue();
        if (count <= 0) continue;
        SqlStatement ss = dialect.nextValues(handle.namespace(), e.getKey(), count);
        out.put(e.getKey(), runner.query(c, handle, ss, BindOpKind.ALLOCATE, row -> row.raw(1)));
      }
      return out;
    } catch (SQLException e) {
      throw SaveException.classify(partition, e, dialect.errorDetails(e));
    } catch (RuntimeException e) {
      if (e.getCause() instanceof SQLException se) throw SaveException.classify(partition, se, dialect.errorDetails(se));
      throw e;
    }
  }
}
