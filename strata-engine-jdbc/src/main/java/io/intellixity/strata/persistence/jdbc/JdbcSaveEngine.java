package io.intellixity.strata.persistence.jdbc;

import io.intellixity.strata.persistence.error.SaveException;
import io.intellixity.strata.persistence.error.StoreErrorKind;
import io.intellixity.strata.persistence.exec.Retrier;
import io.intellixity.strata.persistence.ids.IdGenerator;
import io.intellixity.strata.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.strata.persistence.schema.AttributeSchema;
import io.intellixity.strata.persistence.spi.bind.BindOpKind;
import io.intellixity.strata.persistence.spi.bind.DiscoveredBinderRegistry;
import io.intellixity.strata.persistence.spi.exec.AbstractSaveEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * JDBC save engine.\n
 *
 * Each partition's statements run on one connection in one SERIALIZABLE transaction. The dialect's constraint
 * deferral statement runs first, so UPDATE/DELETE before INSERT never trips a foreign key mid-transaction.\n
 * Any failure rolls back and surfaces as a classified {@link SaveException}; the retry loop decides whether to
 * run the partition again.
 */
public final class JdbcSaveEngine extends AbstractSaveEngine<SqlStatement, JdbcHandle> {
  private static final Logger log = LoggerFactory.getLogger(JdbcSaveEngine.class);

  private final JdbcDialect sql;
  private final JdbcStatementRunner runner;

  public JdbcSaveEngine(JdbcDialect dialect, AttributeSchema schema, Map<String, JdbcHandle> handles) {
    super(dialect, schema, handles);
    this.sql = dialect;
    this.runner = new JdbcStatementRunner(binders(), schema.codecRegistry());
  }

  public JdbcSaveEngine(JdbcDialect dialect,
                        AttributeSchema schema,
                        Map<String, JdbcHandle> handles,
                        Retrier retrier,
                        IdGenerator idGenerator,
                        DiscoveredBinderRegistry binders) {
    super(dialect, schema, handles, retrier, idGenerator, binders);
    this.sql = dialect;
    this.runner = new JdbcStatementRunner(binders, schema.codecRegistry());
  }

  @Override
  protected Map<String, List<Object>> allocate(JdbcHandle handle, String partition, Map<String, Integer> counts) {
    return new JdbcSequenceAllocator(handle, sql, runner).allocate(partition, counts);
  }

  @Override
  protected void execute(JdbcHandle handle, String partition, List<SqlStatement> statements) {
    long start = System.nanoTime();
    try (Connection c = handle.client().getConnection()) {
      boolean autoCommit = c.getAutoCommit();
      c.setTransactionIsolation(sql.writeIsolation());
      c.setAutoCommit(false);
      try {
        SqlStatement defer = dialect().deferConstraints();
        if (defer != null) runner.update(c, handle, defer, BindOpKind.UPDATE_SET);
        for (SqlStatement ss : statements) {
          runner.update(c, handle, ss, bindKindOf(ss));
        }
        c.commit();
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(c, e);
        throw e;
      } finally {
        restoreAutoCommit(c, autoCommit);
      }
      log.debug("strata.jdbc tx_done partition={} handleId={} statements={} durationMs={}",
          partition, handle.id(), statements.size(), (System.nanoTime() - start) / 1_000_000.0);
    } catch (SQLException e) {
      throw SaveException.classify(partition, e, dialect().errorDetails(e));
    } catch (RuntimeException e) {
      // binders wrap driver errors
      if (StoreErrorKind.sqlStateOf(e) != null) throw SaveException.classify(partition, e, dialect().errorDetails(e));
      throw e;
    }
  }

  private static BindOpKind bindKindOf(SqlStatement ss) {
    return switch (ss.op()) {
      case "INSERT" -> BindOpKind.INSERT;
      case "UPDATE" -> BindOpKind.UPDATE_SET;
      default -> BindOpKind.FILTER;
    };
  }

  private static void rollbackQuietly(Connection c, Exception failure) {
    try {
      c.rollback();
    } catch (SQLException re) {
      failure.addSuppressed(re);
    }
  }

  private static void restoreAutoCommit(Connection c, boolean autoCommit) throws SQLException {
    if (c.getAutoCommit() != autoCommit) c.setAutoCommit(autoCommit);
  }
}
