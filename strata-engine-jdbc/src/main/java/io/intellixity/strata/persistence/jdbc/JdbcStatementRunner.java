package io.intellixity.strata.persistence.jdbc;

import io.intellixity.strata.persistence.dmlast.Bind;
import io.intellixity.strata.persistence.jdbc.bind.JdbcBindContext;
import io.intellixity.strata.persistence.spi.bind.BindOpKind;
import io.intellixity.strata.persistence.spi.bind.DiscoveredBinderRegistry;
import io.intellixity.strata.persistence.value.CodecRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Prepares, binds and runs {@link SqlStatement}s on a caller-owned connection.\n
 *
 * Logging: DEBUG per statement (op, bind count, handle, JDBC SQL) and on completion with duration; TRACE bind
 * summary only (no raw values).
 */
public final class JdbcStatementRunner {
  private static final Logger log = LoggerFactory.getLogger(JdbcStatementRunner.class);

  /** Maps the current row; called once per row. */
  @FunctionalInterface
  public interface RowMapper<T> {
    T map(JdbcRowAdapter row);
  }

  private final DiscoveredBinderRegistry binders;
  private final CodecRegistry codecs;

  public JdbcStatementRunner(DiscoveredBinderRegistry binders, CodecRegistry codecs) {
    this.binders = Objects.requireNonNull(binders, "binders");
    this.codecs = Objects.requireNonNull(codecs, "codecs");
  }

  public int update(Connection c, JdbcHandle h, SqlStatement ss, BindOpKind bindKind) throws SQLException {
    String jdbcSql = NamedParamCompiler.toJdbcSql(ss.sql());
    long start = System.nanoTime();
    debugSql(h, ss, jdbcSql, bindKind);
    try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      bindAll(ps, ss.binds(), bindKind);
      int n = ps.executeUpdate();
      debugDone(ss, n, System.nanoTime() - start);
      return n;
    }
  }

  public <T> List<T> query(Connection c, JdbcHandle h, SqlStatement ss, BindOpKind bindKind, RowMapper<T> mapper)
      throws SQLException {
    String jdbcSql = NamedParamCompiler.toJdbcSql(ss.sql());
    long start = System.nanoTime();
    debugSql(h, ss, jdbcSql, bindKind);
    try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      bindAll(ps, ss.binds(), bindKind);
      List<T> out = new ArrayList<>();
      try (ResultSet rs = ps.executeQuery()) {
        JdbcRowAdapter row = new JdbcRowAdapter(rs);
        while (rs.next()) out.add(mapper.map(row));
      }
      debugDone(ss, out.size(), System.nanoTime() - start);
      return out;
    }
  }

  private void bindAll(PreparedStatement ps, List<Bind> binds, BindOpKind bindKind) {
    for (int i = 0; i < binds.size(); i++) {
      Bind b = binds.get(i);
      binders.bind(ps, new JdbcBindContext(bindKind, i + 1), b, b.value(), codecs);
    }
  }

  private static void debugSql(JdbcHandle h, SqlStatement ss, String jdbcSql, BindOpKind bindKind) {
    if (!log.isDebugEnabled()) return;
    log.debug("strata.jdbc op={} execKind={} bindKind={} bindCount={} handleId={} schema={} sql={}",
        ss.op(), ss.execKind(), bindKind, ss.binds().size(),
        h == null ? "null" : h.id(),
        h == null ? "null" : h.schema(),
        jdbcSql);

    // TRACE: bind summary only (no raw values; avoids PII leaks)
    if (log.isTraceEnabled() && !ss.binds().isEmpty()) {
      int idx = 1;
      for (Bind b : ss.binds()) {
        Object v = b.value();
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : (v instanceof Collection<?> col) ? col.size() : -1;
        log.trace("strata.jdbc bind index={} typeId={} valueType={} valueLen={}", idx++, b.typeId(), vType, vLen);
      }
    }
  }

  private static void debugDone(SqlStatement ss, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("strata.jdbc_done op={} execKind={} durationMs={} result={}",
        ss.op(), ss.execKind(), durationNanos / 1_000_000.0, safeResult(result));
  }

  private static String safeResult(Object r) {
    if (r == null) return "null";
    if (r instanceof Number n) return String.valueOf(n);
    if (r instanceof CharSequence cs) return "len=" + cs.length();
    return r.getClass().getSimpleName();
  }
}
