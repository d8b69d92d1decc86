package io.intellixity.strata.persistence.jdbc;

import io.intellixity.strata.persistence.dmlast.Bind;
import io.intellixity.strata.persistence.spi.sql.NativeStatement;

import java.util.List;

/** SQL with {@code :bN} named placeholders, its ordered binds and how to execute it. */
public record SqlStatement(String sql, List<Bind> binds, ExecKind execKind) implements NativeStatement {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery() (resolver queries, sequence allocation). */
    QUERY,
    /** Execute via PreparedStatement.executeUpdate() (DML, constraint deferral). */
    UPDATE
  }

  public SqlStatement {
    if (sql == null || sql.isBlank()) throw new IllegalArgumentException("sql is required");
    binds = binds == null ? List.of() : List.copyOf(binds);
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Bind> binds) {
    this(sql, binds, ExecKind.QUERY);
  }

  /** Leading SQL keyword in upper case ({@code INSERT}, {@code SELECT}, ...), used for logging. */
  public String op() {
    String t = sql.trim();
    int sp = t.indexOf(' ');
    return (sp < 0 ? t : t.substring(0, sp)).toUpperCase(java.util.Locale.ROOT);
  }
}
