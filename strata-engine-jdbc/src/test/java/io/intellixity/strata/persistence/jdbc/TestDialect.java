package io.intellixity.strata.persistence.jdbc;

import io.intellixity.strata.persistence.dmlast.Bind;
import io.intellixity.strata.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.strata.persistence.jdbc.dialect.AbstractJdbcSqlDialect;

import java.util.List;

/** ANSI quoting with deferred constraints and a nextval-style sequence query. */
public final class TestDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "test"; }

  @Override
  protected String quoteIdent(String ident) {
    return "\"" + ident + "\"";
  }

  @Override
  public SqlStatement deferConstraints() {
    return new SqlStatement("SET CONSTRAINTS ALL DEFERRED", List.of(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement nextValues(String namespace, String sequence, int count) {
    return new SqlStatement("SELECT nextval('" + qualify(namespace, sequence) + "') FROM generate_series(1, :b1)",
        List.of(new Bind(count, "int")), ExecKind.QUERY);
  }
}
