package io.intellixity.strata.persistence.jdbc.postgres;

import io.intellixity.strata.persistence.dmlast.Bind;
import io.intellixity.strata.persistence.jdbc.SqlStatement;
import io.intellixity.strata.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.strata.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.strata.persistence.jdbc.dialect.JdbcDialect;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class PostgresDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  private static final Logger log = LoggerFactory.getLogger(PostgresDialect.class);

  public static final String ID = "postgres";

  /** Postgres array element type per codec id; anything else travels as text. */
  static final Map<String, String> ARRAY_ELEM_TYPES = Map.of(
      "uuid", "uuid",
      "int", "int4",
      "long", "int8",
      "boolean", "bool",
      "decimal", "numeric",
      "instant", "timestamptz"
  );

  @Override public String id() { return ID; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  public SqlStatement deferConstraints() {
    return new SqlStatement("SET CONSTRAINTS ALL DEFERRED", List.of(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement nextValues(String namespace, String sequence, int count) {
    if (count <= 0) throw new IllegalArgumentException("count must be >= 1");
    String regclass = qualify(namespace, sequence).replace("'", "''");
    String sql = "SELECT nextval('" + regclass + "') AS id FROM generate_series(1, :b1)";
    return new SqlStatement(sql, List.of(new Bind(count, "int")), ExecKind.QUERY);
  }

  @Override
  protected String anyArray(String expr, String param, String elemTypeId) {
    return expr + " = ANY(" + param + "::" + arrayElemType(elemTypeId) + "[])";
  }

  static String arrayElemType(String elemTypeId) {
    return ARRAY_ELEM_TYPES.getOrDefault(elemTypeId == null ? "" : elemTypeId.toLowerCase(), "text");
  }

  /** Constraint, table, column and schema reported by the server, when the driver exposes them. */
  @Override
  public Map<String, String> errorDetails(Throwable error) {
    Throwable cur = error;
    int guard = 0;
    while (cur != null && guard++ < 32) {
      if (cur instanceof PSQLException pe && pe.getServerErrorMessage() != null) {
        ServerErrorMessage m = pe.getServerErrorMessage();
        Map<String, String> out = new LinkedHashMap<>();
        putIfPresent(out, "constraint", m.getConstraint());
        putIfPresent(out, "table", m.getTable());
        putIfPresent(out, "column", m.getColumn());
        putIfPresent(out, "schema", m.getSchema());
        return out;
      }
      if (cur.getCause() == cur) break;
      cur = cur.getCause();
    }
    log.debug("strata.postgres no server error message error={} sqlState={}",
        error == null ? null : error.getClass().getName(),
        error instanceof SQLException se ? se.getSQLState() : null);
    return Map.of();
  }

  private static void putIfPresent(Map<String, String> out, String k, String v) {
    if (v != null && !v.isBlank()) out.put(k, v);
  }
}
