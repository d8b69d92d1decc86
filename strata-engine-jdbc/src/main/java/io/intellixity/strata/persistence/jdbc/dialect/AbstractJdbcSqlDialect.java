package io.intellixity.strata.persistence.jdbc.dialect;

import io.intellixity.strata.persistence.dmlast.*;
import io.intellixity.strata.persistence.jdbc.SqlStatement;
import io.intellixity.strata.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.strata.persistence.spi.sql.Dialect;

import java.util.ArrayList;
import java.util.List;

/**
 * JDBC-generic SQL dialect base.\n
 *
 * Provides common rendering for:\n
 * - DML: insert/update/delete from DmlAst\n
 * - batched resolver queries taking the whole id batch as one array bind\n
 *
 * DB-specific dialects override hooks for quoting, array matching, deferral and sequences.\n
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  protected static final class RenderCtx {
    private int n = 1;
    private final List<Bind> binds = new ArrayList<>();
    public String add(Bind b) {
      binds.add(b);
      return ":b" + (n++);
    }
    public List<Bind> binds() {
      return binds;
    }
  }

  @Override
  public final SqlStatement renderDml(String namespace, DmlAst dml) {
    if (dml instanceof InsertAst ins) return renderInsert(namespace, ins);
    if (dml instanceof UpdateAst upd) return renderUpdate(namespace, upd);
    if (dml instanceof DeleteAst del) return renderDelete(namespace, del);
    throw new IllegalArgumentException("Unsupported DML: " + dml.getClass().getName());
  }

  protected SqlStatement renderInsert(String namespace, InsertAst ins) {
    List<String> cols = new ArrayList<>();
    List<String> ph = new ArrayList<>();
    RenderCtx ctx = new RenderCtx();
    for (ColumnBind cb : ins.columns()) {
      cols.add(quoteIdent(cb.column()));
      ph.add(ctx.add(cb.bind()));
    }
    String sql = "INSERT INTO " + qualify(namespace, ins.table()) +
        " (" + String.join(", ", cols) + ") VALUES (" + String.join(", ", ph) + ")";
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  protected SqlStatement renderUpdate(String namespace, UpdateAst upd) {
    List<String> sets = new ArrayList<>();
    RenderCtx ctx = new RenderCtx();
    for (ColumnBind cb : upd.sets()) {
      sets.add(quoteIdent(cb.column()) + " = " + ctx.add(cb.bind()));
    }
    String sql = "UPDATE " + qualify(namespace, upd.table()) + " SET " + String.join(", ", sets) +
        " WHERE " + quoteIdent(upd.idColumn()) + " = " + ctx.add(upd.id());
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  protected SqlStatement renderDelete(String namespace, DeleteAst del) {
    RenderCtx ctx = new RenderCtx();
    String sql = "DELETE FROM " + qualify(namespace, del.table()) +
        " WHERE " + quoteIdent(del.idColumn()) + " = " + ctx.add(del.id());
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  /** No deferral by default; dialects with deferrable constraints override. */
  @Override
  public SqlStatement deferConstraints() {
    return null;
  }

  @Override
  public SqlStatement selectByIds(String namespace, String table, List<String> columns, String matchColumn,
                                  String elemTypeId) {
    if (columns == null || columns.isEmpty()) throw new IllegalArgumentException("columns are required");
    List<String> items = new ArrayList<>(columns.size());
    for (String c : columns) items.add(quoteIdent(c));
    RenderCtx ctx = new RenderCtx();
    String sql = "SELECT " + String.join(", ", items) + " FROM " + qualify(namespace, table) +
        " WHERE " + anyArray(quoteIdent(matchColumn), ctx.add(idsBind(elemTypeId)), elemTypeId);
    return new SqlStatement(sql, ctx.binds(), ExecKind.QUERY);
  }

  @Override
  public SqlStatement aggregateByIds(String namespace, String table, String keyColumn, String valueColumn,
                                     String orderColumn, String elemTypeId) {
    String key = quoteIdent(keyColumn);
    String order = (orderColumn == null) ? "" : " ORDER BY " + quoteIdent(orderColumn);
    RenderCtx ctx = new RenderCtx();
    String sql = "SELECT " + key + " AS k, " + arrayAgg(quoteIdent(valueColumn) + order) + " AS v" +
        " FROM " + qualify(namespace, table) +
        " WHERE " + anyArray(key, ctx.add(idsBind(elemTypeId)), elemTypeId) +
        " GROUP BY " + key;
    return new SqlStatement(sql, ctx.binds(), ExecKind.QUERY);
  }

  /** Placeholder bind for the id batch; callers replace the value when executing. */
  private static Bind idsBind(String elemTypeId) {
    return new Bind(List.of(), Dialect.arrayTypeId(elemTypeId));
  }

  /** Predicate matching {@code expr} against every element of the array bound at {@code param}. */
  protected String anyArray(String expr, String param, String elemTypeId) {
    return expr + " = ANY(" + param + ")";
  }

  protected String arrayAgg(String inner) {
    return "array_agg(" + inner + ")";
  }

  /** {@code "schema"."table"} when a namespace is set, otherwise the quoted table. */
  protected String qualify(String namespace, String table) {
    if (namespace == null || namespace.isBlank()) return quoteIdent(table);
    return quoteIdent(namespace) + "." + quoteIdent(table);
  }

  protected abstract String quoteIdent(String ident);
}
