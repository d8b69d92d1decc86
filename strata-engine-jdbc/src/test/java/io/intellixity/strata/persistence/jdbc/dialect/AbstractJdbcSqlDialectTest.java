package io.intellixity.strata.persistence.jdbc.dialect;

import io.intellixity.strata.persistence.dmlast.Bind;
import io.intellixity.strata.persistence.dmlast.ColumnBind;
import io.intellixity.strata.persistence.dmlast.DeleteAst;
import io.intellixity.strata.persistence.dmlast.InsertAst;
import io.intellixity.strata.persistence.dmlast.UpdateAst;
import io.intellixity.strata.persistence.jdbc.SqlStatement;
import io.intellixity.strata.persistence.jdbc.TestDialect;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractJdbcSqlDialectTest {
  private final TestDialect dialect = new TestDialect();

  @Test
  void rendersInsertWithNumberedPlaceholders() {
    InsertAst ins = new InsertAst("orders", List.of(
        new ColumnBind("id", new Bind(7L, "long")),
        new ColumnBind("account_id", new Bind("a", "uuid"))));
    SqlStatement ss = dialect.renderDml("app", ins);

    assertEquals("INSERT INTO \"app\".\"orders\" (\"id\", \"account_id\") VALUES (:b1, :b2)", ss.sql());
    assertEquals(List.of(new Bind(7L, "long"), new Bind("a", "uuid")), ss.binds());
    assertEquals(SqlStatement.ExecKind.UPDATE, ss.execKind());
    assertEquals("INSERT", ss.op());
  }

  @Test
  void rendersUpdateWithIdLast() {
    UpdateAst upd = new UpdateAst("accounts", List.of(
        new ColumnBind("name", new Bind("Ada", "string")),
        new ColumnBind("email", new Bind(null, "string"))), "id", new Bind(1L, "long"));
    SqlStatement ss = dialect.renderDml(null, upd);

    assertEquals("UPDATE \"accounts\" SET \"name\" = :b1, \"email\" = :b2 WHERE \"id\" = :b3", ss.sql());
    assertEquals(new Bind(1L, "long"), ss.binds().get(2));
  }

  @Test
  void rendersDelete() {
    SqlStatement ss = dialect.renderDml("app", new DeleteAst("orders", "id", new Bind(5L, "long")));
    assertEquals("DELETE FROM \"app\".\"orders\" WHERE \"id\" = :b1", ss.sql());
    assertEquals("DELETE", ss.op());
  }

  @Test
  void selectByIdsBindsTheWholeBatchAsOneArray() {
    SqlStatement ss = dialect.selectByIds("app", "accounts", List.of("id", "name"), "id", "uuid");
    assertEquals("SELECT \"id\", \"name\" FROM \"app\".\"accounts\" WHERE \"id\" = ANY(:b1)", ss.sql());
    assertEquals(List.of(new Bind(List.of(), "list<uuid>")), ss.binds());
    assertEquals(SqlStatement.ExecKind.QUERY, ss.execKind());
    assertThrows(IllegalArgumentException.class, () -> dialect.selectByIds("app", "accounts", List.of(), "id", "uuid"));
  }

  @Test
  void aggregateByIdsOrdersMembers() {
    SqlStatement ordered = dialect.aggregateByIds(null, "orders", "account_id", "id", "placed_at", "uuid");
    assertEquals("SELECT \"account_id\" AS k, array_agg(\"id\" ORDER BY \"placed_at\") AS v FROM \"orders\"" +
        " WHERE \"account_id\" = ANY(:b1) GROUP BY \"account_id\"", ordered.sql());

    SqlStatement unordered = dialect.aggregateByIds(null, "orders", "account_id", "id", null, "uuid");
    assertTrue(unordered.sql().contains("array_agg(\"id\") AS v"), unordered.sql());
  }

  @Test
  void noDeferralByDefault() {
    AbstractJdbcSqlDialect plain = new AbstractJdbcSqlDialect() {
      @Override public String id() { return "plain"; }
      @Override protected String quoteIdent(String ident) { return ident; }
      @Override public SqlStatement nextValues(String namespace, String sequence, int count) {
        throw new UnsupportedOperationException();
      }
    };
    assertNull(plain.deferConstraints());
    assertEquals("DELETE FROM s.t WHERE id = :b1", plain.renderDml("s", new DeleteAst("t", "id", new Bind(1, "int"))).sql());
  }
}
