package io.intellixity.strata.persistence.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class NamedParamCompilerTest {

  @Test
  void replacesNamedParamsInOrder() {
    assertEquals("UPDATE \"t\" SET \"a\" = ?, \"b\" = ? WHERE \"id\" = ?",
        NamedParamCompiler.toJdbcSql("UPDATE \"t\" SET \"a\" = :b1, \"b\" = :b2 WHERE \"id\" = :b3"));
    assertEquals(3, NamedParamCompiler.countParams("UPDATE t SET a = :b1, b = :b2 WHERE id = :b3"));
  }

  @Test
  void keepsCastsAndQuotedText() {
    assertEquals("SELECT \"id\" FROM t WHERE \"id\" = ANY(?::uuid[])",
        NamedParamCompiler.toJdbcSql("SELECT \"id\" FROM t WHERE \"id\" = ANY(:b1::uuid[])"));
    assertEquals("SELECT ':b1', \"col:x\", 'it''s :b2' FROM t WHERE a = ?",
        NamedParamCompiler.toJdbcSql("SELECT ':b1', \"col:x\", 'it''s :b2' FROM t WHERE a = :b3"));
    assertEquals(1, NamedParamCompiler.countParams("SELECT ':b1' FROM t WHERE a = :b3"));
  }

  @Test
  void leavesPlainColonsAndNullAlone() {
    assertEquals("SELECT '10:30', x : 1 FROM t", NamedParamCompiler.toJdbcSql("SELECT '10:30', x : 1 FROM t"));
    assertEquals("", NamedParamCompiler.toJdbcSql(null));
    assertEquals(0, NamedParamCompiler.countParams("SELECT 1 WHERE a = ?"));
  }
}
