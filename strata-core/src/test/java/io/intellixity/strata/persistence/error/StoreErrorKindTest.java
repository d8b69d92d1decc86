package io.intellixity.strata.persistence.error;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class StoreErrorKindTest {

  @Test
  void mapsKnownStatesAndConnectionClass() {
    assertEquals(StoreErrorKind.UNIQUENESS_VIOLATION, StoreErrorKind.fromSqlState("23505"));
    assertEquals(StoreErrorKind.STRING_TOO_LONG, StoreErrorKind.fromSqlState("22001"));
    assertEquals(StoreErrorKind.CONNECTION_UNAVAILABLE, StoreErrorKind.fromSqlState("08006"));
    assertEquals(StoreErrorKind.UNKNOWN, StoreErrorKind.fromSqlState("XX000"));
    assertEquals(StoreErrorKind.UNKNOWN, StoreErrorKind.fromSqlState(null));
    assertTrue(StoreErrorKind.SERIALIZATION_CONFLICT.retryable());
    assertFalse(StoreErrorKind.STATEMENT_TIMEOUT.retryable());
  }

  @Test
  void findsStateThroughCausesAndNextExceptions() {
    SQLException batch = new SQLException("batch entry failed");
    batch.setNextException(new SQLException("not null", "23502"));
    RuntimeException wrapped = new RuntimeException("wrapper", batch);

    assertEquals("23502", StoreErrorKind.sqlStateOf(wrapped));
    assertEquals(StoreErrorKind.NOT_NULL_VIOLATION, StoreErrorKind.classify(wrapped));
    assertNull(StoreErrorKind.sqlStateOf(new IllegalStateException("no sql here")));
  }

  @Test
  void classifyKeepsDetailsAndExistingSaveExceptions() {
    SaveException e = SaveException.classify("profiles", new SQLException("value too long", "22001"),
        Map.of("column", "bio"));
    assertEquals(StoreErrorKind.STRING_TOO_LONG, e.kind());
    assertEquals("profiles", e.partition());
    assertEquals("bio", e.details().get("column"));
    assertTrue(e.getMessage().contains("sqlState=22001"));
    assertSame(e, SaveException.classify("main", e, Map.of()));
  }
}
