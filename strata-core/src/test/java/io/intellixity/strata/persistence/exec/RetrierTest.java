package io.intellixity.strata.persistence.exec;

import io.intellixity.strata.persistence.error.SaveException;
import io.intellixity.strata.persistence.error.StoreErrorKind;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class RetrierTest {
  private final List<Duration> slept = new ArrayList<>();
  private final Retrier retrier = new Retrier(RetryPolicy.DEFAULT, slept::add);

  private static SaveException conflict() {
    return SaveException.classify("main", new SQLException("could not serialize access", "40001"), null);
  }

  private static SaveException duplicate() {
    return SaveException.classify("main", new SQLException("duplicate key", "23505"), null);
  }

  @Test
  void defaultPolicyBacksOffAndCaps() {
    assertEquals(Duration.ofMillis(100), RetryPolicy.DEFAULT.delayBefore(1));
    assertEquals(Duration.ofMillis(200), RetryPolicy.DEFAULT.delayBefore(2));
    assertEquals(Duration.ofMillis(200), RetryPolicy.DEFAULT.delayBefore(4));
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.DEFAULT.delayBefore(0));
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, Duration.ZERO, Duration.ZERO, 1.0));
  }

  @Test
  void retriesSerializationConflictsUntilSuccess() {
    AtomicInteger tries = new AtomicInteger();
    String out = retrier.run("partition=main", () ->
        tries.incrementAndGet() < 3 ? Attempt.failed(conflict()) : Attempt.ok("done"));

    assertEquals("done", out);
    assertEquals(3, tries.get());
    assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), slept);
  }

  @Test
  void givesUpAfterMaxRetries() {
    AtomicInteger tries = new AtomicInteger();
    SaveException ex = assertThrows(SaveException.class, () -> retrier.run("partition=main", () -> {
      tries.incrementAndGet();
      return Attempt.failed(conflict());
    }));

    assertEquals(StoreErrorKind.SERIALIZATION_CONFLICT, ex.kind());
    assertEquals(5, tries.get());
    assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(200), Duration.ofMillis(200)), slept);
  }

  @Test
  void fatalFailuresAreNotRetried() {
    AtomicInteger tries = new AtomicInteger();
    SaveException ex = assertThrows(SaveException.class, () -> retrier.run("partition=main", () -> {
      tries.incrementAndGet();
      return Attempt.failed(duplicate());
    }));

    assertEquals(StoreErrorKind.UNIQUENESS_VIOLATION, ex.kind());
    assertEquals("23505", ex.sqlState());
    assertEquals(1, tries.get());
    assertTrue(slept.isEmpty());
  }

  @Test
  void noRetryPolicyStopsAtFirstConflict() {
    Retrier none = new Retrier(RetryPolicy.NONE, slept::add);
    assertThrows(SaveException.class, () -> none.run("partition=main", () -> Attempt.failed(conflict())));
    assertTrue(slept.isEmpty());
  }
}
