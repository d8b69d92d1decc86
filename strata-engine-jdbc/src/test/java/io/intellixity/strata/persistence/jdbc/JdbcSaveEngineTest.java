package io.intellixity.strata.persistence.jdbc;

import io.intellixity.strata.persistence.delta.Change;
import io.intellixity.strata.persistence.delta.Delta;
import io.intellixity.strata.persistence.delta.EntityIdent;
import io.intellixity.strata.persistence.error.SaveException;
import io.intellixity.strata.persistence.error.StoreErrorKind;
import io.intellixity.strata.persistence.exec.Retrier;
import io.intellixity.strata.persistence.exec.RetryPolicy;
import io.intellixity.strata.persistence.exec.SaveResult;
import io.intellixity.strata.persistence.ids.IdGenerator;
import io.intellixity.strata.persistence.spi.bind.DiscoveredBinderRegistry;
import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcSaveEngineTest {
  private final FakeJdbc main = new FakeJdbc();
  private final FakeJdbc profiles = new FakeJdbc();
  private final List<Duration> slept = new ArrayList<>();
  private final AtomicLong sequence = new AtomicLong(500);

  private final UUID ada = UUID.randomUUID();
  private final EntityIdent account = EntityIdent.of("account/id", ada);

  JdbcSaveEngineTest() {
    main.rows = sql -> sql.contains("nextval") ? rows(new Object[] {sequence.incrementAndGet()}) : List.of();
  }

  private static List<Object[]> rows(Object[]... rs) {
    return Arrays.asList(rs);
  }

  private JdbcSaveEngine engine() {
    return new JdbcSaveEngine(new TestDialect(), JdbcTestSchemas.accounts(),
        Map.of("main", new JdbcHandle("main-db", main.dataSource(), "app"),
            "profiles", new JdbcHandle("profiles-db", profiles.dataSource())),
        new Retrier(RetryPolicy.DEFAULT, slept::add),
        IdGenerator.randomUuid(),
        new DiscoveredBinderRegistry("test"));
  }

  @Test
  void allocatesThenWritesInOneSerializableTransaction() {
    EntityIdent order = EntityIdent.temp("order/id");
    Instant placed = Instant.parse("2024-05-01T08:00:00Z");
    Delta d = Delta.builder()
        .put(account, "account/name", Change.scalar("Ada", "Ada L"))
        .put(account, "account/orders", Change.refMany(Set.of(), Set.of(order)))
        .set(order, "order/placedAt", placed)
        .build();

    SaveResult result = engine().save(d);

    assertEquals(501L, result.idOf(order.tempId()));
    assertEquals(List.of(
        "prepare SELECT nextval('\"app\".\"orders_id_seq\"') FROM generate_series(1, ?)",
        "bind 1 1",
        "executeQuery",
        "close",
        "isolation 8",
        "autoCommit false",
        "prepare SET CONSTRAINTS ALL DEFERRED",
        "executeUpdate",
        "prepare UPDATE \"app\".\"accounts\" SET \"name\" = ? WHERE \"id\" = ?",
        "bind 1 Ada L",
        "bind 2 " + ada,
        "executeUpdate",
        "prepare INSERT INTO \"app\".\"orders\" (\"id\", \"placed_at\", \"account_id\") VALUES (?, ?, ?)",
        "bind 1 501",
        "bind 2 " + Timestamp.from(placed),
        "bind 3 " + ada,
        "executeUpdate",
        "commit",
        "autoCommit true",
        "close"), main.events);
    assertTrue(profiles.events.isEmpty());
    assertEquals(2, main.connectionsOpened());
  }

  @Test
  void deletesOrphansBeforeInserting() {
    EntityIdent oldOrder = EntityIdent.of("order/id", 7L);
    EntityIdent newOrder = EntityIdent.temp("order/id");
    Delta d = Delta.builder()
        .set(newOrder, "order/placedAt", Instant.parse("2024-05-02T08:00:00Z"))
        .put(account, "account/orders", Change.refMany(Set.of(oldOrder), Set.of(newOrder)))
        .build();

    engine().save(d);

    List<String> prepared = main.events("prepare");
    assertEquals(List.of(
        "prepare SELECT nextval('\"app\".\"orders_id_seq\"') FROM generate_series(1, ?)",
        "prepare SET CONSTRAINTS ALL DEFERRED",
        "prepare DELETE FROM \"app\".\"orders\" WHERE \"id\" = ?",
        "prepare INSERT INTO \"app\".\"orders\" (\"id\", \"placed_at\", \"account_id\") VALUES (?, ?, ?)"), prepared);
  }

  @Test
  void serializationFailureRetriesWithFreshIds() {
    main.failOn("INSERT INTO", "40001");
    EntityIdent order = EntityIdent.temp("order/id");
    Delta d = Delta.builder()
        .put(account, "account/orders", Change.refMany(Set.of(), Set.of(order)))
        .build();

    SaveResult result = engine().save(d);

    assertEquals(502L, result.idOf(order.tempId()));
    assertEquals(2, main.events("prepare SELECT nextval").size());
    assertEquals(List.of("rollback"), main.events("rollback"));
    assertEquals(List.of("commit"), main.events("commit"));
    assertEquals(List.of(Duration.ofMillis(100)), slept);
  }

  @Test
  void constraintViolationRollsBackAndIsNotRetried() {
    main.failOn("UPDATE", "23505");
    Delta d = Delta.builder().put(account, "account/name", Change.scalar("Ada", "Bob")).build();

    SaveException ex = assertThrows(SaveException.class, () -> engine().save(d));

    assertEquals(StoreErrorKind.UNIQUENESS_VIOLATION, ex.kind());
    assertEquals("main", ex.partition());
    assertEquals("23505", ex.sqlState());
    assertEquals(List.of("rollback"), main.events("rollback"));
    assertTrue(main.events("commit").isEmpty());
    assertEquals(List.of("autoCommit false", "autoCommit true"), main.events("autoCommit"));
    assertEquals("close", main.events.get(main.events.size() - 1));
    assertTrue(slept.isEmpty());
  }

  @Test
  void allocationFailureStopsBeforeTheTransaction() {
    main.failOn("nextval", "08006");
    Delta d = Delta.builder()
        .put(account, "account/orders", Change.refMany(Set.of(), Set.of(EntityIdent.temp("order/id"))))
        .build();

    SaveException ex = assertThrows(SaveException.class, () -> engine().save(d));

    assertEquals(StoreErrorKind.CONNECTION_UNAVAILABLE, ex.kind());
    assertTrue(main.events("isolation").isEmpty());
    assertEquals(1, main.connectionsOpened());
  }

  @Test
  void eachPartitionUsesItsOwnHandle() {
    EntityIdent profile = EntityIdent.temp("profile/id");
    Delta d = Delta.builder()
        .put(account, "account/profile", Change.link(profile))
        .set(profile, "profile/bio", "hello")
        .build();

    UUID profileId = (UUID) engine().save(d).idOf(profile.tempId());

    assertTrue(main.events.isEmpty());
    assertEquals(List.of(
        "prepare SET CONSTRAINTS ALL DEFERRED",
        "prepare INSERT INTO \"profiles\" (\"id\", \"bio\", \"account_id\") VALUES (?, ?, ?)"), profiles.events("prepare"));
    assertTrue(profiles.events.contains("bind 1 " + profileId));
  }
}
