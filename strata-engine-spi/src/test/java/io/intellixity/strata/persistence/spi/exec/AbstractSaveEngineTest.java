package io.intellixity.strata.persistence.spi.exec;

import io.intellixity.strata.persistence.delta.Change;
import io.intellixity.strata.persistence.delta.Delta;
import io.intellixity.strata.persistence.delta.EntityIdent;
import io.intellixity.strata.persistence.dmlast.DeleteAst;
import io.intellixity.strata.persistence.dmlast.DmlAst;
import io.intellixity.strata.persistence.dmlast.InsertAst;
import io.intellixity.strata.persistence.error.SaveException;
import io.intellixity.strata.persistence.error.SchemaConfigException;
import io.intellixity.strata.persistence.error.StoreErrorKind;
import io.intellixity.strata.persistence.exec.Retrier;
import io.intellixity.strata.persistence.exec.RetryPolicy;
import io.intellixity.strata.persistence.exec.SaveResult;
import io.intellixity.strata.persistence.exec.handle.EngineHandle;
import io.intellixity.strata.persistence.ids.IdGenerator;
import io.intellixity.strata.persistence.schema.AttrType;
import io.intellixity.strata.persistence.schema.AttributeDescriptor;
import io.intellixity.strata.persistence.schema.AttributeSchema;
import io.intellixity.strata.persistence.spi.bind.DiscoveredBinderRegistry;
import io.intellixity.strata.persistence.spi.sql.Dialect;
import io.intellixity.strata.persistence.spi.sql.NativeStatement;
import io.intellixity.strata.persistence.value.CodecRegistry;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractSaveEngineTest {

  private record Stmt(String text) implements NativeStatement {}

  private static final class TextDialect implements Dialect<Stmt> {
    @Override public String id() { return "text"; }
    @Override public Stmt renderDml(String namespace, DmlAst dml) {
      String verb = (dml instanceof InsertAst) ? "INSERT" : (dml instanceof DeleteAst) ? "DELETE" : "UPDATE";
      return new Stmt(verb + " " + namespace + "." + dml.table());
    }
    @Override public Stmt deferConstraints() { return null; }
    @Override public Stmt nextValues(String namespace, String sequence, int count) { throw new UnsupportedOperationException(); }
    @Override public Stmt selectByIds(String namespace, String table, List<String> columns, String matchColumn, String elemTypeId) {
      throw new UnsupportedOperationException();
    }
    @Override public Stmt aggregateByIds(String namespace, String table, String keyColumn, String valueColumn,
                                         String orderColumn, String elemTypeId) {
      throw new UnsupportedOperationException();
    }
  }

  private record Handle(String id) implements EngineHandle<Object> {
    @Override public Object client() { return new Object(); }
    @Override public String namespace() { return id; }
  }

  /** Records what the engine asked for; execute fails with the queued errors first. */
  private static final class RecordingEngine extends AbstractSaveEngine<Stmt, Handle> {
    final List<String> log = new ArrayList<>();
    final Deque<SaveException> failures = new ArrayDeque<>();
    final AtomicLong sequence = new AtomicLong(100);

    RecordingEngine(AttributeSchema schema, Map<String, Handle> handles, Retrier retrier) {
      super(new TextDialect(), schema, handles, retrier, fixedIds(), new DiscoveredBinderRegistry("text", List.of()));
    }

    @Override
    protected Map<String, List<Object>> allocate(Handle handle, String partition, Map<String, Integer> counts) {
      Map<String, List<Object>> out = new LinkedHashMap<>();
      counts.forEach((seq, n) -> {
        log.add("allocate " + partition + " " + seq + " x" + n);
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < n; i++) values.add(sequence.incrementAndGet());
        out.put(seq, values);
      });
      return out;
    }

    @Override
    protected void execute(Handle handle, String partition, List<Stmt> statements) {
      List<String> texts = new ArrayList<>();
      for (Stmt s : statements) texts.add(s.text());
      log.add("execute " + partition + " " + texts);
      SaveException next = failures.poll();
      if (next != null) throw next;
    }
  }

  private static IdGenerator fixedIds() {
    AtomicLong n = new AtomicLong();
    return identity -> new UUID(0L, n.incrementAndGet());
  }

  private static AttributeSchema schema() {
    return AttributeSchema.of(List.of(
        AttributeDescriptor.identity("account/id", AttrType.UUID, "main").withTable("accounts"),
        AttributeDescriptor.scalar("account/name", AttrType.STRING, "main", "account/id"),
        AttributeDescriptor.toMany("account/orders", "order/id", "order/account", "main", "account/id"),
        AttributeDescriptor.toOne("account/profile", "profile/id", "profiles", "account/id").withMirrorKey("profile/account"),
        AttributeDescriptor.identity("order/id", AttrType.LONG, "main").withTable("orders"),
        AttributeDescriptor.toOne("order/account", "account/id", "main", "order/id").withColumn("account_id"),
        AttributeDescriptor.scalar("order/note", AttrType.STRING, "main", "order/id"),
        AttributeDescriptor.identity("profile/id", AttrType.UUID, "profiles").withTable("profiles"),
        AttributeDescriptor.toOne("profile/account", "account/id", "profiles", "profile/id").withColumn("account_id"),
        AttributeDescriptor.scalar("profile/bio", AttrType.STRING, "profiles", "profile/id"),
        AttributeDescriptor.toOne("profile/firstOrder", "order/id", "profiles", "profile/id").withColumn("first_order_id")
    ), CodecRegistry.builtins());
  }

  private static Map<String, Handle> bothHandles() {
    return Map.of("main", new Handle("main"), "profiles", new Handle("profiles"));
  }

  private static SaveException conflict() {
    return SaveException.classify("main", new SQLException("could not serialize access", "40001"), null);
  }

  @Test
  void emptyDeltaDoesNoWork() {
    RecordingEngine engine = new RecordingEngine(schema(), bothHandles(), new Retrier(RetryPolicy.NONE));
    assertEquals(Map.of(), engine.save(Delta.empty()).tempIds());
    assertTrue(engine.log.isEmpty());
  }

  @Test
  void savesEachPartitionWithItsOwnIds() {
    RecordingEngine engine = new RecordingEngine(schema(), bothHandles(), new Retrier(RetryPolicy.NONE));
    EntityIdent acc = EntityIdent.temp("account/id");
    EntityIdent order = EntityIdent.temp("order/id");
    EntityIdent profile = EntityIdent.temp("profile/id");
    Delta d = Delta.builder()
        .set(acc, "account/name", "Ada")
        .put(acc, "account/orders", Change.refMany(Set.of(), Set.of(order)))
        .put(acc, "account/profile", Change.link(profile))
        .set(profile, "profile/bio", "hi")
        .build();

    SaveResult result = engine.save(d);

    assertEquals(List.of(
        "allocate main orders_id_seq x1",
        "execute main [INSERT main.accounts, INSERT main.orders]",
        "execute profiles [INSERT profiles.profiles]"), engine.log);
    assertEquals(101L, result.idOf(order.tempId()));
    assertEquals(new UUID(0L, 1L), result.idOf(acc.tempId()));
    assertEquals(new UUID(0L, 2L), result.idOf(profile.tempId()));
  }

  @Test
  void missingHandleFailsBeforeAnyIo() {
    RecordingEngine engine = new RecordingEngine(schema(), Map.of("main", new Handle("main")), new Retrier(RetryPolicy.NONE));
    EntityIdent acc = EntityIdent.of("account/id", UUID.randomUUID());
    Delta d = Delta.builder()
        .set(acc, "account/name", "Ada")
        .put(acc, "account/profile", Change.link(EntityIdent.temp("profile/id")))
        .build();

    SchemaConfigException ex = assertThrows(SchemaConfigException.class, () -> engine.save(d));
    assertTrue(ex.getMessage().contains("partition profiles"));
    assertTrue(engine.log.isEmpty());
  }

  @Test
  void retriedPartitionAllocatesFreshIds() {
    List<Duration> slept = new ArrayList<>();
    RecordingEngine engine = new RecordingEngine(schema(), bothHandles(), new Retrier(RetryPolicy.DEFAULT, slept::add));
    engine.failures.add(conflict());
    EntityIdent order = EntityIdent.temp("order/id");
    Delta d = Delta.builder().set(order, "order/note", "gift").build();

    SaveResult result = engine.save(d);

    assertEquals(List.of(
        "allocate main orders_id_seq x1",
        "execute main [INSERT main.orders]",
        "allocate main orders_id_seq x1",
        "execute main [INSERT main.orders]"), engine.log);
    assertEquals(102L, result.idOf(order.tempId()));
    assertEquals(List.of(Duration.ofMillis(100)), slept);
  }

  @Test
  void fatalErrorStopsTheSave() {
    RecordingEngine engine = new RecordingEngine(schema(), bothHandles(), new Retrier(RetryPolicy.DEFAULT, d -> fail("no retry")));
    engine.failures.add(SaveException.classify("main", new SQLException("duplicate key", "23505"), null));
    Delta d = Delta.builder().set(EntityIdent.of("account/id", UUID.randomUUID()), "account/name", "Ada").build();

    SaveException ex = assertThrows(SaveException.class, () -> engine.save(d));
    assertEquals(StoreErrorKind.UNIQUENESS_VIOLATION, ex.kind());
    assertEquals(1, engine.log.size());
  }

  @Test
  void partitionUsingAnotherPartitionsSequenceIdRunsAfterIt() {
    RecordingEngine engine = new RecordingEngine(schema(), bothHandles(), new Retrier(RetryPolicy.NONE));
    EntityIdent profile = EntityIdent.temp("profile/id");
    EntityIdent order = EntityIdent.temp("order/id");
    Delta d = Delta.builder()
        .put(profile, "profile/firstOrder", Change.link(order))
        .set(order, "order/note", "first")
        .build();

    engine.save(d);
    assertEquals(List.of(
        "allocate main orders_id_seq x1",
        "execute main [INSERT main.orders]",
        "execute profiles [INSERT profiles.profiles]"), engine.log);
  }

  @Test
  void invalidDeltaIsRejectedUpFront() {
    RecordingEngine engine = new RecordingEngine(schema(), bothHandles(), new Retrier(RetryPolicy.NONE));
    Delta d = Delta.builder().set(EntityIdent.of("account/id", UUID.randomUUID()), "order/note", "x").build();
    assertThrows(SchemaConfigException.class, () -> engine.save(d));
    assertTrue(engine.log.isEmpty());
  }
}
