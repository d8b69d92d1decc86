package io.intellixity.strata.persistence.spi.exec;

import io.intellixity.strata.persistence.analysis.DeltaAnalyzer;
import io.intellixity.strata.persistence.delta.Delta;
import io.intellixity.strata.persistence.delta.TempId;
import io.intellixity.strata.persistence.dmlast.DmlAst;
import io.intellixity.strata.persistence.dmlast.SqlPlan;
import io.intellixity.strata.persistence.dmlast.SqlPlanGenerator;
import io.intellixity.strata.persistence.error.SaveException;
import io.intellixity.strata.persistence.error.SchemaConfigException;
import io.intellixity.strata.persistence.exec.Attempt;
import io.intellixity.strata.persistence.exec.Retrier;
import io.intellixity.strata.persistence.exec.RetryPolicy;
import io.intellixity.strata.persistence.exec.SaveEngine;
import io.intellixity.strata.persistence.exec.SaveResult;
import io.intellixity.strata.persistence.exec.handle.EngineHandle;
import io.intellixity.strata.persistence.ids.IdAllocation;
import io.intellixity.strata.persistence.ids.IdGenerator;
import io.intellixity.strata.persistence.ids.IdentifierPlan;
import io.intellixity.strata.persistence.ids.IdentifierPlanner;
import io.intellixity.strata.persistence.ids.ResolvedIds;
import io.intellixity.strata.persistence.ids.SequenceTarget;
import io.intellixity.strata.persistence.schema.AttributeSchema;
import io.intellixity.strata.persistence.spi.bind.DiscoveredBinderRegistry;
import io.intellixity.strata.persistence.spi.sql.Dialect;
import io.intellixity.strata.persistence.spi.sql.NativeStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Template-method orchestrator for the write path.\n
 *
 * Order of work in {@link #save(Delta)}:\n
 * - validate and expand references ({@link DeltaAnalyzer})\n
 * - check every touched partition has a handle (fails before any I/O)\n
 * - plan temporary ids and generate the local ones\n
 * - order partitions so owners of sequence-backed ids run before partitions referencing them\n
 * - per partition, one retry unit: allocate its sequence ids, generate its plan, execute it\n
 *
 * A retried unit allocates fresh sequence values; nothing from a failed try is reused. Partitions commit
 * independently: there is no cross-partition atomicity.
 */
public abstract class AbstractSaveEngine<S extends NativeStatement, H extends EngineHandle<?>> implements SaveEngine {
  private static final Logger log = LoggerFactory.getLogger(AbstractSaveEngine.class);

  private final Dialect<S> dialect;
  private final AttributeSchema schema;
  private final Map<String, H> handles;
  private final DeltaAnalyzer analyzer;
  private final Retrier retrier;
  private final IdGenerator idGenerator;
  private final DiscoveredBinderRegistry binders;

  /**
   * DI-friendly constructor: callers provide the supporting collaborators.\n
   *
   * This makes it easy to override retry timing or id generation in tests.\n
   */
  protected AbstractSaveEngine(Dialect<S> dialect,
                               AttributeSchema schema,
                               Map<String, H> handles,
                               Retrier retrier,
                               IdGenerator idGenerator,
                               DiscoveredBinderRegistry binders) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.schema = Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(handles, "handles");
    this.handles = Collections.unmodifiableMap(new LinkedHashMap<>(handles));
    this.analyzer = new DeltaAnalyzer(schema);
    this.retrier = Objects.requireNonNull(retrier, "retrier");
    this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    this.binders = Objects.requireNonNull(binders, "binders");
  }

  protected AbstractSaveEngine(Dialect<S> dialect, AttributeSchema schema, Map<String, H> handles) {
    this(dialect, schema, handles,
        new Retrier(RetryPolicy.DEFAULT),
        IdGenerator.randomUuid(),
        new DiscoveredBinderRegistry(Objects.requireNonNull(dialect, "dialect").id()));
  }

  @Override
  public final SaveResult save(Delta delta) {
    Objects.requireNonNull(delta, "delta");
    if (delta.isEmpty()) return new SaveResult(Map.of());

    analyzer.validate(delta);
    Delta expanded = analyzer.expandReferences(delta);
    IdentifierPlan plan = IdentifierPlanner.plan(schema, expanded);

    Set<String> partitions = new LinkedHashSet<>(analyzer.touchedPartitions(expanded));
    partitions.addAll(plan.sequencePartitions());
    for (String p : partitions) handle(p);

    ResolvedIds resolved = ResolvedIds.of(IdAllocation.generateLocal(plan, schema, idGenerator));
    List<String> order = orderPartitions(partitions, plan, expanded);
    log.debug("strata.save entities={} partitions={} sequenceIds={} localIds={}",
        expanded.size(), order, plan.sequenceIds().size(), plan.localIds().size());

    for (String partition : order) {
      H h = handle(partition);
      ResolvedIds base = resolved;
      resolved = retrier.run("partition=" + partition, () -> attempt(partition, h, plan, base, expanded));
    }
    return new SaveResult(resolved.asMap());
  }

  private Attempt<ResolvedIds> attempt(String partition, H h, IdentifierPlan plan, ResolvedIds base, Delta delta) {
    try {
      Map<TempId, Object> allocated = new LinkedHashMap<>();
      IdAllocation.allocateSequences(plan, partition, (p, counts) -> allocate(h, p, counts)).forEach((t, raw) ->
          allocated.put(t, schema.codec(plan.sequenceIds().get(t).identityKey()).decode(raw)));
      ResolvedIds ids = allocated.isEmpty() ? base : base.merge(allocated);

      SqlPlan sqlPlan = SqlPlanGenerator.generate(schema, partition, ids, delta);
      if (!sqlPlan.isEmpty()) {
        List<S> statements = new ArrayList<>(sqlPlan.size());
        for (DmlAst dml : sqlPlan.statements()) statements.add(dialect.renderDml(h.namespace(), dml));
        execute(h, partition, statements);
      }
      return Attempt.ok(ids);
    } catch (SaveException e) {
      return Attempt.failed(e);
    }
  }

  /**
   * Partitions in first-seen order, except that a partition whose entities mention a sequence-backed temporary
   * id owned by another partition runs after that partition.
   */
  final List<String> orderPartitions(Set<String> partitions, IdentifierPlan plan, Delta delta) {
    Map<String, Set<String>> dependsOn = new LinkedHashMap<>();
    for (String p : partitions) dependsOn.put(p, new LinkedHashSet<>());
    for (var e : delta.entries().entrySet()) {
      String p = schema.requireIdentity(e.getKey().identityKey()).partition();
      for (TempId t : IdentifierPlanner.tempIdsOf(e.getKey(), e.getValue())) {
        SequenceTarget owner = plan.sequenceIds().get(t);
        if (owner != null && !owner.partition().equals(p)) dependsOn.get(p).add(owner.partition());
      }
    }

    List<String> out = new ArrayList<>();
    Set<String> visiting = new HashSet<>();
    for (String p : partitions) visit(p, dependsOn, visiting, out);
    return out;
  }

  private static void visit(String p, Map<String, Set<String>> dependsOn, Set<String> visiting, List<String> out) {
    if (out.contains(p)) return;
    if (!visiting.add(p)) {
      throw new SchemaConfigException("Cyclic sequence id dependency between partitions involving " + p);
    }
    for (String q : dependsOn.getOrDefault(p, Set.of())) visit(q, dependsOn, visiting, out);
    visiting.remove(p);
    out.add(p);
  }

  protected final H handle(String partition) {
    H h = handles.get(partition);
    if (h == null) {
      throw new SchemaConfigException("No handle configured for partition " + partition +
          "; available partitions=" + handles.keySet());
    }
    return h;
  }

  protected final Dialect<S> dialect() { return dialect; }
  protected final DiscoveredBinderRegistry binders() { return binders; }

  // --- Backend-specific hooks ---

  /**
   * Allocates {@code counts} values per sequence with one round trip per sequence on one session.
   * Store failures are thrown as classified {@link SaveException}s.
   */
  protected abstract Map<String, List<Object>> allocate(H handle, String partition, Map<String, Integer> counts);

  /**
   * Runs {@code statements} in order inside one serializable transaction with deferred constraints and commits.
   * Store failures roll back and are thrown as classified {@link SaveException}s.
   */
  protected abstract void execute(H handle, String partition, List<S> statements);
}
