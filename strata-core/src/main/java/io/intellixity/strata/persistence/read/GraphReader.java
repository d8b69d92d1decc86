package io.intellixity.strata.persistence.read;

import io.intellixity.strata.persistence.schema.AttributeDescriptor;
import io.intellixity.strata.persistence.schema.AttributeSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Resolves a batch of identities against a {@link Selection} using generated resolvers.\n
 *
 * Each level of the selection tree calls the id resolver once and every selected ref resolver once, for the
 * whole batch of that level. With an {@link Executor}, the ref resolvers of the root level run concurrently;
 * results are merged by identity in request order regardless of completion order.\n
 *
 * Output is positionally aligned with the input ids: an unknown id gives {@code null}, an absent to-one gives
 * {@code null}, an absent to-many gives an empty list. The {@link Redactor} sees the final results.
 */
public final class GraphReader {
  private static final Logger log = LoggerFactory.getLogger(GraphReader.class);

  private final AttributeSchema schema;
  private final ResolverSet resolvers;
  private final Executor executor;
  private final Redactor redactor;

  public GraphReader(AttributeSchema schema, ResolverSet resolvers) {
    this(schema, resolvers, null, Redactor.none());
  }

  public GraphReader(AttributeSchema schema, ResolverSet resolvers, Executor executor, Redactor redactor) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.resolvers = Objects.requireNonNull(resolvers, "resolvers");
    this.executor = executor;
    this.redactor = Objects.requireNonNull(redactor, "redactor");
  }

  public List<Map<String, Object>> read(String identityKey, List<?> ids, Selection selection) {
    schema.requireIdentity(identityKey);
    Objects.requireNonNull(ids, "ids");
    Selection sel = (selection == null) ? Selection.empty() : selection;
    if (ids.isEmpty()) return List.of();

    List<Object> distinct = distinct(ids);
    log.debug("strata.read identity={} ids={} distinct={} selection={}", identityKey, ids.size(), distinct.size(), sel);
    Map<Object, Map<String, Object>> shaped = readLevel(identityKey, distinct, sel, null, executor);

    List<Map<String, Object>> out = new ArrayList<>(ids.size());
    for (Object id : ids) out.add(id == null ? null : shaped.get(id));
    List<Map<String, Object>> redacted = redactor.redact(identityKey, Collections.unmodifiableList(out));
    if (redacted == null || redacted.size() != ids.size()) {
      throw new IllegalStateException("Redactor must return one result per id for " + identityKey);
    }
    return redacted;
  }

  /** Reads one entity; {@code null} when it does not exist. */
  public Map<String, Object> readOne(String identityKey, Object id, Selection selection) {
    Objects.requireNonNull(id, "id");
    return read(identityKey, List.of(id), selection).get(0);
  }

  private Map<Object, Map<String, Object>> readLevel(String identityKey, List<Object> ids, Selection sel,
                                                     Map<Object, Map<String, Object>> preloaded, Executor exec) {
    if (ids.isEmpty()) return Map.of();
    String home = schema.requireIdentity(identityKey).partition();
    List<AttributeDescriptor> refs = new ArrayList<>();
    List<String> scalars = new ArrayList<>();
    for (String key : sel.keys()) {
      if (key.equals(identityKey)) continue;
      AttributeDescriptor d = schema.require(key);
      if (!d.identities().contains(identityKey)) {
        throw new IllegalArgumentException("Attribute " + key + " is not stored on " + identityKey);
      }
      if (d.isRef()) {
        refs.add(d);
      } else if (!home.equals(d.partition())) {
        // id rows only carry columns of the identity's own table
        throw new IllegalArgumentException("Attribute " + key + " lives in partition " + d.partition()
            + ", not in " + home + " with " + identityKey);
      } else {
        scalars.add(key);
      }
    }

    Map<Object, Map<String, Object>> rows = (preloaded != null) ? preloaded : fetchRows(identityKey, ids);

    List<Object> present = new ArrayList<>();
    Map<Object, Map<String, Object>> out = new LinkedHashMap<>();
    for (Object id : ids) {
      if (!rows.containsKey(id)) continue;
      present.add(id);
      Map<String, Object> m = new LinkedHashMap<>();
      m.put(identityKey, id);
      out.put(id, m);
    }

    for (String key : scalars) {
      for (Object id : present) out.get(id).put(key, rows.get(id).get(key));
    }
    if (refs.isEmpty() || present.isEmpty()) return out;

    List<Map<Object, Object>> values = runAll(refs, d -> () -> resolveRef(identityKey, d, present, rows, sel.child(d.key())), exec);
    for (int i = 0; i < refs.size(); i++) {
      AttributeDescriptor d = refs.get(i);
      Map<Object, Object> byParent = values.get(i);
      Object absent = d.isToMany() ? List.of() : null;
      for (Object id : present) out.get(id).put(d.key(), byParent.getOrDefault(id, absent));
    }
    return out;
  }

  private Map<Object, Map<String, Object>> fetchRows(String identityKey, List<Object> ids) {
    BatchResolver r = resolvers.idResolver(identityKey);
    return indexRows(r, ids, r.resolve(ids));
  }

  private Map<Object, Object> resolveRef(String identityKey, AttributeDescriptor d, List<Object> parents,
                                         Map<Object, Map<String, Object>> rows, Selection child) {
    String target = d.target();
    BatchResolver r = resolvers.refResolver(identityKey, d.key());
    if (r == null) throw new IllegalArgumentException("No resolver for " + d.key() + " on " + identityKey);

    Map<Object, Object> out = new LinkedHashMap<>();
    switch (r.kind()) {
      case ALIAS -> {
        Map<Object, Object> fkByParent = new LinkedHashMap<>();
        for (Object p : parents) {
          Object fk = foreignKey(rows.get(p).get(d.key()), target);
          if (fk != null) fkByParent.put(p, fk);
        }
        List<Object> targetIds = distinct(fkByParent.values());
        if (targetIds.isEmpty()) return out;
        Map<Object, Map<String, Object>> shaped;
        if (child.isEmpty()) {
          shaped = new LinkedHashMap<>();
          for (Object t : targetIds) shaped.put(t, idOnly(target, t));
        } else {
          Map<Object, Map<String, Object>> targetRows = indexRows(r, targetIds, r.resolve(targetIds));
          shaped = readLevel(target, targetIds, child, targetRows, null);
        }
        for (var e : fkByParent.entrySet()) out.put(e.getKey(), shaped.get(e.getValue()));
      }
      case TO_ONE -> {
        List<Object> found = r.resolve(parents);
        requireAligned(r, parents, found);
        Map<Object, Object> tidByParent = new LinkedHashMap<>();
        Map<Object, Map<String, Object>> targetRows = new LinkedHashMap<>();
        for (int i = 0; i < parents.size(); i++) {
          Map<String, Object> row = asRow(r, found.get(i));
          if (row == null) continue;
          Object tid = row.get(target);
          tidByParent.put(parents.get(i), tid);
          targetRows.put(tid, row);
        }
        Map<Object, Map<String, Object>> shaped = readLevel(target, new ArrayList<>(targetRows.keySet()), child, targetRows, null);
        for (var e : tidByParent.entrySet()) out.put(e.getKey(), shaped.get(e.getValue()));
      }
      case TO_MANY -> {
        List<Object> found = r.resolve(parents);
        requireAligned(r, parents, found);
        Map<Object, List<Object>> tidsByParent = new LinkedHashMap<>();
        List<Object> all = new ArrayList<>();
        for (int i = 0; i < parents.size(); i++) {
          List<Object> tids = asList(found.get(i));
          tidsByParent.put(parents.get(i), tids);
          all.addAll(tids);
        }
        List<Object> targetIds = distinct(all);
        Map<Object, Map<String, Object>> shaped;
        if (child.isEmpty()) {
          shaped = new LinkedHashMap<>();
          for (Object t : targetIds) shaped.put(t, idOnly(target, t));
        } else {
          shaped = readLevel(target, targetIds, child, null, null);
        }
        for (var e : tidsByParent.entrySet()) {
          List<Object> members = new ArrayList<>(e.getValue().size());
          for (Object t : e.getValue()) {
            Map<String, Object> m = shaped.get(t);
            if (m != null) members.add(m);
          }
          out.put(e.getKey(), Collections.unmodifiableList(members));
        }
      }
      default -> throw new IllegalArgumentException("Resolver " + r.name() + " of kind " + r.kind() + " cannot resolve ref " + d.key());
    }
    return out;
  }

  private <T> List<T> runAll(List<AttributeDescriptor> refs,
                             Function<AttributeDescriptor, Supplier<T>> task, Executor exec) {
    List<T> out = new ArrayList<>(refs.size());
    if (exec == null || refs.size() == 1) {
      for (AttributeDescriptor d : refs) out.add(task.apply(d).get());
      return out;
    }
    List<CompletableFuture<T>> futures = new ArrayList<>(refs.size());
    for (AttributeDescriptor d : refs) futures.add(CompletableFuture.supplyAsync(task.apply(d), exec));
    try {
      for (CompletableFuture<T> f : futures) out.add(f.join());
    } catch (CompletionException e) {
      Throwable c = e.getCause();
      if (c instanceof RuntimeException re) throw re;
      if (c instanceof Error err) throw err;
      throw e;
    }
    return out;
  }

  private static Map<Object, Map<String, Object>> indexRows(BatchResolver r, List<Object> ids, List<Object> found) {
    requireAligned(r, ids, found);
    Map<Object, Map<String, Object>> out = new LinkedHashMap<>();
    for (int i = 0; i < ids.size(); i++) {
      Map<String, Object> row = asRow(r, found.get(i));
      if (row != null) out.put(ids.get(i), row);
    }
    return out;
  }

  private static void requireAligned(BatchResolver r, List<Object> ids, List<Object> found) {
    if (found == null || found.size() != ids.size()) {
      throw new IllegalStateException("Resolver " + r.name() + " returned " + (found == null ? 0 : found.size()) +
          " results for " + ids.size() + " ids");
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asRow(BatchResolver r, Object v) {
    if (v == null) return null;
    if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
    throw new IllegalStateException("Resolver " + r.name() + " returned a non-row value: " + v.getClass().getName());
  }

  private static List<Object> asList(Object v) {
    if (v == null) return List.of();
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    throw new IllegalStateException("To-many result is not a collection: " + v.getClass().getName());
  }

  private static Object foreignKey(Object v, String targetIdentity) {
    if (v instanceof Map<?, ?> m) return m.get(targetIdentity);
    return v;
  }

  private static Map<String, Object> idOnly(String identityKey, Object id) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(identityKey, id);
    return m;
  }

  private static List<Object> distinct(Collection<?> ids) {
    Set<Object> seen = new LinkedHashSet<>();
    for (Object id : ids) if (id != null) seen.add(id);
    return new ArrayList<>(seen);
  }
}
