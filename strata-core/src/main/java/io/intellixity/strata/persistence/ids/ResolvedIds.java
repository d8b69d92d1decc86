package io.intellixity.strata.persistence.ids;

import io.intellixity.strata.persistence.delta.EntityIdent;
import io.intellixity.strata.persistence.delta.TempId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Immutable temporary id to real id map for one save. */
public final class ResolvedIds {
  private static final ResolvedIds EMPTY = new ResolvedIds(Map.of());

  private final Map<TempId, Object> ids;

  private ResolvedIds(Map<TempId, Object> ids) {
    this.ids = ids;
  }

  public static ResolvedIds empty() { return EMPTY; }

  public static ResolvedIds of(Map<TempId, Object> ids) {
    Objects.requireNonNull(ids, "ids");
    for (var e : ids.entrySet()) {
      Objects.requireNonNull(e.getKey(), "tempId");
      if (e.getValue() == null) throw new IllegalArgumentException("No id for " + e.getKey());
    }
    return new ResolvedIds(Collections.unmodifiableMap(new LinkedHashMap<>(ids)));
  }

  public ResolvedIds merge(Map<TempId, Object> more) {
    Map<TempId, Object> m = new LinkedHashMap<>(ids);
    m.putAll(more);
    return of(m);
  }

  public ResolvedIds merge(ResolvedIds more) {
    return merge(more.ids);
  }

  public Map<TempId, Object> asMap() { return ids; }

  public boolean contains(TempId t) { return ids.containsKey(t); }

  public Object require(TempId t) {
    Object v = ids.get(t);
    if (v == null) throw new IllegalStateException("Unresolved temporary id: " + t);
    return v;
  }

  /** Store id of {@code ident}: its own id, or the resolved one when temporary. */
  public Object idOf(EntityIdent ident) {
    return ident.isTemp() ? require(ident.tempId()) : ident.id();
  }

  /** Rewrites a {@link TempId} or temporary {@link EntityIdent}; other values pass through. */
  public Object resolve(Object value) {
    if (value instanceof TempId t) return require(t);
    if (value instanceof EntityIdent i && i.isTemp()) return new EntityIdent(i.identityKey(), require(i.tempId()));
    return value;
  }

  @Override
  public String toString() { return "ResolvedIds" + ids; }
}
