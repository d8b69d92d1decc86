package io.intellixity.strata.persistence.delta;

import java.util.*;

/**
 * Requested write: entities in caller order, each with its attribute changes.\n
 *
 * Immutable. Build with {@link #builder()}; {@link #toBuilder()} copies into a fresh builder.
 */
public final class Delta {
  private static final Delta EMPTY = new Delta(Map.of());

  private final Map<EntityIdent, EntityDelta> entries;

  private Delta(Map<EntityIdent, EntityDelta> entries) {
    this.entries = entries;
  }

  public static Delta empty() { return EMPTY; }

  public static Builder builder() { return new Builder(); }

  public Map<EntityIdent, EntityDelta> entries() { return entries; }

  public Set<EntityIdent> idents() { return entries.keySet(); }

  public EntityDelta get(EntityIdent ident) { return entries.get(ident); }

  public boolean isEmpty() { return entries.isEmpty(); }

  public int size() { return entries.size(); }

  public Builder toBuilder() {
    Builder b = new Builder();
    for (var e : entries.entrySet()) {
      b.touch(e.getKey());
      if (e.getValue().deleted()) b.delete(e.getKey());
      for (var c : e.getValue().changes().entrySet()) b.put(e.getKey(), c.getKey(), c.getValue());
    }
    return b;
  }

  @Override
  public boolean equals(Object o) {
    return (o instanceof Delta d) && entries.equals(d.entries);
  }

  @Override
  public int hashCode() { return entries.hashCode(); }

  @Override
  public String toString() { return "Delta" + entries; }

  public static final class Builder {
    private final Map<EntityIdent, Map<String, Change>> changes = new LinkedHashMap<>();
    private final Set<EntityIdent> deleted = new HashSet<>();

    private Builder() {}

    /** Registers the entity (keeps ordering) without adding a change. */
    public Builder touch(EntityIdent ident) {
      Objects.requireNonNull(ident, "ident");
      changes.computeIfAbsent(ident, k -> new LinkedHashMap<>());
      return this;
    }

    public Builder put(EntityIdent ident, String key, Change change) {
      replace(ident, key, change);
      return this;
    }

    /** Like {@link #put} but hands back the change previously stored under (ident, key), or null. */
    public Change replace(EntityIdent ident, String key, Change change) {
      Objects.requireNonNull(ident, "ident");
      if (key == null || key.isBlank()) throw new IllegalArgumentException("key is required");
      Objects.requireNonNull(change, "change");
      return changes.computeIfAbsent(ident, k -> new LinkedHashMap<>()).put(key, change);
    }

    public Builder set(EntityIdent ident, String key, Object after) {
      return put(ident, key, Change.set(after));
    }

    public Builder delete(EntityIdent ident) {
      touch(ident);
      deleted.add(ident);
      return this;
    }

    public Change peek(EntityIdent ident, String key) {
      Map<String, Change> m = changes.get(ident);
      return m == null ? null : m.get(key);
    }

    public Delta build() {
      Map<EntityIdent, EntityDelta> out = new LinkedHashMap<>();
      for (var e : changes.entrySet()) {
        out.put(e.getKey(), new EntityDelta(e.getValue(), deleted.contains(e.getKey())));
      }
      return new Delta(Collections.unmodifiableMap(out));
    }
  }
}
