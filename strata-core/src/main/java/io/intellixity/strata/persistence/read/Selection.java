package io.intellixity.strata.persistence.read;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * Requested attribute shape for a graph read, nested to any depth.\n
 *
 * Each entry is an attribute key; ref attributes may carry a child selection for the target entity. A ref
 * without a child selection returns only the target identity.\n
 *
 * JSON form: {@code ["account/name", {"account/orders": ["order/total"]}]}.
 */
@JsonSerialize(using = SelectionJsonSerializer.class)
@JsonDeserialize(using = SelectionJsonDeserializer.class)
public final class Selection {
  private static final Selection EMPTY = new Selection(Map.of());

  private final Map<String, Selection> entries;

  private Selection(Map<String, Selection> entries) {
    this.entries = entries;
  }

  public static Selection empty() { return EMPTY; }

  public static Selection of(String... keys) {
    Builder b = builder();
    for (String k : keys) b.add(k);
    return b.build();
  }

  public static Builder builder() { return new Builder(); }

  /** Selected keys in request order. */
  public Set<String> keys() { return entries.keySet(); }

  /** Child selection of {@code key}; empty when the key is a leaf or not selected. */
  public Selection child(String key) {
    Selection s = entries.get(key);
    return s == null ? EMPTY : s;
  }

  public boolean hasChild(String key) {
    Selection s = entries.get(key);
    return s != null && !s.isEmpty();
  }

  public boolean contains(String key) { return entries.containsKey(key); }

  public boolean isEmpty() { return entries.isEmpty(); }

  @Override
  public boolean equals(Object o) {
    return o instanceof Selection s && entries.equals(s.entries);
  }

  @Override
  public int hashCode() { return entries.hashCode(); }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    boolean first = true;
    for (var e : entries.entrySet()) {
      if (!first) sb.append(", ");
      first = false;
      sb.append(e.getKey());
      if (!e.getValue().isEmpty()) sb.append(' ').append(e.getValue());
    }
    return sb.append(']').toString();
  }

  public static final class Builder {
    private final Map<String, Selection> entries = new LinkedHashMap<>();

    private Builder() {}

    public Builder add(String key) {
      requireKey(key);
      entries.putIfAbsent(key, EMPTY);
      return this;
    }

    /** Adds {@code key} with a child selection, merging with one already present. */
    public Builder add(String key, Selection child) {
      requireKey(key);
      Objects.requireNonNull(child, "child");
      Selection prev = entries.get(key);
      entries.put(key, prev == null ? child : merge(prev, child));
      return this;
    }

    public Selection build() {
      if (entries.isEmpty()) return EMPTY;
      return new Selection(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }

    private static void requireKey(String key) {
      if (key == null || key.indexOf('/') <= 0) {
        throw new IllegalArgumentException("Selection keys must be namespaced attribute keys: " + key);
      }
    }

    private static Selection merge(Selection a, Selection b) {
      Builder m = new Builder();
      for (String k : a.keys()) m.add(k, a.child(k));
      for (String k : b.keys()) m.add(k, b.child(k));
      return m.build();
    }
  }
}
