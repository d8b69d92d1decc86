package io.intellixity.strata.persistence.value;

import java.util.Objects;

/** Namespaced symbol, stored as {@code "ns/name"}. */
public record Symbol(String namespace, String name) {
  public Symbol {
    if (name == null || name.isEmpty()) throw new IllegalArgumentException("symbol name is required");
    namespace = (namespace == null || namespace.isEmpty()) ? null : namespace;
  }

  public static Symbol parse(String s) {
    Objects.requireNonNull(s, "s");
    int slash = s.indexOf('/');
    if (slash <= 0 || slash == s.length() - 1) return new Symbol(null, s);
    return new Symbol(s.substring(0, slash), s.substring(slash + 1));
  }

  @Override
  public String toString() {
    return namespace == null ? name : namespace + "/" + name;
  }
}
