package io.intellixity.strata.persistence.value;

import java.util.Objects;

/** Namespaced symbolic constant, stored as {@code ":ns/name"}. Used for enum and keyword attributes. */
public record Keyword(String namespace, String name) {
  public Keyword {
    if (name == null || name.isEmpty()) throw new IllegalArgumentException("keyword name is required");
    namespace = (namespace == null || namespace.isEmpty()) ? null : namespace;
  }

  public static Keyword of(String namespace, String name) {
    return new Keyword(namespace, name);
  }

  /** Parse {@code ":ns/name"}, {@code "ns/name"} or {@code "name"}. */
  public static Keyword parse(String s) {
    Objects.requireNonNull(s, "s");
    String body = s.startsWith(":") ? s.substring(1) : s;
    int slash = body.indexOf('/');
    if (slash <= 0 || slash == body.length() - 1) return new Keyword(null, body);
    return new Keyword(body.substring(0, slash), body.substring(slash + 1));
  }

  @Override
  public String toString() {
    return namespace == null ? ":" + name : ":" + namespace + "/" + name;
  }
}
