package io.intellixity.strata.persistence.read;

import java.util.*;

/**
 * Immutable registry of generated resolvers.\n
 *
 * Id resolvers are indexed by identity key; ref resolvers by {@code (input identity, attribute key)}, since
 * an attribute stored against several identities gets one resolver per identity.
 */
public final class ResolverSet {
  private final Map<String, BatchResolver> byIdentity;
  private final Map<String, BatchResolver> byRef;
  private final Map<String, BatchResolver> byName;

  private ResolverSet(Map<String, BatchResolver> byIdentity, Map<String, BatchResolver> byRef,
                      Map<String, BatchResolver> byName) {
    this.byIdentity = byIdentity;
    this.byRef = byRef;
    this.byName = byName;
  }

  public static ResolverSet of(Collection<? extends BatchResolver> resolvers) {
    Objects.requireNonNull(resolvers, "resolvers");
    Map<String, BatchResolver> byIdentity = new LinkedHashMap<>();
    Map<String, BatchResolver> byRef = new LinkedHashMap<>();
    Map<String, BatchResolver> byName = new LinkedHashMap<>();
    for (BatchResolver r : resolvers) {
      if (r == null) continue;
      if (byName.putIfAbsent(r.name(), r) != null) {
        throw new IllegalArgumentException("Duplicate resolver name: " + r.name());
      }
      if (r.kind() == ResolverKind.ID) {
        byIdentity.put(r.key(), r);
      } else {
        byRef.put(refKey(r.inputIdentity(), r.key()), r);
      }
    }
    return new ResolverSet(
        Collections.unmodifiableMap(byIdentity),
        Collections.unmodifiableMap(byRef),
        Collections.unmodifiableMap(byName));
  }

  /** Union of several sets; later sets may not redefine a name. */
  public static ResolverSet merge(ResolverSet... sets) {
    List<BatchResolver> all = new ArrayList<>();
    for (ResolverSet s : sets) all.addAll(s.all());
    return of(all);
  }

  public BatchResolver idResolver(String identityKey) {
    BatchResolver r = byIdentity.get(identityKey);
    if (r == null) {
      throw new IllegalArgumentException("No id resolver for " + identityKey + "; available=" + byIdentity.keySet());
    }
    return r;
  }

  /** Ref resolver for {@code attributeKey} read from entities of {@code identityKey}, or {@code null}. */
  public BatchResolver refResolver(String identityKey, String attributeKey) {
    return byRef.get(refKey(identityKey, attributeKey));
  }

  public Optional<BatchResolver> named(String name) {
    return Optional.ofNullable(byName.get(name));
  }

  public Collection<BatchResolver> all() { return byName.values(); }

  public int size() { return byName.size(); }

  private static String refKey(String identityKey, String attributeKey) {
    return identityKey + "|" + attributeKey;
  }
}
