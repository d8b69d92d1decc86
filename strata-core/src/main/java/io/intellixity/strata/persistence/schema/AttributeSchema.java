package io.intellixity.strata.persistence.schema;

import io.intellixity.strata.persistence.error.SchemaConfigException;
import io.intellixity.strata.persistence.value.AttributeCodec;
import io.intellixity.strata.persistence.value.CodecRegistry;

import java.util.*;

/**
 * Compiled, immutable attribute schema.\n
 *
 * Built once at startup from an ordered descriptor list. Construction validates the whole schema and
 * compiles one {@link AttributeCodec} per attribute; a bad schema fails here with
 * {@link SchemaConfigException}, never later during a save.\n
 *
 * Storage naming:\n
 * - table: explicit {@code table} on the identity, else snake_case of the key namespace\n
 * - column: explicit {@code column}, else snake_case of the key name\n
 * - sequence: {@code <table>_<column>_seq}\n
 *
 * Safe for unsynchronized concurrent reads.
 */
public final class AttributeSchema {
  private final Map<String, AttributeDescriptor> byKey;
  private final Map<String, List<AttributeDescriptor>> byIdentity;
  private final Map<String, List<AttributeDescriptor>> byPartition;
  private final Map<String, AttributeCodec> codecs;
  private final CodecRegistry codecRegistry;

  private AttributeSchema(Map<String, AttributeDescriptor> byKey,
                          Map<String, List<AttributeDescriptor>> byIdentity,
                          Map<String, List<AttributeDescriptor>> byPartition,
                          Map<String, AttributeCodec> codecs,
                          CodecRegistry codecRegistry) {
    this.byKey = byKey;
    this.byIdentity = byIdentity;
    this.byPartition = byPartition;
    this.codecs = codecs;
    this.codecRegistry = codecRegistry;
  }

  public static AttributeSchema of(Collection<AttributeDescriptor> attributes) {
    return of(attributes, CodecRegistry.discovered());
  }

  public static AttributeSchema of(Collection<AttributeDescriptor> attributes, CodecRegistry codecRegistry) {
    Objects.requireNonNull(attributes, "attributes");
    Objects.requireNonNull(codecRegistry, "codecRegistry");

    Map<String, AttributeDescriptor> byKey = new LinkedHashMap<>();
    for (AttributeDescriptor d : attributes) {
      if (d == null) continue;
      if (byKey.putIfAbsent(d.key(), d) != null) {
        throw new SchemaConfigException("Duplicate attribute key: " + d.key());
      }
    }
    for (AttributeDescriptor d : byKey.values()) validate(d, byKey);

    Map<String, List<AttributeDescriptor>> byIdentity = new LinkedHashMap<>();
    Map<String, List<AttributeDescriptor>> byPartition = new LinkedHashMap<>();
    Map<String, AttributeCodec> codecs = new LinkedHashMap<>();
    for (AttributeDescriptor d : byKey.values()) {
      if (d.identity()) byIdentity.computeIfAbsent(d.key(), k -> new ArrayList<>());
      for (String id : d.identities()) byIdentity.computeIfAbsent(id, k -> new ArrayList<>()).add(d);
      byPartition.computeIfAbsent(d.partition(), k -> new ArrayList<>()).add(d);
      try {
        codecs.put(d.key(), AttributeCodec.compile(d, codecRegistry));
      } catch (IllegalArgumentException e) {
        throw new SchemaConfigException("Cannot resolve codec for " + d.key() + ": " + e.getMessage(), e);
      }
    }

    return new AttributeSchema(
        Collections.unmodifiableMap(byKey),
        freeze(byIdentity),
        freeze(byPartition),
        Collections.unmodifiableMap(codecs),
        codecRegistry);
  }

  private static void validate(AttributeDescriptor d, Map<String, AttributeDescriptor> byKey) {
    if (d.partition() == null) throw new SchemaConfigException("Attribute has no partition: " + d.key());
    if (d.identity()) {
      if (d.isRef()) throw new SchemaConfigException("Identity attribute cannot be a ref: " + d.key());
    } else {
      if (d.identities().isEmpty()) throw new SchemaConfigException("Attribute has no owning identity: " + d.key());
      for (String id : d.identities()) requireIdentity(id, d.key(), byKey);
    }
    if (d.isRef()) {
      if (d.target() == null) throw new SchemaConfigException("Ref attribute has no target: " + d.key());
      requireIdentity(d.target(), d.key(), byKey);
      if (d.isToMany() && d.mirrorKey() == null) {
        throw new SchemaConfigException("To-many ref needs a mirror key on its target: " + d.key());
      }
    } else if (d.mirrorKey() != null || d.target() != null) {
      throw new SchemaConfigException("Only ref attributes may declare target/mirrorKey: " + d.key());
    }
    if (d.mirrorKey() != null) {
      AttributeDescriptor m = byKey.get(d.mirrorKey());
      if (m == null) throw new SchemaConfigException("Unknown mirror key " + d.mirrorKey() + " on " + d.key());
      if (!m.isRef()) throw new SchemaConfigException("Mirror key " + d.mirrorKey() + " of " + d.key() + " is not a ref");
      if (m.mirrorKey() != null) {
        throw new SchemaConfigException("Mirror key " + d.mirrorKey() + " of " + d.key() + " must hold the foreign key itself");
      }
      if (d.isToMany() && !m.isToOne()) {
        throw new SchemaConfigException("Mirror key " + d.mirrorKey() + " of to-many " + d.key() + " must be a to-one ref");
      }
      if (!m.identities().contains(d.target())) {
        throw new SchemaConfigException("Mirror key " + d.mirrorKey() + " is not stored on target " + d.target());
      }
    }
    if (d.orderBy() != null && !byKey.containsKey(d.orderBy())) {
      throw new SchemaConfigException("Unknown order-by key " + d.orderBy() + " on " + d.key());
    }
  }

  private static void requireIdentity(String id, String owner, Map<String, AttributeDescriptor> byKey) {
    AttributeDescriptor i = byKey.get(id);
    if (i == null) throw new SchemaConfigException("Unknown identity " + id + " referenced by " + owner);
    if (!i.identity()) throw new SchemaConfigException(id + " referenced by " + owner + " is not an identity attribute");
  }

  private static Map<String, List<AttributeDescriptor>> freeze(Map<String, List<AttributeDescriptor>> m) {
    Map<String, List<AttributeDescriptor>> out = new LinkedHashMap<>();
    for (var e : m.entrySet()) out.put(e.getKey(), List.copyOf(e.getValue()));
    return Collections.unmodifiableMap(out);
  }

  // ---- lookups ----

  public Collection<AttributeDescriptor> attributes() { return byKey.values(); }

  public boolean contains(String key) { return byKey.containsKey(key); }

  /** Descriptor for {@code key}, or {@code null}. */
  public AttributeDescriptor get(String key) { return byKey.get(key); }

  public AttributeDescriptor require(String key) {
    AttributeDescriptor d = byKey.get(key);
    if (d == null) throw new SchemaConfigException("Unknown attribute: " + key);
    return d;
  }

  public AttributeDescriptor requireIdentity(String identityKey) {
    AttributeDescriptor d = require(identityKey);
    if (!d.identity()) throw new SchemaConfigException(identityKey + " is not an identity attribute");
    return d;
  }

  public List<AttributeDescriptor> identities() {
    List<AttributeDescriptor> out = new ArrayList<>();
    for (String k : byIdentity.keySet()) out.add(byKey.get(k));
    return out;
  }

  /** Non-identity attributes stored against {@code identityKey}, in declaration order. */
  public List<AttributeDescriptor> attributesOf(String identityKey) {
    return byIdentity.getOrDefault(identityKey, List.of());
  }

  public List<AttributeDescriptor> inPartition(String partition) {
    return byPartition.getOrDefault(partition, List.of());
  }

  public Set<String> partitions() { return byPartition.keySet(); }

  /** Registry the codecs were compiled from; binders use it for driver-level conversions. */
  public CodecRegistry codecRegistry() { return codecRegistry; }

  public AttributeCodec codec(String key) {
    AttributeCodec c = codecs.get(key);
    if (c == null) throw new SchemaConfigException("Unknown attribute: " + key);
    return c;
  }

  // ---- storage naming ----

  public String tableName(String identityKey) {
    AttributeDescriptor id = requireIdentity(identityKey);
    return id.table() != null ? id.table() : snakeCase(id.namespace());
  }

  public String columnName(String key) {
    AttributeDescriptor d = require(key);
    return d.column() != null ? d.column() : snakeCase(d.name());
  }

  public String sequenceName(String identityKey) {
    return tableName(identityKey) + "_" + columnName(identityKey) + "_seq";
  }

  /** {@code "firstName"} and {@code "first-name"} both become {@code "first_name"}. */
  public static String snakeCase(String s) {
    if (s == null) return null;
    StringBuilder out = new StringBuilder(s.length() + 4);
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '-' || c == '.' || c == ' ') {
        out.append('_');
      } else if (Character.isUpperCase(c)) {
        if (i > 0 && out.length() > 0 && out.charAt(out.length() - 1) != '_') out.append('_');
        out.append(Character.toLowerCase(c));
      } else {
        out.append(c);
      }
    }
    return out.toString();
  }
}
