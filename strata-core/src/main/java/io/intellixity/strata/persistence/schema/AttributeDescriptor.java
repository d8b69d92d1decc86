package io.intellixity.strata.persistence.schema;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Immutable schema-time description of one entity attribute.\n
 *
 * Keys are namespaced by entity type: {@code "account/name"}. Identity attributes describe the primary key
 * of their entity type; every other attribute lists the identities it is stored against.\n
 *
 * Reference attributes ({@link AttrType#REF}) name their {@code target} identity. A reference either stores
 * the target id in its own column (no {@code mirrorKey}) or is mirrored by an attribute on the target that
 * holds the foreign key back to this entity.\n
 *
 * {@code codec} names a custom codec registered in the {@link io.intellixity.strata.persistence.value.CodecRegistry};
 * {@code encoder}/{@code decoder} are inline overrides. Inline functions win over a named codec, which wins over
 * the builtin codec of {@code type}.
 */
public record AttributeDescriptor(
    String key,
    AttrType type,
    Cardinality cardinality,
    boolean identity,
    Set<String> identities,
    String partition,
    String table,
    String column,
    String target,
    String mirrorKey,
    boolean deleteOrphan,
    String orderBy,
    Integer maxLength,
    String codec,
    Function<Object, Object> encoder,
    Function<Object, Object> decoder
) {
  public AttributeDescriptor {
    if (key == null || key.isBlank()) throw new IllegalArgumentException("key is required");
    if (key.indexOf('/') <= 0 || key.endsWith("/")) {
      throw new IllegalArgumentException("key must be namespaced as 'entity/name': " + key);
    }
    Objects.requireNonNull(type, "type");
    cardinality = (cardinality == null) ? Cardinality.SCALAR : cardinality;
    if (type != AttrType.REF && cardinality != Cardinality.SCALAR) {
      throw new IllegalArgumentException("cardinality " + cardinality + " requires type ref: " + key);
    }
    if (type == AttrType.REF && cardinality == Cardinality.SCALAR) cardinality = Cardinality.ONE;
    identities = (identities == null) ? Set.of() : Set.copyOf(new LinkedHashSet<>(identities));
    partition = (partition == null || partition.isBlank()) ? null : partition;
    table = blankToNull(table);
    column = blankToNull(column);
    target = blankToNull(target);
    mirrorKey = blankToNull(mirrorKey);
    orderBy = blankToNull(orderBy);
    codec = blankToNull(codec);
  }

  public static AttributeDescriptor identity(String key, AttrType type, String partition) {
    return new AttributeDescriptor(key, type, Cardinality.SCALAR, true, Set.of(), partition,
        null, null, null, null, false, null, null, null, null, null);
  }

  public static AttributeDescriptor scalar(String key, AttrType type, String partition, String owningIdentity) {
    return new AttributeDescriptor(key, type, Cardinality.SCALAR, false, Set.of(owningIdentity), partition,
        null, null, null, null, false, null, null, null, null, null);
  }

  public static AttributeDescriptor toOne(String key, String target, String partition, String owningIdentity) {
    return new AttributeDescriptor(key, AttrType.REF, Cardinality.ONE, false, Set.of(owningIdentity), partition,
        null, null, target, null, false, null, null, null, null, null);
  }

  public static AttributeDescriptor toMany(String key, String target, String mirrorKey,
                                           String partition, String owningIdentity) {
    return new AttributeDescriptor(key, AttrType.REF, Cardinality.MANY, false, Set.of(owningIdentity), partition,
        null, null, target, mirrorKey, false, null, null, null, null, null);
  }

  public AttributeDescriptor withTable(String table) {
    return new AttributeDescriptor(key, type, cardinality, identity, identities, partition, table, column,
        target, mirrorKey, deleteOrphan, orderBy, maxLength, codec, encoder, decoder);
  }

  public AttributeDescriptor withColumn(String column) {
    return new AttributeDescriptor(key, type, cardinality, identity, identities, partition, table, column,
        target, mirrorKey, deleteOrphan, orderBy, maxLength, codec, encoder, decoder);
  }

  public AttributeDescriptor withMirrorKey(String mirrorKey) {
    return new AttributeDescriptor(key, type, cardinality, identity, identities, partition, table, column,
        target, mirrorKey, deleteOrphan, orderBy, maxLength, codec, encoder, decoder);
  }

  public AttributeDescriptor withDeleteOrphan(boolean deleteOrphan) {
    return new AttributeDescriptor(key, type, cardinality, identity, identities, partition, table, column,
        target, mirrorKey, deleteOrphan, orderBy, maxLength, codec, encoder, decoder);
  }

  public AttributeDescriptor withOrderBy(String orderBy) {
    return new AttributeDescriptor(key, type, cardinality, identity, identities, partition, table, column,
        target, mirrorKey, deleteOrphan, orderBy, maxLength, codec, encoder, decoder);
  }

  public AttributeDescriptor withMaxLength(Integer maxLength) {
    return new AttributeDescriptor(key, type, cardinality, identity, identities, partition, table, column,
        target, mirrorKey, deleteOrphan, orderBy, maxLength, codec, encoder, decoder);
  }

  public AttributeDescriptor withIdentities(Set<String> identities) {
    return new AttributeDescriptor(key, type, cardinality, identity, identities, partition, table, column,
        target, mirrorKey, deleteOrphan, orderBy, maxLength, codec, encoder, decoder);
  }

  public AttributeDescriptor withCodec(String codec) {
    return new AttributeDescriptor(key, type, cardinality, identity, identities, partition, table, column,
        target, mirrorKey, deleteOrphan, orderBy, maxLength, codec, encoder, decoder);
  }

  public AttributeDescriptor withConverters(Function<Object, Object> encoder, Function<Object, Object> decoder) {
    return new AttributeDescriptor(key, type, cardinality, identity, identities, partition, table, column,
        target, mirrorKey, deleteOrphan, orderBy, maxLength, codec, encoder, decoder);
  }

  /** Entity namespace of the key ({@code "account"} for {@code "account/name"}). */
  public String namespace() {
    return key.substring(0, key.indexOf('/'));
  }

  /** Local name of the key ({@code "name"} for {@code "account/name"}). */
  public String name() {
    return key.substring(key.indexOf('/') + 1);
  }

  public boolean isRef() { return type == AttrType.REF; }
  public boolean isToOne() { return isRef() && cardinality == Cardinality.ONE; }
  public boolean isToMany() { return isRef() && cardinality == Cardinality.MANY; }

  private static String blankToNull(String s) {
    return (s == null || s.isBlank()) ? null : s.trim();
  }
}
