package io.intellixity.strata.persistence.value;

import io.intellixity.strata.persistence.schema.AttrType;
import io.intellixity.strata.persistence.util.StrataFactoriesLoader;

import java.util.*;

/**
 * Explicit codec registry threaded through schema construction.\n
 *
 * Holds one builtin codec per {@link AttrType} and any number of named codecs. Lookup happens once,
 * when the schema compiles its per-attribute codecs; nothing is looked up per value.\n
 *
 * Named codecs win over builtins with the same id, so a caller can replace e.g. {@code "instant"}.
 */
public final class CodecRegistry {
  private final Map<AttrType, ValueCodec<?>> builtins;
  private final Map<String, ValueCodec<?>> named;

  private CodecRegistry(Map<AttrType, ValueCodec<?>> builtins, Map<String, ValueCodec<?>> named) {
    this.builtins = Collections.unmodifiableMap(new EnumMap<>(builtins));
    this.named = Map.copyOf(named);
  }

  /** Builtin codecs only. */
  public static CodecRegistry builtins() {
    return builder().build();
  }

  /** Builtin codecs plus every {@link CodecProvider} listed in {@code META-INF/strata.factories}. */
  public static CodecRegistry discovered() {
    Builder b = builder();
    for (CodecProvider p : StrataFactoriesLoader.load(CodecProvider.class)) b.registerAll(p);
    return b.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public ValueCodec<?> forType(AttrType type) {
    Objects.requireNonNull(type, "type");
    ValueCodec<?> override = named.get(type.id());
    if (override != null) return override;
    return builtins.get(type);
  }

  public ValueCodec<?> named(String id) {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("codec id is blank");
    ValueCodec<?> c = named.get(id);
    if (c != null) return c;
    for (ValueCodec<?> b : builtins.values()) {
      if (b.id().equals(id)) return b;
    }
    throw new IllegalArgumentException("Unknown codec: " + id + " (registered=" + new TreeSet<>(named.keySet()) + ")");
  }

  public boolean contains(String id) {
    if (named.containsKey(id)) return true;
    for (ValueCodec<?> b : builtins.values()) {
      if (b.id().equals(id)) return true;
    }
    return false;
  }

  public static final class Builder {
    private final Map<String, ValueCodec<?>> named = new LinkedHashMap<>();

    private Builder() {}

    public Builder register(ValueCodec<?> codec) {
      Objects.requireNonNull(codec, "codec");
      if (codec.id() == null || codec.id().isBlank()) throw new IllegalArgumentException("codec id is blank");
      named.put(codec.id(), codec);
      return this;
    }

    public Builder registerAll(CodecProvider provider) {
      if (provider == null) return this;
      Collection<ValueCodec<?>> codecs = provider.codecs();
      if (codecs == null) return this;
      for (ValueCodec<?> c : codecs) {
        if (c != null) register(c);
      }
      return this;
    }

    public CodecRegistry build() {
      return new CodecRegistry(BuiltinCodecs.all(), named);
    }
  }
}
