package io.intellixity.strata.persistence.value;

import io.intellixity.strata.persistence.error.SchemaConfigException;
import io.intellixity.strata.persistence.schema.AttributeDescriptor;

import java.util.Objects;
import java.util.function.Function;

/**
 * Encode/decode pair compiled for one attribute.\n
 *
 * Resolution order: inline encoder/decoder on the descriptor, then the named codec, then the builtin
 * codec of the attribute type. Each direction is resolved independently.\n
 *
 * Values handed to {@link #encode} that are not yet of the codec's Java type (an Integer for a long id, a numeric
 * string for a decimal) are first brought into it with the codec's decoder. Inline encoders see the value as given.
 */
public final class AttributeCodec {
  private final String key;
  private final String codecId;
  private final Function<Object, Object> encoder;
  private final Function<Object, Object> decoder;
  private final Class<?> javaType;
  private final Function<Object, Object> coercer;

  private AttributeCodec(String key, String codecId, Function<Object, Object> encoder, Function<Object, Object> decoder,
                         Class<?> javaType, Function<Object, Object> coercer) {
    this.key = key;
    this.codecId = codecId;
    this.encoder = encoder;
    this.decoder = decoder;
    this.javaType = javaType;
    this.coercer = coercer;
  }

  public static AttributeCodec compile(AttributeDescriptor d, CodecRegistry codecs) {
    Objects.requireNonNull(d, "descriptor");
    Objects.requireNonNull(codecs, "codecs");
    @SuppressWarnings("unchecked")
    ValueCodec<Object> base = (ValueCodec<Object>) (d.codec() != null ? codecs.named(d.codec()) : codecs.forType(d.type()));
    Function<Object, Object> enc = d.encoder() != null ? d.encoder() : base::encode;
    Function<Object, Object> dec = d.decoder() != null ? d.decoder() : base::decode;
    if (d.encoder() != null) return new AttributeCodec(d.key(), base.id(), enc, dec, null, null);
    return new AttributeCodec(d.key(), base.id(), enc, dec, base.javaType(), base::decode);
  }

  public String key() { return key; }

  /** Id of the underlying codec; binders use it as the bind type. */
  public String codecId() { return codecId; }

  public Object encode(Object value) {
    if (value == null) return null;
    return encoder.apply(normalize(value));
  }

  /**
   * {@code value} in the codec's Java type, converted through the decoder when it is not already.
   *
   * @throws SchemaConfigException when the value cannot be read as that type
   */
  public Object normalize(Object value) {
    if (value == null || javaType == null || javaType.isInstance(value)) return value;
    try {
      return coercer.apply(value);
    } catch (RuntimeException e) {
      throw new SchemaConfigException("Attribute " + key + " expects " + javaType.getSimpleName()
          + ", got " + value.getClass().getSimpleName() + " " + value, e);
    }
  }

  public Object decode(Object raw) {
    if (raw == null) return null;
    return decoder.apply(raw);
  }
}
