package io.intellixity.strata.persistence.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/** Stores arbitrary JSON-shaped values (maps, lists, scalars) as JSON text. Codec id {@code "json"}. */
public final class JsonCodec implements ValueCodec<Object> {
  public static final String ID = "json";

  private final ObjectMapper mapper;

  public JsonCodec() {
    this(new ObjectMapper());
  }

  public JsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override public String id() { return ID; }
  @Override public Class<Object> javaType() { return Object.class; }

  @Override
  public Object decode(Object raw) {
    if (raw == null) return null;
    // PGobject and friends render their JSON text via toString()
    String text = (raw instanceof CharSequence cs) ? cs.toString() : String.valueOf(raw);
    try {
      return mapper.readValue(text, Object.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON value (len=" + text.length() + ")", e);
    }
  }

  @Override
  public Object encode(Object value) {
    if (value == null) return null;
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value is not JSON serializable: " + value.getClass().getName(), e);
    }
  }
}
