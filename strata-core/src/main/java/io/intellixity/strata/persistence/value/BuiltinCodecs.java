package io.intellixity.strata.persistence.value;

import io.intellixity.strata.persistence.schema.AttrType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Builtin codec for every {@link AttrType}.\n
 *
 * Encoders keep values in their logical Java type where the JDBC layer can bind them directly;
 * binders take care of driver specifics (e.g. Instant to Timestamp).
 */
public final class BuiltinCodecs {
  private BuiltinCodecs() {}

  /** One codec per type, keyed by type. */
  public static Map<AttrType, ValueCodec<?>> all() {
    Map<AttrType, ValueCodec<?>> out = new EnumMap<>(AttrType.class);
    out.put(AttrType.UUID, uuid());
    out.put(AttrType.INT, integer());
    out.put(AttrType.LONG, longType());
    out.put(AttrType.STRING, string("string"));
    out.put(AttrType.PASSWORD, string("password"));
    out.put(AttrType.BOOLEAN, bool());
    out.put(AttrType.DECIMAL, decimal());
    out.put(AttrType.INSTANT, instant());
    out.put(AttrType.ENUM, keyword("enum"));
    out.put(AttrType.KEYWORD, keyword("keyword"));
    out.put(AttrType.SYMBOL, symbol());
    out.put(AttrType.REF, ref());
    return out;
  }

  public static ValueCodec<UUID> uuid() {
    return new ValueCodec<>() {
      @Override public String id() { return "uuid"; }
      @Override public Class<UUID> javaType() { return UUID.class; }
      @Override public UUID decode(Object raw) {
        if (raw == null) return null;
        if (raw instanceof UUID u) return u;
        return UUID.fromString(String.valueOf(raw));
      }
      @Override public Object encode(UUID value) { return value; }
    };
  }

  public static ValueCodec<Integer> integer() {
    return new ValueCodec<>() {
      @Override public String id() { return "int"; }
      @Override public Class<Integer> javaType() { return Integer.class; }
      @Override public Integer decode(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Integer i) return i;
        if (raw instanceof Number n) return Math.toIntExact(n.longValue());
        return Integer.parseInt(String.valueOf(raw).trim());
      }
      @Override public Object encode(Integer value) { return value; }
    };
  }

  public static ValueCodec<Long> longType() {
    return new ValueCodec<>() {
      @Override public String id() { return "long"; }
      @Override public Class<Long> javaType() { return Long.class; }
      @Override public Long decode(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Long l) return l;
        if (raw instanceof Number n) return n.longValue();
        return Long.parseLong(String.valueOf(raw).trim());
      }
      @Override public Object encode(Long value) { return value; }
    };
  }

  public static ValueCodec<String> string(String id) {
    return new ValueCodec<>() {
      @Override public String id() { return id; }
      @Override public Class<String> javaType() { return String.class; }
      @Override public String decode(Object raw) { return raw == null ? null : String.valueOf(raw); }
      @Override public Object encode(String value) { return value; }
    };
  }

  public static ValueCodec<Boolean> bool() {
    return new ValueCodec<>() {
      @Override public String id() { return "boolean"; }
      @Override public Class<Boolean> javaType() { return Boolean.class; }
      @Override public Boolean decode(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Boolean b) return b;
        if (raw instanceof Number n) return n.intValue() != 0;
        return Boolean.parseBoolean(String.valueOf(raw).trim());
      }
      @Override public Object encode(Boolean value) { return value; }
    };
  }

  public static ValueCodec<BigDecimal> decimal() {
    return new ValueCodec<>() {
      @Override public String id() { return "decimal"; }
      @Override public Class<BigDecimal> javaType() { return BigDecimal.class; }
      @Override public BigDecimal decode(Object raw) {
        if (raw == null) return null;
        if (raw instanceof BigDecimal d) return d;
        if (raw instanceof BigInteger bi) return new BigDecimal(bi);
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
          return BigDecimal.valueOf(((Number) raw).longValue());
        }
        if (raw instanceof Number n) return new BigDecimal(n.toString());
        return new BigDecimal(String.valueOf(raw).trim());
      }
      @Override public Object encode(BigDecimal value) { return value; }
    };
  }

  public static ValueCodec<Instant> instant() {
    return new ValueCodec<>() {
      @Override public String id() { return "instant"; }
      @Override public Class<Instant> javaType() { return Instant.class; }
      @Override public Instant decode(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Instant i) return i;
        if (raw instanceof Timestamp ts) return ts.toInstant();
        if (raw instanceof OffsetDateTime odt) return odt.toInstant();
        if (raw instanceof java.util.Date d) return d.toInstant();
        return Instant.parse(String.valueOf(raw));
      }
      @Override public Object encode(Instant value) { return value; }
    };
  }

  public static ValueCodec<Keyword> keyword(String id) {
    return new ValueCodec<>() {
      @Override public String id() { return id; }
      @Override public Class<Keyword> javaType() { return Keyword.class; }
      @Override public Keyword decode(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Keyword k) return k;
        return Keyword.parse(String.valueOf(raw));
      }
      @Override public Object encode(Keyword value) { return value == null ? null : value.toString(); }
    };
  }

  public static ValueCodec<Symbol> symbol() {
    return new ValueCodec<>() {
      @Override public String id() { return "symbol"; }
      @Override public Class<Symbol> javaType() { return Symbol.class; }
      @Override public Symbol decode(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Symbol s) return s;
        return Symbol.parse(String.valueOf(raw));
      }
      @Override public Object encode(Symbol value) { return value == null ? null : value.toString(); }
    };
  }

  /** Reference columns hold the target id as-is; the id codec of the target decides its shape. */
  public static ValueCodec<Object> ref() {
    return new ValueCodec<>() {
      @Override public String id() { return "ref"; }
      @Override public Class<Object> javaType() { return Object.class; }
      @Override public Object decode(Object raw) { return raw; }
      @Override public Object encode(Object value) { return value; }
    };
  }
}
