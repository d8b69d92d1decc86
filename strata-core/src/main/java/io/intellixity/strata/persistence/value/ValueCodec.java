package io.intellixity.strata.persistence.value;

/**
 * Converts between a domain value and its storage representation.\n
 *
 * Both directions must accept {@code null} and return {@code null} for it.
 */
public interface ValueCodec<T> {
  String id();
  Class<T> javaType();
  T decode(Object raw);
  Object encode(T value);
}
