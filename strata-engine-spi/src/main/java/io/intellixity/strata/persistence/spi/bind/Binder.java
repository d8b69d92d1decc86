package io.intellixity.strata.persistence.spi.bind;

import io.intellixity.strata.persistence.dmlast.Bind;
import io.intellixity.strata.persistence.value.CodecRegistry;

/**
 * Writes one codec-encoded value into a store statement.\n
 *
 * {@link DiscoveredBinderRegistry} offers a bind to binders whose target and value types fit;
 * {@link #supports} then decides on the bind's type id (and, when it matters, the statement role).
 * A null value matches any value type.
 */
public interface Binder<T, V> {
  Class<T> targetType();

  Class<V> valueType();

  boolean supports(BindContext ctx, Bind bind, V encodedValue);

  void bind(T target, BindContext ctx, Bind bind, V encodedValue, CodecRegistry codecs);
}
