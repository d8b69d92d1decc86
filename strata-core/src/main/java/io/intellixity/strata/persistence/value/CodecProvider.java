package io.intellixity.strata.persistence.value;

import java.util.Collection;

/**
 * Contributes named codecs to a {@link CodecRegistry}.\n
 *
 * Providers are listed in {@code META-INF/strata.factories} and picked up by {@link CodecRegistry#discovered()}.
 */
public interface CodecProvider {
  Collection<ValueCodec<?>> codecs();
}
