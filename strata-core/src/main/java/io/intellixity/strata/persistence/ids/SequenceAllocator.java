package io.intellixity.strata.persistence.ids;

import java.util.List;
import java.util.Map;

/**
 * Store-side sequence allocation for one partition.\n
 *
 * Implementations issue exactly one round trip per sequence in {@code countsBySequence}, all on one
 * connection, and return the values in allocation order.
 */
@FunctionalInterface
public interface SequenceAllocator {
  Map<String, List<Object>> allocate(String partition, Map<String, Integer> countsBySequence);
}
