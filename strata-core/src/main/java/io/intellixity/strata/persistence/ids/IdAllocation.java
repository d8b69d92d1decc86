package io.intellixity.strata.persistence.ids;

import io.intellixity.strata.persistence.delta.TempId;
import io.intellixity.strata.persistence.error.SaveException;
import io.intellixity.strata.persistence.error.StoreErrorKind;
import io.intellixity.strata.persistence.schema.AttributeSchema;

import java.util.*;

/** Turns an {@link IdentifierPlan} into concrete ids. */
public final class IdAllocation {
  private IdAllocation() {}

  /** One fresh local id per planned local temporary id. No I/O. */
  public static Map<TempId, Object> generateLocal(IdentifierPlan plan, AttributeSchema schema, IdGenerator generator) {
    Map<TempId, Object> out = new LinkedHashMap<>();
    for (var e : plan.localIds().entrySet()) {
      out.put(e.getKey(), generator.newId(schema.requireIdentity(e.getValue())));
    }
    return out;
  }

  /** Allocates the sequence-backed ids of {@code partition} and zips them positionally. */
  public static Map<TempId, Object> allocateSequences(IdentifierPlan plan, String partition, SequenceAllocator allocator) {
    Map<String, List<TempId>> bySequence = plan.bySequence(partition);
    if (bySequence.isEmpty()) return Map.of();

    Map<String, Integer> counts = new LinkedHashMap<>();
    for (var e : bySequence.entrySet()) counts.put(e.getKey(), e.getValue().size());
    Map<String, List<Object>> allocated = allocator.allocate(partition, counts);

    Map<TempId, Object> out = new LinkedHashMap<>();
    for (var e : bySequence.entrySet()) {
      List<TempId> pending = e.getValue();
      List<Object> values = (allocated == null) ? null : allocated.get(e.getKey());
      int got = (values == null) ? 0 : values.size();
      if (got != pending.size()) {
        throw new SaveException(StoreErrorKind.UNKNOWN, partition,
            "Sequence " + e.getKey() + " returned " + got + " values for " + pending.size() + " temporary ids", null);
      }
      if (new HashSet<>(values).size() != values.size()) {
        throw new SaveException(StoreErrorKind.UNKNOWN, partition, "Sequence " + e.getKey() + " returned duplicate values", null);
      }
      for (int i = 0; i < pending.size(); i++) out.put(pending.get(i), values.get(i));
    }
    return out;
  }
}
