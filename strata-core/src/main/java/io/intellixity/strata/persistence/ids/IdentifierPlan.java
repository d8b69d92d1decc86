package io.intellixity.strata.persistence.ids;

import io.intellixity.strata.persistence.delta.TempId;

import java.util.*;

/**
 * Output of {@link IdentifierPlanner}: how each temporary id of a delta gets its real id.\n
 *
 * {@code sequenceIds} and {@code localIds} are disjoint and keep first-seen delta order, which is also the
 * order allocated values are zipped in.
 */
public record IdentifierPlan(Map<TempId, SequenceTarget> sequenceIds, Map<TempId, String> localIds) {
  public IdentifierPlan {
    sequenceIds = (sequenceIds == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sequenceIds));
    localIds = (localIds == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(localIds));
  }

  public boolean isEmpty() {
    return sequenceIds.isEmpty() && localIds.isEmpty();
  }

  /** Partitions whose sequences back at least one temporary id. */
  public Set<String> sequencePartitions() {
    Set<String> out = new LinkedHashSet<>();
    for (SequenceTarget t : sequenceIds.values()) out.add(t.partition());
    return out;
  }

  /** Pending temporary ids of {@code partition} grouped by sequence name. */
  public Map<String, List<TempId>> bySequence(String partition) {
    Map<String, List<TempId>> out = new LinkedHashMap<>();
    for (var e : sequenceIds.entrySet()) {
      if (!e.getValue().partition().equals(partition)) continue;
      out.computeIfAbsent(e.getValue().sequence(), k -> new ArrayList<>()).add(e.getKey());
    }
    return out;
  }

  public Set<TempId> sequenceIdsOf(String partition) {
    Set<TempId> out = new LinkedHashSet<>();
    for (var e : sequenceIds.entrySet()) {
      if (e.getValue().partition().equals(partition)) out.add(e.getKey());
    }
    return out;
  }
}
