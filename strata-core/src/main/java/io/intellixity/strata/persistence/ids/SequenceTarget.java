package io.intellixity.strata.persistence.ids;

/** Store sequence that supplies the id of one temporary identity, and the partition that owns it. */
public record SequenceTarget(String partition, String sequence, String identityKey) {
  public SequenceTarget {
    if (partition == null || partition.isBlank()) throw new IllegalArgumentException("partition is required");
    if (sequence == null || sequence.isBlank()) throw new IllegalArgumentException("sequence is required");
  }
}
