package io.intellixity.strata.persistence.dmlast;

/** An encoded value plus the codec id binders use to pick a driver-level binding. */
public record Bind(Object value, String typeId) {
  public Bind {
    if (typeId == null || typeId.isBlank()) throw new IllegalArgumentException("typeId is required");
  }
}
