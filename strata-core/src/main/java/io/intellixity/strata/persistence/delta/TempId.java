package io.intellixity.strata.persistence.delta;

import java.util.Objects;
import java.util.UUID;

/** Caller-side placeholder for an identity the store has not assigned yet. */
public record TempId(UUID value) {
  public TempId {
    Objects.requireNonNull(value, "value");
  }

  public static TempId create() {
    return new TempId(UUID.randomUUID());
  }

  @Override
  public String toString() {
    return "#tempid[" + value + "]";
  }
}
