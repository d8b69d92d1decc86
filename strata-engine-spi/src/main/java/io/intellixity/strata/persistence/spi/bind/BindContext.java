package io.intellixity.strata.persistence.spi.bind;

/** Backend-neutral bind context; backends extend it with position or field data. */
public interface BindContext {
  BindOpKind opKind();
}
