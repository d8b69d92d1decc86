package io.intellixity.strata.persistence.spi.bind;

/** Statement role of a bind position; binders may adapt values per role. */
public enum BindOpKind {
  INSERT,
  UPDATE_SET,
  FILTER,
  ALLOCATE
}
