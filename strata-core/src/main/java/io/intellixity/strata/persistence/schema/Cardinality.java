package io.intellixity.strata.persistence.schema;

public enum Cardinality {
  /** Plain value attribute. */
  SCALAR,
  /** Reference to at most one target entity. */
  ONE,
  /** Reference to a collection of target entities. */
  MANY
}
