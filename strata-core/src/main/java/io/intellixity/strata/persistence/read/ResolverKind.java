package io.intellixity.strata.persistence.read;

/** What a {@link BatchResolver} takes as input and what it returns per input. */
public enum ResolverKind {
  /** Identity ids in, decoded entity row (or null) out. */
  ID,
  /** Target ids taken from the parent row in, target row out. Delegates to the target's id resolver. */
  ALIAS,
  /** Source ids in, the single target row holding a foreign key back to the source (or null) out. */
  TO_ONE,
  /** Source ids in, ordered list of target ids out; never null. */
  TO_MANY
}
