package io.intellixity.strata.persistence.exec;

import io.intellixity.strata.persistence.delta.Delta;

/**
 * Write entry point.\n
 *
 * Each touched partition commits in its own serializable transaction. There is no atomicity across
 * partitions: a failure in a later partition leaves earlier partitions committed.
 */
public interface SaveEngine {
  SaveResult save(Delta delta);
}
