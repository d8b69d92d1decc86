package io.intellixity.strata.persistence.read;

import java.util.List;
import java.util.Map;

/**
 * Caller-side authorization hook applied to read results before they are returned.\n
 *
 * Implementations may drop keys or replace whole results with {@code null}; the list must stay positionally
 * aligned with its input.
 */
@FunctionalInterface
public interface Redactor {
  List<Map<String, Object>> redact(String identityKey, List<Map<String, Object>> results);

  static Redactor none() {
    return (identityKey, results) -> results;
  }
}
