package io.intellixity.strata.persistence.exec;

import io.intellixity.strata.persistence.delta.TempId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Outcome of a committed save: every temporary id of the delta mapped to its real id. */
public record SaveResult(Map<TempId, Object> tempIds) {
  public SaveResult {
    tempIds = (tempIds == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tempIds));
  }

  public Object idOf(TempId t) {
    return tempIds.get(t);
  }
}
