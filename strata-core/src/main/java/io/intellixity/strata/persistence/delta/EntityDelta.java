package io.intellixity.strata.persistence.delta;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Attribute changes for one entity, plus an explicit whole-entity deletion flag. */
public record EntityDelta(Map<String, Change> changes, boolean deleted) {
  public EntityDelta {
    changes = (changes == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(changes));
  }

  public static EntityDelta of(Map<String, Change> changes) {
    return new EntityDelta(changes, false);
  }

  public static EntityDelta deletion() {
    return new EntityDelta(Map.of(), true);
  }

  public Change change(String key) {
    return changes.get(key);
  }
}
