package io.intellixity.strata.persistence.value;

import java.util.*;

/**
 * Stores a set of tags as one comma separated string column. Codec id {@code "csv-tags"}.\n
 *
 * Tags are trimmed; blanks are dropped. An empty set is stored as {@code ""}.
 */
public final class CsvTagsCodec implements ValueCodec<Set<String>> {
  public static final String ID = "csv-tags";

  @Override public String id() { return ID; }

  @SuppressWarnings({"unchecked", "rawtypes"})
  @Override public Class<Set<String>> javaType() { return (Class) Set.class; }

  @Override
  public Set<String> decode(Object raw) {
    if (raw == null) return null;
    Set<String> out = new LinkedHashSet<>();
    for (String part : String.valueOf(raw).split(",")) {
      String t = part.trim();
      if (!t.isEmpty()) out.add(t);
    }
    return out;
  }

  @Override
  public Object encode(Set<String> value) {
    if (value == null) return null;
    StringJoiner j = new StringJoiner(",");
    for (String t : value) {
      if (t == null) continue;
      String s = t.trim();
      if (s.isEmpty()) continue;
      if (s.indexOf(',') >= 0) throw new IllegalArgumentException("Tag contains a comma: " + s);
      j.add(s);
    }
    return j.toString();
  }
}
