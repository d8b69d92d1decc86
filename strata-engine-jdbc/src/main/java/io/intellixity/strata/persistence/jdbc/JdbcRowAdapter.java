package io.intellixity.strata.persistence.jdbc;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Positional and label access to the current row of a {@link ResultSet}. */
public final class JdbcRowAdapter {
  private final ResultSet rs;
  private Map<String, Integer> colIndex;

  public JdbcRowAdapter(ResultSet rs) {
    this.rs = rs;
  }

  public boolean isNull(int index1Based) { return raw(index1Based) == null; }

  public Object raw(int index1Based) {
    try {
      return rs.getObject(index1Based);
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  public Object raw(String label) {
    return raw(indexOf(label));
  }

  /** Array column as a list; {@code null} stays {@code null}. */
  public List<Object> arrayRaw(int index1Based) {
    Object v = raw(index1Based);
    if (v == null) return null;
    try {
      if (v instanceof java.sql.Array a) {
        Object arr = a.getArray();
        if (arr instanceof Object[] oa) return Arrays.asList(oa);
        throw new IllegalArgumentException("Not an object array: " + arr.getClass());
      }
      if (v instanceof Object[] oa) return Arrays.asList(oa);
      if (v instanceof List<?> l) return new ArrayList<>(l);
      throw new IllegalArgumentException("Not an array: " + v.getClass());
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  private int indexOf(String label) {
    try {
      if (colIndex == null) {
        var md = rs.getMetaData();
        Map<String, Integer> m = new HashMap<>();
        for (int i = 1; i <= md.getColumnCount(); i++) {
          m.putIfAbsent(md.getColumnLabel(i), i);
        }
        colIndex = m;
      }
      Integer idx = colIndex.get(label);
      if (idx == null) throw new IllegalArgumentException("Unknown column: " + label);
      return idx;
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }
}
