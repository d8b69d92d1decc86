package io.intellixity.strata.persistence.dmlast;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** One new row: the id column first, then every non-null scalar of the new instance. */
public record InsertAst(String table, List<ColumnBind> columns) implements DmlAst {
  public InsertAst {
    if (table == null || table.isBlank()) throw new IllegalArgumentException("table is required");
    columns = columns == null ? List.of() : List.copyOf(columns);
    if (columns.isEmpty()) throw new IllegalArgumentException("Insert into " + table + " has no columns");
    Set<String> seen = new HashSet<>();
    for (ColumnBind cb : columns) {
      if (!seen.add(cb.column())) {
        throw new IllegalArgumentException("Insert into " + table + " sets column " + cb.column() + " twice");
      }
    }
  }
}
