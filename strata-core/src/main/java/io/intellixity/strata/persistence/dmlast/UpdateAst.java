package io.intellixity.strata.persistence.dmlast;

import java.util.List;
import java.util.Objects;

/** {@code UPDATE table SET sets WHERE idColumn = id}. */
public record UpdateAst(String table, List<ColumnBind> sets, String idColumn, Bind id) implements DmlAst {
  public UpdateAst {
    if (table == null || table.isBlank()) throw new IllegalArgumentException("table is required");
    sets = sets == null ? List.of() : List.copyOf(sets);
    if (sets.isEmpty()) throw new IllegalArgumentException("Update of " + table + " has no SET columns");
    if (idColumn == null || idColumn.isBlank()) throw new IllegalArgumentException("idColumn is required");
    Objects.requireNonNull(id, "id");
  }
}
