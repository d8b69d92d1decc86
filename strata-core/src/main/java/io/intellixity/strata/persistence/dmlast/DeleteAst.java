package io.intellixity.strata.persistence.dmlast;

import java.util.Objects;

/** {@code DELETE FROM table WHERE idColumn = id}. */
public record DeleteAst(String table, String idColumn, Bind id) implements DmlAst {
  public DeleteAst {
    if (table == null || table.isBlank()) throw new IllegalArgumentException("table is required");
    if (idColumn == null || idColumn.isBlank()) throw new IllegalArgumentException("idColumn is required");
    Objects.requireNonNull(id, "id");
  }
}
