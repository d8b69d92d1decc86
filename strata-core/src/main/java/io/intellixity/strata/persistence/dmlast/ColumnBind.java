package io.intellixity.strata.persistence.dmlast;

import java.util.Objects;

public record ColumnBind(String column, Bind bind) {
  public ColumnBind {
    if (column == null || column.isBlank()) throw new IllegalArgumentException("column is required");
    Objects.requireNonNull(bind, "bind");
  }
}
