package io.intellixity.strata.persistence.dmlast;

/** Backend-agnostic DML statement. Dialects render it into native statements. */
public sealed interface DmlAst permits InsertAst, UpdateAst, DeleteAst {
  String table();
}
