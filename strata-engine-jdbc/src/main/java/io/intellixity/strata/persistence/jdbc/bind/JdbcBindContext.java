package io.intellixity.strata.persistence.jdbc.bind;

import io.intellixity.strata.persistence.spi.bind.BindContext;
import io.intellixity.strata.persistence.spi.bind.BindOpKind;

/** Where a value lands in a prepared statement: the statement role and the 1-based parameter index. */
public record JdbcBindContext(BindOpKind opKind, int position) implements BindContext {
  public JdbcBindContext {
    if (opKind == null) throw new IllegalArgumentException("opKind is required");
    if (position < 1) throw new IllegalArgumentException("position is 1-based, got " + position);
  }

  /** Parameter index of a JDBC bind; JDBC binders reject any other context. */
  public static int positionOf(BindContext ctx) {
    if (ctx instanceof JdbcBindContext jc) return jc.position();
    throw new IllegalArgumentException("JDBC binder called with " + (ctx == null ? "null" : ctx.getClass().getName()));
  }
}
