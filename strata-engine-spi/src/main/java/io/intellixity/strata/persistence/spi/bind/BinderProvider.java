package io.intellixity.strata.persistence.spi.bind;

import java.util.Collection;

/**
 * Source of {@link Binder}s, listed under this interface's name in META-INF/strata.factories.\n
 *
 * A provider scoped to one dialect is consulted before every unscoped one.
 */
public interface BinderProvider {
  String GLOBAL = "*";

  /** Dialect the binders are written for; {@link #GLOBAL} offers them to every dialect. */
  default String dialectId() {
    return GLOBAL;
  }

  /** Binders in priority order. */
  Collection<Binder<?, ?>> binders();
}
