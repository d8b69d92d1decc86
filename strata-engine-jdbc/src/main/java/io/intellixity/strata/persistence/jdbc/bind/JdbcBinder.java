package io.intellixity.strata.persistence.jdbc.bind;

import io.intellixity.strata.persistence.dmlast.Bind;
import io.intellixity.strata.persistence.spi.bind.BindContext;
import io.intellixity.strata.persistence.spi.bind.Binder;
import io.intellixity.strata.persistence.value.CodecRegistry;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Collection;

/**
 * Binder into a {@link PreparedStatement} parameter.\n
 *
 * Resolves the parameter index from the {@link JdbcBindContext}; a driver {@link SQLException} is rethrown
 * unchecked with the original as cause so the save and read paths can still read its SQLState.
 */
public abstract class JdbcBinder<V> implements Binder<PreparedStatement, V> {
  private final Class<V> valueType;

  protected JdbcBinder(Class<V> valueType) {
    this.valueType = valueType;
  }

  @Override public final Class<PreparedStatement> targetType() { return PreparedStatement.class; }

  @Override public final Class<V> valueType() { return valueType; }

  @Override
  public final void bind(PreparedStatement ps, BindContext ctx, Bind bind, V encodedValue, CodecRegistry codecs) {
    int position = JdbcBindContext.positionOf(ctx);
    try {
      set(ps, position, bind, encodedValue, codecs);
    } catch (SQLException e) {
      throw new RuntimeException("bind failed at parameter " + position + " typeId=" + bind.typeId(), e);
    }
  }

  protected abstract void set(PreparedStatement ps, int position, Bind bind, V value, CodecRegistry codecs)
      throws SQLException;

  /** True for {@code list<elem>} type ids. */
  protected static boolean isListType(Bind bind) {
    if (bind == null) return false;
    String t = bind.typeId();
    return t.startsWith("list<") && t.endsWith(">");
  }

  /** Element type id of a {@code list<elem>} type id. */
  protected static String listElementType(Bind bind) {
    String t = bind.typeId();
    return t.substring("list<".length(), t.length() - 1);
  }

  @SuppressWarnings("unchecked")
  protected static Class<Collection<?>> collectionType() {
    return (Class<Collection<?>>) (Class<?>) Collection.class;
  }
}
