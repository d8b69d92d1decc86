package io.intellixity.strata.persistence.jdbc.postgres;

import io.intellixity.strata.persistence.dmlast.Bind;
import io.intellixity.strata.persistence.jdbc.bind.JdbcBinder;
import io.intellixity.strata.persistence.jdbc.bind.JdbcBinderProvider;
import io.intellixity.strata.persistence.spi.bind.BindContext;
import io.intellixity.strata.persistence.spi.bind.Binder;
import io.intellixity.strata.persistence.value.CodecRegistry;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/** Binders for the postgres dialect: jsonb documents and native arrays for resolver id batches. */
public final class PostgresBinderProvider extends JdbcBinderProvider {
  @Override
  public String dialectId() {
    return PostgresDialect.ID;
  }

  @Override
  protected Collection<Binder<?, ?>> dialectBinders() {
    return List.of(new JsonbBinder(), new ArrayBinder());
  }

  static final class JsonbBinder extends JdbcBinder<Object> {
    JsonbBinder() { super(Object.class); }

    @Override
    public boolean supports(BindContext ctx, Bind bind, Object value) {
      return bind != null && "json".equalsIgnoreCase(bind.typeId());
    }

    @Override
    protected void set(PreparedStatement ps, int position, Bind bind, Object value, CodecRegistry codecs)
        throws SQLException {
      if (value == null) {
        ps.setNull(position, Types.OTHER);
        return;
      }
      PGobject jsonb = new PGobject();
      jsonb.setType("jsonb");
      jsonb.setValue(String.valueOf(value));
      ps.setObject(position, jsonb);
    }
  }

  /**
   * A {@code list<elem>} bind as one Postgres array, matching the {@code = ANY(:bN::type[])} cast the dialect
   * renders. The element type comes from {@link PostgresDialect#arrayElemType(String)}.
   */
  static final class ArrayBinder extends JdbcBinder<Collection<?>> {
    ArrayBinder() { super(collectionType()); }

    @Override
    public boolean supports(BindContext ctx, Bind bind, Collection<?> value) {
      return isListType(bind);
    }

    @Override
    protected void set(PreparedStatement ps, int position, Bind bind, Collection<?> ids, CodecRegistry codecs)
        throws SQLException {
      if (ids == null) {
        ps.setNull(position, Types.ARRAY);
        return;
      }
      String pgType = PostgresDialect.arrayElemType(listElementType(bind));
      Object[] elements = ids.stream().map(v -> element(pgType, v)).toArray();
      ps.setArray(position, ps.getConnection().createArrayOf(pgType, elements));
    }

    private static Object element(String pgType, Object v) {
      if (v == null) return null;
      if (v instanceof Instant in) return Timestamp.from(in);
      return "text".equals(pgType) ? String.valueOf(v) : v;
    }
  }
}
