package io.intellixity.strata.persistence.jdbc.bind;

import io.intellixity.strata.persistence.dmlast.Bind;
import io.intellixity.strata.persistence.spi.bind.BindContext;
import io.intellixity.strata.persistence.spi.bind.Binder;
import io.intellixity.strata.persistence.spi.bind.BinderProvider;
import io.intellixity.strata.persistence.value.CodecRegistry;
import io.intellixity.strata.persistence.value.JsonCodec;
import io.intellixity.strata.persistence.value.ValueCodec;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Portable JDBC binders, registered for every dialect.\n
 *
 * A dialect module subclasses this, scopes it with {@link #dialectId()} and puts its own binders in
 * {@link #dialectBinders()}; they are tried before the portable ones.
 */
public class JdbcBinderProvider implements BinderProvider {
  @Override
  public final Collection<Binder<?, ?>> binders() {
    List<Binder<?, ?>> out = new ArrayList<>(dialectBinders());
    out.add(new InstantBinder());
    out.add(new ListAsJsonBinder());
    out.add(new ObjectBinder());
    return List.copyOf(out);
  }

  protected Collection<Binder<?, ?>> dialectBinders() {
    return List.of();
  }

  /** {@code instant} values go out as {@link Timestamp}. */
  static final class InstantBinder extends JdbcBinder<Instant> {
    InstantBinder() { super(Instant.class); }

    @Override
    public boolean supports(BindContext ctx, Bind bind, Instant value) {
      return bind != null && "instant".equalsIgnoreCase(bind.typeId());
    }

    @Override
    protected void set(PreparedStatement ps, int position, Bind bind, Instant value, CodecRegistry codecs)
        throws SQLException {
      ps.setTimestamp(position, value == null ? null : Timestamp.from(value));
    }
  }

  /** Id batches for drivers without array support: the list is sent as JSON text. */
  static final class ListAsJsonBinder extends JdbcBinder<Collection<?>> {
    private static final JsonCodec FALLBACK = new JsonCodec();

    ListAsJsonBinder() { super(collectionType()); }

    @Override
    public boolean supports(BindContext ctx, Bind bind, Collection<?> value) {
      return isListType(bind);
    }

    @Override
    protected void set(PreparedStatement ps, int position, Bind bind, Collection<?> value, CodecRegistry codecs)
        throws SQLException {
      @SuppressWarnings("unchecked")
      ValueCodec<Object> json = codecs.contains(JsonCodec.ID) ? (ValueCodec<Object>) codecs.named(JsonCodec.ID) : FALLBACK;
      ps.setObject(position, value == null ? null : json.encode(new ArrayList<>(value)));
    }
  }

  /** Last resort: hand the value to the driver as is. */
  static final class ObjectBinder extends JdbcBinder<Object> {
    ObjectBinder() { super(Object.class); }

    @Override
    public boolean supports(BindContext ctx, Bind bind, Object value) {
      return true;
    }

    @Override
    protected void set(PreparedStatement ps, int position, Bind bind, Object value, CodecRegistry codecs)
        throws SQLException {
      ps.setObject(position, value);
    }
  }
}
