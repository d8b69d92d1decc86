package io.intellixity.strata.persistence.jdbc.read;

import io.intellixity.strata.persistence.dmlast.Bind;
import io.intellixity.strata.persistence.error.ReadException;
import io.intellixity.strata.persistence.error.StoreErrorKind;
import io.intellixity.strata.persistence.jdbc.JdbcHandle;
import io.intellixity.strata.persistence.jdbc.JdbcStatementRunner;
import io.intellixity.strata.persistence.jdbc.SqlStatement;
import io.intellixity.strata.persistence.read.BatchResolver;
import io.intellixity.strata.persistence.read.QueryTimer;
import io.intellixity.strata.persistence.read.ResolverKind;
import io.intellixity.strata.persistence.spi.bind.BindOpKind;
import io.intellixity.strata.persistence.value.AttributeCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Base for resolvers backed by one fixed-text query taking the whole batch as a single array bind.\n
 *
 * Input ids are normalized through the input identity's codec, so {@code "42"} and {@code 42} match the same row.
 */
abstract class AbstractJdbcResolver implements BatchResolver {
  private static final Logger log = LoggerFactory.getLogger(BatchResolver.class);

  private final String name;
  private final String key;
  private final String inputIdentity;
  private final String outputIdentity;
  private final ResolverKind kind;
  private final JdbcHandle handle;
  private final SqlStatement template;
  private final AttributeCodec inputCodec;
  private final JdbcStatementRunner runner;

  AbstractJdbcResolver(String name, String key, String inputIdentity, String outputIdentity, ResolverKind kind,
                       JdbcHandle handle, SqlStatement template, AttributeCodec inputCodec,
                       JdbcStatementRunner runner) {
    this.name = name;
    this.key = key;
    this.inputIdentity = inputIdentity;
    this.outputIdentity = outputIdentity;
    this.kind = kind;
    this.handle = handle;
    this.template = template;
    this.inputCodec = inputCodec;
    this.runner = runner;
  }

  @Override public String name() { return name; }
  @Override public String key() { return key; }
  @Override public String inputIdentity() { return inputIdentity; }
  @Override public String outputIdentity() { return outputIdentity; }
  @Override public ResolverKind kind() { return kind; }

  SqlStatement template() { return template; }

  /** Decoded form of each input id; null stays null. */
  final List<Object> normalize(List<Object> ids) {
    List<Object> out = new ArrayList<>(ids.size());
    for (Object id : ids) out.add(id == null ? null : inputCodec.decode(id));
    return out;
  }

  /** Runs the query once for the distinct non-null ids. */
  final <T> List<T> query(List<Object> decodedIds, JdbcStatementRunner.RowMapper<T> mapper) {
    Set<Object> distinct = new LinkedHashSet<>();
    for (Object id : decodedIds) {
      if (id != null) distinct.add(inputCodec.encode(id));
    }
    if (distinct.isEmpty()) return List.of();

    Bind ids = new Bind(new ArrayList<>(distinct), template.binds().get(0).typeId());
    SqlStatement ss = new SqlStatement(template.sql(), List.of(ids), template.execKind());
    return QueryTimer.time(log, kind.name(), name, distinct.size(), () -> {
      try (Connection c = handle.client().getConnection()) {
        return runner.query(c, handle, ss, BindOpKind.FILTER, mapper);
      } catch (SQLException e) {
        throw new ReadException(name, e);
      } catch (RuntimeException e) {
        if (StoreErrorKind.sqlStateOf(e) != null) throw new ReadException(name, e);
        throw e;
      }
    });
  }
}
