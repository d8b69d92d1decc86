package io.intellixity.strata.persistence.jdbc.read;

import io.intellixity.strata.persistence.jdbc.JdbcHandle;
import io.intellixity.strata.persistence.jdbc.JdbcStatementRunner;
import io.intellixity.strata.persistence.jdbc.SqlStatement;
import io.intellixity.strata.persistence.read.BatchResolver;
import io.intellixity.strata.persistence.read.ResolverKind;
import io.intellixity.strata.persistence.value.AttributeCodec;

import java.util.*;

/** Rows of one identity by id, in input order; unknown ids give null. */
final class IdResolver extends AbstractJdbcResolver {
  private final RowShape shape;

  IdResolver(RowShape shape, JdbcHandle handle, SqlStatement template, AttributeCodec idCodec, JdbcStatementRunner runner) {
    super(BatchResolver.idResolverName(shape.identityKey()), shape.identityKey(), shape.identityKey(),
        shape.identityKey(), ResolverKind.ID, handle, template, idCodec, runner);
    this.shape = shape;
  }

  @Override
  public List<Object> resolve(List<Object> ids) {
    if (ids.isEmpty()) return List.of();
    List<Object> keys = normalize(ids);
    Map<Object, Map<String, Object>> byId = new HashMap<>();
    for (Map<String, Object> row : query(keys, r -> shape.decode(r, 0))) {
      byId.put(row.get(shape.identityKey()), row);
    }
    List<Object> out = new ArrayList<>(keys.size());
    for (Object k : keys) out.add(k == null ? null : byId.get(k));
    return out;
  }
}
