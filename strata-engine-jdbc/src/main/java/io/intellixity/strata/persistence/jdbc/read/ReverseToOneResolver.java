package io.intellixity.strata.persistence.jdbc.read;

import io.intellixity.strata.persistence.jdbc.JdbcHandle;
import io.intellixity.strata.persistence.jdbc.JdbcStatementRunner;
import io.intellixity.strata.persistence.jdbc.SqlStatement;
import io.intellixity.strata.persistence.read.ResolverKind;
import io.intellixity.strata.persistence.value.AttributeCodec;

import java.util.*;

/**
 * Source ids in, the target row whose foreign key points back at each source out.\n
 * The foreign key column is selected first; the target row columns follow.
 */
final class ReverseToOneResolver extends AbstractJdbcResolver {
  private final RowShape targetShape;
  private final AttributeCodec sourceCodec;

  ReverseToOneResolver(String name, String attrKey, String sourceIdentity, RowShape targetShape, JdbcHandle handle,
                       SqlStatement template, AttributeCodec sourceCodec, JdbcStatementRunner runner) {
    super(name, attrKey, sourceIdentity, targetShape.identityKey(), ResolverKind.TO_ONE, handle, template,
        sourceCodec, runner);
    this.targetShape = targetShape;
    this.sourceCodec = sourceCodec;
  }

  @Override
  public List<Object> resolve(List<Object> ids) {
    if (ids.isEmpty()) return List.of();
    List<Object> keys = normalize(ids);
    Map<Object, Map<String, Object>> bySource = new HashMap<>();
    for (Object[] kv : query(keys, r -> new Object[] {sourceCodec.decode(r.raw(1)), targetShape.decode(r, 1)})) {
      bySource.putIfAbsent(kv[0], castRow(kv[1]));
    }
    List<Object> out = new ArrayList<>(keys.size());
    for (Object k : keys) out.add(k == null ? null : bySource.get(k));
    return out;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> castRow(Object v) {
    return (Map<String, Object>) v;
  }
}
