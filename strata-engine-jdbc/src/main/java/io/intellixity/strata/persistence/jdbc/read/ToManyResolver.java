package io.intellixity.strata.persistence.jdbc.read;

import io.intellixity.strata.persistence.jdbc.JdbcHandle;
import io.intellixity.strata.persistence.jdbc.JdbcStatementRunner;
import io.intellixity.strata.persistence.jdbc.SqlStatement;
import io.intellixity.strata.persistence.read.BatchResolver;
import io.intellixity.strata.persistence.read.ResolverKind;
import io.intellixity.strata.persistence.value.AttributeCodec;

import java.util.*;

/** Source ids in, ordered target ids out. A source with no members gets an empty list, never null. */
final class ToManyResolver extends AbstractJdbcResolver {
  private final AttributeCodec sourceCodec;
  private final AttributeCodec targetCodec;

  ToManyResolver(String attrKey, String sourceIdentity, String targetIdentity, JdbcHandle handle,
                 SqlStatement template, AttributeCodec sourceCodec, AttributeCodec targetCodec,
                 JdbcStatementRunner runner) {
    super(BatchResolver.attributeResolverName(attrKey), attrKey, sourceIdentity, targetIdentity,
        ResolverKind.TO_MANY, handle, template, sourceCodec, runner);
    this.sourceCodec = sourceCodec;
    this.targetCodec = targetCodec;
  }

  @Override
  public List<Object> resolve(List<Object> ids) {
    if (ids.isEmpty()) return List.of();
    List<Object> keys = normalize(ids);
    Map<Object, List<Object>> bySource = new HashMap<>();
    for (Object[] kv : query(keys, r -> new Object[] {sourceCodec.decode(r.raw(1)), r.arrayRaw(2)})) {
      List<?> raw = (List<?>) kv[1];
      List<Object> targets = new ArrayList<>();
      if (raw != null) {
        for (Object t : raw) if (t != null) targets.add(targetCodec.decode(t));
      }
      bySource.put(kv[0], Collections.unmodifiableList(targets));
    }
    List<Object> out = new ArrayList<>(keys.size());
    for (Object k : keys) out.add(k == null ? List.of() : bySource.getOrDefault(k, List.of()));
    return out;
  }
}
