package io.intellixity.strata.persistence.jdbc.read;

import io.intellixity.strata.persistence.read.BatchResolver;
import io.intellixity.strata.persistence.read.ResolverKind;

import java.util.List;

/** Forward to-one: the parent row already holds the target id, so this answers with the target's id resolver. */
final class AliasResolver implements BatchResolver {
  private final String attrKey;
  private final String sourceIdentity;
  private final BatchResolver target;

  AliasResolver(String attrKey, String sourceIdentity, BatchResolver target) {
    this.attrKey = attrKey;
    this.sourceIdentity = sourceIdentity;
    this.target = target;
  }

  @Override public String name() { return BatchResolver.attributeResolverName(attrKey); }
  @Override public String key() { return attrKey; }
  @Override public String inputIdentity() { return sourceIdentity; }
  @Override public String outputIdentity() { return target.outputIdentity(); }
  @Override public ResolverKind kind() { return ResolverKind.ALIAS; }

  @Override
  public List<Object> resolve(List<Object> ids) {
    return target.resolve(ids);
  }
}
