package io.intellixity.strata.persistence.read;

import java.util.List;

/**
 * A generated batched read accessor.\n
 *
 * {@link #resolve(List)} issues at most one store round trip for the whole batch and returns a list
 * positionally aligned with {@code ids}. Implementations are immutable and safe for concurrent use.
 */
public interface BatchResolver {
  /** Resolver name, e.g. {@code account/id-resolver}. */
  String name();

  /** Identity key (for {@link ResolverKind#ID}) or ref attribute key this resolver answers. */
  String key();

  /** Identity key the input ids belong to. */
  String inputIdentity();

  /** Identity key of the entities the output describes. */
  String outputIdentity();

  ResolverKind kind();

  List<Object> resolve(List<Object> ids);

  static String idResolverName(String identityKey) {
    return identityKey + "-resolver";
  }

  static String attributeResolverName(String attributeKey) {
    return attributeKey + "-resolver";
  }

  /** {@code order/by-account-id-resolver} for the reverse to-one from {@code account/id} to {@code order/id}. */
  static String reverseResolverName(String targetKey, String sourceIdentityKey) {
    String ns = targetKey.substring(0, targetKey.indexOf('/'));
    return ns + "/by-" + sourceIdentityKey.replace('/', '-') + "-resolver";
  }
}
