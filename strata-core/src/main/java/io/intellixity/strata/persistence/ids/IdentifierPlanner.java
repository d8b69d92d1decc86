package io.intellixity.strata.persistence.ids;

import io.intellixity.strata.persistence.delta.Change;
import io.intellixity.strata.persistence.delta.Delta;
import io.intellixity.strata.persistence.delta.EntityDelta;
import io.intellixity.strata.persistence.delta.EntityIdent;
import io.intellixity.strata.persistence.delta.TempId;
import io.intellixity.strata.persistence.schema.AttributeDescriptor;
import io.intellixity.strata.persistence.schema.AttributeSchema;

import java.util.*;

/**
 * Splits the temporary ids of a delta into sequence-backed and locally generated ones. No I/O.\n
 *
 * Temporary ids are collected from delta keys and from every {@link EntityIdent} found in change values.
 * A bare {@link TempId} in a scalar value must also appear inside some {@link EntityIdent} of the same delta,
 * otherwise its identity type is unknown.
 */
public final class IdentifierPlanner {
  private IdentifierPlanner() {}

  public static IdentifierPlan plan(AttributeSchema schema, Delta delta) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(delta, "delta");

    Map<TempId, String> identityOf = new LinkedHashMap<>();
    Set<TempId> bare = new LinkedHashSet<>();
    for (var e : delta.entries().entrySet()) {
      collect(e.getKey(), identityOf);
      for (Change c : e.getValue().changes().values()) collect(c, identityOf, bare);
    }
    for (TempId t : bare) {
      if (!identityOf.containsKey(t)) {
        throw new IllegalArgumentException("Temporary id " + t + " is not attached to any entity identity in the delta");
      }
    }

    Map<TempId, SequenceTarget> sequenceIds = new LinkedHashMap<>();
    Map<TempId, String> localIds = new LinkedHashMap<>();
    for (var e : identityOf.entrySet()) {
      AttributeDescriptor id = schema.requireIdentity(e.getValue());
      if (id.type().sequenceBacked()) {
        sequenceIds.put(e.getKey(), new SequenceTarget(id.partition(), schema.sequenceName(id.key()), id.key()));
      } else {
        localIds.put(e.getKey(), id.key());
      }
    }
    return new IdentifierPlan(sequenceIds, localIds);
  }

  /** Temporary ids mentioned by one delta entry, as its key or in any change value. */
  public static Set<TempId> tempIdsOf(EntityIdent ident, EntityDelta entry) {
    Map<TempId, String> identityOf = new LinkedHashMap<>();
    Set<TempId> bare = new LinkedHashSet<>();
    collect(ident, identityOf);
    if (entry != null) {
      for (Change c : entry.changes().values()) collect(c, identityOf, bare);
    }
    Set<TempId> out = new LinkedHashSet<>(identityOf.keySet());
    out.addAll(bare);
    return out;
  }

  private static void collect(Change c, Map<TempId, String> identityOf, Set<TempId> bare) {
    if (c instanceof Change.Scalar s) {
      collectValue(s.before(), identityOf, bare);
      collectValue(s.after(), identityOf, bare);
    } else if (c instanceof Change.RefOne r) {
      collect(r.before(), identityOf);
      collect(r.after(), identityOf);
    } else if (c instanceof Change.RefMany m) {
      for (EntityIdent i : m.before()) collect(i, identityOf);
      for (EntityIdent i : m.after()) collect(i, identityOf);
    } else if (c instanceof Change.Deleted d) {
      collect(d.before(), identityOf);
    }
  }

  private static void collectValue(Object v, Map<TempId, String> identityOf, Set<TempId> bare) {
    if (v instanceof EntityIdent i) collect(i, identityOf);
    else if (v instanceof TempId t) bare.add(t);
  }

  private static void collect(EntityIdent ident, Map<TempId, String> identityOf) {
    if (ident == null || !ident.isTemp()) return;
    String previous = identityOf.putIfAbsent(ident.tempId(), ident.identityKey());
    if (previous != null && !previous.equals(ident.identityKey())) {
      throw new IllegalArgumentException("Temporary id " + ident.id() + " used for both " + previous +
          " and " + ident.identityKey());
    }
  }
}
