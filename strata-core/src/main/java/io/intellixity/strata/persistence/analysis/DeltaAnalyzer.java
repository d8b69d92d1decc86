package io.intellixity.strata.persistence.analysis;

import io.intellixity.strata.persistence.delta.Change;
import io.intellixity.strata.persistence.delta.Delta;
import io.intellixity.strata.persistence.delta.EntityDelta;
import io.intellixity.strata.persistence.delta.EntityIdent;
import io.intellixity.strata.persistence.delta.TempId;
import io.intellixity.strata.persistence.error.SchemaConfigException;
import io.intellixity.strata.persistence.schema.AttributeDescriptor;
import io.intellixity.strata.persistence.schema.AttributeSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Pure delta analysis: partition classification, validation and reference expansion.\n
 *
 * Reference expansion writes the mirrored side of every ref change that declares a mirror key:\n
 * - link: {@code target[mirror] = RefOne(null, source)}\n
 * - unlink: {@code target[mirror] = Deleted(source)} with delete-orphan, else {@code RefOne(source, null)}\n
 *
 * An unlink never replaces a link already planned for the same target in this expansion (the target
 * was re-parented). Two links to different sources on the same target: the later one in delta order wins
 * and a WARN is logged.
 */
public final class DeltaAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(DeltaAnalyzer.class);

  private final AttributeSchema schema;

  public DeltaAnalyzer(AttributeSchema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  /** Partitions of every identity key and attribute key in the delta, in first-seen order. Unknown keys are skipped. */
  public Set<String> touchedPartitions(Delta delta) {
    Objects.requireNonNull(delta, "delta");
    Set<String> out = new LinkedHashSet<>();
    for (var e : delta.entries().entrySet()) {
      addPartition(out, e.getKey().identityKey());
      for (String k : e.getValue().changes().keySet()) addPartition(out, k);
    }
    return out;
  }

  private void addPartition(Set<String> out, String key) {
    AttributeDescriptor d = schema.get(key);
    if (d != null) out.add(d.partition());
  }

  /**
   * Rejects deltas the planner cannot translate: unknown keys, non-identity entity keys, attributes not
   * owned by the entity, ref attributes carrying scalar changes, and ids or scalar values the attribute codec
   * cannot read as its type.
   */
  public void validate(Delta delta) {
    Objects.requireNonNull(delta, "delta");
    for (var e : delta.entries().entrySet()) {
      EntityIdent ident = e.getKey();
      schema.requireIdentity(ident.identityKey());
      requireReadableId(ident);
      for (var c : e.getValue().changes().entrySet()) {
        AttributeDescriptor d = schema.require(c.getKey());
        if (d.identity()) {
          throw new SchemaConfigException("Identity attribute " + d.key() + " cannot be changed on " + ident);
        }
        if (!d.identities().contains(ident.identityKey())) {
          throw new SchemaConfigException("Attribute " + d.key() + " is not stored on " + ident.identityKey());
        }
        Change ch = c.getValue();
        if (d.isRef() && ch instanceof Change.Scalar) {
          throw new SchemaConfigException("Ref attribute " + d.key() + " needs a ref change, got a scalar one");
        }
        if (d.isToMany() && ch instanceof Change.RefOne) {
          throw new SchemaConfigException("To-many attribute " + d.key() + " needs a RefMany change");
        }
        if (d.isToOne() && ch instanceof Change.RefMany) {
          throw new SchemaConfigException("To-one attribute " + d.key() + " needs a RefOne change");
        }
        if (!d.isRef() && (ch instanceof Change.RefOne || ch instanceof Change.RefMany)) {
          throw new SchemaConfigException("Scalar attribute " + d.key() + " cannot carry a ref change");
        }
        if (ch instanceof Change.Scalar sc && !(sc.after() instanceof TempId) && !(sc.after() instanceof EntityIdent)) {
          schema.codec(d.key()).normalize(sc.after());
        }
        if (ch instanceof Change.RefOne r) {
          requireReadableId(r.before());
          requireReadableId(r.after());
        }
      }
    }
  }

  private void requireReadableId(EntityIdent ident) {
    if (ident == null || ident.isTemp() || schema.get(ident.identityKey()) == null) return;
    schema.codec(ident.identityKey()).normalize(ident.id());
  }

  /** Returns a new delta with the mirrored side of each ref change added. The input is not modified. */
  public Delta expandReferences(Delta delta) {
    Objects.requireNonNull(delta, "delta");
    Delta.Builder acc = delta.toBuilder();

    for (Map.Entry<EntityIdent, EntityDelta> e : delta.entries().entrySet()) {
      EntityIdent source = e.getKey();
      for (Map.Entry<String, Change> c : e.getValue().changes().entrySet()) {
        AttributeDescriptor d = schema.get(c.getKey());
        if (d == null || !d.isRef() || d.mirrorKey() == null) continue;
        String mirror = d.mirrorKey();

        Change ch = c.getValue();
        if (ch instanceof Change.RefOne r) {
          if (r.after() != null) {
            link(acc, r.after(), mirror, source);
            if (r.before() != null && !r.before().equals(r.after())) unlink(acc, r.before(), mirror, source, d.deleteOrphan());
          } else if (r.before() != null) {
            unlink(acc, r.before(), mirror, source, d.deleteOrphan());
          }
        } else if (ch instanceof Change.RefMany m) {
          for (EntityIdent added : m.added()) link(acc, added, mirror, source);
          for (EntityIdent removed : m.removed()) unlink(acc, removed, mirror, source, d.deleteOrphan());
        } else if (ch instanceof Change.Deleted del) {
          unlink(acc, del.before(), mirror, source, true);
        }
      }
    }
    return acc.build();
  }

  private static void link(Delta.Builder acc, EntityIdent target, String mirror, EntityIdent source) {
    Change previous = acc.replace(target, mirror, Change.link(source));
    if (previous instanceof Change.RefOne p && p.after() != null && !p.after().equals(source)) {
      log.warn("strata.delta conflicting mirror writes target={} key={} previous={} winner={}",
          target, mirror, p.after(), source);
    }
  }

  private static void unlink(Delta.Builder acc, EntityIdent target, String mirror, EntityIdent source, boolean deleteOrphan) {
    if (acc.peek(target, mirror) instanceof Change.RefOne p && p.after() != null && !p.after().equals(source)) {
      // re-parented within this delta
      return;
    }
    acc.put(target, mirror, deleteOrphan ? new Change.Deleted(source) : Change.refOne(source, null));
  }
}
