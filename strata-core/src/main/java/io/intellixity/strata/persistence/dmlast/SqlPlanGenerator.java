package io.intellixity.strata.persistence.dmlast;

import io.intellixity.strata.persistence.delta.Change;
import io.intellixity.strata.persistence.delta.Delta;
import io.intellixity.strata.persistence.delta.EntityDelta;
import io.intellixity.strata.persistence.delta.EntityIdent;
import io.intellixity.strata.persistence.ids.ResolvedIds;
import io.intellixity.strata.persistence.schema.AttributeDescriptor;
import io.intellixity.strata.persistence.schema.AttributeSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Translates an expanded, id-resolved delta into the DML of one partition. Pure.\n
 *
 * Per entity of the partition:\n
 * - temporary identity: INSERT of the id plus every non-null table-local value\n
 * - existing identity, deleted (explicitly or via a delete-orphan change): DELETE by id\n
 * - existing identity otherwise: UPDATE of the table-local columns that change, if any\n
 *
 * Table-local attributes live in the partition and in the entity's own table: not to-many refs, and to-one
 * refs only when they hold the foreign key (no mirror key).\n
 * Values go through the attribute codec, so loosely typed input (an Integer id for a long identity, a numeric
 * string for a decimal) is normalized first; input the codec cannot read fails with {@code SchemaConfigException}.
 */
public final class SqlPlanGenerator {
  private SqlPlanGenerator() {}

  public static SqlPlan generate(AttributeSchema schema, String partition, ResolvedIds ids, Delta delta) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(partition, "partition");
    Objects.requireNonNull(ids, "ids");
    Objects.requireNonNull(delta, "delta");

    List<DmlAst> updates = new ArrayList<>();
    List<InsertAst> inserts = new ArrayList<>();
    for (Map.Entry<EntityIdent, EntityDelta> e : delta.entries().entrySet()) {
      EntityIdent ident = e.getKey();
      AttributeDescriptor idAttr = schema.requireIdentity(ident.identityKey());
      if (!partition.equals(idAttr.partition())) continue;

      if (ident.isTemp()) {
        InsertAst ins = insert(schema, partition, ids, ident, idAttr, e.getValue());
        if (ins != null) inserts.add(ins);
      } else {
        DmlAst upd = updateOrDelete(schema, partition, ids, ident, idAttr, e.getValue());
        if (upd != null) updates.add(upd);
      }
    }
    return new SqlPlan(updates, inserts);
  }

  static boolean tableLocal(AttributeDescriptor d, String partition) {
    if (d.identity() || !partition.equals(d.partition())) return false;
    if (d.isToMany()) return false;
    return !(d.isToOne() && d.mirrorKey() != null);
  }

  private static InsertAst insert(AttributeSchema schema, String partition, ResolvedIds ids,
                                  EntityIdent ident, AttributeDescriptor idAttr, EntityDelta ed) {
    // created and removed in the same save
    if (ed.deleted()) return null;

    List<ColumnBind> cols = new ArrayList<>();
    cols.add(idColumn(schema, ids, ident, idAttr));
    for (Map.Entry<String, Change> c : ed.changes().entrySet()) {
      AttributeDescriptor d = schema.require(c.getKey());
      if (!tableLocal(d, partition)) continue;
      if (c.getValue() instanceof Change.Deleted) return null;
      Object v = encodedAfter(schema, ids, d, c.getValue());
      if (v == null) continue;
      cols.add(new ColumnBind(schema.columnName(d.key()), new Bind(v, bindType(schema, d))));
    }
    return new InsertAst(schema.tableName(idAttr.key()), cols);
  }

  private static DmlAst updateOrDelete(AttributeSchema schema, String partition, ResolvedIds ids,
                                       EntityIdent ident, AttributeDescriptor idAttr, EntityDelta ed) {
    String table = schema.tableName(idAttr.key());
    ColumnBind id = idColumn(schema, ids, ident, idAttr);
    if (ed.deleted()) return new DeleteAst(table, id.column(), id.bind());

    List<ColumnBind> sets = new ArrayList<>();
    for (Map.Entry<String, Change> c : ed.changes().entrySet()) {
      AttributeDescriptor d = schema.require(c.getKey());
      if (!tableLocal(d, partition)) continue;
      Change ch = c.getValue();
      if (ch instanceof Change.Deleted) return new DeleteAst(table, id.column(), id.bind());
      if (ch.isNoop()) continue;

      Object after = encodedAfter(schema, ids, d, ch);
      boolean hadBefore = before(ch) != null;
      if (after == null && !hadBefore) continue;
      sets.add(new ColumnBind(schema.columnName(d.key()), new Bind(after, bindType(schema, d))));
    }
    if (sets.isEmpty()) return null;
    return new UpdateAst(table, sets, id.column(), id.bind());
  }

  private static ColumnBind idColumn(AttributeSchema schema, ResolvedIds ids, EntityIdent ident, AttributeDescriptor idAttr) {
    Object raw = ids.idOf(ident);
    Object encoded = schema.codec(idAttr.key()).encode(raw);
    return new ColumnBind(schema.columnName(idAttr.key()), new Bind(encoded, schema.codec(idAttr.key()).codecId()));
  }

  private static Object before(Change ch) {
    if (ch instanceof Change.Scalar s) return s.before();
    if (ch instanceof Change.RefOne r) return r.before();
    return null;
  }

  private static Object encodedAfter(AttributeSchema schema, ResolvedIds ids, AttributeDescriptor d, Change ch) {
    Object v;
    if (ch instanceof Change.Scalar s) {
      v = ids.resolve(s.after());
      if (v instanceof EntityIdent i) v = i.id();
    } else if (ch instanceof Change.RefOne r) {
      v = (r.after() == null) ? null : schema.codec(d.target()).normalize(ids.idOf(r.after()));
    } else {
      throw new IllegalArgumentException("Unsupported change for column " + d.key() + ": " + ch);
    }
    return schema.codec(d.key()).encode(v);
  }

  /** Foreign key columns bind with the codec id of the identity they point at. */
  private static String bindType(AttributeSchema schema, AttributeDescriptor d) {
    if (d.isRef()) return schema.codec(d.target()).codecId();
    return schema.codec(d.key()).codecId();
  }
}
