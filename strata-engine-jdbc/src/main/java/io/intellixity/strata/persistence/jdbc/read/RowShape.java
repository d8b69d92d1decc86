package io.intellixity.strata.persistence.jdbc.read;

import io.intellixity.strata.persistence.jdbc.JdbcRowAdapter;
import io.intellixity.strata.persistence.schema.AttributeDescriptor;
import io.intellixity.strata.persistence.schema.AttributeSchema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Columns of one identity's table and how each decodes into a row map.\n
 *
 * The id column comes first. Forward to-one columns decode to {@code {targetIdKey: id}}.
 */
final class RowShape {
  private final AttributeSchema schema;
  private final AttributeDescriptor identity;
  private final List<AttributeDescriptor> attrs;
  private final List<String> columns;

  RowShape(AttributeSchema schema, String identityKey) {
    this.schema = schema;
    this.identity = schema.requireIdentity(identityKey);
    List<AttributeDescriptor> as = new ArrayList<>();
    List<String> cs = new ArrayList<>();
    as.add(identity);
    cs.add(schema.columnName(identityKey));
    for (AttributeDescriptor d : schema.attributesOf(identityKey)) {
      if (!isColumn(d, identity.partition())) continue;
      as.add(d);
      cs.add(schema.columnName(d.key()));
    }
    this.attrs = List.copyOf(as);
    this.columns = List.copyOf(cs);
  }

  /** Attributes held in the identity's own table: scalars and foreign-key to-one refs of its partition. */
  static boolean isColumn(AttributeDescriptor d, String partition) {
    if (d.identity() || d.isToMany()) return false;
    if (partition != null && !partition.equals(d.partition())) return false;
    return !(d.isToOne() && d.mirrorKey() != null);
  }

  String identityKey() { return identity.key(); }
  String idColumn() { return columns.get(0); }
  List<String> columns() { return columns; }

  /** Decodes columns {@code offset+1 ..} of the current row. */
  Map<String, Object> decode(JdbcRowAdapter row, int offset) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (int i = 0; i < attrs.size(); i++) {
      AttributeDescriptor d = attrs.get(i);
      Object raw = row.raw(offset + i + 1);
      if (d.isToOne()) {
        Object fk = schema.codec(d.target()).decode(raw);
        if (fk == null) {
          out.put(d.key(), null);
        } else {
          Map<String, Object> ref = new LinkedHashMap<>();
          ref.put(d.target(), fk);
          out.put(d.key(), ref);
        }
      } else {
        out.put(d.key(), schema.codec(d.key()).decode(raw));
      }
    }
    return out;
  }
}
