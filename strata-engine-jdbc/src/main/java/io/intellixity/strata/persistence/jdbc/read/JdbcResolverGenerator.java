package io.intellixity.strata.persistence.jdbc.read;

import io.intellixity.strata.persistence.error.SchemaConfigException;
import io.intellixity.strata.persistence.jdbc.JdbcHandle;
import io.intellixity.strata.persistence.jdbc.JdbcStatementRunner;
import io.intellixity.strata.persistence.jdbc.SqlStatement;
import io.intellixity.strata.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.strata.persistence.read.BatchResolver;
import io.intellixity.strata.persistence.read.ResolverSet;
import io.intellixity.strata.persistence.schema.AttributeDescriptor;
import io.intellixity.strata.persistence.schema.AttributeSchema;
import io.intellixity.strata.persistence.spi.bind.DiscoveredBinderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Generates one batched resolver per identity and per ref attribute of the schema.\n
 *
 * - identity: {@code SELECT cols FROM table WHERE id = ANY(ids)}\n
 * - forward to-one (foreign key on the source row): alias of the target's id resolver\n
 * - mirrored to-one: target rows by their foreign key back to the source\n
 * - to-many: {@code array_agg} of target ids grouped by foreign key, ordered by {@code orderBy} or the target id\n
 *
 * Each query runs against the handle of the partition owning the queried table. Query text is fixed per
 * resolver; only the id array changes between calls.
 */
public final class JdbcResolverGenerator {
  private static final Logger log = LoggerFactory.getLogger(JdbcResolverGenerator.class);

  private final JdbcDialect dialect;
  private final AttributeSchema schema;
  private final JdbcStatementRunner runner;

  public JdbcResolverGenerator(JdbcDialect dialect, AttributeSchema schema) {
    this(dialect, schema, new DiscoveredBinderRegistry(Objects.requireNonNull(dialect, "dialect").id()));
  }

  public JdbcResolverGenerator(JdbcDialect dialect, AttributeSchema schema, DiscoveredBinderRegistry binders) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.runner = new JdbcStatementRunner(binders, schema.codecRegistry());
  }

  public ResolverSet generate(Map<String, JdbcHandle> handles) {
    Objects.requireNonNull(handles, "handles");
    Map<String, BatchResolver> idResolvers = new LinkedHashMap<>();
    for (AttributeDescriptor id : schema.identities()) {
      RowShape shape = new RowShape(schema, id.key());
      JdbcHandle h = handle(handles, id.partition());
      SqlStatement ss = dialect.selectByIds(h.namespace(), schema.tableName(id.key()), shape.columns(),
          shape.idColumn(), schema.codec(id.key()).codecId());
      idResolvers.put(id.key(), new IdResolver(shape, h, ss, schema.codec(id.key()), runner));
    }

    List<BatchResolver> all = new ArrayList<>(idResolvers.values());
    Set<String> names = new HashSet<>();
    for (BatchResolver r : all) names.add(r.name());

    for (AttributeDescriptor id : schema.identities()) {
      for (AttributeDescriptor d : schema.attributesOf(id.key())) {
        if (!d.isRef()) continue;
        BatchResolver r;
        if (d.isToMany()) {
          r = toMany(handles, id, d);
        } else if (d.mirrorKey() == null) {
          r = new AliasResolver(d.key(), id.key(), idResolvers.get(d.target()));
        } else {
          r = reverseToOne(handles, id, d, names);
        }
        names.add(r.name());
        all.add(r);
      }
    }

    ResolverSet out = ResolverSet.of(all);
    log.info("strata.read generated resolvers={} identities={} partitions={}",
        out.size(), idResolvers.size(), handles.keySet());
    return out;
  }

  private BatchResolver toMany(Map<String, JdbcHandle> handles, AttributeDescriptor source, AttributeDescriptor d) {
    AttributeDescriptor target = schema.requireIdentity(d.target());
    JdbcHandle h = handle(handles, target.partition());
    String order = (d.orderBy() == null) ? schema.columnName(target.key()) : schema.columnName(d.orderBy());
    SqlStatement ss = dialect.aggregateByIds(h.namespace(), schema.tableName(target.key()),
        schema.columnName(d.mirrorKey()), schema.columnName(target.key()), order,
        schema.codec(source.key()).codecId());
    return new ToManyResolver(d.key(), source.key(), target.key(), h, ss,
        schema.codec(source.key()), schema.codec(target.key()), runner);
  }

  private BatchResolver reverseToOne(Map<String, JdbcHandle> handles, AttributeDescriptor source,
                                     AttributeDescriptor d, Set<String> taken) {
    AttributeDescriptor target = schema.requireIdentity(d.target());
    JdbcHandle h = handle(handles, target.partition());
    RowShape shape = new RowShape(schema, target.key());
    String fk = schema.columnName(d.mirrorKey());
    List<String> cols = new ArrayList<>(shape.columns().size() + 1);
    cols.add(fk);
    cols.addAll(shape.columns());
    SqlStatement ss = dialect.selectByIds(h.namespace(), schema.tableName(target.key()), cols, fk,
        schema.codec(source.key()).codecId());

    String name = BatchResolver.reverseResolverName(target.key(), source.key());
    // two mirrored to-ones between the same identities
    if (taken.contains(name)) name = BatchResolver.attributeResolverName(d.key());
    return new ReverseToOneResolver(name, d.key(), source.key(), shape, h, ss, schema.codec(source.key()), runner);
  }

  private static JdbcHandle handle(Map<String, JdbcHandle> handles, String partition) {
    JdbcHandle h = handles.get(partition);
    if (h == null) {
      throw new SchemaConfigException("No handle configured for partition " + partition +
          "; available partitions=" + handles.keySet());
    }
    return h;
  }
}
