package io.intellixity.strata.examples.config;

import io.intellixity.strata.persistence.exec.SaveEngine;
import io.intellixity.strata.persistence.jdbc.JdbcSaveEngine;
import io.intellixity.strata.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.strata.persistence.jdbc.postgres.PostgresDialect;
import io.intellixity.strata.persistence.jdbc.read.JdbcResolverGenerator;
import io.intellixity.strata.persistence.read.GraphReader;
import io.intellixity.strata.persistence.read.Redactor;
import io.intellixity.strata.persistence.read.ResolverSet;
import io.intellixity.strata.persistence.schema.AttrType;
import io.intellixity.strata.persistence.schema.AttributeDescriptor;
import io.intellixity.strata.persistence.schema.AttributeSchema;
import io.intellixity.strata.persistence.schema.SchemaJsonLoader;
import io.intellixity.strata.persistence.value.CodecRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(PartitionsProperties.class)
public class StrataExampleConfig {

  @Bean
  public AttributeSchema attributeSchema(PartitionsProperties props) {
    // builtins plus codec providers listed in META-INF/strata.factories (csv-tags, json)
    return new SchemaJsonLoader().loadResource(props.getSchemaResource(), CodecRegistry.discovered());
  }

  @Bean(destroyMethod = "close")
  public Partitions partitions(PartitionsProperties props) {
    return Partitions.open(props);
  }

  @Bean
  public JdbcDialect jdbcDialect() {
    return new PostgresDialect();
  }

  @Bean
  public SaveEngine saveEngine(JdbcDialect dialect, AttributeSchema schema, Partitions partitions) {
    return new JdbcSaveEngine(dialect, schema, partitions.handles());
  }

  @Bean
  public ResolverSet resolverSet(JdbcDialect dialect, AttributeSchema schema, Partitions partitions) {
    return new JdbcResolverGenerator(dialect, schema).generate(partitions.handles());
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService readExecutor(PartitionsProperties props) {
    return Executors.newFixedThreadPool(Math.max(1, props.getReadThreads()));
  }

  @Bean
  public Redactor passwordRedactor(AttributeSchema schema) {
    return passwordRedactor(schema.attributes());
  }

  @Bean
  public GraphReader graphReader(AttributeSchema schema, ResolverSet resolvers, ExecutorService readExecutor,
                                 Redactor passwordRedactor) {
    return new GraphReader(schema, resolvers, readExecutor, passwordRedactor);
  }

  /** Drops password attributes from every returned entity, at any depth. */
  static Redactor passwordRedactor(Collection<AttributeDescriptor> attributes) {
    Set<String> hidden = new HashSet<>();
    for (AttributeDescriptor d : attributes) {
      if (d.type() == AttrType.PASSWORD) hidden.add(d.key());
    }
    return (identityKey, results) -> {
      List<Map<String, Object>> out = new ArrayList<>(results.size());
      for (Map<String, Object> m : results) out.add(strip(m, hidden));
      return out;
    };
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> strip(Map<String, Object> m, Set<String> hidden) {
    if (m == null) return null;
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : m.entrySet()) {
      if (hidden.contains(e.getKey())) continue;
      Object v = e.getValue();
      if (v instanceof Map<?, ?> child) {
        v = strip((Map<String, Object>) child, hidden);
      } else if (v instanceof List<?> list) {
        List<Object> copy = new ArrayList<>(list.size());
        for (Object x : list) copy.add(x instanceof Map<?, ?> cm ? strip((Map<String, Object>) cm, hidden) : x);
        v = copy;
      }
      out.put(e.getKey(), v);
    }
    return out;
  }
}
