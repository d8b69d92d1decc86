package io.intellixity.strata.persistence.schema;

import io.intellixity.strata.persistence.error.SchemaConfigException;
import io.intellixity.strata.persistence.value.CodecRegistry;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaJsonLoaderTest {

  private static final String SCHEMA = """
      {
        "partition": "main",
        "attributes": [
          {"key": "account/id", "type": "uuid", "identity": true, "table": "accounts"},
          {"key": "account/name", "type": "string", "identities": ["account/id"], "maxLength": 200},
          {"key": "account/tags", "type": "string", "identities": "account/id", "codec": "csv-tags"},
          {"key": "account/orders", "type": "ref", "cardinality": "many", "identities": ["account/id"],
           "target": "order/id", "mirrorKey": "order/account", "deleteOrphan": true, "orderBy": "order/placedAt"},
          {"key": "order/id", "type": "long", "identity": true, "table": "orders"},
          {"key": "order/account", "type": "ref", "identities": ["order/id"], "target": "account/id", "column": "account_id"},
          {"key": "order/placedAt", "type": "instant", "identities": ["order/id"]},
          {"key": "audit/id", "type": "uuid", "identity": true, "partition": "audit"}
        ]
      }
      """;

  @Test
  void readsAttributesWithDefaultPartition() {
    List<AttributeDescriptor> attrs = new SchemaJsonLoader().read(SCHEMA);
    assertEquals(8, attrs.size());

    AttributeDescriptor orders = attrs.get(3);
    assertEquals(Cardinality.MANY, orders.cardinality());
    assertTrue(orders.deleteOrphan());
    assertEquals("order/placedAt", orders.orderBy());
    assertEquals("main", orders.partition());

    AttributeDescriptor account = attrs.get(5);
    assertEquals(Cardinality.ONE, account.cardinality());
    assertEquals("account_id", account.column());
    assertEquals(Set.of("account/id"), attrs.get(2).identities());
    assertEquals("audit", attrs.get(7).partition());
    assertEquals(200, attrs.get(1).maxLength());
  }

  @Test
  void loadsAValidatedSchema() {
    AttributeSchema s = new SchemaJsonLoader().load(
        new ByteArrayInputStream(SCHEMA.getBytes(StandardCharsets.UTF_8)), CodecRegistry.discovered());
    assertEquals("csv-tags", s.codec("account/tags").codecId());
    assertEquals("orders_id_seq", s.sequenceName("order/id"));
    assertEquals(Set.of("main", "audit"), s.partitions());
  }

  @Test
  void reportsTheIndexOfABadAttribute() {
    String bad = """
        [{"key": "account/id", "type": "uuid", "identity": true, "partition": "main"},
         {"key": "account/age", "type": "float", "identities": ["account/id"], "partition": "main"}]
        """;
    SchemaConfigException ex = assertThrows(SchemaConfigException.class, () -> new SchemaJsonLoader().read(bad));
    assertTrue(ex.getMessage().contains("index 1"), ex.getMessage());
  }

  @Test
  void missingResourceIsAConfigError() {
    assertThrows(SchemaConfigException.class,
        () -> new SchemaJsonLoader().loadResource("schema/does-not-exist.json", CodecRegistry.builtins()));
  }
}
