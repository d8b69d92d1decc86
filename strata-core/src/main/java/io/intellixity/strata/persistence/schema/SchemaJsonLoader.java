package io.intellixity.strata.persistence.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.strata.persistence.error.SchemaConfigException;
import io.intellixity.strata.persistence.value.CodecRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Loads attribute descriptors from JSON.\n
 *
 * Accepts either a top-level array or {@code {"attributes": [...]}}. Each element:\n
 *\n
 * <pre>\n
 * { "key": "account/name", "type": "string", "partition": "main", "identities": ["account/id"],\n
 *   "column": "name", "maxLength": 200, "codec": "csv-tags" }\n
 * { "key": "account/orders", "type": "ref", "cardinality": "many", "target": "order/id",\n
 *   "mirrorKey": "order/account", "deleteOrphan": true, "orderBy": "order/placedAt", ... }\n
 * </pre>\n
 *
 * A document-level {@code "partition"} is the default for elements that omit it. Inline
 * encoder/decoder functions cannot be expressed in JSON; use a named {@code codec} instead.
 */
public final class SchemaJsonLoader {
  private final ObjectMapper mapper;

  public SchemaJsonLoader() {
    this(new ObjectMapper());
  }

  public SchemaJsonLoader(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public AttributeSchema load(InputStream in, CodecRegistry codecs) {
    return AttributeSchema.of(read(in), codecs);
  }

  public AttributeSchema loadResource(String resource, CodecRegistry codecs) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = SchemaJsonLoader.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new SchemaConfigException("Schema resource not found: " + resource);
      return load(in, codecs);
    } catch (IOException e) {
      throw new SchemaConfigException("Failed to read schema resource " + resource, e);
    }
  }

  public List<AttributeDescriptor> read(InputStream in) {
    Objects.requireNonNull(in, "in");
    try {
      return parse(mapper.readTree(in));
    } catch (IOException e) {
      throw new SchemaConfigException("Invalid schema JSON", e);
    }
  }

  public List<AttributeDescriptor> read(String json) {
    Objects.requireNonNull(json, "json");
    try {
      return parse(mapper.readTree(json));
    } catch (IOException e) {
      throw new SchemaConfigException("Invalid schema JSON", e);
    }
  }

  private List<AttributeDescriptor> parse(JsonNode root) {
    if (root == null || root.isNull()) return List.of();
    String defaultPartition = null;
    JsonNode list = root;
    if (root.isObject()) {
      defaultPartition = text(root.get("partition"));
      list = root.get("attributes");
    }
    if (list == null || !list.isArray()) throw new SchemaConfigException("Schema JSON must contain an attributes array");

    List<AttributeDescriptor> out = new ArrayList<>();
    int i = 0;
    for (JsonNode n : list) {
      try {
        out.add(parseOne(n, defaultPartition));
      } catch (IllegalArgumentException e) {
        throw new SchemaConfigException("Invalid attribute at index " + i + ": " + e.getMessage(), e);
      }
      i++;
    }
    return out;
  }

  private static AttributeDescriptor parseOne(JsonNode n, String defaultPartition) {
    if (!n.isObject()) throw new IllegalArgumentException("attribute must be an object");
    String key = text(n.get("key"));
    AttrType type = AttrType.fromId(text(n.get("type")));
    String card = text(n.get("cardinality"));
    Cardinality cardinality = (card == null) ? null : Cardinality.valueOf(card.toUpperCase(Locale.ROOT));
    boolean identity = n.path("identity").asBoolean(false);

    Set<String> identities = new LinkedHashSet<>();
    JsonNode ids = n.get("identities");
    if (ids != null && ids.isArray()) {
      for (JsonNode x : ids) if (x.isTextual()) identities.add(x.asText());
    } else if (ids != null && ids.isTextual()) {
      identities.add(ids.asText());
    }

    String partition = text(n.get("partition"));
    if (partition == null) partition = defaultPartition;
    JsonNode ml = n.get("maxLength");
    Integer maxLength = (ml == null || ml.isNull()) ? null : ml.asInt();

    return new AttributeDescriptor(
        key, type, cardinality, identity, identities, partition,
        text(n.get("table")),
        text(n.get("column")),
        text(n.get("target")),
        text(n.get("mirrorKey")),
        n.path("deleteOrphan").asBoolean(false),
        text(n.get("orderBy")),
        maxLength,
        text(n.get("codec")),
        null, null);
  }

  private static String text(JsonNode n) {
    if (n == null || n.isNull()) return null;
    String s = n.asText();
    return s.isBlank() ? null : s.trim();
  }
}
