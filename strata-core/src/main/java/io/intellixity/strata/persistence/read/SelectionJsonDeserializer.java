package io.intellixity.strata.persistence.read;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

/**
 * Canonical JSON deserializer for {@link Selection}.\n
 *
 * Elements are attribute keys or single-or-multi-entry objects mapping a ref key to its child selection.
 */
public final class SelectionJsonDeserializer extends JsonDeserializer<Selection> {
  @Override
  public Selection deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    if (root == null || root.isNull()) return null;
    return parse(root);
  }

  static Selection parse(JsonNode node) {
    if (!node.isArray()) throw new IllegalArgumentException("Selection JSON must be an array");
    Selection.Builder b = Selection.builder();
    for (JsonNode el : node) {
      if (el.isTextual()) {
        b.add(el.asText());
      } else if (el.isObject()) {
        Iterator<Map.Entry<String, JsonNode>> it = el.fields();
        while (it.hasNext()) {
          Map.Entry<String, JsonNode> e = it.next();
          b.add(e.getKey(), parse(e.getValue()));
        }
      } else {
        throw new IllegalArgumentException("Unsupported selection element: " + el);
      }
    }
    return b.build();
  }
}
