package io.intellixity.strata.persistence.read;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link Selection}. */
public final class SelectionJsonSerializer extends JsonSerializer<Selection> {
  @Override
  public void serialize(Selection s, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (s == null) {
      g.writeNull();
      return;
    }
    write(s, g);
  }

  private static void write(Selection s, JsonGenerator g) throws IOException {
    g.writeStartArray();
    for (String key : s.keys()) {
      if (!s.hasChild(key)) {
        g.writeString(key);
        continue;
      }
      g.writeStartObject();
      g.writeFieldName(key);
      write(s.child(key), g);
      g.writeEndObject();
    }
    g.writeEndArray();
  }
}
