package io.intellixity.strata.persistence.value;

import io.intellixity.strata.persistence.schema.AttrType;
import io.intellixity.strata.persistence.schema.AttributeDescriptor;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class BuiltinCodecsTest {

  @Test
  void everyTypeHasACodecNamedAfterIt() {
    Map<AttrType, ValueCodec<?>> all = BuiltinCodecs.all();
    assertEquals(AttrType.values().length, all.size());
    for (AttrType t : AttrType.values()) assertEquals(t.id(), all.get(t).id(), t.name());
  }

  @Test
  void stringsKeepEmptyAndLongValues() {
    ValueCodec<String> c = BuiltinCodecs.string("string");
    assertEquals("", c.decode(c.encode("")));
    String longest = "x".repeat(200);
    assertEquals(longest, c.decode(c.encode(longest)));
    assertEquals("ünïcødé", c.decode("ünïcødé"));
  }

  @Test
  void numbersDecodeFromDriverShapes() {
    assertEquals(0, BuiltinCodecs.integer().decode(0L));
    assertEquals(-42, BuiltinCodecs.integer().decode(" -42 "));
    assertEquals(Long.MIN_VALUE, BuiltinCodecs.longType().decode(Long.MIN_VALUE));
    assertEquals(7L, BuiltinCodecs.longType().decode(7));
    assertThrows(ArithmeticException.class, () -> BuiltinCodecs.integer().decode(Long.MAX_VALUE));
  }

  @Test
  void decimalsStayExact() {
    ValueCodec<BigDecimal> c = BuiltinCodecs.decimal();
    assertEquals(new BigDecimal("-0.10"), c.decode("-0.10"));
    assertEquals(BigDecimal.valueOf(12L), c.decode(12L));
    assertEquals(new BigDecimal("0.1"), c.decode(0.1d));
    assertEquals(new BigDecimal("19.99"), c.decode(c.encode(new BigDecimal("19.99"))));
  }

  @Test
  void instantsKeepNanosAroundLeapSecond() {
    ValueCodec<Instant> c = BuiltinCodecs.instant();
    Instant beforeLeap = Instant.parse("2016-12-31T23:59:59.999999999Z");
    assertEquals(beforeLeap, c.decode(c.encode(beforeLeap)));
    assertEquals(beforeLeap, c.decode(Timestamp.from(beforeLeap)));
    assertEquals(beforeLeap, c.decode(OffsetDateTime.ofInstant(beforeLeap, ZoneOffset.ofHours(5))));
    assertEquals(Instant.parse("2017-01-01T00:00:00Z"), c.decode("2017-01-01T00:00:00Z"));
  }

  @Test
  void uuidsDecodeFromText() {
    UUID id = UUID.randomUUID();
    assertEquals(id, BuiltinCodecs.uuid().decode(id.toString()));
    assertSame(id, BuiltinCodecs.uuid().decode(id));
  }

  @Test
  void booleansAcceptNumbersAndText() {
    assertEquals(Boolean.TRUE, BuiltinCodecs.bool().decode(1));
    assertEquals(Boolean.FALSE, BuiltinCodecs.bool().decode(0));
    assertEquals(Boolean.TRUE, BuiltinCodecs.bool().decode("TRUE"));
  }

  @Test
  void keywordsAndSymbolsAreStoredAsText() {
    ValueCodec<Keyword> k = BuiltinCodecs.keyword("keyword");
    Keyword active = Keyword.of("account.status", "active");
    assertEquals(":account.status/active", k.encode(active));
    assertEquals(active, k.decode(":account.status/active"));
    assertEquals(active, k.decode("account.status/active"));
    assertEquals(Keyword.of(null, "plain"), k.decode(":plain"));

    ValueCodec<Symbol> s = BuiltinCodecs.symbol();
    Symbol sym = Symbol.parse("billing/invoice");
    assertEquals("billing/invoice", s.encode(sym));
    assertEquals(sym, s.decode("billing/invoice"));
  }

  @Test
  void csvTagsRoundTripKeepingOrder() {
    CsvTagsCodec c = new CsvTagsCodec();
    Set<String> tags = new LinkedHashSet<>(List.of("vip", " beta ", "", "early"));
    Object encoded = c.encode(tags);
    assertEquals("vip,beta,early", encoded);
    assertEquals(List.of("vip", "beta", "early"), List.copyOf(c.decode(encoded)));
    assertEquals(Set.of(), c.decode(""));
    assertThrows(IllegalArgumentException.class, () -> c.encode(Set.of("a,b")));
  }

  @Test
  void jsonCodecWritesTextAndReadsStructures() {
    JsonCodec c = new JsonCodec();
    Object encoded = c.encode(Map.of("sku", "A-1"));
    assertEquals("{\"sku\":\"A-1\"}", encoded);
    assertEquals(List.of(1, 2), c.decode("[1,2]"));
    assertThrows(IllegalArgumentException.class, () -> c.decode("{not json"));
  }

  @Test
  void registryFindsDiscoveredCodecsAndRejectsUnknownOnes() {
    CodecRegistry r = CodecRegistry.discovered();
    assertTrue(r.contains(JsonCodec.ID));
    assertTrue(r.contains(CsvTagsCodec.ID));
    assertTrue(r.contains("uuid"));
    assertFalse(CodecRegistry.builtins().contains(JsonCodec.ID));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> r.named("nope"));
    assertTrue(ex.getMessage().contains("Unknown codec: nope"));
  }

  @Test
  void attributeCodecPrefersInlineConverters() {
    AttributeDescriptor email = AttributeDescriptor.scalar("account/email", AttrType.STRING, "main", "account/id")
        .withConverters(v -> String.valueOf(v).toLowerCase(), raw -> "<" + raw + ">");
    AttributeCodec c = AttributeCodec.compile(email, CodecRegistry.builtins());
    assertEquals("string", c.codecId());
    assertEquals("a@x.io", c.encode("A@X.io"));
    assertEquals("<a@x.io>", c.decode("a@x.io"));
    assertNull(c.encode(null));
    assertNull(c.decode(null));
  }
}
