package io.intellixity.strata.persistence.spi.bind;

import io.intellixity.strata.persistence.dmlast.Bind;
import io.intellixity.strata.persistence.value.CodecRegistry;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DiscoveredBinderRegistryTest {

  private record Ctx(BindOpKind opKind) implements BindContext {}

  private static final class Tagging implements Binder<StringBuilder, Object> {
    private final String tag;
    private final String typeId;

    Tagging(String tag, String typeId) {
      this.tag = tag;
      this.typeId = typeId;
    }

    @Override public Class<StringBuilder> targetType() { return StringBuilder.class; }
    @Override public Class<Object> valueType() { return Object.class; }
    @Override public boolean supports(BindContext ctx, Bind bind, Object v) { return typeId == null || typeId.equals(bind.typeId()); }
    @Override public void bind(StringBuilder target, BindContext ctx, Bind bind, Object v, CodecRegistry codecs) {
      target.append(tag).append('=').append(v);
    }
  }

  private static BinderProvider provider(String dialectId, Binder<?, ?>... binders) {
    return new BinderProvider() {
      @Override public String dialectId() { return dialectId; }
      @Override public Collection<Binder<?, ?>> binders() { return List.of(binders); }
    };
  }

  private static String bind(DiscoveredBinderRegistry r, String typeId, Object value) {
    StringBuilder sb = new StringBuilder();
    r.bind(sb, new Ctx(BindOpKind.INSERT), new Bind(value, typeId), value, CodecRegistry.builtins());
    return sb.toString();
  }

  @Test
  void dialectBindersWinOverGlobalOnes() {
    DiscoveredBinderRegistry r = new DiscoveredBinderRegistry("pg", List.of(
        provider("*", new Tagging("global", null)),
        provider("pg", new Tagging("pg-json", "json")),
        provider("other", new Tagging("other", null))));

    assertEquals("pg-json={}", bind(r, "json", "{}"));
    assertEquals("global=7", bind(r, "int", 7));
  }

  @Test
  void blankDialectIdMeansGlobal() {
    DiscoveredBinderRegistry r = new DiscoveredBinderRegistry("pg", List.of(provider(" ", new Tagging("any", null))));
    assertEquals("any=x", bind(r, "string", "x"));
  }

  @Test
  void failsWhenNothingMatches() {
    DiscoveredBinderRegistry r = new DiscoveredBinderRegistry("pg", List.of(provider("pg", new Tagging("json", "json"))));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> bind(r, "uuid", "x"));
    assertTrue(ex.getMessage().contains("typeId=uuid"));
    assertThrows(IllegalArgumentException.class,
        () -> r.bind(new StringBuilder(), null, new Bind("x", "json"), "x", CodecRegistry.builtins()));
  }
}
