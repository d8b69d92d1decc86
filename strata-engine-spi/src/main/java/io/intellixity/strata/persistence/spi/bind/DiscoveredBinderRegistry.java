package io.intellixity.strata.persistence.spi.bind;

import io.intellixity.strata.persistence.dmlast.Bind;
import io.intellixity.strata.persistence.util.StrataFactoriesLoader;
import io.intellixity.strata.persistence.value.CodecRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * The binder chain of one dialect, assembled from every discovered {@link BinderProvider}.\n
 *
 * The chain holds the dialect's own binders followed by the global ones, each provider in discovery order.
 * A bind goes to the first binder whose target and value types fit and which accepts the bind's type id.
 * Providers scoped to other dialects are ignored.
 */
public final class DiscoveredBinderRegistry {
  private final String dialectId;
  private final List<Binder<?, ?>> chain;
  private final int dialectScoped;

  public DiscoveredBinderRegistry(String dialectId) {
    this(dialectId, StrataFactoriesLoader.load(BinderProvider.class));
  }

  public DiscoveredBinderRegistry(String dialectId, List<BinderProvider> providers) {
    this.dialectId = dialectId == null ? "" : dialectId.trim();
    List<Binder<?, ?>> own = new ArrayList<>();
    List<Binder<?, ?>> shared = new ArrayList<>();
    for (BinderProvider p : providers) {
      Collection<Binder<?, ?>> bs = p == null ? null : p.binders();
      if (bs == null) continue;
      String scope = scopeOf(p);
      if (BinderProvider.GLOBAL.equals(scope)) collect(bs, shared);
      else if (scope.equals(this.dialectId)) collect(bs, own);
    }
    this.dialectScoped = own.size();
    own.addAll(shared);
    this.chain = List.copyOf(own);
  }

  public String dialectId() { return dialectId; }

  /** Binds {@code encodedValue} into {@code target}; fails when no binder in the chain takes it. */
  public <T> void bind(T target, BindContext ctx, Bind bind, Object encodedValue, CodecRegistry codecs) {
    if (target == null) throw new IllegalArgumentException("target is required");
    if (ctx == null || ctx.opKind() == null) throw new IllegalArgumentException("bind context with an op kind is required");
    for (Binder<?, ?> b : chain) {
      if (!b.targetType().isInstance(target)) continue;
      if (encodedValue != null && !b.valueType().isInstance(encodedValue)) continue;
      @SuppressWarnings("unchecked")
      Binder<T, Object> typed = (Binder<T, Object>) b;
      if (!typed.supports(ctx, bind, encodedValue)) continue;
      typed.bind(target, ctx, bind, encodedValue, codecs);
      return;
    }
    throw new IllegalArgumentException("No binder for dialectId=" + dialectId + " op=" + ctx.opKind()
        + " typeId=" + (bind == null ? null : bind.typeId())
        + " value=" + (encodedValue == null ? "null" : encodedValue.getClass().getName())
        + " target=" + target.getClass().getName()
        + " (" + dialectScoped + " dialect, " + (chain.size() - dialectScoped) + " global binders)");
  }

  private static void collect(Collection<Binder<?, ?>> from, List<Binder<?, ?>> into) {
    for (Binder<?, ?> b : from) if (b != null) into.add(b);
  }

  private static String scopeOf(BinderProvider p) {
    String id = p.dialectId();
    return id == null || id.isBlank() ? BinderProvider.GLOBAL : id.trim();
  }
}
