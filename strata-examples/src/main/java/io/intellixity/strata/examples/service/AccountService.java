package io.intellixity.strata.examples.service;

import io.intellixity.strata.persistence.delta.Change;
import io.intellixity.strata.persistence.delta.Delta;
import io.intellixity.strata.persistence.delta.EntityIdent;
import io.intellixity.strata.persistence.exec.SaveEngine;
import io.intellixity.strata.persistence.exec.SaveResult;
import io.intellixity.strata.persistence.read.GraphReader;
import io.intellixity.strata.persistence.read.Selection;
import io.intellixity.strata.persistence.value.Keyword;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.*;

/** Account and order writes expressed as deltas, reads as selections over the resolver graph. */
@Service
public final class AccountService {
  public static final String ACCOUNT = "account/id";
  public static final String ORDER = "order/id";
  public static final String PROFILE = "profile/id";

  /** Default shape returned after writes. */
  static final Selection ACCOUNT_VIEW = Selection.builder()
      .add("account/name")
      .add("account/email")
      .add("account/tags")
      .add("account/status")
      .add("account/orders", Selection.of("order/placedAt", "order/total"))
      .add("account/profile", Selection.of("profile/bio"))
      .build();

  private final SaveEngine saves;
  private final GraphReader reader;

  public AccountService(SaveEngine saves, GraphReader reader) {
    this.saves = saves;
    this.reader = reader;
  }

  /** Creates an account and, when {@code bio} is given, its profile in the profiles partition. */
  public UUID create(String name, String email, String password, List<String> tags, String bio) {
    EntityIdent account = EntityIdent.temp(ACCOUNT);
    Delta.Builder b = Delta.builder()
        .set(account, "account/name", name)
        .set(account, "account/email", email)
        .set(account, "account/password", password)
        .set(account, "account/status", Keyword.of("account.status", "active"));
    if (tags != null && !tags.isEmpty()) b.set(account, "account/tags", new LinkedHashSet<>(tags));
    if (bio != null) {
      EntityIdent profile = EntityIdent.temp(PROFILE);
      b.set(profile, "profile/bio", bio);
      b.put(account, "account/profile", Change.link(profile));
    }
    SaveResult r = saves.save(b.build());
    return (UUID) r.idOf(account.tempId());
  }

  public void rename(UUID accountId, String before, String after) {
    EntityIdent account = EntityIdent.of(ACCOUNT, accountId);
    saves.save(Delta.builder().put(account, "account/name", Change.scalar(before, after)).build());
  }

  /** Adds an order to the account through the to-many side; returns the sequence-allocated order id. */
  public long addOrder(UUID accountId, BigDecimal total, List<Map<String, Object>> lines, Set<Long> currentOrders) {
    EntityIdent account = EntityIdent.of(ACCOUNT, accountId);
    EntityIdent order = EntityIdent.temp(ORDER);
    Set<EntityIdent> before = orders(currentOrders);
    Set<EntityIdent> after = new LinkedHashSet<>(before);
    after.add(order);

    Delta.Builder b = Delta.builder()
        .set(order, "order/placedAt", Instant.now())
        .set(order, "order/total", total)
        .put(account, "account/orders", Change.refMany(before, after));
    if (lines != null) b.set(order, "order/lines", lines);
    SaveResult r = saves.save(b.build());
    return ((Number) r.idOf(order.tempId())).longValue();
  }

  /** Removes an order from the account; the order row is deleted because the relation is delete-orphan. */
  public void removeOrder(UUID accountId, long orderId) {
    EntityIdent account = EntityIdent.of(ACCOUNT, accountId);
    Set<EntityIdent> before = orders(Set.of(orderId));
    saves.save(Delta.builder().put(account, "account/orders", Change.refMany(before, Set.of())).build());
  }

  public void delete(UUID accountId) {
    saves.save(Delta.builder().delete(EntityIdent.of(ACCOUNT, accountId)).build());
  }

  public Map<String, Object> get(UUID accountId) {
    return reader.readOne(ACCOUNT, accountId, ACCOUNT_VIEW);
  }

  public List<Map<String, Object>> read(String identityKey, List<Object> ids, Selection selection) {
    return reader.read(identityKey, ids, selection);
  }

  private static Set<EntityIdent> orders(Set<Long> ids) {
    Set<EntityIdent> out = new LinkedHashSet<>();
    if (ids != null) for (Long id : ids) out.add(EntityIdent.of(ORDER, id));
    return out;
  }
}
