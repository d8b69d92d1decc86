package io.intellixity.strata.examples.web;

import io.intellixity.strata.examples.service.AccountService;
import io.intellixity.strata.persistence.read.Selection;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@RestController
@RequestMapping("/api")
public final class AccountController {
  private final AccountService accounts;

  public AccountController(AccountService accounts) {
    this.accounts = accounts;
  }

  public record CreateAccountRequest(String name, String email, String password, List<String> tags, String bio) {}

  public record RenameRequest(String before, String after) {}

  public record AddOrderRequest(BigDecimal total, List<Map<String, Object>> lines, Set<Long> currentOrders) {}

  public record ReadRequest(String identity, List<Object> ids, Selection selection) {}

  @PostMapping("/accounts")
  public Map<String, Object> create(@RequestBody CreateAccountRequest req) {
    UUID id = accounts.create(req.name(), req.email(), req.password(), req.tags(), req.bio());
    return accounts.get(id);
  }

  @GetMapping("/accounts/{id}")
  public ResponseEntity<Map<String, Object>> get(@PathVariable("id") UUID id) {
    Map<String, Object> a = accounts.get(id);
    return (a == null) ? ResponseEntity.notFound().build() : ResponseEntity.ok(a);
  }

  @PatchMapping("/accounts/{id}/name")
  public Map<String, Object> rename(@PathVariable("id") UUID id, @RequestBody RenameRequest req) {
    accounts.rename(id, req.before(), req.after());
    return accounts.get(id);
  }

  @PostMapping("/accounts/{id}/orders")
  public Map<String, Object> addOrder(@PathVariable("id") UUID id, @RequestBody AddOrderRequest req) {
    long orderId = accounts.addOrder(id, req.total(), req.lines(), req.currentOrders());
    return Map.of("order/id", orderId);
  }

  @DeleteMapping("/accounts/{id}/orders/{orderId}")
  public ResponseEntity<Void> removeOrder(@PathVariable("id") UUID id, @PathVariable("orderId") long orderId) {
    accounts.removeOrder(id, orderId);
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/accounts/{id}")
  public ResponseEntity<Void> delete(@PathVariable("id") UUID id) {
    accounts.delete(id);
    return ResponseEntity.noContent().build();
  }

  /** Batched graph read: {@code {"identity": "account/id", "ids": [...], "selection": [...]}}. */
  @PostMapping("/read")
  public List<Map<String, Object>> read(@RequestBody ReadRequest req) {
    return accounts.read(req.identity(), req.ids(), req.selection());
  }
}
