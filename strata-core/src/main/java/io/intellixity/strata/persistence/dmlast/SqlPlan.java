package io.intellixity.strata.persistence.dmlast;

import java.util.ArrayList;
import java.util.List;

/**
 * Statements for one partition. {@code updates} holds UPDATEs and DELETEs and always runs before
 * {@code inserts}: constraints are deferred to commit, so clearing foreign keys first is safe.
 */
public record SqlPlan(List<DmlAst> updates, List<InsertAst> inserts) {
  public SqlPlan {
    updates = updates == null ? List.of() : List.copyOf(updates);
    inserts = inserts == null ? List.of() : List.copyOf(inserts);
    for (DmlAst u : updates) {
      if (u instanceof InsertAst) throw new IllegalArgumentException("INSERT in update list: " + u.table());
    }
  }

  public static SqlPlan empty() {
    return new SqlPlan(List.of(), List.of());
  }

  /** Execution order: updates then inserts. */
  public List<DmlAst> statements() {
    List<DmlAst> out = new ArrayList<>(updates.size() + inserts.size());
    out.addAll(updates);
    out.addAll(inserts);
    return out;
  }

  public boolean isEmpty() {
    return updates.isEmpty() && inserts.isEmpty();
  }

  public int size() {
    return updates.size() + inserts.size();
  }
}
