package io.intellixity.strata.persistence.delta;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** One attribute change inside an {@link EntityDelta}. */
public sealed interface Change permits Change.Scalar, Change.RefOne, Change.RefMany, Change.Deleted {

  /** True when applying the change would not alter the stored value. */
  boolean isNoop();

  static Scalar set(Object after) { return new Scalar(null, after); }
  static Scalar scalar(Object before, Object after) { return new Scalar(before, after); }
  static RefOne link(EntityIdent after) { return new RefOne(null, after); }
  static RefOne refOne(EntityIdent before, EntityIdent after) { return new RefOne(before, after); }
  static RefMany refMany(Set<EntityIdent> before, Set<EntityIdent> after) { return new RefMany(before, after); }

  /** Plain value change. Either side may be {@code null}. */
  record Scalar(Object before, Object after) implements Change {
    @Override public boolean isNoop() { return Objects.equals(before, after); }
  }

  /** To-one reference change. */
  record RefOne(EntityIdent before, EntityIdent after) implements Change {
    @Override public boolean isNoop() { return Objects.equals(before, after); }
  }

  /** To-many reference change; membership is compared as sets. */
  record RefMany(Set<EntityIdent> before, Set<EntityIdent> after) implements Change {
    public RefMany {
      before = (before == null) ? Set.of() : copy(before);
      after = (after == null) ? Set.of() : copy(after);
    }

    public Set<EntityIdent> added() {
      Set<EntityIdent> out = new LinkedHashSet<>(after);
      out.removeAll(before);
      return out;
    }

    public Set<EntityIdent> removed() {
      Set<EntityIdent> out = new LinkedHashSet<>(before);
      out.removeAll(after);
      return out;
    }

    @Override public boolean isNoop() { return before.equals(after); }

    private static Set<EntityIdent> copy(Set<EntityIdent> s) {
      return Collections.unmodifiableSet(new LinkedHashSet<>(s));
    }
  }

  /** The reference to {@code before} was cleared and the row holding it must be deleted (delete-orphan). */
  record Deleted(EntityIdent before) implements Change {
    @Override public boolean isNoop() { return false; }
  }
}
