package io.intellixity.strata.persistence.delta;

import java.util.Objects;

/**
 * (identity attribute key, id) pair naming one entity, e.g. {@code ("account/id", uuid)}.\n
 *
 * {@code id} is either a store id or a {@link TempId}.
 */
public record EntityIdent(String identityKey, Object id) {
  public EntityIdent {
    if (identityKey == null || identityKey.isBlank()) throw new IllegalArgumentException("identityKey is required");
    Objects.requireNonNull(id, "id");
  }

  public static EntityIdent of(String identityKey, Object id) {
    return new EntityIdent(identityKey, id);
  }

  public static EntityIdent temp(String identityKey) {
    return new EntityIdent(identityKey, TempId.create());
  }

  public boolean isTemp() {
    return id instanceof TempId;
  }

  public TempId tempId() {
    if (id instanceof TempId t) return t;
    throw new IllegalStateException("Not a temporary identity: " + this);
  }

  @Override
  public String toString() {
    return "[" + identityKey + " " + id + "]";
  }
}
