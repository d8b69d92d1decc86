package io.intellixity.strata.persistence.ids;

import io.intellixity.strata.persistence.schema.AttrType;
import io.intellixity.strata.persistence.schema.AttributeDescriptor;

import java.util.UUID;

/** Generates a fresh id for a locally generated identity. Must never return the same value twice. */
@FunctionalInterface
public interface IdGenerator {
  Object newId(AttributeDescriptor identity);

  /** Random UUIDs; string identities get the UUID text. */
  static IdGenerator randomUuid() {
    return identity -> {
      if (identity.type() == AttrType.UUID) return UUID.randomUUID();
      if (identity.type() == AttrType.STRING) return UUID.randomUUID().toString();
      throw new IllegalArgumentException("No local id generation for type " + identity.type() + " of " + identity.key());
    };
  }
}
