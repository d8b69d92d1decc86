package io.intellixity.strata.persistence.schema;

import java.util.Locale;

/** Storage kinds an attribute can carry. The id doubles as the builtin codec id. */
public enum AttrType {
  UUID("uuid"),
  INT("int"),
  LONG("long"),
  STRING("string"),
  PASSWORD("password"),
  BOOLEAN("boolean"),
  DECIMAL("decimal"),
  INSTANT("instant"),
  ENUM("enum"),
  KEYWORD("keyword"),
  SYMBOL("symbol"),
  REF("ref");

  private final String id;

  AttrType(String id) {
    this.id = id;
  }

  public String id() { return id; }

  /** Identities of this type get their ids from a store sequence rather than a local generator. */
  public boolean sequenceBacked() {
    return this == INT || this == LONG;
  }

  public static AttrType fromId(String id) {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("type is blank");
    String s = id.trim().toLowerCase(Locale.ROOT);
    for (AttrType t : values()) {
      if (t.id.equals(s)) return t;
    }
    throw new IllegalArgumentException("Unknown attribute type: " + id);
  }
}
