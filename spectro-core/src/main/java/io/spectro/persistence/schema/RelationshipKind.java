package io.spectro.persistence.schema;

public enum RelationshipKind {
  HAS_MANY,
  HAS_ONE,
  BELONGS_TO,
  MANY_TO_MANY;

  /** True when the owner holds the referencing column. */
  public boolean ownerHoldsKey() { return this == BELONGS_TO; }

  /** True when at most one related row is attached per owner. */
  public boolean singular() { return this == HAS_ONE || this == BELONGS_TO; }
}
