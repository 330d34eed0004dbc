package io.spectro.persistence.query;

import java.util.Objects;

/** A condition on a field of the table reached through {@code association}. */
public record RelationshipCondition(String association, Condition condition) {
  public RelationshipCondition {
    Objects.requireNonNull(association, "association");
    Objects.requireNonNull(condition, "condition");
  }
}
