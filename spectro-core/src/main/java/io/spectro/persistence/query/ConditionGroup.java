package io.spectro.persistence.query;

import java.util.List;
import java.util.Objects;

/** Composite condition group: its conditions are joined by {@code clause}, the group is ANDed with its siblings. */
public record ConditionGroup(Clause clause, List<Condition> conditions) {
  public ConditionGroup {
    clause = (clause == null) ? Clause.AND : clause;
    conditions = Condition.copy(conditions);
  }

  public static ConditionGroup and(List<Condition> conditions) {
    return new ConditionGroup(Clause.AND, conditions);
  }

  public static ConditionGroup or(List<Condition> conditions) {
    return new ConditionGroup(Clause.OR, Objects.requireNonNull(conditions, "conditions"));
  }
}
