package io.spectro.persistence.dmlast;

import java.util.List;
import java.util.Objects;

/** Upsert conflict target: a column list or a named constraint. */
public record ConflictTarget(List<String> columns, String constraint) {
  public ConflictTarget {
    columns = columns == null ? List.of() : List.copyOf(columns);
    if (columns.isEmpty() == (constraint == null)) {
      throw new IllegalArgumentException("ConflictTarget needs either columns or a constraint name");
    }
  }

  public static ConflictTarget columns(String... columns) {
    return new ConflictTarget(List.of(columns), null);
  }

  public static ConflictTarget constraint(String name) {
    return new ConflictTarget(List.of(), Objects.requireNonNull(name, "name"));
  }

  public boolean isConstraint() { return constraint != null; }
}
