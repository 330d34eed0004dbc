package io.spectro.persistence.query;

import io.spectro.persistence.error.SpectroException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Typed condition builder: {@code Field.of("age").greaterThanOrEqual(18)}.
 */
public final class Field {
  private final String name;

  private Field(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public static Field of(String name) {
    return new Field(name);
  }

  public String name() { return name; }

  public Condition eq(Object value) { return Condition.of(name, Operator.EQ, value); }
  public Condition notEq(Object value) { return Condition.of(name, Operator.NE, value); }
  public Condition greaterThan(Object value) { return Condition.of(name, Operator.GT, value); }
  public Condition greaterThanOrEqual(Object value) { return Condition.of(name, Operator.GE, value); }
  public Condition lessThan(Object value) { return Condition.of(name, Operator.LT, value); }
  public Condition lessThanOrEqual(Object value) { return Condition.of(name, Operator.LE, value); }
  public Condition like(String pattern) { return Condition.of(name, Operator.LIKE, pattern); }
  public Condition ilike(String pattern) { return Condition.of(name, Operator.ILIKE, pattern); }

  /** {@code IN} over a snapshot of {@code values}; null elements are rejected with {@code INVALID_QUERY}. */
  public Condition in(Collection<?> values) {
    Objects.requireNonNull(values, "values");
    List<Object> copy = new ArrayList<>(values.size());
    for (Object v : values) {
      if (v == null) throw SpectroException.invalidQuery("IN list for '" + name + "' contains null; use isNull()");
      copy.add(v);
    }
    return Condition.of(name, Operator.IN, Collections.unmodifiableList(copy));
  }

  public Condition between(Object lower, Object upper) { return Condition.between(name, lower, upper); }
  public Condition isNull() { return Condition.of(name, Operator.IS_NULL, null); }
  public Condition isNotNull() { return Condition.of(name, Operator.IS_NOT_NULL, null); }

  public SortField asc() { return SortField.asc(name); }
  public SortField desc() { return SortField.desc(name); }
}
