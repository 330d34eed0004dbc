package io.spectro.persistence.query;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A single filter predicate: {@code field operator value}.
 * <p>
 * The operator is kept as written so that an unsupported one surfaces when the query is compiled,
 * not when it is built. {@code value} is a scalar, a collection for {@code IN}, a two-element list
 * for {@code BETWEEN}, or absent for {@code IS NULL}/{@code IS NOT NULL}.
 */
public record Condition(String field, String operator, Object value) {
  public Condition {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(operator, "operator");
  }

  public static Condition of(String field, Operator operator, Object value) {
    return new Condition(field, operator.symbol(), value);
  }

  public static Condition between(String field, Object lower, Object upper) {
    return new Condition(field, Operator.BETWEEN.symbol(), Arrays.asList(lower, upper));
  }

  static List<Condition> copy(List<Condition> in) {
    return List.copyOf(in == null ? List.of() : in);
  }
}
