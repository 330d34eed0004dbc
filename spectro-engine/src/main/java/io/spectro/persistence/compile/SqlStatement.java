package io.spectro.persistence.compile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Compiled statement: SQL with {@code $1..$n} placeholders and the values they bind, in order. */
public record SqlStatement(String sql, List<Object> params) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    // Parameters may be null, so List.copyOf is not an option.
    params = (params == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public static SqlStatement of(String sql) {
    return new SqlStatement(sql, List.of());
  }

  /** Leading SQL keyword, used as the operation name in logs. */
  public String op() {
    String t = sql.stripLeading();
    int end = 0;
    while (end < t.length() && Character.isLetter(t.charAt(end))) end++;
    return end == 0 ? "SQL" : t.substring(0, end).toUpperCase();
  }
}
