package io.spectro.persistence.query;

import java.util.Locale;
import java.util.Objects;

/** One {@code ORDER BY} item; direction defaults to ascending. */
public record SortField(String field, Direction direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    if (field.isBlank()) throw new IllegalArgumentException("Sort field must not be blank");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static SortField asc(String field) { return new SortField(field, Direction.ASC); }
  public static SortField desc(String field) { return new SortField(field, Direction.DESC); }

  public enum Direction {
    ASC, DESC;

    /** Case-insensitive; null means {@link #ASC}. */
    public static Direction parse(String s) {
      if (s == null) return ASC;
      return switch (s.trim().toUpperCase(Locale.ROOT)) {
        case "ASC" -> ASC;
        case "DESC" -> DESC;
        default -> throw new IllegalArgumentException("Unknown sort direction: " + s);
      };
    }
  }
}
