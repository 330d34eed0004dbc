package io.spectro.persistence.query;

import io.spectro.persistence.error.SpectroException;

/** Comparison operators accepted in a {@link Condition}. */
public enum Operator {
  EQ("="),
  NE("!="),
  GT(">"),
  GE(">="),
  LT("<"),
  LE("<="),
  LIKE("LIKE"),
  ILIKE("ILIKE"),
  IN("IN"),
  BETWEEN("BETWEEN"),
  IS_NULL("IS NULL"),
  IS_NOT_NULL("IS NOT NULL");

  private final String symbol;

  Operator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() { return symbol; }

  /** True when the operator takes no operand. */
  public boolean unary() {
    return this == IS_NULL || this == IS_NOT_NULL;
  }

  /**
   * Resolve a condition's operator text. Matching is case-insensitive and tolerant of
   * repeated whitespace ("is  not null").
   *
   * @throws SpectroException INVALID_QUERY when the text is not a supported operator
   */
  public static Operator fromSymbol(String text) {
    if (text == null) throw SpectroException.invalidQuery("Missing operator");
    String norm = text.trim().replaceAll("\\s+", " ").toUpperCase();
    for (Operator op : values()) {
      if (op.symbol.equals(norm)) return op;
    }
    throw SpectroException.invalidQuery("Unsupported operator '" + text + "'");
  }

  /** Lenient lookup used by JSON parsing: accepts either the symbol or the enum name. */
  static Operator tryParse(String text) {
    if (text == null) return null;
    for (Operator op : values()) {
      if (op.name().equalsIgnoreCase(text) || op.symbol.equalsIgnoreCase(text.trim())) return op;
    }
    return null;
  }
}
