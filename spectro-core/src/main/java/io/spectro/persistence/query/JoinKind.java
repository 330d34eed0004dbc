package io.spectro.persistence.query;

public enum JoinKind {
  INNER("INNER JOIN"),
  LEFT("LEFT JOIN"),
  RIGHT("RIGHT JOIN"),
  FULL("FULL OUTER JOIN");

  private final String sql;

  JoinKind(String sql) {
    this.sql = sql;
  }

  public String sql() { return sql; }
}
