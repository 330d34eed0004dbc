package io.spectro.persistence.error;

/** Driver failure, wrapped with the SQL that caused it. */
public final class DatabaseException extends SpectroException {
  private final String sql;

  public DatabaseException(String sql, Throwable cause) {
    super(ErrorKind.DATABASE_ERROR, "Statement failed: " + (cause == null ? "unknown" : cause.getMessage()) + " [sql=" + sql + "]", cause);
    this.sql = sql;
  }

  public String sql() { return sql; }
}
