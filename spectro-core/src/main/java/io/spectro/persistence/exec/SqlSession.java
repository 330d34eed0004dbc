package io.spectro.persistence.exec;

import java.util.List;
import java.util.Map;

/**
 * One live connection. Statements run sequentially; a session is never shared between threads.
 * <p>
 * SQL uses {@code $1..$n} placeholders; {@code params.get(i)} binds {@code $(i+1)}.
 * Transaction control ({@code BEGIN}, {@code COMMIT}, {@code SAVEPOINT ...}) is sent through {@link #execute}.
 * Failures surface as {@link io.spectro.persistence.error.DatabaseException}.
 */
public interface SqlSession extends AutoCloseable {
  /** Runs a statement and returns the affected row count. */
  long execute(String sql, List<Object> params);

  /** Runs a statement and returns the raw column values of each row, keyed by column label in result order. */
  List<Map<String, Object>> query(String sql, List<Object> params);

  /** Returns the connection to the pool. */
  @Override
  void close();
}
