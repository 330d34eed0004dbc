package io.spectro.persistence.tx;

import io.spectro.persistence.engine.SqlExecutor;
import io.spectro.persistence.exec.IsolationLevel;
import io.spectro.persistence.exec.SqlClient;
import io.spectro.persistence.exec.SqlSession;

import java.util.Objects;
import java.util.function.Function;

/**
 * Scopes work to one transaction on a dedicated session.
 * <p>
 * {@code BEGIN}, run, {@code COMMIT}. Any failure issues {@code ROLLBACK} before it is rethrown
 * unchanged. The session goes back to the pool in every case.
 */
public final class TransactionManager {
  private final SqlClient client;
  private final SqlExecutor executor;

  public TransactionManager(SqlClient client, SqlExecutor executor) {
    this.client = Objects.requireNonNull(client, "client");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public <T> T inTransaction(IsolationLevel isolation, Function<Transaction, T> work) {
    Objects.requireNonNull(work, "work");
    try (SqlSession session = client.openSession()) {
      Transaction tx = new Transaction(session, executor);
      try {
        tx.begin(isolation);
        T result = work.apply(tx);
        tx.commit();
        return result;
      } catch (Throwable e) {
        tx.rollbackAfter(e);
        throw Transaction.rethrow(e);
      }
    }
  }
}
