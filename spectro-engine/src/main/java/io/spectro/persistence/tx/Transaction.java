package io.spectro.persistence.tx;

import io.spectro.persistence.compile.Identifiers;
import io.spectro.persistence.compile.SqlStatement;
import io.spectro.persistence.engine.SqlExecutor;
import io.spectro.persistence.exec.IsolationLevel;
import io.spectro.persistence.exec.SqlSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * One transaction on one session: {@code IDLE -> ACTIVE -> (COMMITTED | ROLLED_BACK)}.
 * <p>
 * Boundaries are plain SQL sent through the session. The session itself is owned and closed by
 * {@link TransactionManager}.
 */
public final class Transaction {
  private static final Logger log = LoggerFactory.getLogger(Transaction.class);

  private final SqlSession session;
  private final SqlExecutor executor;
  private TransactionState state = TransactionState.IDLE;

  public Transaction(SqlSession session, SqlExecutor executor) {
    this.session = Objects.requireNonNull(session, "session");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public SqlSession session() { return session; }
  public TransactionState state() { return state; }
  public boolean active() { return state == TransactionState.ACTIVE; }

  public void begin(IsolationLevel isolation) {
    requireState(TransactionState.IDLE, "begin");
    String sql = (isolation == null) ? "BEGIN" : "BEGIN ISOLATION LEVEL " + isolation.sql();
    executor.execute(session, SqlStatement.of(sql));
    state = TransactionState.ACTIVE;
    if (log.isDebugEnabled()) log.debug("spectro.tx begin isolation={}", isolation == null ? "default" : isolation.sql());
  }

  public void commit() {
    requireState(TransactionState.ACTIVE, "commit");
    executor.execute(session, SqlStatement.of("COMMIT"));
    state = TransactionState.COMMITTED;
    log.debug("spectro.tx commit");
  }

  public void rollback() {
    requireState(TransactionState.ACTIVE, "rollback");
    try {
      executor.execute(session, SqlStatement.of("ROLLBACK"));
    } finally {
      // The server discards the transaction whether or not ROLLBACK reaches it cleanly.
      state = TransactionState.ROLLED_BACK;
    }
    log.debug("spectro.tx rollback");
  }

  /**
   * Rolls back after {@code cause}. A rollback failure is logged and attached to {@code cause}
   * as suppressed; it never replaces it.
   */
  void rollbackAfter(Throwable cause) {
    if (state != TransactionState.ACTIVE) return;
    try {
      rollback();
    } catch (RuntimeException rbEx) {
      log.warn("spectro.tx rollback_failed cause={}", cause.toString(), rbEx);
      cause.addSuppressed(rbEx);
    }
  }

  /**
   * Runs {@code work} behind a savepoint. On failure only the work's changes are undone and the
   * enclosing transaction stays usable.
   */
  public <T> T savepoint(String name, Supplier<T> work) {
    requireState(TransactionState.ACTIVE, "savepoint");
    Objects.requireNonNull(work, "work");
    String sp = savepointName(name);
    executor.execute(session, SqlStatement.of("SAVEPOINT " + sp));
    log.debug("spectro.tx savepoint name={}", sp);
    T result;
    try {
      result = work.get();
    } catch (Throwable e) {
      rollbackToSavepoint(sp, e);
      throw rethrow(e);
    }
    executor.execute(session, SqlStatement.of("RELEASE SAVEPOINT " + sp));
    return result;
  }

  /**
   * Rethrows {@code t} unchanged, checked or not. Lambdas can smuggle checked exceptions past
   * {@code Function}; they still have to unwind the transaction as-is.
   */
  static RuntimeException rethrow(Throwable t) {
    throw Transaction.<RuntimeException>sneaky(t);
  }

  @SuppressWarnings("unchecked")
  private static <E extends Throwable> E sneaky(Throwable t) throws E {
    throw (E) t;
  }

  private void rollbackToSavepoint(String sp, Throwable cause) {
    try {
      executor.execute(session, SqlStatement.of("ROLLBACK TO SAVEPOINT " + sp));
      executor.execute(session, SqlStatement.of("RELEASE SAVEPOINT " + sp));
    } catch (RuntimeException e) {
      log.warn("spectro.tx savepoint_rollback_failed name={} cause={}", sp, cause.toString(), e);
      cause.addSuppressed(e);
    }
  }

  /** {@code sp_<name>_<8 random hex chars>}; the suffix keeps concurrent savepoints with one name apart. */
  static String savepointName(String name) {
    Identifiers.check(name);
    if (Identifiers.isQualified(name)) throw new IllegalArgumentException("Savepoint name must not contain '.': " + name);
    return "sp_" + name + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
  }

  private void requireState(TransactionState expected, String op) {
    if (state != expected) {
      throw new IllegalStateException("Cannot " + op + " a transaction in state " + state);
    }
  }
}
