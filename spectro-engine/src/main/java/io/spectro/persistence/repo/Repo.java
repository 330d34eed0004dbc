package io.spectro.persistence.repo;

import io.spectro.persistence.changeset.Changeset;
import io.spectro.persistence.dmlast.ConflictTarget;
import io.spectro.persistence.exec.IsolationLevel;
import io.spectro.persistence.exec.Propagation;
import io.spectro.persistence.query.Query;
import io.spectro.persistence.row.Row;
import io.spectro.persistence.schema.EntitySchema;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Database access for one data source.
 * <p>
 * A repository is passed explicitly to the code that needs it. Inside
 * {@link #transaction(Function)} the work receives a transaction-scoped repository bound to the
 * transaction's session; everything issued through it belongs to that transaction.
 */
public interface Repo {

  // ---------- reads ----------

  /** Compiles and runs {@code query}; preloads {@link Query#preload()} associations if any. */
  List<Row> rows(Query query);

  <T> List<T> all(EntitySchema<T> schema, Query query);

  <T> List<T> all(EntitySchema<T> schema);

  <T> Optional<T> first(EntitySchema<T> schema, Query query);

  /** Number of rows matching the query's filters; ordering and paging are ignored. */
  long count(Query query);

  <T> Optional<T> get(EntitySchema<T> schema, Object id);

  /** @throws io.spectro.persistence.error.SpectroException NOT_FOUND when no row has this primary key */
  <T> T getOrFail(EntitySchema<T> schema, Object id);

  // ---------- writes ----------

  /** {@code INSERT ... RETURNING *}; the returned row carries database defaults. */
  Row insert(Changeset changeset);

  /**
   * Multi-row insert in batches of at most {@code batchSize} rows, in one transaction.
   * Rows are returned in input order.
   */
  List<Row> insertAll(EntitySchema<?> schema, List<Changeset> changesets);

  /** Updates by primary key. An empty changeset returns the current row unchanged. */
  Row update(EntitySchema<?> schema, Object id, Changeset changeset);

  /** @throws io.spectro.persistence.error.SpectroException NOT_FOUND when no row was deleted */
  void delete(EntitySchema<?> schema, Object id);

  /**
   * {@code INSERT ... ON CONFLICT ... DO UPDATE SET ...}.
   *
   * @param set columns overwritten on conflict; null means every inserted column except the
   *            conflict columns and the primary key
   */
  Row upsert(Changeset changeset, ConflictTarget target, List<String> set);

  // ---------- associations ----------

  List<Row> preload(String table, List<Row> rows, String... names);

  /** Preloads onto entities through the schema's accessor and re-reads them with its reader. */
  <T> List<T> preload(EntitySchema<T> schema, List<T> entities, String... names);

  // ---------- transactions ----------

  /** Runs {@code work} with the configured default propagation and isolation. */
  <T> T transaction(Function<Repo, T> work);

  <T> T transaction(IsolationLevel isolation, Function<Repo, T> work);

  <T> T transaction(Propagation propagation, Function<Repo, T> work);

  /**
   * Runs {@code work} behind a savepoint; a failure undoes only the work's changes. Outside a
   * transaction, one is opened around the savepoint.
   */
  <T> T savepoint(String name, Function<Repo, T> work);

  boolean inTransaction();

  // ---------- raw SQL ----------

  /** Runs a raw statement with {@code $n} placeholders; returns the affected row count. */
  long execute(String sql, List<Object> params);

  List<Row> query(String sql, List<Object> params);
}
