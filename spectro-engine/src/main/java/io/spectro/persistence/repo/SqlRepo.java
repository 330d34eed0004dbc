package io.spectro.persistence.repo;

import io.spectro.persistence.changeset.Changeset;
import io.spectro.persistence.compile.PostgresSqlDialect;
import io.spectro.persistence.compile.SqlDialect;
import io.spectro.persistence.compile.SqlStatement;
import io.spectro.persistence.dml.SqlDmlPlanner;
import io.spectro.persistence.dmlast.ConflictTarget;
import io.spectro.persistence.dmlast.DeleteAst;
import io.spectro.persistence.dmlast.DmlPlanner;
import io.spectro.persistence.dmlast.InsertAst;
import io.spectro.persistence.dmlast.UpdateAst;
import io.spectro.persistence.dmlast.UpsertAst;
import io.spectro.persistence.engine.DefaultValueDecoder;
import io.spectro.persistence.engine.SessionProvider;
import io.spectro.persistence.engine.SpectroOptions;
import io.spectro.persistence.engine.SqlExecutor;
import io.spectro.persistence.error.InvalidChangesetException;
import io.spectro.persistence.error.SpectroException;
import io.spectro.persistence.exec.IsolationLevel;
import io.spectro.persistence.exec.Propagation;
import io.spectro.persistence.exec.SqlClient;
import io.spectro.persistence.exec.ValueDecoder;
import io.spectro.persistence.mapping.Coercions;
import io.spectro.persistence.preload.Preloader;
import io.spectro.persistence.query.Field;
import io.spectro.persistence.query.Query;
import io.spectro.persistence.row.Row;
import io.spectro.persistence.schema.EntitySchema;
import io.spectro.persistence.schema.SchemaRegistry;
import io.spectro.persistence.tx.Transaction;
import io.spectro.persistence.tx.TransactionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * {@link Repo} over a {@link SqlClient}.
 * <p>
 * The root instance borrows a session from the client per statement. Transaction-scoped instances
 * (handed to {@code transaction} work) share the root's collaborators and run every statement on
 * the transaction's session. Closing the root shuts down the preload pool it created, if any.
 */
public final class SqlRepo implements Repo, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SqlRepo.class);

  private final SqlClient client;
  private final SchemaRegistry schemas;
  private final SqlDialect dialect;
  private final DmlPlanner planner;
  private final SqlExecutor executor;
  private final SpectroOptions options;
  private final Preloader preloader;
  private final TransactionManager txManager;
  /** Pool created by this repository; null when the caller supplied one. */
  private final ExecutorService ownedPool;
  /** Null on the root repository. */
  private final Transaction tx;
  private final SessionProvider sessions;

  private SqlRepo(Builder b) {
    this.client = b.client;
    this.schemas = b.schemas;
    this.options = b.options;
    this.dialect = b.dialect;
    this.planner = new SqlDmlPlanner();
    this.executor = new SqlExecutor(b.decoder);
    ExecutorService pool = b.preloadExecutor;
    this.ownedPool = (pool == null) ? newPreloadPool(options.preloadParallelism()) : null;
    this.preloader = new Preloader(schemas, dialect, executor, options.batchSize(), pool == null ? ownedPool : pool);
    this.txManager = new TransactionManager(client, executor);
    this.tx = null;
    this.sessions = SessionProvider.pooled(client);
  }

  private SqlRepo(SqlRepo root, Transaction tx) {
    this.client = root.client;
    this.schemas = root.schemas;
    this.options = root.options;
    this.dialect = root.dialect;
    this.planner = root.planner;
    this.executor = root.executor;
    this.ownedPool = null;
    this.preloader = root.preloader;
    this.txManager = root.txManager;
    this.tx = tx;
    this.sessions = SessionProvider.bound(tx.session());
  }

  public static Builder builder(SqlClient client, SchemaRegistry schemas) {
    return new Builder(client, schemas);
  }

  public static SqlRepo create(SqlClient client, SchemaRegistry schemas) {
    return builder(client, schemas).build();
  }

  public static SqlRepo create(SqlClient client, SchemaRegistry schemas, SpectroOptions options) {
    return builder(client, schemas).options(options).build();
  }

  public SpectroOptions options() { return options; }
  public SchemaRegistry schemas() { return schemas; }

  // ---------- reads ----------

  @Override
  public List<Row> rows(Query query) {
    Objects.requireNonNull(query, "query");
    SqlStatement ss = dialect.compileSelect(query, schemas);
    List<Row> rows = sessions.withSession(s -> executor.query(s, ss));
    if (query.preload().isEmpty()) return rows;
    return preloader.preload(query.table(), rows, query.preload(), sessions);
  }

  @Override
  public <T> List<T> all(EntitySchema<T> schema, Query query) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(query, "query");
    if (!schema.table().equals(query.table())) {
      throw SpectroException.invalidSchema("Schema for '" + schema.table() + "' used with a query on '" + query.table() + "'");
    }
    List<Row> rows = rows(query);
    List<T> out = new ArrayList<>(rows.size());
    for (Row r : rows) out.add(schema.read(r));
    return out;
  }

  @Override
  public <T> List<T> all(EntitySchema<T> schema) {
    return all(schema, Query.from(schema.table()));
  }

  @Override
  public <T> Optional<T> first(EntitySchema<T> schema, Query query) {
    List<T> found = all(schema, query.limit(1));
    return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
  }

  @Override
  public long count(Query query) {
    Objects.requireNonNull(query, "query");
    SqlStatement ss = dialect.compileCount(query, schemas);
    List<Row> rows = sessions.withSession(s -> executor.query(s, ss));
    if (rows.size() != 1 || rows.get(0).values().isEmpty()) {
      throw SpectroException.unexpectedResultCount(1, rows.size());
    }
    Object n = rows.get(0).values().values().iterator().next();
    try {
      return Coercions.toLong(n);
    } catch (IllegalArgumentException e) {
      throw SpectroException.invalidData("COUNT returned " + n);
    }
  }

  @Override
  public <T> Optional<T> get(EntitySchema<T> schema, Object id) {
    return findRow(schema, id).map(schema::read);
  }

  @Override
  public <T> T getOrFail(EntitySchema<T> schema, Object id) {
    return schema.read(requireRow(schema, id));
  }

  private Optional<Row> findRow(EntitySchema<?> schema, Object id) {
    Objects.requireNonNull(schema, "schema");
    Object key = SqlDmlPlanner.primaryKeyValue(schema, id);
    Query q = Query.from(schema.table()).where(Field.of(schema.primaryKeyColumn()).eq(key)).limit(1);
    List<Row> rows = rows(q);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  private Row requireRow(EntitySchema<?> schema, Object id) {
    return findRow(schema, id).orElseThrow(() -> SpectroException.notFound(schema.table(), id));
  }

  // ---------- writes ----------

  @Override
  public Row insert(Changeset changeset) {
    InsertAst ast = planner.planInsert(changeset);
    return single(dialect.renderDml(ast));
  }

  @Override
  public List<Row> insertAll(EntitySchema<?> schema, List<Changeset> changesets) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(changesets, "changesets");
    if (changesets.isEmpty()) return List.of();
    List<InsertAst> batches = planner.planInsertAll(schema.table(), changesets, options.batchSize());
    return inTx(Propagation.REQUIRED, options.defaultIsolation(), repo -> {
      List<Row> out = new ArrayList<>(changesets.size());
      for (InsertAst batch : batches) {
        SqlStatement ss = dialect.renderDml(batch);
        List<Row> inserted = repo.sessions.withSession(s -> executor.query(s, ss));
        if (inserted.size() != batch.rows().size()) {
          throw SpectroException.unexpectedResultCount(batch.rows().size(), inserted.size());
        }
        out.addAll(inserted);
      }
      return out;
    });
  }

  @Override
  public Row update(EntitySchema<?> schema, Object id, Changeset changeset) {
    Objects.requireNonNull(changeset, "changeset");
    if (!changeset.isValid()) throw new InvalidChangesetException(changeset.table(), changeset.errors());
    if (changeset.isEmpty()) return requireRow(schema, id);

    UpdateAst ast = planner.planUpdateById(schema, id, changeset);
    if (ast.sets().isEmpty()) return requireRow(schema, id);
    SqlStatement ss = dialect.renderDml(ast);
    List<Row> rows = sessions.withSession(s -> executor.query(s, ss));
    if (rows.isEmpty()) throw SpectroException.notFound(schema.table(), id);
    if (rows.size() > 1) throw SpectroException.unexpectedResultCount(1, rows.size());
    return rows.get(0);
  }

  @Override
  public void delete(EntitySchema<?> schema, Object id) {
    DeleteAst ast = planner.planDeleteById(schema, id);
    SqlStatement ss = dialect.renderDml(ast);
    long n = sessions.withSession(s -> executor.execute(s, ss));
    if (n == 0) throw SpectroException.notFound(schema.table(), id);
  }

  @Override
  public Row upsert(Changeset changeset, ConflictTarget target, List<String> set) {
    Objects.requireNonNull(changeset, "changeset");
    String pk = schemas.find(changeset.table()).map(EntitySchema::primaryKeyColumn).orElse(null);
    UpsertAst ast = planner.planUpsert(changeset, target, set, pk);
    return single(dialect.renderDml(ast));
  }

  private Row single(SqlStatement ss) {
    List<Row> rows = sessions.withSession(s -> executor.query(s, ss));
    if (rows.size() != 1) throw SpectroException.unexpectedResultCount(1, rows.size());
    return rows.get(0);
  }

  // ---------- associations ----------

  @Override
  public List<Row> preload(String table, List<Row> rows, String... names) {
    return preloader.preload(table, rows, Arrays.asList(names), sessions);
  }

  @Override
  public <T> List<T> preload(EntitySchema<T> schema, List<T> entities, String... names) {
    Objects.requireNonNull(schema, "schema");
    List<Row> rows = new ArrayList<>(entities.size());
    for (T e : entities) rows.add(schema.toRow(e));
    List<Row> loaded = preload(schema.table(), rows, names);
    List<T> out = new ArrayList<>(loaded.size());
    for (Row r : loaded) out.add(schema.read(r));
    return out;
  }

  // ---------- transactions ----------

  @Override
  public <T> T transaction(Function<Repo, T> work) {
    Objects.requireNonNull(work, "work");
    return inTx(options.defaultPropagation(), options.defaultIsolation(), work::apply);
  }

  @Override
  public <T> T transaction(IsolationLevel isolation, Function<Repo, T> work) {
    Objects.requireNonNull(work, "work");
    return inTx(Propagation.REQUIRED, isolation, work::apply);
  }

  @Override
  public <T> T transaction(Propagation propagation, Function<Repo, T> work) {
    Objects.requireNonNull(work, "work");
    return inTx(propagation, options.defaultIsolation(), work::apply);
  }

  private <T> T inTx(Propagation propagation, IsolationLevel isolation, Function<SqlRepo, T> work) {
    Objects.requireNonNull(propagation, "propagation");
    return switch (propagation) {
      case REQUIRED -> (tx != null) ? work.apply(this) : runInNewTx(isolation, work);
      case SUPPORTS -> work.apply(this);
      case MANDATORY -> {
        if (tx == null) throw new IllegalStateException("No existing transaction for propagation=MANDATORY");
        yield work.apply(this);
      }
      case REQUIRES_NEW -> runInNewTx(isolation, work);
      case NEVER -> {
        if (tx != null) throw new IllegalStateException("Existing transaction found for propagation=NEVER");
        yield work.apply(this);
      }
      case NESTED -> throw SpectroException.notImplemented("Propagation.NESTED (use savepoint(name, work))");
    };
  }

  private <T> T runInNewTx(IsolationLevel isolation, Function<SqlRepo, T> work) {
    return txManager.inTransaction(isolation, t -> work.apply(new SqlRepo(this, t)));
  }

  @Override
  public <T> T savepoint(String name, Function<Repo, T> work) {
    Objects.requireNonNull(work, "work");
    if (tx == null) {
      log.debug("spectro.tx savepoint_outside_tx name={}", name);
      return inTx(Propagation.REQUIRED, options.defaultIsolation(), repo -> repo.savepoint(name, work));
    }
    return tx.savepoint(name, () -> work.apply(this));
  }

  @Override
  public boolean inTransaction() { return tx != null; }

  // ---------- raw SQL ----------

  @Override
  public long execute(String sql, List<Object> params) {
    SqlStatement ss = new SqlStatement(sql, params);
    return sessions.withSession(s -> executor.execute(s, ss));
  }

  @Override
  public List<Row> query(String sql, List<Object> params) {
    SqlStatement ss = new SqlStatement(sql, params);
    return sessions.withSession(s -> executor.query(s, ss));
  }

  @Override
  public void close() {
    if (ownedPool != null) ownedPool.shutdownNow();
  }

  private static ExecutorService newPreloadPool(int parallelism) {
    AtomicInteger seq = new AtomicInteger();
    ThreadFactory tf = r -> {
      Thread t = new Thread(r, "spectro-preload-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
    return parallelism == 0 ? Executors.newCachedThreadPool(tf) : Executors.newFixedThreadPool(parallelism, tf);
  }

  public static final class Builder {
    private final SqlClient client;
    private final SchemaRegistry schemas;
    private SpectroOptions options = SpectroOptions.defaults();
    private SqlDialect dialect = new PostgresSqlDialect();
    private ValueDecoder decoder = DefaultValueDecoder.INSTANCE;
    private ExecutorService preloadExecutor;

    private Builder(SqlClient client, SchemaRegistry schemas) {
      this.client = Objects.requireNonNull(client, "client");
      this.schemas = Objects.requireNonNull(schemas, "schemas");
    }

    public Builder options(SpectroOptions options) {
      this.options = Objects.requireNonNull(options, "options");
      return this;
    }

    public Builder dialect(SqlDialect dialect) {
      this.dialect = Objects.requireNonNull(dialect, "dialect");
      return this;
    }

    /** Decoder applied to every raw column value; defaults to {@link DefaultValueDecoder}. */
    public Builder valueDecoder(ValueDecoder decoder) {
      this.decoder = Objects.requireNonNull(decoder, "decoder");
      return this;
    }

    /** Pool for concurrent preloads. The caller keeps ownership and shuts it down. */
    public Builder preloadExecutor(ExecutorService pool) {
      this.preloadExecutor = Objects.requireNonNull(pool, "pool");
      return this;
    }

    public SqlRepo build() {
      return new SqlRepo(this);
    }
  }
}
