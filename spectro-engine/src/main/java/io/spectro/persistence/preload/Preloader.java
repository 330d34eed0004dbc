package io.spectro.persistence.preload;

import io.spectro.persistence.compile.SqlDialect;
import io.spectro.persistence.compile.SqlStatement;
import io.spectro.persistence.engine.SessionProvider;
import io.spectro.persistence.engine.SqlExecutor;
import io.spectro.persistence.error.ErrorKind;
import io.spectro.persistence.error.SpectroException;
import io.spectro.persistence.query.Field;
import io.spectro.persistence.query.Query;
import io.spectro.persistence.row.Row;
import io.spectro.persistence.schema.RelationshipInfo;
import io.spectro.persistence.schema.RelationshipKind;
import io.spectro.persistence.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Eager loading of associations with a bounded number of queries.
 * <p>
 * Each association costs one {@code SELECT ... WHERE key IN (...)} per batch of distinct owner keys,
 * whatever the number of owner rows. Dotted paths ({@code posts.comments}) load the first segment
 * and recurse into the loaded rows. Paths sharing a first segment load it once.
 * <p>
 * Independent top-level associations run concurrently when the session provider allows it;
 * nested levels always run sequentially. Results are matched by key, so completion order does
 * not matter. The preload fails as a whole: no partially enriched rows are returned.
 */
public final class Preloader {
  private static final Logger log = LoggerFactory.getLogger(Preloader.class);

  private final SchemaRegistry schemas;
  private final SqlDialect dialect;
  private final SqlExecutor executor;
  private final int batchSize;
  private final ExecutorService pool;

  private record Plan(RelationshipInfo rel, List<String> rest) {}

  private record Loaded(String name, Map<Object, List<Row>> groups) {}

  public Preloader(SchemaRegistry schemas, SqlDialect dialect, SqlExecutor executor, int batchSize, ExecutorService pool) {
    this.schemas = Objects.requireNonNull(schemas, "schemas");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.executor = Objects.requireNonNull(executor, "executor");
    if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0: " + batchSize);
    this.batchSize = batchSize;
    this.pool = Objects.requireNonNull(pool, "pool");
  }

  /**
   * Returns copies of {@code rows} with every association in {@code names} attached.
   *
   * @throws SpectroException INVALID_RELATIONSHIP if any name does not resolve, before any query runs
   */
  public List<Row> preload(String table, List<Row> rows, List<String> names, SessionProvider sessions) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(rows, "rows");
    Objects.requireNonNull(names, "names");
    Objects.requireNonNull(sessions, "sessions");
    return preload(table, rows, names, sessions, true);
  }

  private List<Row> preload(String table, List<Row> rows, List<String> names, SessionProvider sessions, boolean topLevel) {
    List<Plan> plans = plan(table, names);
    if (plans.isEmpty() || rows.isEmpty()) return List.copyOf(rows);

    boolean concurrent = topLevel && plans.size() > 1 && !sessions.exclusive();
    if (log.isDebugEnabled()) {
      log.debug("spectro.preload table={} names={} owners={} concurrent={}", table, names, rows.size(), concurrent);
    }

    Map<String, Map<Object, List<Row>>> loaded = concurrent
        ? loadConcurrently(plans, rows, sessions)
        : loadSequentially(plans, rows, sessions);

    List<Row> out = new ArrayList<>(rows.size());
    for (Row owner : rows) {
      Row r = owner;
      for (Plan p : plans) r = attach(r, p.rel(), loaded.get(p.rel().name()));
      out.add(r);
    }
    return out;
  }

  /** Resolves every path up front and groups them by first segment. */
  private List<Plan> plan(String table, List<String> names) {
    Map<String, RelationshipInfo> firsts = new LinkedHashMap<>();
    Map<String, Set<String>> rests = new LinkedHashMap<>();
    for (String name : names) {
      Objects.requireNonNull(name, "name");
      String[] segments = name.split("\\.", -1);
      String owner = table;
      RelationshipInfo first = null;
      for (String seg : segments) {
        RelationshipInfo rel = resolve(owner, seg);
        if (first == null) first = rel;
        owner = rel.relatedTable();
      }
      firsts.putIfAbsent(first.name(), first);
      Set<String> rest = rests.computeIfAbsent(first.name(), k -> new LinkedHashSet<>());
      int dot = name.indexOf('.');
      if (dot >= 0) rest.add(name.substring(dot + 1));
    }
    List<Plan> out = new ArrayList<>(firsts.size());
    for (var e : firsts.entrySet()) out.add(new Plan(e.getValue(), List.copyOf(rests.get(e.getKey()))));
    return out;
  }

  private RelationshipInfo resolve(String table, String name) {
    if (name.isEmpty()) throw SpectroException.invalidRelationship(table, name);
    RelationshipInfo rel = schemas.schemaFor(table).relationship(name);
    if (rel.kind() == RelationshipKind.MANY_TO_MANY) {
      throw SpectroException.notImplemented("Preloading many-to-many association '" + table + "." + name + "'");
    }
    return rel;
  }

  private Map<String, Map<Object, List<Row>>> loadSequentially(List<Plan> plans, List<Row> owners, SessionProvider sessions) {
    Map<String, Map<Object, List<Row>>> out = new HashMap<>();
    for (Plan p : plans) {
      Loaded l = load(p, owners, sessions);
      out.put(l.name(), l.groups());
    }
    return out;
  }

  private Map<String, Map<Object, List<Row>>> loadConcurrently(List<Plan> plans, List<Row> owners, SessionProvider sessions) {
    CompletionService<Loaded> ecs = new ExecutorCompletionService<>(pool);
    List<Future<Loaded>> futures = new ArrayList<>(plans.size());
    Map<String, Map<Object, List<Row>>> out = new HashMap<>();
    try {
      for (Plan p : plans) futures.add(ecs.submit(() -> load(p, owners, sessions)));
      for (int i = 0; i < futures.size(); i++) {
        Loaded l = ecs.take().get();
        out.put(l.name(), l.groups());
      }
      return out;
    } catch (ExecutionException e) {
      cancelAll(futures);
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) throw re;
      if (cause instanceof Error err) throw err;
      throw new SpectroException(ErrorKind.DATABASE_ERROR, "Preload failed: " + cause, cause);
    } catch (InterruptedException e) {
      cancelAll(futures);
      Thread.currentThread().interrupt();
      throw new SpectroException(ErrorKind.DATABASE_ERROR, "Preload interrupted", e);
    }
  }

  private static void cancelAll(List<Future<Loaded>> futures) {
    for (Future<Loaded> f : futures) f.cancel(true);
  }

  private Loaded load(Plan plan, List<Row> owners, SessionProvider sessions) {
    RelationshipInfo rel = plan.rel();
    Set<Object> keys = new LinkedHashSet<>();
    for (Row owner : owners) {
      if (!owner.has(rel.ownerKey())) {
        throw SpectroException.invalidData("Cannot preload '" + rel.name() + "': rows have no column '" + rel.ownerKey() + "'");
      }
      Object k = normalizeKey(owner.get(rel.ownerKey()));
      if (k != null) keys.add(k);
    }

    List<Row> related = new ArrayList<>();
    List<Object> all = new ArrayList<>(keys);
    for (int from = 0; from < all.size(); from += batchSize) {
      List<Object> chunk = all.subList(from, Math.min(from + batchSize, all.size()));
      Query q = Query.from(rel.relatedTable()).where(Field.of(rel.relatedKey()).in(chunk));
      SqlStatement ss = dialect.compileSelect(q, schemas);
      related.addAll(sessions.withSession(s -> executor.query(s, ss)));
    }

    if (!plan.rest().isEmpty() && !related.isEmpty()) {
      related = preload(rel.relatedTable(), related, plan.rest(), sessions, false);
    }

    Map<Object, List<Row>> groups = new HashMap<>();
    for (Row r : related) {
      Object k = normalizeKey(r.get(rel.relatedKey()));
      if (k != null) groups.computeIfAbsent(k, x -> new ArrayList<>()).add(r);
    }
    return new Loaded(rel.name(), groups);
  }

  private static Row attach(Row owner, RelationshipInfo rel, Map<Object, List<Row>> groups) {
    Object k = normalizeKey(owner.get(rel.ownerKey()));
    List<Row> matches = (k == null || groups == null) ? List.of() : groups.getOrDefault(k, List.of());
    if (rel.kind().singular()) {
      return owner.withAssociation(rel.name(), matches.isEmpty() ? null : matches.get(0));
    }
    return owner.withAssociation(rel.name(), List.copyOf(matches));
  }

  /** Integer and Long keys from different columns must match each other. */
  static Object normalizeKey(Object v) {
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
      return ((Number) v).longValue();
    }
    if (v instanceof BigInteger bi && bi.bitLength() < 64) return bi.longValue();
    return v;
  }
}
