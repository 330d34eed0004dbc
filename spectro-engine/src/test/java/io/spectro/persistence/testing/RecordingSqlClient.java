package io.spectro.persistence.testing;

import io.spectro.persistence.exec.SqlClient;
import io.spectro.persistence.exec.SqlSession;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Driver fake: records every statement and answers from scripted handlers, matched by SQL prefix
 * (first match wins). Unmatched queries return no rows; unmatched statements affect 0 rows.
 * <p>
 * {@link #trackInserts(String)} turns on a tiny table simulation for one table: inserts are staged
 * per session inside {@code BEGIN ... COMMIT} and discarded on {@code ROLLBACK}.
 */
public final class RecordingSqlClient implements SqlClient {
  public record Call(int session, String sql, List<Object> params) {}

  private record Handler(String prefix, Function<List<Object>, List<Map<String, Object>>> rows, Long affected, RuntimeException failure) {}

  private final List<Call> calls = new CopyOnWriteArrayList<>();
  private final List<Handler> handlers = new CopyOnWriteArrayList<>();
  private final AtomicInteger opened = new AtomicInteger();
  private final AtomicInteger closed = new AtomicInteger();
  private final AtomicLong ids = new AtomicLong();
  private final Map<String, Integer> committed = Collections.synchronizedMap(new HashMap<>());

  public RecordingSqlClient onQuery(String sqlPrefix, Function<List<Object>, List<Map<String, Object>>> rows) {
    handlers.add(new Handler(sqlPrefix, rows, null, null));
    return this;
  }

  public RecordingSqlClient onQuery(String sqlPrefix, List<Map<String, Object>> rows) {
    return onQuery(sqlPrefix, params -> rows);
  }

  public RecordingSqlClient onExecute(String sqlPrefix, long affected) {
    handlers.add(new Handler(sqlPrefix, null, affected, null));
    return this;
  }

  public RecordingSqlClient failOn(String sqlPrefix, RuntimeException failure) {
    handlers.add(new Handler(sqlPrefix, null, null, failure));
    return this;
  }

  public RecordingSqlClient trackInserts(String table) {
    committed.putIfAbsent(table, 0);
    return this;
  }

  public int committedRows(String table) {
    Integer n = committed.get(table);
    return n == null ? 0 : n;
  }

  public List<Call> calls() { return List.copyOf(calls); }

  public List<String> sql() {
    List<String> out = new ArrayList<>();
    for (Call c : calls) out.add(c.sql());
    return out;
  }

  public List<Call> callsStartingWith(String prefix) {
    List<Call> out = new ArrayList<>();
    for (Call c : calls) if (c.sql().startsWith(prefix)) out.add(c);
    return out;
  }

  public int openedSessions() { return opened.get(); }
  public int closedSessions() { return closed.get(); }

  @Override
  public SqlSession openSession() {
    return new Session(opened.incrementAndGet());
  }

  private Handler match(String sql) {
    for (Handler h : handlers) if (sql.startsWith(h.prefix())) return h;
    return null;
  }

  private final class Session implements SqlSession {
    private final int id;
    private final Map<String, Integer> pending = new LinkedHashMap<>();
    private boolean inTx;
    private boolean isClosed;

    Session(int id) { this.id = id; }

    @Override
    public long execute(String sql, List<Object> params) {
      record(sql, params);
      if (sql.startsWith("BEGIN")) {
        inTx = true;
      } else if (sql.equals("COMMIT")) {
        for (var e : pending.entrySet()) committed.merge(e.getKey(), e.getValue(), Integer::sum);
        pending.clear();
        inTx = false;
      } else if (sql.equals("ROLLBACK")) {
        pending.clear();
        inTx = false;
      }
      Handler h = match(sql);
      if (h == null) return 0;
      if (h.failure() != null) throw h.failure();
      if (h.affected() != null) return h.affected();
      return h.rows().apply(params).size();
    }

    @Override
    public List<Map<String, Object>> query(String sql, List<Object> params) {
      record(sql, params);
      Handler h = match(sql);
      if (h != null && h.failure() != null) throw h.failure();
      if (sql.startsWith("INSERT INTO ")) {
        String table = sql.substring("INSERT INTO ".length()).split("[ (]", 2)[0];
        if (committed.containsKey(table)) return stageInsert(table, sql);
      }
      if (h == null || h.rows() == null) return List.of();
      return h.rows().apply(params);
    }

    private List<Map<String, Object>> stageInsert(String table, String sql) {
      int tuples = sql.contains(" VALUES ") ? sql.split("\\), \\(", -1).length : 1;
      if (inTx) pending.merge(table, tuples, Integer::sum);
      else committed.merge(table, tuples, Integer::sum);
      List<Map<String, Object>> out = new ArrayList<>();
      for (int i = 0; i < tuples; i++) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", ids.incrementAndGet());
        out.add(row);
      }
      return out;
    }

    private void record(String sql, List<Object> params) {
      if (isClosed) throw new IllegalStateException("session " + id + " is closed");
      calls.add(new Call(id, sql, Collections.unmodifiableList(new ArrayList<>(params))));
    }

    @Override
    public void close() {
      if (!isClosed) {
        isClosed = true;
        closed.incrementAndGet();
      }
    }
  }

  /** {@code Map.of} rejects nulls; rows in tests often need them. */
  public static Map<String, Object> row(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
    return m;
  }
}
