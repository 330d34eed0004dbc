package io.spectro.persistence.engine;

import io.spectro.persistence.compile.SqlStatement;
import io.spectro.persistence.error.DatabaseException;
import io.spectro.persistence.error.ErrorKind;
import io.spectro.persistence.error.SpectroException;
import io.spectro.persistence.exec.SqlSession;
import io.spectro.persistence.exec.ValueDecoder;
import io.spectro.persistence.row.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs compiled statements on a session and turns raw driver rows into {@link Row}s.
 * <p>
 * This is the only place raw values are decoded. Driver failures that are not already
 * {@link SpectroException}s are wrapped as {@link DatabaseException} with the SQL attached.
 */
public final class SqlExecutor {
  private static final Logger log = LoggerFactory.getLogger(SqlExecutor.class);

  private final ValueDecoder decoder;

  public SqlExecutor(ValueDecoder decoder) {
    this.decoder = Objects.requireNonNull(decoder, "decoder");
  }

  public SqlExecutor() {
    this(DefaultValueDecoder.INSTANCE);
  }

  public List<Row> query(SqlSession session, SqlStatement ss) {
    long start = System.nanoTime();
    debugSql(ss);
    List<Map<String, Object>> raw;
    try {
      raw = session.query(ss.sql(), ss.params());
    } catch (SpectroException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DatabaseException(ss.sql(), e);
    }
    List<Row> out = new ArrayList<>(raw.size());
    for (Map<String, Object> r : raw) out.add(decode(r));
    debugDone(ss, out.size(), System.nanoTime() - start);
    return out;
  }

  public long execute(SqlSession session, SqlStatement ss) {
    long start = System.nanoTime();
    debugSql(ss);
    long n;
    try {
      n = session.execute(ss.sql(), ss.params());
    } catch (SpectroException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DatabaseException(ss.sql(), e);
    }
    debugDone(ss, n, System.nanoTime() - start);
    return n;
  }

  private Row decode(Map<String, Object> raw) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (var e : raw.entrySet()) {
      Object v;
      try {
        v = decoder.decode(e.getKey(), e.getValue());
      } catch (IllegalArgumentException ex) {
        throw new SpectroException(ErrorKind.INVALID_DATA,
            "Cannot decode column '" + e.getKey() + "': " + ex.getMessage(), ex);
      }
      values.put(e.getKey(), v);
    }
    return Row.of(values);
  }

  private static void debugSql(SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    log.debug("spectro.sql op={} paramCount={} sql={}", ss.op(), ss.params().size(), ss.sql());

    // TRACE: parameter summary only (no raw values)
    if (log.isTraceEnabled() && !ss.params().isEmpty()) {
      int idx = 1;
      for (Object v : ss.params()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("spectro.sql param index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private static void debugDone(SqlStatement ss, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("spectro.sql_done op={} durationMs={} result={}", ss.op(), durationNanos / 1_000_000.0, result);
  }
}
