package io.spectro.persistence.jdbc;

import io.spectro.persistence.error.DatabaseException;
import io.spectro.persistence.exec.SqlSession;
import io.spectro.persistence.jdbc.postgres.PostgresValueBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** One JDBC connection. Not thread-safe. */
final class JdbcSqlSession implements SqlSession {
  private static final Logger log = LoggerFactory.getLogger(JdbcSqlSession.class);

  private final Connection conn;
  private final PostgresValueBinder binder;
  private boolean closed;

  JdbcSqlSession(Connection conn, PostgresValueBinder binder) {
    this.conn = Objects.requireNonNull(conn, "conn");
    this.binder = Objects.requireNonNull(binder, "binder");
  }

  @Override
  public long execute(String sql, List<Object> params) {
    requireOpen();
    DollarParamRewriter.Rewritten rw = DollarParamRewriter.rewrite(sql);
    try (PreparedStatement ps = conn.prepareStatement(rw.sql())) {
      bindAll(ps, rw.bind(params));
      if (!ps.execute()) return Math.max(ps.getUpdateCount(), 0);
      // Statement produced rows (e.g. RETURNING): count them.
      long n = 0;
      try (ResultSet rs = ps.getResultSet()) {
        while (rs.next()) n++;
      }
      return n;
    } catch (SQLException e) {
      throw new DatabaseException(sql, e);
    }
  }

  @Override
  public List<Map<String, Object>> query(String sql, List<Object> params) {
    requireOpen();
    DollarParamRewriter.Rewritten rw = DollarParamRewriter.rewrite(sql);
    try (PreparedStatement ps = conn.prepareStatement(rw.sql())) {
      bindAll(ps, rw.bind(params));
      try (ResultSet rs = ps.executeQuery()) {
        return readRows(rs);
      }
    } catch (SQLException e) {
      throw new DatabaseException(sql, e);
    }
  }

  @Override
  public void close() {
    if (closed) return;
    closed = true;
    try {
      conn.close();
    } catch (SQLException e) {
      throw new DatabaseException("<close>", e);
    }
    if (log.isDebugEnabled()) log.debug("spectro.jdbc session_close connection={}", System.identityHashCode(conn));
  }

  private void bindAll(PreparedStatement ps, List<Object> values) throws SQLException {
    for (int i = 0; i < values.size(); i++) binder.bind(ps, i + 1, values.get(i));
  }

  static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int cols = md.getColumnCount();
    String[] labels = new String[cols];
    for (int i = 0; i < cols; i++) labels[i] = md.getColumnLabel(i + 1);

    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>(cols * 2);
      for (int i = 0; i < cols; i++) row.put(labels[i], rs.getObject(i + 1));
      out.add(row);
    }
    return out;
  }

  private void requireOpen() {
    if (closed) throw new IllegalStateException("Session is closed");
  }
}
