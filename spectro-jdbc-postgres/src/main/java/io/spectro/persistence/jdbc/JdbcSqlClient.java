package io.spectro.persistence.jdbc;

import io.spectro.persistence.error.ErrorKind;
import io.spectro.persistence.error.SpectroException;
import io.spectro.persistence.exec.SqlClient;
import io.spectro.persistence.exec.SqlSession;
import io.spectro.persistence.jdbc.postgres.PostgresValueBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link SqlClient} over a JDBC {@link DataSource}. Every session is one pooled connection in
 * auto-commit mode; transactions are driven by the {@code BEGIN}/{@code COMMIT} statements the
 * engine sends.
 */
public final class JdbcSqlClient implements SqlClient {
  private static final Logger log = LoggerFactory.getLogger(JdbcSqlClient.class);

  private final DataSource ds;
  private final PostgresValueBinder binder;

  public JdbcSqlClient(DataSource ds, PostgresValueBinder binder) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.binder = Objects.requireNonNull(binder, "binder");
  }

  public JdbcSqlClient(DataSource ds) {
    this(ds, new PostgresValueBinder());
  }

  @Override
  public SqlSession openSession() {
    Connection c;
    try {
      c = ds.getConnection();
    } catch (SQLException e) {
      throw new SpectroException(ErrorKind.DATABASE_ERROR, "Cannot obtain connection: " + e.getMessage(), e);
    }
    try {
      if (!c.getAutoCommit()) c.setAutoCommit(true);
    } catch (SQLException e) {
      SpectroException ex = new SpectroException(ErrorKind.DATABASE_ERROR, "Cannot prepare connection: " + e.getMessage(), e);
      closeAfter(c, ex);
      throw ex;
    }
    if (log.isDebugEnabled()) log.debug("spectro.jdbc session_open connection={}", System.identityHashCode(c));
    return new JdbcSqlSession(c, binder);
  }

  private static void closeAfter(Connection c, Throwable cause) {
    try {
      c.close();
    } catch (SQLException e) {
      log.warn("spectro.jdbc close_failed error={}", e.toString());
      cause.addSuppressed(e);
    }
  }
}
