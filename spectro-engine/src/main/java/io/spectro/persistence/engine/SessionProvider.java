package io.spectro.persistence.engine;

import io.spectro.persistence.exec.SqlClient;
import io.spectro.persistence.exec.SqlSession;

import java.util.Objects;
import java.util.function.Function;

/** Where a unit of work gets its session: a fresh pool checkout, or the session a transaction owns. */
public interface SessionProvider {
  <T> T withSession(Function<SqlSession, T> work);

  /**
   * True when every call shares one session. Work must then run sequentially on the calling
   * thread, since a session cannot interleave statements.
   */
  boolean exclusive();

  static SessionProvider pooled(SqlClient client) {
    Objects.requireNonNull(client, "client");
    return new SessionProvider() {
      @Override
      public <T> T withSession(Function<SqlSession, T> work) {
        try (SqlSession s = client.openSession()) {
          return work.apply(s);
        }
      }

      @Override
      public boolean exclusive() { return false; }
    };
  }

  static SessionProvider bound(SqlSession session) {
    Objects.requireNonNull(session, "session");
    return new SessionProvider() {
      @Override
      public <T> T withSession(Function<SqlSession, T> work) {
        return work.apply(session);
      }

      @Override
      public boolean exclusive() { return true; }
    };
  }
}
