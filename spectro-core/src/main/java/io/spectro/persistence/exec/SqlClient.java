package io.spectro.persistence.exec;

/**
 * Driver/pool collaborator. Each call checks out one session; concurrent callers get distinct sessions.
 */
public interface SqlClient {
  SqlSession openSession();
}
