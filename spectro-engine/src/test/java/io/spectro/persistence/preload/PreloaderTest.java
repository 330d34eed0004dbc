package io.spectro.persistence.preload;

import io.spectro.persistence.compile.PostgresSqlDialect;
import io.spectro.persistence.engine.SessionProvider;
import io.spectro.persistence.engine.SqlExecutor;
import io.spectro.persistence.error.DatabaseException;
import io.spectro.persistence.error.ErrorKind;
import io.spectro.persistence.error.SpectroException;
import io.spectro.persistence.exec.SqlSession;
import io.spectro.persistence.row.Row;
import io.spectro.persistence.testing.Fixtures;
import io.spectro.persistence.testing.RecordingSqlClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static io.spectro.persistence.testing.RecordingSqlClient.row;
import static org.junit.jupiter.api.Assertions.*;

final class PreloaderTest {
  private static final List<Map<String, Object>> USERS = List.of(
      row("id", 1L, "name", "ann"),
      row("id", 2L, "name", "bob"),
      row("id", 3L, "name", "cy"));

  private static final List<Map<String, Object>> POSTS = List.of(
      row("id", 10L, "user_id", 1L, "title", "a"),
      row("id", 11L, "user_id", 1L, "title", "b"),
      row("id", 12L, "user_id", 2L, "title", "c"),
      row("id", 13L, "user_id", 2L, "title", "d"),
      row("id", 14L, "user_id", 2L, "title", "e"));

  private static final List<Map<String, Object>> COMMENTS = List.of(
      row("id", 100L, "post_id", 10L, "body", "x"),
      row("id", 101L, "post_id", 12L, "body", "y"));

  private final ExecutorService pool = Executors.newFixedThreadPool(4);
  private final RecordingSqlClient client = new RecordingSqlClient()
      .onQuery("SELECT * FROM posts", params -> matching(POSTS, "user_id", params))
      .onQuery("SELECT * FROM users", params -> matching(USERS, "id", params))
      .onQuery("SELECT * FROM comments", params -> matching(COMMENTS, "post_id", params))
      .onQuery("SELECT * FROM profiles", params -> matching(List.of(row("id", 7L, "user_id", 2L, "bio", "hi")), "user_id", params));

  @AfterEach
  void shutdown() {
    pool.shutdownNow();
  }

  @Test
  void hasManyCostsOneQuery() {
    List<Row> users = preloader(1000).preload("users", rows(USERS), List.of("posts"), SessionProvider.pooled(client));

    assertEquals(List.of("SELECT * FROM posts WHERE user_id IN ($1, $2, $3)"), client.sql());
    assertEquals(List.of(1L, 2L, 3L), client.calls().get(0).params());
    assertEquals(2, users.get(0).rows("posts").size());
    assertEquals(3, users.get(1).rows("posts").size());
    assertEquals(List.of(), users.get(2).rows("posts"));
    assertEquals("ann", users.get(0).getString("name"));
  }

  @Test
  void belongsToLoadsDistinctNonNullKeys() {
    List<Row> posts = new ArrayList<>(rows(POSTS));
    posts.add(Row.of(row("id", 15L, "user_id", null, "title", "orphan")));

    List<Row> out = preloader(1000).preload("posts", posts, List.of("author"), SessionProvider.pooled(client));

    assertEquals(List.of("SELECT * FROM users WHERE id IN ($1, $2)"), client.sql());
    assertEquals("ann", out.get(0).one("author").getString("name"));
    assertEquals("bob", out.get(4).one("author").getString("name"));
    assertNull(out.get(5).one("author"));
  }

  @Test
  void hasOneAttachesSingleRowOrNull() {
    List<Row> users = preloader(1000).preload("users", rows(USERS), List.of("profile"), SessionProvider.pooled(client));
    assertNull(users.get(0).one("profile"));
    assertEquals("hi", users.get(1).one("profile").getString("bio"));
  }

  @Test
  void integerAndLongKeysMatch() {
    List<Row> owners = List.of(Row.of("id", 1, "name", "ann"));
    List<Row> out = preloader(1000).preload("users", owners, List.of("posts"), SessionProvider.pooled(client));
    assertEquals(2, out.get(0).rows("posts").size());
  }

  @Test
  void keysAreChunkedByBatchSize() {
    List<Row> out = preloader(2).preload("users", rows(USERS), List.of("posts"), SessionProvider.pooled(client));

    assertEquals(List.of(
        "SELECT * FROM posts WHERE user_id IN ($1, $2)",
        "SELECT * FROM posts WHERE user_id IN ($1)"), client.sql());
    assertEquals(2, out.get(0).rows("posts").size());
    assertEquals(3, out.get(1).rows("posts").size());
  }

  @Test
  void nestedPathsShareTheirFirstSegment() {
    List<Row> users = preloader(1000).preload("users", rows(USERS), List.of("posts.comments", "posts.author"),
        SessionProvider.pooled(client));

    assertEquals(1, client.callsStartingWith("SELECT * FROM posts").size());
    assertEquals(1, client.callsStartingWith("SELECT * FROM comments").size());
    assertEquals(1, client.callsStartingWith("SELECT * FROM users").size());
    Row firstPost = users.get(0).rows("posts").get(0);
    assertEquals("x", firstPost.rows("comments").get(0).getString("body"));
    assertEquals("ann", firstPost.one("author").getString("name"));
  }

  @Test
  void unknownNameFailsBeforeAnyQuery() {
    Preloader p = preloader(1000);
    SessionProvider sessions = SessionProvider.pooled(client);

    SpectroException top = assertThrows(SpectroException.class,
        () -> p.preload("users", rows(USERS), List.of("posts", "nope"), sessions));
    assertEquals(ErrorKind.INVALID_RELATIONSHIP, top.kind());

    SpectroException nested = assertThrows(SpectroException.class,
        () -> p.preload("users", rows(USERS), List.of("posts.nope"), sessions));
    assertEquals(ErrorKind.INVALID_RELATIONSHIP, nested.kind());

    SpectroException m2m = assertThrows(SpectroException.class,
        () -> p.preload("users", rows(USERS), List.of("friends"), sessions));
    assertEquals(ErrorKind.NOT_IMPLEMENTED, m2m.kind());

    assertTrue(client.calls().isEmpty());
  }

  @Test
  void independentAssociationsUseTheirOwnSessions() {
    preloader(1000).preload("users", rows(USERS), List.of("posts", "profile"), SessionProvider.pooled(client));

    Set<Integer> sessions = new HashSet<>();
    for (RecordingSqlClient.Call c : client.calls()) sessions.add(c.session());
    assertEquals(2, sessions.size());
    assertEquals(2, client.closedSessions());
  }

  @Test
  void boundSessionRunsSequentially() {
    try (SqlSession s = client.openSession()) {
      List<Row> users = preloader(1000).preload("users", rows(USERS), List.of("posts", "profile"), SessionProvider.bound(s));
      assertEquals(List.of(
          "SELECT * FROM posts WHERE user_id IN ($1, $2, $3)",
          "SELECT * FROM profiles WHERE user_id IN ($1, $2, $3)"), client.sql());
      assertEquals(1, client.openedSessions());
      assertTrue(users.get(1).hasAssociation("profile"));
    }
  }

  @Test
  void failingTaskFailsTheWholePreload() {
    RecordingSqlClient failing = new RecordingSqlClient()
        .failOn("SELECT * FROM profiles", new IllegalStateException("connection reset"))
        .onQuery("SELECT * FROM posts", params -> matching(POSTS, "user_id", params));

    DatabaseException e = assertThrows(DatabaseException.class, () ->
        preloader(1000).preload("users", rows(USERS), List.of("posts", "profile"), SessionProvider.pooled(failing)));

    assertEquals(ErrorKind.DATABASE_ERROR, e.kind());
    assertTrue(e.sql().startsWith("SELECT * FROM profiles"));
    assertEquals("connection reset", e.getCause().getMessage());
  }

  @Test
  void failingTaskInterruptsSlowSibling() throws InterruptedException {
    CountDownLatch postsStarted = new CountDownLatch(1);
    CountDownLatch postsInterrupted = new CountDownLatch(1);
    CountDownLatch never = new CountDownLatch(1);
    RecordingSqlClient slow = new RecordingSqlClient()
        .onQuery("SELECT * FROM posts", params -> {
          postsStarted.countDown();
          try {
            never.await(10, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            postsInterrupted.countDown();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("cancelled", e);
          }
          return List.of();
        })
        .onQuery("SELECT * FROM profiles", params -> {
          try {
            postsStarted.await(5, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          throw new IllegalStateException("connection reset");
        });

    long start = System.nanoTime();
    DatabaseException e = assertThrows(DatabaseException.class, () ->
        preloader(1000).preload("users", rows(USERS), List.of("posts", "profile"), SessionProvider.pooled(slow)));
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertTrue(e.sql().startsWith("SELECT * FROM profiles"));
    assertTrue(elapsedMillis < 8000, "waited " + elapsedMillis + "ms for the slow sibling");
    assertTrue(postsInterrupted.await(5, TimeUnit.SECONDS));
  }

  @Test
  void emptyOwnersIssueNoQueries() {
    assertEquals(List.of(), preloader(1000).preload("users", List.of(), List.of("posts"), SessionProvider.pooled(client)));
    assertTrue(client.calls().isEmpty());
  }

  @Test
  void missingKeyColumnIsInvalidData() {
    List<Row> owners = List.of(Row.of("name", "ann"));
    SpectroException e = assertThrows(SpectroException.class,
        () -> preloader(1000).preload("users", owners, List.of("posts"), SessionProvider.pooled(client)));
    assertEquals(ErrorKind.INVALID_DATA, e.kind());
  }

  private Preloader preloader(int batchSize) {
    return new Preloader(Fixtures.registry(), new PostgresSqlDialect(), new SqlExecutor(), batchSize, pool);
  }

  private static List<Row> rows(List<Map<String, Object>> raw) {
    List<Row> out = new ArrayList<>();
    for (Map<String, Object> m : raw) out.add(Row.of(m));
    return out;
  }

  private static List<Map<String, Object>> matching(List<Map<String, Object>> table, String column, List<Object> keys) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> r : table) if (keys.contains(r.get(column))) out.add(r);
    return out;
  }
}
