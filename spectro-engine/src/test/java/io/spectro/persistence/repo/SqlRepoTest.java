package io.spectro.persistence.repo;

import io.spectro.persistence.changeset.Changeset;
import io.spectro.persistence.dmlast.ConflictTarget;
import io.spectro.persistence.engine.SpectroOptions;
import io.spectro.persistence.error.ErrorKind;
import io.spectro.persistence.error.InvalidChangesetException;
import io.spectro.persistence.error.SpectroException;
import io.spectro.persistence.exec.IsolationLevel;
import io.spectro.persistence.exec.Propagation;
import io.spectro.persistence.query.Field;
import io.spectro.persistence.query.Query;
import io.spectro.persistence.row.Row;
import io.spectro.persistence.schema.EntitySchema;
import io.spectro.persistence.schema.FieldType;
import io.spectro.persistence.schema.RelationshipInfo;
import io.spectro.persistence.testing.Fixtures;
import io.spectro.persistence.testing.RecordingSqlClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static io.spectro.persistence.testing.RecordingSqlClient.row;
import static org.junit.jupiter.api.Assertions.*;

final class SqlRepoTest {
  record Author(long id, String name, List<String> titles) {}

  private static final EntitySchema<Author> AUTHORS = EntitySchema.<Author>builder("users")
      .id("id", FieldType.LONG)
      .field("name", FieldType.STRING)
      .relationship(RelationshipInfo.hasMany("posts", "posts", "user_id"))
      .reader(r -> new Author(r.getLong("id"), r.getString("name"), titles(r)))
      .accessor((a, field) -> switch (field) {
        case "id" -> a.id();
        case "name" -> a.name();
        default -> null;
      })
      .build();

  private final RecordingSqlClient client = new RecordingSqlClient();
  private final SqlRepo repo = SqlRepo.create(client, Fixtures.registry());

  @AfterEach
  void close() {
    repo.close();
  }

  // ---------- transactions ----------

  @Test
  void failedTransactionLeavesNoRows() {
    client.trackInserts("users");

    assertThrows(IllegalStateException.class, () -> repo.transaction(r -> {
      r.insert(Changeset.empty("users").put("name", "ann"));
      throw new IllegalStateException("abort");
    }));

    assertEquals(0, client.committedRows("users"));
    assertEquals("BEGIN", client.sql().get(0));
    assertEquals("ROLLBACK", client.sql().get(2));

    Row inserted = repo.transaction(r -> r.insert(Changeset.empty("users").put("name", "bob")));
    assertNotNull(inserted.get("id"));
    assertEquals(1, client.committedRows("users"));
  }

  @Test
  void transactionScopedRepoUsesOneSession() {
    repo.transaction(r -> {
      assertTrue(r.inTransaction());
      r.rows(Query.from("users"));
      r.execute("UPDATE users SET age = age + 1", List.of());
      return null;
    });

    Set<Integer> sessions = new HashSet<>();
    for (RecordingSqlClient.Call c : client.calls()) sessions.add(c.session());
    assertEquals(1, sessions.size());
    assertFalse(repo.inTransaction());
  }

  @Test
  void nestedTransactionJoinsOuter() {
    repo.transaction(outer -> outer.transaction(inner -> {
      assertSame(outer, inner);
      return inner.transaction(IsolationLevel.SERIALIZABLE, again -> 1);
    }));

    assertEquals(List.of("BEGIN", "COMMIT"), client.sql());
  }

  @Test
  void propagationRules() {
    SpectroException nested = assertThrows(SpectroException.class, () -> repo.transaction(Propagation.NESTED, r -> 1));
    assertEquals(ErrorKind.NOT_IMPLEMENTED, nested.kind());

    assertThrows(IllegalStateException.class, () -> repo.transaction(Propagation.MANDATORY, r -> 1));
    int never = repo.transaction(Propagation.NEVER, r -> 1);
    int supports = repo.transaction(Propagation.SUPPORTS, r -> 2);
    assertEquals(3, never + supports);
    assertTrue(client.calls().isEmpty());

    repo.transaction(r -> {
      int joined = r.transaction(Propagation.MANDATORY, x -> 2);
      assertEquals(2, joined);
      assertThrows(IllegalStateException.class, () -> r.transaction(Propagation.NEVER, x -> 3));
      r.transaction(Propagation.REQUIRES_NEW, fresh -> {
        assertNotSame(r, fresh);
        return fresh.execute("SELECT 1", List.of());
      });
      return null;
    });

    List<RecordingSqlClient.Call> begins = client.callsStartingWith("BEGIN");
    assertEquals(2, begins.size());
    assertNotEquals(begins.get(0).session(), begins.get(1).session());
    assertEquals(2, client.callsStartingWith("COMMIT").size());
  }

  @Test
  void defaultIsolationFromOptions() {
    try (SqlRepo repeatable = SqlRepo.create(client, Fixtures.registry(),
        SpectroOptions.defaults().withDefaultIsolation(IsolationLevel.REPEATABLE_READ))) {
      repeatable.transaction(r -> 1);
    }
    assertEquals("BEGIN ISOLATION LEVEL REPEATABLE READ", client.sql().get(0));
  }

  @Test
  void savepointOutsideTransactionOpensOne() {
    repo.savepoint("step", r -> {
      assertTrue(r.inTransaction());
      return 1;
    });

    List<String> sql = client.sql();
    assertEquals("BEGIN", sql.get(0));
    assertTrue(sql.get(1).startsWith("SAVEPOINT sp_step_"));
    assertTrue(sql.get(2).startsWith("RELEASE SAVEPOINT sp_step_"));
    assertEquals("COMMIT", sql.get(3));
  }

  @Test
  void savepointFailureKeepsOuterWork() {
    client.trackInserts("users");

    repo.transaction(r -> {
      r.insert(Changeset.empty("users").put("name", "kept"));
      assertThrows(IllegalStateException.class, () -> r.savepoint("risky", sp -> {
        throw new IllegalStateException("undo me");
      }));
      return null;
    });

    assertTrue(client.sql().stream().anyMatch(s -> s.startsWith("ROLLBACK TO SAVEPOINT sp_risky_")));
    assertEquals("COMMIT", client.sql().get(client.sql().size() - 1));
    assertEquals(1, client.committedRows("users"));
  }

  // ---------- writes ----------

  @Test
  void insertRequiresExactlyOneReturnedRow() {
    client.onQuery("INSERT INTO posts", List.of());
    SpectroException e = assertThrows(SpectroException.class,
        () -> repo.insert(Changeset.empty("posts").put("title", "t")));
    assertEquals(ErrorKind.UNEXPECTED_RESULT_COUNT, e.kind());
  }

  @Test
  void invalidChangesetIssuesNoSql() {
    Changeset bad = Changeset.cast(Fixtures.USERS, Map.of("age", "old")).validateRequired(Fixtures.USERS);
    InvalidChangesetException e = assertThrows(InvalidChangesetException.class, () -> repo.insert(bad));
    assertEquals(Set.of("age", "name"), e.errors().keySet());

    assertThrows(InvalidChangesetException.class, () -> repo.update(Fixtures.USERS, 1, bad));
    assertThrows(InvalidChangesetException.class, () -> repo.insertAll(Fixtures.USERS, List.of(bad)));
    assertTrue(client.calls().isEmpty());
  }

  @Test
  void insertAllBatchesInsideOneTransaction() {
    client.trackInserts("users");
    SqlRepo small = SqlRepo.create(client, Fixtures.registry(), SpectroOptions.defaults().withBatchSize(2));
    List<Changeset> rows = new ArrayList<>();
    for (int i = 0; i < 5; i++) rows.add(Changeset.empty("users").put("name", "u" + i));

    List<Row> inserted;
    try (small) {
      inserted = small.insertAll(Fixtures.USERS, rows);
    }

    assertEquals(5, inserted.size());
    assertEquals(5, client.committedRows("users"));
    List<String> sql = client.sql();
    assertEquals("BEGIN", sql.get(0));
    assertEquals("INSERT INTO users (name) VALUES ($1), ($2) RETURNING *", sql.get(1));
    assertEquals("INSERT INTO users (name) VALUES ($1) RETURNING *", sql.get(3));
    assertEquals("COMMIT", sql.get(4));
    assertEquals(List.of(), repo.insertAll(Fixtures.USERS, List.of()));
  }

  @Test
  void updateMissingRowIsNotFound() {
    client.onQuery("UPDATE users", List.of());
    SpectroException e = assertThrows(SpectroException.class,
        () -> repo.update(Fixtures.USERS, 9, Changeset.empty("users").put("name", "x")));
    assertEquals(ErrorKind.NOT_FOUND, e.kind());
  }

  @Test
  void updateReturnsNewRow() {
    client.onQuery("UPDATE users", List.of(row("id", 9L, "name", "x")));
    Row r = repo.update(Fixtures.USERS, 9, Changeset.empty("users").put("name", "x"));
    assertEquals("x", r.getString("name"));
    assertEquals(List.of("x", 9L), client.calls().get(0).params());
  }

  @Test
  void emptyUpdateReadsCurrentRow() {
    client.onQuery("SELECT * FROM users WHERE id = $1 LIMIT 1", List.of(row("id", 4L, "name", "same")));
    Row r = repo.update(Fixtures.USERS, 4L, Changeset.empty("users"));
    assertEquals("same", r.getString("name"));
    assertEquals(List.of("SELECT * FROM users WHERE id = $1 LIMIT 1"), client.sql());
  }

  @Test
  void deleteOfMissingRowIsNotFound() {
    client.onExecute("DELETE FROM users", 0);
    SpectroException e = assertThrows(SpectroException.class, () -> repo.delete(Fixtures.USERS, 5));
    assertEquals(ErrorKind.NOT_FOUND, e.kind());
    assertEquals(List.of("DELETE FROM users WHERE id = $1"), client.sql());
  }

  @Test
  void upsertRendersConflictClause() {
    client.onQuery("INSERT INTO users", List.of(row("id", 1L, "name", "ann", "email", "a@x.com")));
    Changeset cs = Changeset.empty("users").put("id", 1L).put("name", "ann").put("email", "a@x.com");

    Row r = repo.upsert(cs, ConflictTarget.columns("email"), null);

    assertEquals("ann", r.getString("name"));
    assertEquals("INSERT INTO users (id, name, email) VALUES ($1, $2, $3)"
        + " ON CONFLICT (email) DO UPDATE SET name = EXCLUDED.name RETURNING *", client.sql().get(0));
  }

  // ---------- reads ----------

  @Test
  void getAndGetOrFail() {
    assertEquals(Optional.empty(), repo.get(Fixtures.USERS, 1));
    SpectroException e = assertThrows(SpectroException.class, () -> repo.getOrFail(Fixtures.USERS, 1));
    assertEquals(ErrorKind.NOT_FOUND, e.kind());
    assertEquals(List.of(1L), client.calls().get(0).params());
  }

  @Test
  void getCastsIdToPrimaryKeyType() {
    client.onQuery("SELECT * FROM users", List.of(row("id", 7L, "name", "ann")));

    assertEquals("ann", repo.getOrFail(Fixtures.USERS, "7").getString("name"));
    assertEquals(List.of(7L), client.calls().get(0).params());

    SpectroException bad = assertThrows(SpectroException.class, () -> repo.get(Fixtures.USERS, "seven"));
    assertEquals(ErrorKind.INVALID_QUERY, bad.kind());
    SpectroException missing = assertThrows(SpectroException.class, () -> repo.get(Fixtures.USERS, null));
    assertEquals(ErrorKind.INVALID_QUERY, missing.kind());
    assertEquals(1, client.calls().size());
  }

  @Test
  void countReadsSingleValue() {
    client.onQuery("SELECT COUNT(*)", List.of(row("count", 42L)));
    assertEquals(42L, repo.count(Query.from("users").where(Field.of("age").greaterThan(1)).limit(3)));
    assertEquals("SELECT COUNT(*) FROM users WHERE age > $1", client.sql().get(0));
  }

  @Test
  void firstLimitsToOneRow() {
    client.onQuery("SELECT * FROM users", List.of(row("id", 1L, "name", "ann")));
    Optional<Row> first = repo.first(Fixtures.USERS, Query.from("users"));
    assertEquals("ann", first.orElseThrow().getString("name"));
    assertEquals("SELECT * FROM users LIMIT 1", client.sql().get(0));

    SpectroException e = assertThrows(SpectroException.class, () -> repo.all(Fixtures.USERS, Query.from("posts")));
    assertEquals(ErrorKind.INVALID_SCHEMA, e.kind());
  }

  @Test
  void queryPreloadRunsAfterSelect() {
    client.onQuery("SELECT * FROM users", List.of(row("id", 1L, "name", "ann"), row("id", 2L, "name", "bob")));
    client.onQuery("SELECT * FROM posts", List.of(row("id", 10L, "user_id", 2L, "title", "hello")));

    List<Author> authors = repo.all(AUTHORS, Query.from("users").preload("posts"));

    assertEquals(List.of(new Author(1L, "ann", List.of()), new Author(2L, "bob", List.of("hello"))), authors);
    assertEquals(List.of("SELECT * FROM users", "SELECT * FROM posts WHERE user_id IN ($1, $2)"), client.sql());
  }

  @Test
  void preloadsOntoEntities() {
    client.onQuery("SELECT * FROM posts", List.of(row("id", 10L, "user_id", 7L, "title", "t1")));

    List<Author> out = repo.preload(AUTHORS, List.of(new Author(7L, "gus", List.of())), "posts");

    assertEquals(List.of("t1"), out.get(0).titles());
  }

  @Test
  void rawStatementsPassThrough() {
    client.onExecute("DELETE FROM sessions", 3);
    client.onQuery("SELECT now()", List.of(row("now", "2024-01-01")));

    assertEquals(3, repo.execute("DELETE FROM sessions WHERE expires < $1", List.of(10)));
    assertEquals("2024-01-01", repo.query("SELECT now()", List.of()).get(0).getString("now"));
    assertEquals(List.of(10), client.calls().get(0).params());
  }

  private static List<String> titles(Row r) {
    if (!r.hasAssociation("posts")) return List.of();
    List<String> out = new ArrayList<>();
    for (Row p : r.rows("posts")) out.add(p.getString("title"));
    return out;
  }
}
