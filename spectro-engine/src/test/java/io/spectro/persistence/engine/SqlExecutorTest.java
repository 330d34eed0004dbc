package io.spectro.persistence.engine;

import io.spectro.persistence.compile.SqlStatement;
import io.spectro.persistence.error.DatabaseException;
import io.spectro.persistence.error.ErrorKind;
import io.spectro.persistence.error.SpectroException;
import io.spectro.persistence.exec.Propagation;
import io.spectro.persistence.exec.SqlSession;
import io.spectro.persistence.row.Row;
import io.spectro.persistence.testing.RecordingSqlClient;
import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

import static io.spectro.persistence.testing.RecordingSqlClient.row;
import static org.junit.jupiter.api.Assertions.*;

final class SqlExecutorTest {
  private static final Instant AT = Instant.parse("2024-05-06T07:08:09Z");

  private final RecordingSqlClient client = new RecordingSqlClient();

  @Test
  void decodesDriverValues() {
    client.onQuery("SELECT", List.of(row("id", (short) 3, "at", Timestamp.from(AT), "note", null)));
    try (SqlSession s = client.openSession()) {
      List<Row> rows = new SqlExecutor().query(s, new SqlStatement("SELECT * FROM t WHERE id = $1", List.of(3)));

      Row r = rows.get(0);
      assertEquals(3, r.get("id"));
      assertEquals(AT, r.get("at"));
      assertTrue(r.has("note"));
      assertNull(r.get("note"));
      assertEquals(List.of("id", "at", "note"), List.copyOf(r.columns()));
    }
  }

  @Test
  void customDecoderRunsAfterDefaults() {
    client.onQuery("SELECT", List.of(row("name", 'x')));
    SqlExecutor executor = new SqlExecutor(DefaultValueDecoder.INSTANCE.andThen((col, v) -> v instanceof String s ? s.toUpperCase() : v));
    try (SqlSession s = client.openSession()) {
      assertEquals("X", executor.query(s, SqlStatement.of("SELECT name FROM t")).get(0).get("name"));
    }
  }

  @Test
  void undecodableValueIsInvalidData() {
    client.onQuery("SELECT", List.of(row("v", "??")));
    SqlExecutor executor = new SqlExecutor((col, v) -> {
      throw new IllegalArgumentException("unsupported type");
    });
    try (SqlSession s = client.openSession()) {
      SpectroException e = assertThrows(SpectroException.class, () -> executor.query(s, SqlStatement.of("SELECT v FROM t")));
      assertEquals(ErrorKind.INVALID_DATA, e.kind());
    }
  }

  @Test
  void driverFailuresCarryTheSql() {
    client.failOn("UPDATE", new IllegalStateException("deadlock detected"));
    try (SqlSession s = client.openSession()) {
      DatabaseException e = assertThrows(DatabaseException.class,
          () -> new SqlExecutor().execute(s, SqlStatement.of("UPDATE t SET a = 1")));
      assertEquals("UPDATE t SET a = 1", e.sql());
      assertEquals(ErrorKind.DATABASE_ERROR, e.kind());
      assertEquals("deadlock detected", e.getCause().getMessage());
    }
  }

  @Test
  void spectroFailuresPassThroughUnwrapped() {
    SpectroException original = SpectroException.invalidData("bad row");
    client.failOn("SELECT", original);
    try (SqlSession s = client.openSession()) {
      SpectroException e = assertThrows(SpectroException.class, () -> new SqlExecutor().query(s, SqlStatement.of("SELECT 1")));
      assertSame(original, e);
    }
  }

  @Test
  void optionsValidateAndDefault() {
    SpectroOptions d = SpectroOptions.defaults();
    assertEquals(SpectroOptions.DEFAULT_BATCH_SIZE, d.batchSize());
    assertEquals(Propagation.REQUIRED, d.defaultPropagation());
    assertNull(d.defaultIsolation());
    assertEquals(50, d.withBatchSize(50).batchSize());
    assertThrows(IllegalArgumentException.class, () -> d.withBatchSize(0));
    assertThrows(IllegalArgumentException.class, () -> d.withPreloadParallelism(-1));
  }
}
