package io.spectro.persistence.compile;

import io.spectro.persistence.error.ErrorKind;
import io.spectro.persistence.error.SpectroException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SqlFragmentTest {
  @Test
  void numbersSlotsOnceInOrderOfAppearance() {
    SqlFragment a = SqlFragment.builder().append("a = ").param(1).build();
    SqlFragment b = SqlFragment.builder().append("b IN (").params(List.of("x", "y")).append(")").build();
    SqlFragment group = SqlFragment.join(" OR ", List.of(a, b)).parenthesized();

    SqlStatement ss = SqlFragment.builder().append("c = ").param(true).append(" AND ").append(group).build().toStatement();

    assertEquals("c = $1 AND (a = $2 OR b IN ($3, $4))", ss.sql());
    assertEquals(List.of(true, 1, "x", "y"), ss.params());
  }

  @Test
  void reusedFragmentGetsFreshNumbers() {
    SqlFragment eq = SqlFragment.builder().append("x = ").param(5).build();
    SqlStatement ss = SqlFragment.join(" AND ", List.of(eq, eq)).toStatement();
    assertEquals("x = $1 AND x = $2", ss.sql());
    assertEquals(List.of(5, 5), ss.params());
  }

  @Test
  void joinSkipsEmptyFragments() {
    SqlFragment joined = SqlFragment.join(" AND ", Arrays.asList(SqlFragment.empty(), SqlFragment.text("a"), null, SqlFragment.text("b")));
    assertEquals("a AND b", joined.toStatement().sql());
    assertTrue(SqlFragment.join(" AND ", List.of(SqlFragment.empty())).isEmpty());
    assertTrue(SqlFragment.empty().parenthesized().isEmpty());
  }

  @Test
  void nullParametersAreKept() {
    SqlStatement ss = SqlFragment.builder().append("v = ").param(null).build().toStatement();
    assertEquals(Arrays.asList((Object) null), ss.params());
    assertEquals(1, SqlFragment.param(null).paramCount());
  }

  @Test
  void statementOpIsLeadingKeyword() {
    assertEquals("SELECT", SqlStatement.of("  select 1").op());
    assertEquals("BEGIN", SqlStatement.of("BEGIN ISOLATION LEVEL SERIALIZABLE").op());
    assertEquals("SQL", SqlStatement.of("(values 1)").op());
  }

  @Test
  void identifiersAllowOptionalQualifier() {
    assertEquals("users.id", Identifiers.check("users.id"));
    assertEquals("users.id", Identifiers.qualify("users", "id"));
    assertTrue(Identifiers.isQualified("users.id"));
    assertFalse(Identifiers.isQualified("id"));
    for (String bad : List.of("", "1abc", "a.b.c", "a-b", "a b", "\"x\"")) {
      SpectroException e = assertThrows(SpectroException.class, () -> Identifiers.check(bad), bad);
      assertEquals(ErrorKind.INVALID_QUERY, e.kind());
    }
  }
}
