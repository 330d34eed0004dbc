package io.spectro.persistence.compile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Clause-level intermediate form: a sequence of SQL text pieces and parameter slots.
 * <p>
 * Fragments compile independently and compose freely; placeholders are only numbered when the
 * finished statement is flattened by {@link #toStatement()}, so they are always {@code $1..$k}
 * in order of appearance.
 */
public final class SqlFragment {
  private static final SqlFragment EMPTY = new SqlFragment(List.of());

  private final List<Object> parts;

  private SqlFragment(List<Object> parts) {
    this.parts = parts;
  }

  /** Parameter slot; identity matters, not the value. */
  private static final class Slot {
    private final Object value;

    Slot(Object value) {
      this.value = value;
    }
  }

  public static SqlFragment empty() { return EMPTY; }

  public static SqlFragment text(String sql) {
    return new SqlFragment(List.of(sql));
  }

  public static SqlFragment param(Object value) {
    return new SqlFragment(List.of(new Slot(value)));
  }

  public static Builder builder() { return new Builder(); }

  public boolean isEmpty() { return parts.isEmpty(); }

  public int paramCount() {
    int n = 0;
    for (Object p : parts) if (p instanceof Slot) n++;
    return n;
  }

  /** Joins non-empty fragments with {@code separator}. */
  public static SqlFragment join(String separator, List<SqlFragment> fragments) {
    Builder b = builder();
    boolean first = true;
    for (SqlFragment f : fragments) {
      if (f == null || f.isEmpty()) continue;
      if (!first) b.append(separator);
      b.append(f);
      first = false;
    }
    return b.build();
  }

  public SqlFragment parenthesized() {
    if (isEmpty()) return this;
    return builder().append("(").append(this).append(")").build();
  }

  /** Numbers every slot in one pass, left to right. */
  public SqlStatement toStatement() {
    StringBuilder sql = new StringBuilder();
    List<Object> params = new ArrayList<>();
    for (Object p : parts) {
      if (p instanceof Slot s) {
        params.add(s.value);
        sql.append('$').append(params.size());
      } else {
        sql.append((String) p);
      }
    }
    return new SqlStatement(sql.toString(), params);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Object p : parts) sb.append(p instanceof Slot ? "?" : p);
    return sb.toString();
  }

  public static final class Builder {
    private final List<Object> parts = new ArrayList<>();

    private Builder() {}

    public Builder append(String sql) {
      if (sql != null && !sql.isEmpty()) parts.add(sql);
      return this;
    }

    public Builder append(SqlFragment fragment) {
      if (fragment != null) parts.addAll(fragment.parts);
      return this;
    }

    public Builder param(Object value) {
      parts.add(new Slot(value));
      return this;
    }

    /** Comma-separated slots, one per value. */
    public Builder params(List<?> values) {
      for (int i = 0; i < values.size(); i++) {
        if (i > 0) append(", ");
        param(values.get(i));
      }
      return this;
    }

    public boolean isEmpty() { return parts.isEmpty(); }

    public SqlFragment build() {
      return parts.isEmpty() ? EMPTY : new SqlFragment(Collections.unmodifiableList(new ArrayList<>(parts)));
    }
  }
}
