package io.spectro.persistence.row;

import io.spectro.persistence.error.SpectroException;
import io.spectro.persistence.mapping.Coercions;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * One fetched database row: column name to decoded scalar, in result-set order.
 * <p>
 * Rows are immutable. Preloaded associations live beside the columns and are attached with
 * {@link #withAssociation(String, Object)}, which returns a new row.
 */
public final class Row {
  private final Map<String, Object> values;
  private final Map<String, Object> associations;

  private Row(Map<String, Object> values, Map<String, Object> associations) {
    this.values = values;
    this.associations = associations;
  }

  public static Row of(Map<String, ?> values) {
    Objects.requireNonNull(values, "values");
    return new Row(Collections.unmodifiableMap(new LinkedHashMap<>(values)), Map.of());
  }

  /** Convenience for tests and literals: {@code Row.of("id", 1, "name", "a")}. */
  public static Row of(Object... kv) {
    if (kv.length % 2 != 0) throw new IllegalArgumentException("Expected key/value pairs");
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put(String.valueOf(kv[i]), kv[i + 1]);
    return new Row(Collections.unmodifiableMap(m), Map.of());
  }

  public Map<String, Object> values() { return values; }
  public Set<String> columns() { return values.keySet(); }
  public boolean has(String column) { return values.containsKey(column); }
  public Object get(String column) { return values.get(column); }
  public boolean isNull(String column) { return values.get(column) == null; }

  public String getString(String column) {
    Object v = values.get(column);
    return v == null ? null : String.valueOf(v);
  }

  public Integer getInt(String column) { return convert(column, Integer.class); }
  public Long getLong(String column) { return convert(column, Long.class); }
  public Double getDouble(String column) { return convert(column, Double.class); }
  public Boolean getBoolean(String column) { return convert(column, Boolean.class); }
  public UUID getUuid(String column) { return convert(column, UUID.class); }
  public Instant getInstant(String column) { return convert(column, Instant.class); }

  private <T> T convert(String column, Class<T> type) {
    Object v = values.get(column);
    try {
      return Coercions.to(type, v);
    } catch (IllegalArgumentException e) {
      throw SpectroException.invalidData("Column '" + column + "' holds " + v.getClass().getSimpleName()
          + ", not " + type.getSimpleName());
    }
  }

  // ---------- associations ----------

  public Row withAssociation(String name, Object value) {
    Objects.requireNonNull(name, "name");
    Map<String, Object> next = new LinkedHashMap<>(associations);
    next.put(name, value);
    return new Row(values, Collections.unmodifiableMap(next));
  }

  public Map<String, Object> associations() { return associations; }
  public boolean hasAssociation(String name) { return associations.containsKey(name); }

  /** Rows of a has-many association; empty when nothing matched. */
  @SuppressWarnings("unchecked")
  public List<Row> rows(String association) {
    Object v = requireAssociation(association);
    if (v == null) return List.of();
    if (v instanceof List<?> l) return (List<Row>) l;
    throw SpectroException.invalidData("Association '" + association + "' is a single row, not a list");
  }

  /** Row of a has-one or belongs-to association, or null. */
  public Row one(String association) {
    Object v = requireAssociation(association);
    if (v == null || v instanceof Row) return (Row) v;
    throw SpectroException.invalidData("Association '" + association + "' is a list, not a single row");
  }

  private Object requireAssociation(String name) {
    if (!associations.containsKey(name)) {
      throw new IllegalStateException("Association '" + name + "' was not preloaded");
    }
    return associations.get(name);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Row r)) return false;
    return values.equals(r.values) && associations.equals(r.associations);
  }

  @Override
  public int hashCode() { return Objects.hash(values, associations); }

  @Override
  public String toString() {
    return associations.isEmpty() ? "Row" + values : "Row" + values + " +" + associations.keySet();
  }
}
