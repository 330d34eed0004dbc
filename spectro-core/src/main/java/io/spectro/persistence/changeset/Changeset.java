package io.spectro.persistence.changeset;

import io.spectro.persistence.schema.EntitySchema;
import io.spectro.persistence.schema.FieldDef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Pending write for one table: the column changes plus any validation errors found so far.
 * <p>
 * Changesets are values; every operation returns a new instance. A changeset with errors is
 * rejected by the repository before any SQL is issued.
 */
public final class Changeset {
  private final String table;
  private final Map<String, Object> changes;
  private final Map<String, String> errors;

  private Changeset(String table, Map<String, Object> changes, Map<String, String> errors) {
    this.table = Objects.requireNonNull(table, "table");
    this.changes = Collections.unmodifiableMap(changes);
    this.errors = Collections.unmodifiableMap(errors);
  }

  public static Changeset of(String table, Map<String, ?> changes) {
    return new Changeset(table, new LinkedHashMap<>(changes), new LinkedHashMap<>());
  }

  public static Changeset empty(String table) {
    return new Changeset(table, new LinkedHashMap<>(), new LinkedHashMap<>());
  }

  /**
   * Keep only declared fields of {@code schema}, keyed by column, and check each value against the
   * field's type. Values that cannot be cast are reported as errors and left out of the changes.
   */
  public static Changeset cast(EntitySchema<?> schema, Map<String, ?> params) {
    Map<String, Object> out = new LinkedHashMap<>();
    Map<String, String> errs = new LinkedHashMap<>();
    for (var e : params.entrySet()) {
      FieldDef f = schema.field(e.getKey()).orElse(null);
      if (f == null) continue;
      try {
        out.put(f.column(), f.type().cast(e.getValue()));
      } catch (IllegalArgumentException ex) {
        errs.put(f.column(), "is invalid: expected " + f.type().name().toLowerCase());
      }
    }
    return new Changeset(schema.table(), out, errs);
  }

  public String table() { return table; }
  public Map<String, Object> changes() { return changes; }
  public Map<String, String> errors() { return errors; }
  public boolean isValid() { return errors.isEmpty(); }
  public boolean isEmpty() { return changes.isEmpty(); }

  public Changeset put(String column, Object value) {
    Map<String, Object> next = new LinkedHashMap<>(changes);
    next.put(Objects.requireNonNull(column, "column"), value);
    return new Changeset(table, next, new LinkedHashMap<>(errors));
  }

  public Changeset remove(String column) {
    if (!changes.containsKey(column)) return this;
    Map<String, Object> next = new LinkedHashMap<>(changes);
    next.remove(column);
    return new Changeset(table, next, new LinkedHashMap<>(errors));
  }

  /** Records an error; a second error on the same field is appended to the first. */
  public Changeset addError(String field, String message) {
    Map<String, String> next = new LinkedHashMap<>(errors);
    next.merge(field, message, (a, b) -> a + "; " + b);
    return new Changeset(table, new LinkedHashMap<>(changes), next);
  }

  /** Each field must be present with a non-null, non-blank value. */
  public Changeset validateRequired(String... fields) {
    Changeset out = this;
    for (String f : fields) {
      Object v = changes.get(f);
      if (v == null || (v instanceof CharSequence cs && cs.toString().isBlank())) {
        out = out.addError(f, "can't be blank");
      }
    }
    return out;
  }

  /** Every required field of {@code schema} except the primary key must be present. */
  public Changeset validateRequired(EntitySchema<?> schema) {
    Changeset out = this;
    for (FieldDef f : schema.fields()) {
      if (f.required() && !f.primaryKey()) out = out.validateRequired(f.column());
    }
    return out;
  }

  public Changeset validateLength(String field, int min, int max) {
    Object v = changes.get(field);
    if (!(v instanceof CharSequence cs)) return this;
    if (cs.length() < min) return addError(field, "should be at least " + min + " character(s)");
    if (cs.length() > max) return addError(field, "should be at most " + max + " character(s)");
    return this;
  }

  public Changeset validateFormat(String field, Pattern pattern) {
    Object v = changes.get(field);
    if (!(v instanceof CharSequence cs)) return this;
    return pattern.matcher(cs).matches() ? this : addError(field, "has invalid format");
  }

  @Override
  public String toString() {
    return "Changeset{" + table + ", changes=" + changes.keySet() + ", errors=" + errors + "}";
  }
}
