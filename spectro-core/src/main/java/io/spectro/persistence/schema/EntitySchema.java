package io.spectro.persistence.schema;

import io.spectro.persistence.error.SpectroException;
import io.spectro.persistence.row.Row;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-entity descriptor table: table name, ordered fields, primary key, relationships,
 * and the reader/accessor pair that converts between rows and entities.
 * <p>
 * Built once at registration time and validated by {@link Builder#build()}.
 */
public final class EntitySchema<T> {
  private final String table;
  private final List<FieldDef> fields;
  private final Map<String, FieldDef> byName;
  private final Map<String, FieldDef> byColumn;
  private final FieldDef primaryKey;
  private final Map<String, RelationshipInfo> relationships;
  private final RowReader<T> reader;
  private final FieldAccessor<T> accessor;

  private EntitySchema(Builder<T> b) {
    this.table = b.table;
    this.fields = List.copyOf(b.fields);
    Map<String, FieldDef> names = new LinkedHashMap<>();
    Map<String, FieldDef> cols = new LinkedHashMap<>();
    FieldDef pk = null;
    for (FieldDef f : fields) {
      if (names.put(f.name(), f) != null) throw SpectroException.invalidSchema("Duplicate field '" + f.name() + "' on '" + table + "'");
      if (cols.put(f.column(), f) != null) throw SpectroException.invalidSchema("Duplicate column '" + f.column() + "' on '" + table + "'");
      if (f.primaryKey()) {
        if (pk != null) throw SpectroException.invalidSchema("Composite primary keys are not supported on '" + table + "'");
        pk = f;
      }
    }
    if (pk == null) throw SpectroException.invalidSchema("No primary key declared on '" + table + "'");
    this.byName = Collections.unmodifiableMap(names);
    this.byColumn = Collections.unmodifiableMap(cols);
    this.primaryKey = pk;
    this.relationships = Collections.unmodifiableMap(new LinkedHashMap<>(b.relationships));
    this.reader = b.reader;
    this.accessor = b.accessor;
  }

  public static <T> Builder<T> builder(String table) {
    return new Builder<>(table);
  }

  public String table() { return table; }
  public List<FieldDef> fields() { return fields; }
  public FieldDef primaryKey() { return primaryKey; }
  public String primaryKeyColumn() { return primaryKey.column(); }
  public Map<String, RelationshipInfo> relationships() { return relationships; }

  public List<String> columns() {
    List<String> out = new ArrayList<>(fields.size());
    for (FieldDef f : fields) out.add(f.column());
    return out;
  }

  /** Field by name or by column. */
  public Optional<FieldDef> field(String nameOrColumn) {
    FieldDef f = byName.get(nameOrColumn);
    if (f == null) f = byColumn.get(nameOrColumn);
    return Optional.ofNullable(f);
  }

  /** Column for a field name; names that are not declared fields are returned unchanged. */
  public String columnFor(String nameOrColumn) {
    FieldDef f = byName.get(nameOrColumn);
    return f == null ? nameOrColumn : f.column();
  }

  public RelationshipInfo relationship(String name) {
    RelationshipInfo r = relationships.get(name);
    if (r == null) throw SpectroException.invalidRelationship(table, name);
    return r;
  }

  public T read(Row row) {
    if (reader == null) throw new IllegalStateException("No RowReader registered for '" + table + "'");
    return reader.read(row);
  }

  /** Entity to row, through the declared fields. Used to preload associations onto entities. */
  public Row toRow(T entity) {
    Objects.requireNonNull(entity, "entity");
    if (entity instanceof Row r) return r;
    if (accessor == null) throw new IllegalStateException("No FieldAccessor registered for '" + table + "'");
    Map<String, Object> out = new LinkedHashMap<>();
    for (FieldDef f : fields) out.put(f.column(), accessor.get(entity, f.name()));
    return Row.of(out);
  }

  @Override
  public String toString() {
    return "EntitySchema{" + table + ", pk=" + primaryKey.column() + ", relationships=" + relationships.keySet() + "}";
  }

  public static final class Builder<T> {
    private final String table;
    private final List<FieldDef> fields = new ArrayList<>();
    private final Map<String, RelationshipInfo> relationships = new LinkedHashMap<>();
    private final Set<String> relationshipNames = new HashSet<>();
    private RowReader<T> reader;
    private FieldAccessor<T> accessor;

    private Builder(String table) {
      this.table = Objects.requireNonNull(table, "table");
    }

    public Builder<T> field(FieldDef field) {
      fields.add(Objects.requireNonNull(field, "field"));
      return this;
    }

    public Builder<T> id(String name, FieldType type) { return field(FieldDef.id(name, type)); }
    public Builder<T> field(String name, FieldType type) { return field(FieldDef.of(name, type)); }
    public Builder<T> required(String name, FieldType type) { return field(FieldDef.required(name, type)); }

    public Builder<T> relationship(RelationshipInfo rel) {
      Objects.requireNonNull(rel, "rel");
      if (!relationshipNames.add(rel.name())) {
        throw SpectroException.invalidSchema("Duplicate relationship '" + rel.name() + "' on '" + table + "'");
      }
      relationships.put(rel.name(), rel);
      return this;
    }

    public Builder<T> reader(RowReader<T> reader) {
      this.reader = reader;
      return this;
    }

    public Builder<T> accessor(FieldAccessor<T> accessor) {
      this.accessor = accessor;
      return this;
    }

    public EntitySchema<T> build() {
      return new EntitySchema<>(this);
    }
  }
}
