package io.spectro.persistence.schema;

import java.util.Objects;

/** One declared entity field and the column that stores it. */
public record FieldDef(String name, String column, FieldType type, boolean required, boolean primaryKey) {
  public FieldDef {
    Objects.requireNonNull(name, "name");
    column = (column == null || column.isBlank()) ? name : column;
    type = (type == null) ? FieldType.STRING : type;
  }

  public static FieldDef of(String name, FieldType type) {
    return new FieldDef(name, name, type, false, false);
  }

  public static FieldDef required(String name, FieldType type) {
    return new FieldDef(name, name, type, true, false);
  }

  public static FieldDef id(String name, FieldType type) {
    return new FieldDef(name, name, type, false, true);
  }
}
