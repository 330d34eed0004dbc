package io.spectro.persistence.schema;

import io.spectro.persistence.error.SpectroException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Simple in-memory {@link SchemaRegistry}, populated once at startup. */
public final class InMemorySchemaRegistry implements SchemaRegistry {
  private final Map<String, EntitySchema<?>> byTable = new LinkedHashMap<>();

  public InMemorySchemaRegistry(List<EntitySchema<?>> schemas) {
    for (EntitySchema<?> s : schemas) {
      if (byTable.putIfAbsent(s.table(), s) != null) {
        throw SpectroException.invalidSchema("Duplicate schema for table '" + s.table() + "'");
      }
    }
  }

  public static InMemorySchemaRegistry of(EntitySchema<?>... schemas) {
    return new InMemorySchemaRegistry(List.of(schemas));
  }

  @Override
  public Optional<EntitySchema<?>> find(String table) {
    return Optional.ofNullable(byTable.get(table));
  }
}
