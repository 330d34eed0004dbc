package io.spectro.persistence.schema;

import java.util.Optional;

/** Resolves entity descriptors by table name. */
public interface SchemaRegistry {
  Optional<EntitySchema<?>> find(String table);

  /** @throws io.spectro.persistence.error.SpectroException INVALID_SCHEMA when the table is not registered */
  default EntitySchema<?> schemaFor(String table) {
    return find(table).orElseThrow(() ->
        io.spectro.persistence.error.SpectroException.invalidSchema("No schema registered for table '" + table + "'"));
  }
}
