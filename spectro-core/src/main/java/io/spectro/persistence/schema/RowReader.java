package io.spectro.persistence.schema;

import io.spectro.persistence.row.Row;

/** Maps a fetched row to an entity. */
@FunctionalInterface
public interface RowReader<T> {
  T read(Row row);
}
