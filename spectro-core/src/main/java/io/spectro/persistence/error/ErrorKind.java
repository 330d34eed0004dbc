package io.spectro.persistence.error;

/** Failure categories surfaced by {@link SpectroException#kind()}. */
public enum ErrorKind {
  /** An expected single row was absent. */
  NOT_FOUND,
  /** An association name does not resolve to a declared relationship. */
  INVALID_RELATIONSHIP,
  /** Structural misconfiguration (missing primary key, empty upsert update list, unknown table). */
  INVALID_SCHEMA,
  /** The query cannot be compiled (unknown operator, malformed identifier, bad operand). */
  INVALID_QUERY,
  /** A write did not return exactly the expected number of rows. */
  UNEXPECTED_RESULT_COUNT,
  /** A pending write failed validation. */
  INVALID_CHANGESET,
  /** A row value could not be read as the requested type. */
  INVALID_DATA,
  /** Known gap (many-to-many preload, nested transactions). */
  NOT_IMPLEMENTED,
  /** Opaque failure from the driver layer. */
  DATABASE_ERROR
}
