package io.spectro.persistence.error;

import java.util.Map;

/** Raised before any SQL is issued when a changeset carries validation errors. */
public final class InvalidChangesetException extends SpectroException {
  private final String table;
  private final Map<String, String> errors;

  public InvalidChangesetException(String table, Map<String, String> errors) {
    super(ErrorKind.INVALID_CHANGESET, "Invalid changeset for '" + table + "': " + errors);
    this.table = table;
    this.errors = Map.copyOf(errors);
  }

  public String table() { return table; }
  public Map<String, String> errors() { return errors; }
}
