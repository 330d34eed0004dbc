package io.spectro.persistence.error;

import java.util.Objects;

/**
 * Base failure of the data-access layer.
 * <p>
 * All failures are unchecked; callers branch on {@link #kind()} instead of on subclasses.
 */
public class SpectroException extends RuntimeException {
  private final ErrorKind kind;

  public SpectroException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public SpectroException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() { return kind; }

  public static SpectroException notFound(String table, Object id) {
    return new SpectroException(ErrorKind.NOT_FOUND, "No row in '" + table + "' with id=" + id);
  }

  public static SpectroException invalidRelationship(String table, String name) {
    return new SpectroException(ErrorKind.INVALID_RELATIONSHIP,
        "Relationship '" + name + "' is not declared on '" + table + "'");
  }

  public static SpectroException invalidSchema(String message) {
    return new SpectroException(ErrorKind.INVALID_SCHEMA, message);
  }

  public static SpectroException invalidQuery(String message) {
    return new SpectroException(ErrorKind.INVALID_QUERY, message);
  }

  public static SpectroException unexpectedResultCount(int expected, int actual) {
    return new SpectroException(ErrorKind.UNEXPECTED_RESULT_COUNT,
        "Expected " + expected + " row(s) but got " + actual);
  }

  public static SpectroException invalidData(String message) {
    return new SpectroException(ErrorKind.INVALID_DATA, message);
  }

  public static SpectroException notImplemented(String feature) {
    return new SpectroException(ErrorKind.NOT_IMPLEMENTED, feature + " is not implemented");
  }
}
