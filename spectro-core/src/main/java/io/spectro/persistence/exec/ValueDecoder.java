package io.spectro.persistence.exec;

/** Converts a raw driver value into the scalar stored in a {@link io.spectro.persistence.row.Row}. */
@FunctionalInterface
public interface ValueDecoder {
  Object decode(String column, Object raw);

  /** Decoder that applies {@code this} first and then {@code next}. */
  default ValueDecoder andThen(ValueDecoder next) {
    return (column, raw) -> next.decode(column, decode(column, raw));
  }
}
