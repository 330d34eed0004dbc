package io.spectro.persistence.jdbc.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.spectro.persistence.engine.DefaultValueDecoder;
import io.spectro.persistence.error.SpectroException;
import io.spectro.persistence.exec.ValueDecoder;
import org.postgresql.util.PGobject;

import java.sql.Array;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Decodes driver objects pgjdbc leaves opaque: {@link PGobject} ({@code uuid}, {@code json},
 * {@code jsonb}) and {@link java.sql.Array}. Other values pass through.
 */
public final class PostgresValueDecoder implements ValueDecoder {
  private final ObjectMapper mapper;

  public PostgresValueDecoder(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /** Engine defaults first, then PostgreSQL types. */
  public static ValueDecoder withDefaults(ObjectMapper mapper) {
    return DefaultValueDecoder.INSTANCE.andThen(new PostgresValueDecoder(mapper));
  }

  @Override
  public Object decode(String column, Object raw) {
    if (raw instanceof PGobject pg) return decodeObject(column, pg);
    if (raw instanceof Array arr) return decodeArray(column, arr);
    return raw;
  }

  private Object decodeObject(String column, PGobject pg) {
    String value = pg.getValue();
    if (value == null) return null;
    String type = pg.getType() == null ? "" : pg.getType().toLowerCase(Locale.ROOT);
    switch (type) {
      case "uuid":
        try {
          return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
          throw SpectroException.invalidData("Column '" + column + "' holds a malformed uuid");
        }
      case "json":
      case "jsonb":
        try {
          return mapper.readValue(value, Object.class);
        } catch (JsonProcessingException e) {
          throw SpectroException.invalidData("Column '" + column + "' holds malformed " + type + ": " + e.getOriginalMessage());
        }
      default:
        return value;
    }
  }

  private Object decodeArray(String column, Array arr) {
    try {
      Object raw = arr.getArray();
      if (!(raw instanceof Object[] items)) {
        throw SpectroException.invalidData("Column '" + column + "' holds a primitive array");
      }
      List<Object> out = new ArrayList<>(items.length);
      for (Object o : items) out.add(decode(column, o));
      return out;
    } catch (SQLException e) {
      throw SpectroException.invalidData("Column '" + column + "' array could not be read: " + e.getMessage());
    }
  }
}
