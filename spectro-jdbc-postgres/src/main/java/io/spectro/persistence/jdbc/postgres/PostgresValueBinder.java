package io.spectro.persistence.jdbc.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.postgresql.util.PGobject;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Binds row values onto a {@link PreparedStatement} the way PostgreSQL expects them.
 * <p>
 * {@link Map}, {@link Collection} and {@link JsonNode} values go as {@code jsonb}; object arrays go as
 * native arrays; instants go as {@code timestamptz}.
 */
public final class PostgresValueBinder {
  private final ObjectMapper mapper;

  public PostgresValueBinder(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public PostgresValueBinder() {
    this(new ObjectMapper());
  }

  public void bind(PreparedStatement ps, int pos, Object value) throws SQLException {
    if (value == null) {
      ps.setNull(pos, Types.NULL);
    } else if (value instanceof Map<?, ?> || value instanceof Collection<?> || value instanceof JsonNode) {
      ps.setObject(pos, jsonb(value));
    } else if (value instanceof Instant i) {
      ps.setObject(pos, OffsetDateTime.ofInstant(i, ZoneOffset.UTC));
    } else if (value instanceof UUID u) {
      ps.setObject(pos, u);
    } else if (value instanceof byte[] bytes) {
      ps.setBytes(pos, bytes);
    } else if (value instanceof Enum<?> e) {
      ps.setString(pos, e.name());
    } else if (value instanceof Object[] arr) {
      Array sqlArray = ps.getConnection().createArrayOf(arrayElementType(arr), arr);
      ps.setArray(pos, sqlArray);
    } else {
      ps.setObject(pos, value);
    }
  }

  PGobject jsonb(Object value) throws SQLException {
    String json;
    try {
      json = mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot encode " + value.getClass().getSimpleName() + " as jsonb", e);
    }
    PGobject obj = new PGobject();
    obj.setType("jsonb");
    obj.setValue(json);
    return obj;
  }

  /** Element type name for {@code createArrayOf}, from the first non-null element. */
  static String arrayElementType(Object[] arr) {
    for (Object o : arr) {
      if (o == null) continue;
      if (o instanceof String) return "text";
      if (o instanceof Integer) return "int4";
      if (o instanceof Long) return "int8";
      if (o instanceof Double) return "float8";
      if (o instanceof Boolean) return "bool";
      if (o instanceof UUID) return "uuid";
      throw new IllegalArgumentException("Unsupported array element type: " + o.getClass().getName());
    }
    return "text";
  }
}
