package io.spectro.persistence.schema;

import io.spectro.persistence.mapping.Coercions;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/** Semantic column type, used to validate changeset values before they are bound. */
public enum FieldType {
  STRING(String.class),
  INT(Integer.class),
  LONG(Long.class),
  DOUBLE(Double.class),
  DECIMAL(BigDecimal.class),
  BOOLEAN(Boolean.class),
  UUID(java.util.UUID.class),
  INSTANT(Instant.class),
  DATE(LocalDate.class),
  BYTES(byte[].class),
  JSON(Object.class);

  private final Class<?> javaType;

  FieldType(Class<?> javaType) {
    this.javaType = javaType;
  }

  /**
   * Convert {@code v} to this type's Java representation.
   *
   * @throws IllegalArgumentException when the value cannot be represented
   */
  public Object cast(Object v) {
    if (v == null) return null;
    return switch (this) {
      case BYTES -> {
        if (v instanceof byte[]) yield v;
        throw new IllegalArgumentException("Expected byte[] but got " + v.getClass().getSimpleName());
      }
      case JSON -> {
        if (v instanceof Map<?, ?> || v instanceof List<?> || v instanceof String
            || v instanceof Number || v instanceof Boolean) yield v;
        throw new IllegalArgumentException("Expected JSON-compatible value but got " + v.getClass().getSimpleName());
      }
      case UUID -> Coercions.toUuid(v);
      default -> Coercions.to(javaType, v);
    };
  }
}
