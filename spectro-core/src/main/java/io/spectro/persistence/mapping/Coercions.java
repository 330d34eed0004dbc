package io.spectro.persistence.mapping;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/**
 * Lenient conversions between the scalar representations a driver may return and the types callers ask for.
 * Every method throws {@link IllegalArgumentException} when the value cannot be represented.
 */
public final class Coercions {
  private Coercions() {}

  @SuppressWarnings("unchecked")
  public static <T> T to(Class<T> type, Object v) {
    if (v == null) return null;
    if (type.isInstance(v)) return (T) v;
    Object out;
    if (type == Integer.class) out = toInt(v);
    else if (type == Long.class) out = toLong(v);
    else if (type == Double.class) out = toDouble(v);
    else if (type == BigDecimal.class) out = toDecimal(v);
    else if (type == Boolean.class) out = toBoolean(v);
    else if (type == UUID.class) out = toUuid(v);
    else if (type == Instant.class) out = toInstant(v);
    else if (type == LocalDate.class) out = toLocalDate(v);
    else if (type == String.class) out = String.valueOf(v);
    else throw new IllegalArgumentException("No conversion to " + type.getName());
    return (T) out;
  }

  public static Integer toInt(Object v) {
    if (v instanceof Integer i) return i;
    if (v instanceof Number n) {
      long l = n.longValue();
      if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE || n.doubleValue() != l) throw mismatch(v, Integer.class);
      return (int) l;
    }
    if (v instanceof String s) {
      try {
        return Integer.parseInt(s.trim());
      } catch (NumberFormatException e) {
        throw mismatch(v, Integer.class);
      }
    }
    throw mismatch(v, Integer.class);
  }

  public static Long toLong(Object v) {
    if (v instanceof Long l) return l;
    if (v instanceof Number n) {
      if (n.doubleValue() != n.longValue()) throw mismatch(v, Long.class);
      return n.longValue();
    }
    if (v instanceof String s) {
      try {
        return Long.parseLong(s.trim());
      } catch (NumberFormatException e) {
        throw mismatch(v, Long.class);
      }
    }
    throw mismatch(v, Long.class);
  }

  public static Double toDouble(Object v) {
    if (v instanceof Number n) return n.doubleValue();
    if (v instanceof String s) {
      try {
        return Double.parseDouble(s.trim());
      } catch (NumberFormatException e) {
        throw mismatch(v, Double.class);
      }
    }
    throw mismatch(v, Double.class);
  }

  public static BigDecimal toDecimal(Object v) {
    if (v instanceof BigDecimal d) return d;
    if (v instanceof Integer || v instanceof Long) return BigDecimal.valueOf(((Number) v).longValue());
    if (v instanceof Number n) return BigDecimal.valueOf(n.doubleValue());
    if (v instanceof String s) {
      try {
        return new BigDecimal(s.trim());
      } catch (NumberFormatException e) {
        throw mismatch(v, BigDecimal.class);
      }
    }
    throw mismatch(v, BigDecimal.class);
  }

  public static Boolean toBoolean(Object v) {
    if (v instanceof Boolean b) return b;
    if (v instanceof String s) {
      if (s.equalsIgnoreCase("true") || s.equals("t")) return true;
      if (s.equalsIgnoreCase("false") || s.equals("f")) return false;
    }
    throw mismatch(v, Boolean.class);
  }

  public static UUID toUuid(Object v) {
    if (v instanceof UUID u) return u;
    if (v instanceof String s) {
      try {
        return UUID.fromString(s.trim());
      } catch (IllegalArgumentException e) {
        throw mismatch(v, UUID.class);
      }
    }
    throw mismatch(v, UUID.class);
  }

  public static Instant toInstant(Object v) {
    if (v instanceof Instant i) return i;
    if (v instanceof OffsetDateTime odt) return odt.toInstant();
    if (v instanceof String s) {
      try {
        return OffsetDateTime.parse(s.trim()).toInstant();
      } catch (DateTimeParseException e) {
        throw mismatch(v, Instant.class);
      }
    }
    throw mismatch(v, Instant.class);
  }

  public static LocalDate toLocalDate(Object v) {
    if (v instanceof LocalDate d) return d;
    if (v instanceof String s) {
      try {
        return LocalDate.parse(s.trim());
      } catch (DateTimeParseException e) {
        throw mismatch(v, LocalDate.class);
      }
    }
    throw mismatch(v, LocalDate.class);
  }

  private static IllegalArgumentException mismatch(Object v, Class<?> type) {
    return new IllegalArgumentException("Cannot convert " + v.getClass().getSimpleName() + " to " + type.getSimpleName());
  }
}
