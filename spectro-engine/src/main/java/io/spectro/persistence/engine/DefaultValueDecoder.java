package io.spectro.persistence.engine;

import io.spectro.persistence.exec.ValueDecoder;

import java.math.BigInteger;

/**
 * Normalizes JDBC-flavored values into the scalars a {@link io.spectro.persistence.row.Row} holds:
 * timestamps become {@link java.time.Instant}, dates {@link java.time.LocalDate}, small integer
 * types {@link Integer}. Anything else passes through unchanged.
 */
public final class DefaultValueDecoder implements ValueDecoder {
  public static final DefaultValueDecoder INSTANCE = new DefaultValueDecoder();

  private DefaultValueDecoder() {}

  @Override
  public Object decode(String column, Object raw) {
    if (raw == null) return null;
    if (raw instanceof java.sql.Timestamp ts) return ts.toInstant();
    if (raw instanceof java.sql.Date d) return d.toLocalDate();
    if (raw instanceof java.sql.Time t) return t.toLocalTime();
    if (raw instanceof Short s) return s.intValue();
    if (raw instanceof Byte b) return b.intValue();
    if (raw instanceof Float f) return f.doubleValue();
    if (raw instanceof Character c) return String.valueOf(c);
    if (raw instanceof BigInteger bi) return bi.bitLength() < 64 ? (Object) bi.longValue() : bi;
    if (raw instanceof java.time.OffsetDateTime odt) return odt.toInstant();
    return raw;
  }
}
