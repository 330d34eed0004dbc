package io.spectro.persistence.compile;

import io.spectro.persistence.error.SpectroException;

import java.util.regex.Pattern;

/** Identifiers are interpolated into SQL unquoted, so only plain names are accepted. */
public final class Identifiers {
  private static final Pattern IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

  private Identifiers() {}

  public static String check(String ident) {
    if (ident == null || !IDENT.matcher(ident).matches()) {
      throw SpectroException.invalidQuery("Invalid identifier '" + ident + "'");
    }
    return ident;
  }

  public static boolean isQualified(String ident) {
    return ident.indexOf('.') >= 0;
  }

  /** Prefixes {@code column} with {@code table} unless it is already qualified. */
  public static String qualify(String table, String column) {
    return isQualified(column) ? column : table + "." + column;
  }
}
