package io.spectro.persistence.jdbc;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites PostgreSQL {@code $n} placeholders into JDBC {@code ?} binds.
 * <p>
 * Rules:
 * <ul>
 *   <li>A placeholder is {@code $} followed by digits, outside quotes, comments and dollar-quoted bodies.</li>
 *   <li>{@code '...'} literals (with {@code ''} escapes), {@code "..."} identifiers, {@code --} and
 *       {@code /* *}{@code /} comments, and {@code $$...$$} / {@code $tag$...$tag$} bodies are copied verbatim.</li>
 *   <li>A bare {@code ?} outside those regions is doubled, so the driver does not read it as a bind.</li>
 * </ul>
 * Purely lexical scanning. The same {@code $n} may appear more than once; each occurrence becomes
 * its own {@code ?} and {@link Rewritten#bind(List)} repeats the value.
 */
public final class DollarParamRewriter {
  private DollarParamRewriter() {}

  /** JDBC SQL plus the 1-based parameter index behind each {@code ?}, in order. */
  public record Rewritten(String sql, List<Integer> order) {
    public Rewritten {
      order = List.copyOf(order);
    }

    /** Parameters in bind order. */
    public List<Object> bind(List<Object> params) {
      List<Object> out = new ArrayList<>(order.size());
      for (int idx : order) {
        if (idx < 1 || idx > params.size()) {
          throw new IllegalArgumentException("Missing query param: $" + idx + " (" + params.size() + " given)");
        }
        out.add(params.get(idx - 1));
      }
      return out;
    }
  }

  public static Rewritten rewrite(String sql) {
    if (sql == null) return new Rewritten("", List.of());
    StringBuilder out = new StringBuilder(sql.length() + 16);
    List<Integer> order = new ArrayList<>();
    int n = sql.length();

    for (int i = 0; i < n; i++) {
      char ch = sql.charAt(i);

      if (ch == '\'' || ch == '"') {
        int end = skipQuoted(sql, i, ch);
        out.append(sql, i, end);
        i = end - 1;
        continue;
      }

      if (ch == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
        int end = sql.indexOf('\n', i);
        end = (end < 0) ? n : end + 1;
        out.append(sql, i, end);
        i = end - 1;
        continue;
      }

      if (ch == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
        int end = sql.indexOf("*/", i + 2);
        end = (end < 0) ? n : end + 2;
        out.append(sql, i, end);
        i = end - 1;
        continue;
      }

      if (ch == '$') {
        if (i + 1 < n && Character.isDigit(sql.charAt(i + 1)) && !isIdentPart(prev(sql, i))) {
          int end = i + 1;
          while (end < n && Character.isDigit(sql.charAt(end))) end++;
          order.add(Integer.parseInt(sql.substring(i + 1, end)));
          out.append('?');
          i = end - 1;
          continue;
        }
        String tag = dollarTag(sql, i);
        if (tag != null && !isIdentPart(prev(sql, i))) {
          int close = sql.indexOf(tag, i + tag.length());
          int end = (close < 0) ? n : close + tag.length();
          out.append(sql, i, end);
          i = end - 1;
          continue;
        }
      }

      if (ch == '?') {
        out.append("??");
        continue;
      }

      out.append(ch);
    }

    return new Rewritten(out.toString(), order);
  }

  /** Index just past the closing quote; doubled quotes are escapes. */
  private static int skipQuoted(String sql, int start, char quote) {
    int i = start + 1;
    while (i < sql.length()) {
      if (sql.charAt(i) == quote) {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    return sql.length();
  }

  /** {@code $$} or {@code $tag$} starting at {@code start}, or null. */
  private static String dollarTag(String sql, int start) {
    int i = start + 1;
    while (i < sql.length() && isIdentPart(sql.charAt(i))) i++;
    if (i < sql.length() && sql.charAt(i) == '$') return sql.substring(start, i + 1);
    return null;
  }

  private static char prev(String sql, int i) {
    return i == 0 ? ' ' : sql.charAt(i - 1);
  }

  private static boolean isIdentPart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_' || (c >= '0' && c <= '9');
  }
}
