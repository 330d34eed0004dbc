package io.spectro.persistence.dmlast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Single or multi-row insert. {@code columns} is the union of the rows' keys; a row without a
 * value for a column is rendered as {@code DEFAULT}.
 */
public record InsertAst(
    String table,
    List<String> columns,
    List<Map<String, Object>> rows,
    boolean returning
) implements DmlAst {
  public InsertAst {
    Objects.requireNonNull(table, "table");
    columns = columns == null ? List.of() : List.copyOf(columns);
    List<Map<String, Object>> copied = new ArrayList<>();
    for (Map<String, Object> r : (rows == null ? List.<Map<String, Object>>of() : rows)) {
      copied.add(Collections.unmodifiableMap(new LinkedHashMap<>(r)));
    }
    rows = List.copyOf(copied);
  }

  public static InsertAst single(String table, List<ColumnBind> values) {
    List<String> cols = new ArrayList<>();
    Map<String, Object> row = new LinkedHashMap<>();
    for (ColumnBind cb : values) {
      cols.add(cb.column());
      row.put(cb.column(), cb.value());
    }
    return new InsertAst(table, cols, List.of(row), true);
  }
}
