package io.spectro.persistence.dmlast;

import io.spectro.persistence.query.Condition;

import java.util.List;

public record UpdateAst(
    String table,
    List<ColumnBind> sets,
    List<Condition> where,
    boolean returning
) implements DmlAst {
  public UpdateAst {
    sets = sets == null ? List.of() : List.copyOf(sets);
    where = where == null ? List.of() : List.copyOf(where);
  }
}
