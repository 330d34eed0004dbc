package io.spectro.persistence.dmlast;

import io.spectro.persistence.query.Condition;

import java.util.List;

public record DeleteAst(String table, List<Condition> where) implements DmlAst {
  public DeleteAst {
    where = where == null ? List.of() : List.copyOf(where);
  }
}
