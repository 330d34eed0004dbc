package io.spectro.persistence.dmlast;

import java.util.List;
import java.util.Objects;

public record UpsertAst(
    InsertAst insert,
    ConflictTarget target,
    List<String> updateColumns
) implements DmlAst {
  public UpsertAst {
    Objects.requireNonNull(insert, "insert");
    Objects.requireNonNull(target, "target");
    updateColumns = updateColumns == null ? List.of() : List.copyOf(updateColumns);
  }

  @Override
  public String table() { return insert.table(); }
}
