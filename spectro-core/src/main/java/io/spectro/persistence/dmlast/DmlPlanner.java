package io.spectro.persistence.dmlast;

import io.spectro.persistence.changeset.Changeset;
import io.spectro.persistence.schema.EntitySchema;

import java.util.List;

/** Maps validated changesets into backend-agnostic DML ASTs. */
public interface DmlPlanner {
  InsertAst planInsert(Changeset changeset);

  /** One multi-row insert per batch of at most {@code batchSize} changesets. */
  List<InsertAst> planInsertAll(String table, List<Changeset> changesets, int batchSize);

  UpdateAst planUpdateById(EntitySchema<?> schema, Object id, Changeset changeset);

  DeleteAst planDeleteById(EntitySchema<?> schema, Object id);

  /**
   * @param set             columns to overwrite on conflict; null means every inserted column except
   *                        the conflict columns and the primary key
   * @param primaryKeyOrNull primary key column of the table, excluded from the derived update list
   */
  UpsertAst planUpsert(Changeset changeset, ConflictTarget target, List<String> set, String primaryKeyOrNull);
}
