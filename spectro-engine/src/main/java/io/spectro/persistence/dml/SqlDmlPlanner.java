package io.spectro.persistence.dml;

import io.spectro.persistence.changeset.Changeset;
import io.spectro.persistence.dmlast.ColumnBind;
import io.spectro.persistence.dmlast.ConflictTarget;
import io.spectro.persistence.dmlast.DeleteAst;
import io.spectro.persistence.dmlast.DmlPlanner;
import io.spectro.persistence.dmlast.InsertAst;
import io.spectro.persistence.dmlast.UpdateAst;
import io.spectro.persistence.dmlast.UpsertAst;
import io.spectro.persistence.error.InvalidChangesetException;
import io.spectro.persistence.error.SpectroException;
import io.spectro.persistence.query.Condition;
import io.spectro.persistence.query.Operator;
import io.spectro.persistence.schema.EntitySchema;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** SQL-family planner: every statement returns the affected rows ({@code RETURNING *}) except deletes. */
public final class SqlDmlPlanner implements DmlPlanner {
  @Override
  public InsertAst planInsert(Changeset cs) {
    requireValid(cs);
    List<ColumnBind> values = new ArrayList<>();
    for (var e : cs.changes().entrySet()) values.add(new ColumnBind(e.getKey(), e.getValue()));
    return InsertAst.single(cs.table(), values);
  }

  @Override
  public List<InsertAst> planInsertAll(String table, List<Changeset> changesets, int batchSize) {
    Objects.requireNonNull(table, "table");
    if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
    for (Changeset cs : changesets) {
      requireValid(cs);
      requireTable(table, cs);
    }

    List<InsertAst> out = new ArrayList<>();
    for (int from = 0; from < changesets.size(); from += batchSize) {
      List<Changeset> batch = changesets.subList(from, Math.min(from + batchSize, changesets.size()));
      Set<String> columns = new LinkedHashSet<>();
      List<Map<String, Object>> rows = new ArrayList<>(batch.size());
      for (Changeset cs : batch) {
        columns.addAll(cs.changes().keySet());
        rows.add(cs.changes());
      }
      out.add(new InsertAst(table, new ArrayList<>(columns), rows, true));
    }
    return out;
  }

  @Override
  public UpdateAst planUpdateById(EntitySchema<?> schema, Object id, Changeset cs) {
    requireValid(cs);
    requireTable(schema.table(), cs);
    String pk = schema.primaryKeyColumn();
    List<ColumnBind> sets = new ArrayList<>();
    for (var e : cs.changes().entrySet()) {
      if (e.getKey().equals(pk)) continue;
      sets.add(new ColumnBind(e.getKey(), e.getValue()));
    }
    return new UpdateAst(schema.table(), sets, List.of(Condition.of(pk, Operator.EQ, primaryKeyValue(schema, id))), true);
  }

  @Override
  public DeleteAst planDeleteById(EntitySchema<?> schema, Object id) {
    return new DeleteAst(schema.table(), List.of(Condition.of(schema.primaryKeyColumn(), Operator.EQ, primaryKeyValue(schema, id))));
  }

  @Override
  public UpsertAst planUpsert(Changeset cs, ConflictTarget target, List<String> set, String primaryKeyOrNull) {
    requireValid(cs);
    Objects.requireNonNull(target, "target");
    if (cs.isEmpty()) throw SpectroException.invalidSchema("Upsert into '" + cs.table() + "' has no values");

    List<String> updateColumns;
    if (set != null) {
      if (set.isEmpty()) {
        throw SpectroException.invalidSchema("Upsert into '" + cs.table() + "' has an empty update column list");
      }
      updateColumns = List.copyOf(set);
    } else {
      updateColumns = new ArrayList<>();
      for (String c : cs.changes().keySet()) {
        if (target.columns().contains(c)) continue;
        if (c.equals(primaryKeyOrNull)) continue;
        updateColumns.add(c);
      }
    }
    return new UpsertAst(planInsert(cs), target, updateColumns);
  }

  /** Casts {@code id} to the primary key's declared type; {@code INVALID_QUERY} when null or not convertible. */
  public static Object primaryKeyValue(EntitySchema<?> schema, Object id) {
    if (id == null) throw SpectroException.invalidQuery("Primary key value for '" + schema.table() + "' is null");
    try {
      return schema.primaryKey().type().cast(id);
    } catch (IllegalArgumentException e) {
      throw SpectroException.invalidQuery("Primary key value for '" + schema.table() + "' is invalid: " + e.getMessage());
    }
  }

  private static void requireValid(Changeset cs) {
    Objects.requireNonNull(cs, "changeset");
    if (!cs.isValid()) throw new InvalidChangesetException(cs.table(), cs.errors());
  }

  private static void requireTable(String table, Changeset cs) {
    if (!table.equals(cs.table())) {
      throw SpectroException.invalidSchema("Changeset for '" + cs.table() + "' used with table '" + table + "'");
    }
  }
}
