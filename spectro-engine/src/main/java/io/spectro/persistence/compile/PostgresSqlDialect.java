package io.spectro.persistence.compile;

import io.spectro.persistence.dmlast.ColumnBind;
import io.spectro.persistence.dmlast.ConflictTarget;
import io.spectro.persistence.dmlast.DeleteAst;
import io.spectro.persistence.dmlast.DmlAst;
import io.spectro.persistence.dmlast.InsertAst;
import io.spectro.persistence.dmlast.UpdateAst;
import io.spectro.persistence.dmlast.UpsertAst;
import io.spectro.persistence.error.SpectroException;
import io.spectro.persistence.query.Clause;
import io.spectro.persistence.query.Condition;
import io.spectro.persistence.query.ConditionGroup;
import io.spectro.persistence.query.JoinKind;
import io.spectro.persistence.query.JoinSpec;
import io.spectro.persistence.query.Navigation;
import io.spectro.persistence.query.Operator;
import io.spectro.persistence.query.Query;
import io.spectro.persistence.query.RelationshipCondition;
import io.spectro.persistence.query.SortField;
import io.spectro.persistence.schema.EntitySchema;
import io.spectro.persistence.schema.RelationshipInfo;
import io.spectro.persistence.schema.RelationshipKind;
import io.spectro.persistence.schema.SchemaRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * PostgreSQL rendering: {@code $n} placeholders, {@code RETURNING *}, {@code ON CONFLICT} upserts.
 * <p>
 * Statement shape for selects:
 * <pre>
 * SELECT &lt;columns&gt; FROM t [JOIN ...]
 *   [WHERE &lt;conditions&gt; AND (&lt;group&gt;) AND &lt;related&gt; AND t.key IN (&lt;navigation source&gt;)]
 *   [ORDER BY ...] [LIMIT n] [OFFSET m]
 * </pre>
 * Each clause is built as a {@link SqlFragment}; numbering happens once, on the finished statement.
 * The schema registry is consulted only when a query needs metadata: field-to-column mapping,
 * primary key for explicit selections, and relationships for joins.
 */
public final class PostgresSqlDialect implements SqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  public SqlStatement compileSelect(Query q, SchemaRegistry schemas) {
    Scope scope = Scope.resolve(q, schemas);
    SqlFragment.Builder b = SqlFragment.builder();
    b.append("SELECT ").append(selectList(q, scope)).append(" FROM ").append(scope.table);
    appendJoins(b, scope);
    appendWhere(b, q, scope);
    appendOrderBy(b, q, scope);
    if (q.limit() != null) b.append(" LIMIT " + q.limit());
    if (q.offset() != null) b.append(" OFFSET " + q.offset());
    return b.build().toStatement();
  }

  @Override
  public SqlStatement compileCount(Query q, SchemaRegistry schemas) {
    Scope scope = Scope.resolve(q, schemas);
    SqlFragment.Builder b = SqlFragment.builder();
    if (scope.joins.isEmpty()) {
      b.append("SELECT COUNT(*) FROM ").append(scope.table);
    } else {
      // Joins can repeat owner rows.
      b.append("SELECT COUNT(DISTINCT ")
          .append(Identifiers.qualify(scope.table, scope.schema.primaryKeyColumn()))
          .append(") FROM ").append(scope.table);
    }
    appendJoins(b, scope);
    appendWhere(b, q, scope);
    return b.build().toStatement();
  }

  @Override
  public SqlStatement renderDml(DmlAst dml) {
    if (dml instanceof InsertAst ins) return renderInsert(ins, ins.returning()).toStatement();
    if (dml instanceof UpdateAst upd) return renderUpdate(upd);
    if (dml instanceof DeleteAst del) return renderDelete(del);
    if (dml instanceof UpsertAst ups) return renderUpsert(ups);
    throw new IllegalArgumentException("Unknown DmlAst: " + dml);
  }

  // ---------- select ----------

  private String selectList(Query q, Scope scope) {
    if (q.selectsAll()) {
      if (scope.joins.isEmpty()) return "*";
      List<String> cols = new ArrayList<>();
      for (String c : scope.schema.columns()) cols.add(Identifiers.qualify(scope.table, c));
      return String.join(", ", cols);
    }

    if (scope.schema == null) {
      throw SpectroException.invalidSchema("Selecting explicit fields from '" + scope.table + "' requires a registered schema");
    }
    String pk = scope.schema.primaryKeyColumn();
    String qualifiedPk = Identifiers.qualify(scope.table, pk);
    List<String> cols = new ArrayList<>();
    boolean hasPk = false;
    for (String sel : q.selections()) {
      String col = scope.ownerColumn(sel);
      if (col.equals(pk) || col.equals(qualifiedPk)) hasPk = true;
      cols.add(col);
    }
    if (!hasPk) cols.add(0, scope.joins.isEmpty() ? pk : qualifiedPk);
    return String.join(", ", cols);
  }

  private static void appendJoins(SqlFragment.Builder b, Scope scope) {
    for (ResolvedJoin j : scope.joins.values()) {
      b.append(" ").append(j.kind.sql()).append(" ").append(j.rel.relatedTable());
      if (!j.alias.equals(j.rel.relatedTable())) b.append(" AS ").append(j.alias);
      b.append(" ON ")
          .append(Identifiers.qualify(j.alias, j.rel.relatedKey()))
          .append(" = ")
          .append(Identifiers.qualify(scope.table, j.rel.ownerKey()));
    }
  }

  private void appendWhere(SqlFragment.Builder b, Query q, Scope scope) {
    List<SqlFragment> parts = new ArrayList<>();
    for (Condition c : q.conditions()) {
      parts.add(renderCondition(scope.ownerColumn(c.field()), c));
    }
    for (ConditionGroup g : q.compositeConditions()) {
      List<SqlFragment> inner = new ArrayList<>();
      for (Condition c : g.conditions()) inner.add(renderCondition(scope.ownerColumn(c.field()), c));
      parts.add(SqlFragment.join(g.clause() == Clause.OR ? " OR " : " AND ", inner).parenthesized());
    }
    for (RelationshipCondition rc : q.relationshipConditions()) {
      ResolvedJoin j = scope.joins.get(rc.association());
      parts.add(renderCondition(j.column(rc.condition().field()), rc.condition()));
    }
    if (q.navigation() != null) parts.add(navigationPredicate(q.navigation(), scope));
    SqlFragment where = SqlFragment.join(" AND ", parts);
    if (!where.isEmpty()) b.append(" WHERE ").append(where);
  }

  /** {@code related.key IN (SELECT owner.key FROM owner ... WHERE <source predicates>)} */
  private SqlFragment navigationPredicate(Navigation nav, Scope scope) {
    RelationshipInfo rel = nav.relationship();
    Identifiers.check(rel.ownerKey());
    Identifiers.check(rel.relatedKey());
    Scope source = Scope.resolve(nav.source(), scope.schemas);
    SqlFragment.Builder sub = SqlFragment.builder()
        .append("SELECT ").append(Identifiers.qualify(source.table, rel.ownerKey()))
        .append(" FROM ").append(source.table);
    appendJoins(sub, source);
    appendWhere(sub, nav.source(), source);
    return SqlFragment.builder()
        .append(Identifiers.qualify(scope.table, rel.relatedKey()))
        .append(" IN ")
        .append(sub.build().parenthesized())
        .build();
  }

  private static void appendOrderBy(SqlFragment.Builder b, Query q, Scope scope) {
    if (q.orderBy().isEmpty()) return;
    List<String> items = new ArrayList<>();
    for (SortField sf : q.orderBy()) {
      items.add(scope.ownerColumn(sf.field()) + " " + sf.direction().name());
    }
    b.append(" ORDER BY ").append(String.join(", ", items));
  }

  // ---------- predicates ----------

  SqlFragment renderCondition(String expr, Condition c) {
    Operator op = Operator.fromSymbol(c.operator());
    Object v = c.value();
    return switch (op) {
      case EQ -> (v == null) ? SqlFragment.text(expr + " IS NULL") : binary(expr, "=", v);
      case NE -> (v == null) ? SqlFragment.text(expr + " IS NOT NULL") : binary(expr, "!=", v);
      case GT, GE, LT, LE, LIKE, ILIKE -> {
        if (v == null) throw SpectroException.invalidQuery(op.symbol() + " requires a value for '" + c.field() + "'");
        yield binary(expr, op.symbol(), v);
      }
      case IN -> inList(expr, toValues(c));
      case BETWEEN -> {
        List<Object> bounds = toValues(c);
        if (bounds.size() != 2 || bounds.get(0) == null || bounds.get(1) == null) {
          throw SpectroException.invalidQuery("BETWEEN requires two non-null bounds for '" + c.field() + "'");
        }
        yield SqlFragment.builder()
            .append(expr + " BETWEEN ").param(bounds.get(0))
            .append(" AND ").param(bounds.get(1))
            .build();
      }
      case IS_NULL, IS_NOT_NULL -> SqlFragment.text(expr + " " + op.symbol());
    };
  }

  private static SqlFragment binary(String expr, String op, Object value) {
    return SqlFragment.builder().append(expr + " " + op + " ").param(value).build();
  }

  private static SqlFragment inList(String expr, List<Object> values) {
    if (values.isEmpty()) return SqlFragment.text("FALSE");
    return SqlFragment.builder().append(expr + " IN (").params(values).append(")").build();
  }

  private static List<Object> toValues(Condition c) {
    Object v = c.value();
    if (v instanceof Collection<?> col) return new ArrayList<>(col);
    if (v instanceof Object[] arr) return Arrays.asList(arr);
    throw SpectroException.invalidQuery(c.operator() + " requires a collection for '" + c.field() + "'");
  }

  // ---------- DML ----------

  private SqlFragment renderInsert(InsertAst ins, boolean returning) {
    String table = Identifiers.check(ins.table());
    SqlFragment.Builder b = SqlFragment.builder().append("INSERT INTO ").append(table);
    if (ins.columns().isEmpty()) {
      if (ins.rows().size() != 1) throw SpectroException.invalidQuery("Multi-row insert into '" + table + "' has no columns");
      b.append(" DEFAULT VALUES");
    } else {
      for (String c : ins.columns()) Identifiers.check(c);
      b.append(" (").append(String.join(", ", ins.columns())).append(") VALUES ");
      for (int r = 0; r < ins.rows().size(); r++) {
        Map<String, Object> row = ins.rows().get(r);
        if (r > 0) b.append(", ");
        b.append("(");
        for (int i = 0; i < ins.columns().size(); i++) {
          String col = ins.columns().get(i);
          if (i > 0) b.append(", ");
          if (row.containsKey(col)) b.param(row.get(col));
          else b.append("DEFAULT");
        }
        b.append(")");
      }
    }
    if (returning) b.append(" RETURNING *");
    return b.build();
  }

  private SqlStatement renderUpdate(UpdateAst upd) {
    if (upd.sets().isEmpty()) throw new IllegalArgumentException("Update has no SET columns");
    SqlFragment.Builder b = SqlFragment.builder().append("UPDATE ").append(Identifiers.check(upd.table())).append(" SET ");
    List<SqlFragment> sets = new ArrayList<>();
    for (ColumnBind cb : upd.sets()) {
      sets.add(SqlFragment.builder().append(Identifiers.check(cb.column()) + " = ").param(cb.value()).build());
    }
    b.append(SqlFragment.join(", ", sets));
    appendDmlWhere(b, upd.where());
    if (upd.returning()) b.append(" RETURNING *");
    return b.build().toStatement();
  }

  private SqlStatement renderDelete(DeleteAst del) {
    SqlFragment.Builder b = SqlFragment.builder().append("DELETE FROM ").append(Identifiers.check(del.table()));
    appendDmlWhere(b, del.where());
    return b.build().toStatement();
  }

  private void appendDmlWhere(SqlFragment.Builder b, List<Condition> where) {
    List<SqlFragment> parts = new ArrayList<>();
    for (Condition c : where) parts.add(renderCondition(Identifiers.check(c.field()), c));
    SqlFragment w = SqlFragment.join(" AND ", parts);
    if (!w.isEmpty()) b.append(" WHERE ").append(w);
  }

  private SqlStatement renderUpsert(UpsertAst ups) {
    ConflictTarget target = ups.target();
    SqlFragment.Builder b = SqlFragment.builder().append(renderInsert(ups.insert(), false));
    if (target.isConstraint()) {
      b.append(" ON CONFLICT ON CONSTRAINT ").append(Identifiers.check(target.constraint()));
    } else {
      for (String c : target.columns()) Identifiers.check(c);
      b.append(" ON CONFLICT (").append(String.join(", ", target.columns())).append(")");
    }

    List<String> updateCols = ups.updateColumns();
    if (updateCols.isEmpty()) {
      throw SpectroException.invalidSchema("Upsert into '" + ups.table() + "' has no columns to update");
    }
    List<String> sets = new ArrayList<>();
    for (String c : updateCols) sets.add(Identifiers.check(c) + " = EXCLUDED." + c);
    b.append(" DO UPDATE SET ").append(String.join(", ", sets));

    if (ups.insert().returning()) b.append(" RETURNING *");
    return b.build().toStatement();
  }

  // ---------- scope ----------

  private record ResolvedJoin(String association, JoinKind kind, RelationshipInfo rel, String alias, EntitySchema<?> relatedSchema) {
    String column(String field) {
      Identifiers.check(field);
      if (Identifiers.isQualified(field)) return field;
      String col = (relatedSchema == null) ? field : relatedSchema.columnFor(field);
      return Identifiers.qualify(alias, col);
    }
  }

  private static final class Scope {
    final String table;
    final EntitySchema<?> schema;
    final Map<String, ResolvedJoin> joins = new LinkedHashMap<>();
    private final Set<String> aliases = new HashSet<>();
    final SchemaRegistry schemas;

    private Scope(String table, EntitySchema<?> schema, SchemaRegistry schemas) {
      this.table = table;
      this.schema = schema;
      this.schemas = schemas;
      aliases.add(table);
    }

    static Scope resolve(Query q, SchemaRegistry schemas) {
      String table = Identifiers.check(q.table());
      Scope s = new Scope(table, schemas.find(table).orElse(null), schemas);
      for (JoinSpec js : q.joins()) s.addJoin(js.association(), js.kind());
      // A condition on an association that is not joined explicitly gets an implicit inner join.
      for (RelationshipCondition rc : q.relationshipConditions()) s.addJoin(rc.association(), JoinKind.INNER);
      return s;
    }

    private void addJoin(String association, JoinKind kind) {
      if (joins.containsKey(association)) return;
      if (schema == null) {
        throw SpectroException.invalidSchema("Joining '" + association + "' requires a registered schema for '" + table + "'");
      }
      RelationshipInfo rel = schema.relationship(association);
      if (rel.kind() == RelationshipKind.MANY_TO_MANY) {
        throw SpectroException.notImplemented("Many-to-many join '" + association + "'");
      }
      Identifiers.check(rel.relatedTable());
      Identifiers.check(rel.localKey());
      Identifiers.check(rel.foreignKey());
      String alias = aliases.add(rel.relatedTable()) ? rel.relatedTable() : Identifiers.check(association);
      if (!alias.equals(rel.relatedTable()) && !aliases.add(alias)) {
        throw SpectroException.invalidQuery("Join alias '" + alias + "' is used twice");
      }
      joins.put(association, new ResolvedJoin(association, kind, rel, alias, schemas.find(rel.relatedTable()).orElse(null)));
    }

    /** Column for a field of the queried table, qualified when joins are present. */
    String ownerColumn(String field) {
      Identifiers.check(field);
      if (Identifiers.isQualified(field)) return field;
      String col = (schema == null) ? field : schema.columnFor(field);
      return joins.isEmpty() ? col : Identifiers.qualify(table, col);
    }
  }
}
