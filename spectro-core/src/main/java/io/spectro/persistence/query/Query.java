package io.spectro.persistence.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.spectro.persistence.error.SpectroException;
import io.spectro.persistence.schema.EntitySchema;
import io.spectro.persistence.schema.RelationshipInfo;
import io.spectro.persistence.schema.RelationshipKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable query specification.
 * <p>
 * Every builder method returns a new instance; the receiver is never modified, so a partially
 * built query can be shared and extended independently:
 * <pre>{@code
 * Query adults = Query.from("users").where(Field.of("age").greaterThanOrEqual(18));
 * Query page = adults.orderBy("name", SortField.Direction.ASC).limit(10);
 * }</pre>
 */
@JsonSerialize(using = QueryJsonSerializer.class)
@JsonDeserialize(using = QueryJsonDeserializer.class)
public final class Query {
  public static final String ALL = "*";

  private final String table;
  private final List<String> selections;
  private final List<Condition> conditions;
  private final List<ConditionGroup> compositeConditions;
  private final List<RelationshipCondition> relationshipConditions;
  private final List<JoinSpec> joins;
  private final List<SortField> orderBy;
  private final Integer limit;
  private final Integer offset;
  private final List<String> preload;
  private final Navigation navigation;

  private Query(String table,
                List<String> selections,
                List<Condition> conditions,
                List<ConditionGroup> compositeConditions,
                List<RelationshipCondition> relationshipConditions,
                List<JoinSpec> joins,
                List<SortField> orderBy,
                Integer limit,
                Integer offset,
                List<String> preload,
                Navigation navigation) {
    this.table = Objects.requireNonNull(table, "table");
    this.selections = (selections == null || selections.isEmpty()) ? List.of(ALL) : List.copyOf(selections);
    this.conditions = List.copyOf(conditions);
    this.compositeConditions = List.copyOf(compositeConditions);
    this.relationshipConditions = List.copyOf(relationshipConditions);
    this.joins = List.copyOf(joins);
    this.orderBy = List.copyOf(orderBy);
    this.limit = limit;
    this.offset = offset;
    this.preload = List.copyOf(preload);
    this.navigation = navigation;
  }

  public static Query from(String table) {
    return new Query(table, List.of(ALL), List.of(), List.of(), List.of(), List.of(), List.of(), null, null, List.of(), null);
  }

  public String table() { return table; }
  public List<String> selections() { return selections; }
  public List<Condition> conditions() { return conditions; }
  public List<ConditionGroup> compositeConditions() { return compositeConditions; }
  public List<RelationshipCondition> relationshipConditions() { return relationshipConditions; }
  public List<JoinSpec> joins() { return joins; }
  public List<SortField> orderBy() { return orderBy; }
  public Integer limit() { return limit; }
  public Integer offset() { return offset; }
  public List<String> preload() { return preload; }

  /** The query this one was navigated from, or {@code null}. */
  public Navigation navigation() { return navigation; }

  /** True when the selection is the implicit {@code *}. */
  public boolean selectsAll() {
    return selections.size() == 1 && ALL.equals(selections.get(0));
  }

  public Query where(Condition condition) {
    Objects.requireNonNull(condition, "condition");
    return new Query(table, selections, append(conditions, condition), compositeConditions,
        relationshipConditions, joins, orderBy, limit, offset, preload, navigation);
  }

  /** Adds a group of conditions joined with AND, compiled as one parenthesized fragment. */
  public Query whereGroup(List<Condition> group) {
    return whereGroup(ConditionGroup.and(group));
  }

  /** Adds a group of conditions joined with OR. */
  public Query whereAny(List<Condition> group) {
    return whereGroup(ConditionGroup.or(group));
  }

  public Query whereGroup(ConditionGroup group) {
    Objects.requireNonNull(group, "group");
    return new Query(table, selections, conditions, append(compositeConditions, group),
        relationshipConditions, joins, orderBy, limit, offset, preload, navigation);
  }

  public Query whereRelated(String association, Condition condition) {
    RelationshipCondition rc = new RelationshipCondition(association, condition);
    return new Query(table, selections, conditions, compositeConditions,
        append(relationshipConditions, rc), joins, orderBy, limit, offset, preload, navigation);
  }

  public Query join(String association, JoinKind kind) {
    JoinSpec js = new JoinSpec(association, kind);
    return new Query(table, selections, conditions, compositeConditions,
        relationshipConditions, append(joins, js), orderBy, limit, offset, preload, navigation);
  }

  public Query join(String association) {
    return join(association, JoinKind.INNER);
  }

  public Query orderBy(String field, SortField.Direction direction) {
    return orderBy(new SortField(field, direction));
  }

  public Query orderBy(SortField sort) {
    Objects.requireNonNull(sort, "sort");
    return new Query(table, selections, conditions, compositeConditions,
        relationshipConditions, joins, append(orderBy, sort), limit, offset, preload, navigation);
  }

  public Query limit(int n) {
    if (n < 0) throw new IllegalArgumentException("limit must be >= 0: " + n);
    return new Query(table, selections, conditions, compositeConditions,
        relationshipConditions, joins, orderBy, n, offset, preload, navigation);
  }

  public Query offset(int n) {
    if (n < 0) throw new IllegalArgumentException("offset must be >= 0: " + n);
    return new Query(table, selections, conditions, compositeConditions,
        relationshipConditions, joins, orderBy, limit, n, preload, navigation);
  }

  /** Replaces the selection list. An empty list restores {@code *}. */
  public Query select(List<String> fields) {
    return new Query(table, fields, conditions, compositeConditions,
        relationshipConditions, joins, orderBy, limit, offset, preload, navigation);
  }

  public Query select(String... fields) {
    return select(Arrays.asList(fields));
  }

  public Query preload(String... names) {
    List<String> next = new ArrayList<>(preload);
    for (String n : names) next.add(Objects.requireNonNull(n, "name"));
    return new Query(table, selections, conditions, compositeConditions,
        relationshipConditions, joins, orderBy, limit, offset, next, navigation);
  }

  /** Same query without preload directives. */
  public Query withoutPreload() {
    if (preload.isEmpty()) return this;
    return new Query(table, selections, conditions, compositeConditions,
        relationshipConditions, joins, orderBy, limit, offset, List.of(), navigation);
  }

  /**
   * Re-roots this query on the table reached through {@code association}. The result selects the
   * related rows of every row this query matches:
   * <pre>{@code
   * Query posts = Query.from("users").where(Field.of("age").greaterThanOrEqual(18)).through(USERS, "posts");
   * }</pre>
   * Filters, joins and related conditions stay on the source side; limit and offset move to the
   * new query. Ordering and preload directives are dropped.
   *
   * @throws SpectroException INVALID_SCHEMA if {@code owner} does not describe this query's table,
   *     INVALID_RELATIONSHIP if the association is unknown, NOT_IMPLEMENTED for many-to-many
   */
  public Query through(EntitySchema<?> owner, String association) {
    Objects.requireNonNull(owner, "owner");
    Objects.requireNonNull(association, "association");
    if (!owner.table().equals(table)) {
      throw SpectroException.invalidSchema("Schema for '" + owner.table() + "' cannot navigate a query on '" + table + "'");
    }
    return through(owner.relationship(association));
  }

  Query through(RelationshipInfo relationship) {
    if (relationship.kind() == RelationshipKind.MANY_TO_MANY) {
      throw SpectroException.notImplemented("Navigating many-to-many association '" + table + "." + relationship.name() + "'");
    }
    Query source = new Query(table, List.of(ALL), conditions, compositeConditions,
        relationshipConditions, joins, List.of(), null, null, List.of(), navigation);
    return new Query(relationship.relatedTable(), List.of(ALL), List.of(), List.of(), List.of(), List.of(), List.of(),
        limit, offset, List.of(), new Navigation(source, relationship));
  }

  private static <T> List<T> append(List<T> base, T item) {
    List<T> out = new ArrayList<>(base.size() + 1);
    out.addAll(base);
    out.add(item);
    return out;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Query q)) return false;
    return table.equals(q.table)
        && selections.equals(q.selections)
        && conditions.equals(q.conditions)
        && compositeConditions.equals(q.compositeConditions)
        && relationshipConditions.equals(q.relationshipConditions)
        && joins.equals(q.joins)
        && orderBy.equals(q.orderBy)
        && Objects.equals(limit, q.limit)
        && Objects.equals(offset, q.offset)
        && preload.equals(q.preload)
        && Objects.equals(navigation, q.navigation);
  }

  @Override
  public int hashCode() {
    return Objects.hash(table, selections, conditions, compositeConditions, relationshipConditions,
        joins, orderBy, limit, offset, preload, navigation);
  }

  @Override
  public String toString() {
    return "Query{table=" + table + ", selections=" + selections + ", conditions=" + conditions.size()
        + ", groups=" + compositeConditions.size() + ", related=" + relationshipConditions.size()
        + ", joins=" + joins.size() + ", limit=" + limit + ", offset=" + offset + ", preload=" + preload
        + (navigation == null ? "" : ", through=" + navigation.source().table() + "." + navigation.relationship().name()) + "}";
  }
}
