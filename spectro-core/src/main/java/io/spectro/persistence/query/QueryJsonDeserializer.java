package io.spectro.persistence.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.spectro.persistence.schema.RelationshipInfo;
import io.spectro.persistence.schema.RelationshipKind;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/** Canonical JSON deserializer for {@link Query}. */
public final class QueryJsonDeserializer extends JsonDeserializer<Query> {
  @Override
  public Query deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Query JSON must be an object");

    String table = textOrNull(root.get("table"));
    if (table == null) throw new IllegalArgumentException("Query JSON requires 'table'");
    Query q = Query.from(table);

    JsonNode through = root.get("through");
    if (through != null && !through.isNull()) {
      q = parseThrough(through, codec);
      if (!q.table().equals(table)) {
        throw new IllegalArgumentException("Navigation reaches '" + q.table() + "' but table is '" + table + "'");
      }
    }

    JsonNode select = root.get("select");
    if (select != null && select.isArray()) {
      q = q.select(strings(select));
    }

    JsonNode where = root.get("where");
    if (where != null && where.isArray()) {
      for (JsonNode c : where) q = q.where(parseCondition(c, codec));
    }

    JsonNode groups = root.get("groups");
    if (groups != null && groups.isArray()) {
      for (JsonNode gn : groups) {
        if (gn.has("or")) {
          q = q.whereGroup(new ConditionGroup(Clause.OR, parseConditions(gn.get("or"), codec)));
        } else if (gn.has("and")) {
          q = q.whereGroup(new ConditionGroup(Clause.AND, parseConditions(gn.get("and"), codec)));
        } else {
          throw new IllegalArgumentException("Group must be {\"and\":[...]} or {\"or\":[...]}: " + gn);
        }
      }
    }

    JsonNode related = root.get("related");
    if (related != null && related.isArray()) {
      for (JsonNode r : related) {
        String association = textOrNull(r.get("association"));
        if (association == null) throw new IllegalArgumentException("related entry requires association");
        q = q.whereRelated(association, parseCondition(r.get("condition"), codec));
      }
    }

    JsonNode joins = root.get("joins");
    if (joins != null && joins.isArray()) {
      for (JsonNode j : joins) {
        String association = textOrNull(j.get("association"));
        if (association == null) throw new IllegalArgumentException("join entry requires association");
        String kind = textOrNull(j.get("kind"));
        q = q.join(association, kind == null ? JoinKind.INNER : JoinKind.valueOf(kind.toUpperCase()));
      }
    }

    JsonNode sort = root.get("sort");
    if (sort != null && sort.isArray()) {
      for (JsonNode s : sort) {
        if (!s.isObject()) continue;
        String f = textOrNull(s.get("field"));
        String dir = textOrNull(s.get("dir"));
        if (f == null) continue;
        q = q.orderBy(f, SortField.Direction.parse(dir));
      }
    }

    JsonNode limit = root.get("limit");
    if (limit != null && !limit.isNull()) q = q.limit(limit.asInt());
    JsonNode offset = root.get("offset");
    if (offset != null && !offset.isNull()) q = q.offset(offset.asInt());

    JsonNode preload = root.get("preload");
    if (preload != null && preload.isArray()) {
      q = q.preload(strings(preload).toArray(new String[0]));
    }

    return q;
  }

  private static Query parseThrough(JsonNode n, ObjectCodec codec) throws IOException {
    JsonNode source = n.get("source");
    JsonNode rel = n.get("relationship");
    if (source == null || !source.isObject() || rel == null || !rel.isObject()) {
      throw new IllegalArgumentException("through requires source and relationship objects: " + n);
    }
    String kind = textOrNull(rel.get("kind"));
    if (kind == null) throw new IllegalArgumentException("relationship requires kind: " + rel);
    RelationshipInfo info = new RelationshipInfo(
        require(rel, "name"),
        RelationshipKind.valueOf(kind.toUpperCase()),
        require(rel, "relatedTable"),
        require(rel, "localKey"),
        require(rel, "foreignKey"));
    return codec.treeToValue(source, Query.class).through(info);
  }

  private static String require(JsonNode n, String field) {
    String v = textOrNull(n.get(field));
    if (v == null) throw new IllegalArgumentException("relationship requires " + field + ": " + n);
    return v;
  }

  private static List<Condition> parseConditions(JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || !arr.isArray()) return List.of();
    List<Condition> out = new ArrayList<>();
    for (JsonNode x : arr) out.add(parseCondition(x, codec));
    return out;
  }

  private static Condition parseCondition(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || !n.isObject()) throw new IllegalArgumentException("Condition must be an object: " + n);

    // Verbatim form: { "operator": ">=", "field": "age", "value": 18 }
    if (n.has("operator")) {
      String field = textOrNull(n.get("field"));
      if (field == null) throw new IllegalArgumentException("Condition requires field: " + n);
      return new Condition(field, n.get("operator").asText(), decodeValue(n.get("value"), codec));
    }

    // Canonical form: { "ge": { "field": "age", "value": 18 } }
    Iterator<String> it = n.fieldNames();
    while (it.hasNext()) {
      String k = it.next();
      Operator op = Operator.tryParse(k);
      if (op == null) continue;
      JsonNode body = n.get(k);
      if (body == null || !body.isObject()) throw new IllegalArgumentException(k + " must be an object");
      String field = textOrNull(body.get("field"));
      if (field == null) throw new IllegalArgumentException(k + " requires field");
      return switch (op) {
        case IS_NULL, IS_NOT_NULL -> Condition.of(field, op, null);
        case IN -> Condition.of(field, op, decodeValue(body.get("values"), codec));
        case BETWEEN -> Condition.of(field, op, Arrays.asList(
            decodeValue(body.get("lower"), codec), decodeValue(body.get("upper"), codec)));
        default -> Condition.of(field, op, decodeValue(body.get("value"), codec));
      };
    }
    throw new IllegalArgumentException("Unsupported condition: " + n);
  }

  private static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    return codec.treeToValue(v, Object.class);
  }

  private static List<String> strings(JsonNode arr) {
    List<String> out = new ArrayList<>();
    for (JsonNode x : arr) if (x.isTextual()) out.add(x.asText());
    return out;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
