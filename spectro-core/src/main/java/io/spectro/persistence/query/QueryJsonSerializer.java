package io.spectro.persistence.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.spectro.persistence.schema.RelationshipInfo;

import java.io.IOException;
import java.util.List;

/** Canonical JSON serializer for {@link Query}. */
public final class QueryJsonSerializer extends JsonSerializer<Query> {
  @Override
  public void serialize(Query q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("table", q.table());

    if (q.navigation() != null) {
      Navigation nav = q.navigation();
      RelationshipInfo rel = nav.relationship();
      g.writeObjectFieldStart("through");
      g.writeFieldName("source");
      serialize(nav.source(), g, serializers);
      g.writeObjectFieldStart("relationship");
      g.writeStringField("name", rel.name());
      g.writeStringField("kind", rel.kind().name());
      g.writeStringField("relatedTable", rel.relatedTable());
      g.writeStringField("localKey", rel.localKey());
      g.writeStringField("foreignKey", rel.foreignKey());
      g.writeEndObject();
      g.writeEndObject();
    }

    if (!q.selectsAll()) {
      g.writeObjectField("select", q.selections());
    }

    if (!q.conditions().isEmpty()) {
      g.writeArrayFieldStart("where");
      for (Condition c : q.conditions()) writeCondition(c, g, serializers);
      g.writeEndArray();
    }

    if (!q.compositeConditions().isEmpty()) {
      g.writeArrayFieldStart("groups");
      for (ConditionGroup group : q.compositeConditions()) {
        g.writeStartObject();
        g.writeArrayFieldStart(group.clause() == Clause.OR ? "or" : "and");
        for (Condition c : group.conditions()) writeCondition(c, g, serializers);
        g.writeEndArray();
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (!q.relationshipConditions().isEmpty()) {
      g.writeArrayFieldStart("related");
      for (RelationshipCondition rc : q.relationshipConditions()) {
        g.writeStartObject();
        g.writeStringField("association", rc.association());
        g.writeFieldName("condition");
        writeCondition(rc.condition(), g, serializers);
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (!q.joins().isEmpty()) {
      g.writeArrayFieldStart("joins");
      for (JoinSpec j : q.joins()) {
        g.writeStartObject();
        g.writeStringField("association", j.association());
        g.writeStringField("kind", j.kind().name());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (!q.orderBy().isEmpty()) {
      g.writeArrayFieldStart("sort");
      for (SortField sf : q.orderBy()) {
        g.writeStartObject();
        g.writeStringField("field", sf.field());
        g.writeStringField("dir", sf.direction().name());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (q.limit() != null) g.writeNumberField("limit", q.limit());
    if (q.offset() != null) g.writeNumberField("offset", q.offset());

    if (!q.preload().isEmpty()) {
      g.writeObjectField("preload", q.preload());
    }

    g.writeEndObject();
  }

  private static void writeCondition(Condition c, JsonGenerator g, SerializerProvider serializers) throws IOException {
    Operator op = Operator.tryParse(c.operator());
    g.writeStartObject();
    if (op == null) {
      // Unknown operators are kept verbatim; compilation rejects them.
      g.writeStringField("operator", c.operator());
      g.writeStringField("field", c.field());
      g.writeFieldName("value");
      serializers.defaultSerializeValue(c.value(), g);
      g.writeEndObject();
      return;
    }

    g.writeObjectFieldStart(op.name().toLowerCase());
    g.writeStringField("field", c.field());
    switch (op) {
      case IS_NULL, IS_NOT_NULL -> { }
      case IN -> {
        g.writeFieldName("values");
        serializers.defaultSerializeValue(c.value(), g);
      }
      case BETWEEN -> {
        List<?> bounds = (c.value() instanceof List<?> l) ? l : null;
        g.writeFieldName("lower");
        serializers.defaultSerializeValue(bounds == null || bounds.isEmpty() ? null : bounds.get(0), g);
        g.writeFieldName("upper");
        serializers.defaultSerializeValue(bounds == null || bounds.size() < 2 ? null : bounds.get(1), g);
      }
      default -> {
        g.writeFieldName("value");
        serializers.defaultSerializeValue(c.value(), g);
      }
    }
    g.writeEndObject();
    g.writeEndObject();
  }
}
