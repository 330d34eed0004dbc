package io.spectro.persistence.query;

import io.spectro.persistence.schema.RelationshipInfo;

import java.util.Objects;

/** Link from a navigated query back to the query whose rows it follows. */
public record Navigation(Query source, RelationshipInfo relationship) {
  public Navigation {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(relationship, "relationship");
  }
}
