package io.spectro.persistence.query;

import java.util.Objects;

/** Join through a declared relationship, by association name. */
public record JoinSpec(String association, JoinKind kind) {
  public JoinSpec {
    Objects.requireNonNull(association, "association");
    kind = (kind == null) ? JoinKind.INNER : kind;
  }
}
