package com.gentoro.usml.ast;

import java.util.List;
import java.util.Objects;

public record ScalarMapping(
    String field, ColumnRef source, JoinSpec join, List<JoinLink> joinChain, AggregateSpec aggregate)
    implements MappingNode {

  public ScalarMapping {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(source, "source");
    joinChain = joinChain == null ? List.of() : List.copyOf(joinChain);
  }

  public ScalarMapping(String field, ColumnRef source) {
    this(field, source, null, List.of(), null);
  }

  @Override
  public MappingKind kind() {
    return MappingKind.SCALAR;
  }
}
