package com.gentoro.usml.ast;

import java.util.List;
import java.util.Objects;

public record ArrayMapping(
    String field,
    String sourceTable,
    JoinSpec join,
    List<JoinLink> joinChain,
    AggregateSpec aggregate,
    List<MappingNode> children)
    implements MappingNode {

  public ArrayMapping {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(sourceTable, "sourceTable");
    joinChain = joinChain == null ? List.of() : List.copyOf(joinChain);
    children = List.copyOf(Objects.requireNonNull(children, "children"));
  }

  @Override
  public MappingKind kind() {
    return MappingKind.ARRAY;
  }
}
