package com.gentoro.usml.visualizer;

import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.usml.ast.MappingNode;

/** How a field obtains its value; drives unit styling and edge colour. */
public enum UnitKind {
  SIMPLE("simple"),
  JOIN("join"),
  JOIN_CHAIN("join-chain"),
  AGGREGATE("aggregate");

  private final String label;

  UnitKind(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  /** Aggregate wins over a join chain, which wins over a plain join. */
  public static UnitKind of(MappingNode node) {
    if (node.hasAggregate()) return AGGREGATE;
    if (node.hasJoinChain()) return JOIN_CHAIN;
    if (node.hasJoin()) return JOIN;
    return SIMPLE;
  }
}
