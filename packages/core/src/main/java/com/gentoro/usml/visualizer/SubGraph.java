package com.gentoro.usml.visualizer;

import java.util.List;

/** Fields of one mapping level, with the units that feed them. */
public record SubGraph(List<FieldNode> fields, List<UnitNode> units) {

  public SubGraph {
    fields = List.copyOf(fields);
    units = List.copyOf(units);
  }
}
