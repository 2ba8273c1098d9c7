package com.gentoro.usml.visualizer;

import java.util.List;

/** Nodes to emphasise together when a field is focused. */
public record HighlightGroup(String fieldId, List<String> unitIds, List<String> tableIds) {

  public HighlightGroup {
    unitIds = List.copyOf(unitIds);
    tableIds = List.copyOf(tableIds);
  }
}
