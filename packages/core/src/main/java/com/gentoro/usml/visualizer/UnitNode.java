package com.gentoro.usml.visualizer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/**
 * The join or transform step between a field and its tables. {@code lines} are display-ready
 * descriptions of the joins; {@code transforms} the types of transforms targeting the field.
 */
public record UnitNode(
    String id, String fieldId, UnitKind kind, List<String> lines, List<String> transforms) {

  public UnitNode {
    lines = List.copyOf(lines);
    transforms = List.copyOf(transforms);
  }

  @JsonIgnore
  public boolean isEmpty() {
    return lines.isEmpty() && transforms.isEmpty();
  }
}
