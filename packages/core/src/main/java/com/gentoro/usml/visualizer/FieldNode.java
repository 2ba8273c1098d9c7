package com.gentoro.usml.visualizer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.gentoro.usml.ast.MappingKind;
import java.util.List;

/**
 * A response field. {@code path} is the dotted field path from the top level, {@code depth} its
 * nesting level and {@code depthClass} the depth clamped for layout. Array fields own the
 * sub-graph of their element fields.
 */
public record FieldNode(
    String id,
    String field,
    String path,
    int depth,
    int depthClass,
    MappingKind kind,
    List<String> badges,
    String unitId,
    List<String> tableIds,
    @JsonInclude(JsonInclude.Include.NON_NULL) SubGraph children) {

  public FieldNode {
    badges = List.copyOf(badges);
    tableIds = List.copyOf(tableIds);
  }

  @JsonIgnore
  public boolean isArray() {
    return kind == MappingKind.ARRAY;
  }
}
