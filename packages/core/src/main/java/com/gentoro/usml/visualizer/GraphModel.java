package com.gentoro.usml.visualizer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rendering-ready data-flow model of one usecase: the field hierarchy, the units between fields
 * and tables, the tables, the derivation edges and per-field highlight groups.
 */
public record GraphModel(
    String usecase,
    @JsonInclude(JsonInclude.Include.NON_NULL) String summary,
    SubGraph root,
    List<TableNode> tables,
    List<GraphEdge> edges,
    List<HighlightGroup> highlights) {

  public GraphModel {
    tables = List.copyOf(tables);
    edges = List.copyOf(edges);
    highlights = List.copyOf(highlights);
  }

  /** All fields, depth first, parents before their element fields. */
  @JsonIgnore
  public List<FieldNode> allFields() {
    List<FieldNode> fields = new ArrayList<>();
    collect(root, fields, null);
    return fields;
  }

  @JsonIgnore
  public List<UnitNode> allUnits() {
    List<UnitNode> units = new ArrayList<>();
    collect(root, null, units);
    return units;
  }

  public Optional<FieldNode> field(String path) {
    return allFields().stream().filter(f -> f.path().equals(path)).findFirst();
  }

  public Optional<UnitNode> unit(String id) {
    return allUnits().stream().filter(u -> u.id().equals(id)).findFirst();
  }

  public Optional<TableNode> table(String id) {
    return tables.stream().filter(t -> t.id().equals(id)).findFirst();
  }

  private static void collect(SubGraph graph, List<FieldNode> fields, List<UnitNode> units) {
    if (units != null) {
      units.addAll(graph.units());
    }
    for (FieldNode field : graph.fields()) {
      if (fields != null) {
        fields.add(field);
      }
      if (field.children() != null) {
        collect(field.children(), fields, units);
      }
    }
  }
}
