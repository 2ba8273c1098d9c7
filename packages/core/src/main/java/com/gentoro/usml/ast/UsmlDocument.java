package com.gentoro.usml.ast;

import java.util.List;
import java.util.Objects;

/**
 * Parsed mapping document: one usecase binding the fields of one API response to database
 * columns, joins, aggregates and transforms. Immutable once built by {@code DocumentParser}.
 */
public record UsmlDocument(
    String version,
    ApiReference importApi,
    List<TableReference> importTables,
    String usecaseName,
    String usecaseSummary,
    String outputName,
    List<MappingNode> responseMappings,
    List<Filter> filters,
    List<Transform> transforms) {

  public UsmlDocument {
    Objects.requireNonNull(version, "version");
    Objects.requireNonNull(usecaseName, "usecaseName");
    importTables = importTables == null ? List.of() : List.copyOf(importTables);
    responseMappings = List.copyOf(Objects.requireNonNull(responseMappings, "responseMappings"));
    filters = filters == null ? List.of() : List.copyOf(filters);
    transforms = transforms == null ? List.of() : List.copyOf(transforms);
  }

  /** Table names of {@link #importTables()} in import order, without duplicates. */
  public List<String> importedTableNames() {
    return importTables.stream().map(TableReference::table).distinct().toList();
  }
}
