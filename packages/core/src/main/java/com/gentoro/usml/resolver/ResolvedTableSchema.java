package com.gentoro.usml.resolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tables imported by a document, in import order, with the foreign keys whose endpoints are both
 * imported. {@code importedColumns} records, per table, the columns named by column-qualified
 * imports; a table imported without a column qualifier has no entry.
 */
public record ResolvedTableSchema(
    Map<String, TableDefinition> tables,
    List<ForeignKey> foreignKeys,
    Map<String, Set<String>> importedColumns) {

  public ResolvedTableSchema {
    tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    foreignKeys = List.copyOf(foreignKeys);
    importedColumns = Collections.unmodifiableMap(new LinkedHashMap<>(importedColumns));
  }

  public static ResolvedTableSchema empty() {
    return new ResolvedTableSchema(Map.of(), List.of(), Map.of());
  }

  public boolean hasTable(String name) {
    return tables.containsKey(name);
  }

  public Optional<TableDefinition> table(String name) {
    return Optional.ofNullable(tables.get(name));
  }

  public boolean hasColumn(String table, String column) {
    TableDefinition definition = tables.get(table);
    return definition != null && definition.hasColumn(column);
  }

  /** Primary-key columns of {@code table}; empty when unknown. */
  public List<String> primaryKey(String table) {
    TableDefinition definition = tables.get(table);
    return definition == null ? List.of() : definition.primaryKey();
  }

  public List<String> tableNames() {
    return List.copyOf(tables.keySet());
  }
}
