package com.gentoro.usml.resolver;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One DBML table. {@code primaryKey} lists the key columns in declaration order; it holds more
 * than one name for composite keys and is empty when the table declares none.
 */
public record TableDefinition(
    String name, String alias, List<ColumnDefinition> columns, List<String> primaryKey) {

  public TableDefinition {
    Objects.requireNonNull(name, "name");
    columns = List.copyOf(columns);
    primaryKey = List.copyOf(primaryKey);
  }

  public Optional<ColumnDefinition> column(String columnName) {
    return columns.stream().filter(c -> c.name().equals(columnName)).findFirst();
  }

  public boolean hasColumn(String columnName) {
    return column(columnName).isPresent();
  }

  public List<String> columnNames() {
    return columns.stream().map(ColumnDefinition::name).toList();
  }

  /** The single primary-key column, or empty when the key is composite or undeclared. */
  public Optional<String> singlePrimaryKey() {
    return primaryKey.size() == 1 ? Optional.of(primaryKey.get(0)) : Optional.empty();
  }
}
