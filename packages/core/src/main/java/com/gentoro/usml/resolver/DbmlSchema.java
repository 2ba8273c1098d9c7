package com.gentoro.usml.resolver;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Everything read from one DBML file: tables in declaration order and all references. */
public record DbmlSchema(Path file, Map<String, TableDefinition> tables, List<ForeignKey> references) {

  public DbmlSchema {
    tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    references = List.copyOf(references);
  }

  /** Look a table up by name or by the alias declared with {@code Table name as alias}. */
  public Optional<TableDefinition> table(String nameOrAlias) {
    TableDefinition table = tables.get(nameOrAlias);
    if (table != null) {
      return Optional.of(table);
    }
    return tables.values().stream().filter(t -> nameOrAlias.equals(t.alias())).findFirst();
  }
}
