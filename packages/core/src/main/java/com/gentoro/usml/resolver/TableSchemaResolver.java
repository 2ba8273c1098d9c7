package com.gentoro.usml.resolver;

import com.gentoro.usml.ast.TableReference;
import com.gentoro.usml.exception.ResolutionException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves table imports against DBML files.
 *
 * <p>Every referenced file is read once per resolver instance. The result keeps only the imported
 * tables, in import order, and the foreign keys whose two endpoints are both imported.
 */
public class TableSchemaResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.usml.logging.LoggingService.getLogger(TableSchemaResolver.class);

  private final DbmlReader reader;
  private final Map<Path, DbmlSchema> cache = new ConcurrentHashMap<>();

  public TableSchemaResolver() {
    this(new DbmlReader());
  }

  public TableSchemaResolver(DbmlReader reader) {
    this.reader = reader;
  }

  /**
   * Resolve {@code references}, each file path taken relative to {@code baseDir}.
   *
   * @throws ResolutionException naming the first file, table or column that cannot be resolved
   */
  public ResolvedTableSchema resolve(Path baseDir, List<TableReference> references) {
    if (references == null || references.isEmpty()) {
      return ResolvedTableSchema.empty();
    }
    Map<String, TableDefinition> tables = new LinkedHashMap<>();
    Map<String, Set<String>> importedColumns = new LinkedHashMap<>();
    Set<String> wholeTables = new LinkedHashSet<>();
    List<DbmlSchema> schemas = new ArrayList<>();

    for (TableReference reference : references) {
      Path file = baseDir.resolve(reference.path()).toAbsolutePath().normalize();
      DbmlSchema schema = load(file);
      if (!schemas.contains(schema)) {
        schemas.add(schema);
      }
      TableDefinition table =
          schema
              .table(reference.table())
              .orElseThrow(
                  () ->
                      (ResolutionException)
                          new ResolutionException(
                                  "Cannot resolve "
                                      + reference.format()
                                      + ": table '"
                                      + reference.table()
                                      + "' is not declared in "
                                      + file)
                              .withContext("reference", reference.format()));
      if (reference.hasColumn() && !table.hasColumn(reference.column())) {
        throw new ResolutionException(
                "Cannot resolve "
                    + reference.format()
                    + ": table '"
                    + table.name()
                    + "' has no column '"
                    + reference.column()
                    + "'")
            .withContext("reference", reference.format());
      }
      TableDefinition existing = tables.putIfAbsent(table.name(), table);
      if (existing != null && existing != table) {
        log.warn(
            "Table '{}' is imported from more than one file; keeping the first definition",
            table.name());
      }
      if (reference.hasColumn()) {
        importedColumns.computeIfAbsent(table.name(), k -> new LinkedHashSet<>()).add(reference.column());
      } else {
        wholeTables.add(table.name());
      }
    }
    wholeTables.forEach(importedColumns::remove);

    Set<ForeignKey> foreignKeys = new LinkedHashSet<>();
    for (DbmlSchema schema : schemas) {
      for (ForeignKey key : schema.references()) {
        if (tables.containsKey(key.fromTable()) && tables.containsKey(key.toTable())) {
          foreignKeys.add(key);
        }
      }
    }
    log.debug(
        "Resolved {} tables and {} foreign keys from {} file(s)",
        tables.size(),
        foreignKeys.size(),
        schemas.size());
    return new ResolvedTableSchema(tables, new ArrayList<>(foreignKeys), importedColumns);
  }

  DbmlSchema load(Path file) {
    DbmlSchema cached = cache.get(file);
    if (cached != null) {
      log.trace("DBML cache hit for {}", file);
      return cached;
    }
    return cache.computeIfAbsent(file, reader::read);
  }
}
