package com.gentoro.usml.validator.rules;

import com.gentoro.usml.ast.ArrayMapping;
import com.gentoro.usml.ast.ColumnRef;
import com.gentoro.usml.ast.ScalarMapping;
import com.gentoro.usml.resolver.ResolvedTableSchema;
import com.gentoro.usml.validator.Diagnostic;
import com.gentoro.usml.validator.MappingSite;
import com.gentoro.usml.validator.ValidationCheck;
import com.gentoro.usml.validator.ValidationContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Every {@code source} column and {@code source_table} must belong to an imported table. When a
 * table was imported column by column, only those columns may be mapped.
 */
public final class TableCoverageCheck implements ValidationCheck {
  public static final String RULE = "table-coverage";

  @Override
  public String rule() {
    return RULE;
  }

  @Override
  public List<Diagnostic> check(ValidationContext context) {
    ResolvedTableSchema tables = context.tables();
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (MappingSite site : context.scopes().sites()) {
      if (site.node() instanceof ScalarMapping scalar) {
        ColumnRef source = scalar.source();
        String table = site.scope().physical(source.qualifier());
        String location = site.location() + ".source";
        if (!tables.hasTable(table)) {
          diagnostics.add(
              error(
                  "Source '" + source + "' refers to table '" + table + "' which is not imported",
                  location));
        } else if (!tables.hasColumn(table, source.column())) {
          diagnostics.add(
              error(
                  "Source '" + source + "': table '" + table + "' has no column '" + source.column() + "'",
                  location));
        } else {
          Set<String> imported = tables.importedColumns().get(table);
          if (imported != null && !imported.contains(source.column())) {
            diagnostics.add(
                error(
                    "Source '"
                        + source
                        + "': column '"
                        + source.column()
                        + "' of table '"
                        + table
                        + "' is not imported",
                    location));
          }
        }
      } else if (site.node() instanceof ArrayMapping array) {
        String table = site.scope().physical(array.sourceTable());
        if (!tables.hasTable(table)) {
          diagnostics.add(
              error(
                  "Source table '" + array.sourceTable() + "' of array '" + array.field() + "' is not imported",
                  site.location() + ".source_table"));
        }
      }
    }
    return diagnostics;
  }
}
