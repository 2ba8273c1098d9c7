package com.gentoro.usml.ast;

import java.util.Objects;

/**
 * Reference into a DBML schema file.
 *
 * <pre>
 * TableRef := Path "#" "tables[" Quoted "]" ["." "columns[" Quoted "]"]
 * </pre>
 */
public record TableReference(String path, String table, String column) {

  public TableReference {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(table, "table");
  }

  public TableReference(String path, String table) {
    this(path, table, null);
  }

  public static TableReference parse(String expression) {
    ReferenceScanner s = new ReferenceScanner(expression, "table reference");
    String file = s.path();
    s.expect("tables[");
    String table = s.quoted();
    s.expect("]");
    String column = null;
    if (!s.atEnd()) {
      s.expect(".columns[");
      column = s.quoted();
      s.expect("]");
    }
    s.expectEnd();
    return new TableReference(file, table, column);
  }

  public boolean hasColumn() {
    return column != null;
  }

  public String format() {
    String base = path + "#tables[" + ReferenceScanner.quote(table) + "]";
    return column == null ? base : base + ".columns[" + ReferenceScanner.quote(column) + "]";
  }

  @Override
  public String toString() {
    return format();
  }
}
