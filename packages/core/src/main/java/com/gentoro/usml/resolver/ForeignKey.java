package com.gentoro.usml.resolver;

import java.util.Objects;

/**
 * Relationship between two columns as declared by a DBML {@code Ref}. {@code relation} is the
 * DBML operator: {@code >} many-to-one, {@code <} one-to-many, {@code -} one-to-one, {@code <>}
 * many-to-many.
 */
public record ForeignKey(
    String fromTable, String fromColumn, String relation, String toTable, String toColumn) {

  public ForeignKey {
    Objects.requireNonNull(fromTable, "fromTable");
    Objects.requireNonNull(fromColumn, "fromColumn");
    Objects.requireNonNull(relation, "relation");
    Objects.requireNonNull(toTable, "toTable");
    Objects.requireNonNull(toColumn, "toColumn");
  }

  public boolean touches(String table) {
    return fromTable.equals(table) || toTable.equals(table);
  }

  @Override
  public String toString() {
    return fromTable + "." + fromColumn + " " + relation + " " + toTable + "." + toColumn;
  }
}
