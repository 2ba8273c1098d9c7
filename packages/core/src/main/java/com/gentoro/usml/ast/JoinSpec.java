package com.gentoro.usml.ast;

import java.util.Objects;

/** Primary join of a mapping. */
public record JoinSpec(String table, String alias, JoinCondition on, JoinType type) {

  public JoinSpec {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(on, "on");
    type = type == null ? JoinType.LEFT : type;
  }

  public boolean hasAlias() {
    return alias != null;
  }

  /** Name under which the joined table is addressed: the alias when declared, else the table. */
  public String bindingName() {
    return alias != null ? alias : table;
  }
}
