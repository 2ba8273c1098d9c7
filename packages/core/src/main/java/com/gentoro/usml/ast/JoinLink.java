package com.gentoro.usml.ast;

import java.util.Objects;

/**
 * One step of a {@code join_chain}, applied in declared order after the primary join. A link may
 * declare its own alias; it is resolved through the same scope as {@link JoinSpec#alias()}.
 */
public record JoinLink(String table, String alias, JoinCondition on) {

  public JoinLink {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(on, "on");
  }

  public boolean hasAlias() {
    return alias != null;
  }

  public String bindingName() {
    return alias != null ? alias : table;
  }
}
