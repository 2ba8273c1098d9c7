package com.gentoro.usml.validator.rules;

import com.gentoro.usml.ast.ColumnRef;
import com.gentoro.usml.ast.JoinCondition;
import com.gentoro.usml.ast.MappingNode;
import com.gentoro.usml.validator.AliasScope;
import com.gentoro.usml.validator.Diagnostic;
import com.gentoro.usml.validator.MappingSite;
import com.gentoro.usml.validator.ValidationCheck;
import com.gentoro.usml.validator.ValidationContext;
import java.util.ArrayList;
import java.util.List;

/** Both sides of every join condition must resolve, through aliases, to an existing column. */
public final class JoinConditionResolvableCheck implements ValidationCheck {
  public static final String RULE = "join-condition-resolvable";

  @Override
  public String rule() {
    return RULE;
  }

  @Override
  public List<Diagnostic> check(ValidationContext context) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (MappingSite site : context.scopes().sites()) {
      MappingNode node = site.node();
      if (!node.hasJoin()) {
        continue;
      }
      verify(context, site.scope(), node.join().on(), site.location() + ".join.on", diagnostics);
      for (int i = 0; i < node.joinChain().size(); i++) {
        verify(
            context,
            site.scope(),
            node.joinChain().get(i).on(),
            site.location() + ".join_chain[" + i + "].on",
            diagnostics);
      }
    }
    return diagnostics;
  }

  private void verify(
      ValidationContext context,
      AliasScope scope,
      JoinCondition condition,
      String location,
      List<Diagnostic> diagnostics) {
    for (ColumnRef side : List.of(condition.left(), condition.right())) {
      String table = scope.physical(side.qualifier());
      if (!context.tables().hasTable(table)) {
        diagnostics.add(
            error(
                "Cannot resolve '" + side + "' in join condition '" + condition + "': table '"
                    + table + "' is not imported",
                location));
      } else if (!context.tables().hasColumn(table, side.column())) {
        diagnostics.add(
            error(
                "Cannot resolve '" + side + "' in join condition '" + condition + "': table '"
                    + table + "' has no column '" + side.column() + "'",
                location));
      }
    }
  }
}
