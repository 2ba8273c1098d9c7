package com.gentoro.usml.validator.rules;

import com.gentoro.usml.ast.JoinLink;
import com.gentoro.usml.ast.MappingNode;
import com.gentoro.usml.validator.Diagnostic;
import com.gentoro.usml.validator.MappingSite;
import com.gentoro.usml.validator.ValidationCheck;
import com.gentoro.usml.validator.ValidationContext;
import java.util.ArrayList;
import java.util.List;

/** Tables named by {@code join} and {@code join_chain} must be imported. */
public final class JoinTableImportedCheck implements ValidationCheck {
  public static final String RULE = "join-table-imported";

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
      if (!context.tables().hasTable(node.join().table())) {
        diagnostics.add(
            error(
                "Joined table '" + node.join().table() + "' is not imported",
                site.location() + ".join.table"));
      }
      List<JoinLink> chain = node.joinChain();
      for (int i = 0; i < chain.size(); i++) {
        if (!context.tables().hasTable(chain.get(i).table())) {
          diagnostics.add(
              error(
                  "Joined table '" + chain.get(i).table() + "' is not imported",
                  site.location() + ".join_chain[" + i + "].table"));
        }
      }
    }
    return diagnostics;
  }
}
