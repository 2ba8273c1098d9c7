package com.gentoro.usml.validator.rules;

import com.gentoro.usml.ast.JoinCondition;
import com.gentoro.usml.ast.JoinLink;
import com.gentoro.usml.ast.MappingNode;
import com.gentoro.usml.validator.Diagnostic;
import com.gentoro.usml.validator.MappingSite;
import com.gentoro.usml.validator.ValidationCheck;
import com.gentoro.usml.validator.ValidationContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A table joined more than once without an alias must always be joined on the same condition. The
 * first unaliased join of a table, in document order, fixes its condition; aliased joins are
 * independent bindings and never conflict.
 */
public final class AliasRequiredOnConflictCheck implements ValidationCheck {
  public static final String RULE = "alias-required-on-conflict";

  @Override
  public String rule() {
    return RULE;
  }

  @Override
  public List<Diagnostic> check(ValidationContext context) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    Map<String, JoinCondition> canonical = new LinkedHashMap<>();
    for (MappingSite site : context.scopes().sites()) {
      MappingNode node = site.node();
      if (!node.hasJoin()) {
        continue;
      }
      if (!node.join().hasAlias()) {
        compare(canonical, node.join().table(), node.join().on(), site.location() + ".join", diagnostics);
      }
      List<JoinLink> chain = node.joinChain();
      for (int i = 0; i < chain.size(); i++) {
        JoinLink link = chain.get(i);
        if (!link.hasAlias()) {
          compare(
              canonical, link.table(), link.on(), site.location() + ".join_chain[" + i + "]", diagnostics);
        }
      }
    }
    return diagnostics;
  }

  private void compare(
      Map<String, JoinCondition> canonical,
      String table,
      JoinCondition on,
      String location,
      List<Diagnostic> diagnostics) {
    JoinCondition first = canonical.putIfAbsent(table, on);
    if (first != null && !first.sameAs(on)) {
      diagnostics.add(
          error(
              "Table '"
                  + table
                  + "' is joined on '"
                  + on
                  + "' but was already joined on '"
                  + first
                  + "'; declare an alias to join it more than once",
              location));
    }
  }
}
