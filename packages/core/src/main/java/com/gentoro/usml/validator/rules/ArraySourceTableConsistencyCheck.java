package com.gentoro.usml.validator.rules;

import com.gentoro.usml.ast.ArrayMapping;
import com.gentoro.usml.validator.Diagnostic;
import com.gentoro.usml.validator.MappingSite;
import com.gentoro.usml.validator.ValidationCheck;
import com.gentoro.usml.validator.ValidationContext;
import java.util.ArrayList;
import java.util.List;

/**
 * An array produced through a join must take its elements from the table at the end of that join:
 * the last {@code join_chain} entry, or the primary join without a chain. Arrays without a join are
 * not constrained.
 */
public final class ArraySourceTableConsistencyCheck implements ValidationCheck {
  public static final String RULE = "array-source-table-consistency";

  @Override
  public String rule() {
    return RULE;
  }

  @Override
  public List<Diagnostic> check(ValidationContext context) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (MappingSite site : context.scopes().sites()) {
      if (!(site.node() instanceof ArrayMapping array) || !array.hasJoin()) {
        continue;
      }
      String sourceTable = array.sourceTable();
      boolean matches =
          sourceTable.equals(array.joinTailBinding())
              || site.scope().physical(sourceTable).equals(array.joinTailTable());
      if (!matches) {
        diagnostics.add(
            error(
                "Array '" + array.field() + "' reads elements from '" + sourceTable
                    + "' but its join ends at '" + array.joinTailTable() + "'",
                site.location() + ".source_table"));
      }
    }
    return diagnostics;
  }
}
