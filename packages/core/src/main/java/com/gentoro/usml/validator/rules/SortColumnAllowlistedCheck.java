package com.gentoro.usml.validator.rules;

import com.gentoro.usml.ast.Filter;
import com.gentoro.usml.validator.Diagnostic;
import com.gentoro.usml.validator.ValidationCheck;
import com.gentoro.usml.validator.ValidationContext;
import java.util.ArrayList;
import java.util.List;

/** ORDER_BY defaults must be members of their allow-lists when both are given. */
public final class SortColumnAllowlistedCheck implements ValidationCheck {
  public static final String RULE = "sort-column-allowlisted";

  @Override
  public String rule() {
    return RULE;
  }

  @Override
  public List<Diagnostic> check(ValidationContext context) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    List<Filter> filters = context.document().filters();
    for (int i = 0; i < filters.size(); i++) {
      if (!(filters.get(i) instanceof Filter.OrderBy order)) {
        continue;
      }
      String location = "filters[" + i + "]";
      if (order.defaultColumn() != null
          && order.allowedColumns() != null
          && !order.allowedColumns().contains(order.defaultColumn())) {
        diagnostics.add(
            error(
                "default_column '" + order.defaultColumn() + "' is not in allowed_columns "
                    + order.allowedColumns(),
                location + ".default_column"));
      }
      if (order.defaultDirection() != null
          && order.allowedDirections() != null
          && !order.allowedDirections().contains(order.defaultDirection())) {
        diagnostics.add(
            error(
                "default_direction '" + order.defaultDirection() + "' is not in allowed_directions "
                    + order.allowedDirections(),
                location + ".default_direction"));
      }
    }
    return diagnostics;
  }
}
