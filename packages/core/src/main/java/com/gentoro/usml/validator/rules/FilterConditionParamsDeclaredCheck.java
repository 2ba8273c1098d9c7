package com.gentoro.usml.validator.rules;

import com.gentoro.usml.ast.Filter;
import com.gentoro.usml.validator.Diagnostic;
import com.gentoro.usml.validator.ValidationCheck;
import com.gentoro.usml.validator.ValidationContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Every {@code :name} placeholder of a WHERE condition must be the param of some filter. */
public final class FilterConditionParamsDeclaredCheck implements ValidationCheck {
  public static final String RULE = "filter-condition-params-declared";

  @Override
  public String rule() {
    return RULE;
  }

  @Override
  public List<Diagnostic> check(ValidationContext context) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    Set<String> declared = context.filterParams();
    List<Filter> filters = context.document().filters();
    for (int i = 0; i < filters.size(); i++) {
      if (!(filters.get(i) instanceof Filter.Where where)) {
        continue;
      }
      for (String placeholder : where.placeholders()) {
        if (!declared.contains(placeholder)) {
          diagnostics.add(
              error(
                  "Placeholder ':" + placeholder + "' in condition '" + where.condition()
                      + "' is not declared by any filter param",
                  "filters[" + i + "].condition"));
        }
      }
    }
    return diagnostics;
  }
}
