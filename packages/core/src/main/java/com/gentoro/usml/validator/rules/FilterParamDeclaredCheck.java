package com.gentoro.usml.validator.rules;

import com.gentoro.usml.ast.Filter;
import com.gentoro.usml.validator.Diagnostic;
import com.gentoro.usml.validator.ValidationCheck;
import com.gentoro.usml.validator.ValidationContext;
import java.util.ArrayList;
import java.util.List;

/** Filter parameters, and the {@code limit_param} of pagination, must be API parameters. */
public final class FilterParamDeclaredCheck implements ValidationCheck {
  public static final String RULE = "filter-param-declared";

  @Override
  public String rule() {
    return RULE;
  }

  @Override
  public List<Diagnostic> check(ValidationContext context) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    List<Filter> filters = context.document().filters();
    for (int i = 0; i < filters.size(); i++) {
      Filter filter = filters.get(i);
      String location = "filters[" + i + "]";
      if (!context.api().hasParameter(filter.param())) {
        diagnostics.add(
            error(
                "Filter parameter '" + filter.param() + "' is not a declared API parameter",
                location + ".param"));
      }
      if (filter instanceof Filter.Pagination page
          && page.limitParam() != null
          && !context.api().hasParameter(page.limitParam())) {
        diagnostics.add(
            error(
                "Pagination limit parameter '" + page.limitParam() + "' is not a declared API parameter",
                location + ".limit_param"));
      }
    }
    return diagnostics;
  }
}
