package com.gentoro.usml.validator.rules;

import com.gentoro.usml.ast.ApiReference;
import com.gentoro.usml.ast.MappingNode;
import com.gentoro.usml.validator.Diagnostic;
import com.gentoro.usml.validator.ValidationCheck;
import com.gentoro.usml.validator.ValidationContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Top-level response fields must exist in the resolved response schema. */
public final class FieldSchemaMatchCheck implements ValidationCheck {
  public static final String RULE = "field-schema-match";

  @Override
  public String rule() {
    return RULE;
  }

  @Override
  public List<Diagnostic> check(ValidationContext context) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    List<MappingNode> mappings = context.document().responseMappings();
    ApiReference api = context.api().reference();
    for (int i = 0; i < mappings.size(); i++) {
      String field = mappings.get(i).field();
      if (!context.api().hasField(field)) {
        diagnostics.add(
            error(
                "Field '"
                    + field
                    + "' is not declared in the "
                    + api.statusCode()
                    + " response of "
                    + api.method().toUpperCase(Locale.ROOT)
                    + " "
                    + api.apiPath(),
                "response_mapping[" + i + "].field"));
      }
    }
    return diagnostics;
  }
}
