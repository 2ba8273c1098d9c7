package com.gentoro.usml.validator.rules;

import com.gentoro.usml.ast.Transform;
import com.gentoro.usml.ast.TransformCondition;
import com.gentoro.usml.validator.Diagnostic;
import com.gentoro.usml.validator.ValidationCheck;
import com.gentoro.usml.validator.ValidationContext;
import java.util.ArrayList;
import java.util.List;

/** Every {@code param} named in a transform condition must be a declared API parameter. */
public final class TransformWhenParamDeclaredCheck implements ValidationCheck {
  public static final String RULE = "transform-when-param-declared";

  @Override
  public String rule() {
    return RULE;
  }

  @Override
  public List<Diagnostic> check(ValidationContext context) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    List<Transform> transforms = context.document().transforms();
    for (int i = 0; i < transforms.size(); i++) {
      List<TransformCondition> conditions = transforms.get(i).conditions();
      for (int j = 0; j < conditions.size(); j++) {
        TransformCondition condition = conditions.get(j);
        if (condition.subject() == TransformCondition.Subject.PARAM
            && !context.api().hasParameter(condition.reference())) {
          diagnostics.add(
              error(
                  "Condition parameter '" + condition.reference() + "' of transform on '"
                      + transforms.get(i).target() + "' is not a declared API parameter",
                  "transforms[" + i + "].condition[" + j + "].param"));
        }
      }
    }
    return diagnostics;
  }
}
