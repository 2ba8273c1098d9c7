package com.gentoro.usml.validator.rules;

import com.gentoro.usml.ast.Transform;
import com.gentoro.usml.validator.Diagnostic;
import com.gentoro.usml.validator.MappingSite;
import com.gentoro.usml.validator.ValidationCheck;
import com.gentoro.usml.validator.ValidationContext;
import java.util.ArrayList;
import java.util.List;

/** Warns about transform and aggregate types this rule set does not know how to check. */
public final class UnknownVariantScan implements ValidationCheck {
  public static final String RULE = "unknown-variant";

  @Override
  public String rule() {
    return RULE;
  }

  @Override
  public List<Diagnostic> check(ValidationContext context) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (MappingSite site : context.scopes().sites()) {
      if (site.node().hasAggregate() && !site.node().aggregate().isKnown()) {
        diagnostics.add(
            Diagnostic.warning(
                RULE,
                "Unknown aggregate type '" + site.node().aggregate().typeName() + "' on field '"
                    + site.node().field() + "'",
                site.location() + ".aggregate.type"));
      }
    }
    List<Transform> transforms = context.document().transforms();
    for (int i = 0; i < transforms.size(); i++) {
      if (transforms.get(i) instanceof Transform.Unknown unknown) {
        diagnostics.add(
            Diagnostic.warning(
                RULE,
                "Unknown transform type '" + unknown.typeName() + "' on target '" + unknown.target()
                    + "'",
                "transforms[" + i + "].type"));
      }
    }
    return diagnostics;
  }
}
