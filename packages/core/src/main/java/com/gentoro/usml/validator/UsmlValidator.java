package com.gentoro.usml.validator;

import com.gentoro.usml.ast.UsmlDocument;
import com.gentoro.usml.exception.ExceptionUtil;
import com.gentoro.usml.resolver.ResolvedSchemas;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs every registered {@link ValidationCheck} against a parsed document and its resolved
 * schemas. All checks always run; their diagnostics are concatenated in registration order.
 */
public class UsmlValidator {
  private static final org.slf4j.Logger log =
      com.gentoro.usml.logging.LoggingService.getLogger(UsmlValidator.class);

  private final List<ValidationCheck> checks;

  public UsmlValidator() {
    this(ValidationRules.standard());
  }

  public UsmlValidator(List<ValidationCheck> checks) {
    this.checks = List.copyOf(checks);
  }

  public List<Diagnostic> validate(UsmlDocument document, ResolvedSchemas schemas) {
    return validate(new ValidationContext(document, schemas));
  }

  public List<Diagnostic> validate(ValidationContext context) {
    List<Diagnostic> diagnostics = new ArrayList<>(run(ValidationRules.unknownVariants(), context));
    for (ValidationCheck check : checks) {
      diagnostics.addAll(run(check, context));
    }
    log.debug(
        "Validated usecase '{}': {} diagnostic(s) from {} rule(s)",
        context.document().usecaseName(),
        diagnostics.size(),
        checks.size());
    return diagnostics;
  }

  private static List<Diagnostic> run(ValidationCheck check, ValidationContext context) {
    try {
      List<Diagnostic> found = check.check(context);
      log.trace("Rule {} reported {} diagnostic(s)", check.rule(), found.size());
      return found;
    } catch (RuntimeException e) {
      // a defective rule is reported against itself so the remaining rules still run
      log.error("Rule {} failed", check.rule(), e);
      return List.of(
          Diagnostic.error(
              check.rule(), "Rule failed to run: " + ExceptionUtil.extractErrorMessage(e), null));
    }
  }
}
