package com.gentoro.usml.validator;

import com.gentoro.usml.validator.rules.AggregateGroupByResolvableCheck;
import com.gentoro.usml.validator.rules.AliasRequiredOnConflictCheck;
import com.gentoro.usml.validator.rules.ArraySourceTableConsistencyCheck;
import com.gentoro.usml.validator.rules.FieldSchemaMatchCheck;
import com.gentoro.usml.validator.rules.FilterConditionParamsDeclaredCheck;
import com.gentoro.usml.validator.rules.FilterParamDeclaredCheck;
import com.gentoro.usml.validator.rules.JoinConditionResolvableCheck;
import com.gentoro.usml.validator.rules.JoinTableImportedCheck;
import com.gentoro.usml.validator.rules.SortColumnAllowlistedCheck;
import com.gentoro.usml.validator.rules.TableCoverageCheck;
import com.gentoro.usml.validator.rules.TransformTargetExistsCheck;
import com.gentoro.usml.validator.rules.TransformWhenParamDeclaredCheck;
import com.gentoro.usml.validator.rules.UnknownVariantScan;
import java.util.List;

/** The fixed, ordered rule set. Diagnostics are reported in this order. */
public final class ValidationRules {
  private static final List<ValidationCheck> STANDARD =
      List.of(
          new FieldSchemaMatchCheck(),
          new TableCoverageCheck(),
          new JoinTableImportedCheck(),
          new FilterParamDeclaredCheck(),
          new TransformTargetExistsCheck(),
          new JoinConditionResolvableCheck(),
          new AliasRequiredOnConflictCheck(),
          new AggregateGroupByResolvableCheck(),
          new FilterConditionParamsDeclaredCheck(),
          new TransformWhenParamDeclaredCheck(),
          new ArraySourceTableConsistencyCheck(),
          new SortColumnAllowlistedCheck());

  private ValidationRules() {}

  public static List<ValidationCheck> standard() {
    return STANDARD;
  }

  /** Rule ids of {@link #standard()} in order. */
  public static List<String> ruleIds() {
    return STANDARD.stream().map(ValidationCheck::rule).toList();
  }

  /** Reported before the standard rules; not one of them. */
  static ValidationCheck unknownVariants() {
    return new UnknownVariantScan();
  }
}
