package com.gentoro.usml.ast;

import java.util.List;
import java.util.Objects;

/**
 * Value transform applied to a response field.
 *
 * <p>Known kinds are closed variants. {@link Unknown} keeps any other {@code type} so that it can be
 * reported as an unknown variant instead of being silently ignored.
 */
public sealed interface Transform
    permits Transform.Coalesce,
        Transform.Concat,
        Transform.Case,
        Transform.Mask,
        Transform.ConditionalSource,
        Transform.Unknown {

  String target();

  /** Type as written in the document. */
  String typeName();

  List<TransformCondition> conditions();

  record Coalesce(
      String target, List<String> sources, String fallback, List<TransformCondition> conditions)
      implements Transform {
    public Coalesce {
      Objects.requireNonNull(target, "target");
      sources = List.copyOf(sources);
      conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    @Override
    public String typeName() {
      return TransformType.COALESCE.name();
    }
  }

  record Concat(
      String target, List<String> sources, String separator, List<TransformCondition> conditions)
      implements Transform {
    public Concat {
      Objects.requireNonNull(target, "target");
      sources = List.copyOf(sources);
      conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    @Override
    public String typeName() {
      return TransformType.CONCAT.name();
    }
  }

  record Case(
      String target,
      String source,
      List<CaseBranch> branches,
      String elseValue,
      List<TransformCondition> conditions)
      implements Transform {
    public Case {
      Objects.requireNonNull(target, "target");
      branches = List.copyOf(branches);
      conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    @Override
    public String typeName() {
      return TransformType.CASE.name();
    }
  }

  record Mask(String target, String source, String maskPattern, List<TransformCondition> conditions)
      implements Transform {
    public Mask {
      Objects.requireNonNull(target, "target");
      Objects.requireNonNull(maskPattern, "maskPattern");
      conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    @Override
    public String typeName() {
      return TransformType.MASK.name();
    }
  }

  record ConditionalSource(
      String target, String thenSource, String elseSource, List<TransformCondition> conditions)
      implements Transform {
    public ConditionalSource {
      Objects.requireNonNull(target, "target");
      Objects.requireNonNull(thenSource, "thenSource");
      conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    @Override
    public String typeName() {
      return TransformType.CONDITIONAL_SOURCE.name();
    }
  }

  /** Any type name outside {@link TransformType}; the raw payload is not interpreted. */
  record Unknown(String target, String typeName, List<TransformCondition> conditions)
      implements Transform {
    public Unknown {
      Objects.requireNonNull(target, "target");
      Objects.requireNonNull(typeName, "typeName");
      conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }
  }

  /** {@code CASE} branch: when the source equals {@code value}, emit {@code then}. */
  record CaseBranch(String value, String then) {
    public CaseBranch {
      Objects.requireNonNull(value, "value");
      Objects.requireNonNull(then, "then");
    }
  }
}
