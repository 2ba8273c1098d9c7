package com.gentoro.usml.ast;

import java.util.Objects;

/**
 * Gate of a transform: {@code <subject> <operator> <value>}. All conditions of a transform are
 * ANDed together.
 */
public record TransformCondition(Subject subject, String reference, String operator, String value) {

  /** What the condition reads: a request parameter, a response field, or a database column. */
  public enum Subject {
    PARAM,
    FIELD,
    SOURCE
  }

  public TransformCondition {
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(reference, "reference");
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(value, "value");
  }
}
