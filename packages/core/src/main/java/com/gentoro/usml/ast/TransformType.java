package com.gentoro.usml.ast;

import java.util.Locale;
import java.util.Optional;

/** Transform kinds understood by the current rule set. */
public enum TransformType {
  COALESCE,
  CONCAT,
  CASE,
  MASK,
  CONDITIONAL_SOURCE;

  public static Optional<TransformType> fromName(String name) {
    if (name == null) return Optional.empty();
    try {
      return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
