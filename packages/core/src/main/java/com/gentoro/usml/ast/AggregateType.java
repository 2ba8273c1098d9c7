package com.gentoro.usml.ast;

import java.util.Locale;
import java.util.Optional;

public enum AggregateType {
  COUNT,
  SUM,
  AVG,
  MIN,
  MAX;

  public static Optional<AggregateType> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
