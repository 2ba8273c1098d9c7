package com.gentoro.usml.ast;

import java.util.Locale;
import java.util.Optional;

/** Value of a filter's {@code maps_to}. */
public enum FilterTarget {
  WHERE,
  PAGINATION,
  ORDER_BY;

  public static Optional<FilterTarget> fromName(String name) {
    if (name == null) return Optional.empty();
    try {
      return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
