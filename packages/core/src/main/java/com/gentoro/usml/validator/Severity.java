package com.gentoro.usml.validator;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Severity {
  ERROR,
  WARNING;

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
