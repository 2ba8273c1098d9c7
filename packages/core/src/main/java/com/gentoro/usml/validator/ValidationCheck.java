package com.gentoro.usml.validator;

import java.util.List;

/**
 * One named consistency rule. Implementations are stateless and must not throw for any parsed
 * document; every violation is returned as a {@link Diagnostic} carrying {@link #rule()}.
 */
public interface ValidationCheck {

  /** Stable rule identifier. */
  String rule();

  List<Diagnostic> check(ValidationContext context);

  default Diagnostic error(String message, String location) {
    return Diagnostic.error(rule(), message, location);
  }
}
