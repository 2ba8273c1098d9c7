package com.gentoro.usml.validator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;

/**
 * One validation finding. {@code location} is the document path of the offending construct, for
 * example {@code response_mapping[2].fields[0]}, or null when the finding has no single site.
 */
@JsonPropertyOrder({"severity", "rule", "message", "location"})
public record Diagnostic(
    Severity severity,
    String rule,
    String message,
    @JsonInclude(JsonInclude.Include.NON_NULL) String location) {

  public Diagnostic {
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(rule, "rule");
    Objects.requireNonNull(message, "message");
  }

  public static Diagnostic error(String rule, String message, String location) {
    return new Diagnostic(Severity.ERROR, rule, message, location);
  }

  public static Diagnostic warning(String rule, String message, String location) {
    return new Diagnostic(Severity.WARNING, rule, message, location);
  }

  @JsonIgnore
  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public String toString() {
    String prefix = severity.label() + "[" + rule + "]";
    return location == null ? prefix + " " + message : prefix + " " + location + ": " + message;
  }
}
