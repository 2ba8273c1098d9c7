package com.gentoro.usml.validator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.gentoro.usml.exception.DocumentParseException;
import com.gentoro.usml.exception.ExceptionUtil;
import com.gentoro.usml.exception.UsmlErrorCode;
import com.gentoro.usml.exception.UsmlException;
import com.gentoro.usml.utility.JacksonUtility;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Outcome of validating one file: {@code ok} when no diagnostic has error severity, {@code error}
 * otherwise. Warnings never change the status.
 */
@JsonPropertyOrder({"file", "status", "diagnostics"})
public record ValidationResult(String file, Status status, List<Diagnostic> diagnostics) {

  public enum Status {
    OK,
    ERROR;

    @JsonValue
    public String label() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  public ValidationResult {
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(status, "status");
    diagnostics = List.copyOf(diagnostics);
  }

  public static ValidationResult of(String file, List<Diagnostic> diagnostics) {
    boolean failed = diagnostics.stream().anyMatch(Diagnostic::isError);
    return new ValidationResult(file, failed ? Status.ERROR : Status.OK, diagnostics);
  }

  /**
   * Result for a run that stopped before validation. The failure becomes a single error with rule
   * {@code parse} or {@code resolve}.
   */
  public static ValidationResult failure(String file, Throwable failure) {
    String rule = ExceptionUtil.codeOf(failure) == UsmlErrorCode.PARSE_ERROR ? "parse" : "resolve";
    String location =
        failure instanceof DocumentParseException parse && parse.hasLocation()
            ? parse.getLocation()
            : null;
    String message =
        failure instanceof UsmlException && location != null
            ? stripLocation(failure.getMessage(), location)
            : ExceptionUtil.extractErrorMessage(failure);
    return new ValidationResult(
        file, Status.ERROR, List.of(Diagnostic.error(rule, message, location)));
  }

  @JsonIgnore
  public boolean isOk() {
    return status == Status.OK;
  }

  @JsonIgnore
  public List<Diagnostic> errors() {
    return diagnostics.stream().filter(Diagnostic::isError).toList();
  }

  public long count(String rule) {
    return diagnostics.stream().filter(d -> d.rule().equals(rule)).count();
  }

  public String toJson() {
    try {
      return JacksonUtility.getJsonMapper().writeValueAsString(this);
    } catch (JsonProcessingException e) {
      throw new UsmlException(UsmlErrorCode.UNKNOWN, "Failed to serialise validation result", e);
    }
  }

  private static String stripLocation(String message, String location) {
    String prefix = location + ": ";
    return message.startsWith(prefix) ? message.substring(prefix.length()) : message;
  }
}
