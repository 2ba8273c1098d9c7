package com.gentoro.usml.exception;

import java.time.Instant;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or result output. If the
   * throwable is a {@link UsmlException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof UsmlException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(), safeMessage(t.getMessage()), UsmlErrorCode.UNKNOWN, null,
        Instant.now());
  }

  /**
   * Extract a user-facing message from a throwable. USML exceptions already carry a complete
   * message; anything else is reported as {@code SimpleName: message}, walking the cause chain
   * until a non-blank message is found.
   *
   * @param t the throwable to extract the message from
   * @return the error message, or a default message if none is available
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    if (t instanceof UsmlException && !safeMessage(t.getMessage()).isBlank()) {
      return t.getMessage();
    }
    Throwable current = t;
    while (current != null) {
      String message = current.getMessage();
      if (message != null && !message.trim().isEmpty()) {
        return current.getClass().getSimpleName() + ": " + message.trim();
      }
      current = current.getCause();
    }
    return t.getClass().getSimpleName();
  }

  /** Error code of the throwable, or {@link UsmlErrorCode#UNKNOWN} for foreign exceptions. */
  public static UsmlErrorCode codeOf(Throwable t) {
    return t instanceof UsmlException ex ? ex.getCode() : UsmlErrorCode.UNKNOWN;
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
