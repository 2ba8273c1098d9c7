package com.gentoro.usml.exception;

/**
 * A referenced API or database-schema artifact is missing, unreadable, or does not contain the
 * path, method, status code, table or column named by a reference expression.
 */
public class ResolutionException extends UsmlException {
  public ResolutionException(String message) {
    super(UsmlErrorCode.RESOLUTION_ERROR, message);
  }

  public ResolutionException(String message, Throwable cause) {
    super(UsmlErrorCode.RESOLUTION_ERROR, message, cause);
  }
}
