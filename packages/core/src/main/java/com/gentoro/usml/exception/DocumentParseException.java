package com.gentoro.usml.exception;

/**
 * A mapping document could not be turned into a {@code UsmlDocument}: unknown key, wrong value
 * type, missing required field or malformed reference expression.
 *
 * <p>The optional location is the dotted path of the offending construct, for example {@code
 * usecase.response_mapping[1].join.on}.
 */
public class DocumentParseException extends UsmlException {
  private final String location;

  public DocumentParseException(String message) {
    this(message, (String) null);
  }

  public DocumentParseException(String message, String location) {
    super(UsmlErrorCode.PARSE_ERROR, format(message, location));
    this.location = location;
    withContext("location", location);
  }

  public DocumentParseException(String message, Throwable cause) {
    super(UsmlErrorCode.PARSE_ERROR, message, cause);
    this.location = null;
  }

  public String getLocation() {
    return location;
  }

  public boolean hasLocation() {
    return location != null && !location.isEmpty();
  }

  private static String format(String message, String location) {
    if (location == null || location.isEmpty()) {
      return message;
    }
    return location + ": " + message;
  }
}
