package com.gentoro.usml.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the USML exception hierarchy.
 *
 * <p>Every fatal pipeline failure is an unchecked {@code UsmlException} carrying a {@link
 * UsmlErrorCode} and an optional context map (file, location, reference) that callers may render
 * next to the message. Validation findings are never reported through exceptions.
 */
public class UsmlException extends RuntimeException {
  private final UsmlErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public UsmlException(UsmlErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public UsmlException(UsmlErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public UsmlErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry; null values are ignored. */
  public UsmlException withContext(String key, Object value) {
    if (key != null && value != null) {
      context.put(key, value);
    }
    return this;
  }
}
