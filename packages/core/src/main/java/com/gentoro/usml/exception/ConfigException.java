package com.gentoro.usml.exception;

/** Invalid or unreadable configuration. */
public class ConfigException extends UsmlException {
  public ConfigException(String message) {
    super(UsmlErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(UsmlErrorCode.CONFIG_ERROR, message, cause);
  }
}
