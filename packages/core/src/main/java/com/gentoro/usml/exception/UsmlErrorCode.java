package com.gentoro.usml.exception;

/** Stable error categories surfaced by {@link UsmlException}. */
public enum UsmlErrorCode {
  PARSE_ERROR,
  RESOLUTION_ERROR,
  CONFIG_ERROR,
  IO_ERROR,
  UNKNOWN
}
