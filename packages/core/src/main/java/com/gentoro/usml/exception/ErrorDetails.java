package com.gentoro.usml.exception;

import java.time.Instant;
import java.util.Map;

/** Structured, log-friendly view of a failure. */
public record ErrorDetails(
    String type, String message, UsmlErrorCode code, Map<String, Object> context, Instant at) {}
