package com.gentoro.usml.ast;

import com.gentoro.usml.exception.DocumentParseException;
import java.util.Locale;

public enum JoinType {
  INNER,
  LEFT,
  RIGHT;

  /** Accepts {@code INNER}, {@code left join}, {@code Right JOIN} and so on; null means LEFT. */
  public static JoinType parse(String text) {
    if (text == null || text.isBlank()) {
      return LEFT;
    }
    String normalized = text.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
    if (normalized.endsWith(" JOIN")) {
      normalized = normalized.substring(0, normalized.length() - " JOIN".length()).trim();
    }
    if (normalized.equals("LEFT OUTER")) normalized = "LEFT";
    if (normalized.equals("RIGHT OUTER")) normalized = "RIGHT";
    try {
      return JoinType.valueOf(normalized);
    } catch (IllegalArgumentException e) {
      throw new DocumentParseException(
          "Unsupported join type '" + text + "', expected one of INNER, LEFT, RIGHT");
    }
  }

  public String keyword() {
    return name() + " JOIN";
  }
}
