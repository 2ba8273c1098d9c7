package com.gentoro.usml.ast;

import com.gentoro.usml.exception.DocumentParseException;

/** Cursor over a reference expression shared by {@link ApiReference} and {@link TableReference}. */
final class ReferenceScanner {
  private final String input;
  private final String kind;
  private int pos;

  ReferenceScanner(String input, String kind) {
    if (input == null || input.isBlank()) {
      throw new DocumentParseException("Malformed " + kind + ": expression is empty");
    }
    this.input = input.trim();
    this.kind = kind;
  }

  /** Everything up to the first {@code #}; must be non-empty. */
  String path() {
    int hash = input.indexOf('#');
    if (hash <= 0) {
      throw error("expected '<path>#...'");
    }
    pos = hash + 1;
    return input.substring(0, hash);
  }

  void expect(String literal) {
    if (!input.startsWith(literal, pos)) {
      throw error("expected '" + literal + "'");
    }
    pos += literal.length();
  }

  /** A double-quoted string; {@code \"} and {@code \\} escapes are honoured. */
  String quoted() {
    if (pos >= input.length() || input.charAt(pos) != '"') {
      throw error("expected a quoted string");
    }
    StringBuilder sb = new StringBuilder();
    pos++;
    while (pos < input.length()) {
      char c = input.charAt(pos++);
      if (c == '\\' && pos < input.length()) {
        sb.append(input.charAt(pos++));
      } else if (c == '"') {
        if (sb.length() == 0) {
          throw error("quoted string must not be empty");
        }
        return sb.toString();
      } else {
        sb.append(c);
      }
    }
    throw error("unterminated quoted string");
  }

  String identifier() {
    int start = pos;
    while (pos < input.length() && Character.isLetter(input.charAt(pos))) {
      pos++;
    }
    if (start == pos) {
      throw error("expected an identifier");
    }
    return input.substring(start, pos);
  }

  boolean atEnd() {
    return pos >= input.length();
  }

  void expectEnd() {
    if (!atEnd()) {
      throw error("unexpected trailing text '" + input.substring(pos) + "'");
    }
  }

  DocumentParseException error(String detail) {
    return new DocumentParseException(
        "Malformed " + kind + " '" + input + "' at offset " + pos + ": " + detail);
  }

  static String quote(String value) {
    return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }
}
