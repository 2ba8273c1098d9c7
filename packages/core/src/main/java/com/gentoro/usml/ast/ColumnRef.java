package com.gentoro.usml.ast;

import com.gentoro.usml.exception.DocumentParseException;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Qualified column reference {@code qualifier.column}. The qualifier is either a physical table
 * name or an alias declared by a join; which one is only known once the reference is resolved
 * against an {@code AliasScope}.
 */
public record ColumnRef(String qualifier, String column) {
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  public ColumnRef {
    Objects.requireNonNull(qualifier, "qualifier");
    Objects.requireNonNull(column, "column");
  }

  public static ColumnRef parse(String text) {
    if (text == null) {
      throw new DocumentParseException("Expected a qualified column 'table.column'");
    }
    String trimmed = text.trim();
    int dot = trimmed.indexOf('.');
    if (dot <= 0 || dot != trimmed.lastIndexOf('.')) {
      throw new DocumentParseException(
          "Expected a qualified column 'table.column' but got '" + text + "'");
    }
    String qualifier = trimmed.substring(0, dot);
    String column = trimmed.substring(dot + 1);
    if (!isIdentifier(qualifier) || !isIdentifier(column)) {
      throw new DocumentParseException(
          "Expected a qualified column 'table.column' but got '" + text + "'");
    }
    return new ColumnRef(qualifier, column);
  }

  public static boolean isIdentifier(String text) {
    return text != null && IDENTIFIER.matcher(text).matches();
  }

  public String format() {
    return qualifier + "." + column;
  }

  @Override
  public String toString() {
    return format();
  }
}
