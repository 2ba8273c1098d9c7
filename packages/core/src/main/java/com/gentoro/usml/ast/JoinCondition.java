package com.gentoro.usml.ast;

import com.gentoro.usml.exception.DocumentParseException;
import java.util.Objects;

/** Binary equality {@code left = right} between two qualified columns. */
public record JoinCondition(ColumnRef left, ColumnRef right) {

  public JoinCondition {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }

  public static JoinCondition parse(String text) {
    if (text == null || text.isBlank()) {
      throw new DocumentParseException("Join condition must not be empty");
    }
    int eq = text.indexOf('=');
    if (eq < 0 || eq != text.lastIndexOf('=')) {
      throw new DocumentParseException(
          "Join condition must be a single equality 'a.x = b.y' but got '" + text + "'");
    }
    return new JoinCondition(
        ColumnRef.parse(text.substring(0, eq)), ColumnRef.parse(text.substring(eq + 1)));
  }

  /** Same pair of columns regardless of side. */
  public boolean sameAs(JoinCondition other) {
    if (other == null) {
      return false;
    }
    return (left.equals(other.left) && right.equals(other.right))
        || (left.equals(other.right) && right.equals(other.left));
  }

  public String format() {
    return left.format() + " = " + right.format();
  }

  @Override
  public String toString() {
    return format();
  }
}
