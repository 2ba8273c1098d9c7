package com.gentoro.usml.resolver;

import java.util.Objects;

public record ColumnDefinition(
    String name, String type, boolean primaryKey, boolean notNull, boolean unique) {

  public ColumnDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }
}
