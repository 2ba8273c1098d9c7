package com.gentoro.usml.ast;

import java.util.Objects;

/**
 * Aggregation applied to a mapping's source column.
 *
 * <p>{@code type} is null when {@code typeName} is not one of the known {@link AggregateType}s;
 * such aggregates are kept so that they can be reported rather than dropped.
 */
public record AggregateSpec(String typeName, AggregateType type, ColumnRef groupBy) {

  public AggregateSpec {
    Objects.requireNonNull(typeName, "typeName");
  }

  public static AggregateSpec of(String typeName, ColumnRef groupBy) {
    return new AggregateSpec(typeName, AggregateType.fromName(typeName).orElse(null), groupBy);
  }

  public boolean isKnown() {
    return type != null;
  }

  public boolean hasGroupBy() {
    return groupBy != null;
  }
}
