package com.gentoro.usml.validator.rules;

import com.gentoro.usml.ast.AggregateSpec;
import com.gentoro.usml.ast.ArrayMapping;
import com.gentoro.usml.ast.ColumnRef;
import com.gentoro.usml.ast.MappingNode;
import com.gentoro.usml.ast.ScalarMapping;
import com.gentoro.usml.resolver.ResolvedTableSchema;
import com.gentoro.usml.validator.AliasScope;
import com.gentoro.usml.validator.Diagnostic;
import com.gentoro.usml.validator.MappingSite;
import com.gentoro.usml.validator.ValidationCheck;
import com.gentoro.usml.validator.ValidationContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregates need a grouping key: an explicit {@code group_by} that resolves, or else the single
 * primary-key column of the root table of the enclosing mapping tree. An aggregate without a join
 * must read and group within the same table.
 */
public final class AggregateGroupByResolvableCheck implements ValidationCheck {
  public static final String RULE = "aggregate-group-by-resolvable";

  @Override
  public String rule() {
    return RULE;
  }

  @Override
  public List<Diagnostic> check(ValidationContext context) {
    ResolvedTableSchema tables = context.tables();
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (MappingSite site : context.scopes().sites()) {
      MappingNode node = site.node();
      if (!node.hasAggregate()) {
        continue;
      }
      AggregateSpec aggregate = node.aggregate();
      AliasScope scope = site.scope();
      String location = site.location() + ".aggregate";
      String groupTable;
      if (aggregate.hasGroupBy()) {
        ColumnRef groupBy = aggregate.groupBy();
        groupTable = scope.physical(groupBy.qualifier());
        if (!tables.hasColumn(groupTable, groupBy.column())) {
          diagnostics.add(
              error(
                  "group_by '" + groupBy + "' of field '" + node.field()
                      + "' does not resolve to an imported column",
                  location + ".group_by"));
          continue;
        }
      } else {
        String root = scope.rootTable();
        if (root == null || !tables.hasTable(root)) {
          diagnostics.add(
              error(
                  "Aggregate on field '" + node.field()
                      + "' has no group_by and the root table of its mapping tree is unknown",
                  location));
          continue;
        }
        List<String> primaryKey = tables.primaryKey(root);
        if (primaryKey.size() != 1) {
          diagnostics.add(
              error(
                  "Aggregate on field '" + node.field() + "' has no group_by and root table '" + root
                      + "' has " + (primaryKey.isEmpty() ? "no" : "a composite") + " primary key",
                  location));
          continue;
        }
        groupTable = root;
      }
      if (!node.hasJoin()) {
        String sourceTable = sourceTable(node, scope);
        if (!sourceTable.equals(groupTable)) {
          diagnostics.add(
              error(
                  "Aggregate on field '" + node.field() + "' has no join, so it must group within '"
                      + sourceTable + "' but groups by table '" + groupTable + "'",
                  location));
        }
      }
    }
    return diagnostics;
  }

  private static String sourceTable(MappingNode node, AliasScope scope) {
    if (node instanceof ScalarMapping scalar) {
      return scope.physical(scalar.source().qualifier());
    }
    return scope.physical(((ArrayMapping) node).sourceTable());
  }
}
