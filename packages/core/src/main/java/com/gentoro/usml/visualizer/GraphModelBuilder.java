package com.gentoro.usml.visualizer;

import com.gentoro.usml.ast.ArrayMapping;
import com.gentoro.usml.ast.JoinLink;
import com.gentoro.usml.ast.JoinSpec;
import com.gentoro.usml.ast.MappingNode;
import com.gentoro.usml.ast.ScalarMapping;
import com.gentoro.usml.ast.Transform;
import com.gentoro.usml.ast.UsmlDocument;
import com.gentoro.usml.config.UsmlSettings;
import com.gentoro.usml.resolver.ResolvedSchemas;
import com.gentoro.usml.validator.AliasScope;
import com.gentoro.usml.validator.AliasScopes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the {@link GraphModel} of a document. The document is taken as already validated:
 * references are resolved through the same {@link AliasScopes} as the validator uses, and
 * nothing is checked again. No I/O happens here.
 */
public class GraphModelBuilder {
  private static final org.slf4j.Logger log =
      com.gentoro.usml.logging.LoggingService.getLogger(GraphModelBuilder.class);

  private final int maxDepthClass;

  public GraphModelBuilder() {
    this(UsmlSettings.defaults());
  }

  public GraphModelBuilder(UsmlSettings settings) {
    this(settings.maxDepthClass());
  }

  public GraphModelBuilder(int maxDepthClass) {
    this.maxDepthClass = Math.max(0, maxDepthClass);
  }

  public GraphModel build(UsmlDocument document, ResolvedSchemas schemas) {
    return build(document, schemas, AliasScopes.build(document));
  }

  public GraphModel build(UsmlDocument document, ResolvedSchemas schemas, AliasScopes scopes) {
    Assembly assembly = new Assembly(document, schemas, scopes);
    SubGraph root = assembly.level(document.responseMappings(), null, 0);
    List<TableNode> tables =
        assembly.tables.values().stream()
            .map(t -> t.withReferenceCount(assembly.references.getOrDefault(t.id(), 0)))
            .toList();
    GraphModel model =
        new GraphModel(
            document.usecaseName(),
            document.usecaseSummary(),
            root,
            tables,
            assembly.edges,
            assembly.highlights);
    log.debug(
        "Built graph for '{}': {} fields, {} tables, {} edges",
        document.usecaseName(),
        model.allFields().size(),
        tables.size(),
        model.edges().size());
    return model;
  }

  static String fieldId(String path) {
    return "field:" + path;
  }

  static String unitId(String path) {
    return "unit:" + path;
  }

  static String tableId(String binding) {
    return "table:" + binding;
  }

  /** Mutable state of one build. */
  private final class Assembly {
    private final ResolvedSchemas schemas;
    private final AliasScopes scopes;
    private final Map<String, List<String>> transformsByTarget = new LinkedHashMap<>();
    private final Map<String, TableNode> tables = new LinkedHashMap<>();
    private final Map<String, Integer> references = new LinkedHashMap<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private final List<HighlightGroup> highlights = new ArrayList<>();

    Assembly(UsmlDocument document, ResolvedSchemas schemas, AliasScopes scopes) {
      this.schemas = schemas;
      this.scopes = scopes;
      for (Transform transform : document.transforms()) {
        transformsByTarget
            .computeIfAbsent(transform.target(), k -> new ArrayList<>())
            .add(transform.typeName());
      }
      for (String name : document.importedTableNames()) {
        tables.put(tableId(name), new TableNode(tableId(name), name, null, name, true, 0));
      }
    }

    SubGraph level(List<MappingNode> nodes, String parentPath, int depth) {
      List<FieldNode> fields = new ArrayList<>();
      List<UnitNode> units = new ArrayList<>();
      for (MappingNode node : nodes) {
        String path = parentPath == null ? node.field() : parentPath + "." + node.field();
        UnitKind kind = UnitKind.of(node);
        String fieldId = fieldId(path);
        String unitId = unitId(path);

        List<String> tableIds = touchedTables(node, scopes.scopeOf(node));
        for (String tableId : tableIds) {
          references.merge(tableId, 1, Integer::sum);
        }
        UnitNode unit = new UnitNode(unitId, fieldId, kind, lines(node), transformsFor(node, path));
        units.add(unit);

        edges.add(new GraphEdge(fieldId, unitId, kind));
        for (String tableId : tableIds) {
          edges.add(new GraphEdge(unitId, tableId, kind));
        }
        highlights.add(new HighlightGroup(fieldId, List.of(unitId), tableIds));

        SubGraph children = null;
        if (node instanceof ArrayMapping array) {
          children = level(array.children(), path, depth + 1);
        }
        fields.add(
            new FieldNode(
                fieldId,
                node.field(),
                path,
                depth,
                Math.min(depth, maxDepthClass),
                node.kind(),
                badges(node),
                unitId,
                tableIds,
                children));
      }
      return new SubGraph(fields, units);
    }

    private List<String> touchedTables(MappingNode node, AliasScope scope) {
      Set<String> ids = new LinkedHashSet<>();
      if (node instanceof ScalarMapping scalar) {
        ids.add(qualifierTable(scalar.source().qualifier(), scope));
      } else if (node instanceof ArrayMapping array) {
        ids.add(qualifierTable(array.sourceTable(), scope));
      }
      if (node.hasJoin()) {
        JoinSpec join = node.join();
        ids.add(bindingTable(join.table(), join.alias()));
        for (JoinLink link : node.joinChain()) {
          ids.add(bindingTable(link.table(), link.alias()));
        }
      }
      return new ArrayList<>(ids);
    }

    private String qualifierTable(String qualifier, AliasScope scope) {
      String physical = scope.physical(qualifier);
      return bindingTable(physical, qualifier.equals(physical) ? null : qualifier);
    }

    private String bindingTable(String physical, String alias) {
      String effectiveAlias = physical.equals(alias) ? null : alias;
      String binding = effectiveAlias == null ? physical : effectiveAlias;
      String id = tableId(binding);
      TableNode existing = tables.get(id);
      if (existing != null && !existing.name().equals(physical)) {
        // one alias name reused by siblings for different tables
        id = tableId(binding + "@" + physical);
      }
      tables.computeIfAbsent(
          id,
          k ->
              new TableNode(
                  k,
                  physical,
                  effectiveAlias,
                  TableNode.display(physical, effectiveAlias),
                  schemas.tables().hasTable(physical),
                  0));
      return id;
    }

    private List<String> transformsFor(MappingNode node, String path) {
      List<String> types = new ArrayList<>(transformsByTarget.getOrDefault(path, List.of()));
      if (!path.equals(node.field())) {
        types.addAll(transformsByTarget.getOrDefault(node.field(), List.of()));
      }
      return types;
    }
  }

  static List<String> badges(MappingNode node) {
    List<String> badges = new ArrayList<>();
    if (node.hasAggregate()) {
      badges.add(node.aggregate().typeName().toUpperCase(Locale.ROOT));
    }
    if (node instanceof ArrayMapping) {
      badges.add("array");
    }
    return badges;
  }

  /** Display lines, e.g. {@code LEFT JOIN profiles ON users.id = profiles.user_id AS p}. */
  static List<String> lines(MappingNode node) {
    List<String> lines = new ArrayList<>();
    if (node.hasJoin()) {
      JoinSpec join = node.join();
      lines.add(joinLine(join.type().keyword(), join.table(), join.on().format(), join.alias()));
    }
    if (node.hasJoinChain()) {
      lines.add(
          node.joinChain().stream()
              .map(link -> joinLine("JOIN", link.table(), link.on().format(), link.alias()))
              .collect(Collectors.joining(" → ")));
    }
    if (node.hasAggregate()) {
      String line = node.aggregate().typeName().toUpperCase(Locale.ROOT);
      if (node.aggregate().hasGroupBy()) {
        line += " GROUP BY " + node.aggregate().groupBy().format();
      }
      lines.add(line);
    }
    return lines;
  }

  private static String joinLine(String keyword, String table, String on, String alias) {
    String line = keyword + " " + table + " ON " + on;
    return alias == null ? line : line + " AS " + alias;
  }
}
