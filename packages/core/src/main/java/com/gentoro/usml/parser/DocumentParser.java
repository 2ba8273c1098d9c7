package com.gentoro.usml.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.usml.ast.AggregateSpec;
import com.gentoro.usml.ast.ApiReference;
import com.gentoro.usml.ast.ArrayMapping;
import com.gentoro.usml.ast.ColumnRef;
import com.gentoro.usml.ast.Filter;
import com.gentoro.usml.ast.FilterTarget;
import com.gentoro.usml.ast.JoinLink;
import com.gentoro.usml.ast.JoinSpec;
import com.gentoro.usml.ast.JoinType;
import com.gentoro.usml.ast.MappingNode;
import com.gentoro.usml.ast.ScalarMapping;
import com.gentoro.usml.ast.TableReference;
import com.gentoro.usml.ast.Transform;
import com.gentoro.usml.ast.TransformCondition;
import com.gentoro.usml.ast.TransformType;
import com.gentoro.usml.ast.UsmlDocument;
import com.gentoro.usml.config.UsmlSettings;
import com.gentoro.usml.exception.DocumentParseException;
import com.gentoro.usml.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Turns USML text into a {@link UsmlDocument}.
 *
 * <p>Parsing is structural only: it enforces the document shape (known keys, value types,
 * required fields, reference grammar, array mappings owning their element mapping) but never
 * consults the referenced OpenAPI or DBML files. Failures surface as {@link
 * DocumentParseException} naming the location of the offending construct.
 *
 * <pre>{@code
 * version: "0.1"
 * import:
 *   openapi: ./api.yaml#paths["/users"].get.responses["200"]
 *   dbml:
 *     - ./schema.dbml#tables["users"]
 * usecase:
 *   name: users-list
 *   response_mapping:
 *     - field: id
 *       source: users.id
 * }</pre>
 */
public class DocumentParser {
  private static final org.slf4j.Logger log =
      com.gentoro.usml.logging.LoggingService.getLogger(DocumentParser.class);

  private static final Set<String> ROOT_KEYS = Set.of("version", "import", "usecase");
  private static final Set<String> IMPORT_KEYS = Set.of("openapi", "dbml");
  private static final Set<String> USECASE_KEYS =
      Set.of("name", "summary", "output", "response_mapping", "filters", "transforms");
  private static final Set<String> MAPPING_KEYS =
      Set.of(
          "field", "type", "source", "source_table", "join", "join_chain", "aggregate", "fields");
  private static final Set<String> JOIN_KEYS = Set.of("table", "on", "type", "alias");
  private static final Set<String> JOIN_LINK_KEYS = Set.of("table", "on", "alias");
  private static final Set<String> AGGREGATE_KEYS = Set.of("type", "group_by");
  private static final Set<String> CONDITION_KEYS =
      Set.of("param", "field", "source", "operator", "value");
  private static final Set<String> CASE_BRANCH_KEYS = Set.of("value", "then");

  private final List<String> supportedVersions;

  public DocumentParser() {
    this(List.of("0.1"));
  }

  public DocumentParser(UsmlSettings settings) {
    this(settings.supportedVersions());
  }

  public DocumentParser(List<String> supportedVersions) {
    this.supportedVersions = List.copyOf(supportedVersions);
  }

  public UsmlDocument parse(Path file) {
    String text;
    try {
      text = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new DocumentParseException("Failed to read USML document: " + file, e);
    }
    log.debug("Parsing USML document {}", file);
    return parse(text);
  }

  public UsmlDocument parse(String text) {
    JsonNode root;
    try {
      root = JacksonUtility.getYamlMapper().readTree(text == null ? "" : text);
    } catch (JsonProcessingException e) {
      throw new DocumentParseException("YAML parse error: " + e.getOriginalMessage(), e);
    }
    if (root == null || root.isMissingNode() || root.isNull()) {
      throw new DocumentParseException("USML document is empty");
    }

    NodeReader doc = NodeReader.object(root, "").allowOnly(ROOT_KEYS);
    String version = doc.requiredScalar("version");
    if (!supportedVersions.contains(version)) {
      throw new DocumentParseException(
          "unsupported version '" + version + "', expected one of " + supportedVersions,
          "version");
    }

    NodeReader imports = NodeReader.object(doc.get("import"), "import").allowOnly(IMPORT_KEYS);
    ApiReference api = apiReference(imports);
    List<TableReference> tables = tableReferences(imports);

    NodeReader usecase = NodeReader.object(doc.get("usecase"), "usecase").allowOnly(USECASE_KEYS);
    String name = usecase.requiredString("name");
    String summary = usecase.optionalString("summary");
    String output = usecase.optionalString("output");
    List<MappingNode> mappings =
        mappings(usecase.list("response_mapping", true), usecase.child("response_mapping"));
    List<Filter> filters = filters(usecase);
    List<Transform> transforms = transforms(usecase);

    UsmlDocument result =
        new UsmlDocument(
            version, api, tables, name, summary, output, mappings, filters, transforms);
    log.trace(
        "Parsed usecase '{}': {} mappings, {} filters, {} transforms",
        name,
        mappings.size(),
        filters.size(),
        transforms.size());
    return result;
  }

  private static ApiReference apiReference(NodeReader imports) {
    String text = imports.requiredString("openapi");
    try {
      return ApiReference.parse(text);
    } catch (DocumentParseException e) {
      throw new DocumentParseException(e.getMessage(), imports.child("openapi"));
    }
  }

  private static List<TableReference> tableReferences(NodeReader imports) {
    List<String> refs = imports.stringList("dbml", false);
    List<TableReference> tables = new ArrayList<>();
    for (int i = 0; i < refs.size(); i++) {
      try {
        tables.add(TableReference.parse(refs.get(i)));
      } catch (DocumentParseException e) {
        throw new DocumentParseException(
            e.getMessage(), NodeReader.element(imports.child("dbml"), i));
      }
    }
    return tables;
  }

  // ---------------- response_mapping ----------------

  private List<MappingNode> mappings(List<JsonNode> items, String listPath) {
    List<MappingNode> nodes = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < items.size(); i++) {
      String path = NodeReader.element(listPath, i);
      MappingNode node = mapping(items.get(i), path);
      if (!seen.add(node.field())) {
        throw new DocumentParseException(
            "duplicate field '" + node.field() + "' among sibling mappings", path + ".field");
      }
      nodes.add(node);
    }
    return nodes;
  }

  private MappingNode mapping(JsonNode item, String path) {
    NodeReader m = NodeReader.object(item, path).allowOnly(MAPPING_KEYS);
    String field = m.requiredString("field");
    String type = m.optionalString("type");
    JoinSpec join = m.has("join") ? join(NodeReader.object(m.get("join"), m.child("join"))) : null;
    List<JoinLink> chain = joinChain(m);
    if (!chain.isEmpty() && join == null) {
      throw new DocumentParseException("'join_chain' requires a primary 'join'", m.child("join_chain"));
    }
    AggregateSpec aggregate =
        m.has("aggregate")
            ? aggregate(NodeReader.object(m.get("aggregate"), m.child("aggregate")))
            : null;

    if (type == null || "scalar".equalsIgnoreCase(type)) {
      if (m.has("fields")) {
        throw new DocumentParseException(
            "'fields' is only allowed on mappings with type 'array'", m.child("fields"));
      }
      if (m.has("source_table")) {
        throw new DocumentParseException(
            "'source_table' is only allowed on mappings with type 'array'",
            m.child("source_table"));
      }
      ColumnRef source = m.columnRef("source", true);
      return new ScalarMapping(field, source, join, chain, aggregate);
    }
    if (!"array".equalsIgnoreCase(type)) {
      throw new DocumentParseException(
          "unsupported mapping type '" + type + "', expected 'array' or no type", m.child("type"));
    }
    if (m.has("source")) {
      throw new DocumentParseException(
          "'source' is not allowed on an array mapping; use 'source_table'", m.child("source"));
    }
    String sourceTable = m.requiredString("source_table");
    if (!m.has("fields")) {
      throw new DocumentParseException(
          "array mapping '" + field + "' must define 'fields'", m.child("fields"));
    }
    List<JsonNode> childItems = m.list("fields", true);
    if (childItems.isEmpty()) {
      throw new DocumentParseException(
          "array mapping '" + field + "' must define at least one entry in 'fields'",
          m.child("fields"));
    }
    List<MappingNode> children = mappings(childItems, m.child("fields"));
    return new ArrayMapping(field, sourceTable, join, chain, aggregate, children);
  }

  private static JoinSpec join(NodeReader j) {
    j.allowOnly(JOIN_KEYS);
    String table = j.requiredString("table");
    String alias = alias(j);
    JoinType type;
    try {
      type = JoinType.parse(j.optionalString("type"));
    } catch (DocumentParseException e) {
      throw new DocumentParseException(e.getMessage(), j.child("type"));
    }
    return new JoinSpec(table, alias, j.joinCondition("on"), type);
  }

  private static List<JoinLink> joinChain(NodeReader m) {
    List<JsonNode> items = m.list("join_chain", false);
    List<JoinLink> links = new ArrayList<>();
    for (int i = 0; i < items.size(); i++) {
      NodeReader l =
          NodeReader.object(items.get(i), NodeReader.element(m.child("join_chain"), i))
              .allowOnly(JOIN_LINK_KEYS);
      links.add(new JoinLink(l.requiredString("table"), alias(l), l.joinCondition("on")));
    }
    return links;
  }

  private static String alias(NodeReader r) {
    String alias = r.optionalString("alias");
    if (alias != null && !ColumnRef.isIdentifier(alias)) {
      throw new DocumentParseException("alias must be an identifier but got '" + alias + "'", r.child("alias"));
    }
    return alias;
  }

  private static AggregateSpec aggregate(NodeReader a) {
    a.allowOnly(AGGREGATE_KEYS);
    String type = a.requiredString("type");
    AggregateSpec spec = AggregateSpec.of(type, a.columnRef("group_by", false));
    if (!spec.isKnown()) {
      log.warn("Unknown aggregate type '{}' at {}", type, a.path());
    }
    return spec;
  }

  // ---------------- filters ----------------

  private static List<Filter> filters(NodeReader usecase) {
    List<JsonNode> items = usecase.list("filters", false);
    List<Filter> filters = new ArrayList<>();
    for (int i = 0; i < items.size(); i++) {
      NodeReader f = NodeReader.object(items.get(i), NodeReader.element(usecase.child("filters"), i));
      String param = f.requiredString("param");
      String mapsTo = f.requiredString("maps_to");
      FilterTarget target =
          FilterTarget.fromName(mapsTo)
              .orElseThrow(
                  () ->
                      new DocumentParseException(
                          "unsupported maps_to '" + mapsTo + "', expected WHERE, PAGINATION or ORDER_BY",
                          f.child("maps_to")));
      filters.add(
          switch (target) {
            case WHERE -> where(f, param);
            case PAGINATION -> pagination(f, param);
            case ORDER_BY -> orderBy(f, param);
          });
    }
    return filters;
  }

  private static Filter where(NodeReader f, String param) {
    f.allowOnly(Set.of("param", "maps_to", "condition"));
    return new Filter.Where(param, f.requiredString("condition"));
  }

  private static Filter pagination(NodeReader f, String param) {
    f.allowOnly(
        Set.of(
            "param", "maps_to", "strategy", "page_size", "limit_param", "max_page_size",
            "cursor_field"));
    String strategyName = f.requiredString("strategy");
    Filter.PaginationStrategy strategy =
        enumValue(Filter.PaginationStrategy.class, strategyName)
            .orElseThrow(
                () ->
                    new DocumentParseException(
                        "unsupported pagination strategy '" + strategyName + "', expected offset or cursor",
                        f.child("strategy")));
    Integer pageSize = f.optionalPositiveInt("page_size");
    Integer maxPageSize = f.optionalPositiveInt("max_page_size");
    if (pageSize != null && maxPageSize != null && pageSize > maxPageSize) {
      throw new DocumentParseException(
          "page_size " + pageSize + " exceeds max_page_size " + maxPageSize, f.child("page_size"));
    }
    String cursorField = f.optionalString("cursor_field");
    if (strategy == Filter.PaginationStrategy.CURSOR && cursorField == null) {
      throw new DocumentParseException(
          "cursor pagination requires 'cursor_field'", f.child("cursor_field"));
    }
    return new Filter.Pagination(
        param, strategy, pageSize, f.optionalString("limit_param"), maxPageSize, cursorField);
  }

  private static Filter orderBy(NodeReader f, String param) {
    f.allowOnly(
        Set.of(
            "param", "maps_to", "default_column", "default_direction", "allowed_columns",
            "allowed_directions"));
    Filter.SortDirection defaultDirection = null;
    String direction = f.optionalString("default_direction");
    if (direction != null) {
      defaultDirection = sortDirection(direction, f.child("default_direction"));
    }
    List<Filter.SortDirection> allowedDirections = null;
    if (f.has("allowed_directions")) {
      List<String> names = f.stringList("allowed_directions", true);
      allowedDirections = new ArrayList<>();
      for (int i = 0; i < names.size(); i++) {
        allowedDirections.add(
            sortDirection(names.get(i), NodeReader.element(f.child("allowed_directions"), i)));
      }
    }
    return new Filter.OrderBy(
        param,
        f.optionalString("default_column"),
        defaultDirection,
        f.has("allowed_columns") ? new LinkedHashSet<>(f.stringList("allowed_columns", true)) : null,
        allowedDirections == null ? null : new LinkedHashSet<>(allowedDirections));
  }

  private static Filter.SortDirection sortDirection(String text, String path) {
    return enumValue(Filter.SortDirection.class, text)
        .orElseThrow(
            () ->
                new DocumentParseException(
                    "unsupported sort direction '" + text + "', expected ASC or DESC", path));
  }

  // ---------------- transforms ----------------

  private static List<Transform> transforms(NodeReader usecase) {
    List<JsonNode> items = usecase.list("transforms", false);
    List<Transform> transforms = new ArrayList<>();
    for (int i = 0; i < items.size(); i++) {
      NodeReader t =
          NodeReader.object(items.get(i), NodeReader.element(usecase.child("transforms"), i));
      transforms.add(transform(t));
    }
    return transforms;
  }

  private static Transform transform(NodeReader t) {
    String target = t.requiredString("target");
    String typeName = t.requiredString("type");
    Optional<TransformType> type = TransformType.fromName(typeName);
    if (type.isEmpty()) {
      // payload of unknown kinds is not interpreted
      log.warn("Unknown transform type '{}' at {}", typeName, t.path());
      return new Transform.Unknown(target, typeName, conditions(t, false));
    }
    return switch (type.get()) {
      case COALESCE -> {
        t.allowOnly(Set.of("target", "type", "sources", "fallback", "condition"));
        yield new Transform.Coalesce(
            target, nonEmpty(t, "sources"), t.optionalScalar("fallback"), conditions(t, false));
      }
      case CONCAT -> {
        t.allowOnly(Set.of("target", "type", "sources", "separator", "condition"));
        yield new Transform.Concat(
            target, nonEmpty(t, "sources"), separator(t), conditions(t, false));
      }
      case CASE -> {
        t.allowOnly(Set.of("target", "type", "source", "when", "else_value", "condition"));
        yield new Transform.Case(
            target,
            t.requiredString("source"),
            caseBranches(t),
            t.optionalScalar("else_value"),
            conditions(t, false));
      }
      case MASK -> {
        t.allowOnly(Set.of("target", "type", "source", "mask_pattern", "condition"));
        yield new Transform.Mask(
            target,
            t.requiredString("source"),
            t.requiredString("mask_pattern"),
            conditions(t, false));
      }
      case CONDITIONAL_SOURCE -> {
        t.allowOnly(
            Set.of("target", "type", "condition", "then_source", "else_source"));
        yield new Transform.ConditionalSource(
            target,
            t.requiredString("then_source"),
            t.optionalString("else_source"),
            conditions(t, true));
      }
    };
  }

  private static String separator(NodeReader t) {
    JsonNode value = t.get("separator");
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isTextual()) {
      throw new DocumentParseException(
          "expected a string but got " + NodeReader.describe(value), t.child("separator"));
    }
    // a single space is a legitimate separator
    return value.asText();
  }

  private static List<String> nonEmpty(NodeReader t, String key) {
    List<String> values = t.stringList(key, true);
    if (values.isEmpty()) {
      throw new DocumentParseException("'" + key + "' must not be empty", t.child(key));
    }
    return values;
  }

  private static List<Transform.CaseBranch> caseBranches(NodeReader t) {
    List<JsonNode> items = t.list("when", true);
    if (items.isEmpty()) {
      throw new DocumentParseException("'when' must not be empty", t.child("when"));
    }
    List<Transform.CaseBranch> branches = new ArrayList<>();
    for (int i = 0; i < items.size(); i++) {
      NodeReader b =
          NodeReader.object(items.get(i), NodeReader.element(t.child("when"), i))
              .allowOnly(CASE_BRANCH_KEYS);
      branches.add(new Transform.CaseBranch(b.requiredScalar("value"), b.requiredScalar("then")));
    }
    return branches;
  }

  private static List<TransformCondition> conditions(NodeReader t, boolean required) {
    List<JsonNode> items = t.list("condition", required);
    if (required && items.isEmpty()) {
      throw new DocumentParseException("'condition' must not be empty", t.child("condition"));
    }
    List<TransformCondition> conditions = new ArrayList<>();
    for (int i = 0; i < items.size(); i++) {
      String path = NodeReader.element(t.child("condition"), i);
      NodeReader c = NodeReader.object(items.get(i), path).allowOnly(CONDITION_KEYS);
      TransformCondition.Subject subject = null;
      String reference = null;
      for (TransformCondition.Subject candidate : TransformCondition.Subject.values()) {
        String key = candidate.name().toLowerCase(Locale.ROOT);
        if (c.has(key)) {
          if (subject != null) {
            throw new DocumentParseException(
                "condition must reference exactly one of param, field or source", path);
          }
          subject = candidate;
          reference = c.requiredString(key);
        }
      }
      if (subject == null) {
        throw new DocumentParseException(
            "condition must reference one of param, field or source", path);
      }
      conditions.add(
          new TransformCondition(
              subject, reference, c.requiredString("operator"), c.requiredScalar("value")));
    }
    return conditions;
  }

  private static <E extends Enum<E>> Optional<E> enumValue(Class<E> type, String name) {
    try {
      return Optional.of(Enum.valueOf(type, name.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
