package com.gentoro.usml.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.usml.ast.AggregateSpec;
import com.gentoro.usml.ast.ArrayMapping;
import com.gentoro.usml.ast.Filter;
import com.gentoro.usml.ast.JoinLink;
import com.gentoro.usml.ast.JoinSpec;
import com.gentoro.usml.ast.MappingNode;
import com.gentoro.usml.ast.ScalarMapping;
import com.gentoro.usml.ast.TableReference;
import com.gentoro.usml.ast.Transform;
import com.gentoro.usml.ast.TransformCondition;
import com.gentoro.usml.ast.UsmlDocument;
import com.gentoro.usml.exception.UsmlErrorCode;
import com.gentoro.usml.exception.UsmlException;
import com.gentoro.usml.utility.JacksonUtility;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Serialises a {@link UsmlDocument} back to USML YAML. Output read by {@link DocumentParser}
 * yields a document equal to the one written.
 */
public class DocumentWriter {
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  public String write(UsmlDocument document) {
    try {
      return JacksonUtility.getYamlMapper().writeValueAsString(toTree(document));
    } catch (JsonProcessingException e) {
      throw new UsmlException(
          UsmlErrorCode.UNKNOWN, "Failed to serialise usecase " + document.usecaseName(), e);
    }
  }

  ObjectNode toTree(UsmlDocument document) {
    ObjectNode root = NODES.objectNode();
    root.put("version", document.version());

    ObjectNode imports = root.putObject("import");
    imports.put("openapi", document.importApi().format());
    if (!document.importTables().isEmpty()) {
      ArrayNode dbml = imports.putArray("dbml");
      for (TableReference table : document.importTables()) {
        dbml.add(table.format());
      }
    }

    ObjectNode usecase = root.putObject("usecase");
    usecase.put("name", document.usecaseName());
    putIfPresent(usecase, "summary", document.usecaseSummary());
    putIfPresent(usecase, "output", document.outputName());
    usecase.set("response_mapping", mappings(document.responseMappings()));
    if (!document.filters().isEmpty()) {
      ArrayNode filters = usecase.putArray("filters");
      document.filters().forEach(f -> filters.add(filter(f)));
    }
    if (!document.transforms().isEmpty()) {
      ArrayNode transforms = usecase.putArray("transforms");
      document.transforms().forEach(t -> transforms.add(transform(t)));
    }
    return root;
  }

  private ArrayNode mappings(List<MappingNode> nodes) {
    ArrayNode array = NODES.arrayNode();
    for (MappingNode node : nodes) {
      ObjectNode m = array.addObject();
      m.put("field", node.field());
      if (node instanceof ScalarMapping scalar) {
        m.put("source", scalar.source().format());
      } else if (node instanceof ArrayMapping list) {
        m.put("type", "array");
        m.put("source_table", list.sourceTable());
      }
      if (node.hasJoin()) {
        JoinSpec join = node.join();
        ObjectNode j = m.putObject("join");
        j.put("table", join.table());
        putIfPresent(j, "alias", join.alias());
        j.put("on", join.on().format());
        j.put("type", join.type().name());
      }
      if (node.hasJoinChain()) {
        ArrayNode chain = m.putArray("join_chain");
        for (JoinLink link : node.joinChain()) {
          ObjectNode l = chain.addObject();
          l.put("table", link.table());
          putIfPresent(l, "alias", link.alias());
          l.put("on", link.on().format());
        }
      }
      if (node.hasAggregate()) {
        AggregateSpec aggregate = node.aggregate();
        ObjectNode a = m.putObject("aggregate");
        a.put("type", aggregate.typeName());
        if (aggregate.hasGroupBy()) {
          a.put("group_by", aggregate.groupBy().format());
        }
      }
      if (node instanceof ArrayMapping list) {
        m.set("fields", mappings(list.children()));
      }
    }
    return array;
  }

  private ObjectNode filter(Filter filter) {
    ObjectNode f = NODES.objectNode();
    f.put("param", filter.param());
    f.put("maps_to", filter.mapsTo().name());
    if (filter instanceof Filter.Where where) {
      f.put("condition", where.condition());
    } else if (filter instanceof Filter.Pagination page) {
      f.put("strategy", page.strategy().name().toLowerCase(Locale.ROOT));
      if (page.pageSize() != null) f.put("page_size", page.pageSize());
      putIfPresent(f, "limit_param", page.limitParam());
      if (page.maxPageSize() != null) f.put("max_page_size", page.maxPageSize());
      putIfPresent(f, "cursor_field", page.cursorField());
    } else if (filter instanceof Filter.OrderBy order) {
      putIfPresent(f, "default_column", order.defaultColumn());
      if (order.defaultDirection() != null) {
        f.put("default_direction", order.defaultDirection().name());
      }
      if (order.allowedColumns() != null) {
        f.set("allowed_columns", strings(order.allowedColumns()));
      }
      if (order.allowedDirections() != null) {
        ArrayNode directions = f.putArray("allowed_directions");
        order.allowedDirections().forEach(d -> directions.add(d.name()));
      }
    }
    return f;
  }

  private ObjectNode transform(Transform transform) {
    ObjectNode t = NODES.objectNode();
    t.put("target", transform.target());
    t.put("type", transform.typeName());
    if (transform instanceof Transform.Coalesce coalesce) {
      t.set("sources", strings(coalesce.sources()));
      putIfPresent(t, "fallback", coalesce.fallback());
    } else if (transform instanceof Transform.Concat concat) {
      t.set("sources", strings(concat.sources()));
      putIfPresent(t, "separator", concat.separator());
    } else if (transform instanceof Transform.Case caseOf) {
      t.put("source", caseOf.source());
      ArrayNode when = t.putArray("when");
      for (Transform.CaseBranch branch : caseOf.branches()) {
        when.addObject().put("value", branch.value()).put("then", branch.then());
      }
      putIfPresent(t, "else_value", caseOf.elseValue());
    } else if (transform instanceof Transform.Mask mask) {
      t.put("source", mask.source());
      t.put("mask_pattern", mask.maskPattern());
    } else if (transform instanceof Transform.ConditionalSource conditional) {
      t.put("then_source", conditional.thenSource());
      putIfPresent(t, "else_source", conditional.elseSource());
    }
    if (!transform.conditions().isEmpty()) {
      ArrayNode conditions = t.putArray("condition");
      for (TransformCondition c : transform.conditions()) {
        conditions
            .addObject()
            .put(c.subject().name().toLowerCase(Locale.ROOT), c.reference())
            .put("operator", c.operator())
            .put("value", c.value());
      }
    }
    return t;
  }

  private static ArrayNode strings(Collection<String> values) {
    ArrayNode array = NODES.arrayNode();
    values.forEach(array::add);
    return array;
  }

  private static void putIfPresent(ObjectNode node, String key, String value) {
    if (value != null) {
      node.put(key, value);
    }
  }
}
