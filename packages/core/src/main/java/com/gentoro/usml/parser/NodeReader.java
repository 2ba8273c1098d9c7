package com.gentoro.usml.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.usml.ast.ColumnRef;
import com.gentoro.usml.ast.JoinCondition;
import com.gentoro.usml.exception.DocumentParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Strict accessor over one YAML mapping. Every failure is reported as a {@link
 * DocumentParseException} located at the dotted path of the offending key.
 */
final class NodeReader {
  private final JsonNode node;
  private final String path;

  private NodeReader(JsonNode node, String path) {
    this.node = node;
    this.path = path;
  }

  static NodeReader object(JsonNode node, String path) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      throw new DocumentParseException("missing required mapping", path);
    }
    if (!node.isObject()) {
      throw new DocumentParseException(
          "expected a mapping but got " + describe(node), path);
    }
    return new NodeReader(node, path);
  }

  String path() {
    return path;
  }

  String child(String key) {
    return path.isEmpty() ? key : path + "." + key;
  }

  static String element(String listPath, int index) {
    return listPath + "[" + index + "]";
  }

  boolean has(String key) {
    JsonNode value = node.get(key);
    return value != null && !value.isNull();
  }

  /** Reject any key outside {@code allowed}. */
  NodeReader allowOnly(Set<String> allowed) {
    Iterator<String> names = node.fieldNames();
    while (names.hasNext()) {
      String name = names.next();
      if (!allowed.contains(name)) {
        throw new DocumentParseException("unknown key '" + name + "'", child(name));
      }
    }
    return this;
  }

  String requiredString(String key) {
    String value = optionalString(key);
    if (value == null) {
      throw new DocumentParseException("missing required field '" + key + "'", child(key));
    }
    return value;
  }

  String optionalString(String key) {
    JsonNode value = node.get(key);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isTextual()) {
      throw new DocumentParseException(
          "expected a string but got " + describe(value), child(key));
    }
    String text = value.asText();
    if (text.isBlank()) {
      throw new DocumentParseException("must not be blank", child(key));
    }
    return text;
  }

  /** String, number or boolean rendered as text; used for literal values. */
  String requiredScalar(String key) {
    String value = optionalScalar(key);
    if (value == null) {
      throw new DocumentParseException("missing required field '" + key + "'", child(key));
    }
    return value;
  }

  String optionalScalar(String key) {
    JsonNode value = node.get(key);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isValueNode()) {
      throw new DocumentParseException(
          "expected a scalar value but got " + describe(value), child(key));
    }
    return value.asText();
  }

  Integer optionalPositiveInt(String key) {
    JsonNode value = node.get(key);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isIntegralNumber() || !value.canConvertToInt() || value.asInt() <= 0) {
      throw new DocumentParseException(
          "expected a positive integer but got " + describe(value), child(key));
    }
    return value.asInt();
  }

  /** Elements of a sequence; absent means empty unless {@code required}. */
  List<JsonNode> list(String key, boolean required) {
    JsonNode value = node.get(key);
    if (value == null || value.isNull()) {
      if (required) {
        throw new DocumentParseException("missing required field '" + key + "'", child(key));
      }
      return List.of();
    }
    if (!value.isArray()) {
      throw new DocumentParseException(
          "expected a sequence but got " + describe(value), child(key));
    }
    List<JsonNode> items = new ArrayList<>();
    value.forEach(items::add);
    return items;
  }

  List<String> stringList(String key, boolean required) {
    List<JsonNode> items = list(key, required);
    List<String> values = new ArrayList<>();
    for (int i = 0; i < items.size(); i++) {
      JsonNode item = items.get(i);
      if (!item.isTextual() || item.asText().isBlank()) {
        throw new DocumentParseException(
            "expected a non-blank string but got " + describe(item), element(child(key), i));
      }
      values.add(item.asText());
    }
    return values;
  }

  JsonNode get(String key) {
    return node.get(key);
  }

  ColumnRef columnRef(String key, boolean required) {
    String text = required ? requiredString(key) : optionalString(key);
    if (text == null) {
      return null;
    }
    try {
      return ColumnRef.parse(text);
    } catch (DocumentParseException e) {
      throw new DocumentParseException(e.getMessage(), child(key));
    }
  }

  JoinCondition joinCondition(String key) {
    String text = requiredString(key);
    try {
      return JoinCondition.parse(text);
    } catch (DocumentParseException e) {
      throw new DocumentParseException(e.getMessage(), child(key));
    }
  }

  static String describe(JsonNode value) {
    if (value == null || value.isNull()) return "null";
    if (value.isObject()) return "a mapping";
    if (value.isArray()) return "a sequence";
    if (value.isTextual()) return "string '" + value.asText() + "'";
    if (value.isNumber()) return "number " + value.asText();
    if (value.isBoolean()) return "boolean " + value.asText();
    return value.getNodeType().name().toLowerCase();
  }
}
