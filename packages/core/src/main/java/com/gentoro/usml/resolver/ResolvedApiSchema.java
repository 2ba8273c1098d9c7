package com.gentoro.usml.resolver;

import com.gentoro.usml.ast.ApiReference;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Response-body fields (name to declared type) of one API operation and the names of the
 * parameters that operation declares.
 */
public record ResolvedApiSchema(
    ApiReference reference, Map<String, String> fields, List<String> parameters) {

  public ResolvedApiSchema {
    Objects.requireNonNull(reference, "reference");
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    parameters = List.copyOf(parameters);
  }

  public boolean hasField(String name) {
    return fields.containsKey(name);
  }

  public boolean hasParameter(String name) {
    return parameters.contains(name);
  }
}
