package com.gentoro.usml.resolver;

import java.util.Objects;

/** Both resolved inputs of a document, shared read-only by the validator and the graph builder. */
public record ResolvedSchemas(ResolvedApiSchema api, ResolvedTableSchema tables) {

  public ResolvedSchemas {
    Objects.requireNonNull(api, "api");
    Objects.requireNonNull(tables, "tables");
  }
}
