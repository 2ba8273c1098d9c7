package com.gentoro.usml.visualizer;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A table as addressed by the document. Aliased joins produce their own node, displayed as
 * {@code users (as author)}.
 */
public record TableNode(
    String id,
    String name,
    @JsonInclude(JsonInclude.Include.NON_NULL) String alias,
    String display,
    boolean imported,
    int referenceCount) {

  static String display(String name, String alias) {
    return alias == null ? name : name + " (as " + alias + ")";
  }

  TableNode withReferenceCount(int count) {
    return new TableNode(id, name, alias, display, imported, count);
  }
}
