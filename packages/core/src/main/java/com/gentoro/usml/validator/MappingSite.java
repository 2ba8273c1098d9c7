package com.gentoro.usml.validator;

import com.gentoro.usml.ast.ArrayMapping;
import com.gentoro.usml.ast.MappingNode;

/**
 * A mapping node together with where it sits: its document path, nesting depth (0 for top-level
 * fields), the array owning it (null at top level) and the scope its references resolve in.
 */
public record MappingSite(
    MappingNode node, String location, int depth, ArrayMapping owner, AliasScope scope) {

  public boolean isTopLevel() {
    return owner == null;
  }
}
