package com.gentoro.usml.validator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Symbol table of binding names (alias, or table name when unaliased) to physical tables. A level
 * scope collects the bindings of one level of a mapping tree; a mapping scope holds a single
 * mapping's own {@code join} and {@code join_chain} bindings on top of its level. Lookups fall
 * through to the enclosing scope, then to the raw name itself.
 */
public final class AliasScope {
  private final AliasScope parent;
  private final String rootName;
  private final boolean inheritsRoot;
  private final Map<String, String> bindings = new LinkedHashMap<>();

  AliasScope(AliasScope parent, String rootName) {
    this(parent, rootName, false);
  }

  private AliasScope(AliasScope parent, String rootName, boolean inheritsRoot) {
    this.parent = parent;
    this.rootName = rootName;
    this.inheritsRoot = inheritsRoot;
  }

  /** Scope of one mapping: its own bindings shadow the level's, the root table is the level's. */
  static AliasScope mappingScope(AliasScope level) {
    return new AliasScope(level, null, true);
  }

  /** First binding of a name wins. */
  void bind(String name, String physicalTable) {
    bindings.putIfAbsent(name, physicalTable);
  }

  /** Physical table declared for {@code name} here or in an enclosing level. */
  public Optional<String> lookup(String name) {
    for (AliasScope scope = this; scope != null; scope = scope.parent) {
      String table = scope.bindings.get(name);
      if (table != null) {
        return Optional.of(table);
      }
    }
    return Optional.empty();
  }

  /** Physical table for a qualifier; an undeclared name is taken to be a table name. */
  public String physical(String qualifier) {
    return lookup(qualifier).orElse(qualifier);
  }

  /** Table that rows of this level come from; null when it cannot be determined. */
  public String rootTable() {
    if (inheritsRoot) {
      return parent.rootTable();
    }
    return rootName == null ? null : physical(rootName);
  }

  public AliasScope parent() {
    return parent;
  }

  public Map<String, String> bindings() {
    return Collections.unmodifiableMap(bindings);
  }
}
