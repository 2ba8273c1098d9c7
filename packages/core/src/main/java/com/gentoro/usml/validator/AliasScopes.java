package com.gentoro.usml.validator;

import com.gentoro.usml.ast.ArrayMapping;
import com.gentoro.usml.ast.JoinLink;
import com.gentoro.usml.ast.MappingNode;
import com.gentoro.usml.ast.ScalarMapping;
import com.gentoro.usml.ast.UsmlDocument;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Alias scopes of a whole document, built in one traversal and shared by every consumer.
 *
 * <p>Each mapping resolves its references in its own {@link AliasScope}, holding its {@code join}
 * then {@code join_chain} bindings, so a mapping's own alias always wins over a sibling's. Below
 * that sits the level scope, which collects the bindings of the earlier siblings in declaration
 * order. The children of an array resolve in a nested scope under the array's own scope, whose
 * root table is the array's {@code source_table}.
 */
public final class AliasScopes {
  private final Map<MappingNode, AliasScope> scopes = new IdentityHashMap<>();
  private final Map<ArrayMapping, AliasScope> childScopes = new IdentityHashMap<>();
  private final List<MappingSite> sites = new ArrayList<>();
  private final AliasScope root;

  private AliasScopes(UsmlDocument document) {
    this.root = new AliasScope(null, topLevelRootTable(document));
    visitLevel(document.responseMappings(), "response_mapping", 0, null, root);
  }

  public static AliasScopes build(UsmlDocument document) {
    return new AliasScopes(document);
  }

  public AliasScope root() {
    return root;
  }

  /** Scope that references on {@code node} (source, join conditions, group key) resolve in. */
  public AliasScope scopeOf(MappingNode node) {
    AliasScope scope = scopes.get(node);
    if (scope == null) {
      throw new IllegalArgumentException("Mapping '" + node.field() + "' is not part of this document");
    }
    return scope;
  }

  /** Scope of the children of {@code array}. */
  public AliasScope childScopeOf(ArrayMapping array) {
    AliasScope scope = childScopes.get(array);
    if (scope == null) {
      throw new IllegalArgumentException("Array '" + array.field() + "' is not part of this document");
    }
    return scope;
  }

  /** Every mapping of the document in pre-order. */
  public List<MappingSite> sites() {
    return Collections.unmodifiableList(sites);
  }

  private void visitLevel(
      List<MappingNode> level, String listPath, int depth, ArrayMapping owner, AliasScope scope) {
    for (int i = 0; i < level.size(); i++) {
      MappingNode node = level.get(i);
      String location = listPath + "[" + i + "]";
      AliasScope own = AliasScope.mappingScope(scope);
      if (node.hasJoin()) {
        bindJoins(node, own);
      }
      scopes.put(node, own);
      sites.add(new MappingSite(node, location, depth, owner, own));
      if (node instanceof ArrayMapping array) {
        AliasScope children = new AliasScope(own, array.sourceTable());
        childScopes.put(array, children);
        visitLevel(array.children(), location + ".fields", depth + 1, array, children);
      }
      // later siblings may refer to what this mapping joined
      if (node.hasJoin()) {
        bindJoins(node, scope);
      }
    }
  }

  private static void bindJoins(MappingNode node, AliasScope scope) {
    scope.bind(node.join().bindingName(), node.join().table());
    for (JoinLink link : node.joinChain()) {
      scope.bind(link.bindingName(), link.table());
    }
  }

  /** Table of the first top-level scalar read without a join, else the first imported table. */
  private static String topLevelRootTable(UsmlDocument document) {
    for (MappingNode node : document.responseMappings()) {
      if (node instanceof ScalarMapping scalar && !scalar.hasJoin()) {
        return scalar.source().qualifier();
      }
    }
    List<String> imported = document.importedTableNames();
    return imported.isEmpty() ? null : imported.get(0);
  }
}
