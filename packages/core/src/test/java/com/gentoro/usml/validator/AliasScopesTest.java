package com.gentoro.usml.validator;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.usml.Fixtures;
import com.gentoro.usml.ast.ArrayMapping;
import com.gentoro.usml.ast.UsmlDocument;
import com.gentoro.usml.parser.DocumentParser;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AliasScopesTest {
  private final DocumentParser parser = new DocumentParser();

  @Test
  @DisplayName("top level binds joins then chain links, arrays get nested scopes")
  void buildsScopesForPostDetail() {
    UsmlDocument doc = parser.parse(Fixtures.path("post-detail.usml.yaml"));
    AliasScopes scopes = AliasScopes.build(doc);

    AliasScope root = scopes.root();
    assertEquals("posts", root.rootTable());
    assertEquals(
        Map.of("author", "users", "editor", "users", "pt", "post_tags", "t", "tags", "comments", "comments"),
        root.bindings());
    assertEquals(List.of("author", "editor", "pt", "t", "comments"), List.copyOf(root.bindings().keySet()));

    ArrayMapping tags = (ArrayMapping) doc.responseMappings().get(4);
    AliasScope tagScope = scopes.childScopeOf(tags);
    assertSame(scopes.scopeOf(tags), tagScope.parent());
    assertSame(root, scopes.scopeOf(tags).parent());
    assertEquals("tags", tagScope.rootTable());
    assertEquals("tags", tagScope.physical("t"));

    ArrayMapping comments = (ArrayMapping) doc.responseMappings().get(5);
    AliasScope commentScope = scopes.childScopeOf(comments);
    assertEquals(Optional.of("users"), commentScope.lookup("commenter"));
    assertEquals(Optional.empty(), root.lookup("commenter"));
    assertSame(commentScope, scopes.scopeOf(comments.children().get(2)).parent());
    assertSame(root, scopes.scopeOf(comments).parent());
    assertEquals("posts", scopes.scopeOf(comments).rootTable());
  }

  @Test
  @DisplayName("sites are listed in pre-order with their paths and depth")
  void listsSites() {
    UsmlDocument doc = parser.parse(Fixtures.path("post-detail.usml.yaml"));
    List<MappingSite> sites = AliasScopes.build(doc).sites();

    assertEquals(
        List.of(
            "response_mapping[0]",
            "response_mapping[1]",
            "response_mapping[2]",
            "response_mapping[3]",
            "response_mapping[4]",
            "response_mapping[4].fields[0]",
            "response_mapping[4].fields[1]",
            "response_mapping[5]",
            "response_mapping[5].fields[0]",
            "response_mapping[5].fields[1]",
            "response_mapping[5].fields[2]"),
        sites.stream().map(MappingSite::location).toList());
    MappingSite commenter = sites.get(10);
    assertEquals(1, commenter.depth());
    assertEquals("comments", commenter.owner().field());
    assertFalse(commenter.isTopLevel());
    assertTrue(sites.get(0).isTopLevel());
  }

  @Test
  @DisplayName("a chain alias is only known where the chain declares it")
  void chainAliasNeedsChain() {
    String withoutChain =
        Fixtures.header(Fixtures.POST_API, "posts", "post_tags", "tags")
            + """
              name: tags
              response_mapping:
                - field: tags
                  type: array
                  source_table: t
                  join:
                    table: post_tags
                    alias: pt
                    on: posts.id = pt.post_id
                  fields:
                    - field: name
                      source: t.name
            """;
    UsmlDocument doc = parser.parse(withoutChain);
    AliasScopes scopes = AliasScopes.build(doc);
    assertEquals("t", scopes.root().physical("t"));
    assertEquals("post_tags", scopes.root().physical("pt"));
    // no top-level scalar without a join: the first import is the root
    assertEquals("posts", scopes.root().rootTable());
  }

  @Test
  @DisplayName("a mapping's own alias wins over a sibling's alias of the same name")
  void ownAliasWins() {
    String text =
        Fixtures.header(Fixtures.POST_API, "posts", "users", "comments")
            + """
              name: clash
              response_mapping:
                - field: id
                  source: posts.id
                - field: author_name
                  source: x.name
                  join:
                    table: users
                    alias: x
                    on: posts.user_id = x.id
                - field: title
                  source: x.body
                  join:
                    table: comments
                    alias: x
                    on: posts.id = x.post_id
            """;
    UsmlDocument doc = parser.parse(text);
    AliasScopes scopes = AliasScopes.build(doc);

    assertEquals("users", scopes.scopeOf(doc.responseMappings().get(1)).physical("x"));
    assertEquals("comments", scopes.scopeOf(doc.responseMappings().get(2)).physical("x"));
    // among siblings the first declaration is the one later mappings see
    assertEquals("users", scopes.root().physical("x"));
  }

  @Test
  @DisplayName("an alias is not visible to mappings declared before it")
  void noForwardAliases() {
    String text =
        Fixtures.header(Fixtures.POST_API, "posts", "users")
            + """
              name: forward
              response_mapping:
                - field: id
                  source: posts.id
                - field: editor_name
                  source: author.name
                - field: author_name
                  source: author.name
                  join:
                    table: users
                    alias: author
                    on: posts.user_id = author.id
            """;
    UsmlDocument doc = parser.parse(text);
    AliasScopes scopes = AliasScopes.build(doc);

    assertEquals(Optional.empty(), scopes.scopeOf(doc.responseMappings().get(1)).lookup("author"));
    assertEquals(Optional.of("users"), scopes.root().lookup("author"));
  }
}
