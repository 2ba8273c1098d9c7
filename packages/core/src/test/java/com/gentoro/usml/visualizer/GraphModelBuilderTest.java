package com.gentoro.usml.visualizer;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.usml.Fixtures;
import com.gentoro.usml.ast.MappingKind;
import com.gentoro.usml.ast.UsmlDocument;
import com.gentoro.usml.validator.Contexts;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GraphModelBuilderTest {
  private final GraphModelBuilder builder = new GraphModelBuilder();

  private GraphModel build(GraphModelBuilder graphBuilder, String text) {
    UsmlDocument document = Contexts.parse(text);
    return graphBuilder.build(document, Contexts.resolve(document));
  }

  @Test
  @DisplayName("post-detail: aliased tables, chain units and nested element fields")
  void buildsPostDetail() {
    GraphModel model = build(builder, Fixtures.read("post-detail.usml.yaml"));

    assertEquals("post detail", model.usecase());
    assertNull(model.summary());
    assertEquals(
        List.of(
            "id",
            "title",
            "author_name",
            "editor_name",
            "tags",
            "tags.id",
            "tags.name",
            "comments",
            "comments.id",
            "comments.body",
            "comments.commenter"),
        model.allFields().stream().map(FieldNode::path).toList());

    FieldNode author = model.field("author_name").orElseThrow();
    assertEquals(List.of("table:author"), author.tableIds());
    TableNode authorTable = model.table("table:author").orElseThrow();
    assertEquals("users", authorTable.name());
    assertEquals("users (as author)", authorTable.display());
    assertTrue(authorTable.imported());

    FieldNode tags = model.field("tags").orElseThrow();
    assertTrue(tags.isArray());
    assertEquals(MappingKind.ARRAY, tags.kind());
    assertEquals(List.of("array"), tags.badges());
    assertEquals(List.of("table:t", "table:pt"), tags.tableIds());
    UnitNode tagUnit = model.unit(tags.unitId()).orElseThrow();
    assertEquals(UnitKind.JOIN_CHAIN, tagUnit.kind());
    assertEquals(
        List.of(
            "INNER JOIN post_tags ON posts.id = pt.post_id AS pt",
            "JOIN tags ON pt.tag_id = t.id AS t"),
        tagUnit.lines());

    FieldNode tagName = model.field("tags.name").orElseThrow();
    assertEquals(1, tagName.depth());
    assertEquals("field:tags.name", tagName.id());
    assertEquals(List.of("table:t"), tagName.tableIds());

    UnitNode body = model.unit("unit:comments.body").orElseThrow();
    assertEquals(List.of("MASK"), body.transforms());
    assertEquals(UnitKind.SIMPLE, body.kind());
  }

  @Test
  @DisplayName("imported tables come first and carry reference counts")
  void countsTableReferences() {
    GraphModel model = build(builder, Fixtures.read("post-detail.usml.yaml"));

    assertEquals(
        List.of(
            "table:posts",
            "table:users",
            "table:comments",
            "table:tags",
            "table:post_tags",
            "table:author",
            "table:editor",
            "table:t",
            "table:pt",
            "table:commenter"),
        model.tables().stream().map(TableNode::id).toList());
    assertEquals(2, model.table("table:posts").orElseThrow().referenceCount());
    assertEquals(3, model.table("table:t").orElseThrow().referenceCount());
    assertEquals(3, model.table("table:comments").orElseThrow().referenceCount());
    assertEquals(0, model.table("table:users").orElseThrow().referenceCount());
  }

  @Test
  @DisplayName("users-list: aggregate units, transforms and edges")
  void buildsUsersList() {
    GraphModel model = build(builder, Fixtures.read("users-list.usml.yaml"));

    assertEquals("List users with their avatar and number of posts", model.summary());
    UnitNode count = model.unit("unit:post_count").orElseThrow();
    assertEquals(UnitKind.AGGREGATE, count.kind());
    assertEquals(List.of("LEFT JOIN posts ON users.id = posts.user_id", "COUNT"), count.lines());
    assertEquals(List.of("COUNT"), model.field("post_count").orElseThrow().badges());

    assertEquals(List.of("COALESCE"), model.unit("unit:name").orElseThrow().transforms());
    assertTrue(model.unit("unit:id").orElseThrow().isEmpty());

    assertTrue(model.edges().contains(new GraphEdge("field:avatar_url", "unit:avatar_url", UnitKind.JOIN)));
    assertTrue(model.edges().contains(new GraphEdge("unit:avatar_url", "table:profiles", UnitKind.JOIN)));
    HighlightGroup avatar =
        model.highlights().stream()
            .filter(h -> h.fieldId().equals("field:avatar_url"))
            .findFirst()
            .orElseThrow();
    assertEquals(List.of("unit:avatar_url"), avatar.unitIds());
    assertEquals(List.of("table:profiles"), avatar.tableIds());
  }

  @Test
  @DisplayName("an alias reused by siblings points each field at its own table")
  void reusedAliasKeepsTablesApart() {
    String text =
        Fixtures.header(Fixtures.POST_API, "posts", "users", "comments")
            + """
              name: reused alias
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
    GraphModel model = build(builder, text);

    assertEquals(List.of("table:x"), model.field("author_name").orElseThrow().tableIds());
    assertEquals(List.of("table:x@comments"), model.field("title").orElseThrow().tableIds());
    assertEquals("users (as x)", model.table("table:x").orElseThrow().display());
    assertEquals("comments (as x)", model.table("table:x@comments").orElseThrow().display());
  }

  @Test
  @DisplayName("depth classes are clamped to the configured maximum")
  void clampsDepthClass() {
    GraphModel model = build(new GraphModelBuilder(0), Fixtures.read("post-detail.usml.yaml"));
    FieldNode nested = model.field("comments.commenter").orElseThrow();
    assertEquals(1, nested.depth());
    assertEquals(0, nested.depthClass());
  }

  @Test
  @DisplayName("tables that are referenced but not imported are marked")
  void marksUnimportedTables() {
    String text =
        Fixtures.header(Fixtures.USERS_API, "users")
            + """
              name: loose
              response_mapping:
                - field: id
                  source: users.id
                - field: avatar_url
                  source: profiles.avatar_url
            """;
    GraphModel model = build(builder, text);
    assertFalse(model.table("table:profiles").orElseThrow().imported());
    assertTrue(model.table("table:users").orElseThrow().imported());
  }

  @Test
  @DisplayName("unit kind precedence is aggregate, chain, join, simple")
  void unitKindPrecedence() {
    UsmlDocument doc = Contexts.parse(Fixtures.read("post-detail.usml.yaml"));
    assertEquals(UnitKind.SIMPLE, UnitKind.of(doc.responseMappings().get(0)));
    assertEquals(UnitKind.JOIN, UnitKind.of(doc.responseMappings().get(2)));
    assertEquals(UnitKind.JOIN_CHAIN, UnitKind.of(doc.responseMappings().get(4)));
    assertEquals("join-chain", UnitKind.JOIN_CHAIN.label());
  }
}
