package com.gentoro.usml.parser;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.usml.Fixtures;
import com.gentoro.usml.ast.ArrayMapping;
import com.gentoro.usml.ast.ColumnRef;
import com.gentoro.usml.ast.Filter;
import com.gentoro.usml.ast.JoinType;
import com.gentoro.usml.ast.ScalarMapping;
import com.gentoro.usml.ast.Transform;
import com.gentoro.usml.ast.TransformCondition;
import com.gentoro.usml.ast.UsmlDocument;
import com.gentoro.usml.exception.DocumentParseException;
import com.gentoro.usml.exception.UsmlErrorCode;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentParserTest {
  private final DocumentParser parser = new DocumentParser();

  private static String doc(String mappings) {
    return Fixtures.header(Fixtures.USERS_API, "users")
        + "  name: test\n"
        + "  response_mapping:\n"
        + mappings;
  }

  private DocumentParseException failure(String text) {
    DocumentParseException e =
        assertThrows(DocumentParseException.class, () -> parser.parse(text));
    assertEquals(UsmlErrorCode.PARSE_ERROR, e.getCode());
    return e;
  }

  @Test
  @DisplayName("users-list fixture parses into mappings, filters and transforms")
  void parsesUsersList() {
    UsmlDocument doc = parser.parse(Fixtures.path("users-list.usml.yaml"));

    assertEquals("0.1", doc.version());
    assertEquals("users-list", doc.usecaseName());
    assertEquals("/users", doc.importApi().apiPath());
    assertEquals(List.of("users", "profiles", "posts"), doc.importedTableNames());
    assertEquals(5, doc.responseMappings().size());

    ScalarMapping avatar = (ScalarMapping) doc.responseMappings().get(3);
    assertEquals(new ColumnRef("profiles", "avatar_url"), avatar.source());
    assertEquals(JoinType.LEFT, avatar.join().type());

    ScalarMapping count = (ScalarMapping) doc.responseMappings().get(4);
    assertTrue(count.hasAggregate());
    assertNull(count.aggregate().groupBy());

    assertEquals(3, doc.filters().size());
    Filter.Pagination page = (Filter.Pagination) doc.filters().get(1);
    assertEquals(Filter.PaginationStrategy.OFFSET, page.strategy());
    assertEquals(20, page.pageSize());
    assertEquals(100, page.maxPageSize());
    Filter.OrderBy sort = (Filter.OrderBy) doc.filters().get(2);
    assertEquals(Set.of("created_at", "name"), sort.allowedColumns());
    assertEquals(Filter.SortDirection.DESC, sort.defaultDirection());

    Transform.Coalesce coalesce = (Transform.Coalesce) doc.transforms().get(0);
    assertEquals(List.of("users.name", "users.email"), coalesce.sources());
    assertEquals("anonymous", coalesce.fallback());
  }

  @Test
  @DisplayName("post-detail fixture keeps aliases, chains and nested arrays")
  void parsesPostDetail() {
    UsmlDocument doc = parser.parse(Fixtures.path("post-detail.usml.yaml"));

    assertEquals("200", doc.importApi().statusCode());
    assertEquals("post-detail.html", doc.outputName());

    ArrayMapping tags = (ArrayMapping) doc.responseMappings().get(4);
    assertEquals("t", tags.sourceTable());
    assertEquals("pt", tags.join().alias());
    assertEquals(JoinType.INNER, tags.join().type());
    assertEquals(1, tags.joinChain().size());
    assertEquals("t", tags.joinTailBinding());

    ArrayMapping comments = (ArrayMapping) doc.responseMappings().get(5);
    ScalarMapping commenter = (ScalarMapping) comments.children().get(2);
    assertEquals("commenter", commenter.join().alias());

    Transform.Mask mask = (Transform.Mask) doc.transforms().get(0);
    TransformCondition gate = mask.conditions().get(0);
    assertEquals(TransformCondition.Subject.PARAM, gate.subject());
    assertEquals("redact", gate.reference());
    assertEquals("true", gate.value());
  }

  @Test
  @DisplayName("an unquoted numeric version is accepted")
  void acceptsNumericVersion() {
    String text = doc("    - field: id\n      source: users.id\n").replace("\"0.1\"", "0.1");
    assertEquals("0.1", parser.parse(text).version());
  }

  @Test
  @DisplayName("unsupported versions are rejected at 'version'")
  void rejectsUnknownVersion() {
    String text = doc("    - field: id\n      source: users.id\n").replace("\"0.1\"", "\"2.0\"");
    assertEquals("version", failure(text).getLocation());
  }

  @Test
  @DisplayName("unknown keys are reported at their own path")
  void rejectsUnknownKeys() {
    DocumentParseException e =
        failure(doc("    - field: id\n      source: users.id\n      sauce: users.name\n"));
    assertEquals("usecase.response_mapping[0].sauce", e.getLocation());
    assertTrue(e.getMessage().contains("unknown key 'sauce'"));
  }

  @Test
  @DisplayName("array mappings must own their element mapping")
  void arrayRequiresFields() {
    DocumentParseException missing =
        failure(doc("    - field: posts\n      type: array\n      source_table: posts\n"));
    assertEquals("usecase.response_mapping[0].fields", missing.getLocation());

    DocumentParseException empty =
        failure(
            doc("    - field: posts\n      type: array\n      source_table: posts\n      fields: []\n"));
    assertEquals("usecase.response_mapping[0].fields", empty.getLocation());
  }

  @Test
  @DisplayName("scalars need a source and may not carry array keys")
  void scalarShape() {
    assertEquals(
        "usecase.response_mapping[0].source", failure(doc("    - field: id\n")).getLocation());
    assertEquals(
        "usecase.response_mapping[0].source_table",
        failure(doc("    - field: id\n      source: users.id\n      source_table: users\n"))
            .getLocation());
    assertEquals(
        "usecase.response_mapping[0].type",
        failure(doc("    - field: id\n      type: object\n      source: users.id\n"))
            .getLocation());
  }

  @Test
  @DisplayName("join_chain without a primary join is rejected")
  void chainNeedsJoin() {
    DocumentParseException e =
        failure(
            doc(
                """
                    - field: tag
                      source: tags.name
                      join_chain:
                        - table: tags
                          on: post_tags.tag_id = tags.id
                """));
    assertEquals("usecase.response_mapping[0].join_chain", e.getLocation());
  }

  @Test
  @DisplayName("sibling fields must be unique, nested ones are located by path")
  void duplicateSiblings() {
    DocumentParseException top =
        failure(doc("    - field: id\n      source: users.id\n    - field: id\n      source: users.name\n"));
    assertEquals("usecase.response_mapping[1].field", top.getLocation());

    DocumentParseException nested =
        failure(
            doc(
                """
                    - field: posts
                      type: array
                      source_table: posts
                      fields:
                        - field: id
                          source: posts.id
                        - field: id
                          source: posts.title
                """));
    assertEquals("usecase.response_mapping[0].fields[1].field", nested.getLocation());
  }

  @Test
  @DisplayName("malformed join conditions and references carry their location")
  void malformedExpressions() {
    DocumentParseException on =
        failure(
            doc(
                """
                    - field: avatar
                      source: profiles.avatar_url
                      join:
                        table: profiles
                        on: users.id == profiles.user_id
                """));
    assertEquals("usecase.response_mapping[0].join.on", on.getLocation());

    String badApi =
        doc("    - field: id\n      source: users.id\n")
            .replace(Fixtures.USERS_API, "./api.yaml#paths[\"/users\"].fetch");
    assertEquals("import.openapi", failure(badApi).getLocation());

    String badTable =
        doc("    - field: id\n      source: users.id\n")
            .replace("tables[\"users\"]", "tables[users]");
    assertEquals("import.dbml[0]", failure(badTable).getLocation());
  }

  @Test
  @DisplayName("duplicate YAML keys are a parse error")
  void duplicateYamlKeys() {
    DocumentParseException e =
        failure(doc("    - field: id\n      source: users.id\n      source: users.name\n"));
    assertTrue(e.getMessage().startsWith("YAML parse error"));
  }

  @Test
  @DisplayName("empty and non-mapping documents are rejected")
  void emptyDocument() {
    assertTrue(failure("").getMessage().contains("empty"));
    assertTrue(failure("# only a comment\n").getMessage().contains("empty"));
    assertTrue(failure("- a\n- b\n").getMessage().contains("expected a mapping"));
  }

  @Test
  @DisplayName("cursor pagination needs a cursor field and page_size is bounded")
  void paginationShape() {
    String base = doc("    - field: id\n      source: users.id\n") + "  filters:\n";
    DocumentParseException cursor =
        failure(base + "    - param: after\n      maps_to: PAGINATION\n      strategy: cursor\n");
    assertEquals("usecase.filters[0].cursor_field", cursor.getLocation());

    DocumentParseException size =
        failure(
            base
                + "    - param: limit\n      maps_to: PAGINATION\n      strategy: offset\n"
                + "      page_size: 200\n      max_page_size: 100\n");
    assertEquals("usecase.filters[0].page_size", size.getLocation());

    DocumentParseException target =
        failure(base + "    - param: q\n      maps_to: HAVING\n");
    assertEquals("usecase.filters[0].maps_to", target.getLocation());
  }

  @Test
  @DisplayName("unknown transform types are kept, known ones are checked strictly")
  void transformVariants() {
    String base = doc("    - field: name\n      source: users.name\n") + "  transforms:\n";
    UsmlDocument doc =
        parser.parse(
            base + "    - target: name\n      type: UPPERCASE\n      whatever: [1, 2]\n");
    Transform.Unknown unknown = (Transform.Unknown) doc.transforms().get(0);
    assertEquals("UPPERCASE", unknown.typeName());

    DocumentParseException sources =
        failure(base + "    - target: name\n      type: CONCAT\n      sources: []\n");
    assertEquals("usecase.transforms[0].sources", sources.getLocation());

    DocumentParseException condition =
        failure(
            base
                + "    - target: name\n      type: CONDITIONAL_SOURCE\n"
                + "      then_source: users.email\n");
    assertEquals("usecase.transforms[0].condition", condition.getLocation());

    DocumentParseException subjects =
        failure(
            base
                + "    - target: name\n      type: MASK\n      source: users.name\n"
                + "      mask_pattern: \"*\"\n      condition:\n"
                + "        - param: redact\n          field: name\n"
                + "          operator: \"=\"\n          value: true\n");
    assertEquals("usecase.transforms[0].condition[0]", subjects.getLocation());
  }

  @Test
  @DisplayName("CONCAT keeps a single-space separator")
  void concatSeparator() {
    String text =
        doc("    - field: name\n      source: users.name\n")
            + "  transforms:\n"
            + "    - target: name\n      type: CONCAT\n      sources: [users.name, users.email]\n"
            + "      separator: \" \"\n";
    Transform.Concat concat = (Transform.Concat) parser.parse(text).transforms().get(0);
    assertEquals(" ", concat.separator());
  }

  @Test
  @DisplayName("a missing file is a parse error naming the file")
  void missingFile(@TempDir Path dir) {
    Path file = dir.resolve("absent.usml.yaml");
    DocumentParseException e =
        assertThrows(DocumentParseException.class, () -> parser.parse(file));
    assertTrue(e.getMessage().contains("absent.usml.yaml"));
  }

  @Test
  @DisplayName("configured versions replace the default list")
  void configuredVersions() {
    DocumentParser strict = new DocumentParser(List.of("0.2"));
    String text = doc("    - field: id\n      source: users.id\n");
    assertThrows(DocumentParseException.class, () -> strict.parse(text));
    assertEquals("0.2", strict.parse(text.replace("\"0.1\"", "\"0.2\"")).version());
  }
}
