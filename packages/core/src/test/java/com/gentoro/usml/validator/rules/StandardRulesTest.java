package com.gentoro.usml.validator.rules;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.usml.Fixtures;
import com.gentoro.usml.validator.Contexts;
import com.gentoro.usml.validator.Diagnostic;
import com.gentoro.usml.validator.ValidationCheck;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StandardRulesTest {

  private static String users(String body, String... tables) {
    return Fixtures.header(Fixtures.USERS_API, tables) + "  name: users\n" + body;
  }

  private static List<String> locations(ValidationCheck check, String text) {
    List<Diagnostic> diagnostics = Contexts.run(check, text);
    diagnostics.forEach(d -> assertEquals(check.rule(), d.rule()));
    return diagnostics.stream().map(Diagnostic::location).toList();
  }

  @Test
  @DisplayName("field-schema-match: top-level fields must be response properties")
  void fieldSchemaMatch() {
    String text =
        users(
            """
              response_mapping:
                - field: id
                  source: users.id
                - field: nickname
                  source: users.name
            """,
            "users");
    List<Diagnostic> diagnostics = Contexts.run(new FieldSchemaMatchCheck(), text);
    assertEquals(1, diagnostics.size());
    assertEquals("response_mapping[1].field", diagnostics.get(0).location());
    assertTrue(diagnostics.get(0).message().contains("200 response of GET /users"));
  }

  @Test
  @DisplayName("table-coverage: sources and array tables must be imported")
  void tableCoverage() {
    String text =
        Fixtures.header(Fixtures.POST_API, "posts")
            + """
              name: post
              response_mapping:
                - field: id
                  source: posts.id
                - field: title
                  source: posts.headline
                - field: author_name
                  source: users.name
                - field: comments
                  type: array
                  source_table: comments
                  fields:
                    - field: id
                      source: comments.id
            """;
    assertEquals(
        List.of(
            "response_mapping[1].source",
            "response_mapping[2].source",
            "response_mapping[3].source_table",
            "response_mapping[3].fields[0].source"),
        locations(new TableCoverageCheck(), text));
  }

  @Test
  @DisplayName("table-coverage: column-qualified imports restrict what may be mapped")
  void tableCoverageImportedColumns() {
    String text =
        users(
                """
                  response_mapping:
                    - field: name
                      source: users.name
                    - field: email
                      source: users.email
                """,
                "users")
            .replace("tables[\"users\"]", "tables[\"users\"].columns[\"name\"]");
    List<Diagnostic> diagnostics = Contexts.run(new TableCoverageCheck(), text);
    assertEquals(1, diagnostics.size());
    assertEquals("response_mapping[1].source", diagnostics.get(0).location());
    assertTrue(diagnostics.get(0).message().contains("is not imported"));
  }

  @Test
  @DisplayName("join-table-imported: join and chain tables must be imported")
  void joinTableImported() {
    String text =
        Fixtures.header(Fixtures.POST_API, "posts", "post_tags")
            + """
              name: post
              response_mapping:
                - field: like_count
                  source: likes.id
                  join:
                    table: likes
                    on: posts.id = likes.post_id
                - field: tags
                  type: array
                  source_table: tags
                  join:
                    table: post_tags
                    on: posts.id = post_tags.post_id
                  join_chain:
                    - table: tags
                      on: post_tags.tag_id = tags.id
                  fields:
                    - field: id
                      source: tags.id
            """;
    assertEquals(
        List.of("response_mapping[0].join.table", "response_mapping[1].join_chain[0].table"),
        locations(new JoinTableImportedCheck(), text));
  }

  @Test
  @DisplayName("filter-param-declared: params and limit params must be API parameters")
  void filterParamDeclared() {
    String text =
        users(
            """
              response_mapping:
                - field: id
                  source: users.id
              filters:
                - param: q
                  maps_to: WHERE
                  condition: "users.name = :q"
                - param: offset
                  maps_to: PAGINATION
                  strategy: offset
                  limit_param: size
                - param: limit
                  maps_to: PAGINATION
                  strategy: offset
                  limit_param: limit
            """,
            "users");
    assertEquals(
        List.of("filters[0].param", "filters[1].limit_param"),
        locations(new FilterParamDeclaredCheck(), text));
  }

  @Test
  @DisplayName("transform-target-exists: dotted targets walk arrays, bare names match any level")
  void transformTargetExists() {
    String text =
        Fixtures.header(Fixtures.POST_API, "posts", "comments")
            + """
              name: post
              response_mapping:
                - field: title
                  source: posts.title
                - field: comments
                  type: array
                  source_table: comments
                  fields:
                    - field: body
                      source: comments.body
              transforms:
                - target: comments.body
                  type: MASK
                  source: comments.body
                  mask_pattern: "*"
                - target: body
                  type: MASK
                  source: comments.body
                  mask_pattern: "*"
                - target: nickname
                  type: MASK
                  source: posts.title
                  mask_pattern: "*"
                - target: title.x
                  type: MASK
                  source: posts.title
                  mask_pattern: "*"
                - target: comments.nope
                  type: MASK
                  source: comments.body
                  mask_pattern: "*"
            """;
    assertEquals(
        List.of("transforms[2].target", "transforms[3].target", "transforms[4].target"),
        locations(new TransformTargetExistsCheck(), text));
  }

  @Test
  @DisplayName("join-condition-resolvable: both sides resolve through aliases")
  void joinConditionResolvable() {
    String text =
        Fixtures.header(Fixtures.POST_API, "posts", "users")
            + """
              name: post
              response_mapping:
                - field: author_name
                  source: author.name
                  join:
                    table: users
                    alias: author
                    on: posts.user_id = author.id
                - field: editor_name
                  source: editor.name
                  join:
                    table: users
                    alias: editor
                    on: posts.editor = editor.idx
                - field: like_count
                  source: posts.id
                  join:
                    table: users
                    alias: liker
                    on: likes.user_id = liker.id
            """;
    List<Diagnostic> diagnostics = Contexts.run(new JoinConditionResolvableCheck(), text);
    assertEquals(3, diagnostics.size());
    assertEquals("response_mapping[1].join.on", diagnostics.get(0).location());
    assertTrue(diagnostics.get(0).message().contains("has no column 'editor'"));
    assertTrue(diagnostics.get(1).message().contains("has no column 'idx'"));
    assertTrue(diagnostics.get(2).message().contains("table 'likes' is not imported"));
  }

  @Test
  @DisplayName("filter-condition-params-declared: one error per undeclared placeholder")
  void filterConditionParams() {
    String text =
        users(
            """
              response_mapping:
                - field: id
                  source: users.id
              filters:
                - param: status
                  maps_to: WHERE
                  condition: "users.status = :status AND users.name = :who OR users.email = :mail"
            """,
            "users");
    List<Diagnostic> diagnostics = Contexts.run(new FilterConditionParamsDeclaredCheck(), text);
    assertEquals(2, diagnostics.size());
    assertTrue(diagnostics.get(0).message().contains(":who"));
    assertTrue(diagnostics.get(1).message().contains(":mail"));
  }

  @Test
  @DisplayName("transform-when-param-declared: only param conditions are checked")
  void transformWhenParam() {
    String text =
        users(
            """
              response_mapping:
                - field: email
                  source: users.email
              transforms:
                - target: email
                  type: MASK
                  source: users.email
                  mask_pattern: "***"
                  condition:
                    - field: status
                      operator: "="
                      value: hidden
                    - param: debug
                      operator: "="
                      value: false
            """,
            "users");
    assertEquals(
        List.of("transforms[0].condition[1].param"),
        locations(new TransformWhenParamDeclaredCheck(), text));
  }

  @Test
  @DisplayName("sort-column-allowlisted: defaults must be allowed")
  void sortAllowlist() {
    String text =
        users(
            """
              response_mapping:
                - field: id
                  source: users.id
              filters:
                - param: sort
                  maps_to: ORDER_BY
                  default_column: id
                  default_direction: ASC
                  allowed_columns: [created_at, name]
                  allowed_directions: [DESC]
                - param: sort
                  maps_to: ORDER_BY
                  default_column: id
            """,
            "users");
    assertEquals(
        List.of("filters[0].default_column", "filters[0].default_direction"),
        locations(new SortColumnAllowlistedCheck(), text));
  }
}
