package com.gentoro.usml.resolver;

import com.gentoro.usml.exception.ResolutionException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Reader for the subset of DBML that carries relational structure.
 *
 * <p>Understood: {@code Table} blocks with columns, column settings ({@code pk}, {@code primary
 * key}, {@code not null}, {@code unique}, inline {@code ref}), {@code indexes} with composite
 * primary keys, table aliases, standalone and block {@code Ref}s, quoted and schema-qualified
 * names. {@code Project}, {@code Enum}, {@code TableGroup}, {@code Note} and {@code Records}
 * blocks are skipped.
 */
public class DbmlReader {
  private static final org.slf4j.Logger log =
      com.gentoro.usml.logging.LoggingService.getLogger(DbmlReader.class);

  private static final Set<String> SKIPPED_BLOCKS =
      Set.of("project", "enum", "tablegroup", "note", "records", "tablepartial");

  public DbmlSchema read(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ResolutionException("DBML file does not exist: " + file)
          .withContext("file", file.toString());
    }
    String text;
    try {
      text = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ResolutionException("Failed to read DBML file: " + file, e);
    }
    return read(text, file);
  }

  public DbmlSchema read(String text, Path source) {
    List<Token> tokens = new Lexer(text, source).tokenize();
    DbmlSchema schema = new Parser(tokens, source).parse();
    log.debug(
        "Read DBML {}: {} tables, {} references",
        source,
        schema.tables().size(),
        schema.references().size());
    return schema;
  }

  private static ResolutionException syntaxError(Path source, int line, int column, String message) {
    return (ResolutionException)
        new ResolutionException(
                "DBML syntax error in " + source + " at " + line + ":" + column + ": " + message)
            .withContext("file", String.valueOf(source))
            .withContext("line", line)
            .withContext("column", column);
  }

  private enum Kind {
    IDENT,
    STRING,
    NUMBER,
    SYMBOL,
    EOF
  }

  private record Token(Kind kind, String text, int line, int column) {
    boolean is(String symbol) {
      return kind == Kind.SYMBOL && text.equals(symbol);
    }

    boolean isKeyword(String keyword) {
      return kind == Kind.IDENT && text.equalsIgnoreCase(keyword);
    }

    boolean isName() {
      return kind == Kind.IDENT || kind == Kind.STRING;
    }
  }

  // ---------------------------------------------------------------------------------------------

  private static final class Lexer {
    private final String text;
    private final Path source;
    private int pos;
    private int line = 1;
    private int column = 1;

    Lexer(String text, Path source) {
      this.text = text == null ? "" : text;
      this.source = source;
    }

    List<Token> tokenize() {
      List<Token> tokens = new ArrayList<>();
      while (true) {
        skipTrivia();
        if (pos >= text.length()) {
          tokens.add(new Token(Kind.EOF, "", line, column));
          return tokens;
        }
        int startLine = line;
        int startColumn = column;
        char c = text.charAt(pos);
        if (Character.isLetter(c) || c == '_') {
          tokens.add(new Token(Kind.IDENT, consumeWhile(DbmlReader::isNameChar), startLine, startColumn));
        } else if (Character.isDigit(c)) {
          tokens.add(
              new Token(
                  Kind.NUMBER,
                  consumeWhile(ch -> Character.isDigit(ch) || ch == '.'),
                  startLine,
                  startColumn));
        } else if (text.startsWith("'''", pos)) {
          tokens.add(new Token(Kind.STRING, delimited("'''"), startLine, startColumn));
        } else if (c == '\'' || c == '"' || c == '`') {
          tokens.add(new Token(Kind.STRING, delimited(String.valueOf(c)), startLine, startColumn));
        } else if (text.startsWith("<>", pos)) {
          advance(2);
          tokens.add(new Token(Kind.SYMBOL, "<>", startLine, startColumn));
        } else {
          advance(1);
          tokens.add(new Token(Kind.SYMBOL, String.valueOf(c), startLine, startColumn));
        }
      }
    }

    private void skipTrivia() {
      while (pos < text.length()) {
        char c = text.charAt(pos);
        if (Character.isWhitespace(c)) {
          advance(1);
        } else if (text.startsWith("//", pos)) {
          while (pos < text.length() && text.charAt(pos) != '\n') {
            advance(1);
          }
        } else if (text.startsWith("/*", pos)) {
          int startLine = line;
          int startColumn = column;
          int end = text.indexOf("*/", pos + 2);
          if (end < 0) {
            throw syntaxError(source, startLine, startColumn, "unterminated block comment");
          }
          advance(end + 2 - pos);
        } else {
          return;
        }
      }
    }

    private String delimited(String quote) {
      int startLine = line;
      int startColumn = column;
      advance(quote.length());
      StringBuilder sb = new StringBuilder();
      while (pos < text.length()) {
        if (text.startsWith(quote, pos)) {
          advance(quote.length());
          return sb.toString();
        }
        char c = text.charAt(pos);
        if (c == '\\' && pos + 1 < text.length()) {
          sb.append(text.charAt(pos + 1));
          advance(2);
          continue;
        }
        if (c == '\n' && quote.length() == 1 && !quote.equals("`")) {
          break;
        }
        sb.append(c);
        advance(1);
      }
      throw syntaxError(source, startLine, startColumn, "unterminated string");
    }

    private String consumeWhile(java.util.function.IntPredicate accept) {
      int start = pos;
      while (pos < text.length() && accept.test(text.charAt(pos))) {
        advance(1);
      }
      return text.substring(start, pos);
    }

    private void advance(int count) {
      for (int i = 0; i < count && pos < text.length(); i++) {
        if (text.charAt(pos) == '\n') {
          line++;
          column = 1;
        } else {
          column++;
        }
        pos++;
      }
    }
  }

  private static boolean isNameChar(int c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  // ---------------------------------------------------------------------------------------------

  private static final class TableBuilder {
    final String name;
    final String alias;
    final Map<String, ColumnDefinition> columns = new LinkedHashMap<>();
    final List<String> indexPrimaryKey = new ArrayList<>();

    TableBuilder(String name, String alias) {
      this.name = name;
      this.alias = alias;
    }

    TableDefinition build() {
      List<String> primaryKey = new ArrayList<>(indexPrimaryKey);
      if (primaryKey.isEmpty()) {
        columns.values().stream()
            .filter(ColumnDefinition::primaryKey)
            .map(ColumnDefinition::name)
            .forEach(primaryKey::add);
      }
      return new TableDefinition(name, alias, new ArrayList<>(columns.values()), primaryKey);
    }
  }

  /** One side of a relationship as written: possibly an alias, possibly composite. */
  private record Endpoint(String table, List<String> columns) {}

  private record PendingRef(Endpoint from, String relation, Endpoint to) {}

  private static final class Parser {
    private final List<Token> tokens;
    private final Path source;
    private int index;
    private final Map<String, TableBuilder> tables = new LinkedHashMap<>();
    private final List<PendingRef> refs = new ArrayList<>();

    Parser(List<Token> tokens, Path source) {
      this.tokens = tokens;
      this.source = source;
    }

    DbmlSchema parse() {
      while (peek().kind() != Kind.EOF) {
        Token token = peek();
        if (token.isKeyword("table")) {
          table();
        } else if (token.isKeyword("ref")) {
          ref();
        } else if (token.kind() == Kind.IDENT
            && SKIPPED_BLOCKS.contains(token.text().toLowerCase(Locale.ROOT))) {
          skipTopLevel();
        } else {
          throw error(token, "unexpected '" + token.text() + "'");
        }
      }
      return build();
    }

    private DbmlSchema build() {
      Map<String, String> aliases = new LinkedHashMap<>();
      Map<String, TableDefinition> definitions = new LinkedHashMap<>();
      for (TableBuilder builder : tables.values()) {
        definitions.put(builder.name, builder.build());
        if (builder.alias != null) {
          aliases.put(builder.alias, builder.name);
        }
      }
      Set<ForeignKey> keys = new LinkedHashSet<>();
      for (PendingRef ref : refs) {
        List<String> fromColumns = ref.from().columns();
        List<String> toColumns = ref.to().columns();
        if (fromColumns.size() != toColumns.size()) {
          log.warn("Skipping reference with mismatched column counts in {}", source);
          continue;
        }
        String fromTable = aliases.getOrDefault(ref.from().table(), ref.from().table());
        String toTable = aliases.getOrDefault(ref.to().table(), ref.to().table());
        for (int i = 0; i < fromColumns.size(); i++) {
          keys.add(
              new ForeignKey(fromTable, fromColumns.get(i), ref.relation(), toTable, toColumns.get(i)));
        }
      }
      return new DbmlSchema(source, definitions, new ArrayList<>(keys));
    }

    // Table [schema.]name [as alias] [settings] { ... }
    private void table() {
      next();
      Token nameToken = peek();
      String name = lastSegment(qualifiedName());
      String alias = null;
      if (peek().isKeyword("as")) {
        next();
        alias = name(peek());
        next();
      }
      if (peek().is("[")) {
        settings();
      }
      if (tables.containsKey(name)) {
        throw error(nameToken, "table '" + name + "' is declared twice");
      }
      TableBuilder table = new TableBuilder(name, alias);
      tables.put(name, table);

      expect("{");
      while (!peek().is("}")) {
        Token token = peek();
        if (token.kind() == Kind.EOF) {
          throw error(token, "unterminated table '" + name + "'");
        }
        if (token.isKeyword("indexes") && peek(1).is("{")) {
          indexes(table);
        } else if (token.isKeyword("note") && (peek(1).is(":") || peek(1).is("{"))) {
          skipNote();
        } else {
          column(table);
        }
      }
      expect("}");
    }

    // name type [settings]
    private void column(TableBuilder table) {
      Token nameToken = next();
      String columnName = name(nameToken);
      String type = columnType();
      boolean pk = false;
      boolean notNull = false;
      boolean unique = false;
      if (peek().is("[")) {
        for (List<Token> setting : settings()) {
          String head = setting.get(0).text().toLowerCase(Locale.ROOT);
          if (head.equals("pk")
              || (head.equals("primary") && setting.size() > 1 && setting.get(1).isKeyword("key"))) {
            pk = true;
          } else if (head.equals("not") && setting.size() > 1 && setting.get(1).isKeyword("null")) {
            notNull = true;
          } else if (head.equals("unique")) {
            unique = true;
          } else if (head.equals("ref")) {
            inlineRef(table.name, columnName, setting);
          }
        }
      }
      if (table.columns.containsKey(columnName)) {
        throw error(nameToken, "column '" + columnName + "' is declared twice in table '" + table.name + "'");
      }
      table.columns.put(columnName, new ColumnDefinition(columnName, type, pk, pk || notNull, unique));
    }

    private String columnType() {
      Token first = next();
      if (!first.isName()) {
        throw error(first, "expected a column type but got '" + first.text() + "'");
      }
      StringBuilder type = new StringBuilder(first.text());
      while (peek().is(".") && peek(1).isName()) {
        next();
        type.append('.').append(next().text());
      }
      if (peek().is("(")) {
        type.append(next().text());
        while (!peek().is(")")) {
          Token token = next();
          if (token.kind() == Kind.EOF) {
            throw error(token, "unterminated column type");
          }
          type.append(token.text());
        }
        type.append(next().text());
      }
      return type.toString();
    }

    // ref: > table.column
    private void inlineRef(String table, String column, List<Token> setting) {
      int i = 1;
      if (i < setting.size() && setting.get(i).is(":")) {
        i++;
      }
      if (i >= setting.size()) {
        throw error(setting.get(0), "inline ref is missing its target");
      }
      Token relation = setting.get(i++);
      if (!isRelation(relation)) {
        throw error(relation, "expected one of > < - <> but got '" + relation.text() + "'");
      }
      List<String> parts = new ArrayList<>();
      for (; i < setting.size(); i++) {
        Token token = setting.get(i);
        if (token.isName()) {
          parts.add(token.text());
        } else if (!token.is(".")) {
          throw error(token, "unexpected '" + token.text() + "' in inline ref");
        }
      }
      if (parts.size() < 2) {
        throw error(relation, "inline ref must name 'table.column'");
      }
      refs.add(
          new PendingRef(
              new Endpoint(table, List.of(column)),
              relation.text(),
              new Endpoint(parts.get(parts.size() - 2), List.of(parts.get(parts.size() - 1)))));
    }

    // indexes { col [pk] (a, b) [pk, unique] `expr` }
    private void indexes(TableBuilder table) {
      next();
      expect("{");
      while (!peek().is("}")) {
        Token token = next();
        List<String> columns = new ArrayList<>();
        if (token.is("(")) {
          while (!peek().is(")")) {
            Token item = next();
            if (item.kind() == Kind.EOF) {
              throw error(item, "unterminated index column list");
            }
            if (item.isName()) {
              columns.add(item.text());
            }
          }
          next();
        } else if (token.isName()) {
          columns.add(token.text());
        } else {
          throw error(token, "unexpected '" + token.text() + "' in indexes");
        }
        if (peek().is("[")) {
          boolean pk =
              settings().stream()
                  .anyMatch(
                      s ->
                          s.get(0).isKeyword("pk")
                              || (s.get(0).isKeyword("primary") && s.size() > 1 && s.get(1).isKeyword("key")));
          if (pk) {
            table.indexPrimaryKey.clear();
            table.indexPrimaryKey.addAll(columns);
          }
        }
      }
      expect("}");
    }

    // Ref [name]: a.b > c.d [settings]   |   Ref [name] { a.b > c.d ... }
    private void ref() {
      next();
      if (peek().isName()) {
        next();
      }
      if (peek().is(":")) {
        next();
        relationship();
      } else if (peek().is("{")) {
        next();
        while (!peek().is("}")) {
          if (peek().kind() == Kind.EOF) {
            throw error(peek(), "unterminated Ref block");
          }
          relationship();
        }
        next();
      } else {
        throw error(peek(), "expected ':' or '{' after Ref");
      }
    }

    private void relationship() {
      Endpoint from = endpoint();
      Token relation = next();
      if (!isRelation(relation)) {
        throw error(relation, "expected one of > < - <> but got '" + relation.text() + "'");
      }
      Endpoint to = endpoint();
      if (peek().is("[")) {
        settings();
      }
      refs.add(new PendingRef(from, relation.text(), to));
    }

    // [schema.]table.column  |  [schema.]table.(a, b)
    private Endpoint endpoint() {
      List<String> parts = new ArrayList<>();
      Token start = peek();
      parts.add(name(next()));
      while (peek().is(".")) {
        next();
        if (peek().is("(")) {
          next();
          List<String> columns = new ArrayList<>();
          while (!peek().is(")")) {
            Token item = next();
            if (item.kind() == Kind.EOF) {
              throw error(item, "unterminated composite reference");
            }
            if (item.isName()) {
              columns.add(item.text());
            }
          }
          next();
          return new Endpoint(parts.get(parts.size() - 1), columns);
        }
        parts.add(name(next()));
      }
      if (parts.size() < 2) {
        throw error(start, "reference endpoint must be 'table.column'");
      }
      return new Endpoint(parts.get(parts.size() - 2), List.of(parts.get(parts.size() - 1)));
    }

    private static boolean isRelation(Token token) {
      return token.is(">") || token.is("<") || token.is("-") || token.is("<>");
    }

    /** Settings list split on top-level commas; empty entries are dropped. */
    private List<List<Token>> settings() {
      Token open = expect("[");
      List<List<Token>> settings = new ArrayList<>();
      List<Token> current = new ArrayList<>();
      int depth = 0;
      while (true) {
        Token token = next();
        if (token.kind() == Kind.EOF) {
          throw error(open, "unterminated settings list");
        }
        if (depth == 0 && token.is("]")) {
          break;
        }
        if (token.is("[") || token.is("(")) depth++;
        if (token.is("]") || token.is(")")) depth--;
        if (depth == 0 && token.is(",")) {
          if (!current.isEmpty()) settings.add(current);
          current = new ArrayList<>();
        } else {
          current.add(token);
        }
      }
      if (!current.isEmpty()) {
        settings.add(current);
      }
      return settings;
    }

    private void skipNote() {
      next();
      if (peek().is(":")) {
        next();
        next();
      } else {
        skipBraces();
      }
    }

    private void skipTopLevel() {
      Token keyword = next();
      if (keyword.isKeyword("note") && peek().is(":")) {
        next();
        next();
        return;
      }
      while (!peek().is("{")) {
        if (peek().kind() == Kind.EOF) {
          throw error(keyword, "expected '{' after " + keyword.text());
        }
        next();
      }
      skipBraces();
      log.trace("Skipped {} block in {}", keyword.text(), source);
    }

    private void skipBraces() {
      Token open = expect("{");
      int depth = 1;
      while (depth > 0) {
        Token token = next();
        if (token.kind() == Kind.EOF) {
          throw error(open, "unterminated block");
        }
        if (token.is("{")) depth++;
        if (token.is("}")) depth--;
      }
    }

    private String qualifiedName() {
      StringBuilder sb = new StringBuilder(name(next()));
      while (peek().is(".") && peek(1).isName()) {
        next();
        sb.append('.').append(name(next()));
      }
      return sb.toString();
    }

    private String name(Token token) {
      if (!token.isName() || StringUtils.isBlank(token.text())) {
        throw error(token, "expected a name but got '" + token.text() + "'");
      }
      return token.text();
    }

    private static String lastSegment(String qualified) {
      return qualified.contains(".") ? StringUtils.substringAfterLast(qualified, ".") : qualified;
    }

    private Token expect(String symbol) {
      Token token = next();
      if (!token.is(symbol)) {
        throw error(token, "expected '" + symbol + "' but got '" + token.text() + "'");
      }
      return token;
    }

    private Token peek() {
      return peek(0);
    }

    private Token peek(int ahead) {
      return tokens.get(Math.min(index + ahead, tokens.size() - 1));
    }

    private Token next() {
      Token token = peek();
      if (index < tokens.size() - 1) {
        index++;
      }
      return token;
    }

    private ResolutionException error(Token token, String message) {
      return syntaxError(source, token.line(), token.column(), message);
    }
  }
}
