package com.gentoro.usml;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Access to the files under {@code src/test/resources/fixtures}. */
public final class Fixtures {
  public static final List<String> FILES =
      List.of("api.yaml", "schema.dbml", "users-list.usml.yaml", "post-detail.usml.yaml");

  private Fixtures() {}

  public static Path dir() {
    URL url = Fixtures.class.getClassLoader().getResource("fixtures/api.yaml");
    if (url == null) {
      throw new IllegalStateException("fixtures are not on the test classpath");
    }
    try {
      return Path.of(url.toURI()).getParent();
    } catch (URISyntaxException e) {
      throw new IllegalStateException(e);
    }
  }

  public static Path path(String name) {
    return dir().resolve(name);
  }

  public static String read(String name) {
    try {
      return Files.readString(path(name), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Copy every fixture into {@code target} so a test can edit them freely. */
  public static Path copyTo(Path target) {
    try {
      Files.createDirectories(target);
      for (String name : FILES) {
        Files.copy(path(name), target.resolve(name));
      }
      return target;
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** A document header importing the blog API and the given tables, ending at {@code usecase:}. */
  public static String header(String apiRef, String... tables) {
    StringBuilder sb = new StringBuilder();
    sb.append("version: \"0.1\"\n");
    sb.append("import:\n");
    sb.append("  openapi: ").append(apiRef).append('\n');
    if (tables.length > 0) {
      sb.append("  dbml:\n");
      for (String table : tables) {
        sb.append("    - ./schema.dbml#tables[\"").append(table).append("\"]\n");
      }
    }
    sb.append("usecase:\n");
    return sb.toString();
  }

  public static final String USERS_API = "./api.yaml#paths[\"/users\"].get.responses[\"200\"]";
  public static final String POST_API = "./api.yaml#paths[\"/posts/{post_id}\"].get";
}
