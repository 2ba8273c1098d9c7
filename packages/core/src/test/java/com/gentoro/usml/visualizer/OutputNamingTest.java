package com.gentoro.usml.visualizer;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.usml.Fixtures;
import com.gentoro.usml.ast.UsmlDocument;
import com.gentoro.usml.parser.DocumentParser;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OutputNamingTest {
  private final DocumentParser parser = new DocumentParser();
  private final Path out = Path.of("build", "graphs");

  @Test
  @DisplayName("override, then document output, then sanitised usecase name")
  void precedence() {
    UsmlDocument detail = parser.parse(Fixtures.path("post-detail.usml.yaml"));
    UsmlDocument list = parser.parse(Fixtures.path("users-list.usml.yaml"));

    Path override = Path.of("/tmp/custom.html");
    assertEquals(override, OutputNaming.resolve(override, detail, out));
    assertEquals(out.resolve("post-detail.html"), OutputNaming.resolve(null, detail, out));
    assertEquals(out.resolve("users-list.html"), OutputNaming.resolve(null, list, out));
  }

  @Test
  @DisplayName("sanitising keeps letters, digits, dash and underscore")
  void sanitize() {
    assertEquals("post-detail", OutputNaming.sanitize("post detail"));
    assertEquals("a_b-c--d", OutputNaming.sanitize("a_b-c/.d"));
    assertEquals("usecase", OutputNaming.sanitize("  "));
    assertEquals("usecase", OutputNaming.sanitize(null));
  }
}
