package com.gentoro.usml;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.gentoro.usml.ast.UsmlDocument;
import com.gentoro.usml.config.UsmlSettings;
import com.gentoro.usml.exception.DocumentParseException;
import com.gentoro.usml.exception.ResolutionException;
import com.gentoro.usml.parser.DocumentParser;
import com.gentoro.usml.resolver.OpenApiSchemaResolver;
import com.gentoro.usml.resolver.ResolvedSchemas;
import com.gentoro.usml.resolver.TableSchemaResolver;
import com.gentoro.usml.validator.UsmlValidator;
import com.gentoro.usml.validator.ValidationResult;
import com.gentoro.usml.visualizer.GraphModel;
import com.gentoro.usml.visualizer.GraphModelBuilder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UsmlPipelineTest {

  private static UsmlSettings settings(boolean parallel) {
    return new UsmlSettings(List.of("0.1"), parallel, "application/json", "output", 4);
  }

  @Test
  @DisplayName("valid fixtures validate ok relative to their own directory")
  void validatesFixtures() {
    try (UsmlPipeline pipeline = new UsmlPipeline()) {
      ValidationResult result = pipeline.validate(Fixtures.path("users-list.usml.yaml"));
      assertTrue(result.isOk());
      assertTrue(result.diagnostics().isEmpty());
      assertTrue(result.file().endsWith("users-list.usml.yaml"));

      assertTrue(pipeline.validate(Fixtures.path("post-detail.usml.yaml")).isOk());
    }
  }

  @Test
  @DisplayName("parallel and sequential resolution agree")
  void parallelMatchesSequential() {
    UsmlDocument document = new DocumentParser().parse(Fixtures.path("post-detail.usml.yaml"));
    try (UsmlPipeline parallel = new UsmlPipeline(settings(true));
        UsmlPipeline sequential = new UsmlPipeline(settings(false))) {
      ResolvedSchemas a = parallel.resolve(document, Fixtures.dir());
      ResolvedSchemas b = sequential.resolve(document, Fixtures.dir());
      assertEquals(b, a);
    }
  }

  @Test
  @DisplayName("a placeholder error makes the file fail with one diagnostic")
  void reportsValidationErrors(@TempDir Path dir) throws Exception {
    Fixtures.copyTo(dir);
    Path file = dir.resolve("users-list.usml.yaml");
    Files.writeString(
        file, Files.readString(file, StandardCharsets.UTF_8).replace(":status", ":statuz"));

    try (UsmlPipeline pipeline = new UsmlPipeline(settings(false))) {
      ValidationResult result = pipeline.validateReport(file);
      assertEquals(ValidationResult.Status.ERROR, result.status());
      assertEquals(1, result.errors().size());
      assertEquals("filter-condition-params-declared", result.errors().get(0).rule());
    }
  }

  @Test
  @DisplayName("parse failures are reported, not thrown, by validateReport")
  void reportsParseFailure(@TempDir Path dir) throws Exception {
    Path file = Files.writeString(dir.resolve("broken.usml.yaml"), "version: \"0.1\"\nimport: []\n");
    try (UsmlPipeline pipeline = new UsmlPipeline(settings(false))) {
      assertThrows(DocumentParseException.class, () -> pipeline.validate(file));

      ValidationResult result = pipeline.validateReport(file);
      assertFalse(result.isOk());
      assertEquals("parse", result.diagnostics().get(0).rule());
      assertEquals("import", result.diagnostics().get(0).location());
    }
  }

  @Test
  @DisplayName("resolution failures surface from the parallel path unwrapped")
  void reportsResolutionFailure() {
    OpenApiSchemaResolver api = mock(OpenApiSchemaResolver.class);
    when(api.resolve(any(), any())).thenThrow(new ResolutionException("OpenAPI file does not exist"));
    UsmlSettings settings = settings(true);
    try (UsmlPipeline pipeline =
        new UsmlPipeline(
            settings,
            new DocumentParser(settings),
            api,
            new TableSchemaResolver(),
            new UsmlValidator(),
            new GraphModelBuilder(settings))) {
      Path file = Fixtures.path("users-list.usml.yaml");
      ResolutionException thrown =
          assertThrows(ResolutionException.class, () -> pipeline.validate(file));
      assertEquals("OpenAPI file does not exist", thrown.getMessage());

      ValidationResult result = pipeline.validateReport(file);
      assertEquals("resolve", result.diagnostics().get(0).rule());
      assertEquals(ValidationResult.Status.ERROR, result.status());
    }
  }

  @Test
  @DisplayName("run validates and builds the graph from one parse")
  void runsBothStages() {
    try (UsmlPipeline pipeline = new UsmlPipeline(settings(false))) {
      UsmlPipeline.Result result = pipeline.run(Fixtures.path("post-detail.usml.yaml"));
      assertTrue(result.validation().isOk());
      assertEquals("post detail", result.document().usecaseName());
      assertEquals(11, result.graph().allFields().size());

      GraphModel graph = pipeline.buildGraph(Fixtures.path("post-detail.usml.yaml"));
      assertEquals(result.graph(), graph);
    }
  }

  @Test
  @DisplayName("output path follows the configured directory")
  void outputPath() {
    try (UsmlPipeline pipeline = new UsmlPipeline(settings(false))) {
      UsmlDocument list = pipeline.parse(Fixtures.path("users-list.usml.yaml"));
      assertEquals(Path.of("output", "users-list.html"), pipeline.outputPath(list, null));
      assertEquals(Path.of("x.html"), pipeline.outputPath(list, Path.of("x.html")));
    }
  }
}
