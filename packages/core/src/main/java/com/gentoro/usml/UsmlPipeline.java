package com.gentoro.usml;

import com.gentoro.usml.ast.UsmlDocument;
import com.gentoro.usml.config.ConfigurationProvider;
import com.gentoro.usml.config.UsmlSettings;
import com.gentoro.usml.exception.UsmlException;
import com.gentoro.usml.logging.LoggingService;
import com.gentoro.usml.parser.DocumentParser;
import com.gentoro.usml.resolver.OpenApiSchemaResolver;
import com.gentoro.usml.resolver.ResolvedApiSchema;
import com.gentoro.usml.resolver.ResolvedSchemas;
import com.gentoro.usml.resolver.ResolvedTableSchema;
import com.gentoro.usml.resolver.TableSchemaResolver;
import com.gentoro.usml.validator.AliasScopes;
import com.gentoro.usml.validator.Diagnostic;
import com.gentoro.usml.validator.UsmlValidator;
import com.gentoro.usml.validator.ValidationContext;
import com.gentoro.usml.validator.ValidationResult;
import com.gentoro.usml.visualizer.GraphModel;
import com.gentoro.usml.visualizer.GraphModelBuilder;
import com.gentoro.usml.visualizer.OutputNaming;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point used by front-ends: parse, resolve, then validate or build the graph model.
 *
 * <p>Parse and resolution failures are fatal and surface as {@link UsmlException}s; validation
 * findings are returned as diagnostics. When {@code resolver.parallel} is enabled the API and
 * table resolvers run concurrently. Close the pipeline to release its resolver threads.
 */
public class UsmlPipeline implements AutoCloseable {
  private static final org.slf4j.Logger log = LoggingService.getLogger(UsmlPipeline.class);

  private final UsmlSettings settings;
  private final DocumentParser parser;
  private final OpenApiSchemaResolver apiResolver;
  private final TableSchemaResolver tableResolver;
  private final UsmlValidator validator;
  private final GraphModelBuilder graphBuilder;
  private final ExecutorService executor;

  /** Pipeline configured from the bundled {@code usml.yaml}. */
  public UsmlPipeline() {
    this(new ConfigurationProvider());
  }

  public UsmlPipeline(ConfigurationProvider configurationProvider) {
    this(applyLogging(configurationProvider));
  }

  public UsmlPipeline(UsmlSettings settings) {
    this(
        settings,
        new DocumentParser(settings),
        new OpenApiSchemaResolver(settings.preferredMediaType()),
        new TableSchemaResolver(),
        new UsmlValidator(),
        new GraphModelBuilder(settings));
  }

  UsmlPipeline(
      UsmlSettings settings,
      DocumentParser parser,
      OpenApiSchemaResolver apiResolver,
      TableSchemaResolver tableResolver,
      UsmlValidator validator,
      GraphModelBuilder graphBuilder) {
    this.settings = settings;
    this.parser = parser;
    this.apiResolver = apiResolver;
    this.tableResolver = tableResolver;
    this.validator = validator;
    this.graphBuilder = graphBuilder;
    this.executor = settings.parallelResolution() ? newResolverPool() : null;
  }

  public UsmlSettings settings() {
    return settings;
  }

  public UsmlDocument parse(Path file) {
    return parser.parse(file);
  }

  /**
   * Resolve both imports of {@code document}; relative paths are taken from {@code baseDir}.
   * The first failure is rethrown as is.
   */
  public ResolvedSchemas resolve(UsmlDocument document, Path baseDir) {
    if (executor == null) {
      return new ResolvedSchemas(
          apiResolver.resolve(baseDir, document.importApi()),
          tableResolver.resolve(baseDir, document.importTables()));
    }
    CompletableFuture<ResolvedApiSchema> api =
        CompletableFuture.supplyAsync(
            () -> apiResolver.resolve(baseDir, document.importApi()), executor);
    CompletableFuture<ResolvedTableSchema> tables =
        CompletableFuture.supplyAsync(
            () -> tableResolver.resolve(baseDir, document.importTables()), executor);
    try {
      return new ResolvedSchemas(api.join(), tables.join());
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }

  /** Parse, resolve and validate {@code file}. */
  public ValidationResult validate(Path file) {
    log.debug("Validating {}", file);
    UsmlDocument document = parse(file);
    ResolvedSchemas schemas = resolve(document, baseDir(file));
    List<Diagnostic> diagnostics = validator.validate(document, schemas);
    return ValidationResult.of(file.toString(), diagnostics);
  }

  /**
   * Like {@link #validate(Path)}, but a parse or resolution failure is reported as a failed result
   * instead of being thrown.
   */
  public ValidationResult validateReport(Path file) {
    try {
      return validate(file);
    } catch (UsmlException e) {
      log.debug("Validation of {} stopped: {}", file, e.getMessage());
      return ValidationResult.failure(file.toString(), e);
    }
  }

  /** Parse and resolve {@code file}, then build its graph model without validating. */
  public GraphModel buildGraph(Path file) {
    UsmlDocument document = parse(file);
    ResolvedSchemas schemas = resolve(document, baseDir(file));
    AliasScopes scopes = AliasScopes.build(document);
    return graphBuilder.build(document, schemas, scopes);
  }

  /** Validate and build the graph over one set of alias scopes. */
  public Result run(Path file) {
    UsmlDocument document = parse(file);
    ResolvedSchemas schemas = resolve(document, baseDir(file));
    AliasScopes scopes = AliasScopes.build(document);
    List<Diagnostic> diagnostics =
        validator.validate(new ValidationContext(document, schemas, scopes));
    return new Result(
        document,
        ValidationResult.of(file.toString(), diagnostics),
        graphBuilder.build(document, schemas, scopes));
  }

  /** Where the rendering of {@code document} should go; {@code override} may be null. */
  public Path outputPath(UsmlDocument document, Path override) {
    return OutputNaming.resolve(override, document, Path.of(settings.outputDirectory()));
  }

  @Override
  public void close() {
    if (executor != null) {
      executor.shutdown();
    }
  }

  public record Result(UsmlDocument document, ValidationResult validation, GraphModel graph) {}

  private static Path baseDir(Path file) {
    Path parent = file.toAbsolutePath().getParent();
    return parent == null ? Path.of(".") : parent;
  }

  private static UsmlSettings applyLogging(ConfigurationProvider configurationProvider) {
    LoggingService.applyConfiguration(configurationProvider.config());
    return UsmlSettings.from(configurationProvider.config());
  }

  private static ExecutorService newResolverPool() {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newFixedThreadPool(
        2,
        r -> {
          Thread thread = new Thread(r, "usml-resolver-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
  }
}
