package com.gentoro.usml.resolver;

import com.gentoro.usml.ast.ApiReference;
import com.gentoro.usml.exception.ResolutionException;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.media.ComposedSchema;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves an {@link ApiReference} against an OpenAPI 3 description.
 *
 * <p>Each description file is parsed once per resolver instance; subsequent references into the
 * same file reuse the parsed model. Instances are safe for concurrent use.
 */
public class OpenApiSchemaResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.usml.logging.LoggingService.getLogger(OpenApiSchemaResolver.class);

  private static final String COMPONENT_SCHEMA_PREFIX = "#/components/schemas/";
  private static final String COMPONENT_PARAMETER_PREFIX = "#/components/parameters/";

  private final String preferredMediaType;
  private final Map<Path, OpenAPI> cache = new ConcurrentHashMap<>();

  public OpenApiSchemaResolver() {
    this("application/json");
  }

  public OpenApiSchemaResolver(String preferredMediaType) {
    this.preferredMediaType = preferredMediaType;
  }

  /**
   * Resolve {@code reference}; its file path is taken relative to {@code baseDir}.
   *
   * @throws ResolutionException if the file cannot be read, or the path, method or status code is
   *     not declared
   */
  public ResolvedApiSchema resolve(Path baseDir, ApiReference reference) {
    Path file = baseDir.resolve(reference.path()).toAbsolutePath().normalize();
    OpenAPI openAPI = load(file);

    if (openAPI.getPaths() == null || !openAPI.getPaths().containsKey(reference.apiPath())) {
      throw notFound(reference, "path " + reference.apiPath() + " is not declared in " + file);
    }
    PathItem pathItem = openAPI.getPaths().get(reference.apiPath());
    Operation operation =
        pathItem.readOperationsMap().get(PathItem.HttpMethod.valueOf(
            reference.method().toUpperCase(Locale.ROOT)));
    if (operation == null) {
      throw notFound(
          reference,
          "method " + reference.method() + " is not declared for path " + reference.apiPath());
    }
    ApiResponse response =
        operation.getResponses() == null
            ? null
            : operation.getResponses().get(reference.statusCode());
    if (response == null) {
      throw notFound(
          reference,
          "response "
              + reference.statusCode()
              + " is not declared for "
              + reference.method()
              + " "
              + reference.apiPath());
    }

    Map<String, String> fields = new LinkedHashMap<>();
    Schema<?> body = responseSchema(response.getContent());
    if (body != null) {
      collectFields(openAPI, body, fields, new LinkedHashSet<>());
    }
    List<String> parameters = parameterNames(openAPI, pathItem, operation);
    log.debug(
        "Resolved {}: {} response fields, {} parameters", reference, fields.size(), parameters.size());
    return new ResolvedApiSchema(reference, fields, parameters);
  }

  OpenAPI load(Path file) {
    OpenAPI cached = cache.get(file);
    if (cached != null) {
      log.trace("OpenAPI cache hit for {}", file);
      return cached;
    }
    return cache.computeIfAbsent(file, OpenApiSchemaResolver::parse);
  }

  private static OpenAPI parse(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ResolutionException("OpenAPI file does not exist: " + file)
          .withContext("file", file.toString());
    }
    ParseOptions options = new ParseOptions();
    options.setResolve(true);
    options.setResolveFully(true);
    SwaggerParseResult result = new OpenAPIV3Parser().readLocation(file.toString(), null, options);
    if (result == null || result.getOpenAPI() == null) {
      List<String> messages = result == null ? List.of() : result.getMessages();
      throw new ResolutionException(
              "Failed to parse OpenAPI file " + file + (messages == null ? "" : ": " + messages))
          .withContext("file", file.toString());
    }
    if (result.getMessages() != null && !result.getMessages().isEmpty()) {
      log.warn("OpenAPI file {} parsed with messages: {}", file, result.getMessages());
    }
    log.debug("Parsed OpenAPI file {}", file);
    return result.getOpenAPI();
  }

  private Schema<?> responseSchema(Content content) {
    if (content == null || content.isEmpty()) {
      return null;
    }
    MediaType mediaType = content.get(preferredMediaType);
    if (mediaType == null) {
      mediaType = content.values().iterator().next();
    }
    return mediaType.getSchema();
  }

  private void collectFields(
      OpenAPI openAPI, Schema<?> schema, Map<String, String> fields, Set<String> visiting) {
    Schema<?> resolved = deref(openAPI, schema, visiting);
    if (resolved == null) {
      return;
    }
    if (resolved instanceof ComposedSchema composed && composed.getAllOf() != null) {
      for (Schema<?> member : composed.getAllOf()) {
        collectFields(openAPI, member, fields, visiting);
      }
    }
    if ("array".equals(typeOf(resolved)) && resolved.getItems() != null) {
      collectFields(openAPI, resolved.getItems(), fields, visiting);
      return;
    }
    if (resolved.getProperties() != null) {
      for (Map.Entry<String, Schema> property : resolved.getProperties().entrySet()) {
        fields.putIfAbsent(property.getKey(), describe(openAPI, property.getValue()));
      }
    }
  }

  private String describe(OpenAPI openAPI, Schema<?> schema) {
    Schema<?> resolved = deref(openAPI, schema, new LinkedHashSet<>());
    if (resolved == null) {
      return "any";
    }
    String type = typeOf(resolved);
    if ("array".equals(type)) {
      return "array<" + (resolved.getItems() == null ? "any" : describe(openAPI, resolved.getItems())) + ">";
    }
    if (type != null) {
      return type;
    }
    if (resolved.getProperties() != null || resolved instanceof ComposedSchema) {
      return "object";
    }
    return "any";
  }

  /** Follow a local {@code $ref} left in place by the parser; cycles end in null. */
  private static Schema<?> deref(OpenAPI openAPI, Schema<?> schema, Set<String> visiting) {
    Schema<?> current = schema;
    while (current != null && current.get$ref() != null) {
      String ref = current.get$ref();
      if (!visiting.add(ref)
          || !ref.startsWith(COMPONENT_SCHEMA_PREFIX)
          || openAPI.getComponents() == null
          || openAPI.getComponents().getSchemas() == null) {
        return null;
      }
      current = openAPI.getComponents().getSchemas().get(ref.substring(COMPONENT_SCHEMA_PREFIX.length()));
    }
    return current;
  }

  private static String typeOf(Schema<?> schema) {
    if (schema.getType() != null) {
      return schema.getType();
    }
    if (schema.getTypes() != null) {
      return schema.getTypes().stream().filter(t -> !"null".equals(t)).findFirst().orElse(null);
    }
    return null;
  }

  private static List<String> parameterNames(
      OpenAPI openAPI, PathItem pathItem, Operation operation) {
    Set<String> names = new LinkedHashSet<>();
    List<Parameter> declared = new ArrayList<>();
    if (pathItem.getParameters() != null) {
      declared.addAll(pathItem.getParameters());
    }
    if (operation.getParameters() != null) {
      declared.addAll(operation.getParameters());
    }
    for (Parameter parameter : declared) {
      Parameter resolved = parameter;
      if (resolved.getName() == null && resolved.get$ref() != null) {
        resolved = componentParameter(openAPI, resolved.get$ref());
      }
      if (resolved != null && resolved.getName() != null) {
        names.add(resolved.getName());
      }
    }
    return new ArrayList<>(names);
  }

  private static Parameter componentParameter(OpenAPI openAPI, String ref) {
    if (!ref.startsWith(COMPONENT_PARAMETER_PREFIX)
        || openAPI.getComponents() == null
        || openAPI.getComponents().getParameters() == null) {
      return null;
    }
    return openAPI.getComponents().getParameters().get(ref.substring(COMPONENT_PARAMETER_PREFIX.length()));
  }

  private static ResolutionException notFound(ApiReference reference, String message) {
    return (ResolutionException)
        new ResolutionException("Cannot resolve " + reference.format() + ": " + message)
            .withContext("reference", reference.format());
  }
}
