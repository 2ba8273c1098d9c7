package com.gentoro.usml.ast;

import com.gentoro.usml.exception.DocumentParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Reference into an OpenAPI description.
 *
 * <pre>
 * ApiRef := Path "#" "paths[" Quoted "]" "." Method ["." "responses[" Quoted "]"]
 * </pre>
 *
 * <p>Example: {@code ./api.yaml#paths["/posts/{post_id}"].get.responses["200"]}. A missing
 * {@code responses[...]} segment defaults the status code to {@value #DEFAULT_STATUS}.
 */
public record ApiReference(String path, String apiPath, String method, String statusCode) {
  public static final String DEFAULT_STATUS = "200";

  private static final Set<String> METHODS =
      Set.of("get", "put", "post", "delete", "options", "head", "patch", "trace");

  public ApiReference {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(apiPath, "apiPath");
    Objects.requireNonNull(method, "method");
    method = method.toLowerCase(Locale.ROOT);
    statusCode = statusCode == null ? DEFAULT_STATUS : statusCode;
  }

  /** Parse a reference expression, failing with {@link DocumentParseException} on any other shape. */
  public static ApiReference parse(String expression) {
    ReferenceScanner s = new ReferenceScanner(expression, "API reference");
    String file = s.path();
    s.expect("paths[");
    String apiPath = s.quoted();
    s.expect("].");
    String method = s.identifier().toLowerCase(Locale.ROOT);
    if (!METHODS.contains(method)) {
      throw s.error("unsupported HTTP method '" + method + "'");
    }
    String status = DEFAULT_STATUS;
    if (!s.atEnd()) {
      s.expect(".responses[");
      status = s.quoted();
      s.expect("]");
    }
    s.expectEnd();
    return new ApiReference(file, apiPath, method, status);
  }

  /** Canonical textual form; always spells out the status code. */
  public String format() {
    return path
        + "#paths["
        + ReferenceScanner.quote(apiPath)
        + "]."
        + method
        + ".responses["
        + ReferenceScanner.quote(statusCode)
        + "]";
  }

  @Override
  public String toString() {
    return format();
  }
}
