package com.gentoro.usml.validator;

import com.gentoro.usml.ast.Filter;
import com.gentoro.usml.ast.UsmlDocument;
import com.gentoro.usml.resolver.ResolvedApiSchema;
import com.gentoro.usml.resolver.ResolvedSchemas;
import com.gentoro.usml.resolver.ResolvedTableSchema;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** Read-only inputs shared by every {@link ValidationCheck} of one run. */
public final class ValidationContext {
  private final UsmlDocument document;
  private final ResolvedApiSchema api;
  private final ResolvedTableSchema tables;
  private final AliasScopes scopes;

  public ValidationContext(UsmlDocument document, ResolvedSchemas schemas) {
    this(document, schemas, AliasScopes.build(document));
  }

  public ValidationContext(UsmlDocument document, ResolvedSchemas schemas, AliasScopes scopes) {
    this.document = Objects.requireNonNull(document, "document");
    this.api = schemas.api();
    this.tables = schemas.tables();
    this.scopes = Objects.requireNonNull(scopes, "scopes");
  }

  public UsmlDocument document() {
    return document;
  }

  public ResolvedApiSchema api() {
    return api;
  }

  public ResolvedTableSchema tables() {
    return tables;
  }

  public AliasScopes scopes() {
    return scopes;
  }

  /** Names declared by {@code filters[].param}. */
  public Set<String> filterParams() {
    Set<String> params = new LinkedHashSet<>();
    for (Filter filter : document.filters()) {
      params.add(filter.param());
    }
    return params;
  }
}
