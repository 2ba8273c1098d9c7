package com.gentoro.usml.config;

import java.util.List;
import org.apache.commons.configuration2.Configuration;

/** Typed view over the configuration keys the pipeline stages read. */
public final class UsmlSettings {
  public static final String SUPPORTED_VERSIONS = "parser.supported-versions";
  public static final String RESOLVER_PARALLEL = "resolver.parallel";
  public static final String OPENAPI_MEDIA_TYPE = "resolver.openapi.media-type";
  public static final String OUTPUT_DIR = "visualizer.output-dir";
  public static final String MAX_DEPTH_CLASS = "visualizer.max-depth-class";

  private final List<String> supportedVersions;
  private final boolean parallelResolution;
  private final String preferredMediaType;
  private final String outputDirectory;
  private final int maxDepthClass;

  public UsmlSettings(
      List<String> supportedVersions,
      boolean parallelResolution,
      String preferredMediaType,
      String outputDirectory,
      int maxDepthClass) {
    this.supportedVersions = List.copyOf(supportedVersions);
    this.parallelResolution = parallelResolution;
    this.preferredMediaType = preferredMediaType;
    this.outputDirectory = outputDirectory;
    this.maxDepthClass = Math.max(0, maxDepthClass);
  }

  public static UsmlSettings defaults() {
    return new UsmlSettings(List.of("0.1"), true, "application/json", "output", 4);
  }

  public static UsmlSettings from(Configuration config) {
    UsmlSettings d = defaults();
    List<String> versions = config.getList(String.class, SUPPORTED_VERSIONS, d.supportedVersions);
    return new UsmlSettings(
        versions.isEmpty() ? d.supportedVersions : versions,
        config.getBoolean(RESOLVER_PARALLEL, d.parallelResolution),
        config.getString(OPENAPI_MEDIA_TYPE, d.preferredMediaType),
        config.getString(OUTPUT_DIR, d.outputDirectory),
        config.getInt(MAX_DEPTH_CLASS, d.maxDepthClass));
  }

  public List<String> supportedVersions() {
    return supportedVersions;
  }

  public boolean parallelResolution() {
    return parallelResolution;
  }

  public String preferredMediaType() {
    return preferredMediaType;
  }

  public String outputDirectory() {
    return outputDirectory;
  }

  public int maxDepthClass() {
    return maxDepthClass;
  }
}
