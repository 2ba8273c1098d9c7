package com.gentoro.usml.config;

import com.gentoro.usml.exception.ConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Loads the USML configuration.
 *
 * <p>Defaults come from {@code usml.yaml} on the classpath. An explicit file, when given, is
 * layered on top so that any key it declares wins over the bundled default.
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.usml.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "usml.yaml";

  private final Configuration config;

  /** Bundled defaults only. */
  public ConfigurationProvider() {
    this(null);
  }

  public ConfigurationProvider(Path overrideFile) {
    CompositeConfiguration composite = new CompositeConfiguration();
    if (overrideFile != null) {
      composite.addConfiguration(loadFile(overrideFile));
    }
    composite.addConfiguration(loadClasspath(DEFAULT_RESOURCE));
    this.config = composite;
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration loadFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigException("Configuration file does not exist: " + file);
    }
    log.debug("Loading configuration overrides from {}", file);
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      YAMLConfiguration yaml = new YAMLConfiguration();
      yaml.read(reader);
      return yaml;
    } catch (ConfigurationException | IOException e) {
      throw new ConfigException("Failed to read configuration file: " + file, e);
    }
  }

  private static YAMLConfiguration loadClasspath(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = ConfigurationProvider.class.getClassLoader();
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) {
        log.warn("Default configuration '{}' not found on classpath, using built-in values", resource);
        return yaml;
      }
      try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
        yaml.read(reader);
      }
      return yaml;
    } catch (ConfigurationException | IOException e) {
      throw new ConfigException("Failed to read default configuration: " + resource, e);
    }
  }
}
