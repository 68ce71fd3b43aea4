package com.shelfscan;

import com.shelfscan.exception.ConfigException;
import com.shelfscan.exception.ExceptionUtil;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Loads the YAML application configuration. The location may be a {@code classpath:} resource, a
 * {@code file:} URI or a plain file path.
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.shelfscan.logging.LoggingService.getLogger(ConfigurationProvider.class);

  private final String location;
  private final YAMLConfiguration config;

  public ConfigurationProvider(String location) {
    this.location = location == null ? StartupParameters.DEFAULT_CONFIG_FILE : location;
    this.config = load(this.location);
  }

  public Configuration config() {
    return config;
  }

  public String location() {
    return location;
  }

  private static YAMLConfiguration load(String location) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (InputStream in = open(location);
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      yaml.read(reader);
      log.debug("Loaded configuration from {}", location);
      return yaml;
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new ConfigException("Failed to load configuration from " + location, ex));
    }
  }

  private static InputStream open(String location) throws Exception {
    if (location.startsWith("classpath:")) {
      String resource = location.substring("classpath:".length());
      if (resource.startsWith("/")) {
        resource = resource.substring(1);
      }
      InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource);
      if (in == null) {
        throw new ConfigException("Configuration resource not found on classpath: " + resource);
      }
      return in;
    }
    Path path = location.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
    }
    return Files.newInputStream(path);
  }
}
