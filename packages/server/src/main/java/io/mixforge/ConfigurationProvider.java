package io.mixforge;

import io.mixforge.exception.ConfigException;
import io.mixforge.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;

/**
 * Loads the application configuration. JVM system properties take precedence over the YAML file,
 * which is either the one passed with {@code --config} or the bundled {@code application.yaml}.
 */
public final class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_RESOURCE = "application.yaml";

  private final Configuration config;

  public ConfigurationProvider(String configFile) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (Reader reader = open(configFile)) {
      yaml.read(reader);
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException(
          "Failed to load configuration from "
              + (configFile == null ? "classpath:" + DEFAULT_RESOURCE : configFile),
          e);
    }
    CompositeConfiguration composite = new CompositeConfiguration();
    composite.addConfiguration(new SystemConfiguration());
    composite.addConfiguration(yaml);
    this.config = composite;
  }

  private static Reader open(String configFile) throws IOException {
    if (configFile != null) {
      Path path = Path.of(configFile);
      if (!Files.isRegularFile(path)) {
        throw new ConfigException("Configuration file not found: " + configFile);
      }
      log.info("Loading configuration from {}", path.toAbsolutePath());
      return Files.newBufferedReader(path, StandardCharsets.UTF_8);
    }
    InputStream in =
        ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
    if (in == null) {
      throw new ConfigException("Missing classpath resource " + DEFAULT_RESOURCE);
    }
    return new InputStreamReader(in, StandardCharsets.UTF_8);
  }

  public Configuration config() {
    return config;
  }
}
