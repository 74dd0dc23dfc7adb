package com.m4brew;

import com.m4brew.exception.ConfigException;
import com.m4brew.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;

/**
 * Loads {@code application.yaml} either from an explicit path or from the classpath. Command line
 * overrides ({@code --http.port=9090}) are applied on top.
 */
public final class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);
  static final String DEFAULT_RESOURCE = "application.yaml";

  private final YAMLConfiguration config;

  public ConfigurationProvider(String configFile) {
    this(configFile, Map.of());
  }

  public ConfigurationProvider(String configFile, Map<String, String> overrides) {
    this.config = new YAMLConfiguration();
    try {
      if (configFile != null && !configFile.isBlank()) {
        Path path = Path.of(configFile);
        if (!Files.isRegularFile(path)) {
          throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
        }
        log.info("Loading configuration from {}", path.toAbsolutePath());
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
          config.read(reader);
        }
      } else {
        try (InputStream in =
            ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
          if (in == null) {
            throw new ConfigException("Missing classpath resource " + DEFAULT_RESOURCE);
          }
          log.debug("Loading bundled {}", DEFAULT_RESOURCE);
          config.read(in);
        }
      }
    } catch (ConfigException e) {
      throw e;
    } catch (ConfigurationException | IOException e) {
      throw new ConfigException("Failed to load configuration", e);
    }
    overrides.forEach(config::setProperty);
  }

  public Configuration config() {
    return config;
  }
}
