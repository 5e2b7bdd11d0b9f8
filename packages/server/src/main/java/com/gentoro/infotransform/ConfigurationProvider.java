package com.gentoro.infotransform;

import com.gentoro.infotransform.exception.ConfigException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.io.FileHandler;

/**
 * Loads the YAML application configuration, either from an explicit file or from {@code
 * application.yaml} on the classpath. Values support {@code ${env:NAME}} interpolation.
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_RESOURCE = "application.yaml";

  private final YAMLConfiguration config = new YAMLConfiguration();

  public ConfigurationProvider(String configFile) {
    FileHandler handler = new FileHandler(config);
    try {
      if (configFile != null) {
        Path path = Path.of(configFile);
        if (!Files.isRegularFile(path)) {
          throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
        }
        handler.load(path.toFile());
        log.info("Loaded configuration from {}", path.toAbsolutePath());
      } else {
        try (InputStream in =
            ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
          if (in == null) {
            throw new ConfigException("Missing classpath resource " + DEFAULT_RESOURCE);
          }
          handler.load(in);
        }
        log.info("Loaded bundled configuration {}", DEFAULT_RESOURCE);
      }
    } catch (ConfigException e) {
      throw e;
    } catch (Exception e) {
      throw new ConfigException("Failed to load configuration", e);
    }
  }

  public Configuration config() {
    return config;
  }
}
