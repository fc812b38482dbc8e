package com.fieldflow.tracker;

import com.fieldflow.tracker.exception.ConfigException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Loads the YAML application configuration. An explicit file wins over the bundled {@code
 * application.yaml}; values may reference environment variables with {@code ${env:NAME}}.
 */
public class ConfigurationProvider {
  static final String BUNDLED_RESOURCE = "/application.yaml";

  private final YAMLConfiguration configuration;

  public ConfigurationProvider(String configFile) {
    this.configuration = new YAMLConfiguration();
    if (configFile != null && !configFile.isBlank()) {
      loadFile(Path.of(configFile.trim()));
    } else {
      loadBundled();
    }
  }

  private void loadFile(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      configuration.read(reader);
    } catch (Exception e) {
      throw new ConfigException("Failed to read configuration file " + path, e);
    }
  }

  private void loadBundled() {
    try (InputStream in = ConfigurationProvider.class.getResourceAsStream(BUNDLED_RESOURCE)) {
      if (in == null) {
        throw new ConfigException("Bundled configuration " + BUNDLED_RESOURCE + " is missing");
      }
      configuration.read(new InputStreamReader(in, StandardCharsets.UTF_8));
    } catch (ConfigException e) {
      throw e;
    } catch (Exception e) {
      throw new ConfigException("Failed to read bundled configuration", e);
    }
  }

  public Configuration config() {
    return configuration;
  }
}
