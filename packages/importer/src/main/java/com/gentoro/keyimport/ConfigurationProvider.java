package com.gentoro.keyimport;

import com.gentoro.keyimport.exception.ConfigurationException;
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
import org.apache.commons.configuration2.ex.ConfigurationRuntimeException;
import org.slf4j.Logger;

/**
 * Loads {@code application.yaml} from the classpath and, when given, an external YAML file whose
 * keys take precedence.
 */
public class ConfigurationProvider {
  private static final Logger log =
      com.gentoro.keyimport.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "application.yaml";

  private final Configuration config;

  public ConfigurationProvider(String externalFile) {
    this(DEFAULT_RESOURCE, externalFile);
  }

  ConfigurationProvider(String resource, String externalFile) {
    CompositeConfiguration composite = new CompositeConfiguration();
    if (externalFile != null) {
      Path path = Path.of(externalFile);
      if (!Files.isRegularFile(path)) {
        throw new ConfigurationException("Configuration file not found: " + path);
      }
      try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        composite.addConfiguration(read(reader, path.toString()));
      } catch (IOException e) {
        throw new ConfigurationException("Could not read configuration file " + path, e);
      }
      log.info("Loaded configuration overrides from {}", path);
    }

    try (InputStream in =
        ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        log.warn("No {} on the classpath, using built-in defaults", resource);
      } else {
        composite.addConfiguration(
            read(new InputStreamReader(in, StandardCharsets.UTF_8), resource));
      }
    } catch (IOException e) {
      throw new ConfigurationException("Could not read classpath resource " + resource, e);
    }
    this.config = composite;
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration read(Reader reader, String source) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (org.apache.commons.configuration2.ex.ConfigurationException
        | ConfigurationRuntimeException e) {
      throw new ConfigurationException("Malformed YAML in " + source + ": " + e.getMessage(), e);
    }
    return yaml;
  }
}
