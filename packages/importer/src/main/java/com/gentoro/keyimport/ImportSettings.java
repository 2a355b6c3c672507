package com.gentoro.keyimport;

import com.gentoro.keyimport.exception.ConfigurationException;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Tunables of the import pipeline, read once from configuration and passed to the components
 * that need them.
 */
public record ImportSettings(
    int progressCapacity,
    Duration progressSendTimeout,
    Duration progressPollTimeout,
    Duration passwordPollTimeout,
    int maxPasswordAttempts,
    Duration passwordInputTimeout,
    String keystoreImporter) {

  public ImportSettings {
    if (progressCapacity <= 0) {
      throw new ConfigurationException(
          "import.progress.capacity must be positive, got " + progressCapacity);
    }
    if (maxPasswordAttempts <= 0) {
      throw new ConfigurationException(
          "import.password.max-attempts must be positive, got " + maxPasswordAttempts);
    }
  }

  public static ImportSettings defaults() {
    return new ImportSettings(
        500,
        Duration.ofMillis(500),
        Duration.ofSeconds(1),
        Duration.ofMillis(100),
        3,
        Duration.ofMinutes(5),
        null);
  }

  public static ImportSettings from(Configuration config) {
    ImportSettings d = defaults();
    try {
      return new ImportSettings(
          config.getInt("import.progress.capacity", d.progressCapacity()),
          millis(config, "import.progress.send-timeout-ms", d.progressSendTimeout()),
          millis(config, "import.progress.poll-timeout-ms", d.progressPollTimeout()),
          millis(config, "import.password.poll-timeout-ms", d.passwordPollTimeout()),
          config.getInt("import.password.max-attempts", d.maxPasswordAttempts()),
          Duration.ofSeconds(
              config.getLong(
                  "import.password.input-timeout-seconds", d.passwordInputTimeout().toSeconds())),
          config.getString("import.keystore.importer", d.keystoreImporter()));
    } catch (org.apache.commons.configuration2.ex.ConversionException e) {
      throw new ConfigurationException("Invalid import configuration: " + e.getMessage(), e);
    }
  }

  private static Duration millis(Configuration config, String key, Duration fallback) {
    return Duration.ofMillis(config.getLong(key, fallback.toMillis()));
  }
}
