package com.gentoro.keyimport;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.keyimport.exception.ConfigurationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path dir;

  @Test
  @DisplayName("Bundled application.yaml provides the defaults")
  void classpathDefaults() {
    var config = new ConfigurationProvider(null).config();

    assertEquals(500, config.getInt("import.progress.capacity"));
    assertEquals(3, config.getInt("import.password.max-attempts"));
    assertEquals(300, config.getLong("import.password.input-timeout-seconds"));
    assertEquals("INFO", config.getString("logging.level.root"));
  }

  @Test
  @DisplayName("External file values win over bundled ones")
  void externalOverride() throws Exception {
    Path file = dir.resolve("override.yaml");
    Files.writeString(
        file,
        """
        import:
          password:
            max-attempts: 5
          keystore:
            importer: geth
        """);

    var config = new ConfigurationProvider(file.toString()).config();
    ImportSettings settings = ImportSettings.from(config);

    assertEquals(5, settings.maxPasswordAttempts());
    assertEquals("geth", settings.keystoreImporter());
    assertEquals(500, settings.progressCapacity());
    assertEquals(Duration.ofMinutes(5), settings.passwordInputTimeout());
  }

  @Test
  @DisplayName("A missing external file is a configuration error")
  void missingFile() {
    var ex =
        assertThrows(
            ConfigurationException.class,
            () -> new ConfigurationProvider(dir.resolve("nope.yaml").toString()));
    assertTrue(ex.getMessage().startsWith("Configuration file not found"));
  }

  @Test
  @DisplayName("Malformed YAML is reported with its source")
  void malformedYaml() throws Exception {
    Path file = dir.resolve("broken.yaml");
    Files.writeString(file, "import: [unclosed\n");

    var ex =
        assertThrows(
            ConfigurationException.class, () -> new ConfigurationProvider(file.toString()));
    assertTrue(ex.getMessage().contains("broken.yaml"));
  }

  @Test
  @DisplayName("A missing classpath resource leaves only the external values")
  void missingResource() {
    var config = new ConfigurationProvider("does-not-exist.yaml", null).config();
    assertTrue(config.isEmpty());
  }
}
