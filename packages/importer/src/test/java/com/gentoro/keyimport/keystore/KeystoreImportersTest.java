package com.gentoro.keyimport.keystore;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.keyimport.exception.ConfigurationException;
import java.util.List;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class KeystoreImportersTest {

  private final Configuration config = new BaseConfiguration();

  private static KeystoreImporterProvider provider(String id, boolean available) {
    KeystoreImporter importer = Mockito.mock(KeystoreImporter.class);
    return new KeystoreImporterProvider() {
      @Override
      public String id() {
        return id;
      }

      @Override
      public boolean isAvailable(Configuration configuration) {
        return available;
      }

      @Override
      public KeystoreImporter create(Configuration configuration) {
        return importer;
      }

      @Override
      public String toString() {
        return id;
      }
    };
  }

  @Test
  @DisplayName("A blank id picks the only available provider")
  void onlyProvider() {
    var geth = provider("geth", true);
    var offline = provider("offline", false);

    KeystoreImporter importer = KeystoreImporters.create(" ", config, List.of(geth, offline));

    assertSame(geth.create(config), importer);
  }

  @Test
  @DisplayName("A blank id without providers fails")
  void noProvider() {
    var ex =
        assertThrows(
            ConfigurationException.class,
            () -> KeystoreImporters.create("", config, List.of(provider("x", false))));
    assertTrue(ex.getMessage().startsWith("No keystore importer is installed"));
  }

  @Test
  @DisplayName("A blank id with several providers is ambiguous")
  void ambiguous() {
    var ex =
        assertThrows(
            ConfigurationException.class,
            () ->
                KeystoreImporters.create(
                    null, config, List.of(provider("a", true), provider("b", true))));
    assertTrue(ex.getMessage().contains("[a, b]"));
  }

  @Test
  @DisplayName("Providers are matched by id ignoring case")
  void byId() {
    var a = provider("alpha", true);
    var b = provider("beta", true);

    assertSame(b.create(config), KeystoreImporters.create(" BETA ", config, List.of(a, b)));
  }

  @Test
  @DisplayName("Unknown ids list the available providers")
  void unknownId() {
    var ex =
        assertThrows(
            ConfigurationException.class,
            () -> KeystoreImporters.create("gamma", config, List.of(provider("alpha", true))));
    assertEquals("Keystore importer 'gamma' not found, available: [alpha]", ex.getMessage());
  }
}
