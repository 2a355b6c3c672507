package com.gentoro.keyimport.keystore;

import com.gentoro.keyimport.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/** Resolves the {@link KeystoreImporter} named in configuration through {@link ServiceLoader}. */
public final class KeystoreImporters {
  private static final Logger log =
      com.gentoro.keyimport.logging.LoggingService.getLogger(KeystoreImporters.class);

  private KeystoreImporters() {}

  /**
   * Create the importer with id {@code id}; when {@code id} is blank the only available provider
   * is used.
   *
   * @throws ConfigurationException when no matching provider is available, or the choice is
   *     ambiguous
   */
  public static KeystoreImporter create(String id, Configuration configuration) {
    return create(id, configuration, ServiceLoader.load(KeystoreImporterProvider.class));
  }

  static KeystoreImporter create(
      String id, Configuration configuration, Iterable<KeystoreImporterProvider> providers) {
    List<KeystoreImporterProvider> available = new ArrayList<>();
    for (KeystoreImporterProvider provider : providers) {
      if (provider.isAvailable(configuration)) {
        available.add(provider);
      } else {
        log.debug("Keystore importer '{}' is not available", provider.id());
      }
    }
    List<String> ids = available.stream().map(KeystoreImporterProvider::id).toList();

    KeystoreImporterProvider chosen;
    if (StringUtils.isBlank(id)) {
      if (available.size() != 1) {
        throw new ConfigurationException(
            available.isEmpty()
                ? "No keystore importer is installed; add a KeystoreImporterProvider"
                    + " to the classpath"
                : "Several keystore importers are installed %s; set import.keystore.importer"
                    .formatted(ids));
      }
      chosen = available.get(0);
    } else {
      chosen =
          available.stream()
              .filter(p -> p.id().equalsIgnoreCase(id.trim()))
              .findFirst()
              .orElseThrow(
                  () ->
                      new ConfigurationException(
                          "Keystore importer '%s' not found, available: %s".formatted(id, ids)));
    }
    log.info("Using keystore importer '{}'", chosen.id());
    return chosen.create(configuration);
  }
}
