package com.gentoro.keyimport.keystore;

import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for pluggable {@link KeystoreImporter} backends.
 *
 * <p>Implementations register through ServiceLoader by listing their fully qualified class name
 * in: META-INF/services/com.gentoro.keyimport.keystore.KeystoreImporterProvider
 */
public interface KeystoreImporterProvider {
  /** Unique id used in configuration ({@code import.keystore.importer}). */
  String id();

  /** Whether the provider can operate in the current runtime. */
  default boolean isAvailable(Configuration configuration) {
    return true;
  }

  KeystoreImporter create(Configuration configuration);
}
