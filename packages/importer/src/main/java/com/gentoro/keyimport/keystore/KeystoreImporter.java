package com.gentoro.keyimport.keystore;

import com.gentoro.keyimport.model.ImportJob;
import java.nio.file.Path;

/**
 * Decrypts keystores and stores the resulting wallets. Everything cryptographic lives behind this
 * interface.
 */
public interface KeystoreImporter {

  /** Whether {@code password} decrypts {@code keystore}. Must not store anything. */
  boolean verifyPassword(Path keystore, String password);

  /**
   * Decrypt {@code job}'s keystore with {@code password} and store it under the job's wallet
   * name.
   *
   * @throws KeystoreImportException on a typed failure such as {@link
   *     KeystoreErrorType#INCORRECT_PASSWORD}; other exceptions are reported as generic failures
   */
  void importKeystore(ImportJob job, String password) throws Exception;
}
