package com.gentoro.keyimport.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One keystore file to decrypt and import.
 *
 * @param keystorePath keystore JSON file
 * @param passwordPath companion {@code .pwd} file; may be null
 * @param manualPassword password supplied up front; may be null, overrides the password file
 * @param walletName name the imported wallet is stored under
 * @param requiresInput whether the password has to be requested interactively
 */
public record ImportJob(
    Path keystorePath,
    Path passwordPath,
    String manualPassword,
    String walletName,
    boolean requiresInput) {

  public ImportJob {
    Objects.requireNonNull(keystorePath, "keystorePath");
  }

  public static ImportJob of(Path keystorePath, String walletName, Path passwordPath) {
    return new ImportJob(keystorePath, passwordPath, null, walletName, passwordPath == null);
  }

  /** Same job, but the password file is ignored and the password is asked for. */
  public ImportJob withManualInput() {
    return new ImportJob(keystorePath, null, null, walletName, true);
  }

  public String fileName() {
    Path name = keystorePath.getFileName();
    return name == null ? keystorePath.toString() : name.toString();
  }

  @Override
  public String toString() {
    return "ImportJob[keystorePath=%s, passwordPath=%s, walletName=%s, requiresInput=%s]"
        .formatted(keystorePath, passwordPath, walletName, requiresInput);
  }
}
