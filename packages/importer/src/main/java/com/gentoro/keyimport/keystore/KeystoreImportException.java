package com.gentoro.keyimport.keystore;

import com.gentoro.keyimport.exception.KeyImportErrorCode;
import com.gentoro.keyimport.exception.KeyImportException;

/** Failure of a single keystore, typed for classification and retry decisions. */
public class KeystoreImportException extends KeyImportException {
  private final KeystoreErrorType type;
  private final String file;
  private final boolean recoverable;
  private final String recoveryHint;

  public KeystoreImportException(KeystoreErrorType type, String message) {
    this(type, message, null, null);
  }

  public KeystoreImportException(KeystoreErrorType type, String message, String file) {
    this(type, message, file, null);
  }

  public KeystoreImportException(
      KeystoreErrorType type, String message, String file, Throwable cause) {
    this(type, message, file, type.isRecoverable(), type.defaultRecoveryHint(), cause);
  }

  public KeystoreImportException(
      KeystoreErrorType type,
      String message,
      String file,
      boolean recoverable,
      String recoveryHint,
      Throwable cause) {
    super(KeyImportErrorCode.KEYSTORE_IMPORT_FAILED, message, cause);
    this.type = type;
    this.file = file;
    this.recoverable = recoverable;
    this.recoveryHint = recoveryHint;
    withContext("type", type);
    if (file != null) {
      withContext("file", file);
    }
  }

  public KeystoreErrorType getType() {
    return type;
  }

  /** May be null when the failure is not tied to a file. */
  public String getFile() {
    return file;
  }

  public boolean isRecoverable() {
    return recoverable;
  }

  public String getRecoveryHint() {
    return recoveryHint;
  }

  /** Skips and cancellations are user choices, not failures. */
  public boolean isUserAction() {
    return type.isUserActionRelated();
  }
}
