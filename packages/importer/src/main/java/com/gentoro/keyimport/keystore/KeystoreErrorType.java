package com.gentoro.keyimport.keystore;

import com.gentoro.keyimport.worker.ErrorCategory;

/** Failure kinds of the keystore worker, with their reporting metadata. */
public enum KeystoreErrorType {
  FILE_NOT_FOUND,
  INVALID_JSON,
  INVALID_KEYSTORE,
  INVALID_VERSION,
  MISSING_REQUIRED_FIELDS,
  INVALID_ADDRESS,
  INCORRECT_PASSWORD,
  CORRUPTED_FILE,
  PASSWORD_FILE_NOT_FOUND,
  PASSWORD_FILE_UNREADABLE,
  PASSWORD_FILE_EMPTY,
  PASSWORD_FILE_INVALID,
  PASSWORD_FILE_OVERSIZED,
  PASSWORD_FILE_CORRUPTED,
  BATCH_IMPORT_FAILED,
  IMPORT_JOB_VALIDATION_FAILED,
  DIRECTORY_SCAN_FAILED,
  PASSWORD_INPUT_TIMEOUT,
  PASSWORD_INPUT_CANCELLED,
  PASSWORD_INPUT_SKIPPED,
  PASSWORD_INPUT_INVALID,
  MAX_PASSWORD_ATTEMPTS_EXCEEDED;

  public boolean isPasswordRelated() {
    return switch (this) {
      case INCORRECT_PASSWORD,
          PASSWORD_FILE_NOT_FOUND,
          PASSWORD_FILE_UNREADABLE,
          PASSWORD_FILE_EMPTY,
          PASSWORD_FILE_INVALID,
          PASSWORD_FILE_OVERSIZED,
          PASSWORD_FILE_CORRUPTED,
          PASSWORD_INPUT_TIMEOUT,
          PASSWORD_INPUT_CANCELLED,
          PASSWORD_INPUT_SKIPPED,
          PASSWORD_INPUT_INVALID,
          MAX_PASSWORD_ATTEMPTS_EXCEEDED -> true;
      default -> false;
    };
  }

  public boolean isFileSystemRelated() {
    return switch (this) {
      case FILE_NOT_FOUND,
          CORRUPTED_FILE,
          PASSWORD_FILE_NOT_FOUND,
          PASSWORD_FILE_UNREADABLE,
          PASSWORD_FILE_OVERSIZED,
          DIRECTORY_SCAN_FAILED -> true;
      default -> false;
    };
  }

  public boolean isValidationRelated() {
    return switch (this) {
      case INVALID_JSON,
          INVALID_KEYSTORE,
          INVALID_VERSION,
          MISSING_REQUIRED_FIELDS,
          INVALID_ADDRESS,
          PASSWORD_FILE_INVALID,
          IMPORT_JOB_VALIDATION_FAILED -> true;
      default -> false;
    };
  }

  public boolean isUserActionRelated() {
    return this == PASSWORD_INPUT_CANCELLED || this == PASSWORD_INPUT_SKIPPED;
  }

  /** User actions win over password, which wins over file-system and validation. */
  public ErrorCategory category() {
    if (isUserActionRelated()) return ErrorCategory.USER_ACTION;
    if (isPasswordRelated()) return ErrorCategory.PASSWORD;
    if (isFileSystemRelated()) return ErrorCategory.FILE_SYSTEM;
    if (isValidationRelated()) return ErrorCategory.VALIDATION;
    return ErrorCategory.SYSTEM;
  }

  /** Whether another attempt (with different input or after fixing the file) can succeed. */
  public boolean isRecoverable() {
    return switch (this) {
      case INCORRECT_PASSWORD,
          PASSWORD_FILE_NOT_FOUND,
          PASSWORD_FILE_UNREADABLE,
          PASSWORD_FILE_EMPTY,
          PASSWORD_INPUT_TIMEOUT,
          PASSWORD_INPUT_CANCELLED,
          PASSWORD_INPUT_SKIPPED,
          PASSWORD_INPUT_INVALID,
          FILE_NOT_FOUND,
          DIRECTORY_SCAN_FAILED,
          IMPORT_JOB_VALIDATION_FAILED,
          BATCH_IMPORT_FAILED -> true;
      default -> false;
    };
  }

  public int retryPriority() {
    return switch (this) {
      case PASSWORD_FILE_NOT_FOUND, PASSWORD_INPUT_TIMEOUT -> 10;
      case FILE_NOT_FOUND, DIRECTORY_SCAN_FAILED -> 8;
      case INCORRECT_PASSWORD, PASSWORD_INPUT_CANCELLED -> 7;
      case PASSWORD_FILE_UNREADABLE, PASSWORD_FILE_EMPTY -> 6;
      case IMPORT_JOB_VALIDATION_FAILED -> 5;
      default -> 1;
    };
  }

  public String retryStrategy() {
    return switch (this) {
      case PASSWORD_FILE_NOT_FOUND, PASSWORD_INPUT_TIMEOUT -> "manual_password_input";
      case FILE_NOT_FOUND -> "reselect_files";
      case DIRECTORY_SCAN_FAILED -> "reselect_directory";
      case INCORRECT_PASSWORD -> "correct_password";
      case PASSWORD_FILE_UNREADABLE -> "fix_file_permissions";
      case PASSWORD_FILE_EMPTY -> "provide_password_file_content";
      default -> "manual_review";
    };
  }

  public String retryDescription() {
    return switch (this) {
      case PASSWORD_FILE_NOT_FOUND,
          PASSWORD_INPUT_TIMEOUT,
          FILE_NOT_FOUND,
          DIRECTORY_SCAN_FAILED,
          INCORRECT_PASSWORD,
          PASSWORD_FILE_UNREADABLE,
          PASSWORD_FILE_EMPTY -> "retry_description_" + name().toLowerCase();
      default -> "retry_description_generic";
    };
  }

  public String defaultRecoveryHint() {
    return name().toLowerCase() + "_recovery";
  }
}
