package com.gentoro.keyimport.exception;

/** Errors while loading or interpreting configuration. */
public class ConfigurationException extends KeyImportException {
  public ConfigurationException(String message) {
    super(KeyImportErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(KeyImportErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
