package com.gentoro.keyimport.exception;

/** Progress snapshot failed consistency checks. Never propagated past the controller. */
public class ProgressValidationException extends KeyImportException {
  public ProgressValidationException(String message) {
    super(KeyImportErrorCode.INVALID_PROGRESS, message);
  }
}
