package com.gentoro.keyimport.exception;

/** Job creation or validation failed in the batch worker; the worker exception is the cause. */
public class JobPreparationException extends KeyImportException {
  public JobPreparationException(String message, Throwable cause) {
    super(KeyImportErrorCode.JOB_PREPARATION_FAILED, message, cause);
  }
}
