package com.gentoro.keyimport.exception;

/** Stable error codes attached to every {@link KeyImportException}. */
public enum KeyImportErrorCode {
  /** Operation requested from a phase that does not allow it. */
  INVALID_PHASE,
  /** Import started with neither files nor a directory selected. */
  NO_SELECTION,
  /** Job creation or validation by the batch worker failed. */
  JOB_PREPARATION_FAILED,
  /** Handshake response could not be delivered because the worker is not waiting. */
  CHANNEL_UNAVAILABLE,
  /** Progress snapshot rejected by validation. */
  INVALID_PROGRESS,
  /** A single keystore could not be imported. */
  KEYSTORE_IMPORT_FAILED,
  /** Configuration missing or malformed. */
  CONFIGURATION_ERROR,
  /** Summary report could not be written. */
  REPORT_WRITE_FAILED
}
