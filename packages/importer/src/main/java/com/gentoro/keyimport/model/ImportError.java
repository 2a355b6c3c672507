package com.gentoro.keyimport.model;

/**
 * Error attached to a file during a batch.
 *
 * @param file keystore path as shown to the user
 * @param error underlying failure; may be null for skips without a reason
 * @param skipped true when the user skipped or cancelled, false for real failures
 */
public record ImportError(String file, Throwable error, boolean skipped) {

  public static ImportError from(ImportResult result) {
    return new ImportError(
        result.job().keystorePath().toString(), result.error(), result.skipped());
  }

  public String message() {
    if (error == null) {
      return skipped ? "skipped" : "unknown error";
    }
    return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
  }
}
