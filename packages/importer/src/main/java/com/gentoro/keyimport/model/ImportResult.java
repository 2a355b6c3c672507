package com.gentoro.keyimport.model;

import java.util.Objects;

/**
 * Outcome of one {@link ImportJob}. Created once by the worker and never changed.
 *
 * @param error failure cause; null on success
 */
public record ImportResult(ImportJob job, boolean success, boolean skipped, Throwable error) {

  public ImportResult {
    Objects.requireNonNull(job, "job");
  }

  public static ImportResult success(ImportJob job) {
    return new ImportResult(job, true, false, null);
  }

  public static ImportResult failure(ImportJob job, Throwable error) {
    return new ImportResult(job, false, false, error);
  }

  public static ImportResult skipped(ImportJob job, Throwable reason) {
    return new ImportResult(job, false, true, reason);
  }

  /** Failed and not skipped by the user. */
  public boolean failed() {
    return !success && !skipped;
  }

  public String errorMessage() {
    if (error == null) {
      return null;
    }
    return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
  }
}
