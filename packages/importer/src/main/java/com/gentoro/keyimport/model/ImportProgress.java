package com.gentoro.keyimport.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Point-in-time view of a running batch. Each snapshot supersedes the previous one.
 *
 * @param currentFile file name being processed; empty between files
 * @param totalFiles number of jobs in the batch
 * @param processedFiles jobs finished so far
 * @param percentage completion in {@code [0, 100]}
 * @param errors failures and skips accumulated so far
 * @param pendingPassword whether the worker is blocked on a password handshake
 * @param pendingFile file waiting for a password; empty when none
 * @param startTime batch start
 * @param elapsedTime time since {@code startTime}
 */
public record ImportProgress(
    String currentFile,
    int totalFiles,
    int processedFiles,
    double percentage,
    List<ImportError> errors,
    boolean pendingPassword,
    String pendingFile,
    Instant startTime,
    Duration elapsedTime) {

  public ImportProgress {
    currentFile = currentFile == null ? "" : currentFile;
    pendingFile = pendingFile == null ? "" : pendingFile;
    errors = errors == null ? List.of() : List.copyOf(errors);
    elapsedTime = elapsedTime == null ? Duration.ZERO : elapsedTime;
  }

  /** Snapshot with nothing processed yet. */
  public static ImportProgress initial(int totalFiles, Instant startTime) {
    return new ImportProgress(
        "", totalFiles, 0, 0.0, List.of(), false, "", startTime, Duration.ZERO);
  }

  /** Placeholder used before any batch has started; fails validation on purpose. */
  public static ImportProgress none() {
    return new ImportProgress("", 0, 0, 0.0, List.of(), false, "", null, Duration.ZERO);
  }

  public static double percentageOf(int processed, int total) {
    if (total <= 0) {
      return 0.0;
    }
    if (processed == total) {
      return 100.0;
    }
    return (double) processed / (double) total * 100.0;
  }

  /** Snapshot announcing that {@code file} is now being processed. */
  public ImportProgress processing(String file, int processed, Duration elapsed) {
    return new ImportProgress(
        file,
        totalFiles,
        processed,
        percentageOf(processed, totalFiles),
        errors,
        pendingPassword,
        pendingFile,
        startTime,
        elapsed);
  }

  public ImportProgress awaitingPassword(String file, Duration elapsed) {
    return new ImportProgress(
        currentFile,
        totalFiles,
        processedFiles,
        percentage,
        errors,
        true,
        file,
        startTime,
        elapsed);
  }

  public ImportProgress passwordResolved(Duration elapsed) {
    return new ImportProgress(
        currentFile, totalFiles, processedFiles, percentage, errors, false, "", startTime, elapsed);
  }

  public ImportProgress withError(ImportError error) {
    List<ImportError> next = new ArrayList<>(errors);
    next.add(error);
    return new ImportProgress(
        currentFile,
        totalFiles,
        processedFiles,
        percentage,
        next,
        pendingPassword,
        pendingFile,
        startTime,
        elapsedTime);
  }

  /** Final snapshot: everything processed, nothing pending. */
  public ImportProgress finished(Duration elapsed) {
    return new ImportProgress(
        "", totalFiles, totalFiles, 100.0, errors, false, "", startTime, elapsed);
  }

  public boolean isFinished() {
    return totalFiles > 0 && processedFiles >= totalFiles;
  }

  public ImportError lastError() {
    return errors.isEmpty() ? null : errors.get(errors.size() - 1);
  }
}
