package com.gentoro.keyimport.state;

import com.gentoro.keyimport.model.ImportError;
import com.gentoro.keyimport.model.ImportProgress;

/**
 * Display model of a running batch, derived from accepted snapshots.
 *
 * @param pauseReason set while paused, otherwise null
 * @param lastError most recent error of the batch; may be null
 */
public record ProgressDisplay(
    int totalFiles,
    int processedFiles,
    String currentFile,
    boolean paused,
    String pauseReason,
    ImportError lastError,
    boolean completed) {

  static final String PASSWORD_PAUSE_REASON = "Waiting for password input";

  public static ProgressDisplay reset(int totalFiles) {
    return new ProgressDisplay(totalFiles, 0, "", false, null, null, false);
  }

  public ProgressDisplay apply(ImportProgress progress) {
    return new ProgressDisplay(
        progress.totalFiles(),
        progress.processedFiles(),
        progress.currentFile(),
        progress.pendingPassword(),
        progress.pendingPassword() ? PASSWORD_PAUSE_REASON : null,
        progress.lastError() != null ? progress.lastError() : lastError,
        progress.processedFiles() >= progress.totalFiles());
  }

  public ProgressDisplay complete() {
    return new ProgressDisplay(totalFiles, totalFiles, "", false, null, lastError, true);
  }

  public double percentage() {
    return ImportProgress.percentageOf(processedFiles, totalFiles);
  }
}
