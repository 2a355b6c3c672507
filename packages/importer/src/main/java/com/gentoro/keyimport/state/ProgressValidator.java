package com.gentoro.keyimport.state;

import com.gentoro.keyimport.exception.ProgressValidationException;
import com.gentoro.keyimport.model.ImportProgress;

/** Consistency checks for incoming progress snapshots. */
public final class ProgressValidator {
  /** Allowed deviation, in percentage points, from the recomputed percentage. */
  public static final double PERCENTAGE_TOLERANCE = 1.0;

  /**
   * @param previous last accepted snapshot; ignored when it has no total yet
   * @throws ProgressValidationException when {@code progress} must not be applied
   */
  public void validate(ImportProgress progress, ImportProgress previous) {
    if (progress == null) {
      throw new ProgressValidationException("progress snapshot is missing");
    }
    int total = progress.totalFiles();
    int processed = progress.processedFiles();
    if (total <= 0) {
      throw new ProgressValidationException("total files must be positive: " + total);
    }
    if (processed < 0) {
      throw new ProgressValidationException("processed files cannot be negative: " + processed);
    }
    if (processed > total) {
      throw new ProgressValidationException(
          "processed files exceeds total: %d > %d".formatted(processed, total));
    }

    double percentage = progress.percentage();
    if (Double.isNaN(percentage) || percentage < 0 || percentage > 100) {
      throw new ProgressValidationException(
          "percentage out of range: %.2f".formatted(percentage));
    }
    double expected = ImportProgress.percentageOf(processed, total);
    if (Math.abs(percentage - expected) > PERCENTAGE_TOLERANCE) {
      throw new ProgressValidationException(
          "percentage inconsistent: %.2f vs expected %.2f".formatted(percentage, expected));
    }

    if (previous != null && previous.totalFiles() > 0) {
      if (total != previous.totalFiles()) {
        throw new ProgressValidationException(
            "total files changed during import: %d -> %d"
                .formatted(previous.totalFiles(), total));
      }
      if (processed < previous.processedFiles() && processed != 0) {
        throw new ProgressValidationException(
            "processed files decreased: %d -> %d"
                .formatted(previous.processedFiles(), processed));
      }
    }
  }
}
