package com.gentoro.keyimport.worker;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/** Counters for one batch. */
public record ErrorStatistics(
    int totalOperations,
    int successCount,
    int failureCount,
    int skipCount,
    int totalErrors,
    int recoverableErrors,
    Map<ErrorCategory, Integer> categoryBreakdown,
    Instant startTime,
    Duration elapsedTime) {

  public ErrorStatistics {
    categoryBreakdown = Map.copyOf(categoryBreakdown);
  }

  public double successRate() {
    return rate(successCount);
  }

  public double failureRate() {
    return rate(failureCount);
  }

  public double skipRate() {
    return rate(skipCount);
  }

  /** Category with the most errors; {@link ErrorCategory#SYSTEM} when there are none. */
  public ErrorCategory mostCommonCategory() {
    ErrorCategory mostCommon = ErrorCategory.SYSTEM;
    int max = 0;
    for (Map.Entry<ErrorCategory, Integer> e : categoryBreakdown.entrySet()) {
      if (e.getValue() > max) {
        max = e.getValue();
        mostCommon = e.getKey();
      }
    }
    return mostCommon;
  }

  private double rate(int count) {
    return totalOperations == 0 ? 0.0 : (double) count / totalOperations * 100.0;
  }
}
