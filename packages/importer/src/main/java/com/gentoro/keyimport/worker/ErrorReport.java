package com.gentoro.keyimport.worker;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Full error analysis of a batch. */
public record ErrorReport(
    ErrorStatistics statistics,
    Map<ErrorCategory, List<AggregatedError>> errorsByCategory,
    List<RetryRecommendation> retryRecommendations,
    Instant generatedAt) {

  public ErrorReport {
    errorsByCategory = Map.copyOf(errorsByCategory);
    retryRecommendations = List.copyOf(retryRecommendations);
  }

  public boolean hasRecoverableErrors() {
    return statistics.recoverableErrors() > 0;
  }

  public Optional<RetryRecommendation> topRecommendation() {
    return retryRecommendations.stream().findFirst();
  }

  /** Multi-line text block for logs. */
  public String formattedSummary() {
    StringBuilder sb = new StringBuilder();
    sb.append("Total Operations: ").append(statistics.totalOperations()).append('\n');
    sb.append(line("Successful", statistics.successCount(), statistics.successRate()));
    sb.append(line("Failed", statistics.failureCount(), statistics.failureRate()));
    sb.append(line("Skipped", statistics.skipCount(), statistics.skipRate()));
    sb.append("Elapsed Time: ").append(statistics.elapsedTime().toSeconds()).append('s');
    if (statistics.recoverableErrors() > 0) {
      sb.append('\n').append("Recoverable Errors: ").append(statistics.recoverableErrors());
    }
    return sb.toString();
  }

  private static String line(String label, int count, double rate) {
    return String.format(Locale.ROOT, "%s: %d (%.1f%%)\n", label, count, rate);
  }
}
