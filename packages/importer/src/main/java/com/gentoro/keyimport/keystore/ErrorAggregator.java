package com.gentoro.keyimport.keystore;

import com.gentoro.keyimport.exception.ExceptionUtil;
import com.gentoro.keyimport.worker.AggregatedError;
import com.gentoro.keyimport.worker.ErrorCategory;
import com.gentoro.keyimport.worker.ErrorReport;
import com.gentoro.keyimport.worker.ErrorStatistics;
import com.gentoro.keyimport.worker.RetryRecommendation;
import com.gentoro.keyimport.worker.UserAction;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the outcome of every operation in one batch and turns the failures into an {@link
 * ErrorReport}. Not thread-safe; owned by the batch that created it.
 */
public class ErrorAggregator {
  private final int totalOperations;
  private final Clock clock;
  private final Instant startTime;
  private final List<AggregatedError> errors = new ArrayList<>();
  private int successCount;
  private int failureCount;
  private int skipCount;

  public ErrorAggregator(int totalOperations) {
    this(totalOperations, Clock.systemUTC());
  }

  public ErrorAggregator(int totalOperations, Clock clock) {
    this.totalOperations = totalOperations;
    this.clock = clock;
    this.startTime = clock.instant();
  }

  public void addSuccess() {
    successCount++;
  }

  /** Record a failure. Skips count as skips, everything else as a failure. */
  public void addError(Throwable error, String file, UserAction userAction) {
    if (error == null) {
      return;
    }
    KeystoreErrorType type;
    boolean recoverable;
    String hint;
    ErrorCategory category;
    if (error instanceof KeystoreImportException ex) {
      type = ex.getType();
      category = type.category();
      recoverable = ex.isRecoverable();
      hint = ex.getRecoveryHint();
    } else {
      type = KeystoreErrorType.BATCH_IMPORT_FAILED;
      category = ErrorCategory.SYSTEM;
      recoverable = false;
      hint = "generic_error_recovery";
    }
    AggregatedError aggregated =
        new AggregatedError(
            file,
            ExceptionUtil.extractErrorMessage(error),
            type.name(),
            category,
            recoverable,
            hint,
            userAction,
            clock.instant());
    errors.add(aggregated);

    if (userAction == UserAction.SKIP) {
      skipCount++;
    } else {
      failureCount++;
    }
  }

  public List<AggregatedError> errors() {
    return List.copyOf(errors);
  }

  public Map<ErrorCategory, List<AggregatedError>> errorsByCategory() {
    Map<ErrorCategory, List<AggregatedError>> byCategory = new EnumMap<>(ErrorCategory.class);
    for (AggregatedError error : errors) {
      byCategory.computeIfAbsent(error.category(), k -> new ArrayList<>()).add(error);
    }
    return byCategory;
  }

  public List<AggregatedError> recoverableErrors() {
    return errors.stream().filter(AggregatedError::recoverable).toList();
  }

  public ErrorStatistics statistics() {
    Map<ErrorCategory, Integer> breakdown = new EnumMap<>(ErrorCategory.class);
    int recoverable = 0;
    for (AggregatedError error : errors) {
      breakdown.merge(error.category(), 1, Integer::sum);
      if (error.recoverable()) {
        recoverable++;
      }
    }
    return new ErrorStatistics(
        totalOperations,
        successCount,
        failureCount,
        skipCount,
        errors.size(),
        recoverable,
        breakdown,
        startTime,
        Duration.between(startTime, clock.instant()));
  }

  /** One recommendation per recoverable error type, highest priority first. */
  public List<RetryRecommendation> retryRecommendations() {
    Map<KeystoreErrorType, List<String>> filesByType = new EnumMap<>(KeystoreErrorType.class);
    for (AggregatedError error : recoverableErrors()) {
      filesByType
          .computeIfAbsent(KeystoreErrorType.valueOf(error.errorType()), k -> new ArrayList<>())
          .add(error.file());
    }
    List<RetryRecommendation> recommendations = new ArrayList<>();
    filesByType.forEach(
        (type, files) ->
            recommendations.add(
                new RetryRecommendation(
                    type.name(),
                    files,
                    type.retryPriority(),
                    type.retryStrategy(),
                    type.retryDescription())));
    recommendations.sort(Comparator.comparingInt(RetryRecommendation::priority).reversed());
    return recommendations;
  }

  public ErrorReport generateReport() {
    return new ErrorReport(
        statistics(), errorsByCategory(), retryRecommendations(), clock.instant());
  }
}
