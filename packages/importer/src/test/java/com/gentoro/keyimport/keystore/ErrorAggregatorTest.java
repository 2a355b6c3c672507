package com.gentoro.keyimport.keystore;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.keyimport.worker.AggregatedError;
import com.gentoro.keyimport.worker.ErrorCategory;
import com.gentoro.keyimport.worker.ErrorReport;
import com.gentoro.keyimport.worker.RetryRecommendation;
import com.gentoro.keyimport.worker.UserAction;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ErrorAggregatorTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-01-01T10:00:00Z"), ZoneOffset.UTC);

  private static KeystoreImportException error(KeystoreErrorType type) {
    return new KeystoreImportException(type, type.name().toLowerCase());
  }

  @Test
  @DisplayName("Counts successes, failures and skips separately")
  void counts() {
    var aggregator = new ErrorAggregator(4, CLOCK);
    aggregator.addSuccess();
    aggregator.addError(error(KeystoreErrorType.INCORRECT_PASSWORD), "a.json", UserAction.NONE);
    aggregator.addError(
        error(KeystoreErrorType.PASSWORD_INPUT_SKIPPED), "b.json", UserAction.SKIP);
    aggregator.addError(error(KeystoreErrorType.INVALID_JSON), "c.json", UserAction.NONE);

    var stats = aggregator.statistics();
    assertEquals(4, stats.totalOperations());
    assertEquals(1, stats.successCount());
    assertEquals(2, stats.failureCount());
    assertEquals(1, stats.skipCount());
    assertEquals(3, stats.totalErrors());
    assertEquals(2, stats.recoverableErrors());
    assertEquals(25.0, stats.successRate());
    assertEquals(50.0, stats.failureRate());
  }

  @Test
  @DisplayName("A null error is ignored")
  void nullError() {
    var aggregator = new ErrorAggregator(1, CLOCK);
    aggregator.addError(null, "a.json", UserAction.NONE);
    assertTrue(aggregator.errors().isEmpty());
    assertEquals(0, aggregator.statistics().failureCount());
  }

  @Test
  @DisplayName("Errors are grouped by category, user actions first")
  void categories() {
    var aggregator = new ErrorAggregator(4, CLOCK);
    aggregator.addError(
        error(KeystoreErrorType.PASSWORD_INPUT_CANCELLED), "a.json", UserAction.SKIP);
    aggregator.addError(error(KeystoreErrorType.PASSWORD_FILE_EMPTY), "b.json", UserAction.NONE);
    aggregator.addError(error(KeystoreErrorType.DIRECTORY_SCAN_FAILED), "dir", UserAction.NONE);
    aggregator.addError(error(KeystoreErrorType.INVALID_VERSION), "d.json", UserAction.NONE);

    var byCategory = aggregator.errorsByCategory();
    assertEquals("a.json", byCategory.get(ErrorCategory.USER_ACTION).get(0).file());
    assertEquals("b.json", byCategory.get(ErrorCategory.PASSWORD).get(0).file());
    assertEquals("dir", byCategory.get(ErrorCategory.FILE_SYSTEM).get(0).file());
    assertEquals("d.json", byCategory.get(ErrorCategory.VALIDATION).get(0).file());
  }

  @Test
  @DisplayName("Foreign exceptions become unrecoverable system errors")
  void foreignException() {
    var aggregator = new ErrorAggregator(1, CLOCK);
    aggregator.addError(new IllegalStateException("boom"), "a.json", UserAction.NONE);

    AggregatedError aggregated = aggregator.errors().get(0);
    assertEquals("BATCH_IMPORT_FAILED", aggregated.errorType());
    assertEquals(ErrorCategory.SYSTEM, aggregated.category());
    assertFalse(aggregated.recoverable());
    assertEquals("generic_error_recovery", aggregated.recoveryHint());
    assertEquals("boom", aggregated.message());
    assertEquals(CLOCK.instant(), aggregated.timestamp());
    assertTrue(aggregator.retryRecommendations().isEmpty());
  }

  @Test
  @DisplayName("Recommendations group files per type and sort by priority")
  void recommendations() {
    var aggregator = new ErrorAggregator(4, CLOCK);
    aggregator.addError(error(KeystoreErrorType.INCORRECT_PASSWORD), "a.json", UserAction.NONE);
    aggregator.addError(
        error(KeystoreErrorType.PASSWORD_FILE_NOT_FOUND), "b.json", UserAction.NONE);
    aggregator.addError(error(KeystoreErrorType.INCORRECT_PASSWORD), "c.json", UserAction.NONE);
    aggregator.addError(error(KeystoreErrorType.CORRUPTED_FILE), "d.json", UserAction.NONE);

    List<RetryRecommendation> recommendations = aggregator.retryRecommendations();
    assertEquals(2, recommendations.size());

    RetryRecommendation first = recommendations.get(0);
    assertEquals("PASSWORD_FILE_NOT_FOUND", first.errorType());
    assertEquals(10, first.priority());
    assertEquals("manual_password_input", first.strategy());

    RetryRecommendation second = recommendations.get(1);
    assertEquals("INCORRECT_PASSWORD", second.errorType());
    assertEquals(List.of("a.json", "c.json"), second.affectedFiles());
    assertEquals("correct_password", second.strategy());
    assertEquals("retry_description_incorrect_password", second.description());
  }

  @Test
  @DisplayName("Report bundles statistics, categories and recommendations")
  void report() {
    var aggregator = new ErrorAggregator(2, CLOCK);
    aggregator.addSuccess();
    aggregator.addError(
        error(KeystoreErrorType.PASSWORD_INPUT_TIMEOUT), "a.json", UserAction.NONE);

    ErrorReport report = aggregator.generateReport();
    assertTrue(report.hasRecoverableErrors());
    assertEquals("PASSWORD_INPUT_TIMEOUT", report.topRecommendation().orElseThrow().errorType());
    assertEquals(CLOCK.instant(), report.generatedAt());
    String summary = report.formattedSummary();
    assertTrue(summary.contains("Total Operations: 2"));
    assertTrue(summary.contains("Successful: 1 (50.0%)"));
    assertTrue(summary.contains("Recoverable Errors: 1"));
  }
}
