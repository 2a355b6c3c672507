package com.gentoro.keyimport.policy;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.keyimport.model.ImportError;
import com.gentoro.keyimport.model.ImportJob;
import com.gentoro.keyimport.model.ImportResult;
import com.gentoro.keyimport.model.ImportSummary;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CompletionReportTest {

  private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

  private static ImportJob job(String file) {
    return ImportJob.of(Path.of(file), file, null);
  }

  private static CompletionReport reportFor(ImportResult... results) {
    return CompletionReport.of(
        ImportSummary.fromResults(List.of(results)), START, START.plusSeconds(3));
  }

  @Test
  @DisplayName("A clean batch offers only menu and reselection")
  void fullSuccess() {
    CompletionReport report =
        reportFor(ImportResult.success(job("a.json")), ImportResult.success(job("b.json")));

    assertTrue(report.isFullSuccess());
    assertEquals(Duration.ofSeconds(3), report.elapsedTime());
    assertEquals(
        List.of(CompletionAction.RETURN_TO_MENU, CompletionAction.SELECT_DIFFERENT_FILES),
        report.availableActions());
  }

  @Test
  @DisplayName("Retryable failures and skips unlock the matching actions in order")
  void mixedOutcome() {
    CompletionReport report =
        reportFor(
            ImportResult.success(job("a.json")),
            ImportResult.failure(job("b.json"), new IllegalStateException("incorrect password")),
            ImportResult.skipped(job("c.json"), new IllegalStateException("skipped by user")));

    assertFalse(report.isFullSuccess());
    assertEquals(
        List.of(
            CompletionAction.RETURN_TO_MENU,
            CompletionAction.RETRY_FAILED,
            CompletionAction.RETRY_WITH_MANUAL_PASSWORDS,
            CompletionAction.RETRY_SKIPPED,
            CompletionAction.RETRY_ALL,
            CompletionAction.VIEW_ERROR_DETAILS,
            CompletionAction.SELECT_DIFFERENT_FILES),
        report.availableActions());
    assertEquals(List.of("b.json"), report.failedFiles());
    assertEquals(List.of("c.json"), report.skippedFiles());
    assertEquals(List.of("b.json"), report.retryableFiles());
  }

  @Test
  @DisplayName("Failures that cannot be fixed by retrying only offer error details")
  void unretryableFailure() {
    CompletionReport report =
        reportFor(ImportResult.failure(job("a.json"), new IllegalStateException("corrupted")));

    assertFalse(report.isAvailable(CompletionAction.RETRY_FAILED));
    assertFalse(report.isAvailable(CompletionAction.RETRY_SKIPPED));
    assertFalse(report.isAvailable(CompletionAction.RETRY_ALL));
    assertTrue(report.isAvailable(CompletionAction.VIEW_ERROR_DETAILS));
  }

  @Test
  @DisplayName("Retry all is offered only when failures and skips are both present")
  void retryAllNeedsFailuresAndSkips() {
    CompletionReport onlySkipped =
        reportFor(
            ImportResult.success(job("a.json")),
            ImportResult.skipped(job("b.json"), new IllegalStateException("skipped by user")));
    assertTrue(onlySkipped.isAvailable(CompletionAction.RETRY_SKIPPED));
    assertFalse(onlySkipped.isAvailable(CompletionAction.RETRY_ALL));

    CompletionReport unretryableAndSkipped =
        reportFor(
            ImportResult.failure(job("a.json"), new IllegalStateException("corrupted")),
            ImportResult.skipped(job("b.json"), new IllegalStateException("skipped by user")));
    assertTrue(unretryableAndSkipped.isAvailable(CompletionAction.RETRY_ALL));
    assertFalse(unretryableAndSkipped.isAvailable(CompletionAction.RETRY_FAILED));
  }

  @Test
  @DisplayName("An empty batch is not a success")
  void emptyBatch() {
    CompletionReport report = CompletionReport.of(ImportSummary.empty(), null, Instant.now());

    assertFalse(report.isFullSuccess());
    assertEquals(Duration.ZERO, report.elapsedTime());
  }

  @Test
  @DisplayName("Long messages are shortened to one display line")
  void shortMessage() {
    String longMessage = "x".repeat(80);
    String shortened =
        CompletionReport.shortMessage(
            new ImportError("a.json", new IllegalStateException(longMessage), false));
    assertEquals(60, shortened.length());
    assertTrue(shortened.endsWith("..."));

    assertEquals(
        "skipped", CompletionReport.shortMessage(new ImportError("a.json", null, true)));
  }

  @Test
  @DisplayName("Completion actions map onto retry strategies")
  void actionStrategies() {
    assertEquals(RetryStrategy.RETRY_FAILED, CompletionAction.RETRY_FAILED.retryStrategy());
    assertEquals(
        RetryStrategy.MANUAL_PASSWORDS,
        CompletionAction.RETRY_WITH_MANUAL_PASSWORDS.retryStrategy());
    assertEquals(RetryStrategy.RETRY_SKIPPED, CompletionAction.RETRY_SKIPPED.retryStrategy());
    assertEquals(RetryStrategy.RETRY_ALL, CompletionAction.RETRY_ALL.retryStrategy());
    assertNull(CompletionAction.VIEW_ERROR_DETAILS.retryStrategy());
    assertEquals("Retry skipped files", CompletionAction.RETRY_SKIPPED.toString());
  }
}
