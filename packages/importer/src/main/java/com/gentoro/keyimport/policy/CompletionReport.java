package com.gentoro.keyimport.policy;

import com.gentoro.keyimport.model.ImportError;
import com.gentoro.keyimport.model.ImportSummary;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * What the user sees after a batch: the summary, how long it took, and which follow-up actions
 * make sense.
 */
public record CompletionReport(
    ImportSummary summary,
    Instant startTime,
    Duration elapsedTime,
    List<CompletionAction> availableActions) {

  private static final int SHORT_MESSAGE_LENGTH = 60;

  public CompletionReport {
    availableActions = List.copyOf(availableActions);
  }

  public static CompletionReport of(ImportSummary summary, Instant startTime, Instant now) {
    Duration elapsed = startTime == null ? Duration.ZERO : Duration.between(startTime, now);
    return new CompletionReport(summary, startTime, elapsed, actionsFor(summary));
  }

  /** Return-to-menu first, select-different-files last, the rest depending on the outcome. */
  static List<CompletionAction> actionsFor(ImportSummary summary) {
    List<CompletionAction> actions = new ArrayList<>();
    actions.add(CompletionAction.RETURN_TO_MENU);
    if (summary.errors().stream().anyMatch(RetryPolicy::isRetryable)) {
      actions.add(CompletionAction.RETRY_FAILED);
      actions.add(CompletionAction.RETRY_WITH_MANUAL_PASSWORDS);
    }
    if (summary.skippedImports() > 0) {
      actions.add(CompletionAction.RETRY_SKIPPED);
      if (summary.failedImports() > 0) {
        actions.add(CompletionAction.RETRY_ALL);
      }
    }
    if (!summary.errors().isEmpty()) {
      actions.add(CompletionAction.VIEW_ERROR_DETAILS);
    }
    actions.add(CompletionAction.SELECT_DIFFERENT_FILES);
    return actions;
  }

  public boolean isAvailable(CompletionAction action) {
    return availableActions.contains(action);
  }

  public boolean isFullSuccess() {
    return summary.totalFiles() > 0 && summary.successfulImports() == summary.totalFiles();
  }

  public List<String> failedFiles() {
    return summary.failedErrors().stream().map(ImportError::file).toList();
  }

  public List<String> skippedFiles() {
    return summary.skippedErrors().stream().map(ImportError::file).toList();
  }

  public List<String> retryableFiles() {
    return summary.errors().stream()
        .filter(RetryPolicy::isRetryable)
        .map(ImportError::file)
        .toList();
  }

  public List<String> recoverySuggestions(ImportError error) {
    return RetryPolicy.recoverySuggestions(error.error());
  }

  /** Message cut to one display line. */
  public static String shortMessage(ImportError error) {
    String message = error.message();
    if (message.length() > SHORT_MESSAGE_LENGTH) {
      return message.substring(0, SHORT_MESSAGE_LENGTH - 3) + "...";
    }
    return message;
  }
}
