package com.gentoro.keyimport.policy;

/** Choices offered once a batch has finished. */
public enum CompletionAction {
  RETURN_TO_MENU("Return to menu"),
  RETRY_FAILED("Retry failed imports"),
  RETRY_WITH_MANUAL_PASSWORDS("Retry with manual passwords"),
  RETRY_SKIPPED("Retry skipped files"),
  RETRY_ALL("Retry all unsuccessful imports"),
  VIEW_ERROR_DETAILS("View error details"),
  SELECT_DIFFERENT_FILES("Select different files");

  private final String label;

  CompletionAction(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /** Strategy behind a retry action; null for the others. */
  public RetryStrategy retryStrategy() {
    return switch (this) {
      case RETRY_FAILED -> RetryStrategy.RETRY_FAILED;
      case RETRY_WITH_MANUAL_PASSWORDS -> RetryStrategy.MANUAL_PASSWORDS;
      case RETRY_SKIPPED -> RetryStrategy.RETRY_SKIPPED;
      case RETRY_ALL -> RetryStrategy.RETRY_ALL;
      default -> null;
    };
  }

  @Override
  public String toString() {
    return label;
  }
}
