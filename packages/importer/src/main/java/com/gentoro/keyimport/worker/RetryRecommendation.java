package com.gentoro.keyimport.worker;

import java.util.List;

/**
 * Suggested way to retry a group of failures that share an error type.
 *
 * @param priority higher is more urgent
 * @param strategy strategy key such as {@code manual_password_input}
 * @param description key of the human readable explanation
 */
public record RetryRecommendation(
    String errorType,
    List<String> affectedFiles,
    int priority,
    String strategy,
    String description) {

  public RetryRecommendation {
    affectedFiles = List.copyOf(affectedFiles);
  }
}
