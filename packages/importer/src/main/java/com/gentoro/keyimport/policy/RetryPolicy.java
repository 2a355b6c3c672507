package com.gentoro.keyimport.policy;

import com.gentoro.keyimport.exception.ExceptionUtil;
import com.gentoro.keyimport.model.ImportError;
import com.gentoro.keyimport.model.ImportResult;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import org.apache.commons.lang3.StringUtils;

/**
 * Decides which failures of a batch are worth retrying. Classification is by message text so it
 * works for failures from any worker.
 */
public final class RetryPolicy {
  private static final String[] PASSWORD_TERMS = {"password", "incorrect", "invalid", "decrypt"};
  private static final String[] ACCESS_TERMS = {"permission", "access"};
  private static final String[] TIMEOUT_TERMS = {"timeout"};

  private RetryPolicy() {}

  /** Failed, not skipped, and the error looks transient or fixable by the user. */
  public static boolean isRetryable(ImportResult result) {
    if (result == null || result.success() || result.skipped()) {
      return false;
    }
    return isRetryableError(result.error());
  }

  public static boolean isRetryable(ImportError error) {
    return error != null && !error.skipped() && isRetryableError(error.error());
  }

  public static boolean isRetryableError(Throwable error) {
    return error != null && isRetryableMessage(ExceptionUtil.extractErrorMessage(error));
  }

  /** Case-insensitive match on password, permission/access and timeout wording. */
  public static boolean isRetryableMessage(String message) {
    return StringUtils.containsAnyIgnoreCase(message, PASSWORD_TERMS)
        || StringUtils.containsAnyIgnoreCase(message, ACCESS_TERMS)
        || StringUtils.containsAnyIgnoreCase(message, TIMEOUT_TERMS);
  }

  public static boolean isPasswordRelated(Throwable error) {
    return error != null
        && StringUtils.containsAnyIgnoreCase(
            ExceptionUtil.extractErrorMessage(error), PASSWORD_TERMS);
  }

  public static ResultClassification classify(List<ImportResult> results) {
    List<ImportResult> successful = new ArrayList<>();
    List<ImportResult> failed = new ArrayList<>();
    List<ImportResult> skipped = new ArrayList<>();
    List<ImportResult> retryable = new ArrayList<>();
    for (ImportResult result : results) {
      if (result.success()) {
        successful.add(result);
      } else if (result.skipped()) {
        skipped.add(result);
      } else {
        failed.add(result);
        if (isRetryable(result)) {
          retryable.add(result);
        }
      }
    }
    return new ResultClassification(successful, failed, skipped, retryable);
  }

  /**
   * Files to retry for {@code strategy}. {@link RetryStrategy#RETRY_SPECIFIC} needs a path, use
   * {@link #planSpecific(Path)}.
   */
  public static RetryPlan plan(RetryStrategy strategy, List<ImportResult> results) {
    Objects.requireNonNull(strategy, "strategy");
    return switch (strategy) {
      case RETRY_FAILED -> new RetryPlan(strategy, files(results, ImportResult::failed), false);
      case RETRY_SKIPPED -> new RetryPlan(strategy, files(results, ImportResult::skipped), false);
      case RETRY_ALL -> new RetryPlan(strategy, files(results, r -> !r.success()), false);
      case MANUAL_PASSWORDS -> new RetryPlan(strategy, files(results, ImportResult::failed), true);
      case RETRY_SPECIFIC -> throw new IllegalArgumentException(
          "retry_specific needs a file, use planSpecific");
    };
  }

  public static RetryPlan planSpecific(Path file) {
    Objects.requireNonNull(file, "file");
    return new RetryPlan(RetryStrategy.RETRY_SPECIFIC, List.of(file), false);
  }

  /** Hints for the user, most specific first. Never empty. */
  public static List<String> recoverySuggestions(Throwable error) {
    if (error == null) {
      return List.of("Try the operation again");
    }
    String message = ExceptionUtil.extractErrorMessage(error);
    List<String> suggestions = new ArrayList<>();
    if (StringUtils.containsAnyIgnoreCase(message, "password", "decrypt")) {
      suggestions.add("Verify the password is correct");
      suggestions.add("Check if a .pwd file exists with the correct password");
      suggestions.add("Try entering the password manually");
    }
    if (StringUtils.containsAnyIgnoreCase(message, ACCESS_TERMS)) {
      suggestions.add("Check file permissions");
      suggestions.add("Ensure the file is not locked by another process");
    }
    if (StringUtils.containsIgnoreCase(message, "not found")) {
      suggestions.add("Verify the file path is correct");
      suggestions.add("Ensure the file exists and is accessible");
    }
    if (StringUtils.containsAnyIgnoreCase(message, "format", "invalid")) {
      suggestions.add("Verify the file is a valid KeyStore V3 format");
      suggestions.add("Check if the file is corrupted");
    }
    if (suggestions.isEmpty()) {
      suggestions.add("Review the error message and try again");
    }
    return suggestions;
  }

  /** Why a skipped file was skipped, for display. */
  public static String skipReason(Throwable error) {
    if (error == null) {
      return "User chose to skip";
    }
    String message = ExceptionUtil.extractErrorMessage(error);
    if (StringUtils.containsIgnoreCase(message, "cancelled")) {
      return "User cancelled password input";
    }
    if (StringUtils.containsIgnoreCase(message, "skipped")) {
      return "User chose to skip this file";
    }
    if (StringUtils.containsIgnoreCase(message, "timeout")) {
      return "Password input timed out";
    }
    return "User action required";
  }

  private static List<Path> files(List<ImportResult> results, Predicate<ImportResult> filter) {
    if (results == null) {
      return List.of();
    }
    return results.stream().filter(filter).map(r -> r.job().keystorePath()).toList();
  }
}
