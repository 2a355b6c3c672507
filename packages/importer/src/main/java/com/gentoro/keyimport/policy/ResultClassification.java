package com.gentoro.keyimport.policy;

import com.gentoro.keyimport.model.ImportResult;
import java.util.List;

/**
 * Results of a batch split by outcome.
 *
 * @param retryable subset of {@code failed} worth retrying
 */
public record ResultClassification(
    List<ImportResult> successful,
    List<ImportResult> failed,
    List<ImportResult> skipped,
    List<ImportResult> retryable) {

  public ResultClassification {
    successful = List.copyOf(successful);
    failed = List.copyOf(failed);
    skipped = List.copyOf(skipped);
    retryable = List.copyOf(retryable);
  }

  public int total() {
    return successful.size() + failed.size() + skipped.size();
  }

  public boolean hasRetryable() {
    return !retryable.isEmpty();
  }
}
