package com.gentoro.keyimport.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate counts for a result list. Always derived, see {@link #fromResults(List)}.
 *
 * @param errors one entry per non-successful result, skipped ones flagged
 */
public record ImportSummary(
    int totalFiles,
    int successfulImports,
    int failedImports,
    int skippedImports,
    List<ImportError> errors) {

  public ImportSummary {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static ImportSummary empty() {
    return new ImportSummary(0, 0, 0, 0, List.of());
  }

  public static ImportSummary fromResults(List<ImportResult> results) {
    if (results == null || results.isEmpty()) {
      return empty();
    }
    int success = 0;
    int failed = 0;
    int skipped = 0;
    List<ImportError> errors = new ArrayList<>();
    for (ImportResult result : results) {
      if (result.success()) {
        success++;
      } else if (result.skipped()) {
        skipped++;
        errors.add(ImportError.from(result));
      } else {
        failed++;
        errors.add(ImportError.from(result));
      }
    }
    return new ImportSummary(results.size(), success, failed, skipped, errors);
  }

  public List<ImportError> failedErrors() {
    return errors.stream().filter(e -> !e.skipped()).toList();
  }

  public List<ImportError> skippedErrors() {
    return errors.stream().filter(ImportError::skipped).toList();
  }
}
