package com.gentoro.keyimport;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.keyimport.exception.KeyImportErrorCode;
import com.gentoro.keyimport.exception.KeyImportException;
import com.gentoro.keyimport.model.ImportError;
import com.gentoro.keyimport.model.ImportSummary;
import com.gentoro.keyimport.policy.CompletionAction;
import com.gentoro.keyimport.policy.CompletionReport;
import com.gentoro.keyimport.policy.RetryPolicy;
import com.gentoro.keyimport.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;

/** Writes a {@link CompletionReport} as JSON. */
public class SummaryReportWriter {
  private static final Logger log =
      com.gentoro.keyimport.logging.LoggingService.getLogger(SummaryReportWriter.class);

  public ObjectNode toJson(CompletionReport report) {
    ImportSummary summary = report.summary();
    ObjectNode root = JacksonUtility.getJsonMapper().createObjectNode();
    root.put("totalFiles", summary.totalFiles());
    root.put("successfulImports", summary.successfulImports());
    root.put("failedImports", summary.failedImports());
    root.put("skippedImports", summary.skippedImports());
    if (report.startTime() != null) {
      root.put("startTime", report.startTime().toString());
    }
    root.put("elapsedMillis", report.elapsedTime().toMillis());

    ArrayNode errors = root.putArray("errors");
    for (ImportError error : summary.errors()) {
      ObjectNode node = errors.addObject();
      node.put("file", error.file());
      node.put("message", error.message());
      node.put("skipped", error.skipped());
      node.put("retryable", RetryPolicy.isRetryable(error));
      ArrayNode suggestions = node.putArray("suggestions");
      report.recoverySuggestions(error).forEach(suggestions::add);
    }

    ArrayNode actions = root.putArray("availableActions");
    for (CompletionAction action : report.availableActions()) {
      actions.add(action.name());
    }
    return root;
  }

  public void write(CompletionReport report, Path target) {
    try {
      Path parent = target.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      JacksonUtility.getJsonMapper().writeValue(target.toFile(), toJson(report));
      log.info("Import report written to {}", target);
    } catch (IOException e) {
      throw new KeyImportException(
              KeyImportErrorCode.REPORT_WRITE_FAILED, "Could not write import report: " + target, e)
          .withContext("file", target.toString());
    }
  }
}
