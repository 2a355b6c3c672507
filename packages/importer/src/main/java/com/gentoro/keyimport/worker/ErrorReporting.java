package com.gentoro.keyimport.worker;

import java.util.List;
import java.util.Optional;

/** Detailed error analysis for the most recent batch, offered by some workers. */
public interface ErrorReporting {

  /** Report for the last batch; empty before any batch ran. */
  Optional<ErrorReport> lastErrorReport();

  /** Highest priority first. Empty when nothing is worth retrying. */
  List<RetryRecommendation> retryRecommendations();
}
