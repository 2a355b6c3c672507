package com.gentoro.keyimport.state;

import com.gentoro.keyimport.model.ImportError;
import com.gentoro.keyimport.model.ImportProgress;
import com.gentoro.keyimport.model.ImportResult;
import com.gentoro.keyimport.model.PasswordRequest;
import com.gentoro.keyimport.policy.RetryPlan;
import java.util.List;

/** Lifecycle events a UI driver reacts to. Rendering them is up to the driver. */
public sealed interface ImportEvent {

  /** The worker returned; carries one result per job. */
  record BatchComplete(List<ImportResult> results) implements ImportEvent {
    public BatchComplete {
      results = List.copyOf(results);
    }
  }

  record ProgressUpdate(ImportProgress progress) implements ImportEvent {}

  record PasswordRequested(PasswordRequest request) implements ImportEvent {}

  /** A listener timed out without data and should be issued again. */
  record ContinueListening(Listener listener) implements ImportEvent {}

  /** The worker closed the progress stream and every snapshot has been read. */
  record ProgressStreamClosed() implements ImportEvent {}

  record ReturnToSelection() implements ImportEvent {}

  record ReturnToMenu() implements ImportEvent {}

  record RetryRequested(RetryPlan plan) implements ImportEvent {}

  record ErrorDetails(List<ImportError> errors) implements ImportEvent {
    public ErrorDetails {
      errors = List.copyOf(errors);
    }
  }

  enum Listener {
    PROGRESS,
    PASSWORD_REQUESTS
  }
}
