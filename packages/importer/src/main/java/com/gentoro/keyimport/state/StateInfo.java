package com.gentoro.keyimport.state;

import com.gentoro.keyimport.model.ImportPhase;

/** Diagnostic snapshot of the controller, for logging and tests. */
public record StateInfo(
    ImportPhase phase,
    int selectedFiles,
    String selectedDir,
    int importJobs,
    int results,
    boolean showingPopup,
    boolean pendingPassword,
    boolean completed,
    boolean cancelled,
    String errorMessage) {

  @Override
  public String toString() {
    return ("Phase: %s, Files: %d, Dir: %s, Jobs: %d, Results: %d, Popup: %s, Pending: %s,"
            + " Complete: %s, Cancelled: %s")
        .formatted(
            phase,
            selectedFiles,
            selectedDir == null ? "" : selectedDir,
            importJobs,
            results,
            showingPopup,
            pendingPassword,
            completed,
            cancelled);
  }
}
