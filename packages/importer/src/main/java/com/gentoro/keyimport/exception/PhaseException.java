package com.gentoro.keyimport.exception;

import com.gentoro.keyimport.model.ImportPhase;

/**
 * Raised when an operation is not allowed in the current phase, including rejected phase
 * transitions. The controller state is left exactly as it was before the call.
 */
public class PhaseException extends KeyImportException {
  private final ImportPhase phase;

  public PhaseException(ImportPhase phase, String message) {
    super(KeyImportErrorCode.INVALID_PHASE, message);
    this.phase = phase;
    withContext("phase", phase);
  }

  public PhaseException(KeyImportErrorCode code, ImportPhase phase, String message) {
    super(code, message);
    this.phase = phase;
    withContext("phase", phase);
  }

  public static PhaseException invalidTransition(ImportPhase from, ImportPhase to) {
    PhaseException ex =
        new PhaseException(from, "invalid phase transition from %s to %s".formatted(from, to));
    ex.withContext("target", to);
    return ex;
  }

  public static PhaseException notAllowed(String operation, ImportPhase phase) {
    return new PhaseException(phase, "cannot %s from phase %s".formatted(operation, phase));
  }

  /** Phase the controller was in when the operation was rejected. */
  public ImportPhase getPhase() {
    return phase;
  }
}
