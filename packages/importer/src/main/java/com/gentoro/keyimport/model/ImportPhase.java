package com.gentoro.keyimport.model;

/** Lifecycle stage of a batch import run. */
public enum ImportPhase {
  /** Choosing keystore files or a directory. Initial phase. */
  FILE_SELECTION("File Selection"),
  /** Worker is running through the job list. */
  IMPORTING("Importing"),
  /** Worker is blocked waiting for an interactive password. */
  PASSWORD_INPUT("Password Input"),
  /** Worker returned its results. */
  COMPLETE("Complete"),
  /** Run was abandoned; cleanup callbacks have been executed. */
  CANCELLED("Cancelled");

  private final String displayName;

  ImportPhase(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
