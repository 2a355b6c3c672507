package com.gentoro.keyimport.worker;

/** Coarse grouping of import failures. */
public enum ErrorCategory {
  FILE_SYSTEM,
  VALIDATION,
  PASSWORD,
  USER_ACTION,
  SYSTEM
}
