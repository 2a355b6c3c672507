package com.gentoro.keyimport.worker;

/** What the user did when a file failed. */
public enum UserAction {
  NONE,
  SKIP,
  CANCEL
}
