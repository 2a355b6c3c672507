package com.gentoro.keyimport.policy;

import java.util.Arrays;

/** Which files of a finished batch to run again. */
public enum RetryStrategy {
  RETRY_FAILED("retry_failed"),
  RETRY_SKIPPED("retry_skipped"),
  RETRY_ALL("retry_all"),
  /** Same files as {@link #RETRY_FAILED}, but every password is asked for interactively. */
  MANUAL_PASSWORDS("manual_passwords"),
  RETRY_SPECIFIC("retry_specific");

  private final String key;

  RetryStrategy(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  public static RetryStrategy fromKey(String key) {
    return Arrays.stream(values())
        .filter(s -> s.key.equalsIgnoreCase(key))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown retry strategy: " + key));
  }
}
