package com.gentoro.keyimport.model;

/**
 * Worker asks for a password. Consumed exactly once by the UI side.
 *
 * @param keystoreFile keystore path that needs a password
 * @param attemptCount 1-based attempt number
 * @param errorMessage feedback from the previous attempt; may be null
 * @param retry whether a previous attempt for the same file failed
 */
public record PasswordRequest(
    String keystoreFile, int attemptCount, String errorMessage, boolean retry) {

  public static PasswordRequest firstAttempt(String keystoreFile) {
    return new PasswordRequest(keystoreFile, 1, null, false);
  }
}
