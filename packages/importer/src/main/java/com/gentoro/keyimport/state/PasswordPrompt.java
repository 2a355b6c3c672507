package com.gentoro.keyimport.state;

import com.gentoro.keyimport.model.PasswordRequest;
import org.apache.commons.lang3.StringUtils;

/**
 * Data for the password dialog.
 *
 * @param errorMessage feedback shown above the input on a retry; null otherwise
 */
public record PasswordPrompt(
    String keystoreFile, int attempt, int maxAttempts, String errorMessage) {

  public static PasswordPrompt from(PasswordRequest request, int maxAttempts) {
    String error =
        request.retry() && StringUtils.isNotBlank(request.errorMessage())
            ? request.errorMessage()
            : null;
    return new PasswordPrompt(request.keystoreFile(), request.attemptCount(), maxAttempts, error);
  }

  public boolean isRetry() {
    return errorMessage != null;
  }
}
