package com.gentoro.keyimport.driver;

import com.gentoro.keyimport.state.PasswordPrompt;
import java.util.concurrent.CompletionStage;

/**
 * Asks the user for a keystore password. Implementations must not block the caller; the answer
 * arrives through the returned stage. A failed stage is treated as a cancellation.
 *
 * <p>The driver cancels the stage's {@link java.util.concurrent.CompletableFuture} when the
 * prompt is no longer wanted, such as after a password timeout or when the batch ends.
 */
@FunctionalInterface
public interface PasswordPrompter {
  CompletionStage<PasswordAnswer> prompt(PasswordPrompt prompt);
}
