package com.gentoro.keyimport.channel;

import com.gentoro.keyimport.model.PasswordResponse;
import java.time.Duration;
import java.util.Optional;

/** Worker-side reader for password responses. */
@FunctionalInterface
public interface PasswordResponseSource {
  /**
   * Blocks until the UI answers or {@code timeout} elapses.
   *
   * @return the response, or empty on timeout
   */
  Optional<PasswordResponse> awaitResponse(Duration timeout) throws InterruptedException;
}
