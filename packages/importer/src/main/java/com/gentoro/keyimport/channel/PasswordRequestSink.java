package com.gentoro.keyimport.channel;

import com.gentoro.keyimport.model.PasswordRequest;

/** Worker-side writer for password requests. */
@FunctionalInterface
public interface PasswordRequestSink {
  /** Non-blocking. Returns false when a previous request has not been consumed yet. */
  boolean offerRequest(PasswordRequest request);
}
