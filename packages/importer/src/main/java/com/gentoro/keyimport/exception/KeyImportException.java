package com.gentoro.keyimport.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Root of the unchecked exception hierarchy used across the import orchestration. */
public class KeyImportException extends RuntimeException {
  private final KeyImportErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public KeyImportException(KeyImportErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public KeyImportException(KeyImportErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public KeyImportErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a diagnostic value; returns {@code this} for chaining at the throw site. */
  public KeyImportException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
