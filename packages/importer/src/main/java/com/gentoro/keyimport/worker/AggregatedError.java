package com.gentoro.keyimport.worker;

import java.time.Instant;

/**
 * One failure with the classification used for reporting.
 *
 * @param errorType worker specific error type name, e.g. {@code INCORRECT_PASSWORD}
 * @param recoveryHint short key describing how to recover
 */
public record AggregatedError(
    String file,
    String message,
    String errorType,
    ErrorCategory category,
    boolean recoverable,
    String recoveryHint,
    UserAction userAction,
    Instant timestamp) {}
