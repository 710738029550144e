package com.tasksmith.execution;

/**
 * Carried by a retry so the execution service can tell the agent what went wrong last time.
 *
 * @param previousError error text of the latest failed run
 * @param retryOrdinal  1 for the first retry
 */
public record RetryContext(String previousError, int retryOrdinal) {

    public static final String UNKNOWN_PREVIOUS_ERROR = "Unknown error from previous attempt.";

    public RetryContext {
        if (previousError == null || previousError.isBlank()) {
            previousError = UNKNOWN_PREVIOUS_ERROR;
        }
    }
}
