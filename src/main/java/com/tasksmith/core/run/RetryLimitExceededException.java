package com.tasksmith.core.run;

/**
 * Raised when a retry would exceed the configured maximum number of attempts.
 */
public class RetryLimitExceededException extends TaskOperationException {

    private final int maxRetries;

    public RetryLimitExceededException(String taskId, int maxRetries) {
        super(Reason.INVALID_STATE, "Task " + taskId + " has reached the maximum retry limit (" + maxRetries
                + "). Consider skipping this task or adjusting the approach manually.");
        this.maxRetries = maxRetries;
    }

    public int maxRetries() {
        return maxRetries;
    }
}
