package com.tasksmith.core.queue;

/**
 * How a queue run ended.
 *
 * @param status terminal status
 * @param reason display message
 * @param phases number of phases that were started
 */
public record QueueOutcome(Status status, String reason, int phases) {

    public enum Status {
        /** Every task is completed or skipped. */
        COMPLETED,
        /** A phase failed or the queue hit an infrastructure error. */
        FAILED,
        /** Stopped by the user. */
        ABORTED,
        /** Nothing is runnable although some tasks are not settled. */
        STALLED
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
