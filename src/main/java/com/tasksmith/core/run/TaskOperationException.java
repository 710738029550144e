package com.tasksmith.core.run;

/**
 * A user-facing task operation (run, retry, skip, cancel) was refused.
 * The message is suitable for direct display.
 */
public class TaskOperationException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        CONFLICT,
        INVALID_STATE
    }

    private final Reason reason;

    public TaskOperationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    public static TaskOperationException planNotFound(String planId) {
        return new TaskOperationException(Reason.NOT_FOUND, "Plan not found: " + planId);
    }

    public static TaskOperationException taskNotFound(String planId, String taskId) {
        return new TaskOperationException(Reason.NOT_FOUND,
                "Task " + taskId + " not found in plan " + planId + ".");
    }
}
