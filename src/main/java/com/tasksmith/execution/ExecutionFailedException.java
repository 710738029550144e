package com.tasksmith.execution;

/**
 * The agent process could not be started or exited with a non-zero code.
 */
public class ExecutionFailedException extends RuntimeException {

    private final int exitCode;

    public ExecutionFailedException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public ExecutionFailedException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    public int exitCode() {
        return exitCode;
    }
}
