package com.tasksmith.core.persistence;

/**
 * Raised when the persistent store cannot complete an operation.
 */
public class PlanStoreException extends RuntimeException {

    public PlanStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
