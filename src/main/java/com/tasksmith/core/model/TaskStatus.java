package com.tasksmith.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of an individual task within a plan.
 */
public enum TaskStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * A settled task never blocks downstream work.
     */
    public boolean isSettled() {
        return this == COMPLETED || this == SKIPPED;
    }

    public static TaskStatus fromValue(String value) {
        for (TaskStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }
}
