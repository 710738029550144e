package com.tasksmith.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a plan.
 */
public enum PlanStatus {
    DRAFT("draft"),
    READY("ready"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    PlanStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static PlanStatus fromValue(String value) {
        for (PlanStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown plan status: " + value);
    }
}
