package com.tasksmith.core.events;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event types pushed to subscribers after each state transition and queue milestone.
 */
public enum RunEventType {
    STARTED("started"),
    LOG("log"),
    TODO_UPDATE("todo_update"),
    TASK_STATUS("task_status"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled"),
    INFO("info"),
    QUEUE_STARTED("queue_started"),
    PHASE_STARTED("phase_started"),
    TASK_MERGED("task_merged"),
    PHASE_COMPLETED("phase_completed"),
    QUEUE_FINISHED("queue_finished");

    private final String value;

    RunEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static RunEventType fromValue(String value) {
        for (RunEventType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }
}
