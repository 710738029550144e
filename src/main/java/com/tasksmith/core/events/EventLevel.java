package com.tasksmith.core.events;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventLevel {
    INFO("info"),
    ERROR("error");

    private final String value;

    EventLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static EventLevel fromValue(String value) {
        return "error".equals(value) ? ERROR : INFO;
    }
}
