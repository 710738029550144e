package com.tasksmith.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * A structured event emitted during run and queue execution, persisted and streamed over SSE.
 *
 * @param id      unique event id
 * @param ts      when the event occurred
 * @param runId   the run this event belongs to (null for plan-level queue events)
 * @param planId  the plan this event belongs to
 * @param taskId  the task this event relates to (nullable for plan-level events)
 * @param type    event type
 * @param level   info or error
 * @param payload arbitrary key-value data; always contains a human-readable "message" where one applies
 */
public record RunEvent(
    String id,
    Instant ts,
    String runId,
    String planId,
    String taskId,
    RunEventType type,
    EventLevel level,
    Map<String, Object> payload
) {

    public RunEvent {
        payload = payload == null ? Map.of() : payload;
    }

    public String message() {
        Object message = payload.get("message");
        return message == null ? null : message.toString();
    }
}
