package com.tasksmith.core.events;

import com.tasksmith.core.persistence.PlanStore;
import com.tasksmith.core.persistence.PlanStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Persists run events and then fans them out on the {@link EventBus}.
 * <p>
 * A failed persist is logged and the event is still published: subscribers are the live
 * view of the run and must not miss a transition because the event log is unavailable.
 */
@Service
public class RunEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RunEventPublisher.class);

    private final PlanStore store;
    private final EventBus eventBus;

    public RunEventPublisher(PlanStore store, EventBus eventBus) {
        this.store = store;
        this.eventBus = eventBus;
    }

    public RunEvent emit(String runId, String planId, String taskId, RunEventType type,
                         EventLevel level, Map<String, Object> payload) {
        var event = new RunEvent(UUID.randomUUID().toString(), Instant.now(), runId, planId, taskId,
                type, level, payload == null ? Map.of() : new LinkedHashMap<>(payload));
        try {
            store.appendRunEvent(event);
        } catch (PlanStoreException e) {
            log.warn("Could not persist {} event for plan {}: {}", type.value(), planId, e.getMessage());
        }
        eventBus.publish(event);
        return event;
    }

    public RunEvent info(String runId, String planId, String taskId, RunEventType type, String message) {
        return emit(runId, planId, taskId, type, EventLevel.INFO, Map.of("message", message));
    }

    public RunEvent error(String runId, String planId, String taskId, RunEventType type, String message) {
        return emit(runId, planId, taskId, type, EventLevel.ERROR, Map.of("message", message));
    }

    /** Emits a plan-level event that has no run. */
    public RunEvent planEvent(String planId, RunEventType type, EventLevel level, Map<String, Object> payload) {
        return emit(null, planId, null, type, level, payload);
    }
}
