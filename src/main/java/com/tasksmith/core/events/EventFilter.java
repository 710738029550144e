package com.tasksmith.core.events;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Selects the events a subscriber receives. A null plan or run matches any; an empty type set
 * matches every type.
 *
 * @param planId plan the events belong to, or null for all plans
 * @param runId  run the events belong to, or null for plan-level and run events alike
 * @param types  event types to deliver, empty for all
 */
public record EventFilter(String planId, String runId, Set<RunEventType> types) {

    public EventFilter {
        types = types == null || types.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(types));
    }

    public static EventFilter all() {
        return new EventFilter(null, null, Set.of());
    }

    public static EventFilter forPlan(String planId) {
        return new EventFilter(planId, null, Set.of());
    }

    public static EventFilter forRun(String planId, String runId) {
        return new EventFilter(planId, runId, Set.of());
    }

    public EventFilter ofTypes(RunEventType... selected) {
        return ofTypes(Arrays.asList(selected));
    }

    public EventFilter ofTypes(Collection<RunEventType> selected) {
        return new EventFilter(planId, runId, selected == null ? Set.of() : Set.copyOf(selected));
    }

    public boolean matches(RunEvent event) {
        if (planId != null && !planId.equals(event.planId())) {
            return false;
        }
        if (runId != null && !runId.equals(event.runId())) {
            return false;
        }
        return types.isEmpty() || types.contains(event.type());
    }

    /**
     * Parses a comma-separated list of wire type names such as {@code task_status,queue_finished}.
     *
     * @throws IllegalArgumentException on an unknown name
     */
    public static Set<RunEventType> parseTypes(String csv) {
        if (csv == null || csv.isBlank()) {
            return Set.of();
        }
        EnumSet<RunEventType> parsed = EnumSet.noneOf(RunEventType.class);
        for (String part : csv.split(",")) {
            if (!part.isBlank()) {
                parsed.add(RunEventType.fromValue(part.strip()));
            }
        }
        return parsed;
    }
}
