package com.tasksmith.core.persistence;

import com.tasksmith.core.events.RunEvent;

import java.util.List;

/**
 * One page of run events in emission order.
 *
 * @param events     events on this page
 * @param hasMore    whether more events follow
 * @param nextCursor id of the last event on this page, to pass as {@code afterId}; null when empty
 */
public record RunEventPage(List<RunEvent> events, boolean hasMore, String nextCursor) {

    public static RunEventPage of(List<RunEvent> fetched, int limit) {
        boolean hasMore = fetched.size() > limit;
        List<RunEvent> page = hasMore ? List.copyOf(fetched.subList(0, limit)) : List.copyOf(fetched);
        String cursor = page.isEmpty() ? null : page.get(page.size() - 1).id();
        return new RunEventPage(page, hasMore, cursor);
    }
}
