package com.tasksmith.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of run and queue events.
 *
 * <p>Each subscription carries an {@link EventFilter}. Subscriptions scoped to a plan are
 * indexed by plan id, so a publish only walks that plan's subscribers plus the unscoped ones.
 * Delivery happens on the publishing thread; a subscriber that throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Registration>> byPlan = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Registration> unscoped = new CopyOnWriteArrayList<>();

    public void publish(RunEvent event) {
        List<Registration> scoped = event.planId() == null ? null : byPlan.get(event.planId());
        if (scoped != null) {
            scoped.forEach(registration -> registration.deliver(event));
        }
        unscoped.forEach(registration -> registration.deliver(event));
    }

    public Subscription subscribe(EventFilter filter, Consumer<RunEvent> consumer) {
        var registration = new Registration(filter, consumer);
        if (filter.planId() == null) {
            unscoped.add(registration);
            return () -> unscoped.remove(registration);
        }
        String planId = filter.planId();
        byPlan.computeIfAbsent(planId, k -> new CopyOnWriteArrayList<>()).add(registration);
        log.debug("Subscribed to plan {} (run={}, types={})", planId, filter.runId(), filter.types());
        return () -> byPlan.computeIfPresent(planId, (k, registrations) -> {
            registrations.remove(registration);
            return registrations.isEmpty() ? null : registrations;
        });
    }

    /** Every event of one plan. */
    public Subscription subscribe(String planId, Consumer<RunEvent> consumer) {
        return subscribe(EventFilter.forPlan(planId), consumer);
    }

    /** Every event of every plan. */
    public Subscription subscribeAll(Consumer<RunEvent> consumer) {
        return subscribe(EventFilter.all(), consumer);
    }

    public int subscriberCount() {
        return unscoped.size() + byPlan.values().stream().mapToInt(List::size).sum();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static final class Registration {

        private final EventFilter filter;
        private final Consumer<RunEvent> consumer;

        Registration(EventFilter filter, Consumer<RunEvent> consumer) {
            this.filter = filter;
            this.consumer = consumer;
        }

        void deliver(RunEvent event) {
            if (!filter.matches(event)) {
                return;
            }
            try {
                consumer.accept(event);
            } catch (RuntimeException e) {
                log.warn("Subscriber failed on {} event of plan {}: {}",
                        event.type().value(), event.planId(), e.getMessage(), e);
            }
        }
    }
}
