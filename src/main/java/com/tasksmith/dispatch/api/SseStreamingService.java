package com.tasksmith.dispatch.api;

import com.tasksmith.core.events.EventBus;
import com.tasksmith.core.events.EventFilter;
import com.tasksmith.core.events.RunEvent;
import com.tasksmith.core.events.RunEventType;
import com.tasksmith.core.model.Run;
import com.tasksmith.core.persistence.PlanStore;
import com.tasksmith.core.persistence.RunEventPage;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Streams run and queue events to HTTP clients as server-sent events.
 *
 * <p>Two kinds of stream exist:
 * <ul>
 *   <li>a plan stream: live events of one plan, optionally narrowed to a set of event types;</li>
 *   <li>a run stream: the run's persisted events after an optional cursor, then its live events.
 *       It completes once the run's terminal event has been sent.</li>
 * </ul>
 * Frames are named after the event type and carry the event id, so a client that reconnects
 * can resume a run stream from the last id it saw.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Queues can run for hours; the emitter outlives a single phase. */
    private static final long DEFAULT_TIMEOUT_MS = 60 * 60 * 1000L;
    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;
    private static final int REPLAY_PAGE_SIZE = 500;

    static final Set<RunEventType> RUN_TERMINAL_TYPES =
            EnumSet.of(RunEventType.COMPLETED, RunEventType.FAILED, RunEventType.CANCELLED);

    private final EventBus eventBus;
    private final PlanStore store;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<Stream> streams = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus, PlanStore store) {
        this(eventBus, store, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, PlanStore store, long timeoutMs) {
        this.eventBus = eventBus;
        this.store = store;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdownNow();
        for (Stream stream : streams) {
            stream.close();
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    // STREAMS
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Live events of a plan.
     *
     * @param types event types to forward, empty for all
     */
    public SseEmitter createPlanEmitter(String planId, Set<RunEventType> types) {
        var stream = new Stream("plan " + planId, new SseEmitter(timeoutMs), false);
        register(stream, EventFilter.forPlan(planId).ofTypes(types));
        stream.goLive();
        log.info("SSE plan stream opened for {} (types={})", planId, types.isEmpty() ? "all" : types);
        return stream.emitter;
    }

    /**
     * Persisted events of a run after {@code afterId} (from the start when null), followed by
     * its live events. The subscription is taken before the replay so nothing emitted in
     * between is lost; events seen in both are sent once.
     */
    public SseEmitter createRunEmitter(Run run, String afterId) {
        var stream = new Stream("run " + run.id(), new SseEmitter(timeoutMs), true);
        register(stream, EventFilter.forRun(run.planId(), run.id()));

        String cursor = afterId;
        RunEventPage page;
        do {
            page = store.listRunEvents(run.id(), cursor, REPLAY_PAGE_SIZE);
            page.events().forEach(stream::replay);
            cursor = page.nextCursor() != null ? page.nextCursor() : cursor;
        } while (page.hasMore() && !stream.isClosed());

        stream.goLive();
        if (!stream.isClosed() && store.findRun(run.id()).map(r -> r.status().isTerminal()).orElse(true)) {
            log.debug("Run {} already finished; closing stream after replay", run.id());
            stream.close();
        }
        log.info("SSE run stream opened for {} (after={})", run.id(), afterId);
        return stream.emitter;
    }

    public int activeEmitterCount() {
        return streams.size();
    }

    private void register(Stream stream, EventFilter filter) {
        stream.subscription = eventBus.subscribe(filter, stream::offer);
        streams.add(stream);
        stream.emitter.onCompletion(stream::release);
        stream.emitter.onTimeout(() -> {
            log.debug("SSE {} timed out", stream.label);
            stream.release();
        });
        stream.emitter.onError(ex -> {
            log.debug("SSE {} failed: {}", stream.label, ex.getMessage());
            stream.release();
        });
        try {
            stream.emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to open SSE {}: {}", stream.label, e.getMessage());
        }
    }

    private void sendHeartbeats() {
        for (Stream stream : streams) {
            try {
                stream.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat failed for SSE {}: {}", stream.label, e.getMessage());
            }
        }
    }

    /**
     * Sends one event frame. Overridable so tests can observe what a client would receive.
     */
    void send(SseEmitter emitter, RunEvent event) throws IOException {
        emitter.send(SseEmitter.event()
                .id(event.id())
                .name(event.type().value())
                .data(toFrame(event)));
    }

    static Map<String, Object> toFrame(RunEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", event.id());
        data.put("ts", event.ts().toString());
        data.put("planId", event.planId());
        if (event.runId() != null) {
            data.put("runId", event.runId());
        }
        if (event.taskId() != null) {
            data.put("taskId", event.taskId());
        }
        data.put("level", event.level().value());
        data.put("payload", event.payload());
        return data;
    }

    /**
     * One connected client. Live events that arrive while the replay runs are held back and
     * flushed, minus duplicates, when the stream goes live.
     */
    private final class Stream {

        private final String label;
        private final SseEmitter emitter;
        private final boolean closesOnTerminal;
        private final List<RunEvent> heldBack = new ArrayList<>();
        private final Set<String> replayedIds = new HashSet<>();
        private volatile EventBus.Subscription subscription;
        private boolean live;
        private boolean closed;

        Stream(String label, SseEmitter emitter, boolean closesOnTerminal) {
            this.label = label;
            this.emitter = emitter;
            this.closesOnTerminal = closesOnTerminal;
        }

        synchronized void offer(RunEvent event) {
            if (closed) {
                return;
            }
            if (live) {
                deliver(event);
            } else {
                heldBack.add(event);
            }
        }

        synchronized void replay(RunEvent event) {
            if (!closed) {
                replayedIds.add(event.id());
                deliver(event);
            }
        }

        synchronized void goLive() {
            for (RunEvent event : heldBack) {
                if (closed) {
                    break;
                }
                if (!replayedIds.contains(event.id())) {
                    deliver(event);
                }
            }
            heldBack.clear();
            replayedIds.clear();
            live = true;
        }

        synchronized boolean isClosed() {
            return closed;
        }

        private void deliver(RunEvent event) {
            try {
                send(emitter, event);
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping {} event for SSE {}: {}", event.type().value(), label, e.getMessage());
                return;
            }
            if (closesOnTerminal && RUN_TERMINAL_TYPES.contains(event.type())) {
                close();
            }
        }

        synchronized void close() {
            if (closed) {
                return;
            }
            closed = true;
            release();
            emitter.complete();
        }

        void release() {
            EventBus.Subscription current = subscription;
            if (current != null) {
                current.unsubscribe();
            }
            streams.remove(this);
        }
    }
}
