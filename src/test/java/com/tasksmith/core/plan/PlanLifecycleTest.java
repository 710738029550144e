package com.tasksmith.core.plan;

import com.tasksmith.core.events.EventBus;
import com.tasksmith.core.events.RunEventPublisher;
import com.tasksmith.core.events.RunEventType;
import com.tasksmith.core.model.Run;
import com.tasksmith.core.model.RunStatus;
import com.tasksmith.core.persistence.InMemoryPlanStore;
import com.tasksmith.core.persistence.PlanFilter;
import com.tasksmith.core.queue.QueueOrchestrator;
import com.tasksmith.core.run.RunTracker;
import com.tasksmith.core.run.TaskOperationException;
import com.tasksmith.support.RecordingEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static com.tasksmith.support.TestPlans.pending;
import static com.tasksmith.support.TestPlans.plan;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlanLifecycleTest {

    private static final String PLAN = "plan-1";

    private InMemoryPlanStore store;
    @Mock
    private QueueOrchestrator queueOrchestrator;
    private RunTracker tracker;
    private RecordingEvents events;
    private PlanLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        store = new InMemoryPlanStore();
        store.createPlan(plan(PLAN, "/repo", pending(PLAN, "a", 1)));
        tracker = new RunTracker();
        var bus = new EventBus();
        events = new RecordingEvents(bus);
        lifecycle = new PlanLifecycle(store, queueOrchestrator, tracker, new RunEventPublisher(store, bus));
    }

    @Test
    @DisplayName("archive hides the plan from the active listing and unarchive brings it back")
    void archiveAndRestore() {
        var archived = lifecycle.archive(PLAN);

        assertTrue(archived.archived());
        assertTrue(store.listPlans(new PlanFilter(false, null)).isEmpty());
        assertEquals(List.of("Plan archived."), events.messages(RunEventType.INFO));

        var restored = lifecycle.unarchive(PLAN);

        assertFalse(restored.archived());
        assertEquals(1, store.listPlans(new PlanFilter(false, null)).size());
    }

    @Test
    @DisplayName("archiving twice keeps the first archive time")
    void archiveIsIdempotent() {
        Instant first = lifecycle.archive(PLAN).archivedAt();

        assertEquals(first, lifecycle.archive(PLAN).archivedAt());
        assertEquals(1, events.ofType(RunEventType.INFO).size());
    }

    @Test
    @DisplayName("delete removes the plan and its runs")
    void delete() {
        store.createRun(Run.started("r1", PLAN, "a", 0, Instant.now()));

        lifecycle.delete(PLAN);

        assertTrue(store.findPlan(PLAN).isEmpty());
        assertTrue(store.findRun("r1").isEmpty());
    }

    @Test
    @DisplayName("unknown plans are reported as not found")
    void missingPlan() {
        var e = assertThrows(TaskOperationException.class, () -> lifecycle.delete("nope"));

        assertEquals(TaskOperationException.Reason.NOT_FOUND, e.reason());
        assertThrows(TaskOperationException.class, () -> lifecycle.archive("nope"));
    }

    @Test
    @DisplayName("refused while the plan's queue is running")
    void refusedWhileQueueRuns() {
        when(queueOrchestrator.isQueueRunning(PLAN)).thenReturn(true);

        var e = assertThrows(TaskOperationException.class, () -> lifecycle.delete(PLAN));

        assertEquals(TaskOperationException.Reason.CONFLICT, e.reason());
        assertTrue(e.getMessage().contains("queue is running"));
        assertThrows(TaskOperationException.class, () -> lifecycle.archive(PLAN));
        assertTrue(store.findPlan(PLAN).isPresent());
        assertFalse(store.findPlan(PLAN).orElseThrow().archived());
    }

    @Test
    @DisplayName("refused while one of the plan's runs is active")
    void refusedWhileRunActive() {
        tracker.register("r1", PLAN, "a", false);

        var e = assertThrows(TaskOperationException.class, () -> lifecycle.archive(PLAN));

        assertEquals(TaskOperationException.Reason.CONFLICT, e.reason());
        assertTrue(e.getMessage().contains("task is running"));

        tracker.complete("r1", RunStatus.CANCELLED);
        lifecycle.delete(PLAN);
        assertTrue(store.findPlan(PLAN).isEmpty());
    }
}
