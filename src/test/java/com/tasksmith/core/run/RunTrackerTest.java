package com.tasksmith.core.run;

import com.tasksmith.core.model.RunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RunTrackerTest {

    private RunTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new RunTracker();
    }

    @Test
    @DisplayName("registered runs are found by id, plan and task")
    void register() {
        ActiveRun run = tracker.register("r1", "p1", "a", true);
        tracker.register("r2", "p1", "b", true);
        tracker.register("r3", "p2", "a", false);

        assertSame(run, tracker.find("r1").orElseThrow());
        assertEquals(2, tracker.activeRunsForPlan("p1").size());
        assertEquals("r3", tracker.activeRunForTask("p2", "a").orElseThrow().runId());
        assertTrue(run.queueManaged());
        assertEquals(3, tracker.size());
    }

    @Test
    @DisplayName("duplicate registration is rejected")
    void duplicate() {
        tracker.register("r1", "p1", "a", false);

        assertThrows(IllegalStateException.class, () -> tracker.register("r1", "p1", "a", false));
    }

    @Test
    @DisplayName("complete resolves the completion once and forgets the run")
    void complete() {
        ActiveRun run = tracker.register("r1", "p1", "a", false);

        tracker.complete("r1", RunStatus.CANCELLED);
        tracker.complete("r1", RunStatus.COMPLETED);

        assertEquals(RunStatus.CANCELLED, run.completion().join());
        assertFalse(tracker.isTracked("r1"));
        assertTrue(tracker.find("r1").isEmpty());
    }

    @Test
    @DisplayName("only the first cancel request reports true")
    void requestCancel() {
        ActiveRun run = tracker.register("r1", "p1", "a", false);

        assertFalse(run.isCancelRequested());
        assertTrue(run.requestCancel());
        assertFalse(run.requestCancel());
        assertTrue(run.isCancelRequested());
    }
}
