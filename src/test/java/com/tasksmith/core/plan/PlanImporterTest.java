package com.tasksmith.core.plan;

import com.tasksmith.core.model.Plan;
import com.tasksmith.core.model.PlanStatus;
import com.tasksmith.core.model.Task;
import com.tasksmith.core.model.TaskStatus;
import com.tasksmith.core.persistence.InMemoryPlanStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanImporterTest {

    private InMemoryPlanStore store;
    private PlanImporter importer;

    @BeforeEach
    void setUp() {
        store = new InMemoryPlanStore();
        importer = new PlanImporter(store);
    }

    private static PlanDraft.TaskDraft draft(String id, String... dependencies) {
        return new PlanDraft.TaskDraft(id, "Title " + id, "Describe " + id, List.of(dependencies),
                List.of("Done"), null);
    }

    @Test
    @DisplayName("import stores a ready plan with pending tasks in order")
    void importsPlan() {
        Plan plan = importer.importPlan(new PlanDraft("/repo", "Build it",
                List.of(draft("setup"), draft("api", "setup"))));

        assertEquals(PlanStatus.READY, plan.status());
        Plan stored = store.findPlan(plan.id()).orElseThrow();
        assertEquals(List.of("setup", "api"), stored.tasks().stream().map(Task::id).toList());
        assertEquals(List.of(1, 2), stored.tasks().stream().map(Task::ordinal).toList());
        assertTrue(stored.tasks().stream().allMatch(t -> t.status() == TaskStatus.PENDING));
        assertEquals(List.of("setup"), stored.tasks().get(1).dependencies());
    }

    @Test
    @DisplayName("ids are normalised and dependencies follow the rename")
    void normalisesIds() {
        Plan plan = importer.importPlan(new PlanDraft("/repo", null,
                List.of(draft("Set Up DB!"), draft("Add API", "Set Up DB!"))));

        assertEquals("set-up-db", plan.tasks().get(0).id());
        assertEquals("add-api", plan.tasks().get(1).id());
        assertEquals(List.of("set-up-db"), plan.tasks().get(1).dependencies());
    }

    @Test
    @DisplayName("duplicate and missing ids get unique fallbacks")
    void deduplicates() {
        Plan plan = importer.importPlan(new PlanDraft("/repo", null,
                List.of(draft("x"), draft("x"), draft(null))));

        assertEquals(List.of("x", "x-2", "task-3"), plan.tasks().stream().map(Task::id).toList());
    }

    @Test
    @DisplayName("self references and unknown dependencies are dropped")
    void dropsBadDependencies() {
        Plan plan = importer.importPlan(new PlanDraft("/repo", null,
                List.of(draft("a", "a", "nowhere"))));

        assertTrue(plan.tasks().get(0).dependencies().isEmpty());
    }

    @Test
    @DisplayName("a missing title falls back to the task id")
    void titleFallback() {
        Plan plan = importer.importPlan(new PlanDraft("/repo", null,
                List.of(new PlanDraft.TaskDraft("only", " ", null, null, null, null))));

        assertEquals("only", plan.tasks().get(0).title());
    }

    @Test
    @DisplayName("cycles are rejected and nothing is stored")
    void rejectsCycles() {
        var ex = assertThrows(IllegalArgumentException.class, () -> importer.importPlan(new PlanDraft("/repo", null,
                List.of(draft("a", "b"), draft("b", "a"), draft("c")))));

        assertTrue(ex.getMessage().contains("a, b"));
        assertTrue(store.listPlans().isEmpty());
    }

    @Test
    @DisplayName("project path and at least one task are required")
    void validatesInput() {
        assertThrows(IllegalArgumentException.class,
                () -> importer.importPlan(new PlanDraft(" ", null, List.of(draft("a")))));
        assertThrows(IllegalArgumentException.class,
                () -> importer.importPlan(new PlanDraft("/repo", null, List.of())));
    }

    @Test
    @DisplayName("normalizeTaskId collapses separators")
    void normalizeTaskId() {
        assertEquals("a-b_c", PlanImporter.normalizeTaskId("  A -- B_c  ", 1));
        assertEquals("task-7", PlanImporter.normalizeTaskId("!!!", 7));
    }
}
