package com.tasksmith.support;

import com.tasksmith.core.model.Plan;
import com.tasksmith.core.model.PlanStatus;
import com.tasksmith.core.model.Task;
import com.tasksmith.core.model.TaskStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builders for plans and tasks used across tests.
 */
public final class TestPlans {

    private TestPlans() {}

    public static Task task(String planId, String id, int ordinal, TaskStatus status, String... dependencies) {
        Instant now = Instant.now();
        return new Task(id, planId, ordinal, "Title " + id, "Do " + id, List.of(dependencies),
                List.of("It works"), null, status, now, now, null);
    }

    public static Task pending(String planId, String id, int ordinal, String... dependencies) {
        return task(planId, id, ordinal, TaskStatus.PENDING, dependencies);
    }

    public static Plan plan(String planId, String projectPath, Task... tasks) {
        Instant now = Instant.now();
        return new Plan(planId, projectPath, "Summary of " + planId, PlanStatus.READY, now, now, null,
                new ArrayList<>(List.of(tasks)));
    }

    /** A → {B, C} → D, all pending. */
    public static Plan diamond(String planId, String projectPath) {
        return plan(planId, projectPath,
                pending(planId, "a", 1),
                pending(planId, "b", 2, "a"),
                pending(planId, "c", 3, "a"),
                pending(planId, "d", 4, "b", "c"));
    }
}
