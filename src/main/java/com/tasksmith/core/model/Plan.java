package com.tasksmith.core.model;

import java.time.Instant;
import java.util.List;

/**
 * A decomposed unit of work: an ordered set of tasks against one project directory.
 *
 * @param id          plan identifier
 * @param projectPath directory inside the git repository the tasks operate on
 * @param summary     human-readable summary
 * @param status      lifecycle status
 * @param createdAt   creation time
 * @param updatedAt   last status change
 * @param archivedAt  when the plan was archived, or null while it is active
 * @param tasks       tasks ordered by ordinal
 */
public record Plan(
    String id,
    String projectPath,
    String summary,
    PlanStatus status,
    Instant createdAt,
    Instant updatedAt,
    Instant archivedAt,
    List<Task> tasks
) {

    public Plan {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public boolean archived() {
        return archivedAt != null;
    }

    public Plan withTasks(List<Task> newTasks) {
        return new Plan(id, projectPath, summary, status, createdAt, updatedAt, archivedAt, newTasks);
    }

    public Plan withStatus(PlanStatus newStatus, Instant now) {
        return new Plan(id, projectPath, summary, newStatus, createdAt, now, archivedAt, tasks);
    }

    /** Archives the plan at {@code archivedAt}, or restores it when that is null. */
    public Plan withArchivedAt(Instant newArchivedAt, Instant now) {
        return new Plan(id, projectPath, summary, status, createdAt, now, newArchivedAt, tasks);
    }
}
