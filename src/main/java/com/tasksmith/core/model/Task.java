package com.tasksmith.core.model;

import java.time.Instant;
import java.util.List;

/**
 * A single unit of work within a plan.
 *
 * @param id                 identifier, unique within the plan (e.g. "setup-db")
 * @param planId             owning plan
 * @param ordinal            1-based position in the plan; lower runs first in single-task mode
 * @param title              short title
 * @param description        what this task should accomplish
 * @param dependencies       ids of tasks that must be completed or skipped first
 * @param acceptanceCriteria how to judge that the task is done
 * @param technicalNotes     free-form implementation hints
 * @param status             current status
 * @param createdAt          creation time
 * @param updatedAt          last status change
 * @param completedAt        when the task reached {@link TaskStatus#COMPLETED}, or null
 */
public record Task(
    String id,
    String planId,
    int ordinal,
    String title,
    String description,
    List<String> dependencies,
    List<String> acceptanceCriteria,
    String technicalNotes,
    TaskStatus status,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt
) {

    public Task {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        acceptanceCriteria = acceptanceCriteria == null ? List.of() : List.copyOf(acceptanceCriteria);
    }

    public Task withStatus(TaskStatus newStatus, Instant now) {
        Instant completed = newStatus == TaskStatus.COMPLETED ? now : completedAt;
        return new Task(id, planId, ordinal, title, description, dependencies, acceptanceCriteria,
                technicalNotes, newStatus, createdAt, now, completed);
    }
}
