package com.tasksmith.core.plan;

import java.util.List;

/**
 * An externally authored plan, before id normalisation.
 *
 * @param projectPath directory inside the git repository the tasks operate on
 * @param summary     human-readable summary
 * @param tasks       tasks in intended order
 */
public record PlanDraft(String projectPath, String summary, List<TaskDraft> tasks) {

    /**
     * @param id                 author-supplied id, normalised on import
     * @param title              short title
     * @param description        what the task should accomplish
     * @param dependencies       author-supplied ids of prerequisite tasks
     * @param acceptanceCriteria how to judge completion
     * @param technicalNotes     implementation hints
     */
    public record TaskDraft(
        String id,
        String title,
        String description,
        List<String> dependencies,
        List<String> acceptanceCriteria,
        String technicalNotes
    ) {}
}
