package com.tasksmith.execution;

import com.tasksmith.core.model.Plan;
import com.tasksmith.core.model.Task;

/**
 * Converts a Task and its Plan into the plain-text instruction handed to the agent.
 * Pure function, no Spring dependencies.
 */
public final class InstructionBuilder {

    private InstructionBuilder() {}

    public static String build(ExecutionRequest request) {
        Task task = request.task();
        Plan plan = request.plan();
        var sb = new StringBuilder();

        sb.append("# Task: ").append(task.id()).append("\n\n");
        if (task.title() != null && !task.title().isBlank()) {
            sb.append("**").append(task.title()).append("**\n\n");
        }

        sb.append("## Objective\n\n");
        sb.append(task.description() != null && !task.description().isBlank() ? task.description() : task.title())
                .append("\n\n");

        if (plan.summary() != null && !plan.summary().isBlank()) {
            sb.append("## Plan Context\n\n");
            sb.append(plan.summary()).append("\n\n");
        }

        if (!task.acceptanceCriteria().isEmpty()) {
            sb.append("## Acceptance Criteria\n\n");
            for (String criterion : task.acceptanceCriteria()) {
                sb.append("- ").append(criterion).append("\n");
            }
            sb.append("\n");
        }

        if (task.technicalNotes() != null && !task.technicalNotes().isBlank()) {
            sb.append("## Technical Notes\n\n");
            sb.append(task.technicalNotes()).append("\n\n");
        }

        RetryContext retry = request.retryContext();
        if (retry != null) {
            sb.append("## Previous Attempt\n\n");
            sb.append("This is retry #").append(retry.retryOrdinal()).append(". The previous attempt failed with:\n\n");
            sb.append("```\n").append(retry.previousError().strip()).append("\n```\n\n");
            sb.append("Address the cause of this failure before anything else.\n\n");
        }

        sb.append("## Constraints\n\n");
        sb.append("- Only modify files related to this task\n");
        if (request.branchName() != null) {
            sb.append("- You are working on branch `").append(request.branchName())
                    .append("` in a dedicated worktree; do not switch branches\n");
        }
        sb.append("- Commit your work before finishing, using Conventional Commit messages ")
                .append("(e.g. `feat(api): add endpoint`)\n");
        sb.append("- Do not add co-author trailers to commit messages\n");
        sb.append("- If you encounter an error, attempt to fix it before reporting failure\n");

        return sb.toString();
    }
}
