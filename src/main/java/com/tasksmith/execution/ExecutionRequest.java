package com.tasksmith.execution;

import com.tasksmith.core.model.Plan;
import com.tasksmith.core.model.Task;

import java.nio.file.Path;

/**
 * Everything an {@link ExecutionService} needs to run one task.
 *
 * @param plan             plan the task belongs to
 * @param task             task to execute
 * @param retryContext     present for retries, otherwise null
 * @param workingDirectory worktree to run in; null means the plan's project directory
 * @param branchName       branch checked out in the worktree, or null
 */
public record ExecutionRequest(
    Plan plan,
    Task task,
    RetryContext retryContext,
    Path workingDirectory,
    String branchName
) {

    public Path effectiveDirectory() {
        return workingDirectory != null ? workingDirectory : Path.of(plan.projectPath());
    }
}
