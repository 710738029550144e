package com.tasksmith.core.run;

import com.tasksmith.execution.RetryContext;

import java.nio.file.Path;

/**
 * Parameters for {@link RunExecutor#startRun(RunRequest)}.
 *
 * @param planId           plan of the task
 * @param taskId           task to run
 * @param retryCount       retry ordinal, 0 for a first attempt
 * @param retryContext     details of the previous failure, for retries
 * @param workingDirectory worktree to execute in; null means the project directory
 * @param branchName       branch checked out in the worktree
 * @param queueManaged     the queue owns the plan status while this run executes
 * @param verifier         optional check run before the run is marked completed
 */
public record RunRequest(
    String planId,
    String taskId,
    int retryCount,
    RetryContext retryContext,
    Path workingDirectory,
    String branchName,
    boolean queueManaged,
    RunVerifier verifier
) {

    public static RunRequest manual(String planId, String taskId) {
        return new RunRequest(planId, taskId, 0, null, null, null, false, null);
    }

    public static RunRequest retry(String planId, String taskId, RetryContext context) {
        return new RunRequest(planId, taskId, context.retryOrdinal(), context, null, null, false, null);
    }

    public static RunRequest queued(String planId, String taskId, Path worktree, String branch, RunVerifier verifier) {
        return new RunRequest(planId, taskId, 0, null, worktree, branch, true, verifier);
    }
}
