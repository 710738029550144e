package com.tasksmith.workspace;

import java.nio.file.Path;

/**
 * Isolated working copy for one task in one phase.
 *
 * @param taskId     task executed in the worktree
 * @param phase      1-based phase number
 * @param branch     branch checked out in the worktree
 * @param path       worktree directory under the queue's scratch root
 * @param baseCommit merge-target commit the branch was created from
 */
public record PhaseWorktree(String taskId, int phase, String branch, Path path, String baseCommit) {}
