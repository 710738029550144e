package com.tasksmith.workspace;

import java.nio.file.Path;

/**
 * Git state for one queue run.
 *
 * @param planId         plan the queue runs
 * @param repoRoot       canonical repository root (main working copy)
 * @param mergeTarget    branch task work is merged into
 * @param originalRef    branch, or commit when detached, checked out before the queue started
 * @param originalDetached whether {@code originalRef} is a detached commit
 * @param scratchRoot    directory holding every worktree of this queue run
 */
public record QueueGitContext(
    String planId,
    Path repoRoot,
    String mergeTarget,
    String originalRef,
    boolean originalDetached,
    Path scratchRoot
) {

    public boolean needsRestore() {
        return originalDetached || !originalRef.equals(mergeTarget);
    }
}
