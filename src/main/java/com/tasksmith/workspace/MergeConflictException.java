package com.tasksmith.workspace;

import java.util.List;

/**
 * Merging a task branch conflicted with the target branch. The merge has already been
 * aborted when this is thrown, so the target working copy is clean.
 */
public class MergeConflictException extends GitCommandException {

    private final String taskId;
    private final String branch;
    private final List<String> conflictedFiles;

    public MergeConflictException(String taskId, String branch, List<String> conflictedFiles, GitResult result) {
        super("Merge conflict while merging task " + taskId + ": " + String.join(", ", conflictedFiles),
                result.exitCode(), result.stderr());
        this.taskId = taskId;
        this.branch = branch;
        this.conflictedFiles = List.copyOf(conflictedFiles);
    }

    public String taskId() {
        return taskId;
    }

    public String branch() {
        return branch;
    }

    public List<String> conflictedFiles() {
        return conflictedFiles;
    }
}
