package com.tasksmith.workspace;

/**
 * Outcome of one git invocation.
 */
public record GitResult(int exitCode, String stdout, String stderr) {

    public static GitResult ok(String stdout) {
        return new GitResult(0, stdout, "");
    }

    public static GitResult failed(int exitCode, String stderr) {
        return new GitResult(exitCode, "", stderr);
    }

    public boolean success() {
        return exitCode == 0;
    }
}
