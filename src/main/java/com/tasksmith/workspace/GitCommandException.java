package com.tasksmith.workspace;

/**
 * A git command failed: non-zero exit, I/O error or timeout.
 */
public class GitCommandException extends RuntimeException {

    private final int exitCode;
    private final String stderr;

    public GitCommandException(String message, GitResult result) {
        super(message + " (exit code " + result.exitCode() + ")" + summarize(result.stderr()));
        this.exitCode = result.exitCode();
        this.stderr = result.stderr();
    }

    public GitCommandException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
        this.stderr = "";
    }

    protected GitCommandException(String message, int exitCode, String stderr) {
        super(message);
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public int exitCode() {
        return exitCode;
    }

    public String stderr() {
        return stderr;
    }

    private static String summarize(String stderr) {
        if (stderr == null || stderr.isBlank()) {
            return "";
        }
        return ": " + stderr.strip().lines().findFirst().orElse("");
    }
}
