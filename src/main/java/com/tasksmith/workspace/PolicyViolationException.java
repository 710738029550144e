package com.tasksmith.workspace;

/**
 * Work violated the repository policy: a non-conventional commit, a forbidden trailer,
 * a merge that produced no commit, or the target branch moved underneath the queue.
 * Never retried automatically.
 */
public class PolicyViolationException extends RuntimeException {

    public PolicyViolationException(String message) {
        super(message);
    }
}
