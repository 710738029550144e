package com.tasksmith.workspace;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Commit-quality rules a task branch must satisfy before it is merged: at least one commit,
 * every subject a Conventional Commit header, and no disallowed trailer in any message.
 */
@Component
public class CommitPolicy {

    private final Pattern headerPattern;
    private final Pattern disallowedTrailerPattern;

    public CommitPolicy(GitProperties properties) {
        this.headerPattern = Pattern.compile(properties.getCommitHeaderPattern());
        this.disallowedTrailerPattern = Pattern.compile(properties.getDisallowedTrailerPattern());
    }

    /**
     * @param commits commits on the branch, newest first
     * @param context where the commits come from, used in messages (e.g. "task setup-db")
     * @throws PolicyViolationException on the first violation
     */
    public void validate(List<CommitRecord> commits, String context) {
        if (commits.isEmpty()) {
            throw new PolicyViolationException("No commits found in " + context + ".");
        }
        for (CommitRecord commit : commits) {
            if (!isConventionalHeader(commit.subject())) {
                throw new PolicyViolationException("Commit policy violation in " + context + ": commit "
                        + commit.shortHash() + " is not Conventional Commit compliant.");
            }
            if (commit.body() != null && disallowedTrailerPattern.matcher(commit.body()).find()) {
                throw new PolicyViolationException("Commit policy violation in " + context + ": commit "
                        + commit.shortHash() + " includes a forbidden co-author trailer.");
            }
        }
    }

    public boolean isConventionalHeader(String subject) {
        return subject != null && headerPattern.matcher(subject.strip()).find();
    }
}
