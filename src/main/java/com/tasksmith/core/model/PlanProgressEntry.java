package com.tasksmith.core.model;

import java.time.Instant;

/**
 * Append-only log line describing how a run ended, kept per plan for later runs to read.
 */
public record PlanProgressEntry(
    long id,
    String planId,
    String runId,
    RunStatus status,
    String entryText,
    Instant createdAt
) {

    public static final int MAX_ENTRY_LENGTH = 16_000;

    public static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_ENTRY_LENGTH ? text : text.substring(0, MAX_ENTRY_LENGTH);
    }
}
