package com.tasksmith.core.model;

import java.time.Instant;

/**
 * Terminal write for a run. Null fields leave the stored value untouched.
 */
public record RunFinalization(
    String runId,
    RunStatus status,
    Instant endedAt,
    Long durationMs,
    String sessionId,
    String resultText,
    Double costUsd,
    String stopReason,
    String errorText
) {

    public RunFinalization {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Finalization requires a terminal status, got " + status);
        }
    }

    public static RunFinalization cancelled(String runId, Instant endedAt, String reason) {
        return new RunFinalization(runId, RunStatus.CANCELLED, endedAt, null, null, null, null, null, reason);
    }

    public static RunFinalization failed(String runId, Instant endedAt, Long durationMs, String reason) {
        return new RunFinalization(runId, RunStatus.FAILED, endedAt, durationMs, null, null, null, null, reason);
    }
}
