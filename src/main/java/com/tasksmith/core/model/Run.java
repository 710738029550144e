package com.tasksmith.core.model;

import java.time.Instant;

/**
 * One execution attempt of one task. Immutable once it reaches a terminal status.
 *
 * @param id         run identifier
 * @param planId     owning plan
 * @param taskId     task being executed
 * @param status     current status
 * @param sessionId  correlation id assigned by the execution service, or null
 * @param retryCount retry ordinal; 0 for the first attempt
 * @param startedAt  start time
 * @param endedAt    finalization time, or null while in progress
 * @param durationMs wall-clock duration reported at finalization
 * @param resultText final result text reported by the execution service
 * @param costUsd    reported cost
 * @param stopReason stop reason reported by the execution service
 * @param errorText  human-readable reason for failed and cancelled runs
 */
public record Run(
    String id,
    String planId,
    String taskId,
    RunStatus status,
    String sessionId,
    int retryCount,
    Instant startedAt,
    Instant endedAt,
    Long durationMs,
    String resultText,
    Double costUsd,
    String stopReason,
    String errorText
) {

    public static Run started(String id, String planId, String taskId, int retryCount, Instant startedAt) {
        return new Run(id, planId, taskId, RunStatus.IN_PROGRESS, null, retryCount, startedAt,
                null, null, null, null, null, null);
    }

    public Run withSessionId(String newSessionId) {
        return new Run(id, planId, taskId, status, newSessionId, retryCount, startedAt, endedAt,
                durationMs, resultText, costUsd, stopReason, errorText);
    }

    /**
     * Applies a finalization, keeping existing values where the finalization leaves a field null.
     */
    public Run finalizedWith(RunFinalization f) {
        return new Run(id, planId, taskId, f.status(),
                f.sessionId() != null ? f.sessionId() : sessionId,
                retryCount, startedAt, f.endedAt(),
                f.durationMs() != null ? f.durationMs() : durationMs,
                f.resultText() != null ? f.resultText() : resultText,
                f.costUsd() != null ? f.costUsd() : costUsd,
                f.stopReason() != null ? f.stopReason() : stopReason,
                f.errorText() != null ? f.errorText() : errorText);
    }
}
