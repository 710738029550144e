package com.tasksmith.execution;

/**
 * Outcome reported by the execution service.
 *
 * @param sessionId  execution session id, or null
 * @param resultText final summary text
 * @param stopReason why the agent stopped; values starting with "error" mean failure
 * @param durationMs duration reported by the service
 * @param costUsd    reported cost, or null
 */
public record ExecutionResult(
    String sessionId,
    String resultText,
    String stopReason,
    Long durationMs,
    Double costUsd
) {

    public boolean isFailure() {
        return stopReason != null && stopReason.startsWith("error");
    }
}
