package com.tasksmith.core.queue;

import java.util.concurrent.CompletableFuture;

/**
 * Answer to {@link QueueOrchestrator#runAll(String)}.
 *
 * @param started    whether a queue loop was started
 * @param queued     runnable tasks when the queue started, otherwise 0
 * @param reason     stable display reason
 * @param completion resolves when the queue loop exits; null when not started
 */
public record QueueStartResult(boolean started, int queued, String reason,
                               CompletableFuture<QueueOutcome> completion) {

    static QueueStartResult refused(String reason) {
        return new QueueStartResult(false, 0, reason, null);
    }

    static QueueStartResult started(int queued, CompletableFuture<QueueOutcome> completion) {
        return new QueueStartResult(true, queued, QueueOrchestrator.REASON_STARTED, completion);
    }
}
