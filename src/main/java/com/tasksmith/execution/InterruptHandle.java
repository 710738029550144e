package com.tasksmith.execution;

import java.util.concurrent.CompletableFuture;

/**
 * Capability to stop an execution that is in flight. Registered through
 * {@link ExecutionCallbacks#onInterruptible(InterruptHandle)}.
 */
@FunctionalInterface
public interface InterruptHandle {

    /**
     * Requests the execution to stop.
     *
     * @return a future that completes once the execution has actually stopped
     */
    CompletableFuture<Void> interrupt();
}
