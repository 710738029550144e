package com.tasksmith.core.run;

import com.tasksmith.core.model.RunStatus;
import com.tasksmith.execution.InterruptHandle;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory state of a run that is executing in this process.
 */
public final class ActiveRun {

    private final String runId;
    private final String planId;
    private final String taskId;
    private final boolean queueManaged;
    private final Instant startedAt;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final CompletableFuture<RunStatus> completion = new CompletableFuture<>();
    private volatile InterruptHandle interruptHandle;

    public ActiveRun(String runId, String planId, String taskId, boolean queueManaged, Instant startedAt) {
        this.runId = runId;
        this.planId = planId;
        this.taskId = taskId;
        this.queueManaged = queueManaged;
        this.startedAt = startedAt;
    }

    public String runId() { return runId; }
    public String planId() { return planId; }
    public String taskId() { return taskId; }
    public boolean queueManaged() { return queueManaged; }
    public Instant startedAt() { return startedAt; }

    /** Resolves to the terminal status once the run leaves the tracker. */
    public CompletableFuture<RunStatus> completion() {
        return completion;
    }

    /** Null until the execution service reports that it can be interrupted. */
    public InterruptHandle interruptHandle() {
        return interruptHandle;
    }

    void attachInterruptHandle(InterruptHandle handle) {
        this.interruptHandle = handle;
    }

    /**
     * @return true for the first request only
     */
    boolean requestCancel() {
        return cancelRequested.compareAndSet(false, true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }
}
