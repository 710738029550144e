package com.tasksmith.core.run;

import com.tasksmith.core.events.EventLevel;
import com.tasksmith.core.events.RunEventPublisher;
import com.tasksmith.core.events.RunEventType;
import com.tasksmith.core.logging.MdcContext;
import com.tasksmith.core.metrics.TasksmithMetrics;
import com.tasksmith.core.model.Plan;
import com.tasksmith.core.model.PlanStatus;
import com.tasksmith.core.model.Run;
import com.tasksmith.core.model.RunFinalization;
import com.tasksmith.core.model.RunStatus;
import com.tasksmith.core.model.Task;
import com.tasksmith.core.model.TaskStatus;
import com.tasksmith.core.model.TodoItem;
import com.tasksmith.core.persistence.PlanStore;
import com.tasksmith.core.queue.QueueProperties;
import com.tasksmith.core.scheduler.TaskDependencyResolver;
import com.tasksmith.execution.AgentNotice;
import com.tasksmith.execution.AgentNotices;
import com.tasksmith.execution.ExecutionCallbacks;
import com.tasksmith.execution.ExecutionRequest;
import com.tasksmith.execution.ExecutionResult;
import com.tasksmith.execution.ExecutionService;
import com.tasksmith.execution.InterruptHandle;
import com.tasksmith.workspace.PolicyViolationException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts runs, drives them through the execution service and finalizes them.
 *
 * <p>Every terminal write goes through {@link PlanStore#finalizeRun}, which only succeeds
 * while the run is still in progress. The normal execution path, cancellation, the force
 * path and stale-run recovery may race; only the winner of that write updates the task and
 * plan and emits events.
 */
@Service
public class RunExecutor {

    private static final Logger log = LoggerFactory.getLogger(RunExecutor.class);

    public static final String CANCELLED_BY_USER = "Run cancelled by user.";
    public static final String FORCED_CANCEL_REASON = "Cancelled (forced after timeout)";

    private final PlanStore store;
    private final RunTracker tracker;
    private final ExecutionService executionService;
    private final RunEventPublisher events;
    private final TaskDependencyResolver resolver;
    private final QueueProperties properties;
    private final TasksmithMetrics metrics;

    private final Object startLock = new Object();
    private final ExecutorService runWorkers = Executors.newCachedThreadPool(daemonThreads("run-worker-"));
    private final ExecutorService cancelWorkers = Executors.newCachedThreadPool(daemonThreads("run-cancel-"));

    public RunExecutor(PlanStore store, RunTracker tracker, ExecutionService executionService,
                       RunEventPublisher events, TaskDependencyResolver resolver,
                       QueueProperties properties, TasksmithMetrics metrics) {
        this.store = store;
        this.tracker = tracker;
        this.executionService = executionService;
        this.events = events;
        this.resolver = resolver;
        this.properties = properties;
        this.metrics = metrics;
    }

    @PreDestroy
    public void shutdown() {
        runWorkers.shutdownNow();
        cancelWorkers.shutdownNow();
    }

    // ══════════════════════════════════════════════════════════════════════════
    // START AND EXECUTE
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Creates a run for the task and executes it asynchronously.
     *
     * @throws TaskOperationException if the plan or task is missing, or the task already has a run
     */
    public StartedRun startRun(RunRequest request) {
        String planId = request.planId();
        String taskId = request.taskId();
        Plan plan;
        Task task;
        ActiveRun active;

        synchronized (startLock) {
            plan = store.findPlan(planId).orElseThrow(() -> TaskOperationException.planNotFound(planId));
            task = store.findTask(planId, taskId)
                    .orElseThrow(() -> TaskOperationException.taskNotFound(planId, taskId));

            if (task.status() == TaskStatus.IN_PROGRESS
                    || tracker.activeRunForTask(planId, taskId).isPresent()
                    || store.findInProgressRunForTask(planId, taskId).isPresent()) {
                throw new TaskOperationException(TaskOperationException.Reason.CONFLICT,
                        "Task " + taskId + " already has a run in progress.");
            }

            String runId = UUID.randomUUID().toString();
            store.createRun(Run.started(runId, planId, taskId, request.retryCount(), Instant.now()));
            store.updateTaskStatus(planId, taskId, TaskStatus.IN_PROGRESS);
            if (!request.queueManaged()) {
                store.updatePlanStatus(planId, PlanStatus.RUNNING);
            }
            active = tracker.register(runId, planId, taskId, request.queueManaged());
        }

        String runId = active.runId();
        log.info("Starting run {} for task {} of plan {} (retry {}, queueManaged={})",
                runId, taskId, planId, request.retryCount(), request.queueManaged());
        events.info(runId, planId, taskId, RunEventType.STARTED, request.retryCount() > 0
                ? "Task retry #" + request.retryCount() + " started."
                : "Task started.");
        emitTaskStatus(runId, planId, taskId, TaskStatus.IN_PROGRESS);

        try {
            runWorkers.execute(() -> execute(active, plan, task, request));
        } catch (RejectedExecutionException e) {
            log.error("Run worker pool rejected run {}", runId, e);
            RunStatus status = settle(active.planId(), active.taskId(), active.queueManaged(),
                    RunFinalization.failed(runId, Instant.now(), 0L, "Run could not be scheduled."));
            tracker.complete(runId, status);
        }
        return new StartedRun(runId, active.completion());
    }

    void execute(ActiveRun active, Plan plan, Task task, RunRequest request) {
        MdcContext.setRun(active.planId(), active.taskId(), active.runId());
        long start = System.currentTimeMillis();
        RunStatus status = RunStatus.FAILED;
        try {
            if (active.isCancelRequested()) {
                status = finalizeCancelled(active, elapsedSince(start));
                return;
            }

            ExecutionResult result = executionService.runTask(
                    new ExecutionRequest(plan, task, request.retryContext(), request.workingDirectory(),
                            request.branchName()),
                    callbacksFor(active));

            long duration = result.durationMs() != null ? result.durationMs() : elapsedSince(start);
            if (active.isCancelRequested()) {
                status = finalizeCancelled(active, duration);
                return;
            }
            if (result.isFailure()) {
                status = finalizeFailed(active, duration, result,
                        "Execution stopped with reason " + result.stopReason() + ".");
                return;
            }
            if (request.verifier() != null) {
                try {
                    request.verifier().verify();
                } catch (PolicyViolationException e) {
                    log.warn("Run {} rejected by verifier: {}", active.runId(), e.getMessage());
                    status = finalizeFailed(active, duration, result, e.getMessage());
                    return;
                }
            }
            status = finalizeCompleted(active, duration, result);
        } catch (Exception e) {
            if (active.isCancelRequested()) {
                log.info("Run {} ended with {} after cancellation was requested", active.runId(),
                        e.getClass().getSimpleName());
                status = finalizeCancelled(active, elapsedSince(start));
            } else {
                log.error("Run {} failed: {}", active.runId(), e.getMessage(), e);
                status = finalizeFailed(active, elapsedSince(start), null, messageOf(e));
            }
        } finally {
            tracker.complete(active.runId(), status);
            MdcContext.clear();
        }
    }

    private ExecutionCallbacks callbacksFor(ActiveRun active) {
        String runId = active.runId();
        String planId = active.planId();
        String taskId = active.taskId();
        return new ExecutionCallbacks() {
            @Override
            public void onLog(String message) {
                events.info(runId, planId, taskId, RunEventType.LOG, message);
            }

            @Override
            public void onTodo(List<TodoItem> todos) {
                store.addTodoSnapshot(runId, todos);
                events.emit(runId, planId, taskId, RunEventType.TODO_UPDATE, EventLevel.INFO,
                        Map.of("todos", todos));
            }

            @Override
            public void onSession(String sessionId) {
                store.updateRunSession(runId, sessionId);
            }

            @Override
            public void onNotice(AgentNotice notice) {
                EventLevel level = EventLevel.INFO;
                if (notice instanceof AgentNotice.ReviewOutcome review && "blocked".equals(review.status())) {
                    level = EventLevel.ERROR;
                } else if (notice instanceof AgentNotice.StageTransition stage && "failed".equals(stage.status())) {
                    level = EventLevel.ERROR;
                } else if (notice instanceof AgentNotice.Unrecognized unrecognized) {
                    log.debug("Run {} reported unrecognized notice kind {}", runId, unrecognized.kind());
                }
                events.emit(runId, planId, taskId, RunEventType.INFO, level, AgentNotices.toPayload(notice));
            }

            @Override
            public void onInterruptible(InterruptHandle handle) {
                active.attachInterruptHandle(handle);
            }
        };
    }

    // ══════════════════════════════════════════════════════════════════════════
    // CANCELLATION
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Requests cancellation and waits up to the cancel timeout for the execution to stop,
     * falling back to {@link #forceCancelRun(String)}. The interrupt acknowledgment and the
     * run's completion share that one window.
     */
    public CancelResult cancelRun(String runId) {
        Optional<ActiveRun> tracked = tracker.find(runId);
        if (tracked.isEmpty()) {
            return CancelResult.notActive();
        }
        ActiveRun active = tracked.get();
        if (active.requestCancel()) {
            log.info("Cancellation requested for run {}", runId);
        }

        InterruptHandle handle = active.interruptHandle();
        if (handle == null) {
            return forceCancel(runId, "no_handle");
        }
        long timeoutMs = properties.getCancelTimeout().toMillis();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        try {
            handle.interrupt().get(timeoutMs, TimeUnit.MILLISECONDS);
            active.completion().get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            return CancelResult.interrupted();
        } catch (TimeoutException e) {
            log.warn("Run {} did not stop within {}ms, forcing cancellation", runId, timeoutMs);
            return forceCancel(runId, "timeout");
        } catch (ExecutionException e) {
            log.warn("Interrupting run {} failed: {}", runId, messageOf(e.getCause()));
            return forceCancel(runId, "interrupt_failed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return forceCancel(runId, "interrupted");
        }
    }

    /**
     * Runs {@link #cancelRun(String)} on the cancellation pool.
     */
    public CompletableFuture<CancelResult> cancelRunAsync(String runId) {
        return CompletableFuture.supplyAsync(() -> cancelRun(runId), cancelWorkers);
    }

    /**
     * Marks the run cancelled without waiting for its execution. Idempotent: once the run is
     * no longer in progress this only releases the tracker entry.
     */
    public CancelResult forceCancelRun(String runId) {
        return forceCancel(runId, "manual");
    }

    private CancelResult forceCancel(String runId, String metricReason) {
        Optional<ActiveRun> active = tracker.find(runId);
        active.ifPresent(ActiveRun::requestCancel);
        Optional<Run> run = store.findRun(runId);
        if (run.isEmpty()) {
            tracker.complete(runId, RunStatus.CANCELLED);
            return CancelResult.notActive();
        }

        boolean queueManaged = active.map(ActiveRun::queueManaged).orElse(false);
        RunFinalization finalization = RunFinalization.cancelled(runId, Instant.now(), FORCED_CANCEL_REASON);
        boolean won = finalizeAndApply(run.get().planId(), run.get().taskId(), queueManaged, finalization);
        RunStatus status = won ? RunStatus.CANCELLED : currentStatus(runId, RunStatus.CANCELLED);
        tracker.complete(runId, status);

        if (won) {
            metrics.recordForcedCancellation(metricReason);
            log.warn("Run {} force-cancelled ({})", runId, metricReason);
            return CancelResult.forced();
        }
        return CancelResult.alreadyFinalized();
    }

    /**
     * Cancels a persisted in-progress run that no thread of this process executes.
     *
     * @return true if this call finalized the run
     */
    public boolean finalizeOrphan(Run run, String reason) {
        boolean won = finalizeAndApply(run.planId(), run.taskId(), false,
                RunFinalization.cancelled(run.id(), Instant.now(), reason));
        tracker.complete(run.id(), won ? RunStatus.CANCELLED : currentStatus(run.id(), RunStatus.CANCELLED));
        return won;
    }

    // ══════════════════════════════════════════════════════════════════════════
    // FINALIZATION
    // ══════════════════════════════════════════════════════════════════════════

    private RunStatus finalizeCompleted(ActiveRun active, long durationMs, ExecutionResult result) {
        if (active.isCancelRequested()) {
            return finalizeCancelled(active, durationMs);
        }
        return settle(active.planId(), active.taskId(), active.queueManaged(), new RunFinalization(
                active.runId(), RunStatus.COMPLETED, Instant.now(), durationMs, result.sessionId(),
                result.resultText(), result.costUsd(), result.stopReason(), null));
    }

    private RunStatus finalizeFailed(ActiveRun active, long durationMs, ExecutionResult result, String reason) {
        return settle(active.planId(), active.taskId(), active.queueManaged(), new RunFinalization(
                active.runId(), RunStatus.FAILED, Instant.now(), durationMs,
                result != null ? result.sessionId() : null,
                result != null ? result.resultText() : null,
                result != null ? result.costUsd() : null,
                result != null ? result.stopReason() : null,
                reason));
    }

    private RunStatus finalizeCancelled(ActiveRun active, long durationMs) {
        return settle(active.planId(), active.taskId(), active.queueManaged(), new RunFinalization(
                active.runId(), RunStatus.CANCELLED, Instant.now(), durationMs,
                null, null, null, null, CANCELLED_BY_USER));
    }

    /**
     * Attempts the finalization and returns the status the run actually ended with.
     */
    private RunStatus settle(String planId, String taskId, boolean queueManaged, RunFinalization finalization) {
        if (finalizeAndApply(planId, taskId, queueManaged, finalization)) {
            return finalization.status();
        }
        return currentStatus(finalization.runId(), finalization.status());
    }

    /**
     * The single finalization path. Writes the terminal status conditionally; if this call
     * won, updates task and plan, appends a progress entry and emits the terminal events.
     *
     * @return true if this call finalized the run
     */
    private boolean finalizeAndApply(String planId, String taskId, boolean queueManaged, RunFinalization f) {
        if (!store.finalizeRun(f)) {
            log.debug("Run {} was already finalized; skipping {} write", f.runId(), f.status().value());
            return false;
        }

        TaskStatus taskStatus = switch (f.status()) {
            case COMPLETED -> TaskStatus.COMPLETED;
            case FAILED -> TaskStatus.FAILED;
            case CANCELLED -> TaskStatus.PENDING;
            default -> throw new IllegalStateException("Not a terminal status: " + f.status());
        };
        store.updateTaskStatus(planId, taskId, taskStatus);
        if (!queueManaged) {
            store.updatePlanStatus(planId, planStatusAfter(planId, f.status()));
        }

        store.appendProgressEntry(planId, f.runId(), f.status(), progressText(taskId, f));
        metrics.recordRunResult(f.status().value());
        if (f.durationMs() != null) {
            metrics.recordRunDuration(f.durationMs());
        }

        var payload = new LinkedHashMap<String, Object>();
        switch (f.status()) {
            case COMPLETED -> {
                payload.put("message", "Task " + taskId + " completed.");
                if (f.stopReason() != null) payload.put("stopReason", f.stopReason());
                if (f.costUsd() != null) payload.put("costUsd", f.costUsd());
                if (f.durationMs() != null) payload.put("durationMs", f.durationMs());
                events.emit(f.runId(), planId, taskId, RunEventType.COMPLETED, EventLevel.INFO, payload);
            }
            case FAILED -> {
                payload.put("message", f.errorText());
                events.emit(f.runId(), planId, taskId, RunEventType.FAILED, EventLevel.ERROR, payload);
            }
            default -> {
                payload.put("message", CANCELLED_BY_USER);
                payload.put("reason", f.errorText());
                events.emit(f.runId(), planId, taskId, RunEventType.CANCELLED, EventLevel.INFO, payload);
            }
        }
        emitTaskStatus(f.runId(), planId, taskId, taskStatus);
        log.info("Run {} finalized as {} (task {} -> {})", f.runId(), f.status().value(), taskId, taskStatus.value());
        return true;
    }

    private PlanStatus planStatusAfter(String planId, RunStatus status) {
        return switch (status) {
            case COMPLETED -> resolver.allSettled(store.listTasks(planId)) ? PlanStatus.COMPLETED : PlanStatus.READY;
            case FAILED -> PlanStatus.FAILED;
            default -> PlanStatus.READY;
        };
    }

    private static String progressText(String taskId, RunFinalization f) {
        return switch (f.status()) {
            case COMPLETED -> "Task " + taskId + " completed."
                    + (f.resultText() != null && !f.resultText().isBlank() ? "\n\n" + f.resultText().strip() : "");
            case FAILED -> "Task " + taskId + " failed: " + f.errorText();
            default -> "Task " + taskId + " cancelled: " + f.errorText();
        };
    }

    private void emitTaskStatus(String runId, String planId, String taskId, TaskStatus status) {
        events.emit(runId, planId, taskId, RunEventType.TASK_STATUS, EventLevel.INFO,
                Map.of("status", status.value(), "message", "Task " + taskId + " is now " + status.value() + "."));
    }

    private RunStatus currentStatus(String runId, RunStatus fallback) {
        return store.findRun(runId).map(Run::status).filter(RunStatus::isTerminal).orElse(fallback);
    }

    private static long elapsedSince(long startMs) {
        return System.currentTimeMillis() - startMs;
    }

    private static String messageOf(Throwable e) {
        if (e == null) {
            return "Unknown error";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
