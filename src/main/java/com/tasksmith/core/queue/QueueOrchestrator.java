package com.tasksmith.core.queue;

import com.tasksmith.core.events.EventLevel;
import com.tasksmith.core.events.RunEventPublisher;
import com.tasksmith.core.events.RunEventType;
import com.tasksmith.core.logging.MdcContext;
import com.tasksmith.core.metrics.TasksmithMetrics;
import com.tasksmith.core.model.Plan;
import com.tasksmith.core.model.PlanStatus;
import com.tasksmith.core.model.RunStatus;
import com.tasksmith.core.model.Task;
import com.tasksmith.core.model.TaskStatus;
import com.tasksmith.core.persistence.PlanStore;
import com.tasksmith.core.run.ActiveRun;
import com.tasksmith.core.run.RunExecutor;
import com.tasksmith.core.run.RunRequest;
import com.tasksmith.core.run.RunTracker;
import com.tasksmith.core.run.StaleRunRecovery;
import com.tasksmith.core.run.StartedRun;
import com.tasksmith.core.run.TaskOperationException;
import com.tasksmith.core.scheduler.TaskDependencyResolver;
import com.tasksmith.workspace.GitCommandException;
import com.tasksmith.workspace.GitWorkspaceManager;
import com.tasksmith.workspace.PhaseWorktree;
import com.tasksmith.workspace.PolicyViolationException;
import com.tasksmith.workspace.QueueGitContext;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every runnable task of a plan, phase by phase.
 *
 * <p>A phase is the set of tasks runnable when it begins (or only the next one when parallel
 * mode is off). Each task of a phase gets its own git worktree branched from the merge target's
 * HEAD; all worktrees are created before any run starts. Completed runs are merged back into
 * the target in the order they finish. The first failed run, merge conflict or policy violation
 * cancels the rest of the phase and ends the queue; tasks of that phase that completed without
 * being merged go back to pending.
 */
@Service
public class QueueOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(QueueOrchestrator.class);

    public static final String REASON_PLAN_NOT_FOUND = "Plan not found.";
    public static final String REASON_ALREADY_RUNNING = "Queue is already running for this plan.";
    public static final String REASON_TASK_RUNNING = "A task is already running for this plan.";
    public static final String REASON_NO_RUNNABLE = "No runnable tasks for this plan.";
    public static final String REASON_STARTED = "Queue started.";
    public static final String REASON_NOT_RUNNING = "Queue is not running for this plan.";
    public static final String REASON_ABORTED = "Queue execution aborted by user.";

    /** Extra wait on top of the cancel timeout, covering the force path. */
    private static final long FORCE_GRACE_MS = 5_000;

    private final PlanStore store;
    private final TaskDependencyResolver resolver;
    private final RunExecutor runExecutor;
    private final RunTracker tracker;
    private final StaleRunRecovery staleRunRecovery;
    private final GitWorkspaceManager git;
    private final RunEventPublisher events;
    private final QueueProperties properties;
    private final TasksmithMetrics metrics;

    private final Set<String> runningQueues = ConcurrentHashMap.newKeySet();
    private final Set<String> abortedQueues = ConcurrentHashMap.newKeySet();
    private final ExecutorService queueWorkers;

    public QueueOrchestrator(PlanStore store, TaskDependencyResolver resolver, RunExecutor runExecutor,
                             RunTracker tracker, StaleRunRecovery staleRunRecovery, GitWorkspaceManager git,
                             RunEventPublisher events, QueueProperties properties, TasksmithMetrics metrics) {
        this.store = store;
        this.resolver = resolver;
        this.runExecutor = runExecutor;
        this.tracker = tracker;
        this.staleRunRecovery = staleRunRecovery;
        this.git = git;
        this.events = events;
        this.properties = properties;
        this.metrics = metrics;
        var counter = new AtomicInteger();
        this.queueWorkers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "queue-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        queueWorkers.shutdownNow();
    }

    // ══════════════════════════════════════════════════════════════════════════
    // START AND ABORT
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Starts the queue loop for a plan unless something prevents it.
     *
     * @return whether the loop started, with one of the stable {@code REASON_*} messages
     */
    public QueueStartResult runAll(String planId) {
        var plan = store.findPlan(planId);
        if (plan.isEmpty()) {
            return QueueStartResult.refused(REASON_PLAN_NOT_FOUND);
        }
        if (!runningQueues.add(planId)) {
            return QueueStartResult.refused(REASON_ALREADY_RUNNING);
        }

        boolean handedOff = false;
        try {
            if (!tracker.activeRunsForPlan(planId).isEmpty()) {
                return QueueStartResult.refused(REASON_TASK_RUNNING);
            }
            staleRunRecovery.reconcilePlan(planId);
            int runnable = resolver.countRunnable(store.listTasks(planId));
            if (runnable == 0) {
                return QueueStartResult.refused(REASON_NO_RUNNABLE);
            }

            abortedQueues.remove(planId);
            var completion = new CompletableFuture<QueueOutcome>();
            queueWorkers.execute(() -> runQueue(plan.get(), completion));
            handedOff = true;
            log.info("Queue started for plan {} with {} runnable task(s)", planId, runnable);
            return QueueStartResult.started(runnable, completion);
        } catch (RejectedExecutionException e) {
            log.error("Queue pool rejected plan {}", planId, e);
            throw new IllegalStateException("Queue could not be scheduled for plan " + planId, e);
        } finally {
            if (!handedOff) {
                runningQueues.remove(planId);
            }
        }
    }

    /**
     * Stops a running queue: cancels its in-flight runs and returns the plan to ready.
     * The loop itself exits at its next checkpoint.
     */
    public QueueAbortResult abortQueue(String planId) {
        if (!runningQueues.contains(planId)) {
            return new QueueAbortResult(false, REASON_NOT_RUNNING);
        }
        abortedQueues.add(planId);
        for (ActiveRun run : tracker.activeRunsForPlan(planId)) {
            runExecutor.cancelRunAsync(run.runId());
        }
        store.updatePlanStatus(planId, PlanStatus.READY);
        events.planEvent(planId, RunEventType.INFO, EventLevel.INFO, Map.of("message", REASON_ABORTED));
        log.info("Queue for plan {} aborted by user", planId);
        return new QueueAbortResult(true, REASON_ABORTED);
    }

    public boolean isQueueRunning(String planId) {
        return runningQueues.contains(planId);
    }

    private boolean isAborted(String planId) {
        return abortedQueues.contains(planId);
    }

    // ══════════════════════════════════════════════════════════════════════════
    // QUEUE LOOP
    // ══════════════════════════════════════════════════════════════════════════

    private void runQueue(Plan plan, CompletableFuture<QueueOutcome> completion) {
        String planId = plan.id();
        MdcContext.setPlan(planId);
        boolean parallel = parallelEnabled();
        QueueGitContext context = null;
        QueueOutcome outcome = null;
        int phase = 0;
        try {
            store.updatePlanStatus(planId, PlanStatus.RUNNING);
            events.planEvent(planId, RunEventType.QUEUE_STARTED, EventLevel.INFO,
                    Map.of("message", REASON_STARTED, "parallel", parallel));

            context = git.openQueueContext(planId, Path.of(plan.projectPath()));
            String expectedHead = git.targetHead(context);

            while (outcome == null) {
                if (isAborted(planId)) {
                    outcome = new QueueOutcome(QueueOutcome.Status.ABORTED, REASON_ABORTED, phase);
                    break;
                }
                List<Task> tasks = store.listTasks(planId);
                List<Task> phaseTasks = parallel
                        ? resolver.runnableTasks(tasks)
                        : resolver.nextRunnable(tasks).map(List::of).orElse(List.of());
                if (phaseTasks.isEmpty()) {
                    outcome = settledOutcome(tasks, phase);
                    break;
                }

                phase++;
                PhaseResult result = runPhase(context, planId, phase, phaseTasks, expectedHead, parallel);
                expectedHead = result.head();
                if (result.aborted()) {
                    outcome = new QueueOutcome(QueueOutcome.Status.ABORTED, REASON_ABORTED, phase);
                } else if (result.failure() != null) {
                    outcome = new QueueOutcome(QueueOutcome.Status.FAILED, result.failure(), phase);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = new QueueOutcome(QueueOutcome.Status.FAILED, "Queue interrupted.", phase);
        } catch (Exception e) {
            log.error("Queue for plan {} failed: {}", planId, e.getMessage(), e);
            outcome = new QueueOutcome(QueueOutcome.Status.FAILED, "Queue failed: " + e.getMessage(), phase);
        } finally {
            if (outcome == null) {
                outcome = new QueueOutcome(QueueOutcome.Status.FAILED, "Queue stopped unexpectedly.", phase);
            }
            finishQueue(planId, outcome);
            if (context != null) {
                closeContext(context);
            }
            runningQueues.remove(planId);
            abortedQueues.remove(planId);
            MdcContext.clear();
            completion.complete(outcome);
        }
    }

    private QueueOutcome settledOutcome(List<Task> tasks, int phases) {
        if (resolver.allSettled(tasks)) {
            return new QueueOutcome(QueueOutcome.Status.COMPLETED, "All tasks completed.", phases);
        }
        long blocked = tasks.stream().filter(t -> !t.status().isSettled()).count();
        return new QueueOutcome(QueueOutcome.Status.STALLED,
                "No runnable tasks remain; " + blocked + " task(s) are not settled.", phases);
    }

    private void finishQueue(String planId, QueueOutcome outcome) {
        try {
            PlanStatus planStatus = switch (outcome.status()) {
                case COMPLETED -> PlanStatus.COMPLETED;
                case FAILED -> PlanStatus.FAILED;
                case ABORTED -> PlanStatus.READY;
                case STALLED -> store.listTasks(planId).stream().anyMatch(t -> t.status() == TaskStatus.FAILED)
                        ? PlanStatus.FAILED : PlanStatus.READY;
            };
            store.updatePlanStatus(planId, planStatus);
        } catch (RuntimeException e) {
            log.error("Could not record queue outcome for plan {}: {}", planId, e.getMessage(), e);
        }
        String outcomeName = outcome.status().name().toLowerCase();
        events.planEvent(planId, RunEventType.QUEUE_FINISHED,
                outcome.status() == QueueOutcome.Status.FAILED ? EventLevel.ERROR : EventLevel.INFO,
                Map.of("outcome", outcomeName, "reason", outcome.reason(), "message", outcome.reason()));
        metrics.recordQueueResult(outcomeName);
        log.info("Queue for plan {} finished: {} ({})", planId, outcomeName, outcome.reason());
    }

    private void closeContext(QueueGitContext context) {
        try {
            git.closeQueueContext(context);
        } catch (RuntimeException e) {
            metrics.recordWorktreeOperation("cleanup", false);
            log.warn("Queue cleanup for plan {} failed: {}", context.planId(), e.getMessage());
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    // PHASE EXECUTION
    // ══════════════════════════════════════════════════════════════════════════

    private PhaseResult runPhase(QueueGitContext context, String planId, int phase, List<Task> tasks,
                                 String expectedHead, boolean parallel) throws InterruptedException {
        MdcContext.setPhase(planId, phase);
        List<String> taskIds = tasks.stream().map(Task::id).toList();
        log.info("Phase {} of plan {}: {}", phase, planId, taskIds);
        events.planEvent(planId, RunEventType.PHASE_STARTED, EventLevel.INFO, Map.of(
                "phase", phase, "taskIds", taskIds,
                "message", "Phase " + phase + " started with " + taskIds.size() + " task(s)."));
        metrics.recordPhaseExecution(tasks.size(), parallel ? "parallel" : "sequential");

        String base = git.targetHead(context);
        Map<String, PhaseWorktree> worktrees = new LinkedHashMap<>();
        for (Task task : tasks) {
            try {
                worktrees.put(task.id(), git.createPhaseWorktree(context, task.id(), phase, base));
            } catch (GitCommandException e) {
                log.error("Worktree creation failed for task {}: {}", task.id(), e.getMessage());
                discardWorktrees(context, worktrees, true);
                return PhaseResult.failed("Failed to create worktree for task " + task.id() + ": "
                        + e.getMessage(), expectedHead);
            }
        }

        Map<String, StartedRun> started = new LinkedHashMap<>();
        Map<String, StartedRun> inFlight = new LinkedHashMap<>();
        Set<String> merged = new HashSet<>();
        var finished = new LinkedBlockingQueue<RunCompletion>();
        String failure = null;
        for (Task task : tasks) {
            PhaseWorktree worktree = worktrees.get(task.id());
            try {
                StartedRun run = runExecutor.startRun(RunRequest.queued(planId, task.id(), worktree.path(),
                        worktree.branch(), () -> git.validateTaskCommits(context, worktree)));
                started.put(task.id(), run);
                inFlight.put(task.id(), run);
                run.completion().whenComplete((status, error) ->
                        finished.add(new RunCompletion(task.id(), run.runId(), error == null ? status : RunStatus.FAILED)));
            } catch (TaskOperationException e) {
                failure = "Failed to start task " + task.id() + ": " + e.getMessage();
                log.error(failure);
                break;
            }
        }

        String head = expectedHead;
        boolean aborted = false;
        while (failure == null && !inFlight.isEmpty()) {
            RunCompletion done = finished.take();
            inFlight.remove(done.taskId());
            PhaseWorktree worktree = worktrees.get(done.taskId());

            if (done.status() != RunStatus.COMPLETED) {
                if (isAborted(planId)) {
                    aborted = true;
                    break;
                }
                failure = runFailureReason(done);
                break;
            }

            try {
                head = git.mergeWorktree(context, worktree, head);
                events.emit(done.runId(), planId, done.taskId(), RunEventType.TASK_MERGED, EventLevel.INFO, Map.of(
                        "branch", worktree.branch(), "commit", head,
                        "message", "Task " + done.taskId() + " merged into " + context.mergeTarget() + "."));
                merged.add(done.taskId());
                git.releaseWorktree(context, worktree, true);
                worktrees.remove(done.taskId());
            } catch (GitCommandException | PolicyViolationException e) {
                failure = e.getMessage();
                recordMergeFailure(planId, done, failure);
                break;
            }

            if (isAborted(planId)) {
                aborted = true;
                break;
            }
        }

        if (failure != null || aborted) {
            cancelInFlight(inFlight);
            reopenUnmerged(planId, started, merged);
            discardWorktrees(context, worktrees, false);
            return aborted ? PhaseResult.aborted(head) : PhaseResult.failed(failure, head);
        }

        events.planEvent(planId, RunEventType.PHASE_COMPLETED, EventLevel.INFO, Map.of(
                "phase", phase, "taskIds", taskIds, "message", "Phase " + phase + " completed."));
        return PhaseResult.completed(head);
    }

    private String runFailureReason(RunCompletion done) {
        String detail = store.findRun(done.runId())
                .map(run -> run.errorText())
                .filter(text -> text != null && !text.isBlank())
                .orElse(null);
        return "Task " + done.taskId() + " " + done.status().value() + (detail != null ? ": " + detail : ".");
    }

    /**
     * The run itself stays completed; the task is failed so it can be retried once the
     * cause is resolved.
     */
    private void recordMergeFailure(String planId, RunCompletion done, String reason) {
        log.error("Merge of task {} failed: {}", done.taskId(), reason);
        store.updateTaskStatus(planId, done.taskId(), TaskStatus.FAILED);
        store.appendProgressEntry(planId, done.runId(), RunStatus.FAILED,
                "Task " + done.taskId() + " failed to merge: " + reason);
        events.error(done.runId(), planId, done.taskId(), RunEventType.FAILED, reason);
        events.emit(done.runId(), planId, done.taskId(), RunEventType.TASK_STATUS, EventLevel.INFO, Map.of(
                "status", TaskStatus.FAILED.value(),
                "message", "Task " + done.taskId() + " is now " + TaskStatus.FAILED.value() + "."));
    }

    /**
     * Returns tasks whose run completed but was never merged to pending. Their worktree
     * branches are discarded, so the merge target does not contain their work.
     */
    private void reopenUnmerged(String planId, Map<String, StartedRun> started, Set<String> merged) {
        for (Map.Entry<String, StartedRun> entry : started.entrySet()) {
            String taskId = entry.getKey();
            String runId = entry.getValue().runId();
            if (merged.contains(taskId)) {
                continue;
            }
            boolean runCompleted = store.findRun(runId).map(run -> run.status() == RunStatus.COMPLETED).orElse(false);
            boolean taskCompleted = store.findTask(planId, taskId)
                    .map(task -> task.status() == TaskStatus.COMPLETED).orElse(false);
            if (!runCompleted || !taskCompleted) {
                continue;
            }
            String message = "Task " + taskId + " completed but was not merged; returned to pending.";
            log.warn("Task {} of plan {} completed but was not merged; returning it to pending", taskId, planId);
            store.updateTaskStatus(planId, taskId, TaskStatus.PENDING);
            store.appendProgressEntry(planId, runId, RunStatus.COMPLETED, message);
            events.emit(runId, planId, taskId, RunEventType.TASK_STATUS, EventLevel.INFO, Map.of(
                    "status", TaskStatus.PENDING.value(), "reason", "not_merged", "message", message));
        }
    }

    /**
     * Cancels every run still in flight and waits for each to settle, forcing the ones that
     * outlast the deadline.
     */
    private void cancelInFlight(Map<String, StartedRun> inFlight) {
        if (inFlight.isEmpty()) {
            return;
        }
        log.info("Cancelling {} sibling run(s): {}", inFlight.size(), inFlight.keySet());
        for (StartedRun run : inFlight.values()) {
            runExecutor.cancelRunAsync(run.runId());
        }
        long deadline = System.currentTimeMillis() + properties.getCancelTimeout().toMillis() + FORCE_GRACE_MS;
        for (StartedRun run : inFlight.values()) {
            long remaining = Math.max(0, deadline - System.currentTimeMillis());
            try {
                run.completion().get(remaining, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("Run {} still active after cancellation; forcing", run.runId());
                runExecutor.forceCancelRun(run.runId());
            } catch (ExecutionException e) {
                log.warn("Run {} completed exceptionally: {}", run.runId(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                runExecutor.forceCancelRun(run.runId());
            }
        }
    }

    private void discardWorktrees(QueueGitContext context, Map<String, PhaseWorktree> worktrees, boolean deleteBranches) {
        for (PhaseWorktree worktree : new ArrayList<>(worktrees.values())) {
            try {
                git.releaseWorktree(context, worktree, deleteBranches);
            } catch (RuntimeException e) {
                log.warn("Could not discard worktree of task {}: {}", worktree.taskId(), e.getMessage());
            }
        }
        worktrees.clear();
    }

    private boolean parallelEnabled() {
        return store.getSetting(PlanStore.SETTING_QUEUE_PARALLEL_ENABLED)
                .map(value -> Boolean.parseBoolean(value.strip()))
                .orElse(properties.isParallelEnabled());
    }

    private record RunCompletion(String taskId, String runId, RunStatus status) {}

    private record PhaseResult(String head, String failure, boolean aborted) {

        static PhaseResult completed(String head) {
            return new PhaseResult(head, null, false);
        }

        static PhaseResult failed(String reason, String head) {
            return new PhaseResult(head, reason, false);
        }

        static PhaseResult aborted(String head) {
            return new PhaseResult(head, null, true);
        }
    }
}
