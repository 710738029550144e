package com.tasksmith.core.run;

import com.tasksmith.core.events.EventLevel;
import com.tasksmith.core.events.RunEventPublisher;
import com.tasksmith.core.events.RunEventType;
import com.tasksmith.core.model.PlanStatus;
import com.tasksmith.core.model.Run;
import com.tasksmith.core.model.Task;
import com.tasksmith.core.model.TaskStatus;
import com.tasksmith.core.persistence.PlanStore;
import com.tasksmith.core.queue.QueueOrchestrator;
import com.tasksmith.core.queue.QueueProperties;
import com.tasksmith.core.scheduler.TaskDependencyResolver;
import com.tasksmith.execution.RetryContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * User-initiated task operations outside the queue: manual run, retry and skip.
 */
@Service
public class RetryController {

    private static final Logger log = LoggerFactory.getLogger(RetryController.class);

    private final PlanStore store;
    private final RunExecutor runExecutor;
    private final QueueOrchestrator queueOrchestrator;
    private final TaskDependencyResolver resolver;
    private final RunEventPublisher events;
    private final QueueProperties properties;

    public RetryController(PlanStore store, RunExecutor runExecutor, QueueOrchestrator queueOrchestrator,
                           TaskDependencyResolver resolver, RunEventPublisher events,
                           QueueProperties properties) {
        this.store = store;
        this.runExecutor = runExecutor;
        this.queueOrchestrator = queueOrchestrator;
        this.resolver = resolver;
        this.events = events;
        this.properties = properties;
    }

    /**
     * Starts another attempt of a failed task in the project directory.
     *
     * @throws RetryLimitExceededException if the attempt would exceed the configured maximum
     * @throws TaskOperationException      if the task is missing, not failed, or a queue is running
     */
    public StartedRun retryTask(String planId, String taskId) {
        Task task = requireTask(planId, taskId);
        requireNoQueue(planId);
        if (task.status() != TaskStatus.FAILED) {
            throw new TaskOperationException(TaskOperationException.Reason.INVALID_STATE,
                    "Task " + taskId + " is not in a failed state (current: " + task.status().value()
                            + "). Only failed tasks can be retried.");
        }

        Optional<Run> lastFailure = store.findLatestFailedRun(planId, taskId);
        int ordinal = lastFailure.map(run -> run.retryCount() + 1).orElse(1);
        if (ordinal > properties.getMaxRetries()) {
            throw new RetryLimitExceededException(taskId, properties.getMaxRetries());
        }

        var context = new RetryContext(lastFailure.map(Run::errorText).orElse(null), ordinal);
        log.info("Retrying task {} of plan {} (attempt #{})", taskId, planId, ordinal);
        return runExecutor.startRun(RunRequest.retry(planId, taskId, context));
    }

    /**
     * Marks a failed task as skipped so dependants can proceed.
     */
    public void skipTask(String planId, String taskId) {
        Task task = requireTask(planId, taskId);
        if (task.status() != TaskStatus.FAILED) {
            throw new TaskOperationException(TaskOperationException.Reason.INVALID_STATE,
                    "Task " + taskId + " is not in a failed state (current: " + task.status().value()
                            + "). Only failed tasks can be skipped.");
        }

        store.updateTaskStatus(planId, taskId, TaskStatus.SKIPPED);
        PlanStatus planStatus = resolver.allSettled(store.listTasks(planId)) ? PlanStatus.COMPLETED : PlanStatus.READY;
        store.updatePlanStatus(planId, planStatus);

        log.info("Task {} of plan {} skipped; plan is now {}", taskId, planId, planStatus.value());
        events.info(null, planId, taskId, RunEventType.INFO, "Task " + taskId + " skipped by user.");
        events.emit(null, planId, taskId, RunEventType.TASK_STATUS, EventLevel.INFO,
                Map.of("status", TaskStatus.SKIPPED.value(), "message", "Task " + taskId + " is now skipped."));
    }

    /**
     * Starts a single first-attempt run of a pending task outside the queue. Failed tasks go
     * through {@link #retryTask} so their attempt ordinal keeps counting.
     */
    public StartedRun runTask(String planId, String taskId) {
        Task task = requireTask(planId, taskId);
        requireNoQueue(planId);
        if (task.status() == TaskStatus.FAILED) {
            throw new TaskOperationException(TaskOperationException.Reason.INVALID_STATE,
                    "Task " + taskId + " has failed; use retry to start another attempt.");
        }
        if (task.status() != TaskStatus.PENDING) {
            throw new TaskOperationException(TaskOperationException.Reason.INVALID_STATE,
                    "Task " + taskId + " cannot be run from status " + task.status().value() + ".");
        }
        return runExecutor.startRun(RunRequest.manual(planId, taskId));
    }

    private Task requireTask(String planId, String taskId) {
        if (store.findPlan(planId).isEmpty()) {
            throw TaskOperationException.planNotFound(planId);
        }
        return store.findTask(planId, taskId)
                .orElseThrow(() -> TaskOperationException.taskNotFound(planId, taskId));
    }

    private void requireNoQueue(String planId) {
        if (queueOrchestrator.isQueueRunning(planId)) {
            throw new TaskOperationException(TaskOperationException.Reason.CONFLICT,
                    QueueOrchestrator.REASON_ALREADY_RUNNING);
        }
    }
}
