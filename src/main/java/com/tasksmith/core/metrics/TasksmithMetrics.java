package com.tasksmith.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for run and queue execution.
 */
@Service
public class TasksmithMetrics {

    private final MeterRegistry registry;

    public TasksmithMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunResult(String status) {
        Counter.builder("tasksmith.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRunDuration(long ms) {
        Timer.builder("tasksmith.run.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordQueueResult(String outcome) {
        Counter.builder("tasksmith.queues.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records how many tasks a phase started concurrently.
     *
     * @param taskCount number of tasks in the phase
     * @param mode      "parallel" or "sequential"
     */
    public void recordPhaseExecution(int taskCount, String mode) {
        Counter.builder("tasksmith.phase.executions")
                .description("Phase executions by mode")
                .tag("mode", mode)
                .register(registry)
                .increment();
        DistributionSummary.builder("tasksmith.phase.size")
                .description("Number of tasks per phase")
                .register(registry)
                .record(taskCount);
    }

    public void recordMerge() {
        Counter.builder("tasksmith.merge.total")
                .description("Task branches merged into the target branch")
                .register(registry)
                .increment();
    }

    /**
     * Records a merge that conflicted and was aborted.
     */
    public void recordMergeConflict() {
        Counter.builder("tasksmith.merge.conflicts")
                .description("Merge conflicts while merging task branches")
                .register(registry)
                .increment();
    }

    public void recordPolicyViolation(String kind) {
        Counter.builder("tasksmith.policy.violations")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * Records worktree operations for monitoring queue health.
     *
     * @param operation "create", "remove" or "cleanup"
     * @param success   whether the operation succeeded
     */
    public void recordWorktreeOperation(String operation, boolean success) {
        Counter.builder("tasksmith.worktree.operations")
                .description("Git worktree lifecycle operations")
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordForcedCancellation(String reason) {
        Counter.builder("tasksmith.cancellations.forced")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordStaleRunsRecovered(int count) {
        Counter.builder("tasksmith.runs.stale_recovered")
                .register(registry)
                .increment(count);
    }

    public void recordNotificationFailure() {
        Counter.builder("tasksmith.notifications.failed")
                .register(registry)
                .increment();
    }
}
