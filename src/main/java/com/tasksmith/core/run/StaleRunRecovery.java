package com.tasksmith.core.run;

import com.tasksmith.core.metrics.TasksmithMetrics;
import com.tasksmith.core.model.Run;
import com.tasksmith.core.persistence.PlanStore;
import com.tasksmith.core.persistence.PlanStoreException;
import com.tasksmith.core.queue.QueueProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Resets runs that the store still lists as in progress but that no thread of this process
 * is executing, typically left behind by a crash or restart.
 */
@Component
public class StaleRunRecovery {

    private static final Logger log = LoggerFactory.getLogger(StaleRunRecovery.class);

    public static final String STALE_REASON = "Cancelled (stale run cleaned up on startup)";
    public static final String ORPHAN_REASON = "Cancelled (orphaned run reconciled before queue start)";

    private final PlanStore store;
    private final RunTracker tracker;
    private final RunExecutor runExecutor;
    private final QueueProperties properties;
    private final TasksmithMetrics metrics;

    public StaleRunRecovery(PlanStore store, RunTracker tracker, RunExecutor runExecutor,
                            QueueProperties properties, TasksmithMetrics metrics) {
        this.store = store;
        this.tracker = tracker;
        this.runExecutor = runExecutor;
        this.properties = properties;
        this.metrics = metrics;
    }

    @EventListener(ApplicationStartedEvent.class)
    public void onApplicationStarted() {
        try {
            sweep();
        } catch (PlanStoreException e) {
            log.error("Stale run sweep failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Cancels every untracked in-progress run older than the stale threshold.
     *
     * @return number of runs reset
     */
    public int sweep() {
        Instant cutoff = Instant.now().minus(properties.getStaleRunThreshold());
        int recovered = reset(store.findStaleInProgressRuns(cutoff), STALE_REASON);
        if (recovered > 0) {
            metrics.recordStaleRunsRecovered(recovered);
            log.info("Recovered {} stale run(s) started before {}", recovered, cutoff);
        }
        return recovered;
    }

    /**
     * Cancels every untracked in-progress run of one plan, regardless of age.
     *
     * @return number of runs reset
     */
    public int reconcilePlan(String planId) {
        int recovered = reset(store.findInProgressRuns(planId), ORPHAN_REASON);
        if (recovered > 0) {
            metrics.recordStaleRunsRecovered(recovered);
            log.info("Reconciled {} orphaned run(s) of plan {}", recovered, planId);
        }
        return recovered;
    }

    private int reset(List<Run> candidates, String reason) {
        int count = 0;
        for (Run run : candidates) {
            if (tracker.isTracked(run.id())) {
                continue;
            }
            if (runExecutor.finalizeOrphan(run, reason)) {
                log.debug("Reset run {} of task {} (started {})", run.id(), run.taskId(), run.startedAt());
                count++;
            }
        }
        return count;
    }
}
