package com.tasksmith.core.plan;

import com.tasksmith.core.events.EventLevel;
import com.tasksmith.core.events.RunEventPublisher;
import com.tasksmith.core.events.RunEventType;
import com.tasksmith.core.model.Plan;
import com.tasksmith.core.persistence.PlanStore;
import com.tasksmith.core.queue.QueueOrchestrator;
import com.tasksmith.core.run.RunTracker;
import com.tasksmith.core.run.TaskOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;

/**
 * Archiving, restoring and deleting plans.
 *
 * <p>All three are refused while the plan has a running queue or an active run, so a worktree
 * or a run finalization never outlives the rows it writes to.
 */
@Service
public class PlanLifecycle {

    private static final Logger log = LoggerFactory.getLogger(PlanLifecycle.class);

    private final PlanStore store;
    private final QueueOrchestrator queueOrchestrator;
    private final RunTracker tracker;
    private final RunEventPublisher events;

    public PlanLifecycle(PlanStore store, QueueOrchestrator queueOrchestrator, RunTracker tracker,
                         RunEventPublisher events) {
        this.store = store;
        this.queueOrchestrator = queueOrchestrator;
        this.tracker = tracker;
        this.events = events;
    }

    /**
     * Hides the plan from the default listing. Archiving an archived plan keeps its original time.
     *
     * @throws TaskOperationException if the plan is missing or busy
     */
    public Plan archive(String planId) {
        Plan plan = requireIdle(planId, "archived");
        if (plan.archived()) {
            return plan;
        }
        store.setPlanArchived(planId, Instant.now());
        log.info("Plan {} archived", planId);
        events.planEvent(planId, RunEventType.INFO, EventLevel.INFO, Map.of("message", "Plan archived."));
        return reload(planId);
    }

    /**
     * Returns an archived plan to the active listing.
     *
     * @throws TaskOperationException if the plan is missing or busy
     */
    public Plan unarchive(String planId) {
        Plan plan = requireIdle(planId, "restored");
        if (!plan.archived()) {
            return plan;
        }
        store.setPlanArchived(planId, null);
        log.info("Plan {} restored from archive", planId);
        events.planEvent(planId, RunEventType.INFO, EventLevel.INFO, Map.of("message", "Plan restored."));
        return reload(planId);
    }

    /**
     * Removes the plan and its whole history.
     *
     * @throws TaskOperationException if the plan is missing or busy
     */
    public void delete(String planId) {
        requireIdle(planId, "deleted");
        if (!store.deletePlan(planId)) {
            throw TaskOperationException.planNotFound(planId);
        }
        log.info("Plan {} deleted", planId);
    }

    private Plan requireIdle(String planId, String action) {
        Plan plan = store.findPlan(planId).orElseThrow(() -> TaskOperationException.planNotFound(planId));
        if (queueOrchestrator.isQueueRunning(planId)) {
            throw new TaskOperationException(TaskOperationException.Reason.CONFLICT,
                    "Plan " + planId + " cannot be " + action + " while its queue is running.");
        }
        if (!tracker.activeRunsForPlan(planId).isEmpty()) {
            throw new TaskOperationException(TaskOperationException.Reason.CONFLICT,
                    "Plan " + planId + " cannot be " + action + " while a task is running.");
        }
        return plan;
    }

    private Plan reload(String planId) {
        return store.findPlan(planId).orElseThrow(() -> TaskOperationException.planNotFound(planId));
    }
}
