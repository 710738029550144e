package com.tasksmith.core.run;

import com.tasksmith.core.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of runs executing in this process. A run is tracked from the moment it is
 * started until its terminal status has been written.
 */
@Component
public class RunTracker {

    private static final Logger log = LoggerFactory.getLogger(RunTracker.class);

    private final ConcurrentHashMap<String, ActiveRun> activeRuns = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if the run id is already tracked
     */
    public ActiveRun register(String runId, String planId, String taskId, boolean queueManaged) {
        var run = new ActiveRun(runId, planId, taskId, queueManaged, Instant.now());
        if (activeRuns.putIfAbsent(runId, run) != null) {
            throw new IllegalStateException("Run " + runId + " is already tracked");
        }
        log.debug("Tracking run {} (task {}, queueManaged={})", runId, taskId, queueManaged);
        return run;
    }

    public Optional<ActiveRun> find(String runId) {
        return Optional.ofNullable(activeRuns.get(runId));
    }

    public boolean isTracked(String runId) {
        return activeRuns.containsKey(runId);
    }

    public List<ActiveRun> activeRunsForPlan(String planId) {
        return activeRuns.values().stream()
                .filter(run -> run.planId().equals(planId))
                .sorted(Comparator.comparing(ActiveRun::startedAt))
                .toList();
    }

    public Optional<ActiveRun> activeRunForTask(String planId, String taskId) {
        return activeRuns.values().stream()
                .filter(run -> run.planId().equals(planId) && run.taskId().equals(taskId))
                .findFirst();
    }

    /**
     * Stops tracking a run and resolves its completion future. Calling it again for the same
     * run is a no-op.
     */
    public void complete(String runId, RunStatus status) {
        ActiveRun run = activeRuns.remove(runId);
        if (run != null) {
            log.debug("Run {} left the tracker with status {}", runId, status.value());
            run.completion().complete(status);
        }
    }

    public int size() {
        return activeRuns.size();
    }
}
