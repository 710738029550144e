package com.tasksmith.core.persistence;

import com.tasksmith.core.events.RunEvent;
import com.tasksmith.core.model.Plan;
import com.tasksmith.core.model.PlanProgressEntry;
import com.tasksmith.core.model.PlanStatus;
import com.tasksmith.core.model.Run;
import com.tasksmith.core.model.RunFinalization;
import com.tasksmith.core.model.RunStatus;
import com.tasksmith.core.model.Task;
import com.tasksmith.core.model.TaskStatus;
import com.tasksmith.core.model.TodoItem;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * {@link PlanStore} held entirely in memory. State is lost on restart.
 * All methods synchronize on the store, which gives the same per-call atomicity as the JDBC store.
 */
public class InMemoryPlanStore implements PlanStore {

    private static final Comparator<Run> NEWEST_FIRST =
            Comparator.comparing(Run::startedAt).thenComparingInt(Run::retryCount).reversed();

    private final Map<String, Plan> plans = new LinkedHashMap<>();
    private final Map<String, Map<String, Task>> tasksByPlan = new HashMap<>();
    private final Map<String, Run> runs = new LinkedHashMap<>();
    private final List<RunEvent> events = new ArrayList<>();
    private final Map<String, List<TodoItem>> latestTodos = new HashMap<>();
    private final List<PlanProgressEntry> progressEntries = new ArrayList<>();
    private final Map<String, String> settings = new TreeMap<>();
    private long progressSequence;

    @Override
    public synchronized void createPlan(Plan plan) {
        plans.put(plan.id(), plan.withTasks(List.of()));
        var tasks = new LinkedHashMap<String, Task>();
        for (Task task : plan.tasks()) {
            tasks.put(task.id(), task);
        }
        tasksByPlan.put(plan.id(), tasks);
    }

    @Override
    public synchronized Optional<Plan> findPlan(String planId) {
        Plan plan = plans.get(planId);
        return plan == null ? Optional.empty() : Optional.of(plan.withTasks(listTasks(planId)));
    }

    @Override
    public synchronized List<Plan> listPlans(PlanFilter filter) {
        return plans.values().stream()
                .filter(filter::matches)
                .map(plan -> plan.withTasks(listTasks(plan.id())))
                .sorted(Comparator.comparing(Plan::createdAt).reversed())
                .toList();
    }

    @Override
    public synchronized void updatePlanStatus(String planId, PlanStatus status) {
        plans.computeIfPresent(planId, (id, plan) -> plan.withStatus(status, Instant.now()));
    }

    @Override
    public synchronized boolean setPlanArchived(String planId, Instant archivedAt) {
        return plans.computeIfPresent(planId, (id, plan) -> plan.withArchivedAt(archivedAt, Instant.now())) != null;
    }

    @Override
    public synchronized boolean deletePlan(String planId) {
        if (plans.remove(planId) == null) {
            return false;
        }
        tasksByPlan.remove(planId);
        List<String> runIds = runs.values().stream()
                .filter(run -> run.planId().equals(planId))
                .map(Run::id)
                .toList();
        runIds.forEach(runs::remove);
        runIds.forEach(latestTodos::remove);
        events.removeIf(event -> planId.equals(event.planId()));
        progressEntries.removeIf(entry -> entry.planId().equals(planId));
        return true;
    }

    @Override
    public synchronized List<Task> listTasks(String planId) {
        return tasksByPlan.getOrDefault(planId, Map.of()).values().stream()
                .sorted(Comparator.comparingInt(Task::ordinal))
                .toList();
    }

    @Override
    public synchronized Optional<Task> findTask(String planId, String taskId) {
        return Optional.ofNullable(tasksByPlan.getOrDefault(planId, Map.of()).get(taskId));
    }

    @Override
    public synchronized void updateTaskStatus(String planId, String taskId, TaskStatus status) {
        Map<String, Task> tasks = tasksByPlan.get(planId);
        if (tasks != null) {
            tasks.computeIfPresent(taskId, (id, task) -> task.withStatus(status, Instant.now()));
        }
    }

    @Override
    public synchronized void createRun(Run run) {
        runs.put(run.id(), run);
    }

    @Override
    public synchronized void updateRunSession(String runId, String sessionId) {
        runs.computeIfPresent(runId, (id, run) -> run.withSessionId(sessionId));
    }

    @Override
    public synchronized boolean finalizeRun(RunFinalization finalization) {
        Run run = runs.get(finalization.runId());
        if (run == null || run.status() != RunStatus.IN_PROGRESS) {
            return false;
        }
        runs.put(run.id(), run.finalizedWith(finalization));
        return true;
    }

    @Override
    public synchronized Optional<Run> findRun(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public synchronized List<Run> listRuns(String planId) {
        return runs.values().stream()
                .filter(run -> run.planId().equals(planId))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public synchronized List<Run> findInProgressRuns(String planId) {
        return runs.values().stream()
                .filter(run -> run.planId().equals(planId) && run.status() == RunStatus.IN_PROGRESS)
                .toList();
    }

    @Override
    public synchronized Optional<Run> findInProgressRunForTask(String planId, String taskId) {
        return runs.values().stream()
                .filter(run -> run.planId().equals(planId) && run.taskId().equals(taskId))
                .filter(run -> run.status() == RunStatus.IN_PROGRESS)
                .findFirst();
    }

    @Override
    public synchronized List<Run> findStaleInProgressRuns(Instant startedBefore) {
        return runs.values().stream()
                .filter(run -> run.status() == RunStatus.IN_PROGRESS)
                .filter(run -> run.startedAt().isBefore(startedBefore))
                .toList();
    }

    @Override
    public synchronized Optional<Run> findLatestFailedRun(String planId, String taskId) {
        return runs.values().stream()
                .filter(run -> run.planId().equals(planId) && run.taskId().equals(taskId))
                .filter(run -> run.status() == RunStatus.FAILED)
                .sorted(NEWEST_FIRST)
                .findFirst();
    }

    @Override
    public synchronized void appendRunEvent(RunEvent event) {
        events.add(event);
    }

    @Override
    public synchronized RunEventPage listRunEvents(String runId, String afterId, int limit) {
        int pageSize = PlanStore.clampEventLimit(limit);
        List<RunEvent> forRun = events.stream()
                .filter(event -> runId.equals(event.runId()))
                .toList();
        int start = 0;
        if (afterId != null) {
            for (int i = 0; i < forRun.size(); i++) {
                if (forRun.get(i).id().equals(afterId)) {
                    start = i + 1;
                    break;
                }
            }
        }
        int end = Math.min(forRun.size(), start + pageSize + 1);
        return RunEventPage.of(forRun.subList(start, end), pageSize);
    }

    @Override
    public synchronized void addTodoSnapshot(String runId, List<TodoItem> todos) {
        latestTodos.put(runId, List.copyOf(todos));
    }

    @Override
    public synchronized List<TodoItem> latestTodoSnapshot(String runId) {
        return latestTodos.getOrDefault(runId, List.of());
    }

    @Override
    public synchronized void appendProgressEntry(String planId, String runId, RunStatus status, String entryText) {
        progressEntries.add(new PlanProgressEntry(++progressSequence, planId, runId, status,
                PlanProgressEntry.truncate(entryText), Instant.now()));
    }

    @Override
    public synchronized List<PlanProgressEntry> listProgressEntries(String planId, int limit) {
        return progressEntries.stream()
                .filter(entry -> entry.planId().equals(planId))
                .sorted(Comparator.comparingLong(PlanProgressEntry::id).reversed())
                .limit(PlanStore.clampProgressLimit(limit))
                .toList();
    }

    @Override
    public synchronized Optional<String> getSetting(String key) {
        return Optional.ofNullable(settings.get(key));
    }

    @Override
    public synchronized void putSetting(String key, String value) {
        settings.put(key, value);
    }

    @Override
    public synchronized Map<String, String> listSettings() {
        return Map.copyOf(settings);
    }
}
