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
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent store for plans, tasks, runs and their history.
 *
 * <p>Every method is atomic per call. {@link #finalizeRun} is the only way a run leaves
 * {@link RunStatus#IN_PROGRESS}, and it only succeeds while the run is still in progress,
 * so concurrent finalization attempts resolve to exactly one winner.
 *
 * <p>Implementations: {@link JdbcPlanStore} (SQLite), {@link InMemoryPlanStore} (tests, ephemeral use).
 */
public interface PlanStore {

    int DEFAULT_EVENT_PAGE_SIZE = 200;
    int MAX_EVENT_PAGE_SIZE = 500;
    int DEFAULT_PROGRESS_LIMIT = 12;
    int MAX_PROGRESS_LIMIT = 100;

    String SETTING_QUEUE_PARALLEL_ENABLED = "queue_parallel_enabled";
    String SETTING_NOTIFICATION_WEBHOOK_URL = "notification_webhook_url";

    // -- plans and tasks --

    void createPlan(Plan plan);

    /** Plan with its tasks ordered by ordinal. */
    Optional<Plan> findPlan(String planId);

    /** Plans matching the filter with their tasks, newest first. */
    List<Plan> listPlans(PlanFilter filter);

    default List<Plan> listPlans() {
        return listPlans(PlanFilter.ALL);
    }

    void updatePlanStatus(String planId, PlanStatus status);

    /**
     * Sets or clears the archive mark of a plan.
     *
     * @param archivedAt archive time, or null to restore the plan
     * @return false if the plan does not exist
     */
    boolean setPlanArchived(String planId, Instant archivedAt);

    /**
     * Removes a plan together with its tasks, runs, run events, todo snapshots and progress entries.
     *
     * @return false if the plan does not exist
     */
    boolean deletePlan(String planId);

    List<Task> listTasks(String planId);

    Optional<Task> findTask(String planId, String taskId);

    void updateTaskStatus(String planId, String taskId, TaskStatus status);

    // -- runs --

    void createRun(Run run);

    void updateRunSession(String runId, String sessionId);

    /**
     * Writes a terminal status if, and only if, the run is still in progress.
     *
     * @return true if this call performed the finalization
     */
    boolean finalizeRun(RunFinalization finalization);

    Optional<Run> findRun(String runId);

    /** Runs of a plan, newest first. */
    List<Run> listRuns(String planId);

    List<Run> findInProgressRuns(String planId);

    Optional<Run> findInProgressRunForTask(String planId, String taskId);

    /** In-progress runs of any plan that started before the given instant. */
    List<Run> findStaleInProgressRuns(Instant startedBefore);

    Optional<Run> findLatestFailedRun(String planId, String taskId);

    // -- history --

    void appendRunEvent(RunEvent event);

    /**
     * Events of one run in emission order, starting after {@code afterId}.
     * An unknown cursor starts from the beginning.
     */
    RunEventPage listRunEvents(String runId, String afterId, int limit);

    void addTodoSnapshot(String runId, List<TodoItem> todos);

    List<TodoItem> latestTodoSnapshot(String runId);

    void appendProgressEntry(String planId, String runId, RunStatus status, String entryText);

    /** Progress entries of a plan, newest first. */
    List<PlanProgressEntry> listProgressEntries(String planId, int limit);

    // -- settings --

    Optional<String> getSetting(String key);

    void putSetting(String key, String value);

    Map<String, String> listSettings();

    static int clampEventLimit(int limit) {
        if (limit <= 0) {
            return DEFAULT_EVENT_PAGE_SIZE;
        }
        return Math.min(limit, MAX_EVENT_PAGE_SIZE);
    }

    static int clampProgressLimit(int limit) {
        if (limit <= 0) {
            return DEFAULT_PROGRESS_LIMIT;
        }
        return Math.min(limit, MAX_PROGRESS_LIMIT);
    }
}
