package com.tasksmith.core.scheduler;

import com.tasksmith.core.model.Task;
import com.tasksmith.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which tasks of a plan may run right now.
 *
 * <p>A task is runnable iff it is {@link TaskStatus#PENDING} and every dependency is
 * {@link TaskStatus#COMPLETED} or {@link TaskStatus#SKIPPED}. A dependency on a task that
 * is not part of the plan is never satisfied. Pure read; no side effects.
 */
@Service
public class TaskDependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(TaskDependencyResolver.class);

    private static final Comparator<Task> BY_ORDINAL = Comparator.comparingInt(Task::ordinal);

    public int countRunnable(List<Task> tasks) {
        return runnableTasks(tasks).size();
    }

    /**
     * Every currently runnable task, ordered by ascending ordinal. Used to build a phase.
     */
    public List<Task> runnableTasks(List<Task> tasks) {
        Map<String, TaskStatus> statusById = indexStatuses(tasks);
        List<Task> runnable = tasks.stream()
                .filter(task -> isRunnable(task, statusById))
                .sorted(BY_ORDINAL)
                .toList();
        log.debug("{} of {} tasks runnable: {}", runnable.size(), tasks.size(),
                runnable.stream().map(Task::id).toList());
        return runnable;
    }

    /**
     * The runnable task with the lowest ordinal. Used in single-task mode.
     */
    public Optional<Task> nextRunnable(List<Task> tasks) {
        Map<String, TaskStatus> statusById = indexStatuses(tasks);
        return tasks.stream()
                .filter(task -> isRunnable(task, statusById))
                .min(BY_ORDINAL);
    }

    /**
     * True when every task is completed or skipped.
     */
    public boolean allSettled(List<Task> tasks) {
        return tasks.stream().allMatch(task -> task.status().isSettled());
    }

    private boolean isRunnable(Task task, Map<String, TaskStatus> statusById) {
        if (task.status() != TaskStatus.PENDING) {
            return false;
        }
        for (String dependency : task.dependencies()) {
            TaskStatus dependencyStatus = statusById.get(dependency);
            if (dependencyStatus == null || !dependencyStatus.isSettled()) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, TaskStatus> indexStatuses(List<Task> tasks) {
        var statusById = new HashMap<String, TaskStatus>();
        for (Task task : tasks) {
            statusById.put(task.id(), task.status());
        }
        return statusById;
    }
}
