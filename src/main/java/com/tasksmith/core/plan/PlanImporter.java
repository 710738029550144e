package com.tasksmith.core.plan;

import com.tasksmith.core.model.Plan;
import com.tasksmith.core.model.PlanStatus;
import com.tasksmith.core.model.Task;
import com.tasksmith.core.model.TaskStatus;
import com.tasksmith.core.persistence.PlanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Turns a {@link PlanDraft} into a stored {@link Plan}.
 *
 * <p>Task ids are normalised to {@code [a-z0-9_-]}, de-duplicated with numeric suffixes,
 * and dependencies are remapped to the normalised ids. Self-references and references to
 * unknown tasks are dropped; dependency cycles are rejected because they could never run.
 */
@Service
public class PlanImporter {

    private static final Logger log = LoggerFactory.getLogger(PlanImporter.class);

    private final PlanStore store;

    public PlanImporter(PlanStore store) {
        this.store = store;
    }

    public Plan importPlan(PlanDraft draft) {
        if (draft.projectPath() == null || draft.projectPath().isBlank()) {
            throw new IllegalArgumentException("Project path is required");
        }
        if (draft.tasks() == null || draft.tasks().isEmpty()) {
            throw new IllegalArgumentException("A plan needs at least one task");
        }

        String planId = UUID.randomUUID().toString();
        Instant now = Instant.now();
        List<Task> tasks = normaliseTasks(planId, draft.tasks(), now);
        rejectCycles(tasks);

        var plan = new Plan(planId, draft.projectPath(), draft.summary(), PlanStatus.READY, now, now, null, tasks);
        store.createPlan(plan);
        log.info("Imported plan {} with {} tasks for {}", planId, tasks.size(), draft.projectPath());
        return plan;
    }

    static List<Task> normaliseTasks(String planId, List<PlanDraft.TaskDraft> drafts, Instant now) {
        var usedIds = new HashSet<String>();
        var idMap = new HashMap<String, String>();
        var normalisedIds = new ArrayList<String>();

        for (int i = 0; i < drafts.size(); i++) {
            PlanDraft.TaskDraft draft = drafts.get(i);
            String baseId = normalizeTaskId(draft.id(), i + 1);
            String candidate = baseId;
            int suffix = 2;
            while (usedIds.contains(candidate)) {
                candidate = baseId + "-" + suffix++;
            }
            usedIds.add(candidate);
            normalisedIds.add(candidate);
            if (draft.id() != null) {
                idMap.putIfAbsent(draft.id(), candidate);
            }
        }

        var tasks = new ArrayList<Task>();
        for (int i = 0; i < drafts.size(); i++) {
            PlanDraft.TaskDraft draft = drafts.get(i);
            String id = normalisedIds.get(i);
            int ordinal = i + 1;
            var dependencies = new LinkedHashSet<String>();
            if (draft.dependencies() != null) {
                for (String raw : draft.dependencies()) {
                    String mapped = idMap.getOrDefault(raw, normalizeTaskId(raw, ordinal));
                    if (usedIds.contains(mapped) && !mapped.equals(id)) {
                        dependencies.add(mapped);
                    }
                }
            }
            String title = draft.title() == null || draft.title().isBlank() ? id : draft.title();
            tasks.add(new Task(id, planId, ordinal, title, draft.description(), List.copyOf(dependencies),
                    draft.acceptanceCriteria(), draft.technicalNotes(), TaskStatus.PENDING, now, now, null));
        }
        return tasks;
    }

    /**
     * Lowercases, replaces characters outside {@code [a-z0-9_-]} with dashes, collapses runs
     * of dashes and trims them; falls back to {@code task-<ordinal>} when nothing is left.
     */
    static String normalizeTaskId(String raw, int fallbackOrdinal) {
        String cleaned = raw == null ? "" : raw.trim()
                .toLowerCase()
                .replaceAll("[^a-z0-9_-]", "-")
                .replaceAll("-+", "-")
                .replaceAll("^-|-$", "");
        return cleaned.isEmpty() ? "task-" + fallbackOrdinal : cleaned;
    }

    private static void rejectCycles(List<Task> tasks) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (Task task : tasks) {
            inDegree.put(task.id(), task.dependencies().size());
            for (String dependency : task.dependencies()) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(task.id());
            }
        }

        var ready = new ArrayDeque<String>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });
        Set<String> visited = new HashSet<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            visited.add(id);
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (visited.size() < tasks.size()) {
            List<String> cyclic = tasks.stream().map(Task::id).filter(id -> !visited.contains(id)).toList();
            throw new IllegalArgumentException("Dependency cycle detected among tasks: " + String.join(", ", cyclic));
        }
    }
}
