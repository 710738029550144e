package com.tasksmith.dispatch.api;

import com.tasksmith.core.events.EventFilter;
import com.tasksmith.core.events.RunEventType;
import com.tasksmith.core.model.Plan;
import com.tasksmith.core.model.PlanProgressEntry;
import com.tasksmith.core.model.Run;
import com.tasksmith.core.model.Task;
import com.tasksmith.core.persistence.PlanFilter;
import com.tasksmith.core.persistence.PlanStore;
import com.tasksmith.core.plan.PlanDraft;
import com.tasksmith.core.plan.PlanImporter;
import com.tasksmith.core.plan.PlanLifecycle;
import com.tasksmith.core.queue.QueueAbortResult;
import com.tasksmith.core.queue.QueueOrchestrator;
import com.tasksmith.core.queue.QueueStartResult;
import com.tasksmith.core.run.RetryController;
import com.tasksmith.core.run.StartedRun;
import com.tasksmith.core.run.TaskOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST controller for plans, their queue and their tasks.
 */
@RestController
@RequestMapping("/api/v1/plans")
public class PlanController {

    private static final Logger log = LoggerFactory.getLogger(PlanController.class);

    private final PlanStore store;
    private final PlanImporter planImporter;
    private final QueueOrchestrator queueOrchestrator;
    private final RetryController retryController;
    private final SseStreamingService sseStreamingService;
    private final PlanLifecycle planLifecycle;

    public PlanController(PlanStore store, PlanImporter planImporter, QueueOrchestrator queueOrchestrator,
                          RetryController retryController, SseStreamingService sseStreamingService,
                          PlanLifecycle planLifecycle) {
        this.store = store;
        this.planImporter = planImporter;
        this.queueOrchestrator = queueOrchestrator;
        this.retryController = retryController;
        this.sseStreamingService = sseStreamingService;
        this.planLifecycle = planLifecycle;
    }

    /**
     * POST /api/v1/plans: import a plan.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> importPlan(@RequestBody PlanDraft draft) {
        Plan plan;
        try {
            plan = planImporter.importPlan(draft);
        } catch (IllegalArgumentException e) {
            return ApiErrors.error(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        log.info("Imported plan {} with {} task(s)", plan.id(), plan.tasks().size());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "planId", plan.id(),
                "taskIds", plan.tasks().stream().map(Task::id).toList()));
    }

    /**
     * GET /api/v1/plans: plans newest first, optionally narrowed with {@code ?archived=false}
     * and {@code ?search=text}.
     */
    @GetMapping
    public List<Plan> listPlans(@RequestParam(required = false) Boolean archived,
                                @RequestParam(required = false) String search) {
        return store.listPlans(new PlanFilter(archived, search));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getPlan(@PathVariable String id) {
        return store.findPlan(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ApiErrors.of(TaskOperationException.planNotFound(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> deletePlan(@PathVariable String id) {
        try {
            planLifecycle.delete(id);
            return ResponseEntity.noContent().build();
        } catch (TaskOperationException e) {
            log.info("Delete of plan {} refused: {}", id, e.getMessage());
            return ApiErrors.of(e);
        }
    }

    @PostMapping("/{id}/archive")
    public ResponseEntity<?> archivePlan(@PathVariable String id) {
        try {
            return ResponseEntity.ok(planLifecycle.archive(id));
        } catch (TaskOperationException e) {
            return ApiErrors.of(e);
        }
    }

    @DeleteMapping("/{id}/archive")
    public ResponseEntity<?> unarchivePlan(@PathVariable String id) {
        try {
            return ResponseEntity.ok(planLifecycle.unarchive(id));
        } catch (TaskOperationException e) {
            return ApiErrors.of(e);
        }
    }

    @GetMapping("/{id}/runs")
    public ResponseEntity<?> listRuns(@PathVariable String id) {
        if (store.findPlan(id).isEmpty()) {
            return ApiErrors.of(TaskOperationException.planNotFound(id));
        }
        List<Run> runs = store.listRuns(id);
        return ResponseEntity.ok(runs);
    }

    /**
     * POST /api/v1/plans/{id}/queue: start executing every runnable task.
     */
    @PostMapping("/{id}/queue")
    public ResponseEntity<Map<String, Object>> startQueue(@PathVariable String id) {
        QueueStartResult result = queueOrchestrator.runAll(id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("started", result.started());
        body.put("queued", result.queued());
        body.put("reason", result.reason());
        if (result.started()) {
            return ResponseEntity.accepted().body(body);
        }
        HttpStatus status = QueueOrchestrator.REASON_PLAN_NOT_FOUND.equals(result.reason())
                ? HttpStatus.NOT_FOUND : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(body);
    }

    @DeleteMapping("/{id}/queue")
    public ResponseEntity<Map<String, Object>> abortQueue(@PathVariable String id) {
        QueueAbortResult result = queueOrchestrator.abortQueue(id);
        Map<String, Object> body = Map.of("aborted", result.aborted(), "reason", result.reason());
        return result.aborted()
                ? ResponseEntity.ok(body)
                : ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @PostMapping("/{id}/tasks/{taskId}/run")
    public ResponseEntity<Map<String, Object>> runTask(@PathVariable String id, @PathVariable String taskId) {
        try {
            StartedRun run = retryController.runTask(id, taskId);
            return ResponseEntity.accepted().body(Map.of("runId", run.runId()));
        } catch (TaskOperationException e) {
            return ApiErrors.of(e);
        }
    }

    @PostMapping("/{id}/tasks/{taskId}/retry")
    public ResponseEntity<Map<String, Object>> retryTask(@PathVariable String id, @PathVariable String taskId) {
        try {
            StartedRun run = retryController.retryTask(id, taskId);
            return ResponseEntity.accepted().body(Map.of("runId", run.runId()));
        } catch (TaskOperationException e) {
            log.info("Retry of task {} refused: {}", taskId, e.getMessage());
            return ApiErrors.of(e);
        }
    }

    @PostMapping("/{id}/tasks/{taskId}/skip")
    public ResponseEntity<Map<String, Object>> skipTask(@PathVariable String id, @PathVariable String taskId) {
        try {
            retryController.skipTask(id, taskId);
            return ResponseEntity.ok(Map.of("taskId", taskId, "status", "skipped"));
        } catch (TaskOperationException e) {
            return ApiErrors.of(e);
        }
    }

    @GetMapping("/{id}/progress")
    public ResponseEntity<?> listProgress(@PathVariable String id,
                                          @RequestParam(defaultValue = "0") int limit) {
        if (store.findPlan(id).isEmpty()) {
            return ApiErrors.of(TaskOperationException.planNotFound(id));
        }
        List<PlanProgressEntry> entries = store.listProgressEntries(id, PlanStore.clampProgressLimit(limit));
        return ResponseEntity.ok(entries);
    }

    /**
     * GET /api/v1/plans/{id}/events: live run and queue events as server-sent events,
     * optionally narrowed with {@code ?types=task_status,queue_finished}.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable String id, @RequestParam(required = false) String types) {
        if (store.findPlan(id).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Plan not found: " + id);
        }
        Set<RunEventType> selected;
        try {
            selected = EventFilter.parseTypes(types);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        return sseStreamingService.createPlanEmitter(id, selected);
    }
}
