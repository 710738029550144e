package com.tasksmith.dispatch.api;

import com.tasksmith.core.model.Run;
import com.tasksmith.core.persistence.PlanStore;
import com.tasksmith.core.persistence.RunEventPage;
import com.tasksmith.core.run.CancelResult;
import com.tasksmith.core.run.RunExecutor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

/**
 * REST controller for individual runs.
 */
@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private final PlanStore store;
    private final RunExecutor runExecutor;
    private final SseStreamingService sseStreamingService;

    public RunController(PlanStore store, RunExecutor runExecutor, SseStreamingService sseStreamingService) {
        this.store = store;
        this.runExecutor = runExecutor;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/runs/{runId}/cancel: interrupt the run, forcing it after the cancel timeout.
     */
    @PostMapping("/{runId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String runId) {
        CancelResult result = runExecutor.cancelRun(runId);
        Map<String, Object> body = Map.of(
                "ok", result.ok(),
                "outcome", result.outcome().name(),
                "reason", result.reason());
        return result.ok()
                ? ResponseEntity.ok(body)
                : ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @GetMapping("/{runId}/events")
    public ResponseEntity<?> events(@PathVariable String runId,
                                    @RequestParam(required = false) String afterId,
                                    @RequestParam(defaultValue = "0") int limit) {
        if (store.findRun(runId).isEmpty()) {
            return ApiErrors.error(HttpStatus.NOT_FOUND, "Run not found: " + runId);
        }
        RunEventPage page = store.listRunEvents(runId, afterId, PlanStore.clampEventLimit(limit));
        return ResponseEntity.ok(page);
    }

    /**
     * GET /api/v1/runs/{runId}/stream: the run's events so far, then live ones until it ends.
     * Reconnecting clients pass the last id they saw as {@code afterId}.
     */
    @GetMapping(value = "/{runId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String runId, @RequestParam(required = false) String afterId) {
        Run run = store.findRun(runId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + runId));
        return sseStreamingService.createRunEmitter(run, afterId);
    }
}
