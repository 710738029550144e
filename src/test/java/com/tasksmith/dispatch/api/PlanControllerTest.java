package com.tasksmith.dispatch.api;

import com.tasksmith.core.events.RunEventType;
import com.tasksmith.core.model.PlanProgressEntry;
import com.tasksmith.core.model.RunStatus;
import com.tasksmith.core.persistence.PlanFilter;
import com.tasksmith.core.persistence.PlanStore;
import com.tasksmith.core.plan.PlanImporter;
import com.tasksmith.core.plan.PlanLifecycle;
import com.tasksmith.core.queue.QueueAbortResult;
import com.tasksmith.core.queue.QueueOrchestrator;
import com.tasksmith.core.queue.QueueStartResult;
import com.tasksmith.core.run.RetryController;
import com.tasksmith.core.run.RetryLimitExceededException;
import com.tasksmith.core.run.StartedRun;
import com.tasksmith.core.run.TaskOperationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static com.tasksmith.support.TestPlans.diamond;
import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PlanController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class PlanControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PlanStore store;

    @MockitoBean
    private PlanImporter planImporter;

    @MockitoBean
    private QueueOrchestrator queueOrchestrator;

    @MockitoBean
    private RetryController retryController;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    @MockitoBean
    private PlanLifecycle planLifecycle;

    // ── POST /api/v1/plans ───────────────────────────────────────────

    @Test
    @DisplayName("POST /plans imports the plan and returns 201 with the normalised ids")
    void importPlan() throws Exception {
        when(planImporter.importPlan(any())).thenReturn(diamond("plan-1", "/repo"));

        mockMvc.perform(post("/api/v1/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"projectPath":"/repo","summary":"Diamond","tasks":[
                                  {"id":"a","title":"A","description":"Do A","dependencies":[]}
                                ]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.planId").value("plan-1"))
                .andExpect(jsonPath("$.taskIds", contains("a", "b", "c", "d")));
    }

    @Test
    @DisplayName("POST /plans with an invalid draft returns 400")
    void importInvalid() throws Exception {
        when(planImporter.importPlan(any())).thenThrow(new IllegalArgumentException("Plan has no tasks."));

        mockMvc.perform(post("/api/v1/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectPath\":\"/repo\",\"tasks\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Plan has no tasks."));
    }

    // ── GET /api/v1/plans ────────────────────────────────────────────

    @Test
    @DisplayName("GET /plans/{id} returns the plan with its tasks")
    void getPlan() throws Exception {
        when(store.findPlan("plan-1")).thenReturn(Optional.of(diamond("plan-1", "/repo")));

        mockMvc.perform(get("/api/v1/plans/plan-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("plan-1"))
                .andExpect(jsonPath("$.status").value("ready"))
                .andExpect(jsonPath("$.tasks", hasSize(4)))
                .andExpect(jsonPath("$.tasks[3].dependencies", contains("b", "c")));
    }

    @Test
    @DisplayName("GET /plans/{id} for an unknown plan returns 404")
    void getPlanMissing() throws Exception {
        when(store.findPlan("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/plans/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value(containsString("nope")));
    }

    @Test
    @DisplayName("GET /plans passes the archive and search filters to the store")
    void listFiltered() throws Exception {
        when(store.listPlans(any(PlanFilter.class))).thenReturn(List.of(diamond("plan-1", "/repo")));

        mockMvc.perform(get("/api/v1/plans").param("archived", "false").param("search", "repo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].archivedAt").doesNotExist());

        verify(store).listPlans(new PlanFilter(false, "repo"));
    }

    // ── Archive and delete ───────────────────────────────────────────

    @Test
    @DisplayName("POST /plans/{id}/archive returns the archived plan")
    void archive() throws Exception {
        var plan = diamond("plan-1", "/repo");
        when(planLifecycle.archive("plan-1")).thenReturn(plan.withArchivedAt(Instant.now(), Instant.now()));

        mockMvc.perform(post("/api/v1/plans/plan-1/archive"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("plan-1"))
                .andExpect(jsonPath("$.archivedAt").exists());
    }

    @Test
    @DisplayName("DELETE /plans/{id}/archive restores the plan")
    void unarchive() throws Exception {
        when(planLifecycle.unarchive("plan-1")).thenReturn(diamond("plan-1", "/repo"));

        mockMvc.perform(delete("/api/v1/plans/plan-1/archive"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("plan-1"));
    }

    @Test
    @DisplayName("DELETE /plans/{id} returns 204")
    void deletePlan() throws Exception {
        mockMvc.perform(delete("/api/v1/plans/plan-1"))
                .andExpect(status().isNoContent());

        verify(planLifecycle).delete("plan-1");
    }

    @Test
    @DisplayName("DELETE /plans/{id} while the queue runs returns 409")
    void deleteBusy() throws Exception {
        doThrow(new TaskOperationException(TaskOperationException.Reason.CONFLICT,
                "Plan plan-1 cannot be deleted while its queue is running."))
                .when(planLifecycle).delete("plan-1");

        mockMvc.perform(delete("/api/v1/plans/plan-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value(containsString("queue is running")));
    }

    @Test
    @DisplayName("DELETE /plans/{id} for an unknown plan returns 404")
    void deleteMissing() throws Exception {
        doThrow(TaskOperationException.planNotFound("nope")).when(planLifecycle).delete("nope");

        mockMvc.perform(delete("/api/v1/plans/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /plans/{id}/progress clamps the limit")
    void progress() throws Exception {
        when(store.findPlan("plan-1")).thenReturn(Optional.of(diamond("plan-1", "/repo")));
        when(store.listProgressEntries(eq("plan-1"), anyInt())).thenReturn(List.of(
                new PlanProgressEntry(1L, "plan-1", "run-1", RunStatus.COMPLETED, "Task a completed.",
                        Instant.now())));

        mockMvc.perform(get("/api/v1/plans/plan-1/progress").param("limit", "5000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].entryText").value("Task a completed."));

        verify(store).listProgressEntries("plan-1", PlanStore.clampProgressLimit(5000));
    }

    // ── Event stream ─────────────────────────────────────────────────

    @Test
    @DisplayName("GET /plans/{id}/events opens a plan stream narrowed to the requested types")
    void streamEvents() throws Exception {
        when(store.findPlan("plan-1")).thenReturn(Optional.of(diamond("plan-1", "/repo")));
        when(sseStreamingService.createPlanEmitter(eq("plan-1"), any())).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/v1/plans/plan-1/events").param("types", "task_status,queue_finished"))
                .andExpect(status().isOk());

        verify(sseStreamingService).createPlanEmitter("plan-1",
                Set.of(RunEventType.TASK_STATUS, RunEventType.QUEUE_FINISHED));
    }

    @Test
    @DisplayName("GET /plans/{id}/events with an unknown event type returns 400")
    void streamEventsBadType() throws Exception {
        when(store.findPlan("plan-1")).thenReturn(Optional.of(diamond("plan-1", "/repo")));

        mockMvc.perform(get("/api/v1/plans/plan-1/events").param("types", "bogus"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(sseStreamingService);
    }

    // ── Queue ────────────────────────────────────────────────────────

    @Test
    @DisplayName("POST /plans/{id}/queue returns 202 when the queue starts")
    void startQueue() throws Exception {
        when(queueOrchestrator.runAll("plan-1")).thenReturn(
                new QueueStartResult(true, 1, QueueOrchestrator.REASON_STARTED, new CompletableFuture<>()));

        mockMvc.perform(post("/api/v1/plans/plan-1/queue"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.started").value(true))
                .andExpect(jsonPath("$.queued").value(1))
                .andExpect(jsonPath("$.reason").value(QueueOrchestrator.REASON_STARTED));
    }

    @Test
    @DisplayName("POST /plans/{id}/queue returns 409 when the queue is already running")
    void startQueueConflict() throws Exception {
        when(queueOrchestrator.runAll("plan-1")).thenReturn(
                new QueueStartResult(false, 0, QueueOrchestrator.REASON_ALREADY_RUNNING, null));

        mockMvc.perform(post("/api/v1/plans/plan-1/queue"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.started").value(false))
                .andExpect(jsonPath("$.reason").value(QueueOrchestrator.REASON_ALREADY_RUNNING));
    }

    @Test
    @DisplayName("POST /plans/{id}/queue returns 404 for an unknown plan")
    void startQueueMissing() throws Exception {
        when(queueOrchestrator.runAll("nope")).thenReturn(
                new QueueStartResult(false, 0, QueueOrchestrator.REASON_PLAN_NOT_FOUND, null));

        mockMvc.perform(post("/api/v1/plans/nope/queue"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("DELETE /plans/{id}/queue aborts a running queue")
    void abortQueue() throws Exception {
        when(queueOrchestrator.abortQueue("plan-1"))
                .thenReturn(new QueueAbortResult(true, QueueOrchestrator.REASON_ABORTED));

        mockMvc.perform(delete("/api/v1/plans/plan-1/queue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.aborted").value(true));
    }

    @Test
    @DisplayName("DELETE /plans/{id}/queue without a running queue returns 409")
    void abortIdle() throws Exception {
        when(queueOrchestrator.abortQueue("plan-1"))
                .thenReturn(new QueueAbortResult(false, QueueOrchestrator.REASON_NOT_RUNNING));

        mockMvc.perform(delete("/api/v1/plans/plan-1/queue"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value(QueueOrchestrator.REASON_NOT_RUNNING));
    }

    // ── Task operations ──────────────────────────────────────────────

    @Test
    @DisplayName("POST retry returns 202 with the new run id")
    void retry() throws Exception {
        when(retryController.retryTask("plan-1", "a"))
                .thenReturn(new StartedRun("run-9", new CompletableFuture<>()));

        mockMvc.perform(post("/api/v1/plans/plan-1/tasks/a/retry"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.runId").value("run-9"));
    }

    @Test
    @DisplayName("POST retry past the limit returns 429")
    void retryLimit() throws Exception {
        when(retryController.retryTask("plan-1", "a")).thenThrow(new RetryLimitExceededException("a", 3));

        mockMvc.perform(post("/api/v1/plans/plan-1/tasks/a/retry"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value(containsString("maximum retry limit (3)")));
    }

    @Test
    @DisplayName("POST retry of a task that is not failed returns 400")
    void retryInvalid() throws Exception {
        when(retryController.retryTask("plan-1", "a")).thenThrow(new TaskOperationException(
                TaskOperationException.Reason.INVALID_STATE, "Task a is pending, not failed."));

        mockMvc.perform(post("/api/v1/plans/plan-1/tasks/a/retry"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST run while the queue runs returns 409")
    void runConflict() throws Exception {
        when(retryController.runTask("plan-1", "a")).thenThrow(new TaskOperationException(
                TaskOperationException.Reason.CONFLICT, "Queue is running for this plan."));

        mockMvc.perform(post("/api/v1/plans/plan-1/tasks/a/run"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Queue is running for this plan."));
    }

    @Test
    @DisplayName("POST skip marks the task skipped")
    void skip() throws Exception {
        mockMvc.perform(post("/api/v1/plans/plan-1/tasks/a/skip"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.taskId").value("a"))
                .andExpect(jsonPath("$.status").value("skipped"));

        verify(retryController).skipTask("plan-1", "a");
    }

    @Test
    @DisplayName("POST skip of an unknown task returns 404")
    void skipMissing() throws Exception {
        doThrow(TaskOperationException.taskNotFound("plan-1", "zz"))
                .when(retryController).skipTask("plan-1", "zz");

        mockMvc.perform(post("/api/v1/plans/plan-1/tasks/zz/skip"))
                .andExpect(status().isNotFound());
    }
}
