package com.tasksmith.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasksmith.core.model.Plan;
import com.tasksmith.core.model.PlanStatus;
import com.tasksmith.core.model.Task;
import com.tasksmith.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ProcessExecutionServiceTest {

    private ExecutionProperties properties;
    private ProcessExecutionService service;
    private RecordingCallbacks callbacks;

    @BeforeEach
    void setUp() {
        properties = new ExecutionProperties();
        service = new ProcessExecutionService(properties, new ObjectMapper());
        callbacks = new RecordingCallbacks();
    }

    @Nested
    @DisplayName("handleLine")
    class HandleLine {

        private final ProcessExecutionService.ResultState state = new ProcessExecutionService.ResultState();

        @Test
        @DisplayName("plain lines become logs")
        void plainLine() {
            service.handleLine("compiling...", callbacks, state);
            service.handleLine("   ", callbacks, state);

            assertEquals(List.of("compiling...\n"), callbacks.logs);
            assertEquals("compiling...", state.lastLine);
        }

        @Test
        @DisplayName("malformed JSON is logged as text")
        void malformedJson() {
            service.handleLine("{not json", callbacks, state);

            assertEquals(List.of("{not json\n"), callbacks.logs);
        }

        @Test
        @DisplayName("session, todos and result messages are interpreted")
        void structured() {
            service.handleLine("{\"kind\":\"session\",\"sessionId\":\"s-1\"}", callbacks, state);
            service.handleLine("{\"kind\":\"todos\",\"todos\":[{\"content\":\"write\",\"status\":\"pending\","
                    + "\"activeForm\":\"Writing\"}]}", callbacks, state);
            service.handleLine("{\"kind\":\"result\",\"resultText\":\"done\",\"stopReason\":\"end_turn\","
                    + "\"costUsd\":0.25,\"sessionId\":\"s-2\"}", callbacks, state);

            assertEquals(List.of("s-1", "s-2"), callbacks.sessions);
            assertEquals("write", callbacks.todos.get(0).get(0).content());
            assertEquals("done", state.resultText);
            assertEquals("end_turn", state.stopReason);
            assertEquals(0.25, state.costUsd);
        }

        @Test
        @DisplayName("log messages and notices are forwarded")
        void logAndNotice() {
            service.handleLine("{\"kind\":\"log\",\"message\":\"step 1\"}", callbacks, state);
            service.handleLine("{\"kind\":\"agent_stage\",\"stage\":\"review\",\"status\":\"started\"}", callbacks, state);

            assertEquals(List.of("step 1\n"), callbacks.logs);
            assertInstanceOf(AgentNotice.StageTransition.class, callbacks.notices.get(0));
        }
    }

    @Nested
    @DisplayName("process execution")
    class ProcessExecution {

        @TempDir
        Path workDir;

        @BeforeEach
        void requireShell() {
            assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "/bin/sh not available");
        }

        private ExecutionRequest request() {
            Instant now = Instant.now();
            var task = new Task("t1", "p1", 1, "T1", "Do it", List.of(), List.of(), null,
                    TaskStatus.IN_PROGRESS, now, now, null);
            var plan = new Plan("p1", workDir.toString(), null, PlanStatus.RUNNING, now, now, null, List.of(task));
            return new ExecutionRequest(plan, task, null, null, null);
        }

        @Test
        @DisplayName("reads the instruction on stdin and reports the result")
        void success() throws Exception {
            properties.setCommand(List.of("/bin/sh", "-c",
                    "grep -q 'Task: {taskId}' && echo working in $TASKSMITH_PLAN_ID && "
                            + "echo '{\"kind\":\"result\",\"resultText\":\"all good\"}'"));

            ExecutionResult result = service.runTask(request(), callbacks);

            assertEquals("all good", result.resultText());
            assertEquals("end_turn", result.stopReason());
            assertFalse(result.isFailure());
            assertEquals(List.of("working in p1\n"), callbacks.logs);
            assertNotNull(callbacks.handle);
        }

        @Test
        @DisplayName("a non-zero exit fails with the last output line")
        void nonZeroExit() {
            properties.setCommand(List.of("/bin/sh", "-c", "cat > /dev/null; echo oops; exit 3"));

            var ex = assertThrows(ExecutionFailedException.class, () -> service.runTask(request(), callbacks));

            assertEquals("Agent process exited with code 3: oops", ex.getMessage());
            assertEquals(3, ex.exitCode());
        }

        @Test
        @DisplayName("a timed out agent is killed")
        void timeout() {
            properties.setTimeout(Duration.ofMillis(300));
            properties.setCommand(List.of("/bin/sh", "-c", "exec sleep 30"));

            var ex = assertThrows(ExecutionFailedException.class, () -> service.runTask(request(), callbacks));
            assertTrue(ex.getMessage().startsWith("Agent timed out"));
        }

        @Test
        @DisplayName("interrupting stops the process and reports an interrupted stop")
        void interrupt() throws Exception {
            properties.setCommand(List.of("/bin/sh", "-c", "exec sleep 30"));

            CompletableFuture<ExecutionResult> running = CompletableFuture.supplyAsync(() -> {
                try {
                    return service.runTask(request(), callbacks);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            });
            long deadline = System.currentTimeMillis() + 5000;
            while (callbacks.handle == null && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertNotNull(callbacks.handle);

            callbacks.handle.interrupt().get(5, TimeUnit.SECONDS);
            ExecutionResult result = running.get(5, TimeUnit.SECONDS);

            assertEquals("interrupted", result.stopReason());
        }

        @Test
        @DisplayName("a missing executable fails to start")
        void missingExecutable() {
            properties.setCommand(List.of("/definitely/not/here"));

            var ex = assertThrows(ExecutionFailedException.class, () -> service.runTask(request(), callbacks));
            assertTrue(ex.getMessage().startsWith("Agent command failed to start"));
        }
    }
}
