package com.tasksmith.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasksmith.core.model.TodoItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a task by launching the configured agent command in the task's working directory.
 *
 * <p>The instruction is written to the process's stdin. Output (stdout and stderr merged)
 * is read line by line: plain lines are forwarded as logs, JSON object lines are
 * interpreted by their {@code kind}:
 * <ul>
 *   <li>{@code session}: {@code sessionId}</li>
 *   <li>{@code todos}: {@code todos} array of {@code {content, status, activeForm}}</li>
 *   <li>{@code result}: {@code resultText}, {@code stopReason}, {@code costUsd}, optional {@code sessionId}</li>
 *   <li>{@code log}: {@code message}</li>
 *   <li>anything else: an {@link AgentNotice}</li>
 * </ul>
 */
@Service
public class ProcessExecutionService implements ExecutionService {

    private static final Logger log = LoggerFactory.getLogger(ProcessExecutionService.class);

    static final String STOP_REASON_INTERRUPTED = "interrupted";
    static final String STOP_REASON_END = "end_turn";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ExecutionProperties properties;
    private final ObjectMapper objectMapper;

    public ProcessExecutionService(ExecutionProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public ExecutionResult runTask(ExecutionRequest request, ExecutionCallbacks callbacks) throws Exception {
        Path workDir = request.effectiveDirectory();
        List<String> command = resolveCommand(request, workDir);
        log.info("Launching agent for task {} in {}: {}", request.task().id(), workDir, command);

        var builder = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true);
        builder.environment().putAll(properties.getEnvironment());
        builder.environment().put("TASKSMITH_PLAN_ID", request.plan().id());
        builder.environment().put("TASKSMITH_TASK_ID", request.task().id());
        if (request.branchName() != null) {
            builder.environment().put("TASKSMITH_BRANCH", request.branchName());
        }

        long start = System.currentTimeMillis();
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ExecutionFailedException("Agent command failed to start: " + String.join(" ", command), e);
        }

        var interrupted = new AtomicBoolean(false);
        callbacks.onInterruptible(() -> {
            interrupted.set(true);
            log.info("Interrupting agent process {} for task {}", process.pid(), request.task().id());
            process.destroy();
            return process.onExit().thenRun(() -> log.debug("Agent process {} exited", process.pid()));
        });

        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(InstructionBuilder.build(request).getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.debug("Agent process closed stdin early: {}", e.getMessage());
        }

        var state = new ResultState();
        CompletableFuture<Void> reader = CompletableFuture.runAsync(() -> readOutput(process, callbacks, state));

        long timeoutMs = properties.getTimeout().toMillis();
        if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            throw new ExecutionFailedException("Agent timed out after " + properties.getTimeout().toSeconds() + "s", -1);
        }
        reader.join();

        long duration = System.currentTimeMillis() - start;
        int exitCode = process.exitValue();
        if (interrupted.get()) {
            return new ExecutionResult(state.sessionId, state.resultText, STOP_REASON_INTERRUPTED, duration, state.costUsd);
        }
        if (exitCode != 0) {
            throw new ExecutionFailedException("Agent process exited with code " + exitCode
                    + (state.lastLine != null ? ": " + state.lastLine : ""), exitCode);
        }
        String stopReason = state.stopReason != null ? state.stopReason : STOP_REASON_END;
        return new ExecutionResult(state.sessionId, state.resultText, stopReason, duration, state.costUsd);
    }

    private List<String> resolveCommand(ExecutionRequest request, Path workDir) {
        if (properties.getCommand() == null || properties.getCommand().isEmpty()) {
            throw new ExecutionFailedException("No agent command configured (tasksmith.execution.command)", -1);
        }
        var command = new ArrayList<String>();
        for (String arg : properties.getCommand()) {
            command.add(arg.replace("{taskId}", request.task().id())
                    .replace("{planId}", request.plan().id())
                    .replace("{workdir}", workDir.toString()));
        }
        return command;
    }

    private void readOutput(Process process, ExecutionCallbacks callbacks, ResultState state) {
        try (var lines = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = lines.readLine()) != null) {
                handleLine(line, callbacks, state);
            }
        } catch (IOException e) {
            log.debug("Agent output stream closed: {}", e.getMessage());
        }
    }

    void handleLine(String line, ExecutionCallbacks callbacks, ResultState state) {
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return;
        }
        if (!trimmed.startsWith("{")) {
            state.lastLine = trimmed;
            callbacks.onLog(line + "\n");
            return;
        }
        Map<String, Object> message;
        try {
            message = objectMapper.readValue(trimmed, MAP_TYPE);
        } catch (JsonProcessingException e) {
            state.lastLine = trimmed;
            callbacks.onLog(line + "\n");
            return;
        }
        String kind = String.valueOf(message.get("kind"));
        switch (kind) {
            case "session" -> {
                String sessionId = stringValue(message.get("sessionId"));
                if (sessionId != null) {
                    state.sessionId = sessionId;
                    callbacks.onSession(sessionId);
                }
            }
            case "todos" -> callbacks.onTodo(objectMapper.convertValue(message.getOrDefault("todos", List.of()),
                    new TypeReference<List<TodoItem>>() {}));
            case "result" -> {
                state.resultText = stringValue(message.get("resultText"));
                state.stopReason = stringValue(message.get("stopReason"));
                if (message.get("costUsd") instanceof Number cost) {
                    state.costUsd = cost.doubleValue();
                }
                String sessionId = stringValue(message.get("sessionId"));
                if (sessionId != null && !sessionId.equals(state.sessionId)) {
                    state.sessionId = sessionId;
                    callbacks.onSession(sessionId);
                }
            }
            case "log" -> {
                String text = stringValue(message.get("message"));
                if (text != null) {
                    state.lastLine = text;
                    callbacks.onLog(text + "\n");
                }
            }
            default -> callbacks.onNotice(AgentNotices.fromPayload(message));
        }
    }

    private static String stringValue(Object value) {
        return value == null ? null : value.toString();
    }

    /** Values collected from the agent's output while it runs. */
    static final class ResultState {
        volatile String sessionId;
        volatile String resultText;
        volatile String stopReason;
        volatile Double costUsd;
        volatile String lastLine;
    }
}
