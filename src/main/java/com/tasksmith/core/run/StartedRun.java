package com.tasksmith.core.run;

import com.tasksmith.core.model.RunStatus;

import java.util.concurrent.CompletableFuture;

/**
 * Handle returned when a run has been accepted.
 *
 * @param runId      id of the new run
 * @param completion resolves to the terminal status
 */
public record StartedRun(String runId, CompletableFuture<RunStatus> completion) {}
