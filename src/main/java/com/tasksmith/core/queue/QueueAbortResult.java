package com.tasksmith.core.queue;

public record QueueAbortResult(boolean aborted, String reason) {}
