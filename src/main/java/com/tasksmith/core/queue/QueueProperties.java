package com.tasksmith.core.queue;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "tasksmith.queue")
public class QueueProperties {

    /** How long a cancellation waits for an interrupted run before forcing it. */
    private Duration cancelTimeout = Duration.ofSeconds(10);
    /** In-progress runs older than this are reset on startup. */
    private Duration staleRunThreshold = Duration.ofHours(1);
    private int maxRetries = 3;
    /** Default for the {@code queue_parallel_enabled} setting. */
    private boolean parallelEnabled = true;

    public Duration getCancelTimeout() { return cancelTimeout; }
    public void setCancelTimeout(Duration cancelTimeout) { this.cancelTimeout = cancelTimeout; }
    public Duration getStaleRunThreshold() { return staleRunThreshold; }
    public void setStaleRunThreshold(Duration staleRunThreshold) { this.staleRunThreshold = staleRunThreshold; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public boolean isParallelEnabled() { return parallelEnabled; }
    public void setParallelEnabled(boolean parallelEnabled) { this.parallelEnabled = parallelEnabled; }
}
