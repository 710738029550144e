package com.tasksmith.execution;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "tasksmith.execution")
public class ExecutionProperties {

    /**
     * Agent command line. The task instruction is written to the process's stdin.
     * Arguments may use the placeholders {taskId}, {planId} and {workdir}.
     */
    private List<String> command = new ArrayList<>(List.of("tasksmith-agent"));
    private Duration timeout = Duration.ofMinutes(60);
    /** Extra environment variables for the agent process. */
    private Map<String, String> environment = new LinkedHashMap<>();

    public List<String> getCommand() { return command; }
    public void setCommand(List<String> command) { this.command = command; }
    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }
    public Map<String, String> getEnvironment() { return environment; }
    public void setEnvironment(Map<String, String> environment) { this.environment = environment; }
}
