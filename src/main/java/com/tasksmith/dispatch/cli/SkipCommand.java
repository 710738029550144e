package com.tasksmith.dispatch.cli;

import com.tasksmith.core.run.RetryController;
import com.tasksmith.core.run.TaskOperationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: tasksmith skip &lt;plan-id&gt; &lt;task-id&gt;
 */
@Command(name = "skip", mixinStandardHelpOptions = true, description = "Skip a failed task")
@Component
public class SkipCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan ID")
    private String planId;

    @Parameters(index = "1", description = "Task ID")
    private String taskId;

    private final RetryController retryController;

    public SkipCommand(RetryController retryController) {
        this.retryController = retryController;
    }

    @Override
    public Integer call() {
        try {
            retryController.skipTask(planId, taskId);
            ConsoleOutput.success("Task " + taskId + " skipped");
            return 0;
        } catch (TaskOperationException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
