package com.tasksmith.dispatch.cli;

import com.tasksmith.core.events.EventBus;
import com.tasksmith.core.model.RunStatus;
import com.tasksmith.core.run.RetryController;
import com.tasksmith.core.run.StartedRun;
import com.tasksmith.core.run.TaskOperationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: tasksmith retry &lt;plan-id&gt; &lt;task-id&gt;
 * <p>
 * Retries a failed task in the project directory and waits for the run to finish.
 */
@Command(name = "retry", mixinStandardHelpOptions = true, description = "Retry a failed task")
@Component
public class RetryCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan ID")
    private String planId;

    @Parameters(index = "1", description = "Task ID")
    private String taskId;

    private final RetryController retryController;
    private final EventBus eventBus;

    public RetryCommand(RetryController retryController, EventBus eventBus) {
        this.retryController = retryController;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        EventBus.Subscription subscription = eventBus.subscribe(planId, ConsoleOutput::event);
        try {
            StartedRun run = retryController.retryTask(planId, taskId);
            ConsoleOutput.info("Run " + run.runId() + " started");
            RunStatus status = run.completion().join();
            if (status == RunStatus.COMPLETED) {
                ConsoleOutput.success("Task " + taskId + " completed");
                return 0;
            }
            ConsoleOutput.error("Task " + taskId + " ended as " + status.value());
            return 1;
        } catch (TaskOperationException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } finally {
            subscription.unsubscribe();
        }
    }
}
