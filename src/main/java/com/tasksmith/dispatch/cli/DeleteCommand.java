package com.tasksmith.dispatch.cli;

import com.tasksmith.core.plan.PlanLifecycle;
import com.tasksmith.core.run.TaskOperationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: tasksmith delete &lt;plan-id&gt;
 */
@Command(name = "delete", mixinStandardHelpOptions = true,
        description = "Delete a plan with its tasks, runs and history")
@Component
public class DeleteCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan ID")
    private String planId;

    private final PlanLifecycle planLifecycle;

    public DeleteCommand(PlanLifecycle planLifecycle) {
        this.planLifecycle = planLifecycle;
    }

    @Override
    public Integer call() {
        try {
            planLifecycle.delete(planId);
            ConsoleOutput.success("Plan " + planId + " deleted");
            return 0;
        } catch (TaskOperationException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
