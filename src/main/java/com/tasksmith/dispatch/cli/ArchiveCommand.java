package com.tasksmith.dispatch.cli;

import com.tasksmith.core.plan.PlanLifecycle;
import com.tasksmith.core.run.TaskOperationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: tasksmith archive &lt;plan-id&gt; [--undo]
 */
@Command(name = "archive", mixinStandardHelpOptions = true, description = "Archive a plan, or restore it with --undo")
@Component
public class ArchiveCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan ID")
    private String planId;

    @Option(names = {"--undo"}, description = "Restore an archived plan")
    private boolean undo;

    private final PlanLifecycle planLifecycle;

    public ArchiveCommand(PlanLifecycle planLifecycle) {
        this.planLifecycle = planLifecycle;
    }

    @Override
    public Integer call() {
        try {
            if (undo) {
                planLifecycle.unarchive(planId);
                ConsoleOutput.success("Plan " + planId + " restored");
            } else {
                planLifecycle.archive(planId);
                ConsoleOutput.success("Plan " + planId + " archived");
            }
            return 0;
        } catch (TaskOperationException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
