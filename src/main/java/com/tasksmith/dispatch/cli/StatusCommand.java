package com.tasksmith.dispatch.cli;

import com.tasksmith.core.model.Plan;
import com.tasksmith.core.model.PlanProgressEntry;
import com.tasksmith.core.model.PlanStatus;
import com.tasksmith.core.model.Task;
import com.tasksmith.core.persistence.PlanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: tasksmith status &lt;plan-id&gt;
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show plan and task status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan ID")
    private String planId;

    @Option(names = {"--progress"}, description = "Number of progress entries to show (default: ${DEFAULT-VALUE})",
            defaultValue = "3")
    private int progress;

    private final PlanStore store;

    public StatusCommand(PlanStore store) {
        this.store = store;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Optional<Plan> found = store.findPlan(planId);
        if (found.isEmpty()) {
            ConsoleOutput.error("Plan not found: " + planId);
            return 1;
        }
        Plan plan = found.get();

        System.out.println();
        System.out.println("PLAN " + plan.id());
        if (plan.summary() != null && !plan.summary().isBlank()) {
            System.out.println("Summary: " + plan.summary());
        }
        System.out.println("Project: " + plan.projectPath());
        if (plan.archived()) {
            System.out.println("Archived: " + plan.archivedAt());
        }
        if (plan.status() == PlanStatus.COMPLETED) {
            ConsoleOutput.success("Status: " + plan.status().value());
        } else if (plan.status() == PlanStatus.FAILED) {
            ConsoleOutput.error("Status: " + plan.status().value());
        } else {
            ConsoleOutput.info("Status: " + plan.status().value());
        }

        System.out.println();
        for (Task task : plan.tasks()) {
            ConsoleOutput.task(task);
        }

        if (progress > 0) {
            List<PlanProgressEntry> entries = store.listProgressEntries(planId, PlanStore.clampProgressLimit(progress));
            if (!entries.isEmpty()) {
                System.out.println();
                System.out.println("Recent progress:");
                for (PlanProgressEntry entry : entries) {
                    String firstLine = entry.entryText().lines().findFirst().orElse("");
                    System.out.println("  [" + entry.status().value() + "] " + firstLine);
                }
            }
        }
        return 0;
    }
}
