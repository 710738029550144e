package com.tasksmith.dispatch.cli;

import com.tasksmith.core.model.Plan;
import com.tasksmith.core.model.TaskStatus;
import com.tasksmith.core.persistence.PlanFilter;
import com.tasksmith.core.persistence.PlanStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: tasksmith list [--archived | --all] [--search text]
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List plans, newest first")
@Component
public class ListCommand implements Callable<Integer> {

    @Option(names = {"--archived"}, description = "Show archived plans instead of active ones")
    private boolean archived;

    @Option(names = {"--all"}, description = "Show active and archived plans")
    private boolean all;

    @Option(names = {"--search"}, description = "Only plans whose summary or project path contains this text")
    private String search;

    private final PlanStore store;

    public ListCommand(PlanStore store) {
        this.store = store;
    }

    @Override
    public Integer call() {
        List<Plan> plans = store.listPlans(new PlanFilter(all ? null : archived, search));
        if (plans.isEmpty()) {
            ConsoleOutput.info("No plans found");
            return 0;
        }
        for (Plan plan : plans) {
            long done = plan.tasks().stream().filter(t -> t.status() == TaskStatus.COMPLETED).count();
            String label = plan.summary() == null || plan.summary().isBlank() ? plan.projectPath() : plan.summary();
            System.out.printf("%s  %-9s %d/%d  %s%s%n", plan.id(), plan.status().value(), done,
                    plan.tasks().size(), label, plan.archived() ? "  (archived)" : "");
        }
        return 0;
    }
}
