package com.tasksmith.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasksmith.core.model.Plan;
import com.tasksmith.core.model.Task;
import com.tasksmith.core.plan.PlanDraft;
import com.tasksmith.core.plan.PlanImporter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: tasksmith import &lt;plan.json&gt;
 */
@Command(name = "import", mixinStandardHelpOptions = true, description = "Import a plan from a JSON file")
@Component
public class ImportCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan JSON file")
    private Path file;

    @Option(names = {"--project", "-p"}, description = "Project directory (overrides projectPath in the file)")
    private Path project;

    private final PlanImporter planImporter;
    private final ObjectMapper objectMapper;

    public ImportCommand(PlanImporter planImporter, ObjectMapper objectMapper) {
        this.planImporter = planImporter;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        PlanDraft draft;
        try {
            draft = objectMapper.readValue(file.toFile(), PlanDraft.class);
        } catch (IOException e) {
            ConsoleOutput.error("Could not read " + file + ": " + e.getMessage());
            return 1;
        }
        if (project != null) {
            draft = new PlanDraft(project.toAbsolutePath().toString(), draft.summary(), draft.tasks());
        }

        Plan plan;
        try {
            plan = planImporter.importPlan(draft);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        ConsoleOutput.success("Imported plan " + plan.id() + " with " + plan.tasks().size() + " task(s)");
        for (Task task : plan.tasks()) {
            ConsoleOutput.task(task);
        }
        return 0;
    }
}
