package com.tasksmith.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Tasksmith.
 */
@Command(
        name = "tasksmith",
        mixinStandardHelpOptions = true,
        version = "Tasksmith 0.1.0",
        description = "Runs dependent plan tasks in parallel git worktrees",
        subcommands = {
                ImportCommand.class,
                ListCommand.class,
                QueueCommand.class,
                StatusCommand.class,
                RetryCommand.class,
                SkipCommand.class,
                ArchiveCommand.class,
                DeleteCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TasksmithCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
