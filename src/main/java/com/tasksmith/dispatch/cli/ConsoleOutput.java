package com.tasksmith.dispatch.cli;

import com.tasksmith.core.events.EventLevel;
import com.tasksmith.core.events.RunEvent;
import com.tasksmith.core.model.Task;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Tasksmith CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKSMITH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TASKSMITH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void task(Task task) {
        String color = switch (task.status()) {
            case COMPLETED -> "fg(green)";
            case FAILED -> "fg(red)";
            case IN_PROGRESS -> "fg(blue)";
            case SKIPPED -> "fg(magenta)";
            case PENDING -> "fg(white)";
        };
        String deps = task.dependencies().isEmpty() ? "" : " (after " + String.join(", ", task.dependencies()) + ")";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + String.format("%-12s", task.status().value()) + "|@ "
                        + task.id() + ": " + task.title() + deps));
    }

    public static void event(RunEvent event) {
        String prefix = switch (event.type()) {
            case QUEUE_STARTED, QUEUE_FINISHED -> "@|bold,fg(yellow) [QUEUE]|@";
            case PHASE_STARTED, PHASE_COMPLETED -> "@|bold,fg(yellow) [PHASE]|@";
            case TASK_MERGED -> "@|fg(green) [MERGE]|@";
            case STARTED, COMPLETED, CANCELLED, TASK_STATUS -> "@|fg(blue) [TASK " + event.taskId() + "]|@";
            case FAILED -> "@|fg(red),bold [TASK " + event.taskId() + "]|@";
            case INFO -> "@|fg(magenta) [INFO]|@";
            case LOG, TODO_UPDATE -> null;
        };
        if (prefix == null) {
            return;
        }
        String message = event.message() != null ? event.message() : event.type().value();
        if (event.level() == EventLevel.ERROR) {
            message = "@|fg(red) " + message + "|@";
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + message));
    }
}
