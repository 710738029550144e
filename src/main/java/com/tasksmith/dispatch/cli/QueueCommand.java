package com.tasksmith.dispatch.cli;

import com.tasksmith.core.events.EventBus;
import com.tasksmith.core.queue.QueueOrchestrator;
import com.tasksmith.core.queue.QueueOutcome;
import com.tasksmith.core.queue.QueueStartResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: tasksmith queue &lt;plan-id&gt;
 * <p>
 * Runs the plan's queue in the foreground, streaming its events. Exits 0 when every task
 * completed, 1 otherwise.
 */
@Command(name = "queue", mixinStandardHelpOptions = true, description = "Run every runnable task of a plan")
@Component
public class QueueCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan ID")
    private String planId;

    private final QueueOrchestrator queueOrchestrator;
    private final EventBus eventBus;

    public QueueCommand(QueueOrchestrator queueOrchestrator, EventBus eventBus) {
        this.queueOrchestrator = queueOrchestrator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        EventBus.Subscription subscription = eventBus.subscribe(planId, ConsoleOutput::event);
        try {
            QueueStartResult start = queueOrchestrator.runAll(planId);
            if (!start.started()) {
                ConsoleOutput.error(start.reason());
                return 1;
            }
            ConsoleOutput.info(start.queued() + " runnable task(s) queued");

            QueueOutcome outcome = start.completion().join();
            if (outcome.isCompleted()) {
                ConsoleOutput.success(outcome.reason());
                return 0;
            }
            ConsoleOutput.error(outcome.status().name() + ": " + outcome.reason());
            return 1;
        } finally {
            subscription.unsubscribe();
        }
    }
}
