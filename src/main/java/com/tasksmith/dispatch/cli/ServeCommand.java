package com.tasksmith.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: tasksmith serve
 * <p>
 * Starts Tasksmith as a long-running HTTP server exposing the REST API and SSE event
 * streaming. The web server is enabled by {@link com.tasksmith.TasksmithApplication#main}
 * detecting "serve" in args; {@link CliRunner} then skips picocli. The banner is printed
 * once the embedded server is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Tasksmith HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through picocli (e.g. help output); serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Tasksmith server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        System.out.println("  Health:     http://localhost:" + port + "/actuator/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
