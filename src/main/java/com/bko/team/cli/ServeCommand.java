package com.bko.team.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: agent-team serve
 * <p>
 * Starts the HTTP API instead of solving a task from the command line. The web server is
 * enabled by {@link com.bko.team.AgentTeamApplication#main} when "serve" is the first
 * argument, and {@link CliRunner} then leaves picocli out.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the agent-team HTTP API")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Not called in serve mode, CliRunner skips picocli. Kept for subcommand registration and --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Agent team API running on port " + port);
        System.out.println();
        System.out.println("  Tasks:   http://localhost:" + port + "/api/tasks");
        System.out.println("  Models:  http://localhost:" + port + "/api/models");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
