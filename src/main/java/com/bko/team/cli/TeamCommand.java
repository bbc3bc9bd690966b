package com.bko.team.cli;

import com.bko.team.bus.MessageBus;
import com.bko.team.bus.MessageFilter;
import com.bko.team.bus.TeamMessage;
import com.bko.team.orchestration.OrchestratorService;
import com.bko.team.orchestration.model.TaskOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Top-level CLI command: solves one task, or reads tasks from standard input in interactive mode.
 */
@Command(
        name = "agent-team",
        mixinStandardHelpOptions = true,
        version = "Agent Team 0.1.0",
        description = "A coordinator and two specialised developer agents solving software tasks",
        subcommands = {
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
@Slf4j
public class TeamCommand implements Callable<Integer> {

    static final String APPLICATION_LOGGER = "com.bko.team";
    private static final Set<String> EXIT_WORDS = Set.of("exit", "quit");

    @Option(names = {"--task", "-t"}, description = "Task to submit to the team")
    private String task;

    @Option(names = {"--interactive", "-i"}, description = "Read tasks from standard input until 'exit' or 'quit'")
    private boolean interactive;

    @Option(names = {"--output", "-o"}, description = "File the final solution is written to")
    private Path output;

    @Option(names = {"--verbose", "-v"}, description = "Log application messages at DEBUG level")
    private boolean verbose;

    @Option(names = "--timeout", description = "Time budget per task, in seconds (default: configured task timeout)")
    private Long timeoutSeconds;

    private final OrchestratorService orchestratorService;
    private final MessageBus messageBus;
    private final LoggingSystem loggingSystem;
    private InputStream input = System.in;

    public TeamCommand(OrchestratorService orchestratorService, MessageBus messageBus, LoggingSystem loggingSystem) {
        this.orchestratorService = orchestratorService;
        this.messageBus = messageBus;
        this.loggingSystem = loggingSystem;
    }

    void setInput(InputStream input) {
        this.input = input;
    }

    @Override
    public Integer call() throws IOException {
        if (verbose) {
            loggingSystem.setLogLevel(APPLICATION_LOGGER, LogLevel.DEBUG);
        }
        ConsoleOutput.printBanner();
        if (interactive) {
            runInteractive();
            return 0;
        }
        if (StringUtils.hasText(task)) {
            TaskOutcome outcome = solve(task);
            writeOutput(outcome.text());
            return 0;
        }
        ConsoleOutput.error("No task given. Use --task or --interactive.");
        return 1;
    }

    private void runInteractive() throws IOException {
        ConsoleOutput.info("Interactive mode. Type 'exit' or 'quit' to leave.");
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        while (true) {
            System.out.println();
            System.out.print("Task> ");
            System.out.flush();
            String line = reader.readLine();
            if (line == null || EXIT_WORDS.contains(line.trim().toLowerCase(Locale.ROOT))) {
                break;
            }
            if (line.isBlank()) {
                continue;
            }
            TaskOutcome outcome = solve(line.trim());
            writeOutput(outcome.text());
        }
    }

    private TaskOutcome solve(String description) {
        ConsoleOutput.info("Working on the task...");
        Duration timeout = timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null;
        MessageBus.Subscription subscription = messageBus.subscribe(MessageFilter.any(), TeamCommand::showProgress);
        TaskOutcome outcome;
        try {
            outcome = orchestratorService.solve(description, timeout);
        } finally {
            subscription.unsubscribe();
        }
        if (outcome.succeeded()) {
            ConsoleOutput.success("Task " + outcome.taskId() + " solved in " + outcome.duration().toSeconds() + " s");
        } else {
            ConsoleOutput.error("Task " + outcome.taskId() + " failed: " + outcome.error());
        }
        ConsoleOutput.result(outcome.text());
        return outcome;
    }

    private static void showProgress(TeamMessage message) {
        switch (message.messageType()) {
            case ASSIGNMENT -> ConsoleOutput.agent(message.recipientRole() != null ? message.recipientRole() : "worker",
                    "sub-task " + subtaskNumber(message) + " assigned");
            case SOLUTION -> ConsoleOutput.agent(message.senderRole(), "sub-task " + subtaskNumber(message) + " solved");
            case REVIEW -> ConsoleOutput.agent(message.senderRole(), "sub-task " + subtaskNumber(message) + " reviewed ("
                    + (Boolean.TRUE.equals(message.metadata().get("approved")) ? "approved" : "rejected") + ")");
            default -> {
            }
        }
    }

    private static String subtaskNumber(TeamMessage message) {
        Object index = message.metadata().get("subtaskIndex");
        return index instanceof Integer value ? String.valueOf(value + 1) : "?";
    }

    private void writeOutput(String text) {
        if (output == null) {
            return;
        }
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, text, StandardCharsets.UTF_8);
            ConsoleOutput.info("Result saved to " + output);
        } catch (IOException ex) {
            log.error("Failed to write result to {}", output, ex);
            ConsoleOutput.error("Could not save the result to " + output + ": " + ex.getMessage());
        }
    }
}
