package com.bko.team.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final TeamCommand teamCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TeamCommand teamCommand, IFactory factory) {
        this.teamCommand = teamCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // In serve mode the embedded web server keeps the JVM alive; picocli is not involved.
        if (isServeMode(args)) {
            return;
        }
        exitCode = new CommandLine(teamCommand, factory).execute(args);
    }

    /**
     * True when {@code serve} is the subcommand, i.e. the first argument. An option value that
     * happens to read "serve" does not count.
     */
    public static boolean isServeMode(String... args) {
        return args.length > 0 && "serve".equals(args[0]);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
