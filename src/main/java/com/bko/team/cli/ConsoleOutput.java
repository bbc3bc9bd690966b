package com.bko.team.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the agent-team CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AGENT TEAM v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TEAM]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void agent(String role, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [" + role.toUpperCase() + "]|@ " + message));
    }

    public static void result(String text) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold === RESULT ===|@"));
        System.out.println();
        for (String line : text.split("\n", -1)) {
            System.out.println(line);
        }
    }
}
