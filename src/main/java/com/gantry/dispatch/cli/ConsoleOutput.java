package com.gantry.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Gantry CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) GANTRY v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [GANTRY]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void verdict(String decision, String detail) {
        String color = switch (decision) {
            case "DONE" -> "fg(green)";
            case "RETRY" -> "fg(yellow)";
            default -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + ",bold [" + decision + "]|@ " + detail));
    }
}
