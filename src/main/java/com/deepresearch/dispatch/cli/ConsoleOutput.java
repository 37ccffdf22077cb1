package com.deepresearch.dispatch.cli;

import com.deepresearch.core.events.ProgressEvent;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) DEEP RESEARCH v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [RESEARCH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void progress(ProgressEvent event) {
        String prefix = switch (event.stage()) {
            case CLARIFYING -> "@|fg(cyan) [CLARIFY]|@";
            case BACKGROUND_INVESTIGATING -> "@|fg(magenta) [BACKGROUND]|@";
            case PLANNING, AWAITING_PLAN_APPROVAL -> "@|bold,fg(yellow) [PLAN]|@";
            case EXECUTING_STEP -> "@|fg(blue) [STEP " + stepLabel(event) + "]|@";
            case REPORTING -> "@|fg(cyan) [REPORT]|@";
            case DONE -> "@|fg(green),bold [DONE]|@";
            case FAILED -> "@|fg(red),bold [FAILED]|@";
            case CANCELLED -> "@|fg(red) [CANCELLED]|@";
            case NEEDS_CLARIFICATION -> "@|fg(yellow) [QUESTION]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + event.message()));
    }

    private static String stepLabel(ProgressEvent event) {
        if (event.currentStepIndex() == null) {
            return "?";
        }
        int number = event.currentStepIndex() + 1;
        return event.totalSteps() != null ? number + "/" + event.totalSteps() : String.valueOf(number);
    }
}
