package com.hivemind.dispatch.cli;

import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for Hivemind CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) HIVEMIND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [HIVEMIND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void caveat(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) !|@ " + message));
    }

    /** Streams assistant text without a line break. */
    public static void agentText(String text) {
        System.out.print(text);
        System.out.flush();
    }

    public static void task(Task task, int depth) {
        String indent = "  ".repeat(depth);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                indent + status(task.status()) + " " + task.id() +
                " @|fg(blue) [" + task.agentId() + "]|@ " + task.objective()));
        String detail = task.status() == TaskStatus.SUCCEEDED ? task.result() : task.error();
        if (detail != null && !detail.isBlank() && !task.isRoot()) {
            System.out.println(indent + "    " + firstLine(detail));
        }
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "task.created", "task.started" -> "@|fg(blue) [TASK]|@";
            case "task.succeeded" -> "@|fg(green) [TASK]|@";
            case "task.failed" -> "@|fg(red) [TASK]|@";
            case "task.cancelled" -> "@|fg(yellow) [TASK]|@";
            case "run.started", "run.completed" -> "@|fg(cyan) [RUN]|@";
            case "run.retrying" -> "@|fg(yellow) [RETRY]|@";
            case "run.failed" -> "@|fg(red) [RUN]|@";
            case "run.cancelled" -> "@|fg(yellow) [RUN]|@";
            case "tool.invoked" -> "@|fg(magenta) [TOOL]|@";
            case "orchestration.completed" -> "@|fg(green),bold [COMPLETE]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String status(TaskStatus status) {
        return switch (status) {
            case SUCCEEDED -> "@|fg(green) SUCCEEDED|@";
            case FAILED -> "@|fg(red) FAILED|@";
            case CANCELLED -> "@|fg(yellow) CANCELLED|@";
            case RUNNING -> "@|fg(cyan) RUNNING|@";
            case PENDING -> "@|fg(white) PENDING|@";
        };
    }

    private static String firstLine(String text) {
        String stripped = text.strip();
        int nl = stripped.indexOf('\n');
        String line = nl < 0 ? stripped : stripped.substring(0, nl) + " ...";
        return line.length() > 120 ? line.substring(0, 117) + "..." : line;
    }
}
