package com.tandem.dispatch.cli;

import com.tandem.core.enforcer.ComplianceResult;
import com.tandem.core.engine.ExecutionReport;
import com.tandem.core.events.TandemEvent;
import com.tandem.core.model.TaskStatus;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Tandem CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(ansi("@|bold,fg(yellow) TANDEM v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(ansi("@|fg(cyan) [TANDEM]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(ansi("@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(ansi("@|fg(red) x|@ " + message));
    }

    public static void wave(int waveNumber, Iterable<String> taskIds) {
        System.out.println(ansi("@|bold,fg(yellow) [WAVE " + waveNumber + "]|@ " + String.join(", ", taskIds)));
    }

    public static void task(String taskId, String workerType, String description) {
        System.out.println(ansi("  @|fg(blue) " + taskId + "|@ (" + workerType + ")"
                + (description.isBlank() ? "" : " " + description)));
    }

    public static void taskResult(String taskId, TaskStatus status) {
        String color = status == TaskStatus.COMPLETED ? "fg(green)" : "fg(red)";
        System.out.println(ansi("  @|" + color + " " + status + "|@ " + taskId));
    }

    public static void compliance(ComplianceResult result) {
        String mark = result.compliant() ? "@|fg(green) ok|@" : "@|fg(red) VIOLATION|@";
        System.out.println(ansi("  @|fg(yellow) [WAVE " + result.waveNumber() + "]|@ " + mark
                + " spread " + result.spread().toMillis() + "ms / " + result.window().toMillis() + "ms"));
    }

    /**
     * One live line per session event, printed while the run is in progress.
     */
    public static void event(TandemEvent event) {
        Map<String, Object> p = event.payload();
        String line = switch (event.eventType()) {
            case "task.spawned" -> "@|fg(blue) [TASK]|@ " + event.taskId() + " spawned as " + p.get("agentTaskId");
            case "task.completed" -> "@|fg(green) [TASK]|@ " + event.taskId() + " completed";
            case "task.failed" -> "@|fg(red) [TASK]|@ " + event.taskId() + " failed"
                    + (p.containsKey("failedDependency") ? " (dependency " + p.get("failedDependency") + " failed)" : "");
            case "wave.advanced" -> "@|bold,fg(yellow) [WAVE]|@ Wave " + p.get("completedWave")
                    + " complete, spawn spread " + p.get("spreadMs") + "ms";
            case "wave.violation" -> "@|fg(red),bold [VIOLATION]|@ Wave " + p.get("wave") + " spawn spread "
                    + p.get("spreadMs") + "ms exceeds " + p.get("windowMs") + "ms";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(ansi(line));
    }

    public static void report(ExecutionReport report) {
        System.out.println("──────────────────────────────────");
        System.out.println(ansi("@|bold Session " + report.sessionId() + "|@ " + report.outcome()));
        report.taskStatuses().forEach(ConsoleOutput::taskResult);
        report.compliance().forEach(ConsoleOutput::compliance);
        System.out.println(ansi("  Tasks: @|fg(green) " + report.count(TaskStatus.COMPLETED) + " completed|@, @|fg(red) "
                + report.count(TaskStatus.FAILED) + " failed|@"));
        System.out.println("  Waves: " + report.wavesExecuted());
        System.out.println("  Duration: " + formatDuration(report.elapsed().toMillis()));
        if (report.haltReason() != null) {
            error(report.haltReason());
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private static String ansi(String markup) {
        return CommandLine.Help.Ansi.AUTO.string(markup);
    }
}
