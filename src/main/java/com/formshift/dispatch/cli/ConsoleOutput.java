package com.formshift.dispatch.cli;

import com.formshift.core.events.ConversionEvent;
import com.formshift.core.model.ConversionOutcome;
import com.formshift.core.model.ConversionStatistics;
import com.formshift.core.transaction.RollbackReport;
import picocli.CommandLine;

import java.time.Duration;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the formshift CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FORMSHIFT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FORMSHIFT]|@ " + message));
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

    /** One line per phase change or per-form event of a running conversion. */
    public static void event(ConversionEvent event) {
        Map<String, Object> payload = event.payload();
        String line = switch (event.eventType()) {
            case ConversionEvent.PHASE_CHANGED -> "@|fg(blue) [" + payload.get("phase") + "]|@";
            case ConversionEvent.FORM_CONVERTED -> "  @|fg(green) CONVERTED|@  " + event.form() + " -> "
                    + payload.get("layout") + " (" + payload.get("confidence") + "%), "
                    + payload.get("files") + " file(s)";
            case ConversionEvent.FORM_FAILED -> "  @|fg(red) FAILED|@     " + event.form() + ": " + payload.get("reason");
            case ConversionEvent.FORM_SKIPPED -> "  @|fg(white) " + skippedLabel(payload.get("status")) + "|@ "
                    + event.form();
            default -> null;
        };
        if (line != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
        }
    }

    private static String skippedLabel(Object status) {
        return "RESUMED".equals(status) ? "RESUMED   " : "UP-TO-DATE";
    }

    public static void outcome(ConversionOutcome outcome, String message) {
        switch (outcome) {
            case SUCCESS -> success(message);
            case PARTIAL_SUCCESS, CANCELLED -> warn(message);
            case FAILED -> error(message);
        }
    }

    public static void rollback(RollbackReport report) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [ROLLBACK]|@ " + report.deleted().size() + " removed, "
                + report.restored().size() + " restored"));
        for (String failure : report.failures()) {
            error("  " + failure);
        }
    }

    public static void statistics(ConversionStatistics s, Duration elapsed) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Conversion Statistics|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Forms: @|fg(green) " + s.getConvertedForms() + " converted|@, @|fg(red) "
                + s.getFailedForms() + " failed|@, " + s.getUpToDateForms() + " up to date"
                + " (of " + s.getTotalForms() + ")"));
        System.out.println("  Controls: " + s.getConvertedControls() + " converted, "
                + s.getPlaceholderControls() + " placeholders");
        System.out.println("  Properties: " + s.getMappedProperties() + "/" + s.getTotalProperties() + " mapped");
        System.out.println("  Events: " + s.getTotalEvents() + " (" + s.getConvertedToCommands() + " to commands)");
        System.out.println("  Files: " + s.getFilesGenerated() + " generated");
        System.out.println("  Duration: " + formatDuration(elapsed.toMillis()));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
