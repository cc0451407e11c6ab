package com.indentlint.util;

import com.indentlint.api.error.LintError;
import com.indentlint.api.error.Severity;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders diagnostics for the terminal, optionally with ANSI colors.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    /**
     * @param useColors whether to use colors in the output
     */
    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Formats a diagnostic with its severity, rule and position.
     */
    public String formatError(LintError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case INFO -> colorize(ANSI_BLUE, "INFO");
        };

        sb.append(severityStr).append(": ");
        if (error.getRuleName() != null) {
            sb.append('[').append(error.getRuleName()).append("] ");
        }
        sb.append(error.getMessage());
        sb.append(" (Line ").append(error.getLine())
                .append(", Col ").append(error.getColumn()).append(")");

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Fix: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Compiler-style single line, {@code path:line:col: [Rule] message}, used in CI mode.
     */
    public String formatLocation(Path file, LintError error) {
        StringBuilder sb = new StringBuilder();
        sb.append(file).append(':').append(error.getLine()).append(':').append(error.getColumn()).append(": ");
        if (error.getRuleName() != null) {
            sb.append('[').append(error.getRuleName()).append("] ");
        }
        sb.append(error.getMessage());
        return sb.toString();
    }

    /**
     * Creates a summary of diagnostics per file.
     */
    public String formatErrorSummary(Map<Path, List<LintError>> fileErrors) {
        StringBuilder sb = new StringBuilder();

        sb.append(colorize(ANSI_BOLD, "Summary:\n"));

        int totalFatals = 0;
        int totalErrors = 0;
        int totalWarnings = 0;

        for (Map.Entry<Path, List<LintError>> entry : fileErrors.entrySet()) {
            List<LintError> errors = entry.getValue();
            if (errors.isEmpty()) {
                continue;
            }

            Map<Severity, List<LintError>> bySeverity = groupBySeverity(errors);
            int fatals = bySeverity.getOrDefault(Severity.FATAL, List.of()).size();
            int errs = bySeverity.getOrDefault(Severity.ERROR, List.of()).size();
            int warnings = bySeverity.getOrDefault(Severity.WARNING, List.of()).size();

            totalFatals += fatals;
            totalErrors += errs;
            totalWarnings += warnings;

            sb.append(entry.getKey().getFileName()).append(": ");
            sb.append(_joinCounts(fatals, errs, warnings));
            sb.append("\n");
        }

        sb.append("\nTotal: ").append(_joinCounts(totalFatals, totalErrors, totalWarnings));
        return sb.toString();
    }

    private String _joinCounts(int fatals, int errors, int warnings) {
        StringBuilder sb = new StringBuilder();
        if (fatals > 0) {
            sb.append(colorize(ANSI_RED, fatals + " fatal")).append(", ");
        }
        if (errors > 0) {
            sb.append(colorize(ANSI_RED, errors + " errors")).append(", ");
        }
        if (warnings > 0) {
            sb.append(colorize(ANSI_YELLOW, warnings + " violations")).append(", ");
        }
        if (sb.length() == 0) {
            return "clean";
        }
        return sb.substring(0, sb.length() - 2);
    }

    public Map<Severity, List<LintError>> groupBySeverity(List<LintError> errors) {
        return errors.stream().collect(Collectors.groupingBy(LintError::getSeverity));
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }
}
