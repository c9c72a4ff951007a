package com.templateformatter.util;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.templateformatter.api.error.FormatterError;
import com.templateformatter.api.error.Severity;

/**
 * Renders diagnostics for the terminal, one line each.
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
     * @param useColors whether to use ANSI colors in the output
     */
    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Formats one diagnostic as {@code SEVERITY line:column message [rule]}.
     */
    public String formatError(FormatterError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case INFO -> colorize(ANSI_BLUE, "INFO");
        };

        sb.append(severityStr).append(' ');
        sb.append(error.getLine()).append(':').append(error.getColumn()).append(' ');
        sb.append(error.getMessage());

        if (error.getRuleName() != null) {
            sb.append(' ').append(colorize(ANSI_BLUE, "[" + error.getRuleName() + "]"));
        }

        return sb.toString();
    }

    /**
     * Creates a summary of diagnostics per file.
     */
    public String formatErrorSummary(Map<Path, List<FormatterError>> fileErrors) {
        StringBuilder sb = new StringBuilder();

        sb.append(colorize(ANSI_BOLD, "Summary:\n"));

        long totalFatals = 0;
        long totalErrors = 0;
        long totalWarnings = 0;
        long totalInfos = 0;

        for (Map.Entry<Path, List<FormatterError>> entry : fileErrors.entrySet()) {
            List<FormatterError> errors = entry.getValue();
            if (errors.isEmpty()) {
                continue;
            }

            Map<Severity, Long> counts = errors.stream()
                    .collect(Collectors.groupingBy(FormatterError::getSeverity, Collectors.counting()));
            totalFatals += counts.getOrDefault(Severity.FATAL, 0L);
            totalErrors += counts.getOrDefault(Severity.ERROR, 0L);
            totalWarnings += counts.getOrDefault(Severity.WARNING, 0L);
            totalInfos += counts.getOrDefault(Severity.INFO, 0L);

            sb.append(entry.getKey()).append(": ")
                    .append(_counts(counts.getOrDefault(Severity.FATAL, 0L), counts.getOrDefault(Severity.ERROR, 0L),
                            counts.getOrDefault(Severity.WARNING, 0L), counts.getOrDefault(Severity.INFO, 0L)))
                    .append('\n');
        }

        sb.append("\nTotal: ").append(_counts(totalFatals, totalErrors, totalWarnings, totalInfos));
        return sb.toString();
    }

    /**
     * Groups errors by severity.
     */
    public Map<Severity, List<FormatterError>> groupBySeverity(List<FormatterError> errors) {
        return errors.stream().collect(Collectors.groupingBy(FormatterError::getSeverity));
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

    private String _counts(long fatals, long errors, long warnings, long infos) {
        StringBuilder sb = new StringBuilder();
        _appendCount(sb, ANSI_RED, fatals, "fatal");
        _appendCount(sb, ANSI_RED, errors, "errors");
        _appendCount(sb, ANSI_YELLOW, warnings, "warnings");
        _appendCount(sb, ANSI_BLUE, infos, "info");
        return sb.length() == 0 ? "no problems" : sb.toString();
    }

    private void _appendCount(StringBuilder sb, String color, long count, String label) {
        if (count == 0) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(", ");
        }
        sb.append(colorize(color, count + " " + label));
    }
}
