package com.vyperformatter.util;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.vyperformatter.api.error.FormatterError;
import com.vyperformatter.api.error.Severity;

/**
 * Renders diagnostics for the console, optionally with ANSI colors.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Formats one diagnostic as {@code file:line:column: SEVERITY: message}.
     */
    public String formatError(Path file, FormatterError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case INFO -> colorize(ANSI_BLUE, "INFO");
        };

        if (file != null) {
            sb.append(file).append(':');
        }
        sb.append(error.getLine()).append(':').append(error.getColumn()).append(": ");
        sb.append(severityStr).append(": ");
        sb.append(error.getMessage());

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * One line per file with blocking diagnostics, then the totals.
     */
    public String formatErrorSummary(Map<Path, List<FormatterError>> fileErrors) {
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_BOLD, "Error Summary:")).append('\n');

        long totalFatals = 0;
        long totalErrors = 0;
        long totalWarnings = 0;

        for (Map.Entry<Path, List<FormatterError>> entry : fileErrors.entrySet()) {
            List<FormatterError> errors = entry.getValue();
            long fatals = _count(errors, Severity.FATAL);
            long errs = _count(errors, Severity.ERROR);
            long warnings = _count(errors, Severity.WARNING);

            totalFatals += fatals;
            totalErrors += errs;
            totalWarnings += warnings;

            if (fatals + errs > 0) {
                sb.append(entry.getKey()).append(": ")
                        .append(_counts(fatals, errs, warnings)).append('\n');
            }
        }

        sb.append("Total: ").append(_counts(totalFatals, totalErrors, totalWarnings));
        return sb.toString();
    }

    private String _counts(long fatals, long errors, long warnings) {
        StringBuilder sb = new StringBuilder();
        if (fatals > 0) {
            sb.append(colorize(ANSI_RED, fatals + " fatal"));
        }
        if (errors > 0) {
            sb.append(sb.length() > 0 ? ", " : "").append(colorize(ANSI_RED, errors + " errors"));
        }
        if (warnings > 0) {
            sb.append(sb.length() > 0 ? ", " : "").append(colorize(ANSI_YELLOW, warnings + " warnings"));
        }
        return sb.length() == 0 ? "no issues" : sb.toString();
    }

    private static long _count(List<FormatterError> errors, Severity severity) {
        return errors.stream().filter(e -> e.getSeverity() == severity).count();
    }

    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }
}
