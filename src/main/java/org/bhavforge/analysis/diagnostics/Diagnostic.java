package org.bhavforge.analysis.diagnostics;

import java.util.Objects;

/**
 * A single finding of the validator, analyzer or rewiring engine.
 *
 * @param category   what kind of problem was found
 * @param severity   how serious it is
 * @param position   instruction index, or {@link #GRAPH_LEVEL} for findings about the whole graph
 * @param message    human-readable description
 * @param suggestion optional hint for fixing the problem, may be empty
 */
public record Diagnostic(DiagnosticCategory category, Severity severity, int position, String message,
                         String suggestion) {

    /** Position used for findings not tied to one instruction. */
    public static final int GRAPH_LEVEL = -1;

    public Diagnostic {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        suggestion = suggestion == null ? "" : suggestion;
    }

    public static Diagnostic error(DiagnosticCategory category, int position, String message) {
        return new Diagnostic(category, Severity.ERROR, position, message, "");
    }

    public static Diagnostic warning(DiagnosticCategory category, int position, String message) {
        return new Diagnostic(category, Severity.WARNING, position, message, "");
    }

    public static Diagnostic info(DiagnosticCategory category, int position, String message) {
        return new Diagnostic(category, Severity.INFO, position, message, "");
    }

    public Diagnostic withSuggestion(String hint) {
        return new Diagnostic(category, severity, position, message, hint);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public boolean isGraphLevel() {
        return position == GRAPH_LEVEL;
    }

    /**
     * One-line rendering, e.g. {@code "[ERROR] #3 INVALID_BRANCH_TARGET: true exit 40 is out of range"}.
     *
     * @return the formatted line
     */
    public String format() {
        String where = isGraphLevel() ? "graph" : "#" + position;
        String line = "[" + severity + "] " + where + " " + category + ": " + message;
        return suggestion.isEmpty() ? line : line + " (" + suggestion + ")";
    }
}
