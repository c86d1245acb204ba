package org.bhavforge.analysis.validation;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.bhavforge.analysis.diagnostics.Diagnostic;
import org.bhavforge.analysis.diagnostics.DiagnosticCategory;
import org.bhavforge.analysis.diagnostics.Severity;

/**
 * Merged findings of all checks for one behavior, ordered by position then severity.
 *
 * @param graphId     validated behavior
 * @param diagnostics all findings
 */
public record ValidationReport(int graphId, List<Diagnostic> diagnostics) {

    public ValidationReport {
        diagnostics = diagnostics.stream()
                .sorted(Comparator.comparingInt(Diagnostic::position)
                        .thenComparing(Diagnostic::severity, Comparator.reverseOrder()))
                .toList();
    }

    /**
     * A behavior is valid when no check reported an error; warnings are allowed.
     *
     * @return true if there is no ERROR diagnostic
     */
    public boolean isValid() {
        return diagnostics.stream().noneMatch(Diagnostic::isError);
    }

    public List<Diagnostic> errors() {
        return withSeverity(Severity.ERROR);
    }

    public List<Diagnostic> warnings() {
        return withSeverity(Severity.WARNING);
    }

    public List<Diagnostic> withSeverity(Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).toList();
    }

    public List<Diagnostic> inCategory(DiagnosticCategory category) {
        return diagnostics.stream().filter(d -> d.category() == category).toList();
    }

    /**
     * Counts findings per report section; every section is present.
     *
     * @return counts keyed by group
     */
    public Map<DiagnosticCategory.Group, Integer> summary() {
        Map<DiagnosticCategory.Group, Integer> counts = new EnumMap<>(DiagnosticCategory.Group.class);
        for (DiagnosticCategory.Group group : DiagnosticCategory.Group.values()) {
            counts.put(group, 0);
        }
        for (Diagnostic diagnostic : diagnostics) {
            counts.merge(diagnostic.category().group(), 1, Integer::sum);
        }
        return counts;
    }

    public String formatText() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Validation of behavior 0x%04X: %s (%d error(s), %d warning(s))%n",
                graphId, isValid() ? "VALID" : "INVALID", errors().size(), warnings().size()));
        summary().forEach((group, count) -> {
            if (count > 0) {
                sb.append(String.format("  %-12s %d%n", group, count));
            }
        });
        for (Diagnostic diagnostic : diagnostics) {
            sb.append("  ").append(diagnostic.format()).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
