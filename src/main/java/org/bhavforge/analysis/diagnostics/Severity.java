package org.bhavforge.analysis.diagnostics;

/**
 * Severity of a {@link Diagnostic}, in ascending order.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
