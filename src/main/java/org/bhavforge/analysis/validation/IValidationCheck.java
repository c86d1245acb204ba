package org.bhavforge.analysis.validation;

import java.util.List;

import org.bhavforge.analysis.diagnostics.Diagnostic;
import org.bhavforge.runtime.model.BehaviorGraph;

/**
 * One independent structural check. Checks do not see each other's findings.
 */
public interface IValidationCheck {

    /**
     * Short identifier used for registration and in logs, e.g. {@code "stack"}.
     *
     * @return the check name
     */
    String name();

    /**
     * Inspects a behavior and appends findings.
     *
     * @param graph       the behavior
     * @param context     catalog and options
     * @param diagnostics sink for findings
     */
    void check(BehaviorGraph graph, ValidationContext context, List<Diagnostic> diagnostics);
}
