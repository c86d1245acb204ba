package org.bhavforge.analysis.validation.checks;

import java.util.List;

import org.bhavforge.analysis.diagnostics.Diagnostic;
import org.bhavforge.analysis.diagnostics.DiagnosticCategory;
import org.bhavforge.analysis.validation.IValidationCheck;
import org.bhavforge.analysis.validation.ValidationContext;
import org.bhavforge.runtime.isa.Instruction;
import org.bhavforge.runtime.model.BehaviorGraph;

/**
 * Simulates the declared stack deltas in instruction order.
 * <p>
 * A negative depth is an underflow error and resets the depth to zero. Crossing the configured
 * threshold is a warning, reported once per crossing. A non-zero depth after the last
 * instruction is a warning.
 */
public class StackBalanceCheck implements IValidationCheck {

    @Override
    public String name() {
        return "stack";
    }

    @Override
    public void check(BehaviorGraph graph, ValidationContext context, List<Diagnostic> diagnostics) {
        if (graph.isEmpty()) {
            return;
        }
        int threshold = context.options().stackDepthWarningThreshold();
        int depth = 0;
        boolean aboveThreshold = false;
        for (Instruction instruction : graph.instructions()) {
            int delta = context.catalog().lookup(instruction.opcode()).stackDelta();
            depth += delta;
            if (depth < 0) {
                diagnostics.add(Diagnostic.error(DiagnosticCategory.STACK_UNDERFLOW, instruction.position(),
                        "Stack underflow: depth " + depth + " after delta " + delta));
                depth = 0;
            }
            if (depth > threshold && !aboveThreshold) {
                diagnostics.add(Diagnostic.warning(DiagnosticCategory.STACK_OVERFLOW, instruction.position(),
                        "Stack depth " + depth + " exceeds " + threshold));
            }
            aboveThreshold = depth > threshold;
        }
        if (depth != 0) {
            diagnostics.add(Diagnostic.warning(DiagnosticCategory.STACK_OVERFLOW, graph.size() - 1,
                    "Unbalanced stack: depth " + depth + " after the last instruction"));
        }
    }
}
