package org.bhavforge.analysis.validation.checks;

import java.util.List;

import org.bhavforge.analysis.diagnostics.Diagnostic;
import org.bhavforge.analysis.diagnostics.DiagnosticCategory;
import org.bhavforge.analysis.validation.IValidationCheck;
import org.bhavforge.analysis.validation.ValidationContext;
import org.bhavforge.runtime.isa.ExitPointer;
import org.bhavforge.runtime.isa.Instruction;
import org.bhavforge.runtime.model.BehaviorGraph;

/**
 * Reports exits that address no instruction, and behaviors that can never return.
 */
public class ControlFlowCheck implements IValidationCheck {

    @Override
    public String name() {
        return "control-flow";
    }

    @Override
    public void check(BehaviorGraph graph, ValidationContext context, List<Diagnostic> diagnostics) {
        if (graph.isEmpty()) {
            diagnostics.add(Diagnostic.warning(DiagnosticCategory.MISSING_RETURN, Diagnostic.GRAPH_LEVEL,
                    "Behavior has no instructions"));
            return;
        }
        boolean returns = false;
        for (Instruction instruction : graph.instructions()) {
            checkExit(graph, instruction, "true", instruction.trueExit(), diagnostics);
            checkExit(graph, instruction, "false", instruction.falseExit(), diagnostics);
            returns |= isReturn(instruction.trueExit()) || isReturn(instruction.falseExit());
        }
        if (!returns) {
            diagnostics.add(Diagnostic.warning(DiagnosticCategory.MISSING_RETURN, Diagnostic.GRAPH_LEVEL,
                    "No instruction exits with TRUE or FALSE"));
        }
    }

    private static void checkExit(BehaviorGraph graph, Instruction instruction, String branch, int pointer,
                                  List<Diagnostic> diagnostics) {
        if (!ExitPointer.isSentinel(pointer) && !graph.isValidTarget(pointer)) {
            diagnostics.add(Diagnostic.error(DiagnosticCategory.INVALID_BRANCH_TARGET, instruction.position(),
                    String.format("%s exit %d is out of range (behavior has %d instructions)",
                            branch, pointer, graph.size())));
        }
    }

    private static boolean isReturn(int pointer) {
        return pointer == ExitPointer.RETURN_TRUE || pointer == ExitPointer.RETURN_FALSE;
    }
}
