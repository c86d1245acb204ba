package org.bhavforge.analysis.validation.checks;

import java.util.List;

import org.bhavforge.analysis.diagnostics.Diagnostic;
import org.bhavforge.analysis.diagnostics.DiagnosticCategory;
import org.bhavforge.analysis.validation.IValidationCheck;
import org.bhavforge.analysis.validation.ValidationContext;
import org.bhavforge.runtime.isa.ExitPointer;
import org.bhavforge.runtime.isa.Instruction;
import org.bhavforge.runtime.isa.OpcodeInfo;
import org.bhavforge.runtime.model.BehaviorGraph;

/**
 * Flags conditional instructions whose two exits are identical, so the condition has no effect.
 */
public class LogicCheck implements IValidationCheck {

    @Override
    public String name() {
        return "logic";
    }

    @Override
    public void check(BehaviorGraph graph, ValidationContext context, List<Diagnostic> diagnostics) {
        for (Instruction instruction : graph.instructions()) {
            OpcodeInfo info = context.catalog().lookup(instruction.opcode());
            if (info.known() && info.conditional() && instruction.trueExit() == instruction.falseExit()) {
                diagnostics.add(Diagnostic.warning(DiagnosticCategory.LOGIC_ERROR, instruction.position(),
                        String.format("%s branches to %s on both outcomes", info.name(),
                                ExitPointer.describe(instruction.trueExit()))));
            }
        }
    }
}
