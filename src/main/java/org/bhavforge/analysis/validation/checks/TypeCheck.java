package org.bhavforge.analysis.validation.checks;

import java.util.List;

import org.bhavforge.analysis.diagnostics.Diagnostic;
import org.bhavforge.analysis.diagnostics.DiagnosticCategory;
import org.bhavforge.analysis.validation.IValidationCheck;
import org.bhavforge.analysis.validation.ValidationContext;
import org.bhavforge.runtime.isa.Instruction;
import org.bhavforge.runtime.isa.OpcodeInfo;
import org.bhavforge.runtime.isa.OperandSchema;
import org.bhavforge.runtime.model.BehaviorGraph;

/**
 * Flags opcodes the catalog does not know and operands that do not fit the declared schema.
 */
public class TypeCheck implements IValidationCheck {

    @Override
    public String name() {
        return "type";
    }

    @Override
    public void check(BehaviorGraph graph, ValidationContext context, List<Diagnostic> diagnostics) {
        for (Instruction instruction : graph.instructions()) {
            OpcodeInfo info = context.catalog().lookup(instruction.opcode());
            if (!info.known()) {
                diagnostics.add(Diagnostic.error(DiagnosticCategory.TYPE_MISMATCH, instruction.position(),
                        String.format("Unknown opcode 0x%04X", instruction.opcode()))
                        .withSuggestion("check the opcode table or the behavior id being called"));
                continue;
            }
            OperandSchema schema = info.operandSchema();
            if (schema == null) {
                continue;
            }
            List<Integer> unexpected = schema.unexpectedBytes(instruction);
            if (!unexpected.isEmpty()) {
                diagnostics.add(Diagnostic.warning(DiagnosticCategory.INVALID_OPERAND, instruction.position(),
                        String.format("%s uses %d operand byte(s) but bytes %s are set (operand %s)",
                                info.name(), schema.usedBytes(), unexpected, instruction.operandHex())));
            }
        }
    }
}
