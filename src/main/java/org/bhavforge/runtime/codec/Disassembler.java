package org.bhavforge.runtime.codec;

import org.bhavforge.runtime.isa.ExitPointer;
import org.bhavforge.runtime.isa.IOpcodeCatalog;
import org.bhavforge.runtime.isa.Instruction;
import org.bhavforge.runtime.isa.OpcodeInfo;
import org.bhavforge.runtime.model.BehaviorGraph;

/**
 * Renders behavior graphs as a human-readable listing.
 * <p>
 * Example line: {@code "  0: [0x0002] Expression                     T->1     F->FALSE  (0000000000000706)"}
 */
public final class Disassembler {

    private final IOpcodeCatalog catalog;

    public Disassembler(IOpcodeCatalog catalog) {
        this.catalog = catalog;
    }

    public String disassemble(BehaviorGraph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("; behavior 0x%04X (%s) - %d instructions, %d locals, %d args%n",
                graph.id(), graph.scope(), graph.size(), graph.localCount(), graph.argumentCount()));
        for (Instruction instruction : graph.instructions()) {
            sb.append(formatLine(instruction)).append(System.lineSeparator());
        }
        return sb.toString();
    }

    /**
     * Formats one instruction.
     *
     * @param instruction the instruction
     * @return a single line without terminator
     */
    public String formatLine(Instruction instruction) {
        OpcodeInfo info = catalog.lookup(instruction.opcode());
        return String.format("%3d: [0x%04X] %-30s T->%-6s F->%-6s (%s)",
                instruction.position(),
                instruction.opcode(),
                info.name(),
                ExitPointer.describe(instruction.trueExit()),
                ExitPointer.describe(instruction.falseExit()),
                instruction.operandHex());
    }
}
