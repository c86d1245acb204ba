package org.bhavforge.runtime.isa;

/**
 * A variable reference encoded in an operand block.
 *
 * @param label       short name for reports, e.g. {@code "lhs"}
 * @param dataOffset  offset of the little-endian 16-bit variable index
 * @param scopeOffset offset of the scope byte
 * @param access      how the instruction uses the variable
 * @param flagOffset  offset of the flag byte consulted by {@link VariableAccess#READ_IF_FLAG}
 * @param flagMask    bits of the flag byte that select a read
 */
public record VariableSlot(String label, int dataOffset, int scopeOffset, VariableAccess access,
                           int flagOffset, int flagMask) {

    public VariableSlot {
        if (dataOffset < 0 || dataOffset > Instruction.OPERAND_SIZE - 2) {
            throw new IllegalArgumentException("Data offset out of operand range: " + dataOffset);
        }
        if (scopeOffset < 0 || scopeOffset >= Instruction.OPERAND_SIZE) {
            throw new IllegalArgumentException("Scope offset out of operand range: " + scopeOffset);
        }
        if (flagOffset < 0 || flagOffset >= Instruction.OPERAND_SIZE) {
            throw new IllegalArgumentException("Flag offset out of operand range: " + flagOffset);
        }
    }

    public VariableScope scope(Instruction instruction) {
        return VariableScope.fromCode(instruction.operandByte(scopeOffset));
    }

    public int index(Instruction instruction) {
        return instruction.operandU16(dataOffset);
    }

    /**
     * Resolves the effective access for a concrete instruction.
     *
     * @param instruction the instruction holding this slot
     * @return {@link VariableAccess#READ} or {@link VariableAccess#WRITE}
     */
    public VariableAccess effectiveAccess(Instruction instruction) {
        if (access != VariableAccess.READ_IF_FLAG) {
            return access;
        }
        return (instruction.operandByte(flagOffset) & flagMask) != 0 ? VariableAccess.READ : VariableAccess.WRITE;
    }
}
