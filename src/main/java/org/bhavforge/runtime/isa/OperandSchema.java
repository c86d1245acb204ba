package org.bhavforge.runtime.isa;

import java.util.ArrayList;
import java.util.List;

/**
 * Declared operand layout of a primitive.
 *
 * @param name      schema name, e.g. {@code "expression"}
 * @param usedBytes number of leading operand bytes the primitive reads; the rest should be zero
 * @param slots     variable references encoded in the operand
 */
public record OperandSchema(String name, int usedBytes, List<VariableSlot> slots) {

    public OperandSchema {
        if (usedBytes < 0 || usedBytes > Instruction.OPERAND_SIZE) {
            throw new IllegalArgumentException("Used bytes must be between 0 and "
                    + Instruction.OPERAND_SIZE + ", got: " + usedBytes);
        }
        slots = List.copyOf(slots);
    }

    /**
     * Returns the offsets of non-zero bytes past {@link #usedBytes()}.
     *
     * @param instruction the instruction to inspect
     * @return offsets in ascending order, empty if the operand fits the schema
     */
    public List<Integer> unexpectedBytes(Instruction instruction) {
        List<Integer> offsets = new ArrayList<>();
        for (int i = usedBytes; i < Instruction.OPERAND_SIZE; i++) {
            if (instruction.operandByte(i) != 0) {
                offsets.add(i);
            }
        }
        return offsets;
    }
}
