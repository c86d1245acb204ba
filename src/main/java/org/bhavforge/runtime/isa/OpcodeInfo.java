package org.bhavforge.runtime.isa;

/**
 * Static metadata about one opcode.
 *
 * @param opcode        the opcode value
 * @param name          display name
 * @param category      coarse grouping
 * @param stackDelta    net change of the abstract stack depth when the instruction runs
 * @param operandSchema declared operand layout, or {@code null} if unknown
 * @param conditional   whether the primitive can report both true and false
 * @param callSpec      call description, or {@code null} if the opcode does not call another behavior
 * @param known         false for opcodes the catalog has no entry for
 */
public record OpcodeInfo(int opcode, String name, OpcodeCategory category, int stackDelta,
                         OperandSchema operandSchema, boolean conditional, CallSpec callSpec, boolean known) {

    /**
     * Creates the placeholder returned for opcodes missing from a catalog.
     * <p>
     * Unknown opcodes are treated as conditional so that analyses explore both exits.
     *
     * @param opcode the unknown opcode
     * @return a first-class unknown entry
     */
    public static OpcodeInfo unknown(int opcode) {
        return new OpcodeInfo(opcode, String.format("Unknown Primitive 0x%04X", opcode),
                OpcodeCategory.UNKNOWN, 0, null, true, null, false);
    }

    public boolean isCallOpcode() {
        return callSpec != null;
    }

    /**
     * Whether the tracer and validator must assume either exit may be taken.
     *
     * @return true for conditional or unknown opcodes
     */
    public boolean mayBranch() {
        return conditional || !known;
    }
}
