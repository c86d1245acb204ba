package org.bhavforge.runtime.isa;

import java.util.OptionalInt;

/**
 * Describes where a call instruction finds the id of the behavior it calls.
 *
 * @param kind          the kind of control transfer
 * @param source        whether the target id is the opcode itself or an operand field
 * @param operandOffset offset of the little-endian 16-bit target field, used with {@link TargetSource#OPERAND_U16}
 */
public record CallSpec(CallKind kind, TargetSource source, int operandOffset) {

    /**
     * Location of the callee id.
     */
    public enum TargetSource {
        /** The opcode value is the callee id. */
        OPCODE,
        /** The callee id is an unsigned 16-bit operand field. */
        OPERAND_U16
    }

    public CallSpec {
        if (kind == null || source == null) {
            throw new IllegalArgumentException("Call kind and target source are required");
        }
        if (source == TargetSource.OPERAND_U16 && (operandOffset < 0 || operandOffset > Instruction.OPERAND_SIZE - 2)) {
            throw new IllegalArgumentException("Operand offset must be between 0 and "
                    + (Instruction.OPERAND_SIZE - 2) + ", got: " + operandOffset);
        }
    }

    /**
     * Spec for a call whose target is the opcode itself.
     *
     * @param kind the kind of control transfer
     * @return the call spec
     */
    public static CallSpec byOpcode(CallKind kind) {
        return new CallSpec(kind, TargetSource.OPCODE, 0);
    }

    /**
     * Spec for a call whose target is stored in the operand.
     *
     * @param kind the kind of control transfer
     * @param offset offset of the 16-bit target field
     * @return the call spec
     */
    public static CallSpec byOperand(CallKind kind, int offset) {
        return new CallSpec(kind, TargetSource.OPERAND_U16, offset);
    }

    /**
     * Extracts the callee id from an instruction.
     * <p>
     * A zero operand target means "no target" and yields an empty result.
     *
     * @param instruction the call instruction
     * @return the callee id, or empty if the instruction carries none
     */
    public OptionalInt resolveTarget(Instruction instruction) {
        if (source == TargetSource.OPCODE) {
            return OptionalInt.of(instruction.opcode());
        }
        int target = instruction.operandU16(operandOffset);
        return target == 0 ? OptionalInt.empty() : OptionalInt.of(target);
    }
}
