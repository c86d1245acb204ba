package org.bhavforge.runtime.isa;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * A single fixed-width behavior instruction.
 *
 * <p>Every instruction names the primitive to run ({@code opcode}), the successor taken when
 * the primitive reports true, the successor taken when it reports false, and an 8-byte
 * operand block whose meaning depends on the opcode. Successors are either instruction
 * indices or one of the {@link ExitPointer} sentinels.
 *
 * <p>Instances are immutable. The operand block is copied on construction and on access;
 * use {@link #operandByte(int)} or {@link #operandU16(int)} for allocation-free reads.
 */
public final class Instruction {

    /** Size of the operand block in bytes. */
    public static final int OPERAND_SIZE = 8;

    /** Largest valid opcode (unsigned 16 bit). */
    public static final int MAX_OPCODE = 0xFFFF;

    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    private final int position;
    private final int opcode;
    private final int trueExit;
    private final int falseExit;
    private final byte[] operand;

    /**
     * Creates an instruction.
     *
     * @param position the index of the instruction in its graph
     * @param opcode the primitive or subroutine id (0-65535)
     * @param trueExit the successor on a true outcome (0-255)
     * @param falseExit the successor on a false outcome (0-255)
     * @param operand exactly {@value #OPERAND_SIZE} operand bytes
     * @throws IllegalArgumentException if any value is out of range
     */
    public Instruction(int position, int opcode, int trueExit, int falseExit, byte[] operand) {
        if (position < 0) {
            throw new IllegalArgumentException("Position must be non-negative, got: " + position);
        }
        if (opcode < 0 || opcode > MAX_OPCODE) {
            throw new IllegalArgumentException("Opcode must be between 0 and " + MAX_OPCODE + ", got: " + opcode);
        }
        if (!ExitPointer.isEncodable(trueExit)) {
            throw new IllegalArgumentException("True exit must fit in one byte, got: " + trueExit);
        }
        if (!ExitPointer.isEncodable(falseExit)) {
            throw new IllegalArgumentException("False exit must fit in one byte, got: " + falseExit);
        }
        if (operand == null || operand.length != OPERAND_SIZE) {
            throw new IllegalArgumentException("Operand must be exactly " + OPERAND_SIZE + " bytes");
        }
        this.position = position;
        this.opcode = opcode;
        this.trueExit = trueExit;
        this.falseExit = falseExit;
        this.operand = operand.clone();
    }

    /**
     * Creates an instruction with an all-zero operand.
     *
     * @param position the index of the instruction in its graph
     * @param opcode the primitive or subroutine id
     * @param trueExit the successor on a true outcome
     * @param falseExit the successor on a false outcome
     * @return the new instruction
     */
    public static Instruction of(int position, int opcode, int trueExit, int falseExit) {
        return new Instruction(position, opcode, trueExit, falseExit, new byte[OPERAND_SIZE]);
    }

    public int position() {
        return position;
    }

    public int opcode() {
        return opcode;
    }

    public int trueExit() {
        return trueExit;
    }

    public int falseExit() {
        return falseExit;
    }

    /**
     * Returns a copy of the operand block.
     *
     * @return a fresh 8-byte array
     */
    public byte[] operand() {
        return operand.clone();
    }

    /**
     * Reads one unsigned operand byte.
     *
     * @param offset the byte offset (0-7)
     * @return the unsigned value
     */
    public int operandByte(int offset) {
        return operand[offset] & 0xFF;
    }

    /**
     * Reads an unsigned little-endian 16-bit value from the operand block.
     *
     * @param offset the offset of the low byte (0-6)
     * @return the unsigned value
     */
    public int operandU16(int offset) {
        return (operand[offset] & 0xFF) | ((operand[offset + 1] & 0xFF) << 8);
    }

    /**
     * Returns the successor for the given branch outcome.
     *
     * @param outcome true for the true exit, false for the false exit
     * @return the selected pointer
     */
    public int exit(boolean outcome) {
        return outcome ? trueExit : falseExit;
    }

    public Instruction withPosition(int newPosition) {
        if (newPosition == position) {
            return this;
        }
        return new Instruction(newPosition, opcode, trueExit, falseExit, operand);
    }

    public Instruction withExits(int newTrueExit, int newFalseExit) {
        if (newTrueExit == trueExit && newFalseExit == falseExit) {
            return this;
        }
        return new Instruction(position, opcode, newTrueExit, newFalseExit, operand);
    }

    public Instruction withOpcode(int newOpcode) {
        return new Instruction(position, newOpcode, trueExit, falseExit, operand);
    }

    /**
     * Returns the operand block as upper-case hex, e.g. {@code "0100000000000000"}.
     *
     * @return 16 hex digits
     */
    public String operandHex() {
        return HEX.formatHex(operand);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Instruction other)) {
            return false;
        }
        return position == other.position
                && opcode == other.opcode
                && trueExit == other.trueExit
                && falseExit == other.falseExit
                && Arrays.equals(operand, other.operand);
    }

    @Override
    public int hashCode() {
        int result = position;
        result = 31 * result + opcode;
        result = 31 * result + trueExit;
        result = 31 * result + falseExit;
        result = 31 * result + Arrays.hashCode(operand);
        return result;
    }

    @Override
    public String toString() {
        return String.format("Instruction[%d: op=0x%04X T=%s F=%s operand=%s]",
                position, opcode, ExitPointer.describe(trueExit), ExitPointer.describe(falseExit), operandHex());
    }
}
