package org.bhavforge.runtime.codec;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

import org.bhavforge.runtime.isa.Instruction;
import org.bhavforge.runtime.model.BehaviorGraph;

/**
 * Converts between raw instruction records and {@link BehaviorGraph}s.
 * <p>
 * Record layout ({@value #RECORD_SIZE} bytes, little-endian):
 * <pre>
 *   [0-1]  opcode (u16)
 *   [2]    true exit (u8)
 *   [3]    false exit (u8)
 *   [4-11] operand
 * </pre>
 * Pointer values are not checked here; corrupt input decodes and is reported by validation.
 * <p>
 * This class is thread-safe as it contains only static methods.
 */
public final class InstructionCodec {

    /** Size of one encoded instruction. */
    public static final int RECORD_SIZE = 12;

    private InstructionCodec() {
        // Utility class - prevent instantiation
    }

    /**
     * Decodes a raw record buffer.
     *
     * @param id            behavior id for the resulting graph
     * @param raw           concatenated instruction records
     * @param localCount    declared locals
     * @param argumentCount declared arguments
     * @return the decoded graph
     * @throws DecodeException if the buffer length is not a multiple of {@value #RECORD_SIZE}
     *                         or holds more than {@link BehaviorGraph#MAX_INSTRUCTIONS} records
     */
    public static BehaviorGraph decode(int id, byte[] raw, int localCount, int argumentCount) throws DecodeException {
        if (raw == null) {
            throw new DecodeException("Behavior buffer is null");
        }
        if (raw.length % RECORD_SIZE != 0) {
            throw new DecodeException(String.format(
                    "Behavior 0x%04X: buffer length %d is not a multiple of %d", id, raw.length, RECORD_SIZE));
        }
        int count = raw.length / RECORD_SIZE;
        if (count > BehaviorGraph.MAX_INSTRUCTIONS) {
            throw new DecodeException(String.format("Behavior 0x%04X: %d instructions exceed the limit of %d",
                    id, count, BehaviorGraph.MAX_INSTRUCTIONS));
        }

        ByteBuffer buffer = ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
        List<Instruction> instructions = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int opcode = Short.toUnsignedInt(buffer.getShort());
            int trueExit = Byte.toUnsignedInt(buffer.get());
            int falseExit = Byte.toUnsignedInt(buffer.get());
            byte[] operand = new byte[Instruction.OPERAND_SIZE];
            buffer.get(operand);
            instructions.add(new Instruction(i, opcode, trueExit, falseExit, operand));
        }
        try {
            return new BehaviorGraph(id, localCount, argumentCount, instructions);
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Behavior " + id + ": " + e.getMessage(), e);
        }
    }

    /**
     * Encodes a graph back to raw records. Inverse of {@link #decode}.
     *
     * @param graph the graph
     * @return {@code graph.size() * 12} bytes
     */
    public static byte[] encode(BehaviorGraph graph) {
        return encode(graph.instructions());
    }

    /**
     * Encodes an instruction list in order, ignoring the stored positions.
     *
     * @param instructions the instructions
     * @return the raw records
     */
    public static byte[] encode(List<Instruction> instructions) {
        ByteBuffer buffer = ByteBuffer.allocate(instructions.size() * RECORD_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        for (Instruction instruction : instructions) {
            buffer.putShort((short) instruction.opcode());
            buffer.put((byte) instruction.trueExit());
            buffer.put((byte) instruction.falseExit());
            buffer.put(instruction.operand());
        }
        return buffer.array();
    }

    /**
     * Decodes a single record, e.g. one typed on the command line.
     *
     * @param position position to assign
     * @param record   exactly {@value #RECORD_SIZE} bytes
     * @return the instruction
     * @throws DecodeException if the record has the wrong length
     */
    public static Instruction decodeRecord(int position, byte[] record) throws DecodeException {
        if (record == null || record.length != RECORD_SIZE) {
            throw new DecodeException("Instruction record must be exactly " + RECORD_SIZE + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(record).order(ByteOrder.LITTLE_ENDIAN);
        int opcode = Short.toUnsignedInt(buffer.getShort());
        int trueExit = Byte.toUnsignedInt(buffer.get());
        int falseExit = Byte.toUnsignedInt(buffer.get());
        byte[] operand = new byte[Instruction.OPERAND_SIZE];
        buffer.get(operand);
        return new Instruction(position, opcode, trueExit, falseExit, operand);
    }
}
