package org.bhavforge.runtime.isa;

/**
 * Source of per-opcode metadata.
 * <p>
 * Implementations must be thread-safe; analyses share one catalog across threads.
 */
public interface IOpcodeCatalog {

    /**
     * Looks up metadata for an opcode.
     *
     * @param opcode the opcode (0-65535)
     * @return the metadata, never {@code null}; unknown opcodes yield {@link OpcodeInfo#unknown(int)}
     */
    OpcodeInfo lookup(int opcode);

    /**
     * Convenience check for call opcodes.
     *
     * @param opcode the opcode
     * @return true if the opcode transfers control to another behavior
     */
    default boolean isCallOpcode(int opcode) {
        return lookup(opcode).isCallOpcode();
    }
}
