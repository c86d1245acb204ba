package org.bhavforge.runtime.isa;

/**
 * How an instruction uses a variable slot.
 */
public enum VariableAccess {
    READ,
    WRITE,
    /** Read when the slot's flag bits are set, written otherwise (e.g. compare vs. assign). */
    READ_IF_FLAG
}
