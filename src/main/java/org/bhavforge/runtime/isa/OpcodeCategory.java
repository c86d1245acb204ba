package org.bhavforge.runtime.isa;

/**
 * Coarse grouping of primitives used in listings and reports.
 */
public enum OpcodeCategory {
    VARIABLE,
    MATH,
    OBJECT,
    ANIMATION,
    NAVIGATION,
    INTERACTION,
    STRING,
    DIALOG,
    SYSTEM,
    CONTROL,
    RELATIONSHIP,
    MISC,
    /** Calls into another behavior graph. */
    SUBROUTINE,
    /** Opcode not present in the catalog. */
    UNKNOWN
}
