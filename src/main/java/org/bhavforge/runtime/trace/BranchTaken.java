package org.bhavforge.runtime.trace;

/**
 * Which way a traced step left its instruction.
 */
public enum BranchTaken {
    TRUE,
    FALSE,
    /** Control entered a subroutine; the caller's exit is chosen when the callee returns. */
    CALL
}
